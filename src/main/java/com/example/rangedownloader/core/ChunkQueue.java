package com.example.rangedownloader.core;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;

/**
 * 待下载分片队列
 * <p>
 * 所有工作线程共享。队列为空并不代表下载完成，其他线程可能正在重试中，
 * 失败的分片会被放回队尾。
 * </p>
 */
public class ChunkQueue {

    private final Deque<Integer> pending = new ArrayDeque<>();

    public synchronized void seed(Collection<Integer> indices) {
        pending.clear();
        pending.addAll(indices);
    }

    /**
     * 取出下一个分片序号，队列暂时为空时返回 null
     */
    public synchronized Integer poll() {
        return pending.pollFirst();
    }

    public synchronized void requeue(int index) {
        pending.addLast(index);
    }

    public synchronized int size() {
        return pending.size();
    }
}
