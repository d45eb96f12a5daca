package com.example.rangedownloader.core;

import com.example.rangedownloader.model.ChunkDescriptor;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 一代(generation)工作线程的完成记录
 * <p>
 * 每次启动或恢复都会新建一个账本，只交给该代的工作线程持有，
 * 旧代线程即使还在运行也只能修改自己的账本，不会影响当前计数。
 * 同一分片只会被计入一次。
 * </p>
 */
public class ChunkLedger {

    private final int generation;
    private final Set<Integer> completed = ConcurrentHashMap.newKeySet();
    private final AtomicLong downloadedBytes;
    private final AtomicInteger completedCount;

    public ChunkLedger(int generation, Collection<Integer> alreadyCompleted, long alreadyDownloaded) {
        this.generation = generation;
        this.completed.addAll(alreadyCompleted);
        this.downloadedBytes = new AtomicLong(alreadyDownloaded);
        this.completedCount = new AtomicInteger(completed.size());
    }

    /**
     * 标记分片完成
     *
     * @return 首次标记返回 true；重复标记返回 false 且不改变计数
     */
    public boolean markCompleted(ChunkDescriptor chunk) {
        if (!completed.add(chunk.getIndex())) {
            return false;
        }
        downloadedBytes.addAndGet(chunk.getExpectedSize());
        completedCount.incrementAndGet();
        return true;
    }

    public int getGeneration() {
        return generation;
    }

    public long getDownloadedBytes() {
        return downloadedBytes.get();
    }

    public int getCompletedCount() {
        return completedCount.get();
    }

    public boolean isCompleted(int index) {
        return completed.contains(index);
    }

    public Set<Integer> completedSnapshot() {
        return new TreeSet<>(completed);
    }
}
