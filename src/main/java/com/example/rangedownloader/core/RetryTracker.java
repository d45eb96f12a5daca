package com.example.rangedownloader.core;

import java.util.HashMap;
import java.util.Map;

/**
 * 记录每个分片的尝试次数，没有上限
 */
public class RetryTracker {

    private final Map<Integer, Integer> attempts = new HashMap<>();

    /**
     * 尝试次数加一并返回新值（第一次尝试返回1）
     */
    public synchronized int incrementAndGet(int index) {
        return attempts.merge(index, 1, Integer::sum);
    }

    public synchronized int get(int index) {
        return attempts.getOrDefault(index, 0);
    }
}
