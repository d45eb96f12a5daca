package com.example.rangedownloader.core;

import com.example.rangedownloader.model.ControlSignal;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 下载控制信号
 * <p>
 * 外部通过 signal 通知工作线程暂停/停止/取消；generation 在每次恢复时递增，
 * 工作线程每轮循环都比较自己的 generation，不一致立即退出。两者读取都无需加锁。
 * </p>
 */
public class DownloadControl {

    private final AtomicReference<ControlSignal> signal = new AtomicReference<>(ControlSignal.RUN);
    private final AtomicInteger generation = new AtomicInteger(0);

    public ControlSignal getSignal() {
        return signal.get();
    }

    public int getGeneration() {
        return generation.get();
    }

    /**
     * 指定代的工作线程是否应继续工作
     */
    public boolean shouldContinue(int workerGeneration) {
        return signal.get() == ControlSignal.RUN && generation.get() == workerGeneration;
    }

    public void signal(ControlSignal newSignal) {
        signal.set(newSignal);
    }

    /**
     * 开始新的一代：先递增 generation 使旧线程失效，再恢复 RUN 信号
     *
     * @return 新的 generation
     */
    public int nextGeneration() {
        int next = generation.incrementAndGet();
        signal.set(ControlSignal.RUN);
        return next;
    }
}
