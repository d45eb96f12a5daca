package com.example.rangedownloader.core;

import com.example.rangedownloader.config.EngineProperties;
import com.example.rangedownloader.error.DownloadException;
import com.example.rangedownloader.model.ControlSignal;
import com.example.rangedownloader.model.DownloadMetadata;
import com.example.rangedownloader.model.DownloadProgress;
import com.example.rangedownloader.model.DownloadResult;
import com.example.rangedownloader.model.DownloadState;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.impl.client.CloseableHttpClient;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 下载任务上下文
 * <p>
 * 负责单个文件的状态流转、工作线程的启动与等待、进度监控、断点状态保存和最终校验。
 * 控制命令（暂停/停止/恢复/取消）和运行收尾都在本对象的锁内执行，彼此串行；
 * 工作线程的热路径不经过这把锁。
 * </p>
 */
@Slf4j
public class DownloadTaskContext {

    private final DownloadMetadata metadata;
    private final ChunkPartitioner partitioner;
    private final DownloadControl control = new DownloadControl();
    private final StatePersistence persistence;
    private final HttpClientFactory httpClientFactory;
    private final EngineProperties properties;
    private final Executor executor;
    private final DownloadListener listener;

    private volatile ChunkLedger ledger;
    private volatile long speed;
    private CompletableFuture<DownloadResult> currentRun;

    public DownloadTaskContext(DownloadMetadata metadata, StatePersistence persistence,
                               HttpClientFactory httpClientFactory, EngineProperties properties,
                               Executor executor, DownloadListener listener) {
        this.metadata = metadata;
        this.partitioner = new ChunkPartitioner(metadata.getTotalSize());
        this.persistence = persistence;
        this.httpClientFactory = httpClientFactory;
        this.properties = properties;
        this.executor = executor;
        this.listener = listener;
        this.ledger = new ChunkLedger(control.getGeneration(), metadata.getCompletedChunks(),
                metadata.getDownloadedBytes());
    }

    public String getTaskId() {
        return metadata.getId();
    }

    public synchronized DownloadState getState() {
        return metadata.getState();
    }

    public ChunkPartitioner getPartitioner() {
        return partitioner;
    }

    public DownloadControl getControl() {
        return control;
    }

    /**
     * 首次启动: PENDING -> ACTIVE
     *
     * @return 本次运行的结果
     */
    public synchronized CompletableFuture<DownloadResult> start() {
        DownloadState previous = metadata.getState();
        if (previous != DownloadState.PENDING) {
            throw DownloadException.invalidState(getTaskId(), previous, "start");
        }
        metadata.setChunkSize(partitioner.getChunkSize());
        metadata.activate();
        persistence.save(metadata);
        log.info("开始下载任务 [{}]: {} -> {}, 大小 {}, 分片 {} x {}", getTaskId(), metadata.getUrl(),
                metadata.getFilepath(), metadata.getTotalSize(), partitioner.getTotalChunks(), partitioner.getChunkSize());
        notifyState(previous);
        return launch(control.getGeneration());
    }

    /**
     * 恢复: PAUSED / STOPPED / FAILED -> ACTIVE
     * <p>
     * generation 加一，只重新下载未完成的分片
     * </p>
     */
    public synchronized CompletableFuture<DownloadResult> resume() {
        DownloadState previous = metadata.getState();
        if (!previous.canResume()) {
            throw DownloadException.invalidState(getTaskId(), previous, "resume");
        }
        persistence.verifyAgainstDisk(metadata, partitioner);

        // 上一代如果还没收尾，以暂停/停止时的状态作为它的结果
        if (currentRun != null && !currentRun.isDone()) {
            currentRun.complete(DownloadResult.of(metadata, previous, null));
        }

        int generation = control.nextGeneration();
        metadata.resume();
        persistence.save(metadata);
        log.info("恢复下载任务 [{}]: 第 {} 代, 剩余分片 {}", getTaskId(), generation,
                metadata.getIncompleteChunks().size());
        notifyState(previous);
        return launch(generation);
    }

    public synchronized void pause() {
        halt(ControlSignal.PAUSE);
    }

    public synchronized void stop() {
        halt(ControlSignal.STOP);
    }

    private void halt(ControlSignal signal) {
        DownloadState previous = metadata.getState();
        if (previous != DownloadState.ACTIVE) {
            throw DownloadException.invalidState(getTaskId(), previous, signal.name().toLowerCase());
        }
        control.signal(signal);
        syncFromLedger(ledger);
        if (signal == ControlSignal.PAUSE) {
            metadata.pause();
        } else {
            metadata.stop();
        }
        persistence.save(metadata);
        log.info("任务 [{}] 已{}，进度 {}, 已保存状态", getTaskId(), signal == ControlSignal.PAUSE ? "暂停" : "停止",
                String.format("%.2f%%", metadata.progressPercentage()));
        notifyState(previous);
    }

    /**
     * 取消并删除分片文件和状态文件
     * <p>
     * 正在下载时先通知工作线程退出，最多等待 cancelWaitMs
     * </p>
     */
    public DownloadResult cancel() {
        CompletableFuture<DownloadResult> running;
        DownloadState previous;
        synchronized (this) {
            previous = metadata.getState();
            if (!previous.canCancel()) {
                throw DownloadException.invalidState(getTaskId(), previous, "cancel");
            }
            log.warn("取消下载任务 [{}]，将删除所有临时文件", getTaskId());
            control.signal(ControlSignal.CANCEL);
            metadata.cancel();
            running = previous == DownloadState.ACTIVE ? currentRun : null;
        }

        if (running != null) {
            awaitQuietly(running, properties.getCancelWaitMs());
        }
        persistence.discard(metadata.getFilepath());
        notifyState(previous);
        return DownloadResult.of(metadata, DownloadState.CANCELLED, "已取消");
    }

    private void awaitQuietly(CompletableFuture<DownloadResult> running, long timeoutMs) {
        try {
            running.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("任务 [{}] 工作线程未在 {}ms 内退出，直接清理文件", getTaskId(), timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("任务 [{}] 等待工作线程退出时被中断", getTaskId());
        } catch (ExecutionException e) {
            log.warn("任务 [{}] 运行异常结束", getTaskId(), e.getCause());
        }
    }

    private CompletableFuture<DownloadResult> launch(int generation) {
        ChunkLedger runLedger = new ChunkLedger(generation, metadata.getCompletedChunks(),
                metadata.getDownloadedBytes());
        ChunkQueue queue = new ChunkQueue();
        queue.seed(metadata.getIncompleteChunks());
        this.ledger = runLedger;

        CompletableFuture<DownloadResult> future = new CompletableFuture<>();
        this.currentRun = future;
        executor.execute(() -> {
            DownloadResult result;
            try {
                result = run(generation, runLedger, queue);
            } catch (RuntimeException e) {
                log.error("任务 [{}] 运行失败", getTaskId(), e);
                result = failRun(generation, runLedger, e);
            }
            future.complete(result);
        });
        return future;
    }

    private DownloadResult run(int generation, ChunkLedger runLedger, ChunkQueue queue) {
        int threads = metadata.getThreadCount();
        long startTime = System.nanoTime();
        log.info("任务 [{}] 启动第 {} 代工作线程: 线程数 {}, 剩余分片 {}", getTaskId(), generation, threads, queue.size());

        ForkJoinPool pool = new ForkJoinPool(threads);
        DownloadException failure;
        try (FileChannel channel = FileChannel.open(StatePersistence.partFile(metadata.getFilepath()),
                StandardOpenOption.WRITE);
             CloseableHttpClient client = httpClientFactory.createWorkerClient(threads)) {

            WorkerBatch batch = new WorkerBatch(getTaskId(), metadata.getUrl(), generation, partitioner, queue,
                    new RetryTracker(), runLedger, control, channel, client, properties);
            List<ChunkWorker> workers = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                ChunkWorker worker = new ChunkWorker(batch, i);
                workers.add(worker);
                pool.execute(worker);
            }
            pool.shutdown();

            monitor(pool, generation, runLedger);
            for (ChunkWorker worker : workers) {
                worker.quietlyJoin();
            }
            failure = batch.getFailure().get();
            if (failure == null) {
                channel.force(false);
            }
        } catch (IOException e) {
            return failRun(generation, runLedger, DownloadException.fileSystem("写入分片文件失败", e));
        } finally {
            pool.shutdown();
        }
        if (failure != null) {
            return failRun(generation, runLedger, failure);
        }
        return finish(generation, runLedger, startTime);
    }

    /**
     * 等待工作线程结束，期间统计速度、推送进度、定期保存状态
     */
    private void monitor(ForkJoinPool pool, int generation, ChunkLedger runLedger) {
        long lastBytes = runLedger.getDownloadedBytes();
        long lastTime = System.nanoTime();
        int lastCheckpoint = runLedger.getCompletedCount();
        try {
            while (!pool.awaitTermination(properties.getMonitorIntervalMs(), TimeUnit.MILLISECONDS)) {
                long now = System.nanoTime();
                long bytes = runLedger.getDownloadedBytes();
                long elapsedMs = Math.max(1, TimeUnit.NANOSECONDS.toMillis(now - lastTime));
                speed = (bytes - lastBytes) * 1000 / elapsedMs;
                lastBytes = bytes;
                lastTime = now;

                if (control.shouldContinue(generation)) {
                    notifyProgress();
                }

                int completed = runLedger.getCompletedCount();
                if (completed - lastCheckpoint >= properties.getCheckpointChunks()
                        && checkpoint(generation, runLedger)) {
                    lastCheckpoint = completed;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("任务 [{}] 监控线程被中断，停止下载", getTaskId());
            control.signal(ControlSignal.STOP);
        } finally {
            speed = 0;
        }
    }

    private synchronized boolean checkpoint(int generation, ChunkLedger runLedger) {
        if (!control.shouldContinue(generation) || metadata.getState() != DownloadState.ACTIVE) {
            return false;
        }
        syncFromLedger(runLedger);
        try {
            persistence.save(metadata);
        } catch (DownloadException e) {
            log.warn("任务 [{}] 定期保存状态失败，继续下载", getTaskId(), e);
            return false;
        }
        return true;
    }

    /**
     * 运行收尾：按退出原因保存状态，全部完成时做完整性校验并生成最终文件
     */
    private synchronized DownloadResult finish(int generation, ChunkLedger runLedger, long startTime) {
        ControlSignal signal = control.getSignal();
        if (control.getGeneration() != generation) {
            log.info("任务 [{}] 第 {} 代已被第 {} 代取代", getTaskId(), generation, control.getGeneration());
            return DownloadResult.of(metadata, signal.toState(), null);
        }

        switch (signal) {
            case CANCEL:
                log.info("任务 [{}] 工作线程已因取消退出", getTaskId());
                return DownloadResult.of(metadata, DownloadState.CANCELLED, "已取消");
            case PAUSE:
            case STOP:
                return persistHalted(signal, runLedger);
            default:
                break;
        }

        try {
            IntegrityVerifier.verify(runLedger.getDownloadedBytes(), metadata.getTotalSize(),
                    runLedger.getCompletedCount(), partitioner.getTotalChunks());
            persistence.finish(metadata.getFilepath());
        } catch (DownloadException e) {
            return failRun(generation, runLedger, e);
        }

        syncFromLedger(runLedger);
        metadata.complete();
        double seconds = Math.max(0.001, (System.nanoTime() - startTime) / 1_000_000_000.0);
        log.info("任务 [{}] 下载完成: {}, 耗时 {}s, 平均速度 {} MB/s", getTaskId(), metadata.getFilepath(),
                String.format("%.2f", seconds),
                String.format("%.2f", metadata.getTotalSize() / 1024.0 / 1024.0 / seconds));
        notifyState(DownloadState.ACTIVE);
        return DownloadResult.of(metadata, DownloadState.COMPLETED, null);
    }

    // 工作线程退出后再同步一次，包含暂停命令之后才完成的分片
    private DownloadResult persistHalted(ControlSignal signal, ChunkLedger runLedger) {
        DownloadState previous = metadata.getState();
        syncFromLedger(runLedger);
        if (previous == DownloadState.ACTIVE) {
            // 信号不是通过 pause()/stop() 发出的（例如监控线程被中断）
            if (signal == ControlSignal.PAUSE) {
                metadata.pause();
            } else {
                metadata.stop();
            }
        }
        String detail = null;
        try {
            persistence.save(metadata);
        } catch (DownloadException e) {
            log.error("任务 [{}] 保存状态失败", getTaskId(), e);
            detail = e.getMessage();
        }
        if (previous == DownloadState.ACTIVE) {
            notifyState(previous);
        }
        log.info("任务 [{}] 工作线程已退出, 状态 {}, 完成分片 {} / {}", getTaskId(), metadata.getState(),
                metadata.getCompletedChunks().size(), partitioner.getTotalChunks());
        return DownloadResult.of(metadata, metadata.getState(), detail);
    }

    private synchronized DownloadResult failRun(int generation, ChunkLedger runLedger, RuntimeException error) {
        if (control.getGeneration() != generation) {
            return DownloadResult.of(metadata, control.getSignal().toState(), error.getMessage());
        }
        if (control.getSignal() == ControlSignal.CANCEL) {
            return DownloadResult.of(metadata, DownloadState.CANCELLED, "已取消");
        }
        DownloadState previous = metadata.getState();
        syncFromLedger(runLedger);
        if (previous == DownloadState.ACTIVE) {
            metadata.fail(error.getMessage());
        }
        try {
            persistence.save(metadata);
        } catch (DownloadException e) {
            log.error("任务 [{}] 保存失败状态时出错", getTaskId(), e);
        }
        log.error("任务 [{}] 下载失败: {}", getTaskId(), error.getMessage());
        if (previous == DownloadState.ACTIVE) {
            notifyState(previous);
        }
        return DownloadResult.of(metadata, metadata.getState(), error.getMessage());
    }

    private void syncFromLedger(ChunkLedger source) {
        Set<Integer> done = source.completedSnapshot();
        metadata.setChunkSize(partitioner.getChunkSize());
        metadata.syncChunks(done, partitioner.expectedBytes(done), partitioner.getTotalChunks());
    }

    /**
     * 当前进度快照
     */
    public synchronized DownloadProgress progress() {
        DownloadProgress progress = new DownloadProgress();
        progress.setId(metadata.getId());
        progress.setUrl(metadata.getUrl());
        progress.setFilepath(metadata.getFilepath());
        progress.setState(metadata.getState());
        progress.setTotalSize(metadata.getTotalSize());
        progress.setTotalChunks(partitioner.getTotalChunks());
        progress.setThreadCount(metadata.getThreadCount());
        progress.setErrorMessage(metadata.getErrorMessage());
        if (metadata.getState() == DownloadState.ACTIVE) {
            ChunkLedger current = ledger;
            progress.setDownloadedBytes(current.getDownloadedBytes());
            progress.setCompletedChunks(current.getCompletedCount());
            progress.setSpeed(speed);
        } else {
            progress.setDownloadedBytes(metadata.getDownloadedBytes());
            progress.setCompletedChunks(metadata.getCompletedChunks().size());
        }
        return progress;
    }

    /**
     * 元数据副本（通过状态文件序列化方式之外的只读访问）
     */
    public synchronized DownloadMetadata snapshotMetadata() {
        DownloadMetadata copy = new DownloadMetadata(metadata.getId(), metadata.getUrl(), metadata.getFilepath(),
                metadata.getTotalSize(), metadata.getThreadCount());
        copy.setCreatedTime(metadata.getCreatedTime());
        copy.setChunkSize(metadata.getChunkSize());
        copy.setState(metadata.getState());
        copy.setDownloadedBytes(metadata.getDownloadedBytes());
        copy.setCompletedChunks(metadata.getCompletedChunks());
        copy.setIncompleteChunks(metadata.getIncompleteChunks());
        copy.setPausedTime(metadata.getPausedTime());
        copy.setResumedTime(metadata.getResumedTime());
        copy.setStoppedTime(metadata.getStoppedTime());
        copy.setCompletedTime(metadata.getCompletedTime());
        copy.setErrorMessage(metadata.getErrorMessage());
        return copy;
    }

    private void notifyProgress() {
        try {
            listener.onProgress(progress());
        } catch (RuntimeException e) {
            log.warn("任务 [{}] 进度回调异常", getTaskId(), e);
        }
    }

    private void notifyState(DownloadState previous) {
        try {
            listener.onStateChanged(progress(), previous);
        } catch (RuntimeException e) {
            log.warn("任务 [{}] 状态回调异常", getTaskId(), e);
        }
    }
}
