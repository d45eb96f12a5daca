package com.example.rangedownloader.core;

import com.example.rangedownloader.config.EngineProperties;
import com.example.rangedownloader.error.DownloadException;
import lombok.Data;
import org.apache.http.impl.client.CloseableHttpClient;

import java.nio.channels.FileChannel;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 同一代工作线程共享的对象，启动时一次性交给每个 {@link ChunkWorker}
 */
@Data
public class WorkerBatch {
    private final String taskId;
    private final String url;
    private final int generation;
    private final ChunkPartitioner partitioner;
    private final ChunkQueue queue;
    private final RetryTracker retries;
    private final ChunkLedger ledger;
    private final DownloadControl control;
    private final FileChannel channel;
    private final CloseableHttpClient client;
    private final EngineProperties properties;

    // 任一线程写文件失败后记录在这里，同代其他线程随即退出
    private final AtomicReference<DownloadException> failure = new AtomicReference<>();

    public void abort(DownloadException e) {
        failure.compareAndSet(null, e);
    }

    public boolean isAborted() {
        return failure.get() != null;
    }
}
