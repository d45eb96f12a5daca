package com.example.rangedownloader.core;

import com.example.rangedownloader.config.EngineProperties;
import com.example.rangedownloader.error.DownloadException;
import com.example.rangedownloader.model.ChunkDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.NonWritableChannelException;
import java.util.concurrent.RecursiveAction;
import java.util.concurrent.TimeUnit;

/**
 * 分片下载工作器
 * <p>
 * 从共享队列中不断取分片下载，失败的分片放回队列无限重试，
 * 直到所有分片完成，或收到暂停/停止/取消信号，或所属的 generation 已过期。
 * 写文件失败不重试：记录到 {@link WorkerBatch} 后抛出，同代其他线程随即退出。
 * </p>
 */
@Slf4j
public class ChunkWorker extends RecursiveAction {

    private final WorkerBatch batch;
    private final int workerId;

    public ChunkWorker(WorkerBatch batch, int workerId) {
        this.batch = batch;
        this.workerId = workerId;
    }

    @Override
    protected void compute() {
        DownloadControl control = batch.getControl();
        ChunkLedger ledger = batch.getLedger();
        ChunkQueue queue = batch.getQueue();
        EngineProperties properties = batch.getProperties();
        int generation = batch.getGeneration();
        int totalChunks = batch.getPartitioner().getTotalChunks();

        while (true) {
            // 1. 检查信号和代数
            if (!control.shouldContinue(generation)) {
                log.debug("任务 [{}] 线程 {} 收到信号 {} (代 {} / 当前 {})，退出", batch.getTaskId(), workerId,
                        control.getSignal(), generation, control.getGeneration());
                return;
            }
            if (batch.isAborted()) {
                return;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.warn("任务 [{}] 线程 {} 被中断，退出", batch.getTaskId(), workerId);
                return;
            }

            // 2. 只有完成数达到总数才算正常结束，队列为空时其他线程可能还在重试
            if (ledger.getCompletedCount() >= totalChunks) {
                return;
            }

            // 3. 取分片
            Integer index = queue.poll();
            if (index == null) {
                sleepWhileRunning(properties.getIdleSleepMs());
                continue;
            }

            // 4. 前几次尝试限速，之后放宽，保证慢分片最终能完成
            int attempt = batch.getRetries().incrementAndGet(index);
            boolean enforceSpeed = attempt < properties.getAdaptiveRetryThreshold();
            if (attempt > 1) {
                log.warn("任务 [{}] Chunk {} 第 {} 次尝试, 限速检查: {}", batch.getTaskId(), index, attempt, enforceSpeed);
            }

            ChunkDescriptor chunk = batch.getPartitioner().chunk(index);
            boolean success;
            try {
                success = fetch(chunk, enforceSpeed);
            } catch (DownloadException e) {
                log.error("任务 [{}] Chunk {} 写入失败，终止本次下载: {}", batch.getTaskId(), index, e.getMessage());
                queue.requeue(index);
                batch.abort(e);
                throw e;
            } catch (IOException | RuntimeException e) {
                log.debug("任务 [{}] Chunk {} 下载出错: {}", batch.getTaskId(), index, e.toString());
                success = false;
            }

            if (success) {
                if (ledger.markCompleted(chunk)) {
                    log.debug("任务 [{}] Chunk {} 完成, {} / {}", batch.getTaskId(), index,
                            ledger.getCompletedCount(), totalChunks);
                }
            } else {
                queue.requeue(index);
                long backoff = Math.min(properties.getRetryBackoffMs() * attempt, properties.getMaxRetryBackoffMs());
                sleepWhileRunning(backoff);
            }
        }
    }

    /**
     * 下载一个分片并写入文件对应位置
     *
     * @return 收到的字节数与期望完全一致时返回 true
     */
    private boolean fetch(ChunkDescriptor chunk, boolean enforceSpeed) throws IOException {
        EngineProperties properties = batch.getProperties();
        HttpGet request = new HttpGet(batch.getUrl());
        request.addHeader(HttpHeaders.RANGE, chunk.rangeHeader());

        // 提前返回时关闭 response 会直接断开连接，不会把剩余内容读完
        try (CloseableHttpResponse response = batch.getClient().execute(request)) {
            int status = response.getStatusLine().getStatusCode();
            if (!acceptable(status, response, chunk)) {
                log.debug("任务 [{}] Chunk {} 状态码 {}", batch.getTaskId(), chunk.getIndex(), status);
                return false;
            }
            HttpEntity entity = response.getEntity();
            if (entity == null) {
                return false;
            }

            InputStream is = entity.getContent();
            byte[] buf = new byte[properties.getBufferSize()];
            long expected = chunk.getExpectedSize();
            long received = 0;
            long attemptStart = System.nanoTime();
            int len;
            while ((len = is.read(buf)) != -1) {
                // 数据流读取过程中也要检查信号，保证暂停/取消及时生效
                if (!running()) {
                    return false;
                }
                if (received + len > expected) {
                    log.warn("任务 [{}] Chunk {} 返回数据超出范围", batch.getTaskId(), chunk.getIndex());
                    return false;
                }
                write(buf, len, chunk.getStart() + received);
                received += len;

                if (enforceSpeed && tooSlow(received, attemptStart)) {
                    log.debug("任务 [{}] Chunk {} 速度过低，放弃本次尝试", batch.getTaskId(), chunk.getIndex());
                    return false;
                }
            }

            if (received != expected) {
                log.debug("任务 [{}] Chunk {} 数据不完整 {} / {}", batch.getTaskId(), chunk.getIndex(), received, expected);
                return false;
            }
            return true;
        }
    }

    // 206 必须带上与请求一致的 Content-Range；200 只有在分片覆盖整个文件时才可接受
    private boolean acceptable(int status, CloseableHttpResponse response, ChunkDescriptor chunk) {
        if (status == HttpStatus.SC_PARTIAL_CONTENT) {
            Header contentRange = response.getFirstHeader(HttpHeaders.CONTENT_RANGE);
            if (contentRange == null || !matchesRange(contentRange.getValue(), chunk)) {
                log.warn("任务 [{}] Chunk {} 返回的 Content-Range 与请求不符: {}", batch.getTaskId(), chunk.getIndex(),
                        contentRange == null ? null : contentRange.getValue());
                return false;
            }
            return true;
        }
        return status == HttpStatus.SC_OK && chunk.getStart() == 0
                && chunk.getExpectedSize() == batch.getPartitioner().getTotalSize();
    }

    /**
     * 检查 {@code bytes start-end/total} 的区间是否正好是本分片
     */
    static boolean matchesRange(String contentRange, ChunkDescriptor chunk) {
        String value = contentRange.trim();
        if (!value.regionMatches(true, 0, "bytes ", 0, 6)) {
            return false;
        }
        int dash = value.indexOf('-', 6);
        int slash = value.indexOf('/', dash + 1);
        if (dash < 0 || slash < 0) {
            return false;
        }
        try {
            long start = Long.parseLong(value.substring(6, dash).trim());
            long end = Long.parseLong(value.substring(dash + 1, slash).trim());
            return start == chunk.getStart() && end == chunk.getEnd();
        } catch (NumberFormatException e) {
            return false;
        }
    }

    // 各分片写入区间互不重叠，定位写无需加锁
    private void write(byte[] buf, int len, long position) {
        ByteBuffer buffer = ByteBuffer.wrap(buf, 0, len);
        long pos = position;
        try {
            while (buffer.hasRemaining()) {
                pos += batch.getChannel().write(buffer, pos);
            }
        } catch (IOException e) {
            throw DownloadException.fileSystem("写入分片文件失败, 位置 " + pos, e);
        } catch (NonWritableChannelException e) {
            throw DownloadException.fileSystem("分片文件不可写", e);
        }
    }

    private boolean running() {
        return batch.getControl().shouldContinue(batch.getGeneration()) && !batch.isAborted();
    }

    private boolean tooSlow(long received, long attemptStart) {
        EngineProperties properties = batch.getProperties();
        long elapsedNanos = System.nanoTime() - attemptStart;
        if (elapsedNanos <= TimeUnit.MILLISECONDS.toNanos(properties.getSpeedWarmupMs())) {
            return false;
        }
        double seconds = elapsedNanos / 1_000_000_000.0;
        double kbps = received / 1024.0 / seconds;
        return kbps < properties.getSpeedFloorKbps();
    }

    /**
     * 分段睡眠，期间收到信号立即返回
     */
    private void sleepWhileRunning(long millis) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        while (running()) {
            long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remaining <= 0) {
                return;
            }
            try {
                Thread.sleep(Math.min(remaining, 100));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
