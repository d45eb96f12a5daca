package com.example.rangedownloader.core;

import com.example.rangedownloader.config.EngineProperties;
import com.example.rangedownloader.error.DownloadException;
import com.example.rangedownloader.error.ErrorKind;
import com.example.rangedownloader.model.ControlSignal;
import com.example.rangedownloader.support.RangeTestServer;
import org.apache.http.impl.client.CloseableHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkWorkerTest {

    private static final long SIZE = 3 * 512 * 1024L + 999;

    @TempDir
    Path dir;

    private RangeTestServer server;
    private EngineProperties properties;
    private HttpClientFactory factory;
    private ChunkPartitioner partitioner;
    private String target;

    @BeforeEach
    void setUp() throws Exception {
        server = new RangeTestServer(SIZE);
        properties = new EngineProperties();
        properties.setRetryBackoffMs(10);
        properties.setMaxRetryBackoffMs(20);
        properties.setIdleSleepMs(10);
        factory = new HttpClientFactory(properties);
        partitioner = new ChunkPartitioner(SIZE);
        target = dir.resolve("file.bin").toString();
        new StatePersistence().allocate(target, SIZE);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private WorkerBatch batch(int generation, ChunkQueue queue, RetryTracker retries, ChunkLedger ledger,
                              DownloadControl control, FileChannel channel, CloseableHttpClient client) {
        return new WorkerBatch("t", server.url("/file.bin"), generation, partitioner, queue, retries, ledger,
                control, channel, client, properties);
    }

    @Test
    void downloadsAllChunksAndRetriesFailures() throws Exception {
        server.failEvery(2).truncateEvery(3);
        ChunkQueue queue = new ChunkQueue();
        queue.seed(partitioner.allIndices());
        ChunkLedger ledger = new ChunkLedger(0, Collections.emptyList(), 0);
        DownloadControl control = new DownloadControl();

        try (FileChannel channel = FileChannel.open(StatePersistence.partFile(target), StandardOpenOption.WRITE);
             CloseableHttpClient client = factory.createWorkerClient(2)) {
            WorkerBatch batch = batch(0, queue, new RetryTracker(), ledger, control, channel, client);
            new ChunkWorker(batch, 0).invoke();
        }

        assertThat(ledger.getCompletedCount()).isEqualTo(partitioner.getTotalChunks());
        assertThat(ledger.getDownloadedBytes()).isEqualTo(SIZE);
        assertThat(server.rangeRequestCount()).isGreaterThan(partitioner.getTotalChunks());
        assertThat(server.firstMismatch(StatePersistence.partFile(target))).isEqualTo(-1);
    }

    @Test
    void staleGenerationWorkerExitsWithoutTouchingAnything() throws Exception {
        ChunkQueue queue = new ChunkQueue();
        queue.seed(partitioner.allIndices());
        RetryTracker retries = new RetryTracker();
        ChunkLedger ledger = new ChunkLedger(0, Collections.emptyList(), 0);
        DownloadControl control = new DownloadControl();
        control.signal(ControlSignal.PAUSE);
        control.nextGeneration();

        try (FileChannel channel = FileChannel.open(StatePersistence.partFile(target), StandardOpenOption.WRITE);
             CloseableHttpClient client = factory.createWorkerClient(1)) {
            new ChunkWorker(batch(0, queue, retries, ledger, control, channel, client), 0).invoke();
        }

        assertThat(queue.size()).isEqualTo(partitioner.getTotalChunks());
        assertThat(retries.get(0)).isZero();
        assertThat(ledger.getCompletedCount()).isZero();
        assertThat(server.rangeRequestCount()).isZero();
    }

    @Test
    void pausedWorkerStopsBeforeFetching() throws Exception {
        ChunkQueue queue = new ChunkQueue();
        queue.seed(partitioner.allIndices());
        ChunkLedger ledger = new ChunkLedger(0, Collections.emptyList(), 0);
        DownloadControl control = new DownloadControl();
        control.signal(ControlSignal.PAUSE);

        try (FileChannel channel = FileChannel.open(StatePersistence.partFile(target), StandardOpenOption.WRITE);
             CloseableHttpClient client = factory.createWorkerClient(1)) {
            new ChunkWorker(batch(0, queue, new RetryTracker(), ledger, control, channel, client), 0).invoke();
        }

        assertThat(ledger.getCompletedCount()).isZero();
        assertThat(server.rangeRequestCount()).isZero();
    }

    @Test
    @Timeout(10)
    void writeFailureIsFatalInsteadOfRetried() throws Exception {
        ChunkQueue queue = new ChunkQueue();
        queue.seed(partitioner.allIndices());
        ChunkLedger ledger = new ChunkLedger(0, Collections.emptyList(), 0);

        try (FileChannel readOnly = FileChannel.open(StatePersistence.partFile(target), StandardOpenOption.READ);
             CloseableHttpClient client = factory.createWorkerClient(1)) {
            WorkerBatch batch = batch(0, queue, new RetryTracker(), ledger, new DownloadControl(), readOnly, client);

            assertThatThrownBy(() -> new ChunkWorker(batch, 0).invoke())
                    .isInstanceOfSatisfying(DownloadException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.FILE_SYSTEM));
            assertThat(batch.isAborted()).isTrue();
            assertThat(batch.getFailure().get().getKind()).isEqualTo(ErrorKind.FILE_SYSTEM);
        }

        assertThat(server.rangeRequestCount()).isEqualTo(1);
        assertThat(ledger.getCompletedCount()).isZero();
        assertThat(queue.size()).isEqualTo(partitioner.getTotalChunks());
    }

    @Test
    @Timeout(10)
    void writeFailureStopsSiblingWorkers() throws Exception {
        ChunkQueue queue = new ChunkQueue();
        queue.seed(partitioner.allIndices());
        ChunkLedger ledger = new ChunkLedger(0, Collections.emptyList(), 0);
        ForkJoinPool pool = new ForkJoinPool(3);

        try (FileChannel readOnly = FileChannel.open(StatePersistence.partFile(target), StandardOpenOption.READ);
             CloseableHttpClient client = factory.createWorkerClient(3)) {
            WorkerBatch batch = batch(0, queue, new RetryTracker(), ledger, new DownloadControl(), readOnly, client);
            for (int i = 0; i < 3; i++) {
                pool.execute(new ChunkWorker(batch, i));
            }
            pool.shutdown();

            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
            assertThat(batch.isAborted()).isTrue();
        }

        // 每个线程最多发出一个请求就退出
        assertThat(server.rangeRequestCount()).isLessThanOrEqualTo(3);
        assertThat(ledger.getCompletedCount()).isZero();
    }

    @Test
    void rejectsPartialContentForAnotherWindow() throws Exception {
        server.misalignEvery(2);
        ChunkQueue queue = new ChunkQueue();
        queue.seed(partitioner.allIndices());
        ChunkLedger ledger = new ChunkLedger(0, Collections.emptyList(), 0);

        try (FileChannel channel = FileChannel.open(StatePersistence.partFile(target), StandardOpenOption.WRITE);
             CloseableHttpClient client = factory.createWorkerClient(1)) {
            new ChunkWorker(batch(0, queue, new RetryTracker(), ledger, new DownloadControl(), channel, client), 0)
                    .invoke();
        }

        assertThat(ledger.getCompletedCount()).isEqualTo(partitioner.getTotalChunks());
        assertThat(server.rangeRequestCount()).isGreaterThan(partitioner.getTotalChunks());
        assertThat(server.firstMismatch(StatePersistence.partFile(target))).isEqualTo(-1);
    }

    @Test
    void contentRangeMustMatchRequestedChunk() {
        assertThat(ChunkWorker.matchesRange("bytes 524288-1048575/2573311", partitioner.chunk(1))).isTrue();
        assertThat(ChunkWorker.matchesRange("bytes 524289-1048576/2573311", partitioner.chunk(1))).isFalse();
        assertThat(ChunkWorker.matchesRange("bytes */2573311", partitioner.chunk(1))).isFalse();
        assertThat(ChunkWorker.matchesRange("items 524288-1048575/2573311", partitioner.chunk(1))).isFalse();
        assertThat(ChunkWorker.matchesRange("bytes 0-524287/*", partitioner.chunk(0))).isTrue();
    }
}
