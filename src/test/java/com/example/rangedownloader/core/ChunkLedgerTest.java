package com.example.rangedownloader.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkLedgerTest {

    private final ChunkPartitioner partitioner = new ChunkPartitioner(10 * 512 * 1024L + 7);

    @Test
    void startsFromPreviousProgress() {
        ChunkLedger ledger = new ChunkLedger(2, Arrays.asList(0, 1), partitioner.expectedBytes(Arrays.asList(0, 1)));

        assertThat(ledger.getGeneration()).isEqualTo(2);
        assertThat(ledger.getCompletedCount()).isEqualTo(2);
        assertThat(ledger.getDownloadedBytes()).isEqualTo(2 * 512 * 1024L);
        assertThat(ledger.isCompleted(1)).isTrue();
        assertThat(ledger.isCompleted(2)).isFalse();
    }

    @Test
    void chunkIsCountedOnlyOnce() {
        ChunkLedger ledger = new ChunkLedger(0, Collections.emptyList(), 0);

        assertThat(ledger.markCompleted(partitioner.chunk(10))).isTrue();
        assertThat(ledger.markCompleted(partitioner.chunk(10))).isFalse();

        assertThat(ledger.getCompletedCount()).isEqualTo(1);
        assertThat(ledger.getDownloadedBytes()).isEqualTo(7);
        assertThat(ledger.completedSnapshot()).containsExactly(10);
    }

    @Test
    void concurrentCompletionsOfSameChunksStayConsistent() throws Exception {
        ChunkLedger ledger = new ChunkLedger(0, Collections.emptyList(), 0);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            futures.add(pool.submit(() -> {
                go.await();
                for (int i = 0; i < partitioner.getTotalChunks(); i++) {
                    ledger.markCompleted(partitioner.chunk(i));
                }
                return null;
            }));
        }
        go.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(ledger.getCompletedCount()).isEqualTo(partitioner.getTotalChunks());
        assertThat(ledger.getDownloadedBytes()).isEqualTo(partitioner.getTotalSize());
    }
}
