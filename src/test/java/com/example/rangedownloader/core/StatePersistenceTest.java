package com.example.rangedownloader.core;

import com.example.rangedownloader.error.DownloadException;
import com.example.rangedownloader.error.ErrorKind;
import com.example.rangedownloader.model.DownloadMetadata;
import com.example.rangedownloader.model.DownloadState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatePersistenceTest {

    private static final long SIZE = 4 * 512 * 1024L + 100;

    @TempDir
    Path dir;

    private final StatePersistence persistence = new StatePersistence();
    private final ChunkPartitioner partitioner = new ChunkPartitioner(SIZE);

    private DownloadMetadata pausedMetadata(String target) {
        DownloadMetadata metadata = new DownloadMetadata("task-1", "http://localhost/file.bin", target, SIZE, 4);
        metadata.setChunkSize(partitioner.getChunkSize());
        metadata.syncChunks(Arrays.asList(0, 2), partitioner.expectedBytes(Arrays.asList(0, 2)),
                partitioner.getTotalChunks());
        metadata.pause();
        return metadata;
    }

    @Test
    void savesAndLoadsMetadata() {
        String target = dir.resolve("file.bin").toString();
        persistence.allocate(target, SIZE);
        persistence.save(pausedMetadata(target));

        DownloadMetadata loaded = persistence.load(target);

        assertThat(loaded.getId()).isEqualTo("task-1");
        assertThat(loaded.getState()).isEqualTo(DownloadState.PAUSED);
        assertThat(loaded.getCompletedChunks()).containsExactly(0, 2);
        assertThat(loaded.getIncompleteChunks()).containsExactly(1, 3, 4);
        assertThat(loaded.getDownloadedBytes()).isEqualTo(2 * 512 * 1024L);
        assertThat(loaded.getPausedTime()).isNotNull();
        assertThat(Files.exists(StatePersistence.stateFile(target))).isTrue();
        assertThat(Files.exists(Path.of(StatePersistence.stateFile(target) + ".tmp"))).isFalse();
    }

    @Test
    void allocatesFullSizeFile() throws Exception {
        String target = dir.resolve("sparse.bin").toString();
        persistence.allocate(target, SIZE);

        assertThat(Files.size(StatePersistence.partFile(target))).isEqualTo(SIZE);
    }

    @Test
    void trustsConsistentStateOnDisk() {
        String target = dir.resolve("file.bin").toString();
        persistence.allocate(target, SIZE);
        DownloadMetadata metadata = pausedMetadata(target);

        assertThat(persistence.verifyAgainstDisk(metadata, partitioner)).isTrue();
        assertThat(metadata.getCompletedChunks()).containsExactly(0, 2);
    }

    @Test
    void fallsBackToFullDownloadWhenPartFileHasWrongSize() throws Exception {
        String target = dir.resolve("file.bin").toString();
        Files.write(StatePersistence.partFile(target), new byte[10]);
        DownloadMetadata metadata = pausedMetadata(target);

        assertThat(persistence.verifyAgainstDisk(metadata, partitioner)).isFalse();

        assertThat(metadata.getCompletedChunks()).isEmpty();
        assertThat(metadata.getIncompleteChunks()).isEqualTo(partitioner.allIndices());
        assertThat(metadata.getDownloadedBytes()).isZero();
        assertThat(Files.size(StatePersistence.partFile(target))).isEqualTo(SIZE);
    }

    @Test
    void fallsBackWhenChunkSetsDoNotPartitionIndices() {
        String target = dir.resolve("file.bin").toString();
        persistence.allocate(target, SIZE);
        DownloadMetadata metadata = pausedMetadata(target);
        metadata.setIncompleteChunks(Arrays.asList(1, 2, 3, 4));

        assertThat(persistence.verifyAgainstDisk(metadata, partitioner)).isFalse();
        assertThat(metadata.getCompletedChunks()).isEmpty();
    }

    @Test
    void fallsBackWhenByteCountDisagreesWithChunks() {
        String target = dir.resolve("file.bin").toString();
        persistence.allocate(target, SIZE);
        DownloadMetadata metadata = pausedMetadata(target);
        metadata.setDownloadedBytes(1);

        assertThat(persistence.verifyAgainstDisk(metadata, partitioner)).isFalse();
        assertThat(metadata.getIncompleteChunks()).hasSize(5);
    }

    @Test
    void missingStateFileIsNotFound() {
        String target = dir.resolve("none.bin").toString();

        assertThat(persistence.exists(target)).isFalse();
        assertThatThrownBy(() -> persistence.load(target))
                .isInstanceOfSatisfying(DownloadException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void malformedStateFileIsParseError() throws Exception {
        String target = dir.resolve("bad.bin").toString();
        Files.write(StatePersistence.stateFile(target), "{not json".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> persistence.load(target))
                .isInstanceOfSatisfying(DownloadException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.PARSE));
    }

    @Test
    void finishRenamesPartFileAndRemovesState() {
        String target = dir.resolve("done.bin").toString();
        persistence.allocate(target, SIZE);
        persistence.save(pausedMetadata(target));

        persistence.finish(target);

        assertThat(Files.exists(Path.of(target))).isTrue();
        assertThat(Files.exists(StatePersistence.partFile(target))).isFalse();
        assertThat(Files.exists(StatePersistence.stateFile(target))).isFalse();
    }

    @Test
    void discardRemovesBothFiles() {
        String target = dir.resolve("gone.bin").toString();
        persistence.allocate(target, SIZE);
        persistence.save(pausedMetadata(target));

        persistence.discard(target);

        assertThat(Files.exists(StatePersistence.partFile(target))).isFalse();
        assertThat(Files.exists(StatePersistence.stateFile(target))).isFalse();
        assertThat(Files.exists(Path.of(target))).isFalse();
    }
}
