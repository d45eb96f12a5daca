package com.example.rangedownloader.core;

import com.example.rangedownloader.error.ErrorKind;
import com.example.rangedownloader.error.IntegrityException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntegrityVerifierTest {

    @Test
    void passesWhenBytesAndChunksMatch() {
        assertThatCode(() -> IntegrityVerifier.verify(104_857_600L, 104_857_600L, 25, 25))
                .doesNotThrowAnyException();
    }

    @Test
    void failsOnMissingChunk() {
        assertThatThrownBy(() -> IntegrityVerifier.verify(100, 100, 3, 4))
                .isInstanceOf(IntegrityException.class)
                .hasMessageContaining("3 / 4");
    }

    @Test
    void failsOnByteMismatchEvenWhenChunkCountMatches() {
        assertThatThrownBy(() -> IntegrityVerifier.verify(99, 100, 4, 4))
                .isInstanceOfSatisfying(IntegrityException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.INTEGRITY);
                    assertThat(e.getDownloadedBytes()).isEqualTo(99);
                    assertThat(e.getTotalSize()).isEqualTo(100);
                });
    }
}
