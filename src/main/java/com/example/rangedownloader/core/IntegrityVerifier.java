package com.example.rangedownloader.core;

import com.example.rangedownloader.error.IntegrityException;
import lombok.extern.slf4j.Slf4j;

/**
 * 完整性校验
 * <p>
 * 工作线程全部退出后执行，分片数和字节数必须同时与期望一致，任何一项不符都视为失败。
 * </p>
 */
@Slf4j
public final class IntegrityVerifier {

    private IntegrityVerifier() {
    }

    /**
     * @throws IntegrityException 分片数或字节数不一致
     */
    public static void verify(long downloadedBytes, long totalSize, long completedChunks, long totalChunks) {
        log.info("完整性校验: 分片 {} / {}, 字节 {} / {}", completedChunks, totalChunks, downloadedBytes, totalSize);

        if (completedChunks != totalChunks || downloadedBytes != totalSize) {
            IntegrityException e = new IntegrityException(downloadedBytes, totalSize, completedChunks, totalChunks);
            log.error("完整性校验失败: {}", e.getMessage());
            throw e;
        }
    }
}
