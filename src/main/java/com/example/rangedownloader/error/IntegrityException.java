package com.example.rangedownloader.error;

import lombok.Getter;

/**
 * 完整性校验失败，携带实际与期望的字节数和分片数
 */
@Getter
public class IntegrityException extends DownloadException {

    private final long downloadedBytes;
    private final long totalSize;
    private final long completedChunks;
    private final long totalChunks;

    public IntegrityException(long downloadedBytes, long totalSize, long completedChunks, long totalChunks) {
        super(ErrorKind.INTEGRITY, String.format("下载不完整: %d / %d 字节, %d / %d 分片",
                downloadedBytes, totalSize, completedChunks, totalChunks));
        this.downloadedBytes = downloadedBytes;
        this.totalSize = totalSize;
        this.completedChunks = completedChunks;
        this.totalChunks = totalChunks;
    }
}
