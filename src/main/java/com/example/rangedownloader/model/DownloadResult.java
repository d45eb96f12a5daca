package com.example.rangedownloader.model;

import lombok.Data;

/**
 * 一次下载运行的最终结果
 * <p>
 * state 只会是 COMPLETED, FAILED, PAUSED, STOPPED 或 CANCELLED 之一，
 * FAILED 时 detail 中带有实际/期望的字节数和分片数
 * </p>
 */
@Data
public class DownloadResult {
    private final String id;
    private final DownloadState state;
    private final long downloadedBytes;
    private final long totalSize;
    private final int completedChunks;
    private final int totalChunks;
    private final String detail;

    public static DownloadResult of(DownloadMetadata metadata, DownloadState state, String detail) {
        int total = metadata.getCompletedChunks().size() + metadata.getIncompleteChunks().size();
        return new DownloadResult(metadata.getId(), state, metadata.getDownloadedBytes(), metadata.getTotalSize(),
                metadata.getCompletedChunks().size(), total, detail);
    }

    public boolean isSuccess() {
        return state == DownloadState.COMPLETED;
    }
}
