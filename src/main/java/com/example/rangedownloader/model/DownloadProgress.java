package com.example.rangedownloader.model;

import lombok.Data;

/**
 * 下载进度快照，用于推送给前端或监听器
 */
@Data
public class DownloadProgress {
    private String id;
    private String url;
    private String filepath;
    private DownloadState state;
    private long downloadedBytes;
    private long totalSize;
    private int completedChunks;
    private int totalChunks;
    private long speed; // bytes/s
    private int threadCount;
    private String errorMessage;

    public double getPercentage() {
        return totalSize <= 0 ? 0.0 : downloadedBytes * 100.0 / totalSize;
    }
}
