package com.example.rangedownloader.model;

import lombok.Data;

import java.util.Collection;
import java.util.Date;
import java.util.Set;
import java.util.TreeSet;

/**
 * 下载元数据
 * <p>
 * 恢复一个下载所需的全部信息，序列化后保存在 {@code <target>.part.state} 文件中。
 * completedChunks 与 incompleteChunks 互不相交，两者合起来覆盖全部分片序号；
 * downloadedBytes 始终等于已完成分片的期望字节数之和。
 * </p>
 */
@Data
public class DownloadMetadata {
    private String id;              // UUID
    private String url;
    private String filepath;        // 最终目标文件路径
    private long totalSize;
    private long downloadedBytes;
    private long chunkSize;
    private int threadCount;
    private DownloadState state = DownloadState.PENDING;

    private Set<Integer> completedChunks = new TreeSet<>();
    private Set<Integer> incompleteChunks = new TreeSet<>();

    private Date createdTime;
    private Date pausedTime;
    private Date resumedTime;
    private Date stoppedTime;
    private Date completedTime;

    private String errorMessage;

    public DownloadMetadata() {
    }

    public DownloadMetadata(String id, String url, String filepath, long totalSize, int threadCount) {
        this.id = id;
        this.url = url;
        this.filepath = filepath;
        this.totalSize = totalSize;
        this.threadCount = threadCount;
        this.createdTime = new Date();
    }

    public void setCompletedChunks(Collection<Integer> chunks) {
        this.completedChunks = chunks == null ? new TreeSet<>() : new TreeSet<>(chunks);
    }

    public void setIncompleteChunks(Collection<Integer> chunks) {
        this.incompleteChunks = chunks == null ? new TreeSet<>() : new TreeSet<>(chunks);
    }

    /**
     * 按已完成分片集合重建两个分片集合和已下载字节数
     *
     * @param completed       已完成的分片序号
     * @param downloadedBytes 已完成分片的字节数之和
     * @param totalChunks     分片总数
     */
    public void syncChunks(Collection<Integer> completed, long downloadedBytes, int totalChunks) {
        TreeSet<Integer> done = new TreeSet<>(completed);
        TreeSet<Integer> remaining = new TreeSet<>();
        for (int i = 0; i < totalChunks; i++) {
            if (!done.contains(i)) {
                remaining.add(i);
            }
        }
        this.completedChunks = done;
        this.incompleteChunks = remaining;
        this.downloadedBytes = downloadedBytes;
    }

    /**
     * 计算下载进度百分比
     */
    public double progressPercentage() {
        if (totalSize <= 0) {
            return 0.0;
        }
        return downloadedBytes * 100.0 / totalSize;
    }

    public void activate() {
        this.state = DownloadState.ACTIVE;
    }

    public void pause() {
        this.state = DownloadState.PAUSED;
        this.pausedTime = new Date();
    }

    public void resume() {
        this.state = DownloadState.ACTIVE;
        this.resumedTime = new Date();
        this.errorMessage = null;
    }

    public void stop() {
        this.state = DownloadState.STOPPED;
        this.stoppedTime = new Date();
    }

    public void complete() {
        this.state = DownloadState.COMPLETED;
        this.completedTime = new Date();
    }

    public void fail(String error) {
        this.state = DownloadState.FAILED;
        this.errorMessage = error;
    }

    public void cancel() {
        this.state = DownloadState.CANCELLED;
    }
}
