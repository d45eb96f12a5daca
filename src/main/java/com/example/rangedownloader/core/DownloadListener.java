package com.example.rangedownloader.core;

import com.example.rangedownloader.model.DownloadProgress;
import com.example.rangedownloader.model.DownloadState;

/**
 * 下载进度监听器接口
 */
public interface DownloadListener {

    /**
     * 下载过程中按监控间隔调用
     *
     * @param progress 进度快照
     */
    default void onProgress(DownloadProgress progress) {
    }

    /**
     * 任务状态发生变化时调用
     *
     * @param progress 变化后的进度快照
     * @param previous 旧状态
     */
    default void onStateChanged(DownloadProgress progress, DownloadState previous) {
    }
}
