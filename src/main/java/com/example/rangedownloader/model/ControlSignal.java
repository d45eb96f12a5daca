package com.example.rangedownloader.model;

/**
 * 下载线程的控制信号
 * <p>
 * 工作线程在每个分片之间以及读取数据流的过程中轮询该信号，非 RUN 时立即退出
 * </p>
 */
public enum ControlSignal {
    RUN,
    PAUSE,
    STOP,
    CANCEL;

    /**
     * 信号对应的下载状态，RUN 没有对应的终止状态
     */
    public DownloadState toState() {
        switch (this) {
            case PAUSE:
                return DownloadState.PAUSED;
            case STOP:
                return DownloadState.STOPPED;
            case CANCEL:
                return DownloadState.CANCELLED;
            default:
                return DownloadState.ACTIVE;
        }
    }
}
