package com.example.rangedownloader.model;

/**
 * 下载状态枚举
 * <p>
 * 定义下载任务的各种状态及其允许的流转
 * </p>
 */
public enum DownloadState {
    PENDING,    // 已创建，尚未开始
    ACTIVE,     // 下载中
    PAUSED,     // 暂停（保留分片文件）
    STOPPED,    // 停止（保留分片文件，表示暂时不需要）
    COMPLETED,  // 完成
    FAILED,     // 完整性校验失败
    CANCELLED;  // 取消（已清理文件）

    /**
     * 是否可以从该状态恢复下载
     *
     * @return PAUSED, STOPPED 或 FAILED 返回 true
     */
    public boolean canResume() {
        return this == PAUSED || this == STOPPED || this == FAILED;
    }

    /**
     * 是否可以取消
     *
     * @return 除 COMPLETED、CANCELLED 和 PENDING 以外返回 true
     */
    public boolean canCancel() {
        return this == ACTIVE || canResume();
    }

    /**
     * 判断是否为终止状态（不会再有任何变化）
     *
     * @return 如果是 COMPLETED 或 CANCELLED 返回 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
