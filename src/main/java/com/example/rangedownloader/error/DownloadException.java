package com.example.rangedownloader.error;

import lombok.Getter;

/**
 * 下载引擎对外抛出的异常
 */
@Getter
public class DownloadException extends RuntimeException {

    private final ErrorKind kind;

    public DownloadException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DownloadException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static DownloadException config(String message) {
        return new DownloadException(ErrorKind.CONFIG, message);
    }

    public static DownloadException notFound(String id) {
        return new DownloadException(ErrorKind.NOT_FOUND, "下载任务不存在: " + id);
    }

    public static DownloadException invalidState(String id, Object state, String action) {
        return new DownloadException(ErrorKind.INVALID_STATE,
                "任务 " + id + " 当前状态为 " + state + "，无法执行 " + action);
    }

    public static DownloadException fileSystem(String message, Throwable cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new DownloadException(ErrorKind.FILE_SYSTEM, message + ": " + reason, cause);
    }

    @Override
    public String getMessage() {
        return kind + ": " + super.getMessage();
    }
}
