package com.example.rangedownloader.error;

/**
 * 错误分类
 */
public enum ErrorKind {
    NETWORK,       // 连接/读取超时、连接重置、非成功状态码
    FILE_SYSTEM,   // 分配、写入、重命名、权限
    INTEGRITY,     // 最终字节数或分片数不一致
    PARSE,         // 源站返回的大小、文件名等信息无法解析
    CONFIG,        // 线程数、目标路径等参数非法
    NOT_FOUND,     // 下载任务不存在
    INVALID_STATE  // 当前状态不允许该操作
}
