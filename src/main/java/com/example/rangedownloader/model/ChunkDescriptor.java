package com.example.rangedownloader.model;

import lombok.Data;

/**
 * 分片描述
 * <p>
 * 记录分片序号和负责的字节范围（闭区间），最后一个分片可能小于标准分片大小
 * </p>
 */
@Data
public class ChunkDescriptor {
    private final int index;         // 分片序号
    private final long start;        // 起始字节位置
    private final long end;          // 结束字节位置(包含)
    private final long expectedSize; // 期望字节数

    /**
     * HTTP Range 请求头的值
     */
    public String rangeHeader() {
        return "bytes=" + start + "-" + end;
    }
}
