package com.example.rangedownloader.model;

import lombok.Data;

/**
 * 下载源信息（文件大小、是否支持 Range、服务器给出的文件名）
 */
@Data
public class SourceInfo {
    private long totalSize = -1; // -1 表示未知
    private boolean supportRange;
    private String fileName;     // Content-Disposition 中的文件名，可能为空
}
