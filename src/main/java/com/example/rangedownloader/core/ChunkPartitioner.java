package com.example.rangedownloader.core;

import com.example.rangedownloader.error.DownloadException;
import com.example.rangedownloader.model.ChunkDescriptor;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * 分片划分器
 * <p>
 * 按文件大小分档选择分片大小：分片过小时大文件会产生几万个请求，容易被限流；
 * 分片过大时小文件无法充分并行。
 * </p>
 */
public class ChunkPartitioner {

    private static final long KB = 1024L;
    private static final long MB = 1024L * KB;
    private static final long GB = 1024L * MB;

    private final long totalSize;
    private final long chunkSize;
    private final int totalChunks;

    public ChunkPartitioner(long totalSize) {
        if (totalSize <= 0) {
            throw DownloadException.config("文件大小必须大于0: " + totalSize);
        }
        this.totalSize = totalSize;
        this.chunkSize = chunkSizeFor(totalSize);
        long chunks = (totalSize + chunkSize - 1) / chunkSize;
        if (chunks > Integer.MAX_VALUE) {
            throw DownloadException.config("分片数过多: " + chunks);
        }
        this.totalChunks = (int) chunks;
    }

    /**
     * 根据文件大小计算分片大小
     * <ul>
     * <li>&lt; 100 MB: 512 KB</li>
     * <li>&lt; 1 GB: 4 MB</li>
     * <li>&lt; 10 GB: 16 MB</li>
     * <li>其余: 64 MB</li>
     * </ul>
     */
    public static long chunkSizeFor(long totalSize) {
        if (totalSize < 100 * MB) {
            return 512 * KB;
        } else if (totalSize < GB) {
            return 4 * MB;
        } else if (totalSize < 10 * GB) {
            return 16 * MB;
        }
        return 64 * MB;
    }

    public long getTotalSize() {
        return totalSize;
    }

    public long getChunkSize() {
        return chunkSize;
    }

    public int getTotalChunks() {
        return totalChunks;
    }

    /**
     * 获取指定序号的分片
     */
    public ChunkDescriptor chunk(int index) {
        if (index < 0 || index >= totalChunks) {
            throw new IndexOutOfBoundsException("分片序号越界: " + index + " / " + totalChunks);
        }
        long start = index * chunkSize;
        long end = Math.min(start + chunkSize, totalSize) - 1;
        return new ChunkDescriptor(index, start, end, end - start + 1);
    }

    /**
     * 全部分片序号 [0, totalChunks)
     */
    public Set<Integer> allIndices() {
        Set<Integer> indices = new TreeSet<>();
        for (int i = 0; i < totalChunks; i++) {
            indices.add(i);
        }
        return indices;
    }

    /**
     * 一组分片的期望字节数之和
     */
    public long expectedBytes(Collection<Integer> indices) {
        long sum = 0;
        for (Integer index : indices) {
            sum += chunk(index).getExpectedSize();
        }
        return sum;
    }
}
