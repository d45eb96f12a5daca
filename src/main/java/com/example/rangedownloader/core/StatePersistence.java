package com.example.rangedownloader.core;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.serializer.SerializerFeature;
import com.example.rangedownloader.error.DownloadException;
import com.example.rangedownloader.error.ErrorKind;
import com.example.rangedownloader.model.DownloadMetadata;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Set;
import java.util.TreeSet;

/**
 * 下载状态持久化
 * <p>
 * 分片数据写入 {@code <target>.part}，元数据以 JSON 保存在 {@code <target>.part.state}，
 * 两者放在同一目录。完成后 .part 重命名为目标文件并删除状态文件，取消时两者都删除。
 * </p>
 */
@Slf4j
public class StatePersistence {

    public static final String PART_SUFFIX = ".part";
    public static final String STATE_SUFFIX = ".part.state";

    public static Path partFile(String target) {
        return Paths.get(target + PART_SUFFIX);
    }

    public static Path stateFile(String target) {
        return Paths.get(target + STATE_SUFFIX);
    }

    /**
     * 保存元数据，先写临时文件再替换，避免写到一半崩溃留下损坏的状态文件
     */
    public void save(DownloadMetadata metadata) {
        Path stateFile = stateFile(metadata.getFilepath());
        Path tmp = Paths.get(stateFile + ".tmp");
        String json = JSON.toJSONString(metadata, SerializerFeature.PrettyFormat);
        try {
            Files.write(tmp, json.getBytes(StandardCharsets.UTF_8));
            moveReplacing(tmp, stateFile);
        } catch (IOException e) {
            log.error("任务 [{}] 保存状态文件失败: {}", metadata.getId(), stateFile, e);
            throw DownloadException.fileSystem("保存状态文件失败 " + stateFile, e);
        }
        log.debug("任务 [{}] 状态已保存: {}, {} / {} 字节, 完成分片 {}", metadata.getId(), metadata.getState(),
                metadata.getDownloadedBytes(), metadata.getTotalSize(), metadata.getCompletedChunks().size());
    }

    /**
     * 读取目标文件对应的状态文件
     *
     * @param target 最终目标文件路径
     */
    public DownloadMetadata load(String target) {
        Path stateFile = stateFile(target);
        if (!Files.exists(stateFile)) {
            throw new DownloadException(ErrorKind.NOT_FOUND, "状态文件不存在: " + stateFile);
        }
        String json;
        try {
            json = new String(Files.readAllBytes(stateFile), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw DownloadException.fileSystem("读取状态文件失败 " + stateFile, e);
        }
        DownloadMetadata metadata;
        try {
            metadata = JSON.parseObject(json, DownloadMetadata.class);
        } catch (JSONException e) {
            throw new DownloadException(ErrorKind.PARSE, "状态文件格式错误 " + stateFile, e);
        }
        if (metadata == null || metadata.getId() == null || metadata.getTotalSize() <= 0) {
            throw new DownloadException(ErrorKind.PARSE, "状态文件内容不完整 " + stateFile);
        }
        // 以实际所在位置为准，状态文件可能随目录一起被移动过
        metadata.setFilepath(target);
        log.info("任务 [{}] 状态已加载: {}, 进度 {}", metadata.getId(), metadata.getState(),
                String.format("%.2f%%", metadata.progressPercentage()));
        return metadata;
    }

    public boolean exists(String target) {
        return Files.exists(stateFile(target));
    }

    /**
     * 校验已加载的元数据是否可信
     * <p>
     * 分片文件大小、分片大小、分片集合、已下载字节数任何一项对不上，都把全部分片视为未完成；
     * 分片文件缺失或大小不对时重新分配。
     * </p>
     *
     * @return 元数据可信返回 true，已回退为全部未完成返回 false
     */
    public boolean verifyAgainstDisk(DownloadMetadata metadata, ChunkPartitioner partitioner) {
        Path part = partFile(metadata.getFilepath());
        boolean trusted = true;
        String reason = null;

        long onDisk = -1;
        try {
            onDisk = Files.exists(part) ? Files.size(part) : -1;
        } catch (IOException e) {
            log.warn("任务 [{}] 读取分片文件大小失败: {}", metadata.getId(), part, e);
        }
        if (onDisk != metadata.getTotalSize()) {
            trusted = false;
            reason = "分片文件大小 " + onDisk + " 与期望 " + metadata.getTotalSize() + " 不符";
        } else if (metadata.getChunkSize() != partitioner.getChunkSize()) {
            trusted = false;
            reason = "分片大小 " + metadata.getChunkSize() + " 与当前划分 " + partitioner.getChunkSize() + " 不符";
        } else if (!isPartition(metadata, partitioner)) {
            trusted = false;
            reason = "分片集合不完整或有重叠";
        } else if (partitioner.expectedBytes(metadata.getCompletedChunks()) != metadata.getDownloadedBytes()) {
            trusted = false;
            reason = "已下载字节数与已完成分片不符";
        }

        if (trusted) {
            return true;
        }

        log.warn("任务 [{}] 状态不可信({})，全部分片重新下载", metadata.getId(), reason);
        metadata.setChunkSize(partitioner.getChunkSize());
        metadata.syncChunks(new TreeSet<>(), 0, partitioner.getTotalChunks());
        if (onDisk != metadata.getTotalSize()) {
            allocate(metadata.getFilepath(), metadata.getTotalSize());
        }
        return false;
    }

    private boolean isPartition(DownloadMetadata metadata, ChunkPartitioner partitioner) {
        Set<Integer> completed = metadata.getCompletedChunks();
        Set<Integer> incomplete = metadata.getIncompleteChunks();
        if (completed.size() + incomplete.size() != partitioner.getTotalChunks()) {
            return false;
        }
        Set<Integer> union = new TreeSet<>(completed);
        union.addAll(incomplete);
        return union.equals(partitioner.allIndices());
    }

    /**
     * 预分配稀疏文件：只在最后一个字节处写入，文件立即达到最终大小
     *
     * @param target 最终目标文件路径
     * @param size   文件大小
     */
    public void allocate(String target, long size) {
        Path part = partFile(target);
        try {
            Path parent = part.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(part, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.SPARSE)) {
                channel.write(ByteBuffer.wrap(new byte[1]), size - 1);
            }
        } catch (IOException e) {
            throw DownloadException.fileSystem("分配文件失败 " + part, e);
        }
        log.info("已分配文件 {}，大小 {}", part, size);
    }

    /**
     * 下载完成：.part 重命名为目标文件，删除状态文件
     */
    public void finish(String target) {
        Path part = partFile(target);
        Path finalFile = Paths.get(target);
        try {
            moveReplacing(part, finalFile);
            Files.deleteIfExists(stateFile(target));
        } catch (IOException e) {
            throw DownloadException.fileSystem("重命名文件失败 " + part + " -> " + finalFile, e);
        }
        log.info("文件已完成: {}", finalFile);
    }

    /**
     * 取消：删除分片文件和状态文件
     */
    public void discard(String target) {
        Path part = partFile(target);
        Path state = stateFile(target);
        try {
            boolean partDeleted = Files.deleteIfExists(part);
            boolean stateDeleted = Files.deleteIfExists(state);
            log.info("已清理 {}(删除: {}), {}(删除: {})", part, partDeleted, state, stateDeleted);
        } catch (IOException e) {
            throw DownloadException.fileSystem("删除临时文件失败 " + part, e);
        }
    }

    private static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
