package com.example.rangedownloader.service;

import com.example.rangedownloader.config.EngineProperties;
import com.example.rangedownloader.core.DownloadListener;
import com.example.rangedownloader.core.DownloadTaskContext;
import com.example.rangedownloader.core.HttpClientFactory;
import com.example.rangedownloader.core.SourceProbe;
import com.example.rangedownloader.core.StatePersistence;
import com.example.rangedownloader.error.DownloadException;
import com.example.rangedownloader.error.ErrorKind;
import com.example.rangedownloader.model.DownloadMetadata;
import com.example.rangedownloader.model.DownloadProgress;
import com.example.rangedownloader.model.DownloadResult;
import com.example.rangedownloader.model.DownloadState;
import com.example.rangedownloader.model.SourceInfo;
import com.example.rangedownloader.util.FileUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;

/**
 * 下载任务服务
 * <p>
 * 管理所有活跃的下载任务，对外提供 start / pause / resume / stop / cancel / recover。
 * 任务完成或取消后从活跃列表中移除，最终结果仍可通过 {@link #awaitResult(String)} 获取。
 * </p>
 */
@Slf4j
public class DownloadService implements DownloadListener {

    // 内存中活跃的任务 Context
    private final Map<String, DownloadTaskContext> activeContexts = new ConcurrentHashMap<>();
    // 未结束任务最近一次运行的结果
    private final Map<String, CompletableFuture<DownloadResult>> results = new ConcurrentHashMap<>();
    // 已完成/已取消任务的结果，只保留最近 retainedResults 个
    private final Map<String, CompletableFuture<DownloadResult>> finishedResults =
            new LinkedHashMap<String, CompletableFuture<DownloadResult>>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, CompletableFuture<DownloadResult>> eldest) {
                    return size() > properties.getRetainedResults();
                }
            };
    // 正在被某个任务使用的目标文件（绝对路径），同一目标同时只允许一个任务
    private final Set<String> reservedTargets = ConcurrentHashMap.newKeySet();
    private final List<DownloadListener> listeners = new CopyOnWriteArrayList<>();

    private final EngineProperties properties;
    private final HttpClientFactory httpClientFactory;
    private final SourceProbe sourceProbe;
    private final StatePersistence persistence;
    private final ExecutorService downloadExecutor;

    public DownloadService(EngineProperties properties, HttpClientFactory httpClientFactory, SourceProbe sourceProbe,
                           StatePersistence persistence, ExecutorService downloadExecutor) {
        this.properties = properties;
        this.httpClientFactory = httpClientFactory;
        this.sourceProbe = sourceProbe;
        this.persistence = persistence;
        this.downloadExecutor = downloadExecutor;
    }

    /**
     * 创建并启动下载任务
     *
     * @param url      下载URL
     * @param filepath 目标文件路径；如果是已存在的目录，文件名由服务器信息或URL决定
     * @param threads  线程数，1 ~ maxThreads
     * @return 任务ID
     */
    public String start(String url, String filepath, int threads) {
        validateThreads(threads);
        validateUrl(url);
        if (filepath == null || filepath.trim().isEmpty()) {
            throw DownloadException.config("目标路径不能为空");
        }

        SourceInfo info = sourceProbe.probe(url);
        String target = reserveTarget(filepath, info);
        try {
            if (persistence.exists(target)) {
                throw DownloadException.config("目标文件存在未完成的下载，请使用 recover 恢复: " + target);
            }

            DownloadMetadata metadata = new DownloadMetadata(UUID.randomUUID().toString(), url, target,
                    info.getTotalSize(), threads);
            DownloadTaskContext context = newContext(metadata);
            metadata.setIncompleteChunks(context.getPartitioner().allIndices());

            persistence.allocate(target, info.getTotalSize());
            activeContexts.put(metadata.getId(), context);
            log.info("创建新下载任务: {}, URL: {}, 线程数: {}", metadata.getId(), url, threads);
            try {
                track(metadata.getId(), context.start());
            } catch (DownloadException e) {
                activeContexts.remove(metadata.getId());
                persistence.discard(target);
                throw e;
            }
            return metadata.getId();
        } catch (DownloadException e) {
            reservedTargets.remove(target);
            throw e;
        }
    }

    public void pause(String id) {
        getContext(id).pause();
    }

    public void stop(String id) {
        getContext(id).stop();
    }

    public void resume(String id) {
        DownloadTaskContext context = getContext(id);
        track(id, context.resume());
    }

    public DownloadResult cancel(String id) {
        DownloadResult result = getContext(id).cancel();
        activeContexts.remove(id);
        CompletableFuture<DownloadResult> running = results.get(id);
        if (running == null || running.isDone()) {
            track(id, CompletableFuture.completedFuture(result));
        } else {
            running.complete(result);
        }
        return result;
    }

    /**
     * 进程重启后根据状态文件重新登记任务
     * <p>
     * 状态为 ACTIVE 说明上次异常退出，按 STOPPED 处理；登记后需调用 {@link #resume(String)} 继续
     * </p>
     *
     * @param target 目标文件路径
     * @return 任务ID
     */
    public String recover(String target) {
        String path = new File(target).getAbsolutePath();
        DownloadMetadata metadata = persistence.load(path);
        DownloadTaskContext existing = activeContexts.get(metadata.getId());
        if (existing != null) {
            return existing.getTaskId();
        }
        if (!reservedTargets.add(path)) {
            throw DownloadException.config("目标文件正被其他任务使用: " + path);
        }
        try {
            return register(metadata);
        } catch (DownloadException e) {
            reservedTargets.remove(path);
            throw e;
        }
    }

    private String register(DownloadMetadata metadata) {
        DownloadState state = metadata.getState();
        if (state == DownloadState.ACTIVE || state == DownloadState.PENDING) {
            log.warn("任务 [{}] 上次未正常退出(状态 {})，按 STOPPED 恢复", metadata.getId(), state);
            metadata.stop();
        } else if (!state.canResume()) {
            throw DownloadException.invalidState(metadata.getId(), state, "recover");
        }
        validateThreads(metadata.getThreadCount());

        DownloadTaskContext context = newContext(metadata);
        persistence.verifyAgainstDisk(metadata, context.getPartitioner());
        persistence.save(metadata);
        activeContexts.put(metadata.getId(), context);
        log.info("已恢复任务登记: {}, 已完成分片 {}, 剩余分片 {}", metadata.getId(),
                metadata.getCompletedChunks().size(), metadata.getIncompleteChunks().size());
        return metadata.getId();
    }

    /**
     * 最近一次运行的结果
     */
    public CompletableFuture<DownloadResult> awaitResult(String id) {
        CompletableFuture<DownloadResult> result = results.get(id);
        if (result == null) {
            synchronized (finishedResults) {
                result = finishedResults.get(id);
            }
        }
        if (result == null) {
            throw DownloadException.notFound(id);
        }
        return result;
    }

    // 运行以 COMPLETED/CANCELLED 结束后把结果移入有上限的 finishedResults
    private void track(String id, CompletableFuture<DownloadResult> future) {
        results.put(id, future);
        future.whenComplete((result, error) -> {
            if (result != null && result.getState().isTerminal()) {
                synchronized (finishedResults) {
                    finishedResults.put(id, future);
                }
                results.remove(id, future);
            }
        });
    }

    public DownloadProgress getProgress(String id) {
        return getContext(id).progress();
    }

    public DownloadMetadata getMetadata(String id) {
        return getContext(id).snapshotMetadata();
    }

    public List<DownloadProgress> listProgress() {
        List<DownloadProgress> list = new ArrayList<>();
        for (DownloadTaskContext ctx : activeContexts.values()) {
            list.add(ctx.progress());
        }
        return list;
    }

    public Collection<String> activeIds() {
        return new ArrayList<>(activeContexts.keySet());
    }

    public boolean isRegistered(String id) {
        return activeContexts.containsKey(id);
    }

    public void addListener(DownloadListener listener) {
        listeners.add(listener);
    }

    public void removeListener(DownloadListener listener) {
        listeners.remove(listener);
    }

    /**
     * 停止所有下载中的任务并保存状态，下次启动可通过 recover 继续
     */
    public void shutdown() {
        for (DownloadTaskContext ctx : activeContexts.values()) {
            if (ctx.getState() == DownloadState.ACTIVE) {
                try {
                    ctx.stop();
                } catch (DownloadException e) {
                    log.warn("停止任务 [{}] 失败: {}", ctx.getTaskId(), e.getMessage());
                }
            }
        }
        downloadExecutor.shutdown();
    }

    @Override
    public void onProgress(DownloadProgress progress) {
        for (DownloadListener l : listeners) {
            l.onProgress(progress);
        }
    }

    @Override
    public void onStateChanged(DownloadProgress progress, DownloadState previous) {
        if (progress.getState().isTerminal()) {
            activeContexts.remove(progress.getId());
            reservedTargets.remove(progress.getFilepath());
            log.info("任务 [{}] 已{}，移出活跃列表", progress.getId(),
                    progress.getState() == DownloadState.COMPLETED ? "完成" : "取消");
        }
        for (DownloadListener l : listeners) {
            l.onStateChanged(progress, previous);
        }
    }

    private DownloadTaskContext newContext(DownloadMetadata metadata) {
        return new DownloadTaskContext(metadata, persistence, httpClientFactory, properties, downloadExecutor, this);
    }

    private DownloadTaskContext getContext(String id) {
        DownloadTaskContext ctx = activeContexts.get(id);
        if (ctx == null) {
            throw DownloadException.notFound(id);
        }
        return ctx;
    }

    private void validateThreads(int threads) {
        if (threads < 1 || threads > properties.getMaxThreads()) {
            throw DownloadException.config("线程数必须在 1 ~ " + properties.getMaxThreads() + " 之间: " + threads);
        }
    }

    private void validateUrl(String url) {
        if (url == null || url.trim().isEmpty()) {
            throw DownloadException.config("下载URL不能为空");
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme) || uri.getHost() == null) {
                throw DownloadException.config("只支持 http/https 下载地址: " + url);
            }
        } catch (URISyntaxException e) {
            throw new DownloadException(ErrorKind.CONFIG, "URL格式错误: " + url, e);
        }
    }

    /**
     * 解析目标文件并占用，目录时自动选一个未被占用的文件名
     *
     * @return 目标文件绝对路径
     */
    private String reserveTarget(String filepath, SourceInfo info) {
        File path = new File(filepath);
        if (path.isDirectory()) {
            checkParent(path.getAbsoluteFile());
            while (true) {
                String name = FileUtils.getUniqueFileName(path.getPath(), info.getFileName(),
                        n -> reservedTargets.contains(new File(path, n).getAbsolutePath()));
                String target = new File(path, name).getAbsolutePath();
                if (reservedTargets.add(target)) {
                    return target;
                }
            }
        }

        String name = FileUtils.sanitize(path.getName());
        if (name.isEmpty()) {
            throw DownloadException.config("目标文件名非法: " + filepath);
        }
        File file = path.getParentFile() == null ? new File(name) : new File(path.getParentFile(), name);
        checkParent(file.getAbsoluteFile().getParentFile());
        String target = file.getAbsolutePath();
        if (!reservedTargets.add(target)) {
            throw DownloadException.config("目标文件正在下载中: " + target);
        }
        return target;
    }

    private void checkParent(File parent) {
        if (parent == null) {
            return;
        }
        if (parent.exists() && !parent.isDirectory()) {
            throw DownloadException.config("目标目录不是文件夹: " + parent);
        }
        if (!parent.exists() && !parent.mkdirs()) {
            throw DownloadException.config("无法创建目标目录: " + parent);
        }
        if (!parent.canWrite()) {
            throw DownloadException.config("目标目录不可写: " + parent);
        }
    }
}
