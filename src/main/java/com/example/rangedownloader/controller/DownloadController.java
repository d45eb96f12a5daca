package com.example.rangedownloader.controller;

import com.example.rangedownloader.config.EngineProperties;
import com.example.rangedownloader.core.DownloadListener;
import com.example.rangedownloader.error.DownloadException;
import com.example.rangedownloader.model.DownloadMetadata;
import com.example.rangedownloader.model.DownloadProgress;
import com.example.rangedownloader.model.DownloadResult;
import com.example.rangedownloader.model.DownloadState;
import com.example.rangedownloader.service.DownloadService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.web.bind.annotation.*;

import javax.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/download")
@CrossOrigin
public class DownloadController {

    @Autowired
    private DownloadService downloadService;
    @Autowired
    private SimpMessagingTemplate messagingTemplate;
    @Autowired
    private EngineProperties properties;

    @PostConstruct
    public void init() {
        // 状态变化即时推送，进度由定时任务批量推送
        downloadService.addListener(new DownloadListener() {
            @Override
            public void onStateChanged(DownloadProgress progress, DownloadState previous) {
                messagingTemplate.convertAndSend("/topic/state", toView(progress));
            }
        });
    }

    @PostMapping("/start")
    public String createTask(@RequestBody Map<String, Object> params) {
        String url = (String) params.get("url");
        String path = (String) params.get("path");
        Object threads = params.get("threads");
        int threadCount = threads instanceof Number ? ((Number) threads).intValue() : properties.getDefaultThreads();
        return downloadService.start(url, path, threadCount);
    }

    /**
     * 根据状态文件重新登记上次未完成的任务
     */
    @PostMapping("/recover")
    public String recover(@RequestBody Map<String, Object> params) {
        return downloadService.recover((String) params.get("path"));
    }

    @GetMapping("/list")
    public List<Map<String, Object>> list() {
        List<Map<String, Object>> list = new ArrayList<>();
        for (DownloadProgress p : downloadService.listProgress()) {
            list.add(toView(p));
        }
        return list;
    }

    @GetMapping("/{id}")
    public Map<String, Object> detail(@PathVariable String id) {
        Map<String, Object> map = toView(downloadService.getProgress(id));
        DownloadMetadata metadata = downloadService.getMetadata(id);
        map.put("createdTime", metadata.getCreatedTime());
        map.put("incompleteChunks", metadata.getIncompleteChunks());
        return map;
    }

    @PostMapping("/{id}/{action}")
    public ResponseEntity<Object> control(@PathVariable String id, @PathVariable String action) {
        log.info("任务 [{}] 操作: {}", id, action);
        switch (action) {
            case "pause":
                downloadService.pause(id);
                break;
            case "stop":
                downloadService.stop(id);
                break;
            case "resume":
                downloadService.resume(id);
                break;
            case "cancel":
                DownloadResult result = downloadService.cancel(id);
                return ResponseEntity.ok(result);
            default:
                return ResponseEntity.badRequest().body(error("未知操作: " + action));
        }
        return ResponseEntity.ok(toView(downloadService.getProgress(id)));
    }

    // 定时推送数据
    @Scheduled(fixedRate = 800)
    public void pushProgress() {
        try {
            List<Map<String, Object>> updates = list();
            if (!updates.isEmpty()) {
                messagingTemplate.convertAndSend("/topic/progress", updates);
            }
        } catch (RuntimeException e) {
            // 防止定时任务终止
            log.error("推送下载进度失败", e);
        }
    }

    @ExceptionHandler(DownloadException.class)
    public ResponseEntity<Map<String, Object>> handleDownloadException(DownloadException e) {
        HttpStatus status;
        switch (e.getKind()) {
            case CONFIG:
            case PARSE:
                status = HttpStatus.BAD_REQUEST;
                break;
            case NOT_FOUND:
                status = HttpStatus.NOT_FOUND;
                break;
            case INVALID_STATE:
                status = HttpStatus.CONFLICT;
                break;
            case NETWORK:
                status = HttpStatus.BAD_GATEWAY;
                break;
            default:
                status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        log.warn("请求失败: {}", e.getMessage());
        Map<String, Object> body = error(e.getMessage());
        body.put("kind", e.getKind());
        return ResponseEntity.status(status).body(body);
    }

    private Map<String, Object> error(String message) {
        Map<String, Object> map = new HashMap<>();
        map.put("error", message);
        return map;
    }

    private Map<String, Object> toView(DownloadProgress p) {
        Map<String, Object> map = new HashMap<>();
        map.put("id", p.getId());
        map.put("url", p.getUrl());
        map.put("filepath", p.getFilepath());
        map.put("status", p.getState());
        map.put("totalSize", p.getTotalSize());
        map.put("downloaded", p.getDownloadedBytes());
        map.put("percentage", p.getPercentage());
        map.put("completedChunks", p.getCompletedChunks());
        map.put("totalChunks", p.getTotalChunks());
        map.put("speed", p.getSpeed());
        map.put("threads", p.getThreadCount());
        map.put("error", p.getErrorMessage());
        return map;
    }
}
