package com.example.rangedownloader.config;

import com.example.rangedownloader.service.DownloadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import javax.annotation.PreDestroy;

/**
 * 应用关闭时停止所有下载并保存状态
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class GracefulShutdownConfig {

    private final DownloadService downloadService;

    @PreDestroy
    public void onShutdown() {
        log.info("应用关闭，停止所有下载任务");
        try {
            downloadService.shutdown();
            log.info("所有下载任务已停止，状态已保存");
        } catch (RuntimeException e) {
            log.error("停止下载任务时出错", e);
        }
    }
}
