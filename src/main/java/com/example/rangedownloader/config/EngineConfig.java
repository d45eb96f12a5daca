package com.example.rangedownloader.config;

import com.example.rangedownloader.core.HttpClientFactory;
import com.example.rangedownloader.core.SourceProbe;
import com.example.rangedownloader.core.StatePersistence;
import com.example.rangedownloader.service.DownloadService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 下载引擎组件装配
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    @Bean
    public HttpClientFactory httpClientFactory(EngineProperties properties) {
        return new HttpClientFactory(properties);
    }

    @Bean
    public SourceProbe sourceProbe(HttpClientFactory httpClientFactory) {
        return new SourceProbe(httpClientFactory);
    }

    @Bean
    public StatePersistence statePersistence() {
        return new StatePersistence();
    }

    /**
     * 每个下载运行占用一个线程（负责等待工作线程、监控进度和收尾），工作线程本身在各自的 ForkJoinPool 中
     */
    @Bean(name = "downloadExecutor")
    public ExecutorService downloadExecutor() {
        ThreadFactory factory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger();

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, "download-run-" + counter.incrementAndGet());
                thread.setDaemon(false);
                return thread;
            }
        };
        log.info("创建下载运行线程池");
        return Executors.newCachedThreadPool(factory);
    }

    // 关闭顺序由 GracefulShutdownConfig 控制
    @Bean(destroyMethod = "")
    public DownloadService downloadService(EngineProperties properties, HttpClientFactory httpClientFactory,
                                           SourceProbe sourceProbe, StatePersistence statePersistence,
                                           ExecutorService downloadExecutor) {
        return new DownloadService(properties, httpClientFactory, sourceProbe, statePersistence, downloadExecutor);
    }
}
