package com.example.rangedownloader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 下载引擎参数
 * <p>
 * 对应 application.yml 中的 {@code downloader.engine.*}，默认值即为推荐值
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "downloader.engine")
public class EngineProperties {

    private int defaultThreads = 8;
    private int maxThreads = 64;

    // 工作线程 HTTP 超时
    private int connectTimeoutMs = 5000;
    private int socketTimeoutMs = 5000;

    // 探测文件信息时的超时
    private int probeConnectTimeoutMs = 10000;
    private int probeSocketTimeoutMs = 30000;

    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    // HTTP 代理，不配置则直连
    private String proxyHost;
    private Integer proxyPort;

    private int bufferSize = 16384;

    // 队列暂时为空时的等待时间
    private long idleSleepMs = 100;

    // 失败后退避: min(retryBackoffMs * attempt, maxRetryBackoffMs)
    private long retryBackoffMs = 200;
    private long maxRetryBackoffMs = 2000;

    // 低速淘汰：预热期后速度低于下限则放弃本次尝试，第 adaptiveRetryThreshold 次起不再限速
    private long speedFloorKbps = 300;
    private long speedWarmupMs = 3000;
    private int adaptiveRetryThreshold = 3;

    // 每完成多少个分片写一次状态文件
    private int checkpointChunks = 32;

    // 进度监控/推送间隔
    private long monitorIntervalMs = 800;

    // 取消时等待工作线程退出的最长时间
    private long cancelWaitMs = 3000;

    // 已完成/已取消任务的结果最多保留多少个，供 awaitResult 查询
    private int retainedResults = 256;
}
