package com.example.rangedownloader.core;

import com.example.rangedownloader.config.EngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpHost;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;

/**
 * HTTP客户端工厂
 * <p>
 * 负责创建探测用和下载用的HTTP客户端，支持代理配置
 * </p>
 */
@Slf4j
public class HttpClientFactory {

    private final EngineProperties properties;

    public HttpClientFactory(EngineProperties properties) {
        this.properties = properties;
    }

    /**
     * 创建探测文件信息用的客户端（超时较宽松）
     */
    public CloseableHttpClient createProbeClient() {
        return builder(properties.getProbeConnectTimeoutMs(), properties.getProbeSocketTimeoutMs()).build();
    }

    /**
     * 创建一次下载运行内所有工作线程共享的客户端
     * <p>
     * 连接池大小与线程数一致，超时较短，卡住的连接会尽快失败并重新入队
     * </p>
     *
     * @param threads 工作线程数
     */
    public CloseableHttpClient createWorkerClient(int threads) {
        PoolingHttpClientConnectionManager manager = new PoolingHttpClientConnectionManager();
        manager.setMaxTotal(threads);
        manager.setDefaultMaxPerRoute(threads);
        return builder(properties.getConnectTimeoutMs(), properties.getSocketTimeoutMs())
                .setConnectionManager(manager)
                .build();
    }

    private HttpClientBuilder builder(int connectTimeout, int socketTimeout) {
        RequestConfig.Builder config = RequestConfig.custom()
                .setConnectTimeout(connectTimeout)
                .setConnectionRequestTimeout(connectTimeout)
                .setSocketTimeout(socketTimeout)
                .setRedirectsEnabled(true);

        String proxyHost = properties.getProxyHost();
        Integer proxyPort = properties.getProxyPort();
        if (proxyHost != null && proxyPort != null) {
            config.setProxy(new HttpHost(proxyHost, proxyPort));
            log.info("使用 HTTP 代理: {}:{}", proxyHost, proxyPort);
        }

        return HttpClients.custom()
                .setUserAgent(properties.getUserAgent())
                .setDefaultRequestConfig(config.build());
    }
}
