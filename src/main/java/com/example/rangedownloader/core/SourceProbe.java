package com.example.rangedownloader.core;

import com.example.rangedownloader.error.DownloadException;
import com.example.rangedownloader.error.ErrorKind;
import com.example.rangedownloader.model.SourceInfo;
import com.example.rangedownloader.util.FileUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.Header;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpHead;
import org.apache.http.impl.client.CloseableHttpClient;

import java.io.IOException;

/**
 * 下载源探测
 * <p>
 * 先发 HEAD，拿不到大小或无法确认 Range 支持时再发 {@code Range: bytes=0-0} 的 GET。
 * 大小未知或不支持 Range 时在下载开始前直接报错。
 * </p>
 */
@Slf4j
public class SourceProbe {

    private final HttpClientFactory httpClientFactory;

    public SourceProbe(HttpClientFactory httpClientFactory) {
        this.httpClientFactory = httpClientFactory;
    }

    public SourceInfo probe(String url) {
        SourceInfo info = new SourceInfo();
        try (CloseableHttpClient client = httpClientFactory.createProbeClient()) {
            // 1. 尝试 HEAD
            HttpHead head = new HttpHead(url);
            try (CloseableHttpResponse response = client.execute(head)) {
                if (response.getStatusLine().getStatusCode() == HttpStatus.SC_OK) {
                    parseResponseHeaders(response, info);
                }
            } catch (IOException e) {
                // HEAD 失败尝试 GET (部分服务器禁用了 HEAD)
                log.debug("HEAD 请求失败，改用 GET 探测: {}", e.toString());
            }

            // 2. 没拿到大小或不确定是否支持 Range 时，用 Range: 0-0 探测
            if (info.getTotalSize() <= 0 || !info.isSupportRange()) {
                HttpGet get = new HttpGet(url);
                get.addHeader(HttpHeaders.RANGE, "bytes=0-0");
                try (CloseableHttpResponse response = client.execute(get)) {
                    int status = response.getStatusLine().getStatusCode();
                    if (status == HttpStatus.SC_PARTIAL_CONTENT) {
                        info.setSupportRange(true);
                        parseResponseHeaders(response, info);
                    } else if (status == HttpStatus.SC_OK) {
                        parseResponseHeaders(response, info);
                    } else {
                        throw new DownloadException(ErrorKind.NETWORK, "服务器返回错误: " + status);
                    }
                }
            }
        } catch (IOException e) {
            throw new DownloadException(ErrorKind.NETWORK, "无法访问 " + url + ": " + e.getMessage(), e);
        }

        if (info.getTotalSize() <= 0) {
            throw new DownloadException(ErrorKind.PARSE, "服务器未返回文件大小(Content-Length): " + url);
        }
        if (!info.isSupportRange()) {
            throw DownloadException.config("服务器不支持 Range 请求，无法分片下载: " + url);
        }
        if (info.getFileName() == null) {
            info.setFileName(FileUtils.extractFileNameFromUrl(url));
        }
        log.info("探测完成 {}: 大小 {}, 文件名 {}", url, info.getTotalSize(), info.getFileName());
        return info;
    }

    private void parseResponseHeaders(CloseableHttpResponse response, SourceInfo info) {
        Header lenHeader = response.getFirstHeader(HttpHeaders.CONTENT_LENGTH);
        Header rangeHeader = response.getFirstHeader(HttpHeaders.ACCEPT_RANGES);
        Header contentRange = response.getFirstHeader(HttpHeaders.CONTENT_RANGE);
        Header disposition = response.getFirstHeader("Content-Disposition");

        try {
            // Range 0-0 返回 Content-Range: bytes 0-0/12345 时总长是 12345
            if (contentRange != null) {
                String val = contentRange.getValue();
                int slash = val.lastIndexOf('/');
                String total = slash > 0 ? val.substring(slash + 1).trim() : "*";
                if (!"*".equals(total)) {
                    info.setTotalSize(Long.parseLong(total));
                }
            } else if (lenHeader != null) {
                info.setTotalSize(Long.parseLong(lenHeader.getValue().trim()));
            }
        } catch (NumberFormatException e) {
            throw new DownloadException(ErrorKind.PARSE, "无法解析文件大小: "
                    + (contentRange != null ? contentRange.getValue() : lenHeader.getValue()), e);
        }

        if (rangeHeader != null) {
            info.setSupportRange("bytes".equalsIgnoreCase(rangeHeader.getValue().trim()));
        }

        if (disposition != null && info.getFileName() == null) {
            info.setFileName(FileUtils.fileNameFromDisposition(disposition.getValue()));
        }
    }
}
