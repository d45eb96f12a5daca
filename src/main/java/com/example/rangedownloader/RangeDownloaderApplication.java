package com.example.rangedownloader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动类
 * <p>
 * 可断点续传的多线程分片下载器应用入口
 * </p>
 */
@EnableScheduling
@SpringBootApplication
public class RangeDownloaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(RangeDownloaderApplication.class, args);
    }
}
