package com.example.imageboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Spring Boot 应用的主启动类
 * 组件扫描从 com.example.imageboard 开始，Controller / Service / Repository 都放在它的子包下。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ImageboardApplication {

    public static void main(String[] args) {
        // 端口来自环境变量 PORT (默认 5000)，见 application.properties
        SpringApplication.run(ImageboardApplication.class, args);
    }

    /**
     * 统一的 UTC 时钟，发帖和顶帖的时间都从这里取
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
