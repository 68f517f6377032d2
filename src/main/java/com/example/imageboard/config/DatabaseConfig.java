package com.example.imageboard.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * 数据源配置
 * 连接串由 DatabaseUrlResolver 从 DATABASE_URL 归一化而来，连接池用 Spring Boot 默认的 HikariCP。
 */
@Configuration
public class DatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

    @Bean
    public DataSource dataSource(ImageboardProperties properties) {
        DatabaseUrlResolver.ConnectionSettings settings = DatabaseUrlResolver.resolve(properties.getDatabaseUrl());
        log.info("Using database {}", settings.getUrl());

        DataSourceBuilder<?> builder = DataSourceBuilder.create().url(settings.getUrl());
        if (settings.getUsername() != null) {
            builder.username(settings.getUsername());
        }
        if (settings.getPassword() != null) {
            builder.password(settings.getPassword());
        }
        return builder.build();
    }
}
