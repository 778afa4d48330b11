package com.qwen.gateway.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * SQLite 数据库初始化
 */
@Component
public class DatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

    private final AppProperties properties;
    private final JdbcTemplate jdbc;

    public DatabaseConfig(AppProperties properties, JdbcTemplate jdbc) {
        this.properties = properties;
        this.jdbc = jdbc;
    }

    @PostConstruct
    public void init() {
        String dbPath = properties.getDatabase().getPath();
        Path parent = Path.of(dbPath).toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new IllegalStateException("无法创建数据库目录: " + parent, e);
            }
        }

        initSchema();
        log.info("SQLite 数据库初始化完成: {}", dbPath);
    }

    private void initSchema() {
        try (InputStream is = getClass().getResourceAsStream("/schema.sql")) {
            if (is == null) {
                throw new IllegalStateException("未找到 schema.sql");
            }
            String sql = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            for (String s : sql.split(";")) {
                String trimmed = s.trim();
                if (!trimmed.isEmpty()) {
                    jdbc.execute(trimmed);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("初始化数据库 schema 失败", e);
        }
    }
}
