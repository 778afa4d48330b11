package com.qwen.gateway.auth;

import com.qwen.gateway.config.AppProperties;
import com.qwen.gateway.dao.CredentialsDAO;
import com.qwen.gateway.exception.CredentialsMissingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * 凭证服务
 * <p>
 * 优先使用数据库中最新且未过期的凭证，其次使用配置文件
 */
@Component
public class CredentialsService implements CredentialsProvider {

    private static final Logger log = LoggerFactory.getLogger(CredentialsService.class);

    private final CredentialsDAO credentialsDAO;
    private final AppProperties properties;

    public CredentialsService(CredentialsDAO credentialsDAO, AppProperties properties) {
        this.credentialsDAO = credentialsDAO;
        this.properties = properties;
    }

    @Override
    public BackendCredentials current() {
        BackendCredentials credentials = lookup();
        if (credentials == null) {
            throw new CredentialsMissingException();
        }
        return credentials;
    }

    @Override
    public String status() {
        BackendCredentials credentials = lookup();
        return credentials != null ? credentials.source() : "missing";
    }

    private BackendCredentials lookup() {
        AppProperties.BackendConfig backend = properties.getBackend();

        CredentialsDAO.CredentialsRow row = findLatestRow();
        if (row != null && !isBlank(row.token()) && !isExpired(row)) {
            return new BackendCredentials(backend.getBaseUrl(), row.token(), row.cookies(),
                    backend.getUserAgent(), "database");
        }

        if (!isBlank(backend.getToken()) || !isBlank(backend.getCookies())) {
            return new BackendCredentials(backend.getBaseUrl(), backend.getToken(), backend.getCookies(),
                    backend.getUserAgent(), "config");
        }
        return null;
    }

    private CredentialsDAO.CredentialsRow findLatestRow() {
        try {
            return credentialsDAO.findLatest();
        } catch (DataAccessException e) {
            log.warn("读取数据库凭证失败，回退到配置: {}", e.getMessage());
            return null;
        }
    }

    private boolean isExpired(CredentialsDAO.CredentialsRow row) {
        try {
            boolean expired = row.isExpired(Instant.now());
            if (expired) {
                log.warn("数据库凭证已过期: id={}, expiresAt={}", row.id(), row.expiresAt());
            }
            return expired;
        } catch (DateTimeParseException e) {
            log.warn("凭证过期时间格式错误，按未过期处理: id={}, expiresAt={}", row.id(), row.expiresAt());
            return false;
        }
    }

    private boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
