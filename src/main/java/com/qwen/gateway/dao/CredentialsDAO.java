package com.qwen.gateway.dao;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Qwen 凭证 DAO
 */
@Component
public class CredentialsDAO {

    private final JdbcTemplate jdbc;

    public CredentialsDAO(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * 最新一条凭证
     *
     * @return 没有记录返回 null
     */
    public CredentialsRow findLatest() {
        List<CredentialsRow> list = jdbc.query(
                "SELECT * FROM qwen_credentials ORDER BY updated_at DESC, id DESC LIMIT 1",
                CREDENTIALS_ROW_MAPPER);
        return list.isEmpty() ? null : list.get(0);
    }

    public void insert(String token, String cookies, String expiresAt) {
        String now = Instant.now().toString();
        jdbc.update(
                "INSERT INTO qwen_credentials (token, cookies, expires_at, created_at, updated_at) VALUES (?, ?, ?, ?, ?)",
                token, cookies, expiresAt, now, now);
    }

    private static final RowMapper<CredentialsRow> CREDENTIALS_ROW_MAPPER = (rs, rowNum) -> new CredentialsRow(
            rs.getInt("id"), rs.getString("token"), rs.getString("cookies"),
            rs.getString("expires_at"), rs.getString("updated_at")
    );

    public record CredentialsRow(int id, String token, String cookies, String expiresAt, String updatedAt) {

        /**
         * expires_at 为 ISO-8601 时间，空表示不过期
         */
        public boolean isExpired(Instant now) {
            if (expiresAt == null || expiresAt.isBlank()) return false;
            return Instant.parse(expiresAt).isBefore(now);
        }
    }
}
