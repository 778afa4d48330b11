package com.qwen.gateway.dao;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * 轮次结果 DAO
 */
@Component
public class ResponseDAO {

    private final JdbcTemplate jdbc;

    public ResponseDAO(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(String turnId, String clientResponse, String tailPointer,
                       int promptTokens, int completionTokens, int totalTokens,
                       long durationMs, String error) {
        String now = Instant.now().toString();
        jdbc.update("""
                        INSERT OR REPLACE INTO responses (turn_id, timestamp, client_response, tail_pointer,
                            prompt_tokens, completion_tokens, total_tokens, duration_ms, error, created_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                turnId, now, clientResponse, tailPointer,
                promptTokens, completionTokens, totalTokens, durationMs, error, now);
    }

    public ResponseRow findByTurnId(String turnId) {
        List<ResponseRow> list = jdbc.query(
                "SELECT * FROM responses WHERE turn_id = ?",
                RESPONSE_ROW_MAPPER, turnId);
        return list.isEmpty() ? null : list.get(0);
    }

    public int cleanup(int retention) {
        return jdbc.update(
                "DELETE FROM responses WHERE id NOT IN (SELECT id FROM responses ORDER BY id DESC LIMIT ?)",
                retention);
    }

    private static final RowMapper<ResponseRow> RESPONSE_ROW_MAPPER = (rs, rowNum) -> new ResponseRow(
            rs.getInt("id"), rs.getString("turn_id"), rs.getString("timestamp"),
            rs.getString("client_response"), rs.getString("tail_pointer"),
            rs.getInt("prompt_tokens"), rs.getInt("completion_tokens"), rs.getInt("total_tokens"),
            rs.getLong("duration_ms"), rs.getString("error")
    );

    public record ResponseRow(int id, String turnId, String timestamp, String clientResponse,
                              String tailPointer, int promptTokens, int completionTokens, int totalTokens,
                              long durationMs, String error) {}
}
