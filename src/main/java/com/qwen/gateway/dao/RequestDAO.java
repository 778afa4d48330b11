package com.qwen.gateway.dao;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * 轮次请求 DAO（客户端请求 + 后端请求）
 */
@Component
public class RequestDAO {

    private final JdbcTemplate jdbc;

    public RequestDAO(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(String turnId, String conversationId, String model, boolean stream,
                       String clientRequest, String backendRequest) {
        String now = Instant.now().toString();
        jdbc.update("""
                        INSERT OR REPLACE INTO requests (turn_id, conversation_id, timestamp, model, stream,
                            client_request, backend_request, created_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                turnId, conversationId, now, model, stream ? 1 : 0,
                clientRequest, backendRequest, now);
    }

    /**
     * 查询某个会话下的所有请求
     */
    public List<RequestRow> findByConversationId(String conversationId) {
        return jdbc.query(
                "SELECT * FROM requests WHERE conversation_id = ? ORDER BY id ASC",
                REQUEST_ROW_MAPPER, conversationId);
    }

    public int cleanup(int retention) {
        return jdbc.update(
                "DELETE FROM requests WHERE id NOT IN (SELECT id FROM requests ORDER BY id DESC LIMIT ?)",
                retention);
    }

    private static final RowMapper<RequestRow> REQUEST_ROW_MAPPER = (rs, rowNum) -> new RequestRow(
            rs.getInt("id"), rs.getString("turn_id"), rs.getString("conversation_id"),
            rs.getString("timestamp"), rs.getString("model"), rs.getInt("stream") == 1,
            rs.getString("client_request"), rs.getString("backend_request")
    );

    public record RequestRow(int id, String turnId, String conversationId, String timestamp,
                             String model, boolean stream, String clientRequest, String backendRequest) {}
}
