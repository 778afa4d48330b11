package com.qwen.gateway.scheduler;

import com.qwen.gateway.config.AppProperties;
import com.qwen.gateway.dao.RequestDAO;
import com.qwen.gateway.dao.ResponseDAO;
import com.qwen.gateway.session.ContinuityManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 后台定时任务调度器
 * <p>
 * - 审计记录自动清理
 * - 空闲会话清理
 */
@Component
public class BackgroundScheduler {

    private static final Logger log = LoggerFactory.getLogger(BackgroundScheduler.class);

    private final AppProperties properties;
    private final RequestDAO requestDAO;
    private final ResponseDAO responseDAO;
    private final ContinuityManager continuity;

    public BackgroundScheduler(AppProperties properties, RequestDAO requestDAO,
                               ResponseDAO responseDAO, ContinuityManager continuity) {
        this.properties = properties;
        this.requestDAO = requestDAO;
        this.responseDAO = responseDAO;
        this.continuity = continuity;
    }

    /**
     * 审计记录清理（每天凌晨 3 点）
     */
    @Scheduled(cron = "0 0 3 * * ?")
    public void cleanupAuditRecords() {
        int retention = properties.getLogging().getRequestLogRetention();
        try {
            int requests = requestDAO.cleanup(retention);
            int responses = responseDAO.cleanup(retention);
            if (requests > 0 || responses > 0) {
                log.info("清理审计记录: 请求 {} 条, 响应 {} 条, 保留最近 {} 条", requests, responses, retention);
            }
        } catch (DataAccessException e) {
            log.error("审计记录清理失败", e);
        }
    }

    /**
     * 空闲会话清理（每 5 分钟）
     */
    @Scheduled(fixedDelay = 300000)
    public void evictIdleConversations() {
        Duration maxIdle = Duration.ofMinutes(properties.getSession().getIdleTimeoutMinutes());
        int evicted = continuity.evictIdle(maxIdle);
        if (evicted > 0) {
            log.info("清理空闲会话: {} 个, 剩余 {} 个", evicted, continuity.size());
        }
    }
}
