package com.qwen.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class QwenGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(QwenGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(QwenGatewayApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("╔═══════════════════════════════════════════════════╗");
        log.info("║           Qwen Gateway Java v1.0.0                ║");
        log.info("║        OpenAI Compatible Tool-Call Gateway        ║");
        log.info("╚═══════════════════════════════════════════════════╝");
        log.info("API 端点:");
        log.info("  POST /v1/chat/completions");
        log.info("  GET  /v1/models");
        log.info("  GET  /health");
        log.info("  GET  /metrics");
    }
}
