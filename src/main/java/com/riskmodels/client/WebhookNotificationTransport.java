package com.riskmodels.client;

import com.riskmodels.dto.NotificationMessage;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Posts notifications as JSON to a chat/incident webhook. With no URL configured the message
 * is only written to the log.
 */
@Slf4j
@Component
public class WebhookNotificationTransport implements NotificationTransport {

    @Value("${lifecycle.notification.webhook-url:}")
    private String webhookUrl;

    @Value("${lifecycle.notification.timeout-seconds:5}")
    private int timeoutSeconds;

    private WebClient webClient;

    @PostConstruct
    void init() {
        if (webhookUrl != null && !webhookUrl.isBlank()) {
            webClient = WebClient.builder()
                .baseUrl(webhookUrl)
                .defaultHeader("Content-Type", "application/json")
                .build();
            log.info("WebhookNotificationTransport initialised → {}", webhookUrl);
        } else {
            log.info("WebhookNotificationTransport has no webhook-url; notifications are logged only");
        }
    }

    @Override
    public void send(NotificationMessage message) {
        if (webClient == null) {
            log.info("NOTIFICATION | type={} | model={} | {}\n{}",
                     message.getType(), message.getModelName(), message.getSubject(), message.getBody());
            return;
        }
        webClient.post()
            .bodyValue(message)
            .retrieve()
            .toBodilessEntity()
            .block(Duration.ofSeconds(timeoutSeconds));
    }
}
