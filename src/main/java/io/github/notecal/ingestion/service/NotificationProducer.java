package io.github.notecal.ingestion.service;

import io.github.notecal.ingestion.domain.event.NotificationEvent;
import io.github.notecal.ingestion.domain.event.NotificationPayload;
import io.github.notecal.ingestion.domain.model.RunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationProducer {

    private final RabbitTemplate rabbitTemplate;

    @Value("${app.rabbitmq.notifications.exchange}")
    private String exchange;

    @Value("${app.rabbitmq.notifications.routing-key}")
    private String routingKey;

    public void sendRunSummary(String runId, RunSummary summary) {
        NotificationEvent event = NotificationEvent.create(
                "NOTE_INGESTION_COMPLETED",
                runId,
                NotificationPayload.fromSummary(summary)
        );

        publish(event);
    }

    public void sendError(String runId, String errorCode, String errorMessage) {
        NotificationEvent event = NotificationEvent.create(
                "NOTE_INGESTION_FAILED",
                runId,
                NotificationPayload.error(errorCode, errorMessage)
        );

        publish(event);
    }

    private void publish(NotificationEvent event) {
        try {
            log.info("Enviando notificação: Type={} Status={}", event.eventType(), event.payload().status());
            rabbitTemplate.convertAndSend(exchange, routingKey, event);
        } catch (Exception e) {
            log.error("Falha ao publicar evento de notificação", e);
        }
    }
}
