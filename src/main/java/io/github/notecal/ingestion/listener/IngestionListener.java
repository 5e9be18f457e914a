package io.github.notecal.ingestion.listener;

import io.github.notecal.ingestion.audit.Log;
import io.github.notecal.ingestion.config.PipelineProperties;
import io.github.notecal.ingestion.domain.event.IngestionEvent;
import io.github.notecal.ingestion.domain.event.IngestionRunPayload;
import io.github.notecal.ingestion.domain.exception.LedgerException;
import io.github.notecal.ingestion.domain.model.CandidateFilter;
import io.github.notecal.ingestion.domain.model.RunSummary;
import io.github.notecal.ingestion.service.IngestionPipeline;
import io.github.notecal.ingestion.service.NotificationProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionListener {

    private final IngestionPipeline ingestionPipeline;
    private final NotificationProducer notificationProducer;
    private final PipelineProperties pipelineProperties;

    @RabbitListener(queues = "${app.rabbitmq.queue.ingestion}")
    public void handleIngestionEvent(IngestionEvent event) {
        String runId = event != null && event.messageId() != null ? event.messageId() : UUID.randomUUID().toString();
        MDC.put(Log.RUN_ID, runId);

        CandidateFilter filter = toFilter(event != null ? event.payload() : null);
        Log.event(log, "INGESTION_RUN_STARTED", "Iniciando execução de ingestão {} (remetente: {}, assunto: {})",
                runId, filter.senderAddress(), filter.subjectKeyword());

        try {
            RunSummary summary = ingestionPipeline.run(filter);
            notificationProducer.sendRunSummary(runId, summary);
        } catch (LedgerException e) {
            Log.error(log, "INGESTION_RUN_FAILED", "Registro de processados indisponível. Execução abortada.", e);
            notificationProducer.sendError(runId, "LEDGER_UNAVAILABLE", e.getMessage());
        } catch (Exception e) {
            Log.error(log, "INGESTION_RUN_FAILED", "Erro fatal na execução de ingestão", e);
            notificationProducer.sendError(runId, "INTERNAL_ERROR", "Erro na execução de ingestão: " + e.getMessage());
        } finally {
            MDC.clear();
        }
    }

    private CandidateFilter toFilter(IngestionRunPayload payload) {
        CandidateFilter defaults = pipelineProperties.defaultFilter();
        if (payload == null) {
            return defaults;
        }
        return new CandidateFilter(
                payload.senderAddress() != null ? payload.senderAddress() : defaults.senderAddress(),
                payload.subjectKeyword() != null ? payload.subjectKeyword() : defaults.subjectKeyword(),
                payload.maxResults() != null && payload.maxResults() > 0 ? payload.maxResults() : defaults.maxResults()
        );
    }
}
