package io.github.notecal.ingestion.listener;

import io.github.notecal.ingestion.config.PipelineProperties;
import io.github.notecal.ingestion.domain.event.IngestionEvent;
import io.github.notecal.ingestion.domain.event.IngestionRunPayload;
import io.github.notecal.ingestion.domain.exception.LedgerException;
import io.github.notecal.ingestion.domain.model.CandidateFilter;
import io.github.notecal.ingestion.domain.model.ItemOutcome;
import io.github.notecal.ingestion.domain.model.RunSummary;
import io.github.notecal.ingestion.service.IngestionPipeline;
import io.github.notecal.ingestion.service.NotificationProducer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionListenerTest {

    @Mock
    private IngestionPipeline ingestionPipeline;

    @Mock
    private NotificationProducer notificationProducer;

    private IngestionListener listener;

    @BeforeEach
    void setUp() {
        listener = new IngestionListener(ingestionPipeline, notificationProducer, new PipelineProperties());
    }

    @Test
    void runsWithConfiguredDefaultsWhenPayloadIsMissing() {
        RunSummary summary = new RunSummary(List.of(ItemOutcome.processed("m1", 2)));
        CandidateFilter defaults = new CandidateFilter("noreply@remarkable.com", "reMarkable Note", 100);
        when(ingestionPipeline.run(defaults)).thenReturn(summary);

        listener.handleIngestionEvent(event("run-1", null));

        verify(notificationProducer).sendRunSummary("run-1", summary);
        assertThat(MDC.get("run.id")).isNull();
    }

    @Test
    void payloadOverridesTheFilter() {
        CandidateFilter expected = new CandidateFilter("me@example.com", "Scan", 100);
        when(ingestionPipeline.run(expected)).thenReturn(new RunSummary(List.of()));

        listener.handleIngestionEvent(event("run-2", new IngestionRunPayload("me@example.com", "Scan", null)));

        verify(ingestionPipeline).run(expected);
    }

    @Test
    void ledgerFailureIsReportedAsRunFailure() {
        when(ingestionPipeline.run(any())).thenThrow(new LedgerException("disk gone"));

        listener.handleIngestionEvent(event("run-3", null));

        verify(notificationProducer).sendError("run-3", "LEDGER_UNAVAILABLE", "disk gone");
        verify(notificationProducer, never()).sendRunSummary(anyString(), any());
    }

    @Test
    void runFailureIsReportedAsInternalErrorWithNeutralMessage() {
        when(ingestionPipeline.run(any())).thenThrow(new IllegalStateException("gateway unreachable"));

        listener.handleIngestionEvent(event("run-4", null));

        verify(notificationProducer).sendError(
                "run-4", "INTERNAL_ERROR", "Erro na execução de ingestão: gateway unreachable");
    }

    private static IngestionEvent event(String id, IngestionRunPayload payload) {
        return new IngestionEvent(id, OffsetDateTime.now(), "scheduler", "NOTE_INGESTION_REQUESTED", payload);
    }
}
