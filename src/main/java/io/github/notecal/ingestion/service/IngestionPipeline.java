package io.github.notecal.ingestion.service;

import io.github.notecal.ingestion.audit.Log;
import io.github.notecal.ingestion.config.PipelineProperties;
import io.github.notecal.ingestion.domain.exception.ItemProcessingException;
import io.github.notecal.ingestion.domain.exception.LedgerException;
import io.github.notecal.ingestion.domain.model.Attachment;
import io.github.notecal.ingestion.domain.model.CandidateFilter;
import io.github.notecal.ingestion.domain.model.ItemOutcome;
import io.github.notecal.ingestion.domain.model.PipelineStage;
import io.github.notecal.ingestion.domain.model.RunSummary;
import io.github.notecal.ingestion.domain.model.ScheduledTask;
import io.github.notecal.ingestion.domain.model.SourceItem;
import io.github.notecal.ingestion.domain.model.Task;
import io.github.notecal.ingestion.service.schedule.TemporalResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Converte cada email candidato em eventos de agenda, no máximo uma vez.
 * <p>
 * Um item só entra no registro de processados depois que todas as suas tarefas viraram eventos.
 * Falhas de um item não afetam os demais; falhas do registro interrompem a execução.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionPipeline {

    private final SourceRetriever sourceRetriever;
    private final TextExtractor textExtractor;
    private final TaskParser taskParser;
    private final TemporalResolver temporalResolver;
    private final EventMaterializer eventMaterializer;
    private final ProcessedItemLedger ledger;
    private final PipelineProperties properties;
    private final Clock clock;

    public RunSummary run(CandidateFilter filter) {
        LocalDateTime now = LocalDateTime.now(clock);
        String timezone = clock.getZone().getId();

        List<SourceItem> candidates = sourceRetriever.listCandidateItems(filter);
        Log.event(log, "CANDIDATES_FETCHED", "{} emails candidatos encontrados.", candidates.size());

        Set<String> alreadyProcessed = ledger.snapshot();
        log.info("{} emails já processados em execuções anteriores.", alreadyProcessed.size());

        List<ItemOutcome> outcomes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (SourceItem item : candidates) {
            if (!seen.add(item.id())) {
                continue;
            }
            if (!ProcessedItemLedger.isValidId(item.id())) {
                Log.warn(log, "ITEM_INVALID_ID", "Email com id inválido '{}' não pode ser registrado. Ignorando.",
                        item.id());
                outcomes.add(ItemOutcome.failed(item.id(), PipelineStage.FILTER_NEW.name(), 0));
                continue;
            }
            if (alreadyProcessed.contains(item.id())) {
                log.debug("Email {} já processado. Ignorando.", item.id());
                outcomes.add(ItemOutcome.skipped(item.id()));
                continue;
            }
            outcomes.add(processItem(item, now, timezone));
        }

        RunSummary summary = new RunSummary(outcomes);
        Log.event(log, "INGESTION_RUN_COMPLETED",
                "Execução concluída. Processados: {}, falhas: {}, ignorados: {}, eventos criados: {}",
                summary.processed(), summary.failed(), summary.skipped(), summary.eventsCreated());
        return summary;
    }

    private ItemOutcome processItem(SourceItem item, LocalDateTime now, String timezone) {
        MDC.put(Log.ITEM_ID, item.id());
        Log.event(log, "ITEM_STARTED", "Processando email {}", item.id());
        try {
            List<String> texts = inStage(PipelineStage.EXTRACT, () -> extractTexts(item));
            List<Task> tasks = inStage(PipelineStage.PARSE, () -> parseAll(texts));

            if (tasks.isEmpty()) {
                Log.warn(log, "ITEM_NO_TASKS", "Nenhuma tarefa encontrada no email {}. Não será marcado como processado.",
                        item.id());
                return ItemOutcome.failed(item.id(), ItemOutcome.NO_TASKS, 0);
            }

            List<ScheduledTask> scheduled = inStage(PipelineStage.RESOLVE_ALL, () -> resolveAll(tasks, now));

            int created = materializeAll(scheduled, timezone, now);
            if (created < scheduled.size()) {
                Log.warn(log, "ITEM_PARTIAL_MATERIALIZATION",
                        "Apenas {} de {} eventos criados para o email {}. Não será marcado como processado.",
                        created, scheduled.size(), item.id());
                return ItemOutcome.failed(item.id(), PipelineStage.MATERIALIZE_ALL.name(), created);
            }

            boolean consumed = inStage(PipelineStage.COMMIT, () -> sourceRetriever.markConsumed(item.id()));
            if (!consumed) {
                Log.warn(log, "MARK_CONSUMED_FAIL", "Não foi possível marcar o email {} como lido na origem.", item.id());
            }
            inStage(PipelineStage.COMMIT, () -> {
                ledger.commit(item.id());
                return null;
            });

            Log.event(log, "ITEM_COMMITTED", "Email {} processado: {} eventos criados.", item.id(), created);
            return ItemOutcome.processed(item.id(), created);

        } catch (ItemProcessingException e) {
            Log.error(log, "ITEM_FAILED", "Falha no estágio " + e.getStage() + " do email " + item.id(), e);
            return ItemOutcome.failed(item.id(), e.getStage().name(), 0);
        } finally {
            MDC.remove(Log.ITEM_ID);
        }
    }

    private List<String> extractTexts(SourceItem item) {
        List<String> texts = new ArrayList<>();

        if (item.hasAttachments()) {
            List<Attachment> attachments = sourceRetriever.fetchAttachments(item);
            log.info("{} anexos encontrados.", attachments.size());
            for (Attachment attachment : attachments) {
                Optional<String> text = textExtractor.extractText(attachment.content(), attachment.extension());
                if (text.isPresent() && !text.get().isBlank()) {
                    texts.add(text.get());
                } else {
                    log.info("Nenhum texto extraído do anexo {}.", attachment.filename());
                }
            }
        } else {
            log.info("Email sem anexos. Usando o corpo do email.");
            sourceRetriever.getInlineBody(item)
                    .filter(body -> !body.isBlank())
                    .ifPresent(texts::add);
        }
        return texts;
    }

    private List<Task> parseAll(List<String> texts) {
        List<Task> tasks = new ArrayList<>();
        for (String text : texts) {
            tasks.addAll(taskParser.parseTasks(text));
        }
        return tasks;
    }

    private List<ScheduledTask> resolveAll(List<Task> tasks, LocalDateTime now) {
        return tasks.stream()
                .map(task -> new ScheduledTask(task, temporalResolver.resolve(task, now,
                        properties.getDefaultDayStartHour(), properties.getEveningCutoffHour())))
                .toList();
    }

    private int materializeAll(List<ScheduledTask> scheduled, String timezone, LocalDateTime now) {
        int created = 0;
        for (ScheduledTask entry : scheduled) {
            Task task = entry.task();
            boolean ok;
            try {
                ok = eventMaterializer.createEvent(task.summary(), describe(entry, now), entry.window(), timezone);
            } catch (RuntimeException e) {
                Log.error(log, "CALENDAR_EVENT_FAIL", "Erro ao criar evento para a tarefa '" + task.summary() + "'", e);
                ok = false;
            }
            if (ok) {
                created++;
            }
        }
        return created;
    }

    static String describe(ScheduledTask entry, LocalDateTime now) {
        Task task = entry.task();
        StringBuilder description = new StringBuilder()
                .append("Prioridade: ").append(task.priority() != null ? task.priority() : "não informada").append('\n')
                .append("Origem: '").append(task.sourceLine() != null ? task.sourceLine() : "").append("'\n");
        if (task.lineNumber() != null) {
            description.append("(Linha ").append(task.lineNumber()).append(")\n");
        }
        description.append("Processado em ").append(now.toLocalDate());
        if (entry.resolution().needsReview()) {
            description.append('\n')
                    .append("REVISAR: horário sugerido '").append(task.suggestedDateTime())
                    .append("' é inválido; agendado por regra padrão (").append(entry.resolution().branch()).append(").");
        }
        return description.toString();
    }

    private static <T> T inStage(PipelineStage stage, Supplier<T> step) {
        try {
            return step.get();
        } catch (LedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ItemProcessingException(stage, "Falha no estágio " + stage + ": " + e.getMessage(), e);
        }
    }
}
