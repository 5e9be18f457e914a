package io.github.notecal.ingestion.service.impl;

import io.github.notecal.ingestion.audit.Log;
import io.github.notecal.ingestion.client.MailGatewayClient;
import io.github.notecal.ingestion.client.dto.MailMessageResponse;
import io.github.notecal.ingestion.domain.exception.StorageException;
import io.github.notecal.ingestion.domain.model.Attachment;
import io.github.notecal.ingestion.domain.model.AttachmentRef;
import io.github.notecal.ingestion.domain.model.CandidateFilter;
import io.github.notecal.ingestion.domain.model.SourceItem;
import io.github.notecal.ingestion.service.SourceRetriever;
import io.github.notecal.ingestion.service.StorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class MailGatewaySourceRetriever implements SourceRetriever {

    private final MailGatewayClient mailGatewayClient;
    private final StorageService storageService;

    @Override
    public List<SourceItem> listCandidateItems(CandidateFilter filter) {
        String query = filter.toSearchQuery();
        log.info("Buscando emails com a consulta: {}", query);

        List<MailMessageResponse> messages = mailGatewayClient.searchMessages(query, filter.maxResults());
        if (messages == null) {
            return List.of();
        }

        return messages.stream()
                .filter(message -> message.id() != null && !message.id().isBlank())
                .map(this::toSourceItem)
                .toList();
    }

    @Override
    public List<Attachment> fetchAttachments(SourceItem item) {
        List<Attachment> attachments = new ArrayList<>();
        for (AttachmentRef ref : item.attachments()) {
            try (InputStream inputStream = storageService.downloadFile(ref.objectKey())) {
                attachments.add(new Attachment(ref.filename(), inputStream.readAllBytes()));
            } catch (IOException e) {
                throw new StorageException("Falha ao ler anexo " + ref.filename() + " do email " + item.id(), e);
            }
        }
        return attachments;
    }

    @Override
    public Optional<String> getInlineBody(SourceItem item) {
        return Optional.ofNullable(item.inlineBody()).filter(body -> !body.isBlank());
    }

    @Override
    public boolean markConsumed(String itemId) {
        try {
            mailGatewayClient.markAsRead(itemId);
            return true;
        } catch (Exception e) {
            Log.error(log, "MARK_CONSUMED_FAIL", "Falha ao marcar email " + itemId + " como lido", e);
            return false;
        }
    }

    private SourceItem toSourceItem(MailMessageResponse message) {
        List<AttachmentRef> refs = message.getAttachmentsSafe().stream()
                .filter(a -> a.objectKey() != null)
                .map(a -> new AttachmentRef(a.filename(), a.objectKey()))
                .toList();
        return new SourceItem(message.id(), refs, message.body());
    }
}
