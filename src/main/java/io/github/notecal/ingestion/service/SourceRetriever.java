package io.github.notecal.ingestion.service;

import io.github.notecal.ingestion.domain.model.Attachment;
import io.github.notecal.ingestion.domain.model.CandidateFilter;
import io.github.notecal.ingestion.domain.model.SourceItem;

import java.util.List;
import java.util.Optional;

public interface SourceRetriever {

    List<SourceItem> listCandidateItems(CandidateFilter filter);

    List<Attachment> fetchAttachments(SourceItem item);

    Optional<String> getInlineBody(SourceItem item);

    /**
     * Marca o item como consumido na origem. Nunca lança exceção; falhas retornam {@code false}.
     */
    boolean markConsumed(String itemId);
}
