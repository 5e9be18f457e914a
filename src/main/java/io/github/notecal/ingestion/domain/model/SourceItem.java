package io.github.notecal.ingestion.domain.model;

import java.util.List;
import java.util.Objects;

public record SourceItem(
        String id,
        List<AttachmentRef> attachments,
        String inlineBody
) {
    public SourceItem {
        Objects.requireNonNull(id, "id");
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public boolean hasAttachments() {
        return !attachments.isEmpty();
    }
}
