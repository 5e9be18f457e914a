package io.github.notecal.ingestion.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

public record MailMessageResponse(
        String id,
        String body,
        List<AttachmentItem> attachments
) {
    public record AttachmentItem(
            String filename,
            @JsonProperty("object_key") String objectKey
    ) {}

    public List<AttachmentItem> getAttachmentsSafe() {
        return attachments == null ? Collections.emptyList() : attachments;
    }
}
