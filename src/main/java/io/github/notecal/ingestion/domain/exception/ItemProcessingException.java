package io.github.notecal.ingestion.domain.exception;

import io.github.notecal.ingestion.domain.model.PipelineStage;
import lombok.Getter;

@Getter
public class ItemProcessingException extends RuntimeException {

    private final PipelineStage stage;

    public ItemProcessingException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }
}
