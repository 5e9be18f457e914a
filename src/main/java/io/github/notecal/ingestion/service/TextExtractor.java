package io.github.notecal.ingestion.service;

import java.util.Optional;

public interface TextExtractor {
    Optional<String> extractText(byte[] content, String mediaKindHint);
}
