package io.github.notecal.ingestion.service.impl;

import io.github.notecal.ingestion.client.OcrServiceClient;
import io.github.notecal.ingestion.client.dto.ExtractTextRequest;
import io.github.notecal.ingestion.client.dto.ExtractTextResponse;
import io.github.notecal.ingestion.service.TextExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Base64;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class OcrTextExtractor implements TextExtractor {

    private final OcrServiceClient ocrServiceClient;

    @Override
    public Optional<String> extractText(byte[] content, String mediaKindHint) {
        if (content == null || content.length == 0) {
            return Optional.empty();
        }

        ExtractTextRequest request = new ExtractTextRequest(Base64.getEncoder().encodeToString(content), mediaKindHint);
        ExtractTextResponse response = ocrServiceClient.extractText(request);

        Optional<String> text = Optional.ofNullable(response)
                .map(ExtractTextResponse::text)
                .filter(t -> !t.isBlank());
        log.debug("OCR ({}) retornou {} caracteres.", mediaKindHint, text.map(String::length).orElse(0));
        return text;
    }
}
