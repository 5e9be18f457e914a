package io.github.notecal.ingestion.client;

import io.github.notecal.ingestion.client.dto.ExtractTextRequest;
import io.github.notecal.ingestion.client.dto.ExtractTextResponse;
import io.github.notecal.ingestion.config.InternalApiFeignConfig;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

@FeignClient(
        name = "ocr-service",
        url = "${app.services.ocr-url}",
        configuration = InternalApiFeignConfig.class
)
public interface OcrServiceClient {
    @PostMapping("/api/internal/ocr/extract")
    ExtractTextResponse extractText(@RequestBody ExtractTextRequest request);
}
