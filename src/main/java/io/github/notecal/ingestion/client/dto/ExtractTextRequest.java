package io.github.notecal.ingestion.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExtractTextRequest(
        @JsonProperty("content_base64") String contentBase64,
        @JsonProperty("media_kind") String mediaKind
) { }
