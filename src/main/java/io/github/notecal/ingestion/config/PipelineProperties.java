package io.github.notecal.ingestion.config;

import io.github.notecal.ingestion.domain.model.CandidateFilter;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    @NotBlank
    private String senderAddress = "noreply@remarkable.com";

    @NotBlank
    private String subjectKeyword = "reMarkable Note";

    @Min(1)
    private int maxResults = 100;

    @Min(0)
    @Max(23)
    private int defaultDayStartHour = 9;

    @Min(0)
    @Max(24)
    private int eveningCutoffHour = 17;

    public CandidateFilter defaultFilter() {
        return new CandidateFilter(senderAddress, subjectKeyword, maxResults);
    }
}
