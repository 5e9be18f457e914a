package io.github.notecal.ingestion.client;

import io.github.notecal.ingestion.client.dto.MailMessageResponse;
import io.github.notecal.ingestion.config.InternalApiFeignConfig;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

@FeignClient(
        name = "mail-gateway",
        url = "${app.services.mail-gateway-url}",
        configuration = InternalApiFeignConfig.class
)
public interface MailGatewayClient {
    @GetMapping("/api/internal/messages")
    List<MailMessageResponse> searchMessages(@RequestParam("q") String query,
                                             @RequestParam("maxResults") int maxResults);

    @PostMapping("/api/internal/messages/{id}/read")
    void markAsRead(@PathVariable("id") String id);
}
