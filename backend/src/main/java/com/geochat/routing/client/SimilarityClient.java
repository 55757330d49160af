package com.geochat.routing.client;

import com.geochat.routing.config.RoutingProperties;
import com.geochat.routing.model.SimilarityRequest;
import com.geochat.routing.model.SimilarityResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class SimilarityClient implements SimilarityScorer {

    private final WebClient webClient;
    private final RoutingProperties.Semantic settings;

    public SimilarityClient(RoutingProperties properties, WebClient.Builder webClientBuilder) {
        this.settings = properties.getSemantic();
        this.webClient = webClientBuilder
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(1024 * 1024))
                .build();
    }

    @Override
    public boolean isConfigured() {
        return settings.isEnabled() && settings.getUrl() != null && !settings.getUrl().isBlank();
    }

    @Override
    public Map<String, Double> score(String query, List<String> candidateIds) {
        if (!isConfigured()) {
            throw new IllegalStateException("Similarity backend is not configured");
        }
        log.debug("Requesting similarity for {} candidates", candidateIds.size());

        SimilarityResponse response = webClient.post()
                .uri(settings.getUrl())
                .bodyValue(new SimilarityRequest(query, candidateIds))
                .retrieve()
                .bodyToMono(SimilarityResponse.class)
                .timeout(Duration.ofMillis(settings.getTimeoutMs()))
                .block();

        if (response == null || response.getScores() == null) {
            throw new IllegalStateException("Similarity backend returned no scores");
        }
        return response.getScores();
    }
}
