package com.whereq.triage.alert;

import com.whereq.triage.config.TriageProperties;
import com.whereq.triage.model.OptimizationResult;
import com.whereq.triage.model.PerformanceAnalysis;
import com.whereq.triage.model.QueueStatistics;
import com.whereq.triage.model.QueueTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends queue health issues and periodic reports to the monitoring webhook.
 * Delivery failures are logged and never fail the caller.
 */
@Slf4j
@Service
public class HealthAlertNotifier {

    private final WebClient.Builder webClientBuilder;
    private final Clock clock;
    private final String webhookUrl;
    private final Duration timeout;

    public HealthAlertNotifier(WebClient.Builder webClientBuilder, Clock clock, TriageProperties properties) {
        this.webClientBuilder = webClientBuilder;
        this.clock = clock;
        this.webhookUrl = properties.getAlerts().getWebhookUrl();
        this.timeout = properties.getAlerts().getTimeout();
    }

    /**
     * Report a queue whose health dropped below the alert threshold
     *
     * @param queue the queue
     * @param healthScore current health score
     * @param stats statistics the score was computed from
     * @return Mono that completes when the alert was handled
     */
    public Mono<Void> notifyQueueHealthIssue(QueueTier queue, double healthScore, QueueStatistics stats) {
        log.warn("Queue health issue: {} score={} pending={} failed={}",
            queue, String.format("%.2f", healthScore), stats.getPendingJobs(), stats.getFailedJobs());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "queue_health_issue");
        payload.put("queue", queue.getQueueName());
        payload.put("healthScore", healthScore);
        payload.put("stats", stats);
        payload.put("timestamp", clock.millis());

        return post(payload);
    }

    /**
     * Publish the result of a periodic optimisation cycle
     *
     * @param analysis performance analysis
     * @param optimization optimisation result
     * @return Mono that completes when the report was handled
     */
    public Mono<Void> publishReport(PerformanceAnalysis analysis, OptimizationResult optimization) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "queue_optimization_report");
        payload.put("performanceAnalysis", analysis);
        payload.put("optimizationResults", optimization);
        payload.put("timestamp", clock.millis());

        return post(payload);
    }

    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    private Mono<Void> post(Map<String, Object> payload) {
        if (!isEnabled()) {
            return Mono.empty();
        }

        return webClientBuilder.build()
            .post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .toBodilessEntity()
            .timeout(timeout)
            .doOnSuccess(response -> log.info("Alert webhook delivered {}: {}",
                payload.get("type"), response.getStatusCode()))
            .doOnError(error -> log.error("Failed to deliver alert webhook {}: {}",
                payload.get("type"), error.getMessage()))
            .onErrorResume(e -> Mono.empty())
            .then();
    }
}
