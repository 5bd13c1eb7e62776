package com.whereq.triage.metrics;

import com.whereq.triage.model.PerformanceAnalysis;
import com.whereq.triage.model.QueueAssignment;
import com.whereq.triage.model.QueueTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Micrometer meters for queue assignment and queue health
 */
@Slf4j
@Component
public class QueueMetrics {

    private final MeterRegistry meterRegistry;
    private final Timer assignmentTimer;
    private final Map<QueueTier, AtomicReference<Double>> loadByQueue = new EnumMap<>(QueueTier.class);
    private final Map<QueueTier, AtomicReference<Double>> healthByQueue = new EnumMap<>(QueueTier.class);

    public QueueMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        assignmentTimer = Timer.builder("triage.assignment.time")
            .description("Time spent classifying and enqueueing an analysis job")
            .register(meterRegistry);

        for (QueueTier queue : QueueTier.values()) {
            AtomicReference<Double> load = new AtomicReference<>(0.0);
            AtomicReference<Double> health = new AtomicReference<>(1.0);
            loadByQueue.put(queue, load);
            healthByQueue.put(queue, health);

            Gauge.builder("triage.queue.load", load, AtomicReference::get)
                .description("Load factor observed by the last optimisation cycle")
                .tag("queue", queue.getQueueName())
                .register(meterRegistry);

            Gauge.builder("triage.queue.health", health, AtomicReference::get)
                .description("Health score observed by the last optimisation cycle")
                .tag("queue", queue.getQueueName())
                .register(meterRegistry);
        }
    }

    /**
     * Count an assignment, tagged by final queue and adjustment reason
     */
    public void recordAssignment(QueueAssignment assignment) {
        Counter.builder("triage.assignments")
            .description("Number of analysis jobs assigned to a queue")
            .tag("queue", assignment.getQueue().getQueueName())
            .tag("reason", assignment.getQueueAdjustment().getReason().wireName())
            .register(meterRegistry)
            .increment();

        if (assignment.getAssignmentTime() != null) {
            assignmentTimer.record(assignment.getAssignmentTime());
        }
    }

    public void recordLoad(QueueTier queue, double load) {
        loadByQueue.get(queue).set(load);
    }

    public void recordHealth(PerformanceAnalysis analysis) {
        analysis.getIndividualQueues().forEach((queue, report) ->
            healthByQueue.get(queue).set(report.getHealthScore()));
    }

    public double lastLoad(QueueTier queue) {
        return loadByQueue.get(queue).get();
    }

    public double lastHealth(QueueTier queue) {
        return healthByQueue.get(queue).get();
    }
}
