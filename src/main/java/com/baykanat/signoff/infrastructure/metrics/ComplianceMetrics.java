package com.baykanat.signoff.infrastructure.metrics;

import com.baykanat.signoff.domain.engine.ComplianceReport;
import com.baykanat.signoff.domain.engine.PipelineResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/** Rapor koşuları ve signoff ingestion için Micrometer metrikleri. */
@Component
public class ComplianceMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter runSucceededCounter;
    private final Counter runFailedCounter;
    private final Timer runTimer;
    private final Counter eventsAppendedCounter;
    private final Counter eventsDuplicateCounter;
    private final Counter eventsDeadLetteredCounter;

    public ComplianceMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.runSucceededCounter = Counter.builder("compliance.runs")
                .description("Completed compliance report runs")
                .tag("status", "succeeded")
                .register(meterRegistry);

        this.runFailedCounter = Counter.builder("compliance.runs")
                .description("Failed compliance report runs")
                .tag("status", "failed")
                .register(meterRegistry);

        this.runTimer = Timer.builder("compliance.run.duration")
                .description("Time taken to load the snapshot, compute and persist all four reports")
                .register(meterRegistry);

        this.eventsAppendedCounter = Counter.builder("signoff.events.ingested")
                .description("Signoff events appended to the event store")
                .tag("result", "appended")
                .register(meterRegistry);

        this.eventsDuplicateCounter = Counter.builder("signoff.events.ingested")
                .description("Signoff events skipped by inbox deduplication")
                .tag("result", "duplicate")
                .register(meterRegistry);

        this.eventsDeadLetteredCounter = Counter.builder("signoff.events.ingested")
                .description("Signoff records routed to the dead letter topic")
                .tag("result", "dead_lettered")
                .register(meterRegistry);
    }

    /** Başarılı koşu: süre, pipeline başına üretilen satır ve sebep bazında düşen satır. */
    public void recordRunSucceeded(ComplianceReport report, Duration duration) {
        runSucceededCounter.increment();
        runTimer.record(duration);

        for (PipelineResult<?> result : report.results()) {
            String pipeline = result.getType().getPath();
            DistributionSummary.builder("compliance.rows.emitted")
                    .description("Rows emitted per report pipeline and run")
                    .tag("pipeline", pipeline)
                    .register(meterRegistry)
                    .record(result.getRows().size());

            for (Map.Entry<String, Integer> drop : result.getDrops().asMap().entrySet()) {
                Counter.builder("compliance.rows.dropped")
                        .description("Rows dropped by inner-join semantics or invalid input")
                        .tag("pipeline", pipeline)
                        .tag("reason", drop.getKey().toLowerCase(Locale.ROOT))
                        .register(meterRegistry)
                        .increment(drop.getValue());
            }
        }
    }

    public void recordRunFailed(Duration duration) {
        runFailedCounter.increment();
        runTimer.record(duration);
    }

    public void recordIngested(int appended, int duplicates) {
        eventsAppendedCounter.increment(appended);
        eventsDuplicateCounter.increment(duplicates);
    }

    public void recordDeadLettered() {
        eventsDeadLetteredCounter.increment();
    }
}
