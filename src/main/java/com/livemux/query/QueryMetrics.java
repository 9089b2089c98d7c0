package com.livemux.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for client requests.
 * Tracks executed and failed queries, query latency, result sizes and forwarded commands.
 */
@Component
public class QueryMetrics {

    private final MeterRegistry meterRegistry;

    private Counter queriesExecuted;
    private Counter queriesFailed;
    private Timer queryLatency;
    private DistributionSummary resultSize;
    private Counter commandsForwarded;

    public QueryMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        initializeMetrics();
    }

    private void initializeMetrics() {
        queriesExecuted = Counter.builder("livemux.query.executed")
            .description("Total number of queries executed")
            .register(meterRegistry);

        queriesFailed = Counter.builder("livemux.query.failed")
            .description("Total number of queries rejected or failed")
            .register(meterRegistry);

        // includes time spent in WaitTrigger
        queryLatency = Timer.builder("livemux.query.latency")
            .description("Latency of multiplexed query execution")
            .publishPercentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        resultSize = DistributionSummary.builder("livemux.query.result.size")
            .description("Distribution of query result sizes (number of rows)")
            .baseUnit("rows")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);

        commandsForwarded = Counter.builder("livemux.command.forwarded")
            .description("Total number of commands forwarded to peers")
            .register(meterRegistry);
    }

    public void recordQueryExecuted() {
        queriesExecuted.increment();
    }

    public void recordQueryFailed() {
        queriesFailed.increment();
    }

    public Timer.Sample startQueryTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordQueryLatency(Timer.Sample sample) {
        sample.stop(queryLatency);
    }

    public void recordResultSize(long size) {
        resultSize.record(size);
    }

    public void recordCommandForwarded() {
        commandsForwarded.increment();
    }

    // Getter methods for testing
    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Timer getQueryLatency() {
        return queryLatency;
    }

    public DistributionSummary getResultSize() {
        return resultSize;
    }

    public Counter getCommandsForwarded() {
        return commandsForwarded;
    }
}
