package com.livemux.peer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Metrics collector for peer refresh cycles and blocking waits.
 * Refresh meters are tagged with the peer id.
 */
@Component
public class PeerMetrics {

    private final MeterRegistry registry;
    private final Counter waitsSatisfied;
    private final Counter waitsTimedOut;

    public PeerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.waitsSatisfied = Counter.builder("livemux.wait.satisfied")
            .description("Number of waits whose condition became true")
            .register(registry);

        this.waitsTimedOut = Counter.builder("livemux.wait.timedout")
            .description("Number of waits that ran into their timeout")
            .register(registry);
    }

    public Timer.Sample startRefreshTimer() {
        return Timer.start(registry);
    }

    public void recordRefreshLatency(Timer.Sample sample, String peerId) {
        sample.stop(refreshTimer(peerId));
    }

    public void recordRefreshFailed(String peerId) {
        refreshFailures(peerId).increment();
    }

    public void recordWait(boolean satisfied) {
        if (satisfied) {
            waitsSatisfied.increment();
        } else {
            waitsTimedOut.increment();
        }
    }

    public Timer refreshTimer(String peerId) {
        return Timer.builder("livemux.peer.refresh.latency")
            .description("Duration of a full refresh cycle of one peer")
            .tag("peer", peerId)
            .register(registry);
    }

    public Counter refreshFailures(String peerId) {
        return Counter.builder("livemux.peer.refresh.failed")
            .description("Number of failed refresh cycles of one peer")
            .tag("peer", peerId)
            .register(registry);
    }

    public Counter getWaitsSatisfied() {
        return waitsSatisfied;
    }

    public Counter getWaitsTimedOut() {
        return waitsTimedOut;
    }
}
