package com.livemux.peer;

import com.livemux.query.WaitTriggers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Blocking-wait support of one peer.
 *
 * Waiters are registered per trigger name. Each waiter moves from ARMED to exactly one of
 * SATISFIED or TIMED_OUT; the transition is a compare-and-set so a refresh and a timeout
 * racing each other cannot both win. The condition is checked once on arming and again
 * after every refresh cycle whose tables the trigger watches. Waiting holds no lock and
 * no thread: each waiter is a Reactor timer plus a one-shot sink.
 */
public class WaitCoordinator {

    private static final Logger log = LoggerFactory.getLogger(WaitCoordinator.class);

    enum State { ARMED, SATISFIED, TIMED_OUT }

    private final String peerId;
    private final Map<String, Set<Waiter>> waiters = new ConcurrentHashMap<>();

    public WaitCoordinator(String peerId) {
        this.peerId = peerId;
    }

    /**
     * Wait until {@code condition} holds or {@code timeout} elapses.
     *
     * @param timeout zero waits until the condition holds or the coordinator shuts down
     * @return Mono emitting true if the condition was met, false on timeout
     */
    public Mono<Boolean> await(String trigger, BooleanSupplier condition, Duration timeout) {
        return Mono.defer(() -> {
            Waiter waiter = new Waiter(condition);
            Set<Waiter> registered = waiters.computeIfAbsent(trigger, k -> ConcurrentHashMap.newKeySet());
            registered.add(waiter);
            waiter.check();

            Mono<Boolean> outcome = waiter.sink.asMono();
            if (!timeout.isZero()) {
                outcome = outcome.timeout(timeout, Mono.fromSupplier(waiter::expire));
            }
            return outcome.doFinally(signal -> registered.remove(waiter));
        });
    }

    /**
     * Re-check waiters after a refresh cycle that published {@code refreshedTables}.
     */
    public void onRefresh(Set<String> refreshedTables) {
        for (Map.Entry<String, Set<Waiter>> entry : waiters.entrySet()) {
            if (!WaitTriggers.fires(entry.getKey(), refreshedTables)) {
                continue;
            }
            for (Waiter waiter : entry.getValue()) {
                waiter.check();
            }
        }
    }

    /**
     * Release every waiter as timed out.
     */
    public void shutdown() {
        int released = 0;
        for (Set<Waiter> registered : waiters.values()) {
            for (Waiter waiter : registered) {
                if (waiter.state.get() == State.ARMED) {
                    waiter.expire();
                    released++;
                }
            }
        }
        if (released > 0) {
            log.info("Released {} pending waits of peer {}", released, peerId);
        }
    }

    /**
     * Number of armed waiters, for monitoring and tests.
     */
    public int getWaiterCount() {
        int count = 0;
        for (Set<Waiter> registered : waiters.values()) {
            for (Waiter waiter : registered) {
                if (waiter.state.get() == State.ARMED) {
                    count++;
                }
            }
        }
        return count;
    }

    private final class Waiter {
        private final BooleanSupplier condition;
        private final AtomicReference<State> state = new AtomicReference<>(State.ARMED);
        private final Sinks.One<Boolean> sink = Sinks.one();

        Waiter(BooleanSupplier condition) {
            this.condition = condition;
        }

        void check() {
            if (state.get() != State.ARMED) {
                return;
            }
            boolean met;
            try {
                met = condition.getAsBoolean();
            } catch (RuntimeException e) {
                log.warn("Wait condition on peer {} could not be evaluated: {}", peerId, e.getMessage());
                met = false;
            }
            if (met && state.compareAndSet(State.ARMED, State.SATISFIED)) {
                sink.tryEmitValue(true);
            }
        }

        /**
         * @return false if this call timed the waiter out, true if it had already been satisfied
         */
        boolean expire() {
            if (state.compareAndSet(State.ARMED, State.TIMED_OUT)) {
                sink.tryEmitValue(false);
                return false;
            }
            return state.get() == State.SATISFIED;
        }
    }
}
