package com.livemux.peer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for blocking waits on one peer.
 */
@DisplayName("WaitCoordinator Tests")
class WaitCoordinatorTest {

    private WaitCoordinator coordinator;
    private AtomicBoolean condition;

    @BeforeEach
    void setUp() {
        coordinator = new WaitCoordinator("p1");
        condition = new AtomicBoolean(false);
    }

    @Test
    @DisplayName("Should complete immediately when the condition already holds")
    void shouldSatisfyImmediately() {
        condition.set(true);

        StepVerifier.create(coordinator.await("all", condition::get, Duration.ofSeconds(10)))
                .expectNext(true)
                .verifyComplete();

        assertThat(coordinator.getWaiterCount()).isZero();
    }

    @Test
    @DisplayName("Should wake up on a refresh that makes the condition true")
    void shouldWakeOnRefresh() {
        StepVerifier.create(coordinator.await("hosts", condition::get, Duration.ofSeconds(10)))
                .then(() -> assertThat(coordinator.getWaiterCount()).isEqualTo(1))
                .then(() -> coordinator.onRefresh(Set.of("hosts")))
                .expectNoEvent(Duration.ofMillis(50))
                .then(() -> {
                    condition.set(true);
                    coordinator.onRefresh(Set.of("hosts", "services"));
                })
                .expectNext(true)
                .verifyComplete();

        assertThat(coordinator.getWaiterCount()).isZero();
    }

    @Test
    @DisplayName("Should ignore refreshes of tables the trigger does not watch")
    void shouldFilterByTrigger() {
        StepVerifier.create(coordinator.await("downtime", condition::get, Duration.ofSeconds(10)))
                .then(() -> {
                    condition.set(true);
                    coordinator.onRefresh(Set.of("hosts"));
                })
                .expectNoEvent(Duration.ofMillis(100))
                .then(() -> coordinator.onRefresh(Set.of("downtimes")))
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should report false when the timeout elapses first")
    void shouldTimeOut() {
        StepVerifier.withVirtualTime(() -> coordinator.await("all", condition::get, Duration.ofSeconds(5)))
                .expectSubscription()
                .expectNoEvent(Duration.ofSeconds(4))
                .thenAwait(Duration.ofSeconds(1))
                .expectNext(false)
                .verifyComplete();

        assertThat(coordinator.getWaiterCount()).isZero();
    }

    @Test
    @DisplayName("Should wait without limit for a zero timeout until shutdown")
    void shouldReleaseWaitersOnShutdown() {
        StepVerifier.create(coordinator.await("all", condition::get, Duration.ZERO))
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(100))
                .then(coordinator::shutdown)
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should treat a failing condition as not met")
    void shouldSurviveFailingCondition() {
        StepVerifier.create(coordinator.await("all", () -> {
                    throw new IllegalStateException("broken");
                }, Duration.ofMillis(100)))
                .expectNext(false)
                .verifyComplete();
    }
}
