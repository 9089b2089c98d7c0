package com.livemux.peer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.livemux.query.Request;
import com.livemux.query.RequestParser;
import com.livemux.schema.SchemaRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for a single peer: mirroring, local evaluation, failure handling and waits.
 */
@DisplayName("Peer Tests")
class PeerTest {

    private SchemaRegistry schema;
    private RequestParser parser;
    private PeerMetrics metrics;
    private FakeUpstream upstream;
    private Peer peer;

    @BeforeEach
    void setUp() {
        schema = new SchemaRegistry();
        parser = new RequestParser(schema);
        metrics = new PeerMetrics(new SimpleMeterRegistry());
        upstream = PeerFixtures.site("/run/naemon/live.sock");
        peer = PeerFixtures.peer("a", schema, metrics, upstream);
    }

    @AfterEach
    void tearDown() {
        peer.stop();
    }

    private PeerResult query(String text) {
        return peer.execute(parser.parse(text)).block(Duration.ofSeconds(5));
    }

    // ========== Refresh ==========

    @Test
    @DisplayName("Should mirror every table on refresh and mark the peer up")
    void shouldMirrorTablesOnRefresh() {
        assertThat(peer.getStatus()).isEqualTo(PeerStatus.PENDING);

        peer.refresh().block();

        assertThat(peer.getStatus()).isEqualTo(PeerStatus.UP);
        assertThat(peer.getLastError()).isEmpty();
        assertThat(peer.snapshotOf("hosts").size()).isEqualTo(2);
        assertThat(peer.snapshotOf("services").size()).isEqualTo(3);
        assertThat(peer.snapshotOf("hostsbygroup")).isNull();
        assertThat(peer.snapshotOf("log")).isNull();
        assertThat(upstream.getRequests())
            .anySatisfy(request -> assertThat(request)
                .startsWith("GET hosts\nColumns: name alias address")
                .endsWith("OutputFormat: json\nResponseHeader: fixed16\n\n"))
            .noneSatisfy(request -> assertThat(request).startsWith("GET log"));
        assertThat(metrics.refreshTimer("a").count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should drop refresh ticks while a slow cycle is still running")
    void shouldDropTicksDuringSlowRefresh() throws InterruptedException {
        // Given
        AtomicInteger cycles = new AtomicInteger();
        UpstreamClient slowOnce = new UpstreamClient() {
            @Override
            public Mono<String> query(String request) {
                if (request.startsWith("GET hosts\n") && cycles.incrementAndGet() == 1) {
                    return Mono.delay(Duration.ofMillis(600)).then(upstream.query(request));
                }
                return upstream.query(request);
            }

            @Override
            public Mono<Void> command(String command) {
                return upstream.command(command);
            }

            @Override
            public String getAddress() {
                return upstream.getAddress();
            }
        };
        Peer slow = new Peer(new PeerConnection("s", "Site s", List.of(upstream.getAddress())),
            List.of(slowOnce), schema, new ObjectMapper(), Duration.ofMillis(100), metrics);

        // When
        slow.start();
        Thread.sleep(900);
        int cyclesSoFar = cycles.get();
        slow.stop();

        // Then
        assertThat(cyclesSoFar).isBetween(1, 4);
    }

    @Test
    @DisplayName("Should keep old snapshots visible until a refresh succeeds")
    void shouldKeepSnapshotsOnFailedRefresh() {
        peer.refresh().block();
        upstream.failing(true);

        peer.refresh().block();

        assertThat(peer.getStatus()).isEqualTo(PeerStatus.DOWN);
        assertThat(peer.snapshotOf("hosts").size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should mark peer down with last error when source is unreachable")
    void shouldMarkPeerDown() {
        upstream.failing(true);

        peer.refresh().block();

        assertThat(peer.getStatus()).isEqualTo(PeerStatus.DOWN);
        assertThat(peer.getLastError()).contains("refused");
        assertThat(metrics.refreshFailures("a").count()).isEqualTo(1.0);

        PeerResult result = query("GET hosts\nColumns: name\n");
        assertThat(result.isFailed()).isTrue();
        assertThat(result.getRows()).isEmpty();
        assertThat(result.getError()).contains("refused");
    }

    @Test
    @DisplayName("Should recover after the source comes back")
    void shouldRecoverAfterFailure() {
        upstream.failing(true);
        peer.refresh().block();
        upstream.failing(false);

        peer.refresh().block();

        assertThat(peer.getStatus()).isEqualTo(PeerStatus.UP);
        assertThat(peer.getLastError()).isEmpty();
    }

    @Test
    @DisplayName("Should mark peer broken on undecodable responses")
    void shouldMarkPeerBrokenOnInvalidJson() {
        upstream.rawResponse("this is not json");

        peer.refresh().block();

        assertThat(peer.getStatus()).isEqualTo(PeerStatus.BROKEN);
        assertThat(peer.getStatus().isUsable()).isFalse();
    }

    @Test
    @DisplayName("Should fail over to the next source and stay there")
    void shouldFailOverToNextSource() {
        FakeUpstream primary = PeerFixtures.site("10.0.0.1:6557").failing(true);
        FakeUpstream secondary = PeerFixtures.site("10.0.0.2:6557");
        Peer failover = PeerFixtures.peer("f", schema, metrics, primary, secondary);

        failover.refresh().block();
        failover.refresh().block();

        assertThat(failover.getStatus()).isEqualTo(PeerStatus.UP);
        assertThat(failover.getActiveAddress()).isEqualTo("10.0.0.2:6557");
        assertThat(primary.getRequests()).hasSize(1);
    }

    // ========== Queries ==========

    @Test
    @DisplayName("Should filter and project mirrored rows")
    void shouldAnswerFromSnapshot() {
        peer.refresh().block();

        PeerResult result = query("GET hosts\nColumns: name state\nFilter: state = 0\n");

        assertThat(result.isFailed()).isFalse();
        assertThat(result.getRows()).containsExactly(Arrays.asList("web1", 0L));
        assertThat(result.getTotal()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should resolve prefixed column names on their own table")
    void shouldResolvePrefixedColumns() {
        peer.refresh().block();

        PeerResult result = query("GET hosts\nColumns: host_name alias\nFilter: host_name = db1\n");

        assertThat(result.getRows()).containsExactly(Arrays.asList("db1", "DB One"));
    }

    @Test
    @DisplayName("Should read reference columns from the referenced table")
    void shouldResolveReferenceColumns() {
        peer.refresh().block();

        PeerResult hosts = query("GET hosts\nColumns: name latency check_command\nFilter: name = web1\n");
        PeerResult services = query("GET services\nColumns: host_name host_latency host_check_command\n"
            + "Filter: host_name = web1\nLimit: 1\n");

        assertThat(services.getRows()).hasSize(1);
        assertThat(services.getRows().get(0)).isEqualTo(hosts.getRows().get(0));
    }

    @Test
    @DisplayName("Should filter on custom variables")
    void shouldFilterCustomVariables() {
        peer.refresh().block();

        PeerResult result = query("GET hosts\nColumns: name\nFilter: custom_variables ~~ TAGS DATABASE\n");

        assertThat(result.getRows()).containsExactly(List.of("db1"));
    }

    @Test
    @DisplayName("Should sort and page locally")
    void shouldSortAndPage() {
        peer.refresh().block();

        PeerResult result = query("GET services\nColumns: description latency\nSort: latency desc\nLimit: 2\n");

        assertThat(result.getRows()).containsExactly(
            Arrays.asList("mysql", 0.3),
            Arrays.asList("ssh", 0.2));
        assertThat(result.getTotal()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should explode hosts into one row per host group")
    void shouldExplodeGroupByTable() {
        peer.refresh().block();

        PeerResult result = query("GET hostsbygroup\nColumns: hostgroup_name name hostgroup_alias\n"
            + "Sort: hostgroup_name asc\n");

        assertThat(result.getRows()).containsExactly(
            Arrays.asList("db", "db1", "Database servers"),
            Arrays.asList("prod", "web1", "Production"),
            Arrays.asList("web", "web1", "Web servers"));
    }

    @Test
    @DisplayName("Should explode services by the groups of their host")
    void shouldExplodeServicesByHostGroup() {
        peer.refresh().block();

        PeerResult result = query("GET servicesbyhostgroup\nColumns: hostgroup_name host_name description\n"
            + "Filter: hostgroup_name = prod\nSort: description asc\n");

        assertThat(result.getRows()).containsExactly(
            Arrays.asList("prod", "web1", "http"),
            Arrays.asList("prod", "web1", "ssh"));
    }

    @Test
    @DisplayName("Should return unfinalized stats state")
    void shouldAccumulateStats() {
        peer.refresh().block();

        PeerResult result = query("GET services\nStats: state = 0\nStats: sum latency\nStats: avg latency\n");

        List<Object> row = result.getStats().toRows().get(0);
        assertThat(row.get(0)).isEqualTo(1L);
        assertThat((Double) row.get(1)).isCloseTo(0.6, within(1e-9));
        assertThat((Double) row.get(2)).isCloseTo(0.2, within(1e-9));
    }

    @Test
    @DisplayName("Should answer the backends table even before the first refresh")
    void shouldAnswerBackendsTable() {
        PeerResult pending = query("GET backends\nColumns: peer_key status\n");
        assertThat(pending.getRows()).containsExactly(Arrays.asList("a", 4L));

        peer.refresh().block();

        PeerResult up = query("GET backends\nColumns: peer_key peer_name status last_error addr\n");
        assertThat(up.getRows()).containsExactly(
            Arrays.asList("a", "Site a", 0L, "", "/run/naemon/live.sock"));
    }

    @Test
    @DisplayName("Should forward passthrough queries with pushable filters and limit")
    void shouldPushDownPassthroughQuery() {
        upstream.table("log",
            FakeUpstream.row("time", 100, "message", "HOST ALERT: web1;DOWN"),
            FakeUpstream.row("time", 200, "message", "HOST ALERT: web1;UP"));
        peer.refresh().block();

        PeerResult result = query("GET log\nColumns: time message\nFilter: time >= 150\nLimit: 5\n");

        String forwarded = upstream.getRequests().get(upstream.getRequests().size() - 1);
        assertThat(forwarded).startsWith("GET log\nColumns: time class lineno")
            .contains("Filter: time >= 150\nLimit: 5\n");
        assertThat(result.getRows()).containsExactly(Arrays.asList(200L, "HOST ALERT: web1;UP"));
    }

    @Test
    @DisplayName("Should forward a capped limit when offset plus limit exceeds an int")
    void shouldCapPassthroughLimit() {
        peer.refresh().block();

        query("GET log\nColumns: time message\nOffset: 1\nLimit: 2147483647\n");

        String forwarded = upstream.getRequests().get(upstream.getRequests().size() - 1);
        assertThat(forwarded).contains("Limit: 2147483647\n").doesNotContain("Limit: -");
    }

    @Test
    @DisplayName("Should not push down filters on virtual columns")
    void shouldNotPushDownVirtualColumnFilters() {
        peer.refresh().block();

        query("GET log\nColumns: time\nFilter: peer_key = a\nFilter: time > 0\nLimit: 5\n");

        String forwarded = upstream.getRequests().get(upstream.getRequests().size() - 1);
        assertThat(forwarded).doesNotContain("Filter:").doesNotContain("Limit:");
    }

    @Test
    @DisplayName("Should forward commands to the source")
    void shouldForwardCommand() {
        peer.command("COMMAND [1473627610] SCHEDULE_HOST_CHECK;web1;1473627610").block();

        assertThat(upstream.getCommands())
            .containsExactly("COMMAND [1473627610] SCHEDULE_HOST_CHECK;web1;1473627610");
    }

    @Test
    @DisplayName("Should surface command transport errors")
    void shouldFailCommandOnTransportError() {
        upstream.failing(true);

        StepVerifier.create(peer.command("COMMAND [1] TEST"))
            .expectError(UpstreamException.class)
            .verify(Duration.ofSeconds(5));
    }

    // ========== Waits ==========

    @Test
    @DisplayName("Should address services by host and description")
    void shouldBuildWaitObjectKey() {
        assertThat(Peer.waitObjectKey(schema.getTable("services"), "web1 http")).isEqualTo("web1;http");
        assertThat(Peer.waitObjectKey(schema.getTable("services"), "web1;http")).isEqualTo("web1;http");
        assertThat(Peer.waitObjectKey(schema.getTable("hosts"), "web1")).isEqualTo("web1");
    }

    @Test
    @DisplayName("Should resume a waiting query when a refresh satisfies the condition")
    void shouldResumeWaitOnRefresh() throws Exception {
        peer.refresh().block();
        Request request = parser.parse("GET hosts\nColumns: name last_check\nFilter: name = web1\n"
            + "WaitTrigger: check\nWaitObject: web1\nWaitTimeout: 10000\n"
            + "WaitCondition: last_check > 1473760401\n");

        CompletableFuture<PeerResult> pending = peer.execute(request).toFuture();

        assertThat(peer.getWaitCoordinator().getWaiterCount()).isEqualTo(1);
        assertThat(pending).isNotDone();

        upstream.table("hosts", PeerFixtures.hosts(1473760500L));
        peer.refresh().block();

        PeerResult result = pending.get(5, TimeUnit.SECONDS);
        assertThat(result.getRows()).containsExactly(Arrays.asList("web1", 1473760500L));
        assertThat(metrics.getWaitsSatisfied().count()).isEqualTo(1.0);
        assertThat(peer.getWaitCoordinator().getWaiterCount()).isZero();
    }

    @Test
    @DisplayName("Should return current data when the wait times out")
    void shouldReturnCurrentDataOnWaitTimeout() {
        peer.refresh().block();
        Request request = parser.parse("GET hosts\nColumns: name\nFilter: name = web1\n"
            + "WaitTrigger: all\nWaitObject: web1\nWaitTimeout: 200\n"
            + "WaitCondition: last_check > 1473760401\n");

        StepVerifier.create(peer.execute(request))
            .assertNext(result -> assertThat(result.getRows()).containsExactly(List.of("web1")))
            .verifyComplete();

        assertThat(metrics.getWaitsTimedOut().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should not wait when the condition already holds")
    void shouldNotWaitForSatisfiedCondition() {
        peer.refresh().block();
        Request request = parser.parse("GET hosts\nColumns: name\nFilter: name = web1\n"
            + "WaitTrigger: all\nWaitObject: web1\nWaitTimeout: 60000\n"
            + "WaitCondition: last_check > 0\n");

        PeerResult result = peer.execute(request).block(Duration.ofSeconds(2));

        assertThat(result.getRows()).containsExactly(List.of("web1"));
    }

    @Test
    @DisplayName("Should answer other queries while one is waiting")
    void shouldNotBlockOtherQueriesWhileWaiting() throws Exception {
        peer.refresh().block();
        Request waiting = parser.parse("GET hosts\nColumns: name latency check_command\nLimit: 1\n"
            + "WaitTrigger: all\nWaitObject: test\nWaitTimeout: 5000\n"
            + "WaitCondition: last_check > 1473760401\n");
        long start = System.nanoTime();

        CompletableFuture<PeerResult> pending = peer.execute(waiting).toFuture();
        PeerResult other = query("GET hosts\nColumns: name latency check_command\nLimit: 1\n");

        assertThat(other.getRows()).hasSize(1);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(3));
        assertThat(pending).isNotDone();

        peer.stop();
        assertThat(pending.get(5, TimeUnit.SECONDS).getRows()).hasSize(1);
    }
}
