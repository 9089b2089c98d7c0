package com.livemux.peer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.livemux.query.Filter;
import com.livemux.query.Request;
import com.livemux.schema.Column;
import com.livemux.schema.SchemaRegistry;
import com.livemux.schema.Table;
import com.livemux.store.QueryScope;
import com.livemux.store.Row;
import com.livemux.store.TableSnapshot;
import com.livemux.store.TableStore;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One upstream monitoring source and its locally mirrored tables.
 *
 * A refresh loop on a peer-private scheduler fetches every mirrored table and publishes
 * the new snapshots together once the whole cycle succeeded. Queries never wait for a
 * refresh: they read whatever snapshots are current when they start (or when their wait
 * condition is released).
 */
public class Peer {

    private static final Logger log = LoggerFactory.getLogger(Peer.class);

    private static final TypeReference<List<List<Object>>> ROWS = new TypeReference<>() {
    };

    private final String id;
    private final String name;
    private final List<UpstreamClient> clients;
    private final ObjectMapper objectMapper;
    private final Duration updateInterval;
    private final PeerMetrics metrics;
    private final WaitCoordinator waitCoordinator;
    private final Map<String, TableStore> stores = new LinkedHashMap<>();

    private final AtomicInteger activeSource = new AtomicInteger();
    private final AtomicLong bytesSend = new AtomicLong();
    private final AtomicLong bytesReceived = new AtomicLong();
    private final AtomicLong queries = new AtomicLong();

    private volatile PeerStatus status = PeerStatus.PENDING;
    private volatile String lastError = "";
    private volatile long lastUpdate;
    private volatile long lastOnline;
    private volatile double responseTime;

    private Scheduler scheduler;
    private Disposable refreshLoop;

    public Peer(PeerConnection connection, List<UpstreamClient> clients, SchemaRegistry schema,
                ObjectMapper objectMapper, Duration updateInterval, PeerMetrics metrics) {
        if (clients.isEmpty()) {
            throw new IllegalArgumentException("Peer " + connection.getId() + " has no sources");
        }
        this.id = connection.getId();
        this.name = connection.getName();
        this.clients = List.copyOf(clients);
        this.objectMapper = objectMapper;
        this.updateInterval = updateInterval;
        this.metrics = metrics;
        this.waitCoordinator = new WaitCoordinator(id);
        for (Table table : schema.getTables()) {
            if (table.isMirrored()) {
                stores.put(table.getName(), new TableStore(table));
            }
        }
    }

    /**
     * Start the periodic refresh loop; the first cycle runs immediately.
     */
    public synchronized void start() {
        if (refreshLoop != null) {
            return;
        }
        scheduler = Schedulers.newSingle("peer-" + id);
        refreshLoop = Flux.interval(Duration.ZERO, updateInterval, scheduler)
            .onBackpressureDrop(tick -> log.debug("Peer {} skipped a refresh, previous cycle still running", id))
            .concatMap(tick -> refresh(), 0)
            .subscribe();
        log.info("Started peer {} ({}) with sources {}, refreshing every {} ms", id, name,
            clients.stream().map(UpstreamClient::getAddress).collect(Collectors.toList()),
            updateInterval.toMillis());
    }

    /**
     * Stop refreshing and release pending waits.
     */
    public synchronized void stop() {
        if (refreshLoop != null) {
            refreshLoop.dispose();
            refreshLoop = null;
        }
        waitCoordinator.shutdown();
        if (scheduler != null) {
            scheduler.disposeGracefully()
                .timeout(Duration.ofSeconds(5))
                .onErrorResume(e -> {
                    log.warn("Refresh scheduler of peer {} did not stop in time: {}", id, e.getMessage());
                    return Mono.empty();
                })
                .block();
            scheduler = null;
        }
        log.info("Stopped peer {}", id);
    }

    /**
     * Run one refresh cycle. Failures are recorded on the peer and never signalled.
     */
    public Mono<Void> refresh() {
        return Mono.defer(() -> {
            Timer.Sample sample = metrics.startRefreshTimer();
            long started = System.nanoTime();
            long refreshedAt = Instant.now().getEpochSecond();
            return Flux.fromIterable(stores.values())
                .concatMap(store -> fetch(store.getTable(), "")
                    .map(rows -> new TableSnapshot(store.getTable(), rows, refreshedAt)))
                .collectList()
                .doOnNext(snapshots -> {
                    Set<String> refreshed = new LinkedHashSet<>();
                    for (TableSnapshot snapshot : snapshots) {
                        stores.get(snapshot.getTable().getName()).publish(snapshot);
                        refreshed.add(snapshot.getTable().getName());
                    }
                    markUp(refreshedAt, (System.nanoTime() - started) / 1_000_000_000.0);
                    metrics.recordRefreshLatency(sample, id);
                    waitCoordinator.onRefresh(refreshed);
                })
                .doOnError(this::markFailed)
                .onErrorResume(e -> Mono.empty())
                .then();
        });
    }

    /**
     * Evaluate a query against this peer's data.
     *
     * Waits for the request's wait condition first, if any. A peer that is not usable
     * answers with a failed result instead of rows; the virtual backends table is always
     * answered.
     */
    public Mono<PeerResult> execute(Request request) {
        Table table = request.getTable();
        if (!table.isVirtual() && !status.isUsable()) {
            String reason = lastError.isEmpty() ? "peer is " + status.name().toLowerCase() : lastError;
            return Mono.just(PeerResult.failed(id, reason));
        }
        queries.incrementAndGet();
        Mono<Boolean> waited = request.isWaiting() ? awaitCondition(request) : Mono.just(true);
        return waited.then(Mono.defer(() -> {
                QueryScope scope = newScope();
                return loadRows(request, scope)
                    .publishOn(Schedulers.parallel())
                    .map(rows -> LocalExecutor.execute(id, request, rows, scope));
            }))
            .onErrorResume(UpstreamException.class, e -> Mono.just(PeerResult.failed(id, e.getMessage())))
            .onErrorResume(JsonProcessingException.class, e -> Mono.just(PeerResult.failed(id,
                "invalid response from " + id + ": " + e.getOriginalMessage())));
    }

    /**
     * Forward a command line to the upstream source.
     */
    public Mono<Void> command(String command) {
        return withFailover(client -> client.command(command))
            .doOnSuccess(ignored -> {
                bytesSend.addAndGet(command.getBytes(StandardCharsets.UTF_8).length + 2L);
                log.debug("Forwarded command to peer {}: {}", id, command);
            });
    }

    private Mono<Boolean> awaitCondition(Request request) {
        Table table = request.getTable();
        Table objectTable = table.isGroupBy() ? table.getBackingTable() : table;
        String key = waitObjectKey(objectTable, request.getWaitObject());
        BooleanSupplier condition = () -> {
            QueryScope scope = newScope();
            TableSnapshot snapshot = scope.snapshot(objectTable.getName());
            if (snapshot == null) {
                return false;
            }
            Row row;
            if (objectTable.getKeyColumns().isEmpty()) {
                row = snapshot.getRows().isEmpty() ? null : snapshot.getRows().get(0);
            } else {
                row = snapshot.findByKey(key);
            }
            return row != null && LocalExecutor.matchesAll(request.getWaitCondition(), row, scope);
        };
        return waitCoordinator.await(request.getWaitTrigger(), condition,
                Duration.ofMillis(request.getWaitTimeout()))
            .doOnNext(satisfied -> {
                metrics.recordWait(satisfied);
                log.debug("Wait on peer {} for {} {}", id, request.getWaitObject(),
                    satisfied ? "satisfied" : "timed out");
            });
    }

    /**
     * Services are addressed as {@code host;description} or {@code host description}.
     */
    static String waitObjectKey(Table table, String waitObject) {
        if (table.getKeyColumns().size() > 1 && waitObject.indexOf(';') < 0) {
            return waitObject.replaceFirst(" ", ";");
        }
        return waitObject;
    }

    private Mono<List<Row>> loadRows(Request request, QueryScope scope) {
        Table table = request.getTable();
        if (table.isVirtual()) {
            return Mono.just(Collections.singletonList(backendRow()));
        }
        if (table.isPassthroughOnly()) {
            return fetch(table, pushDownHeaders(request));
        }
        if (table.isGroupBy()) {
            TableSnapshot backing = scope.snapshot(table.getBackingTable().getName());
            return Mono.fromSupplier(() -> LocalExecutor.explode(table, backing.getRows(), scope));
        }
        return Mono.just(scope.snapshot(table.getName()).getRows());
    }

    /**
     * Filter and Limit headers a passthrough query can hand to the upstream source.
     */
    static String pushDownHeaders(Request request) {
        for (Filter filter : request.getFilters()) {
            if (!filter.isPushable()) {
                return "";
            }
        }
        StringBuilder headers = new StringBuilder();
        for (Filter filter : request.getFilters()) {
            filter.appendTo(headers, "Filter");
        }
        if (request.getLimit() != null && request.getSort().isEmpty() && !request.isStatsQuery()) {
            headers.append("Limit: ").append(PeerMap.saturatedLimit(request)).append('\n');
        }
        return headers.toString();
    }

    private Mono<List<Row>> fetch(Table table, String extraHeaders) {
        String columns = table.getStoredColumns().stream()
            .map(Column::getName)
            .collect(Collectors.joining(" "));
        String request = "GET " + table.getName() + "\n"
            + "Columns: " + columns + "\n"
            + extraHeaders
            + "OutputFormat: json\n"
            + "ResponseHeader: fixed16\n\n";
        return withFailover(client -> client.query(request))
            .doOnNext(body -> {
                bytesSend.addAndGet(request.getBytes(StandardCharsets.UTF_8).length);
                bytesReceived.addAndGet(body.getBytes(StandardCharsets.UTF_8).length);
            })
            .publishOn(Schedulers.parallel())
            .flatMap(body -> Mono.fromCallable(() -> decode(table, body)));
    }

    private List<Row> decode(Table table, String body) throws JsonProcessingException {
        List<List<Object>> raw = objectMapper.readValue(body, ROWS);
        List<Column> stored = table.getStoredColumns();
        List<Row> rows = new ArrayList<>(raw.size());
        for (List<Object> values : raw) {
            Object[] normalized = new Object[stored.size()];
            for (int i = 0; i < normalized.length; i++) {
                Object value = values != null && i < values.size() ? values.get(i) : null;
                normalized[i] = stored.get(i).getType().normalize(value);
            }
            rows.add(new Row(normalized));
        }
        return rows;
    }

    /**
     * Call the active source, trying the remaining ones in order when it fails. The first
     * source that answers becomes the active one.
     */
    private <T> Mono<T> withFailover(Function<UpstreamClient, Mono<T>> call) {
        return attempt(call, activeSource.get(), 0);
    }

    private <T> Mono<T> attempt(Function<UpstreamClient, Mono<T>> call, int first, int tried) {
        int index = (first + tried) % clients.size();
        UpstreamClient client = clients.get(index);
        return Mono.defer(() -> call.apply(client))
            .doOnSuccess(ignored -> activeSource.set(index))
            .onErrorResume(UpstreamException.class, e -> {
                if (tried + 1 >= clients.size()) {
                    return Mono.error(e);
                }
                log.warn("Source {} of peer {} failed, trying next source: {}", client.getAddress(), id,
                    e.getMessage());
                return attempt(call, first, tried + 1);
            });
    }

    private void markUp(long now, double seconds) {
        if (status != PeerStatus.UP) {
            log.info("Peer {} ({}) is up, source {}", id, name, getActiveAddress());
        }
        status = PeerStatus.UP;
        lastError = "";
        lastUpdate = now;
        lastOnline = now;
        responseTime = seconds;
    }

    private void markFailed(Throwable error) {
        PeerStatus next = causedBy(error, JsonProcessingException.class) ? PeerStatus.BROKEN : PeerStatus.DOWN;
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        if (status != next || !message.equals(lastError)) {
            log.warn("Peer {} ({}) is {}: {}", id, name, next.name().toLowerCase(), message);
        }
        status = next;
        lastError = message;
        lastUpdate = Instant.now().getEpochSecond();
        metrics.recordRefreshFailed(id);
    }

    private static boolean causedBy(Throwable error, Class<? extends Throwable> type) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return true;
            }
        }
        return false;
    }

    /**
     * This peer's row of the virtual backends table.
     */
    Row backendRow() {
        return new Row(new Object[]{
            id, name, id, name, getActiveAddress(),
            (long) status.getCode(),
            bytesSend.get(), bytesReceived.get(), queries.get(),
            lastError, lastUpdate, lastOnline, responseTime
        });
    }

    private QueryScope newScope() {
        return new QueryScope(id, name, this::snapshotOf);
    }

    /**
     * Current snapshot of a mirrored table, null for tables this peer does not mirror.
     */
    public TableSnapshot snapshotOf(String tableName) {
        TableStore store = stores.get(tableName);
        return store == null ? null : store.snapshot();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public PeerStatus getStatus() {
        return status;
    }

    public String getLastError() {
        return lastError;
    }

    public String getActiveAddress() {
        return clients.get(activeSource.get()).getAddress();
    }

    public WaitCoordinator getWaitCoordinator() {
        return waitCoordinator;
    }

    @Override
    public String toString() {
        return id + " (" + name + ")";
    }
}
