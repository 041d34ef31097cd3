package com.ryuqq.reskit.adapter.runner;

import com.ryuqq.reskit.application.loader.ResLoader;
import com.ryuqq.reskit.core.cache.ResourceCache;
import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.LoaderId;
import com.ryuqq.reskit.core.model.ResourceKey;
import com.ryuqq.reskit.core.outcome.LoadResult;
import com.ryuqq.reskit.core.outcome.NotFound;
import com.ryuqq.reskit.core.statemachine.LoaderState;
import com.ryuqq.reskit.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.DoubleConsumer;

/**
 * 풀링되는 {@link ResLoader} 구현체.
 *
 * <p>한 소비자가 보유한 경로 집합과 버전을 관리합니다. 모든 로드는
 * {@link LoadCoordinator}를 거치며, 완료 시점에 버전을 비교해 만료된 결과를
 * 걸러냅니다.</p>
 *
 * <p><strong>참조 규칙:</strong></p>
 * <ul>
 *   <li>처음 보유하는 경로: 코디네이터가 준 참조를 그대로 보유</li>
 *   <li>이미 보유한 경로: 코디네이터가 준 추가 참조를 즉시 반납</li>
 *   <li>만료된 결과: 참조를 한 번 반납하고 WARN 기록, NotFound 반환</li>
 * </ul>
 *
 * <p>빈 경로나 1024자를 넘는 경로는 코디네이터를 거치지 않고 NotFound로 완료됩니다.</p>
 *
 * <p><strong>동시성:</strong> 보유 목록, 버전, 상태는 이 객체의 모니터로 보호됩니다.
 * 캐시 해제는 항상 모니터를 놓은 뒤 호출하므로, 로더 모니터를 보유한 채로
 * 캐시 모니터를 잡는 일은 없습니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public class PooledResLoader implements ResLoader {

    private static final Logger log = LoggerFactory.getLogger(PooledResLoader.class);

    private final int slot;
    private final BackendKind kind;
    private final LoadCoordinator coordinator;
    private final ResourceCache cache;
    private final ResKitConfig config;
    private final Executor executor;

    private final Set<String> owned = new LinkedHashSet<>();
    private int version;
    private LoaderState state = LoaderState.POOLED;

    PooledResLoader(int slot, BackendKind kind, LoadCoordinator coordinator,
                    ResKitConfig config, Executor executor) {
        this.slot = slot;
        this.kind = kind;
        this.coordinator = coordinator;
        this.cache = coordinator.cache();
        this.config = config;
        this.executor = executor;
    }

    @Override
    public synchronized LoaderId id() {
        return new LoaderId(slot, version);
    }

    @Override
    public BackendKind kind() {
        return kind;
    }

    @Override
    public synchronized boolean isActive() {
        return state == LoaderState.ACTIVE;
    }

    public int slot() {
        return slot;
    }

    public synchronized int version() {
        return version;
    }

    public synchronized LoaderState state() {
        return state;
    }

    @Override
    public LoadResult load(String path) {
        Ticket ticket = ticket(path);
        if (!ticket.addressable()) {
            return unaddressable(ticket);
        }
        return accept(ticket, coordinator.acquireSync(ticket.key()));
    }

    @Override
    public CompletableFuture<LoadResult> loadAsync(String path) {
        Ticket ticket = ticket(path);
        return loadAsync(ticket);
    }

    @Override
    public CompletableFuture<Void> preloadAsync(List<String> paths, DoubleConsumer progress) {
        if (paths == null) {
            throw new IllegalArgumentException("paths cannot be null");
        }
        DoubleConsumer reporter = progress != null ? progress : p -> { };

        List<Ticket> tickets = new ArrayList<>(paths.size());
        synchronized (this) {
            ensureActive();
            for (String path : paths) {
                tickets.add(newTicket(path));
            }
        }
        if (tickets.isEmpty()) {
            reporter.accept(1.0);
            return CompletableFuture.completedFuture(null);
        }

        int total = tickets.size();
        int batchSize = config.preloadBatchSize();
        int expectedVersion = tickets.get(0).version();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);

        for (int start = 0; start < total; start += batchSize) {
            int end = Math.min(start + batchSize, total);
            List<Ticket> batch = tickets.subList(start, end);
            if (start == 0) {
                chain = chain.thenCompose(v -> loadBatch(batch));
            } else {
                // 배치 사이에서 스케줄링 양보
                chain = chain.thenComposeAsync(v -> loadBatch(batch), executor);
            }
            chain = chain.thenRun(() -> {
                if (isCurrent(expectedVersion)) {
                    reporter.accept((double) end / total);
                }
            });
        }
        return chain;
    }

    @Override
    public void unload(String path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        boolean removed;
        synchronized (this) {
            removed = owned.remove(path);
        }
        if (removed) {
            cache.release(ResourceKey.of(kind, path));
        }
    }

    @Override
    public void releaseAll() {
        List<String> held;
        synchronized (this) {
            held = drain();
        }
        releaseKeys(held);
    }

    @Override
    public synchronized boolean isLoaded(String path) {
        return path != null && owned.contains(path);
    }

    @Override
    public synchronized Set<String> ownedPaths() {
        return Set.copyOf(owned);
    }

    /**
     * 풀에서 꺼낼 때 호출. 버전을 증가시키고 ACTIVE로 전이합니다.
     */
    synchronized void activate() {
        state = StateTransition.transition(state, LoaderState.ACTIVE);
        owned.clear();
        version++;
    }

    /**
     * 풀에 반납할 때 호출. 보유 목록을 비우고 POOLED로 전이합니다.
     *
     * @return 해제해야 할 경로 목록 (이미 POOLED면 null)
     */
    synchronized List<String> deactivate() {
        if (state == LoaderState.POOLED) {
            return null;
        }
        List<String> held = drain();
        state = StateTransition.transition(state, LoaderState.POOLED);
        return held;
    }

    void releaseKeys(List<String> paths) {
        for (String path : paths) {
            cache.release(ResourceKey.of(kind, path));
        }
        if (!paths.isEmpty()) {
            log.debug("Loader {} released {} resource(s)", slot, paths.size());
        }
    }

    private CompletableFuture<LoadResult> loadAsync(Ticket ticket) {
        if (!ticket.addressable()) {
            return CompletableFuture.completedFuture(unaddressable(ticket));
        }
        return coordinator.acquireAsync(ticket.key()).thenApply(result -> accept(ticket, result));
    }

    private CompletableFuture<Void> loadBatch(List<Ticket> batch) {
        if (!isCurrent(batch.get(0).version())) {
            log.debug("Loader {} preload abandoned after bulk release", slot);
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<?>[] loads = new CompletableFuture<?>[batch.size()];
        for (int i = 0; i < batch.size(); i++) {
            loads[i] = loadAsync(batch.get(i));
        }
        return CompletableFuture.allOf(loads);
    }

    private LoadResult accept(Ticket ticket, LoadResult result) {
        if (!result.isLoaded()) {
            return result;
        }

        ResourceKey key = ticket.key();
        boolean stale;
        boolean alreadyOwned = false;
        synchronized (this) {
            stale = ticket.version() != version || state != LoaderState.ACTIVE;
            if (!stale) {
                alreadyOwned = !owned.add(key.getPath());
            }
        }

        if (stale) {
            log.warn("Discarding stale result for {} on loader {} (expected version {})",
                key.asCacheKey(), slot, ticket.version());
            cache.release(key);
            return new NotFound(key);
        }
        if (alreadyOwned) {
            cache.release(key);
        }
        return result;
    }

    private synchronized boolean isCurrent(int expectedVersion) {
        return state == LoaderState.ACTIVE && version == expectedVersion;
    }

    private synchronized Ticket ticket(String path) {
        ensureActive();
        return newTicket(path);
    }

    private Ticket newTicket(String path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (!ResourceKey.isValidPath(path)) {
            return new Ticket(ResourceKey.unaddressable(kind, path), version, false);
        }
        return new Ticket(ResourceKey.of(kind, path), version, true);
    }

    private LoadResult unaddressable(Ticket ticket) {
        log.debug("Loader {} cannot address path of length {}, reporting not found",
            slot, ticket.key().getPath().length());
        return new NotFound(ticket.key());
    }

    private List<String> drain() {
        List<String> held = new ArrayList<>(owned);
        owned.clear();
        version++;
        return held;
    }

    private void ensureActive() {
        if (state != LoaderState.ACTIVE) {
            throw new IllegalStateException("Loader " + slot + " is pooled and cannot be used");
        }
    }

    @Override
    public String toString() {
        return "PooledResLoader{" + kind + ", slot=" + slot + ", version=" + version + ", state=" + state + '}';
    }

    private record Ticket(ResourceKey key, int version, boolean addressable) {
    }
}
