package com.ryuqq.reskit.adapter.runner.archive;

import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.ResourceKey;
import com.ryuqq.reskit.core.outcome.ErrorCode;
import com.ryuqq.reskit.core.outcome.Failure;
import com.ryuqq.reskit.core.outcome.LoadResult;
import com.ryuqq.reskit.core.outcome.Loaded;
import com.ryuqq.reskit.core.spi.BundleManifest;
import com.ryuqq.reskit.core.spi.BundleStore;
import com.ryuqq.reskit.core.statemachine.BundleState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 번들 의존성 그래프.
 *
 * <p>번들 단위로 참조 카운트를 관리하며, 번들을 로드할 때 전이 의존성을 먼저 로드하고
 * 해제할 때 각 의존성을 한 번씩 해제합니다.</p>
 *
 * <p><strong>로드 규칙:</strong></p>
 * <ul>
 *   <li>loadSync: 깊이 우선. 직접 의존성을 순서대로 로드한 뒤 자신을 로드.
 *       해당 번들의 로드가 진행 중이면 블로킹하지 않고 {@code CONCURRENCY_CONFLICT} 반환</li>
 *   <li>loadAsync: 직접 의존성을 병렬로 로드하고 모두 완료되면 자신을 로드.
 *       같은 번들의 진행 중 로드에 합류</li>
 *   <li>READY 노드는 다시 조회하지 않고 참조만 증가</li>
 *   <li>로드 실패 시 이번 호출이 획득한 의존성을 다시 해제</li>
 * </ul>
 *
 * <p><strong>해제 규칙:</strong></p>
 * <ul>
 *   <li>자신의 카운트를 감소. 0에 도달하고 고정되지 않았으면
 *       READY → UNLOADING → UNLOADED로 전이하며 번들 해제</li>
 *   <li>이어서 각 직접 의존성을 한 번씩 해제 (재귀)</li>
 *   <li>없는 노드나 카운트가 0인 노드는 무시</li>
 * </ul>
 *
 * <p><strong>고정 번들:</strong> {@link ArchiveConfig#pinnedBundle()} 노드는 카운트가 0이
 * 되어도 해제되지 않으며, 초기화 시 카운트 0으로 미리 로드됩니다.</p>
 *
 * <p><strong>동시성:</strong> 노드 테이블, 진행 중 테이블, 매니페스트는 이 객체의 모니터로
 * 보호됩니다. 저장소 호출과 future 완료는 모니터 밖에서 수행합니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public class DependencyGraph {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    private final BundleStore store;
    private final ArchiveConfig config;

    private final Map<String, BundleNode> nodes = new HashMap<>();
    private final Map<String, InFlightBundle> inFlight = new HashMap<>();
    private BundleManifest manifest = BundleManifest.empty();
    private CompletableFuture<Void> initialization;
    private boolean asyncInitialization;

    /**
     * 생성자 (기본 설정).
     *
     * @param store 번들 저장소
     */
    public DependencyGraph(BundleStore store) {
        this(store, new ArchiveConfig());
    }

    /**
     * 생성자.
     *
     * @param store 번들 저장소
     * @param config 아카이브 설정
     * @throws IllegalArgumentException store 또는 config가 null인 경우
     */
    public DependencyGraph(BundleStore store, ArchiveConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.config = config;
    }

    /**
     * 동기 초기화.
     *
     * <p>매니페스트를 한 번 읽고 고정 번들을 미리 로드합니다. 매니페스트 읽기에
     * 실패하면 WARN을 기록하고 빈 매니페스트로 계속합니다. 다른 스레드가 동기로
     * 초기화 중이면 완료를 기다립니다.</p>
     *
     * <p>{@link #initializeAsync()}로 시작된 초기화가 아직 끝나지 않았으면 기다리지 않고
     * false를 반환합니다. 이 경우 동기 로드는 {@code CONCURRENCY_CONFLICT}로 실패합니다.</p>
     *
     * @return 초기화가 끝났으면 true, 비동기 초기화가 진행 중이면 false
     */
    public boolean initialize() {
        CompletableFuture<Void> pending;
        boolean owner = false;
        synchronized (this) {
            if (initialization == null) {
                initialization = new CompletableFuture<>();
                owner = true;
            } else if (asyncInitialization && !initialization.isDone()) {
                return false;
            }
            pending = initialization;
        }
        if (!owner) {
            pending.join();
            return true;
        }

        try {
            BundleManifest loaded;
            try {
                loaded = store.readManifest();
            } catch (Exception e) {
                log.warn("Failed to read bundle manifest, continuing with an empty manifest", e);
                loaded = null;
            }
            applyManifest(loaded);

            String pinned = pinnedToPreload();
            if (pinned != null) {
                LoadResult result = store.supportsSyncFetch()
                    ? loadSyncInternal(pinned)
                    : loadAsyncInternal(pinned).join();
                afterPinnedPreload(pinned, result);
            }
        } finally {
            pending.complete(null);
        }
        return true;
    }

    /**
     * 비동기 초기화.
     *
     * @return 초기화 완료 future (예외로 완료되지 않음)
     * @see #initialize()
     */
    public CompletableFuture<Void> initializeAsync() {
        CompletableFuture<Void> pending;
        synchronized (this) {
            if (initialization != null) {
                return initialization.copy();
            }
            initialization = new CompletableFuture<>();
            asyncInitialization = true;
            pending = initialization;
        }

        CompletableFuture<BundleManifest> read;
        try {
            read = store.readManifestAsync();
        } catch (Exception e) {
            read = CompletableFuture.failedFuture(e);
        }
        if (read == null) {
            read = CompletableFuture.completedFuture(null);
        }

        read.handle((loaded, error) -> {
                if (error != null) {
                    log.warn("Failed to read bundle manifest, continuing with an empty manifest", unwrap(error));
                    applyManifest(null);
                } else {
                    applyManifest(loaded);
                }
                return pinnedToPreload();
            })
            .thenCompose(pinned -> pinned == null
                ? CompletableFuture.<Void>completedFuture(null)
                : loadAsyncInternal(pinned).thenAccept(result -> afterPinnedPreload(pinned, result)))
            .whenComplete((v, error) -> {
                if (error != null) {
                    log.error("Bundle graph initialization failed", unwrap(error));
                }
                pending.complete(null);
            });
        return pending.copy();
    }

    /**
     * 번들 동기 로드.
     *
     * <p>비동기 초기화가 진행 중이면 블로킹하지 않고 {@code CONCURRENCY_CONFLICT}를 반환합니다.</p>
     *
     * @param name 번들 이름
     * @return 로드 결과 (성공 시 번들 자체가 Asset)
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public LoadResult loadSync(String name) {
        requireName(name);
        ResourceKey key = bundleKey(name);
        if (!initialize()) {
            return initializationConflict(key);
        }
        return loadSyncInternal(name);
    }

    /**
     * 번들 비동기 로드.
     *
     * @param name 번들 이름
     * @return 로드 결과 future (예외로 완료되지 않음)
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public CompletableFuture<LoadResult> loadAsync(String name) {
        requireName(name);
        return initializeAsync().thenCompose(v -> loadAsyncInternal(name));
    }

    /**
     * 번들 해제.
     *
     * @param name 번들 이름
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public void unload(String name) {
        requireName(name);
        BundleNode destroyed = null;
        List<String> dependencies;

        synchronized (this) {
            BundleNode node = nodes.get(name);
            if (node == null || node.getRefCount() == 0) {
                return;
            }
            node.decrement();
            dependencies = node.getDependencies();
            if (node.getRefCount() == 0 && !node.isPinned()) {
                node.beginUnload();
                nodes.remove(name);
                destroyed = node;
            }
        }

        if (destroyed != null) {
            try {
                store.releaseBundle(name, destroyed.getBundle());
                log.debug("Unloaded bundle {}", name);
            } catch (Exception e) {
                log.error("Bundle release failed for {}", name, e);
            }
            destroyed.finishUnload();
        }

        for (String dependency : dependencies) {
            unload(dependency);
        }
    }

    /**
     * 에셋이 속한 번들 조회.
     *
     * @param assetPath 에셋 경로
     * @return 번들 이름 (매핑이 없으면 empty)
     */
    public synchronized Optional<String> bundleOf(String assetPath) {
        return manifest.bundleOf(assetPath);
    }

    /**
     * 번들 참조 카운트.
     *
     * @param name 번들 이름
     * @return 참조 카운트 (로드되지 않았으면 0)
     */
    public synchronized int refCount(String name) {
        BundleNode node = nodes.get(name);
        return node == null ? 0 : node.getRefCount();
    }

    /**
     * 번들 상태.
     *
     * @param name 번들 이름
     * @return READY, LOADING 또는 UNLOADED
     */
    public synchronized BundleState state(String name) {
        BundleNode node = nodes.get(name);
        if (node != null) {
            return node.getState();
        }
        return inFlight.containsKey(name) ? BundleState.LOADING : BundleState.UNLOADED;
    }

    /**
     * 고정 번들 여부.
     *
     * @param name 번들 이름
     * @return 고정 번들이면 true
     */
    public boolean isPinned(String name) {
        return name != null && name.equals(config.pinnedBundle());
    }

    public synchronized boolean isInitialized() {
        return initialization != null && initialization.isDone();
    }

    public synchronized BundleManifest manifest() {
        return manifest;
    }

    public synchronized Set<String> loadedBundles() {
        return Set.copyOf(nodes.keySet());
    }

    public synchronized int inFlightCount() {
        return inFlight.size();
    }

    private LoadResult loadSyncInternal(String name) {
        ResourceKey key = bundleKey(name);
        if (!store.supportsSyncFetch()) {
            return Failure.of(key, ErrorCode.SYNC_UNSUPPORTED, "Bundle store does not support synchronous fetch");
        }

        List<String> dependencies;
        synchronized (this) {
            if (inFlight.containsKey(name)) {
                return conflict(key);
            }
            dependencies = manifest.dependenciesOf(name);
        }

        List<String> acquired = new ArrayList<>();
        for (String dependency : dependencies) {
            LoadResult result = loadSyncInternal(dependency);
            if (!result.isLoaded()) {
                rollback(acquired);
                return result.withKey(key);
            }
            acquired.add(dependency);
        }

        LoadResult own = acquireSync(name, key);
        if (!own.isLoaded()) {
            rollback(acquired);
        }
        return own;
    }

    private LoadResult acquireSync(String name, ResourceKey key) {
        InFlightBundle request;
        synchronized (this) {
            if (inFlight.containsKey(name)) {
                return conflict(key);
            }
            BundleNode node = nodes.get(name);
            if (node != null) {
                node.increment();
                return new Loaded(key, node.getBundle());
            }
            request = register(name);
        }

        log.debug("Fetching bundle {} synchronously", name);
        LoadResult fetched = null;
        Throwable error = null;
        try {
            fetched = store.fetchBundleSync(name);
        } catch (Exception e) {
            error = e;
        }
        return settle(request, fetched, error);
    }

    private CompletableFuture<LoadResult> loadAsyncInternal(String name) {
        ResourceKey key = bundleKey(name);
        List<String> dependencies;
        synchronized (this) {
            dependencies = manifest.dependenciesOf(name);
        }
        if (dependencies.isEmpty()) {
            return acquireAsync(name, key);
        }

        List<CompletableFuture<LoadResult>> pending = new ArrayList<>(dependencies.size());
        for (String dependency : dependencies) {
            pending.add(loadAsyncInternal(dependency));
        }

        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])).thenCompose(v -> {
            List<String> acquired = new ArrayList<>();
            LoadResult firstFailure = null;
            for (int i = 0; i < pending.size(); i++) {
                LoadResult result = pending.get(i).join();
                if (result.isLoaded()) {
                    acquired.add(dependencies.get(i));
                } else if (firstFailure == null) {
                    firstFailure = result;
                }
            }
            if (firstFailure != null) {
                rollback(acquired);
                return CompletableFuture.completedFuture(firstFailure.withKey(key));
            }
            return acquireAsync(name, key).thenApply(own -> {
                if (!own.isLoaded()) {
                    rollback(acquired);
                }
                return own;
            });
        });
    }

    private CompletableFuture<LoadResult> acquireAsync(String name, ResourceKey key) {
        InFlightBundle request;
        synchronized (this) {
            BundleNode node = nodes.get(name);
            if (node != null) {
                node.increment();
                LoadResult hit = new Loaded(key, node.getBundle());
                return CompletableFuture.completedFuture(hit);
            }
            request = inFlight.get(name);
            if (request != null) {
                request.waiters++;
                return request.future.copy();
            }
            request = register(name);
        }

        log.debug("Fetching bundle {} asynchronously", name);
        CompletableFuture<LoadResult> fetch;
        try {
            fetch = store.fetchBundleAsync(name);
        } catch (Exception e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        if (fetch == null) {
            fetch = CompletableFuture.failedFuture(new IllegalStateException("Bundle store returned null future"));
        }

        InFlightBundle owned = request;
        fetch.whenComplete((result, error) -> settle(owned, result, error));
        return request.future.copy();
    }

    private InFlightBundle register(String name) {
        BundleNode node = new BundleNode(name, manifest.dependenciesOf(name), isPinned(name));
        node.beginLoad();
        InFlightBundle request = new InFlightBundle(node);
        inFlight.put(name, request);
        return request;
    }

    private LoadResult settle(InFlightBundle request, LoadResult fetched, Throwable error) {
        BundleNode node = request.node;
        ResourceKey key = bundleKey(node.getName());
        LoadResult outcome;
        if (error != null) {
            Throwable cause = unwrap(error);
            log.warn("Bundle fetch failed for {}", node.getName(), cause);
            outcome = Failure.of(key, ErrorCode.BACKEND_FAILURE,
                cause.getMessage() != null && !cause.getMessage().isBlank() ? cause.getMessage() : cause.getClass().getName());
        } else if (fetched == null) {
            outcome = Failure.of(key, ErrorCode.BACKEND_FAILURE, "Bundle store returned no result");
        } else {
            outcome = fetched.withKey(key);
        }

        synchronized (this) {
            inFlight.remove(node.getName(), request);
            if (outcome instanceof Loaded loaded) {
                node.markReady(loaded.asset(), request.waiters);
                nodes.put(node.getName(), node);
            } else {
                node.markFailed();
            }
        }

        log.debug("Settled bundle {} as {} for {} waiter(s)", node.getName(),
            outcome.getClass().getSimpleName(), request.waiters);
        request.future.complete(outcome);
        return outcome;
    }

    private void rollback(List<String> acquired) {
        for (String dependency : acquired) {
            unload(dependency);
        }
    }

    private LoadResult conflict(ResourceKey key) {
        log.warn("Synchronous load of bundle {} conflicts with an in-flight asynchronous load", key.getPath());
        return Failure.of(key, ErrorCode.CONCURRENCY_CONFLICT,
            "Bundle " + key.getPath() + " is being loaded asynchronously");
    }

    /**
     * 비동기 초기화가 끝나기 전의 동기 로드 결과.
     *
     * @param key 결과에 기록할 키
     * @return CONCURRENCY_CONFLICT 실패
     */
    public LoadResult initializationConflict(ResourceKey key) {
        log.warn("Synchronous load of {} conflicts with in-flight asynchronous graph initialization", key.asCacheKey());
        return Failure.of(key, ErrorCode.CONCURRENCY_CONFLICT,
            "Bundle graph is being initialized asynchronously");
    }

    private synchronized void applyManifest(BundleManifest loaded) {
        manifest = loaded != null ? loaded : BundleManifest.empty();
        log.info("Bundle manifest ready: {} bundle(s), {} asset mapping(s)",
            manifest.bundleNames().size(), manifest.assetBundles().size());
    }

    private synchronized String pinnedToPreload() {
        String pinned = config.pinnedBundle();
        if (!config.preloadPinned() || pinned == null) {
            return null;
        }
        if (!manifest.declares(pinned)) {
            log.debug("Pinned bundle {} is not declared in the manifest, skipping preload", pinned);
            return null;
        }
        return pinned;
    }

    private void afterPinnedPreload(String pinned, LoadResult result) {
        if (!result.isLoaded()) {
            log.warn("Failed to preload pinned bundle {}: {}", pinned, result);
            return;
        }
        synchronized (this) {
            // 미리 로드한 참조는 반납. 고정 노드는 0에서도 READY로 남음
            BundleNode node = nodes.get(pinned);
            if (node != null && node.getRefCount() > 0) {
                node.decrement();
            }
        }
        log.info("Pinned bundle {} preloaded", pinned);
    }

    private static ResourceKey bundleKey(String name) {
        return ResourceKey.of(BackendKind.ARCHIVE, name);
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /**
     * 진행 중인 번들 로드. 그래프 모니터로 보호됩니다.
     */
    private static final class InFlightBundle {

        private final BundleNode node;
        private final CompletableFuture<LoadResult> future = new CompletableFuture<>();
        private int waiters = 1;

        private InFlightBundle(BundleNode node) {
            this.node = node;
        }
    }
}
