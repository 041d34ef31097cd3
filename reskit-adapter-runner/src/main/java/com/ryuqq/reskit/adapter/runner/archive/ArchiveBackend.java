package com.ryuqq.reskit.adapter.runner.archive;

import com.ryuqq.reskit.core.model.Asset;
import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.ResourceKey;
import com.ryuqq.reskit.core.outcome.ErrorCode;
import com.ryuqq.reskit.core.outcome.Failure;
import com.ryuqq.reskit.core.outcome.LoadResult;
import com.ryuqq.reskit.core.outcome.Loaded;
import com.ryuqq.reskit.core.outcome.NotFound;
import com.ryuqq.reskit.core.spi.Backend;
import com.ryuqq.reskit.core.spi.BundleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 아카이브 저장소 {@link Backend}.
 *
 * <p>에셋 경로로 소속 번들을 찾고, 번들의 의존성 그래프를 로드한 뒤 번들에서
 * 에셋을 꺼냅니다. 반환되는 Asset의 메타데이터에는 번들 이름이 기록됩니다.</p>
 *
 * <p><strong>참조 규칙:</strong> 캐시 항목 하나는 소속 번들의 의존성 폐포를 정확히
 * 한 번 획득합니다. 캐시가 항목을 해제하면 {@link #release(ResourceKey, Asset)}가
 * 번들 그래프를 한 번 해제합니다. 번들에 에셋이 없으면 획득한 번들을 즉시 해제합니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public class ArchiveBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(ArchiveBackend.class);

    private final DependencyGraph graph;
    private final BundleStore store;

    /**
     * 생성자.
     *
     * @param graph 번들 의존성 그래프
     * @param store 그래프와 같은 번들 저장소
     * @throws IllegalArgumentException graph 또는 store가 null인 경우
     */
    public ArchiveBackend(DependencyGraph graph, BundleStore store) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.graph = graph;
        this.store = store;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.ARCHIVE;
    }

    @Override
    public boolean supportsSyncFetch() {
        return store.supportsSyncFetch();
    }

    @Override
    public LoadResult fetchSync(ResourceKey key) {
        requireKey(key);
        if (!graph.initialize()) {
            return graph.initializationConflict(key);
        }

        Optional<String> bundle = graph.bundleOf(key.getPath());
        if (bundle.isEmpty()) {
            log.debug("No bundle contains {}", key.getPath());
            return new NotFound(key);
        }
        String bundleName = bundle.get();

        LoadResult bundleResult = graph.loadSync(bundleName);
        if (!(bundleResult instanceof Loaded loadedBundle)) {
            return bundleResult.withKey(key);
        }

        LoadResult assetResult;
        try {
            assetResult = store.loadAssetSync(loadedBundle.asset(), key);
        } catch (Exception e) {
            assetResult = backendFailure(key, e);
        }
        return finish(key, bundleName, assetResult);
    }

    @Override
    public CompletableFuture<LoadResult> fetchAsync(ResourceKey key) {
        requireKey(key);
        return graph.initializeAsync().thenCompose(v -> {
            Optional<String> bundle = graph.bundleOf(key.getPath());
            if (bundle.isEmpty()) {
                log.debug("No bundle contains {}", key.getPath());
                return CompletableFuture.<LoadResult>completedFuture(new NotFound(key));
            }
            String bundleName = bundle.get();
            return graph.loadAsync(bundleName).thenCompose(bundleResult -> loadAsset(key, bundleName, bundleResult));
        });
    }

    @Override
    public void release(ResourceKey key, Asset asset) {
        requireKey(key);
        String bundleName = asset != null && asset.hasMetadata()
            ? asset.getMetadata()
            : graph.bundleOf(key.getPath()).orElse(null);
        if (bundleName == null) {
            log.warn("Cannot resolve bundle of released asset {}", key.asCacheKey());
            return;
        }
        graph.unload(bundleName);
    }

    public DependencyGraph graph() {
        return graph;
    }

    private CompletableFuture<LoadResult> loadAsset(ResourceKey key, String bundleName, LoadResult bundleResult) {
        if (!(bundleResult instanceof Loaded loadedBundle)) {
            return CompletableFuture.completedFuture(bundleResult.withKey(key));
        }
        CompletableFuture<LoadResult> assetFuture;
        try {
            assetFuture = store.loadAssetAsync(loadedBundle.asset(), key);
        } catch (Exception e) {
            assetFuture = CompletableFuture.failedFuture(e);
        }
        return assetFuture.handle((result, error) ->
            finish(key, bundleName, error != null ? backendFailure(key, error) : result));
    }

    private LoadResult finish(ResourceKey key, String bundleName, LoadResult assetResult) {
        if (assetResult instanceof Loaded loaded) {
            return new Loaded(key, Asset.of(loaded.asset().getContent(), bundleName));
        }
        // 에셋을 얻지 못했으므로 획득한 번들 참조 반납
        graph.unload(bundleName);
        if (assetResult == null) {
            return new NotFound(key);
        }
        return assetResult.withKey(key);
    }

    private static LoadResult backendFailure(ResourceKey key, Throwable error) {
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        String message = cause.getMessage() != null && !cause.getMessage().isBlank()
            ? cause.getMessage() : cause.getClass().getName();
        return Failure.of(key, ErrorCode.BACKEND_FAILURE, message);
    }

    private static void requireKey(ResourceKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }
}
