package com.ryuqq.reskit.adapter.inmemory.archive;

import com.ryuqq.reskit.core.model.Asset;
import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.ResourceKey;
import com.ryuqq.reskit.core.outcome.LoadResult;
import com.ryuqq.reskit.core.outcome.Loaded;
import com.ryuqq.reskit.core.outcome.NotFound;
import com.ryuqq.reskit.core.spi.BundleManifest;
import com.ryuqq.reskit.core.spi.BundleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link BundleStore} 구현.
 *
 * <p>번들은 {@code 에셋 경로 → 콘텐츠} 맵이며, 번들 Asset의 콘텐츠로 그 맵의
 * 불변 사본을 사용합니다. 에셋 추출은 번들 맵에서 경로를 찾습니다.</p>
 *
 * <p><strong>집계:</strong> 번들 이름별 조회/해제 횟수를 기록해 테스트에서
 * 번들 수명을 확인할 수 있습니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public class InMemoryBundleStore implements BundleStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBundleStore.class);

    private final BundleManifest manifest;
    private final Map<String, Map<String, Object>> bundles;
    private final boolean syncFetch;
    private final Executor executor;

    private final ConcurrentHashMap<String, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> releaseCounts = new ConcurrentHashMap<>();

    /**
     * 생성자 (동기 지원, 공용 ForkJoinPool).
     *
     * @param manifest 번들 매니페스트
     * @param bundles 번들 이름별 에셋 콘텐츠
     */
    public InMemoryBundleStore(BundleManifest manifest, Map<String, Map<String, Object>> bundles) {
        this(manifest, bundles, true, ForkJoinPool.commonPool());
    }

    /**
     * 생성자.
     *
     * @param manifest 번들 매니페스트
     * @param bundles 번들 이름별 에셋 콘텐츠
     * @param syncFetch 동기 번들 조회 지원 여부
     * @param executor 비동기 조회 실행기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public InMemoryBundleStore(BundleManifest manifest, Map<String, Map<String, Object>> bundles,
                               boolean syncFetch, Executor executor) {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        if (bundles == null) {
            throw new IllegalArgumentException("bundles cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.manifest = manifest;
        this.bundles = new ConcurrentHashMap<>();
        bundles.forEach((name, assets) -> this.bundles.put(name, Map.copyOf(assets)));
        this.syncFetch = syncFetch;
        this.executor = executor;
    }

    @Override
    public BundleManifest readManifest() {
        return manifest;
    }

    @Override
    public CompletableFuture<BundleManifest> readManifestAsync() {
        return CompletableFuture.supplyAsync(() -> manifest, executor);
    }

    @Override
    public boolean supportsSyncFetch() {
        return syncFetch;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException 동기 조회를 지원하지 않는 경우
     */
    @Override
    public LoadResult fetchBundleSync(String bundleName) {
        if (!syncFetch) {
            throw new IllegalStateException("Bundle store does not support synchronous fetch");
        }
        return lookupBundle(bundleName);
    }

    @Override
    public CompletableFuture<LoadResult> fetchBundleAsync(String bundleName) {
        return CompletableFuture.supplyAsync(() -> lookupBundle(bundleName), executor);
    }

    @Override
    public LoadResult loadAssetSync(Asset bundle, ResourceKey key) {
        if (bundle == null) {
            throw new IllegalArgumentException("bundle cannot be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Map<?, ?> assets = bundle.getContent(Map.class);
        Object content = assets.get(key.getPath());
        if (content == null) {
            log.debug("Bundle does not contain {}", key.getPath());
            return new NotFound(key);
        }
        return new Loaded(key, Asset.of(content));
    }

    @Override
    public CompletableFuture<LoadResult> loadAssetAsync(Asset bundle, ResourceKey key) {
        return CompletableFuture.supplyAsync(() -> loadAssetSync(bundle, key), executor);
    }

    @Override
    public void releaseBundle(String bundleName, Asset bundle) {
        releaseCounts.computeIfAbsent(bundleName, n -> new AtomicInteger()).incrementAndGet();
        log.debug("Released bundle {}", bundleName);
    }

    public int fetchCount(String bundleName) {
        AtomicInteger count = fetchCounts.get(bundleName);
        return count == null ? 0 : count.get();
    }

    public int releaseCount(String bundleName) {
        AtomicInteger count = releaseCounts.get(bundleName);
        return count == null ? 0 : count.get();
    }

    private LoadResult lookupBundle(String bundleName) {
        fetchCounts.computeIfAbsent(bundleName, n -> new AtomicInteger()).incrementAndGet();
        ResourceKey key = ResourceKey.of(BackendKind.ARCHIVE, bundleName);
        Map<String, Object> assets = bundles.get(bundleName);
        return assets == null ? new NotFound(key) : new Loaded(key, Asset.of(assets));
    }
}
