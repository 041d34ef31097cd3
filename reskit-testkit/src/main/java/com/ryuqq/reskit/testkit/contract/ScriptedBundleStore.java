package com.ryuqq.reskit.testkit.contract;

import com.ryuqq.reskit.core.model.Asset;
import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.ResourceKey;
import com.ryuqq.reskit.core.outcome.LoadResult;
import com.ryuqq.reskit.core.outcome.Loaded;
import com.ryuqq.reskit.core.outcome.NotFound;
import com.ryuqq.reskit.core.spi.BundleManifest;
import com.ryuqq.reskit.core.spi.BundleStore;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Contract Test용 스크립트 번들 저장소.
 *
 * <p>동기 번들 조회는 즉시 응답하고, 비동기 번들 조회는 {@link #completeBundle(String)}이
 * 호출될 때까지 진행 중으로 남습니다. 매니페스트와 에셋 조회는 항상 즉시 완료됩니다.</p>
 *
 * <p>번들 Asset의 콘텐츠는 {@code 경로 → 콘텐츠} 맵입니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public class ScriptedBundleStore implements BundleStore {

    private final BundleManifest manifest;
    private final Map<String, Map<String, Object>> bundles;
    private final boolean syncFetch;

    private final ConcurrentHashMap<String, List<CompletableFuture<LoadResult>>> pending = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> releaseCounts = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param manifest 번들 매니페스트
     * @param bundles 번들 이름별 에셋 콘텐츠
     * @param syncFetch 동기 번들 조회 지원 여부
     * @throws IllegalArgumentException manifest 또는 bundles가 null인 경우
     */
    public ScriptedBundleStore(BundleManifest manifest, Map<String, Map<String, Object>> bundles, boolean syncFetch) {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        if (bundles == null) {
            throw new IllegalArgumentException("bundles cannot be null");
        }
        this.manifest = manifest;
        this.bundles = Map.copyOf(bundles);
        this.syncFetch = syncFetch;
    }

    @Override
    public BundleManifest readManifest() {
        return manifest;
    }

    @Override
    public CompletableFuture<BundleManifest> readManifestAsync() {
        return CompletableFuture.completedFuture(manifest);
    }

    @Override
    public boolean supportsSyncFetch() {
        return syncFetch;
    }

    @Override
    public LoadResult fetchBundleSync(String bundleName) {
        countFetch(bundleName);
        return lookupBundle(bundleName);
    }

    @Override
    public CompletableFuture<LoadResult> fetchBundleAsync(String bundleName) {
        countFetch(bundleName);
        CompletableFuture<LoadResult> future = new CompletableFuture<>();
        pending.computeIfAbsent(bundleName, n -> new CopyOnWriteArrayList<>()).add(future);
        return future;
    }

    @Override
    public LoadResult loadAssetSync(Asset bundle, ResourceKey key) {
        Map<?, ?> assets = bundle.getContent(Map.class);
        Object content = assets.get(key.getPath());
        return content == null ? new NotFound(key) : new Loaded(key, Asset.of(content));
    }

    @Override
    public CompletableFuture<LoadResult> loadAssetAsync(Asset bundle, ResourceKey key) {
        return CompletableFuture.completedFuture(loadAssetSync(bundle, key));
    }

    @Override
    public void releaseBundle(String bundleName, Asset bundle) {
        releaseCounts.computeIfAbsent(bundleName, n -> new AtomicInteger()).incrementAndGet();
    }

    /**
     * 번들의 대기 중 비동기 조회를 완료.
     *
     * @param bundleName 번들 이름
     * @return 완료한 조회 수
     */
    public int completeBundle(String bundleName) {
        List<CompletableFuture<LoadResult>> futures = pending.remove(bundleName);
        if (futures == null) {
            return 0;
        }
        LoadResult result = lookupBundle(bundleName);
        futures.forEach(f -> f.complete(result));
        return futures.size();
    }

    public int pendingCount(String bundleName) {
        List<CompletableFuture<LoadResult>> futures = pending.get(bundleName);
        return futures == null ? 0 : futures.size();
    }

    public int fetchCount(String bundleName) {
        AtomicInteger count = fetchCounts.get(bundleName);
        return count == null ? 0 : count.get();
    }

    public int releaseCount(String bundleName) {
        AtomicInteger count = releaseCounts.get(bundleName);
        return count == null ? 0 : count.get();
    }

    /**
     * 상태 초기화.
     */
    public void clear() {
        pending.clear();
        fetchCounts.clear();
        releaseCounts.clear();
    }

    private LoadResult lookupBundle(String bundleName) {
        ResourceKey key = ResourceKey.of(BackendKind.ARCHIVE, bundleName);
        Map<String, Object> assets = bundles.get(bundleName);
        return assets == null ? new NotFound(key) : new Loaded(key, Asset.of(assets));
    }

    private void countFetch(String bundleName) {
        fetchCounts.computeIfAbsent(bundleName, n -> new AtomicInteger()).incrementAndGet();
    }
}
