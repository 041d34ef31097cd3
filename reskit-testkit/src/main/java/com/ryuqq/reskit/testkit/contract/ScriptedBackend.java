package com.ryuqq.reskit.testkit.contract;

import com.ryuqq.reskit.core.model.Asset;
import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.ResourceKey;
import com.ryuqq.reskit.core.outcome.LoadResult;
import com.ryuqq.reskit.core.outcome.Loaded;
import com.ryuqq.reskit.core.outcome.NotFound;
import com.ryuqq.reskit.core.spi.Backend;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Contract Test용 스크립트 백엔드.
 *
 * <p>비동기 조회는 테스트가 {@link #complete(String)} 등으로 직접 완료할 때까지
 * 진행 중으로 남습니다. 이를 통해 진행 중 구간을 결정적으로 유지할 수 있습니다.</p>
 *
 * <p><strong>제공 기능:</strong></p>
 * <ul>
 *   <li>경로별 콘텐츠 등록 ({@link #put(String, Object)})</li>
 *   <li>경로별 조회/해제 횟수 집계</li>
 *   <li>대기 중 조회의 수동 완료 (성공, NotFound, 예외)</li>
 * </ul>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public class ScriptedBackend implements Backend {

    private final BackendKind kind;
    private final boolean syncFetch;

    private final ConcurrentHashMap<String, Object> contents = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<CompletableFuture<LoadResult>>> pending = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> releaseCounts = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Asset> releasedAssets = new CopyOnWriteArrayList<>();

    /**
     * 생성자.
     *
     * @param kind 백엔드 종류
     * @param syncFetch 동기 조회 지원 여부
     */
    public ScriptedBackend(BackendKind kind, boolean syncFetch) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
        this.syncFetch = syncFetch;
    }

    /**
     * 콘텐츠 등록.
     *
     * @param path 경로
     * @param content 콘텐츠
     * @return this
     */
    public ScriptedBackend put(String path, Object content) {
        contents.put(path, content);
        return this;
    }

    @Override
    public BackendKind kind() {
        return kind;
    }

    @Override
    public boolean supportsSyncFetch() {
        return syncFetch;
    }

    @Override
    public LoadResult fetchSync(ResourceKey key) {
        if (!syncFetch) {
            throw new IllegalStateException(kind + " backend does not support synchronous fetch");
        }
        countFetch(key.getPath());
        return lookup(key);
    }

    @Override
    public CompletableFuture<LoadResult> fetchAsync(ResourceKey key) {
        countFetch(key.getPath());
        CompletableFuture<LoadResult> future = new CompletableFuture<>();
        pending.computeIfAbsent(key.getPath(), p -> new CopyOnWriteArrayList<>()).add(future);
        return future;
    }

    @Override
    public void release(ResourceKey key, Asset asset) {
        releaseCounts.computeIfAbsent(key.getPath(), p -> new AtomicInteger()).incrementAndGet();
        releasedAssets.add(asset);
    }

    /**
     * 경로의 대기 중 조회를 등록된 콘텐츠로 완료.
     *
     * @param path 경로
     * @return 완료한 조회 수
     */
    public int complete(String path) {
        ResourceKey key = ResourceKey.of(kind, path);
        return settle(path, lookup(key));
    }

    /**
     * 경로의 대기 중 조회를 NotFound로 완료.
     *
     * @param path 경로
     * @return 완료한 조회 수
     */
    public int completeNotFound(String path) {
        return settle(path, new NotFound(ResourceKey.of(kind, path)));
    }

    /**
     * 경로의 대기 중 조회를 예외로 완료.
     *
     * @param path 경로
     * @param error 예외
     * @return 완료한 조회 수
     */
    public int fail(String path, Throwable error) {
        List<CompletableFuture<LoadResult>> futures = drain(path);
        futures.forEach(f -> f.completeExceptionally(error));
        return futures.size();
    }

    /**
     * 모든 대기 중 조회를 완료.
     *
     * @return 완료한 조회 수
     */
    public int completeAll() {
        int completed = 0;
        for (String path : new ArrayList<>(pending.keySet())) {
            completed += complete(path);
        }
        return completed;
    }

    public int pendingCount(String path) {
        List<CompletableFuture<LoadResult>> futures = pending.get(path);
        return futures == null ? 0 : futures.size();
    }

    public int fetchCount(String path) {
        AtomicInteger count = fetchCounts.get(path);
        return count == null ? 0 : count.get();
    }

    public int releaseCount(String path) {
        AtomicInteger count = releaseCounts.get(path);
        return count == null ? 0 : count.get();
    }

    public List<Asset> releasedAssets() {
        return List.copyOf(releasedAssets);
    }

    /**
     * 상태 초기화.
     */
    public void clear() {
        contents.clear();
        pending.clear();
        fetchCounts.clear();
        releaseCounts.clear();
        releasedAssets.clear();
    }

    private int settle(String path, LoadResult result) {
        List<CompletableFuture<LoadResult>> futures = drain(path);
        futures.forEach(f -> f.complete(result));
        return futures.size();
    }

    private List<CompletableFuture<LoadResult>> drain(String path) {
        List<CompletableFuture<LoadResult>> futures = pending.remove(path);
        return futures == null ? List.of() : futures;
    }

    private LoadResult lookup(ResourceKey key) {
        Object content = contents.get(key.getPath());
        if (content == null) {
            return new NotFound(key);
        }
        // 조회마다 새 Asset 인스턴스
        return new Loaded(key, Asset.of(content));
    }

    private void countFetch(String path) {
        fetchCounts.computeIfAbsent(path, p -> new AtomicInteger()).incrementAndGet();
    }
}
