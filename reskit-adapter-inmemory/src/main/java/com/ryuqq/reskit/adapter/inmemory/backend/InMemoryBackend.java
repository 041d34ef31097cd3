package com.ryuqq.reskit.adapter.inmemory.backend;

import com.ryuqq.reskit.core.model.Asset;
import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.ResourceKey;
import com.ryuqq.reskit.core.outcome.LoadResult;
import com.ryuqq.reskit.core.outcome.Loaded;
import com.ryuqq.reskit.core.outcome.NotFound;
import com.ryuqq.reskit.core.spi.Backend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link Backend} 구현.
 *
 * <p>경로별 콘텐츠를 {@link ConcurrentHashMap}에 보관하고 조회 시마다 새 {@link Asset}으로
 * 감싸 반환합니다. 비동기 조회는 생성 시 지정한 {@link Executor}에서 수행됩니다.</p>
 *
 * <p><strong>동기 조회 지원 (기본값):</strong></p>
 * <ul>
 *   <li>FLAT_FILE, ARCHIVE: 지원</li>
 *   <li>REMOTE_PACKAGE: 미지원 (원격 패키지는 비동기 전용)</li>
 * </ul>
 *
 * <p><strong>제약사항:</strong></p>
 * <ul>
 *   <li>프로세스 재시작 시 콘텐츠 소실</li>
 *   <li>테스트 및 참조 구현 용도</li>
 * </ul>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>
 * InMemoryBackend files = new InMemoryBackend(BackendKind.FLAT_FILE);
 * files.put("ui/hero.model", heroMesh);
 *
 * ResKit kit = new DefaultResKit(BackendRegistry.of(files));
 * ResLoader loader = kit.allocate(BackendKind.FLAT_FILE);
 * LoadResult result = loader.load("ui/hero.model");
 * </pre>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public class InMemoryBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBackend.class);

    private final BackendKind kind;
    private final boolean syncFetch;
    private final Executor executor;

    private final ConcurrentHashMap<String, Object> contents = new ConcurrentHashMap<>();
    private final AtomicInteger fetchCount = new AtomicInteger();
    private final AtomicInteger releaseCount = new AtomicInteger();

    /**
     * 기본 생성자. 종류별 기본 동기 지원 여부와 공용 ForkJoinPool 사용.
     *
     * @param kind 백엔드 종류
     */
    public InMemoryBackend(BackendKind kind) {
        this(kind, kind != BackendKind.REMOTE_PACKAGE, ForkJoinPool.commonPool());
    }

    /**
     * 생성자.
     *
     * @param kind 백엔드 종류
     * @param syncFetch 동기 조회 지원 여부
     * @param executor 비동기 조회 실행기
     * @throws IllegalArgumentException kind 또는 executor가 null인 경우
     */
    public InMemoryBackend(BackendKind kind, boolean syncFetch, Executor executor) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.kind = kind;
        this.syncFetch = syncFetch;
        this.executor = executor;
    }

    /**
     * 콘텐츠 등록 (기존 콘텐츠는 교체).
     *
     * @param path 경로
     * @param content 콘텐츠
     * @return this
     * @throws IllegalArgumentException path 또는 content가 null인 경우
     */
    public InMemoryBackend put(String path, Object content) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        contents.put(path, content);
        return this;
    }

    /**
     * 콘텐츠 등록 (일괄).
     *
     * @param entries 경로별 콘텐츠
     * @return this
     */
    public InMemoryBackend putAll(Map<String, ?> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        entries.forEach(this::put);
        return this;
    }

    /**
     * 콘텐츠 삭제. 이미 캐시된 항목에는 영향이 없습니다.
     *
     * @param path 경로
     * @return 삭제되었으면 true
     */
    public boolean remove(String path) {
        return path != null && contents.remove(path) != null;
    }

    @Override
    public BackendKind kind() {
        return kind;
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
    public LoadResult fetchSync(ResourceKey key) {
        if (!syncFetch) {
            throw new IllegalStateException(kind + " backend does not support synchronous fetch");
        }
        return lookup(key);
    }

    @Override
    public CompletableFuture<LoadResult> fetchAsync(ResourceKey key) {
        return CompletableFuture.supplyAsync(() -> lookup(key), executor);
    }

    @Override
    public void release(ResourceKey key, Asset asset) {
        releaseCount.incrementAndGet();
        log.debug("Released {}", key.asCacheKey());
    }

    public int fetchCount() {
        return fetchCount.get();
    }

    public int releaseCount() {
        return releaseCount.get();
    }

    public int size() {
        return contents.size();
    }

    private LoadResult lookup(ResourceKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        fetchCount.incrementAndGet();
        Object content = contents.get(key.getPath());
        if (content == null) {
            log.debug("No content for {}", key.asCacheKey());
            return new NotFound(key);
        }
        return new Loaded(key, Asset.of(content));
    }
}
