package com.ryuqq.reskit.adapter.runner;

import com.ryuqq.reskit.core.cache.BackendRegistry;
import com.ryuqq.reskit.core.cache.CacheEntry;
import com.ryuqq.reskit.core.cache.ResourceCache;
import com.ryuqq.reskit.core.model.Asset;
import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.ResourceKey;
import com.ryuqq.reskit.core.outcome.ErrorCode;
import com.ryuqq.reskit.core.outcome.Failure;
import com.ryuqq.reskit.core.outcome.LoadResult;
import com.ryuqq.reskit.core.outcome.Loaded;
import com.ryuqq.reskit.core.spi.Backend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 로드 요청 병합기.
 *
 * <p>같은 키에 대한 동시 요청을 백엔드 호출 한 번으로 합칩니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>캐시 적중: 참조 증가 후 즉시 반환</li>
 *   <li>진행 중 요청 존재: 대기자로 합류 (참조는 완료 시점에 적용).
 *       단, 아카이브 키에 대한 동기 요청은 비동기로 시작된 요청에 합류하지 않고
 *       {@code CONCURRENCY_CONFLICT}를 반환</li>
 *   <li>그 외: 캐시 조회와 같은 원자적 단계에서 진행 중 요청을 등록하고,
 *       잠금 밖에서 백엔드를 호출</li>
 *   <li>완료: 성공이면 캐시에 삽입하면서 대기자 수만큼 참조를 한 번에 적용.
 *       NotFound/실패면 캐시는 건드리지 않고 모든 대기자에게 같은 결과 전달</li>
 *   <li>진행 중 요청은 성공/실패와 관계없이 완료 시점에 제거</li>
 * </ol>
 *
 * <p><strong>동시성:</strong> 진행 중 요청 테이블은 캐시의 모니터로 보호됩니다.
 * 백엔드 호출과 future 완료는 모니터 밖에서 수행합니다.</p>
 *
 * <p>백엔드 예외(동기 예외 또는 예외로 완료된 future)는 {@code BACKEND_FAILURE}로
 * 변환되며, 이 계층은 재시도하지 않습니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public class LoadCoordinator {

    private static final Logger log = LoggerFactory.getLogger(LoadCoordinator.class);

    private final ResourceCache cache;
    private final BackendRegistry backends;

    // guarded by cache
    private final Map<ResourceKey, InFlightRequest> inFlight = new HashMap<>();

    /**
     * 생성자.
     *
     * @param cache 공유 캐시
     * @param backends 백엔드 레지스트리
     * @throws IllegalArgumentException cache 또는 backends가 null인 경우
     */
    public LoadCoordinator(ResourceCache cache, BackendRegistry backends) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (backends == null) {
            throw new IllegalArgumentException("backends cannot be null");
        }
        this.cache = cache;
        this.backends = backends;
    }

    /**
     * 리소스 비동기 획득.
     *
     * <p>Loaded로 완료되면 호출자는 참조 하나를 보유합니다.
     * 반환된 future는 예외로 완료되지 않습니다.</p>
     *
     * @param key 리소스 키
     * @return 로드 결과 future
     * @throws IllegalArgumentException key가 null이거나 등록되지 않은 종류인 경우
     */
    public CompletableFuture<LoadResult> acquireAsync(ResourceKey key) {
        Backend backend = backendFor(key);
        InFlightRequest request;

        synchronized (cache) {
            LoadResult hit = hit(key);
            if (hit != null) {
                return CompletableFuture.completedFuture(hit);
            }
            request = inFlight.get(key);
            if (request != null) {
                request.waiters++;
                log.debug("Joined in-flight request for {} (waiters={})", key.asCacheKey(), request.waiters);
                return request.future.copy();
            }
            request = register(key, true);
        }

        log.debug("Fetching {} asynchronously", key.asCacheKey());
        CompletableFuture<LoadResult> fetch;
        try {
            fetch = backend.fetchAsync(key);
        } catch (Exception e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        if (fetch == null) {
            fetch = CompletableFuture.failedFuture(new IllegalStateException("Backend returned null future"));
        }

        InFlightRequest owned = request;
        fetch.whenComplete((result, error) -> settle(owned, result, error));
        return request.future.copy();
    }

    /**
     * 리소스 동기 획득.
     *
     * <p>진행 중 요청이 있으면 완료될 때까지 블로킹합니다. 동기 조회를 지원하지 않는
     * 백엔드에 새 요청이 필요하면 {@code SYNC_UNSUPPORTED}를 반환합니다.</p>
     *
     * <p>아카이브 키의 진행 중 요청이 비동기로 시작된 경우에는 기다리지 않고
     * {@code CONCURRENCY_CONFLICT}를 반환합니다. 이때 참조는 증가하지 않습니다.</p>
     *
     * @param key 리소스 키
     * @return 로드 결과
     * @throws IllegalArgumentException key가 null이거나 등록되지 않은 종류인 경우
     */
    public LoadResult acquireSync(ResourceKey key) {
        Backend backend = backendFor(key);
        InFlightRequest request;
        boolean owner = false;

        synchronized (cache) {
            LoadResult hit = hit(key);
            if (hit != null) {
                return hit;
            }
            request = inFlight.get(key);
            if (request != null && request.async && key.getKind() == BackendKind.ARCHIVE) {
                log.warn("Synchronous load of {} conflicts with an in-flight asynchronous load", key.asCacheKey());
                return Failure.of(key, ErrorCode.CONCURRENCY_CONFLICT,
                    "Resource " + key.getPath() + " is being loaded asynchronously");
            }
            if (request != null) {
                request.waiters++;
            } else if (!backend.supportsSyncFetch()) {
                log.warn("Backend {} does not support synchronous fetch of {}", backend.kind(), key.asCacheKey());
                return Failure.of(key, ErrorCode.SYNC_UNSUPPORTED,
                    "Backend " + backend.kind() + " does not support synchronous fetch");
            } else {
                request = register(key, false);
                owner = true;
            }
        }

        if (!owner) {
            log.debug("Waiting on in-flight request for {}", key.asCacheKey());
            return request.future.join();
        }

        log.debug("Fetching {} synchronously", key.asCacheKey());
        LoadResult result = null;
        Throwable error = null;
        try {
            result = backend.fetchSync(key);
        } catch (Exception e) {
            error = e;
        }
        settle(request, result, error);
        return request.future.join();
    }

    /**
     * 진행 중 요청 수.
     *
     * @return 진행 중인 키의 수
     */
    public int inFlightCount() {
        synchronized (cache) {
            return inFlight.size();
        }
    }

    /**
     * 키에 대한 진행 중 요청 존재 여부.
     *
     * @param key 리소스 키
     * @return 진행 중이면 true
     */
    public boolean isInFlight(ResourceKey key) {
        synchronized (cache) {
            return inFlight.containsKey(key);
        }
    }

    /**
     * 키의 진행 중 요청에 걸린 대기자 수.
     *
     * @param key 리소스 키
     * @return 대기자 수 (진행 중 요청이 없으면 0)
     */
    public int waiterCount(ResourceKey key) {
        synchronized (cache) {
            InFlightRequest request = inFlight.get(key);
            return request == null ? 0 : request.waiters;
        }
    }

    public ResourceCache cache() {
        return cache;
    }

    private LoadResult hit(ResourceKey key) {
        if (!cache.addRef(key)) {
            return null;
        }
        CacheEntry entry = cache.get(key);
        log.debug("Cache hit for {} (refCount={})", key.asCacheKey(), entry.getRefCount());
        return new Loaded(key, entry.getAsset());
    }

    private InFlightRequest register(ResourceKey key, boolean async) {
        InFlightRequest request = new InFlightRequest(key, async);
        inFlight.put(key, request);
        return request;
    }

    private void settle(InFlightRequest request, LoadResult result, Throwable error) {
        ResourceKey key = request.key;
        LoadResult outcome = normalize(key, result, error);
        Asset duplicate = null;
        int waiters;

        synchronized (cache) {
            inFlight.remove(key, request);
            waiters = request.waiters;
            if (outcome instanceof Loaded loaded) {
                CacheEntry entry = cache.insertOrAddRefs(key, loaded.asset(), waiters);
                if (entry.getAsset() != loaded.asset()) {
                    duplicate = loaded.asset();
                    outcome = new Loaded(key, entry.getAsset());
                }
            }
        }

        if (duplicate != null) {
            cache.releaseAsset(key, duplicate);
        }
        log.debug("Settled {} as {} for {} waiter(s)", key.asCacheKey(),
            outcome.getClass().getSimpleName(), waiters);
        request.future.complete(outcome);
    }

    private LoadResult normalize(ResourceKey key, LoadResult result, Throwable error) {
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;
            log.warn("Backend fetch failed for {}", key.asCacheKey(), cause);
            String message = cause.getMessage() != null && !cause.getMessage().isBlank()
                ? cause.getMessage() : cause.getClass().getName();
            return Failure.of(key, ErrorCode.BACKEND_FAILURE, message);
        }
        if (result == null) {
            return Failure.of(key, ErrorCode.BACKEND_FAILURE, "Backend returned no result");
        }
        return result.withKey(key);
    }

    private Backend backendFor(ResourceKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return backends.get(key.getKind());
    }

    /**
     * 진행 중인 백엔드 요청. 캐시 모니터로 보호됩니다.
     */
    private static final class InFlightRequest {

        private final ResourceKey key;
        private final boolean async;
        private final CompletableFuture<LoadResult> future = new CompletableFuture<>();
        private int waiters = 1;

        private InFlightRequest(ResourceKey key, boolean async) {
            this.key = key;
            this.async = async;
        }
    }
}
