package com.ryuqq.reskit.adapter.runner;

import com.ryuqq.reskit.application.kit.ResKit;
import com.ryuqq.reskit.application.loader.ResLoader;
import com.ryuqq.reskit.core.cache.BackendRegistry;
import com.ryuqq.reskit.core.cache.ResourceCache;
import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.LoaderId;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * {@link ResKit} 기본 구현체.
 *
 * <p>하나의 인스턴스가 캐시, 로드 코디네이터, 로더 풀을 소유합니다.
 * 전역 상태는 없으며, 필요한 만큼 독립적인 킷을 생성할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BackendRegistry backends = BackendRegistry.of(flatFileBackend, archiveBackend);
 * ResKit kit = new DefaultResKit(backends);
 *
 * ResLoader loader = kit.allocate(BackendKind.FLAT_FILE);
 * loader.loadAsync("ui/hero.model").thenAccept(result -> ...);
 * kit.recycle(loader);
 * </pre>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public class DefaultResKit implements ResKit {

    private final BackendRegistry backends;
    private final ResKitConfig config;
    private final ResourceCache cache;
    private final LoadCoordinator coordinator;
    private final LoaderPool pool;

    /**
     * 생성자 (기본 설정).
     *
     * @param backends 백엔드 레지스트리
     */
    public DefaultResKit(BackendRegistry backends) {
        this(backends, new ResKitConfig());
    }

    /**
     * 생성자 (공용 ForkJoinPool에서 배치 사이 양보).
     *
     * @param backends 백엔드 레지스트리
     * @param config 설정
     */
    public DefaultResKit(BackendRegistry backends, ResKitConfig config) {
        this(backends, config, ForkJoinPool.commonPool());
    }

    /**
     * 생성자.
     *
     * @param backends 백엔드 레지스트리
     * @param config 설정
     * @param executor 미리 로드 배치 사이의 스케줄링 양보에 사용할 실행기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DefaultResKit(BackendRegistry backends, ResKitConfig config, Executor executor) {
        if (backends == null) {
            throw new IllegalArgumentException("backends cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.backends = backends;
        this.config = config;
        this.cache = new ResourceCache(backends);
        this.coordinator = new LoadCoordinator(cache, backends);
        this.pool = new LoaderPool((slot, kind) -> new PooledResLoader(slot, kind, coordinator, config, executor));
    }

    @Override
    public ResLoader allocate(BackendKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (!backends.contains(kind)) {
            throw new IllegalArgumentException("No backend registered for kind: " + kind);
        }
        return pool.allocate(kind);
    }

    @Override
    public boolean recycle(ResLoader loader) {
        if (loader == null) {
            throw new IllegalArgumentException("loader cannot be null");
        }
        if (!(loader instanceof PooledResLoader pooled)) {
            throw new IllegalArgumentException("loader does not belong to this kit: " + loader);
        }
        return pool.recycle(pooled);
    }

    @Override
    public Optional<ResLoader> resolve(LoaderId id) {
        return pool.resolve(id).map(loader -> (ResLoader) loader);
    }

    public ResourceCache cache() {
        return cache;
    }

    public LoadCoordinator coordinator() {
        return coordinator;
    }

    public LoaderPool pool() {
        return pool;
    }

    public ResKitConfig config() {
        return config;
    }
}
