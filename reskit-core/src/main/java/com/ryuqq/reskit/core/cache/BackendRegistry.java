package com.ryuqq.reskit.core.cache;

import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.spi.Backend;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 저장소 종류별 백엔드 레지스트리.
 *
 * <p>생성 시점에 백엔드를 한 번 등록하며, 이후에는 변경되지 않습니다.
 * 종류당 최대 하나의 백엔드만 등록할 수 있습니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public final class BackendRegistry {

    private final Map<BackendKind, Backend> backends;

    private BackendRegistry(Collection<? extends Backend> backends) {
        if (backends == null) {
            throw new IllegalArgumentException("backends cannot be null");
        }
        Map<BackendKind, Backend> byKind = new EnumMap<>(BackendKind.class);
        for (Backend backend : backends) {
            if (backend == null) {
                throw new IllegalArgumentException("backend cannot be null");
            }
            if (backend.kind() == null) {
                throw new IllegalArgumentException("backend kind cannot be null");
            }
            if (byKind.putIfAbsent(backend.kind(), backend) != null) {
                throw new IllegalArgumentException("Duplicate backend for kind: " + backend.kind());
            }
        }
        this.backends = Collections.unmodifiableMap(byKind);
    }

    /**
     * BackendRegistry 생성.
     *
     * @param backends 등록할 백엔드들
     * @return BackendRegistry 인스턴스
     * @throws IllegalArgumentException null이거나 같은 종류가 중복된 경우
     */
    public static BackendRegistry of(Backend... backends) {
        if (backends == null) {
            throw new IllegalArgumentException("backends cannot be null");
        }
        return new BackendRegistry(List.of(backends));
    }

    /**
     * BackendRegistry 생성.
     *
     * @param backends 등록할 백엔드 목록
     * @return BackendRegistry 인스턴스
     * @throws IllegalArgumentException null이거나 같은 종류가 중복된 경우
     */
    public static BackendRegistry of(Collection<? extends Backend> backends) {
        return new BackendRegistry(backends);
    }

    /**
     * 종류에 해당하는 백엔드 조회.
     *
     * @param kind 저장소 종류
     * @return 등록된 백엔드
     * @throws IllegalArgumentException kind가 null이거나 등록되지 않은 경우
     */
    public Backend get(BackendKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        Backend backend = backends.get(kind);
        if (backend == null) {
            throw new IllegalArgumentException("No backend registered for kind: " + kind);
        }
        return backend;
    }

    /**
     * 종류 등록 여부.
     *
     * @param kind 저장소 종류
     * @return 등록되어 있으면 true
     */
    public boolean contains(BackendKind kind) {
        return kind != null && backends.containsKey(kind);
    }

    /**
     * 등록된 종류 목록.
     *
     * @return 저장소 종류 집합
     */
    public Set<BackendKind> kinds() {
        return backends.keySet();
    }
}
