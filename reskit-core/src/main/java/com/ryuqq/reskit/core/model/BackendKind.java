package com.ryuqq.reskit.core.model;

/**
 * 리소스 저장소 종류.
 *
 * <p>각 종류마다 정확히 하나의 {@link com.ryuqq.reskit.core.spi.Backend}가 등록되며,
 * 캐시 키의 접두사({@code KIND://path})로도 사용됩니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public enum BackendKind {

    /**
     * 단일 파일 단위 저장소 (동기/비동기 모두 지원).
     */
    FLAT_FILE,

    /**
     * 번들(아카이브) 저장소. 번들 간 의존성 그래프를 가집니다.
     */
    ARCHIVE,

    /**
     * 원격 패키지 저장소. 일반적으로 비동기 조회만 지원합니다.
     */
    REMOTE_PACKAGE
}
