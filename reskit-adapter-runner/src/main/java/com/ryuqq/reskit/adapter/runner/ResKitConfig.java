package com.ryuqq.reskit.adapter.runner;

/**
 * ResKit 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>preloadBatchSize: 미리 로드 시 한 배치에 동시에 요청할 리소스 수 (기본 5)</li>
 * </ul>
 *
 * <p>배치가 크면 백엔드에 동시 요청이 몰리고, 작으면 배치 사이의 스케줄링
 * 양보가 잦아집니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 * @param preloadBatchSize 미리 로드 배치 크기 (1 이상이어야 함)
 */
public record ResKitConfig(int preloadBatchSize) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: preloadBatchSize=5</p>
     */
    public ResKitConfig() {
        this(5);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ResKitConfig {
        if (preloadBatchSize <= 0) {
            throw new IllegalArgumentException(
                "preloadBatchSize must be positive (current: " + preloadBatchSize + ")"
            );
        }
    }

    /**
     * preloadBatchSize만 변경한 새 인스턴스 생성.
     *
     * @param preloadBatchSize 새로운 배치 크기
     * @return 새 ResKitConfig 인스턴스
     */
    public ResKitConfig withPreloadBatchSize(int preloadBatchSize) {
        return new ResKitConfig(preloadBatchSize);
    }
}
