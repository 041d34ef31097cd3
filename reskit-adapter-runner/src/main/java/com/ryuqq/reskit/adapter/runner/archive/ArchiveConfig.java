package com.ryuqq.reskit.adapter.runner.archive;

/**
 * 아카이브 백엔드 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pinnedBundle: 참조 카운트와 관계없이 해제되지 않는 번들 (기본 "shaders", null이면 고정 없음)</li>
 *   <li>preloadPinned: 초기화 시 고정 번들을 미리 로드할지 여부 (기본 true)</li>
 * </ul>
 *
 * @author ResKit Team
 * @since 1.0.0
 * @param pinnedBundle 고정 번들 이름 (null 가능, 빈 문자열 불가)
 * @param preloadPinned 고정 번들 미리 로드 여부
 */
public record ArchiveConfig(String pinnedBundle, boolean preloadPinned) {

    /**
     * 기본 고정 번들 이름.
     */
    public static final String DEFAULT_PINNED_BUNDLE = "shaders";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pinnedBundle="shaders", preloadPinned=true</p>
     */
    public ArchiveConfig() {
        this(DEFAULT_PINNED_BUNDLE, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException pinnedBundle이 빈 문자열인 경우
     */
    public ArchiveConfig {
        if (pinnedBundle != null && pinnedBundle.isBlank()) {
            throw new IllegalArgumentException("pinnedBundle cannot be blank (use null to disable pinning)");
        }
    }

    /**
     * 고정 번들 설정 여부.
     *
     * @return 고정 번들이 있으면 true
     */
    public boolean hasPinnedBundle() {
        return pinnedBundle != null;
    }

    /**
     * pinnedBundle만 변경한 새 인스턴스 생성.
     *
     * @param pinnedBundle 새로운 고정 번들 이름 (null이면 고정 없음)
     * @return 새 ArchiveConfig 인스턴스
     */
    public ArchiveConfig withPinnedBundle(String pinnedBundle) {
        return new ArchiveConfig(pinnedBundle, this.preloadPinned);
    }

    /**
     * preloadPinned만 변경한 새 인스턴스 생성.
     *
     * @param preloadPinned 새로운 미리 로드 여부
     * @return 새 ArchiveConfig 인스턴스
     */
    public ArchiveConfig withPreloadPinned(boolean preloadPinned) {
        return new ArchiveConfig(this.pinnedBundle, preloadPinned);
    }
}
