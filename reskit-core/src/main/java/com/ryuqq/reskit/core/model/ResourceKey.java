package com.ryuqq.reskit.core.model;

/**
 * 캐시 내 리소스를 식별하는 키.
 *
 * <p>ResourceKey는 (저장소 종류, 경로) 쌍으로 구성되며, 같은 경로라도 저장소 종류가
 * 다르면 서로 다른 리소스로 취급됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>kind: null 불가</li>
 *   <li>path: null 또는 빈 문자열 불가, 길이 1~1024자</li>
 * </ul>
 *
 * <p>유효하지 않은 경로는 {@link #unaddressable(BackendKind, String)}로만 키를 만들 수 있으며,
 * 이 키는 NotFound 결과를 보고하는 데만 쓰이고 캐시나 백엔드에 전달되지 않습니다.</p>
 *
 * <p><strong>캐시 키 형식:</strong> {@code KIND://path} (예: {@code FLAT_FILE://ui/hero.model})</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public final class ResourceKey {

    private static final int MAX_PATH_LENGTH = 1024;

    private final BackendKind kind;
    private final String path;

    private ResourceKey(BackendKind kind, String path, boolean validate) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (validate && path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        if (validate && path.length() > MAX_PATH_LENGTH) {
            throw new IllegalArgumentException("path length cannot exceed " + MAX_PATH_LENGTH + " characters");
        }
        this.kind = kind;
        this.path = path;
    }

    /**
     * ResourceKey 생성.
     *
     * @param kind 저장소 종류
     * @param path 저장소 내 경로
     * @return ResourceKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ResourceKey of(BackendKind kind, String path) {
        return new ResourceKey(kind, path, true);
    }

    /**
     * 경로 유효성 확인.
     *
     * @param path 저장소 내 경로
     * @return 공백이 아니고 1024자 이하이면 true
     */
    public static boolean isValidPath(String path) {
        return path != null && !path.isBlank() && path.length() <= MAX_PATH_LENGTH;
    }

    /**
     * 유효하지 않은 경로에 대한 보고용 키 생성.
     *
     * <p>경로 규칙을 검사하지 않습니다. 반환된 키는 NotFound 결과에만 담기며
     * 캐시 조회나 백엔드 호출에 사용하면 안 됩니다.</p>
     *
     * @param kind 저장소 종류
     * @param path 호출자가 전달한 경로
     * @return ResourceKey 인스턴스
     * @throws IllegalArgumentException kind 또는 path가 null인 경우
     */
    public static ResourceKey unaddressable(BackendKind kind, String path) {
        return new ResourceKey(kind, path, false);
    }

    /**
     * 저장소 종류 조회.
     *
     * @return 저장소 종류
     */
    public BackendKind getKind() {
        return kind;
    }

    /**
     * 경로 조회.
     *
     * @return 저장소 내 경로
     */
    public String getPath() {
        return path;
    }

    /**
     * 캐시 키 문자열 형식으로 변환.
     *
     * @return {@code KIND://path} 형식의 문자열
     */
    public String asCacheKey() {
        return kind.name() + "://" + path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceKey that = (ResourceKey) o;
        return kind == that.kind && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + path.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceKey{" + asCacheKey() + '}';
    }
}
