package com.ryuqq.reskit.core.outcome;

import com.ryuqq.reskit.core.model.ResourceKey;

/**
 * 리소스 로드 결과.
 *
 * <p>LoadResult는 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Loaded}: 로드 성공, 호출자는 참조 하나를 보유</li>
 *   <li>{@link NotFound}: 리소스 없음 (또는 만료된 로더의 결과가 폐기됨)</li>
 *   <li>{@link Failure}: 백엔드 오류 등으로 로드 실패</li>
 * </ul>
 *
 * <p>로드 실패는 예외가 아닌 값으로 전달됩니다. 예외는 null 인자나 풀에 반납된
 * 로더 사용 같은 프로그래밍 오류에만 사용됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * LoadResult result = loader.load("ui/hero.model");
 * if (result instanceof Loaded loaded) {
 *     render(loaded.asset());
 * } else if (result instanceof Failure failure) {
 *     log.warn("Load failed: {}", failure.errorCode());
 * }
 * </pre>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public sealed interface LoadResult permits Loaded, NotFound, Failure {

    /**
     * 요청된 리소스 키.
     *
     * @return 리소스 키
     */
    ResourceKey key();

    /**
     * 로드 성공 여부.
     *
     * @return 성공 여부
     */
    default boolean isLoaded() {
        return this instanceof Loaded;
    }

    /**
     * 리소스 없음 여부.
     *
     * @return 리소스 없음 여부
     */
    default boolean isNotFound() {
        return this instanceof NotFound;
    }

    /**
     * 실패 여부.
     *
     * @return 실패 여부
     */
    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * 같은 결과를 다른 키로 다시 표현.
     *
     * <p>번들 로드 결과를 에셋 요청의 결과로 돌려줄 때처럼, 내부 요청의 결과를
     * 바깥 요청의 키로 전달할 때 사용합니다.</p>
     *
     * @param key 새 리소스 키
     * @return 키만 바뀐 결과 (키가 같으면 this)
     * @throws IllegalArgumentException key가 null인 경우
     */
    default LoadResult withKey(ResourceKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (key.equals(key())) {
            return this;
        }
        if (this instanceof Loaded loaded) {
            return new Loaded(key, loaded.asset());
        }
        if (this instanceof Failure failure) {
            return new Failure(key, failure.errorCode(), failure.message());
        }
        return new NotFound(key);
    }
}
