package com.ryuqq.reskit.core.outcome;

import com.ryuqq.reskit.core.model.ResourceKey;

/**
 * 리소스 없음.
 *
 * <p>백엔드가 리소스를 찾지 못했거나, 만료된 로더 버전으로 완료된 비동기 결과가
 * 폐기된 경우입니다. 어느 경우에도 호출자는 참조를 보유하지 않습니다.</p>
 *
 * @param key 리소스 키
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public record NotFound(ResourceKey key) implements LoadResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key가 null인 경우
     */
    public NotFound {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }
}
