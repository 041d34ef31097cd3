package com.ryuqq.reskit.core.outcome;

import com.ryuqq.reskit.core.model.Asset;
import com.ryuqq.reskit.core.model.ResourceKey;

/**
 * 로드 성공.
 *
 * <p>Loaded를 받은 호출자는 해당 리소스에 대한 참조 하나를 보유하며,
 * 사용이 끝나면 반드시 해제해야 합니다.</p>
 *
 * @param key 리소스 키
 * @param asset 로드된 리소스
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public record Loaded(ResourceKey key, Asset asset) implements LoadResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key 또는 asset이 null인 경우
     */
    public Loaded {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (asset == null) {
            throw new IllegalArgumentException("asset cannot be null");
        }
    }
}
