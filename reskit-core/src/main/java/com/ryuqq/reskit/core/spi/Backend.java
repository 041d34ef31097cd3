package com.ryuqq.reskit.core.spi;

import com.ryuqq.reskit.core.model.Asset;
import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.ResourceKey;
import com.ryuqq.reskit.core.outcome.LoadResult;

import java.util.concurrent.CompletableFuture;

/**
 * 리소스 저장소 SPI.
 *
 * <p>저장소 종류({@link BackendKind})마다 하나의 구현체가 생성 시점에 등록됩니다.
 * 엔진은 런타임 타입 검사 없이 이 인터페이스만 사용합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>fetchSync/fetchAsync: 결과는 {@link LoadResult} 값으로 반환. 예외를 던지거나
 *       예외로 완료된 future는 엔진이 {@code BACKEND_FAILURE}로 변환</li>
 *   <li>fetchSync: {@link #supportsSyncFetch()}가 false이면 호출되지 않음</li>
 *   <li>release: 캐시 항목이 파괴될 때 항목당 정확히 한 번 호출됨</li>
 *   <li>엔진의 잠금을 보유한 상태로 호출되지 않음. future 완료 콜백은 완료시키는 스레드에서 실행</li>
 * </ul>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public interface Backend {

    /**
     * 이 백엔드가 담당하는 저장소 종류.
     *
     * @return 저장소 종류
     */
    BackendKind kind();

    /**
     * 동기 조회 지원 여부.
     *
     * @return 동기 조회를 지원하면 true
     */
    boolean supportsSyncFetch();

    /**
     * 리소스 동기 조회.
     *
     * @param key 리소스 키
     * @return 조회 결과
     */
    LoadResult fetchSync(ResourceKey key);

    /**
     * 리소스 비동기 조회.
     *
     * @param key 리소스 키
     * @return 조회 결과 future
     */
    CompletableFuture<LoadResult> fetchAsync(ResourceKey key);

    /**
     * 리소스 해제.
     *
     * <p>참조 카운트가 0에 도달해 캐시에서 제거된 리소스에 대해 호출됩니다.</p>
     *
     * @param key 리소스 키
     * @param asset 해제할 리소스
     */
    void release(ResourceKey key, Asset asset);
}
