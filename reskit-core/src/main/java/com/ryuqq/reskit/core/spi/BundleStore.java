package com.ryuqq.reskit.core.spi;

import com.ryuqq.reskit.core.model.Asset;
import com.ryuqq.reskit.core.model.ResourceKey;
import com.ryuqq.reskit.core.outcome.LoadResult;

import java.util.concurrent.CompletableFuture;

/**
 * 아카이브(번들) 저장소 SPI.
 *
 * <p>번들 단위의 원시 입출력만 담당합니다. 번들 간 의존성 해석과 참조 카운트는
 * 의존성 그래프가 관리하며, 이 SPI는 번들 하나를 읽고 해제하는 방법만 제공합니다.</p>
 *
 * <p>번들 조회 결과의 키는 {@code ResourceKey.of(BackendKind.ARCHIVE, bundleName)}
 * 형식을 사용합니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public interface BundleStore {

    /**
     * 매니페스트 동기 조회.
     *
     * @return 번들 매니페스트
     */
    BundleManifest readManifest();

    /**
     * 매니페스트 비동기 조회.
     *
     * @return 번들 매니페스트 future
     */
    CompletableFuture<BundleManifest> readManifestAsync();

    /**
     * 번들 동기 조회 지원 여부.
     *
     * @return 동기 조회를 지원하면 true
     */
    boolean supportsSyncFetch();

    /**
     * 번들 동기 조회.
     *
     * @param bundleName 번들 이름
     * @return 조회 결과 (성공 시 번들 자체가 Asset)
     */
    LoadResult fetchBundleSync(String bundleName);

    /**
     * 번들 비동기 조회.
     *
     * @param bundleName 번들 이름
     * @return 조회 결과 future
     */
    CompletableFuture<LoadResult> fetchBundleAsync(String bundleName);

    /**
     * 로드된 번들에서 에셋 동기 조회.
     *
     * @param bundle 로드된 번들
     * @param key 에셋 키
     * @return 조회 결과
     */
    LoadResult loadAssetSync(Asset bundle, ResourceKey key);

    /**
     * 로드된 번들에서 에셋 비동기 조회.
     *
     * @param bundle 로드된 번들
     * @param key 에셋 키
     * @return 조회 결과 future
     */
    CompletableFuture<LoadResult> loadAssetAsync(Asset bundle, ResourceKey key);

    /**
     * 번들 해제.
     *
     * @param bundleName 번들 이름
     * @param bundle 해제할 번들
     */
    void releaseBundle(String bundleName, Asset bundle);
}
