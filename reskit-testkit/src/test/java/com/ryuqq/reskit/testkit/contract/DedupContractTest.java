package com.ryuqq.reskit.testkit.contract;

import com.ryuqq.reskit.application.loader.ResLoader;
import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.outcome.ErrorCode;
import com.ryuqq.reskit.core.outcome.Failure;
import com.ryuqq.reskit.core.outcome.LoadResult;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: 진행 중 요청 중복 제거.
 *
 * <p><strong>테스트 시나리오:</strong></p>
 * <ul>
 *   <li>완료 전 두 번의 로드 → 백엔드 조회 1회, 두 요청 모두 같은 결과</li>
 *   <li>실패는 모든 대기자에게 전달되고 캐시에 남지 않음</li>
 *   <li>비동기 전용 백엔드의 동기 로드 → SYNC_UNSUPPORTED</li>
 * </ul>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
class DedupContractTest extends AbstractContractTest {

    private static final String PACKAGE = "dlc/level1.pak";

    @Test
    void twoLoadsBeforeSettlement_SingleFetch() {
        // Given
        remote.put(PACKAGE, "pak");
        ResLoader first = kit.allocate(BackendKind.REMOTE_PACKAGE);
        ResLoader second = kit.allocate(BackendKind.REMOTE_PACKAGE);

        // When
        CompletableFuture<LoadResult> a = first.loadAsync(PACKAGE);
        CompletableFuture<LoadResult> b = second.loadAsync(PACKAGE);

        // Then: 하나의 요청만 진행 중
        assertThat(remote.fetchCount(PACKAGE)).isEqualTo(1);
        assertThat(kit.coordinator().isInFlight(key(BackendKind.REMOTE_PACKAGE, PACKAGE))).isTrue();
        assertThat(a).isNotDone();

        // When
        remote.complete(PACKAGE);

        // Then
        assertLoaded(a.join());
        assertLoaded(b.join());
        assertRefCount(BackendKind.REMOTE_PACKAGE, PACKAGE, 2);
        assertThat(kit.coordinator().inFlightCount()).isZero();
    }

    @Test
    void sameLoaderTwiceBeforeSettlement_HoldsSingleReference() {
        // Given
        remote.put(PACKAGE, "pak");
        ResLoader loader = kit.allocate(BackendKind.REMOTE_PACKAGE);

        // When
        CompletableFuture<LoadResult> a = loader.loadAsync(PACKAGE);
        CompletableFuture<LoadResult> b = loader.loadAsync(PACKAGE);
        remote.complete(PACKAGE);

        // Then
        assertLoaded(a.join());
        assertLoaded(b.join());
        assertThat(remote.fetchCount(PACKAGE)).isEqualTo(1);
        assertRefCount(BackendKind.REMOTE_PACKAGE, PACKAGE, 1);
    }

    @Test
    void failedFetch_DeliveredToAllWaitersAndRetriedLater() {
        // Given
        ResLoader first = kit.allocate(BackendKind.REMOTE_PACKAGE);
        ResLoader second = kit.allocate(BackendKind.REMOTE_PACKAGE);
        CompletableFuture<LoadResult> a = first.loadAsync(PACKAGE);
        CompletableFuture<LoadResult> b = second.loadAsync(PACKAGE);

        // When
        remote.fail(PACKAGE, new IllegalStateException("connection reset"));

        // Then
        assertThat(a.join()).isInstanceOf(Failure.class);
        assertThat(((Failure) b.join()).message()).isEqualTo("connection reset");
        assertNotCached(BackendKind.REMOTE_PACKAGE, PACKAGE);
        assertThat(first.isLoaded(PACKAGE)).isFalse();

        // When: 다시 요청하면 새로 조회
        remote.put(PACKAGE, "pak");
        CompletableFuture<LoadResult> retry = first.loadAsync(PACKAGE);
        remote.complete(PACKAGE);

        // Then
        assertLoaded(retry.join());
        assertThat(remote.fetchCount(PACKAGE)).isEqualTo(2);
    }

    @Test
    void notFound_DeliveredToAllWaiters() {
        // Given
        ResLoader first = kit.allocate(BackendKind.REMOTE_PACKAGE);
        ResLoader second = kit.allocate(BackendKind.REMOTE_PACKAGE);
        CompletableFuture<LoadResult> a = first.loadAsync(PACKAGE);
        CompletableFuture<LoadResult> b = second.loadAsync(PACKAGE);

        // When
        remote.completeNotFound(PACKAGE);

        // Then
        assertNotFound(a.join());
        assertNotFound(b.join());
        assertNotCached(BackendKind.REMOTE_PACKAGE, PACKAGE);
    }

    @Test
    void syncLoadOnAsyncOnlyBackend_SyncUnsupported() {
        // Given
        remote.put(PACKAGE, "pak");
        ResLoader loader = kit.allocate(BackendKind.REMOTE_PACKAGE);

        // When
        LoadResult result = loader.load(PACKAGE);

        // Then
        assertThat(result).isInstanceOf(Failure.class);
        assertThat(((Failure) result).errorCode()).isEqualTo(ErrorCode.SYNC_UNSUPPORTED);
        assertThat(remote.fetchCount(PACKAGE)).isZero();
    }

    @Test
    void cachedKey_ServedWithoutFetch() {
        // Given
        flatFiles.put("ui/hero.model", "mesh");
        ResLoader first = kit.allocate(BackendKind.FLAT_FILE);
        first.load("ui/hero.model");
        ResLoader second = kit.allocate(BackendKind.FLAT_FILE);

        // When
        LoadResult result = second.loadAsync("ui/hero.model").join();

        // Then
        assertLoaded(result);
        assertThat(flatFiles.fetchCount("ui/hero.model")).isEqualTo(1);
        assertRefCount(BackendKind.FLAT_FILE, "ui/hero.model", 2);
    }
}
