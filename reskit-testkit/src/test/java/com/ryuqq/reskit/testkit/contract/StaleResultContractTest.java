package com.ryuqq.reskit.testkit.contract;

import com.ryuqq.reskit.application.loader.ResLoader;
import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.LoaderId;
import com.ryuqq.reskit.core.outcome.LoadResult;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: 만료된 결과 폐기.
 *
 * <p>로더가 일괄 해제되거나 풀로 반납된 뒤 도착한 결과는 로더에 귀속되지 않고
 * 획득한 참조가 즉시 해제되어야 합니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
class StaleResultContractTest extends AbstractContractTest {

    private static final String PACKAGE = "dlc/level2.pak";

    @Test
    void releaseAllBeforeSettlement_NoReferenceHeld() {
        // Given
        remote.put(PACKAGE, "pak");
        ResLoader loader = kit.allocate(BackendKind.REMOTE_PACKAGE);
        CompletableFuture<LoadResult> pending = loader.loadAsync(PACKAGE);

        // When
        loader.releaseAll();
        remote.complete(PACKAGE);

        // Then
        assertNotFound(pending.join());
        assertThat(loader.isLoaded(PACKAGE)).isFalse();
        assertNotCached(BackendKind.REMOTE_PACKAGE, PACKAGE);
        assertThat(remote.releaseCount(PACKAGE)).isEqualTo(1);
    }

    @Test
    void recycleBeforeSettlement_ReallocatedLoaderDoesNotInheritResult() {
        // Given
        remote.put(PACKAGE, "pak");
        ResLoader loader = kit.allocate(BackendKind.REMOTE_PACKAGE);
        LoaderId firstId = loader.id();
        CompletableFuture<LoadResult> pending = loader.loadAsync(PACKAGE);
        kit.recycle(loader);

        // When: 같은 슬롯이 새 세대로 재할당된 뒤 결과 도착
        ResLoader reused = kit.allocate(BackendKind.REMOTE_PACKAGE);
        remote.complete(PACKAGE);

        // Then
        assertThat(reused.id().slot()).isEqualTo(firstId.slot());
        assertThat(reused.id().generation()).isGreaterThan(firstId.generation());
        assertNotFound(pending.join());
        assertThat(reused.ownedPaths()).isEmpty();
        assertNotCached(BackendKind.REMOTE_PACKAGE, PACKAGE);
        assertThat(kit.resolve(firstId)).isEmpty();
    }

    @Test
    void staleResultSharedWithLiveLoader_OnlyStaleReferenceDropped() {
        // Given
        remote.put(PACKAGE, "pak");
        ResLoader leaving = kit.allocate(BackendKind.REMOTE_PACKAGE);
        ResLoader staying = kit.allocate(BackendKind.REMOTE_PACKAGE);
        CompletableFuture<LoadResult> dropped = leaving.loadAsync(PACKAGE);
        CompletableFuture<LoadResult> kept = staying.loadAsync(PACKAGE);

        // When
        leaving.releaseAll();
        remote.complete(PACKAGE);

        // Then
        assertNotFound(dropped.join());
        assertLoaded(kept.join());
        assertRefCount(BackendKind.REMOTE_PACKAGE, PACKAGE, 1);
        assertThat(remote.releaseCount(PACKAGE)).isZero();
        assertThat(staying.isLoaded(PACKAGE)).isTrue();
    }

    @Test
    void loadAfterReleaseAll_CountsAgainstNewVersion() {
        // Given
        remote.put(PACKAGE, "pak");
        ResLoader loader = kit.allocate(BackendKind.REMOTE_PACKAGE);
        CompletableFuture<LoadResult> stale = loader.loadAsync(PACKAGE);
        loader.releaseAll();

        // When: 해제 이후 다시 요청하면 같은 진행 중 요청에 합류
        CompletableFuture<LoadResult> fresh = loader.loadAsync(PACKAGE);
        remote.complete(PACKAGE);

        // Then
        assertNotFound(stale.join());
        assertLoaded(fresh.join());
        assertThat(remote.fetchCount(PACKAGE)).isEqualTo(1);
        assertRefCount(BackendKind.REMOTE_PACKAGE, PACKAGE, 1);
        assertThat(loader.ownedPaths()).containsExactly(PACKAGE);
    }
}
