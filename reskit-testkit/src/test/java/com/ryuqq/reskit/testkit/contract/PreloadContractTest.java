package com.ryuqq.reskit.testkit.contract;

import com.ryuqq.reskit.adapter.runner.ResKitConfig;
import com.ryuqq.reskit.application.loader.ResLoader;
import com.ryuqq.reskit.core.model.BackendKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: 배치 미리 로드.
 *
 * @author ResKit Team
 * @since 1.0.0
 */
class PreloadContractTest extends AbstractContractTest {

    private static final List<String> PATHS = List.of("p0", "p1", "p2", "p3", "p4");

    @Override
    protected ResKitConfig config() {
        return new ResKitConfig(2);
    }

    @Test
    void batchesStartOnlyAfterPreviousBatchSettles() {
        // Given
        PATHS.forEach(p -> remote.put(p, "data-" + p));
        ResLoader loader = kit.allocate(BackendKind.REMOTE_PACKAGE);
        List<Double> progress = new CopyOnWriteArrayList<>();

        // When
        CompletableFuture<Void> preload = loader.preloadAsync(PATHS, progress::add);

        // Then: 첫 배치만 요청됨
        assertThat(remote.pendingCount("p0")).isEqualTo(1);
        assertThat(remote.pendingCount("p1")).isEqualTo(1);
        assertThat(remote.fetchCount("p2")).isZero();

        // When
        remote.complete("p0");
        remote.complete("p1");

        // Then
        assertThat(progress).containsExactly(0.4);
        assertThat(remote.pendingCount("p2")).isEqualTo(1);

        // When
        remote.complete("p2");
        remote.complete("p3");
        remote.complete("p4");

        // Then
        assertThat(preload).isCompleted();
        assertThat(progress).containsExactly(0.4, 0.8, 1.0);
        assertThat(loader.ownedPaths()).containsExactlyInAnyOrderElementsOf(PATHS);
        PATHS.forEach(p -> assertRefCount(BackendKind.REMOTE_PACKAGE, p, 1));
    }

    @Test
    void emptyList_ReportsCompleteImmediately() {
        // Given
        ResLoader loader = kit.allocate(BackendKind.REMOTE_PACKAGE);
        List<Double> progress = new CopyOnWriteArrayList<>();

        // When
        CompletableFuture<Void> preload = loader.preloadAsync(List.of(), progress::add);

        // Then
        assertThat(preload).isCompleted();
        assertThat(progress).containsExactly(1.0);
    }

    @Test
    void releaseAllMidPreload_AbandonsRemainingBatches() {
        // Given
        PATHS.forEach(p -> remote.put(p, "data-" + p));
        ResLoader loader = kit.allocate(BackendKind.REMOTE_PACKAGE);
        List<Double> progress = new CopyOnWriteArrayList<>();
        CompletableFuture<Void> preload = loader.preloadAsync(PATHS, progress::add);

        // When
        loader.releaseAll();
        remote.complete("p0");
        remote.complete("p1");

        // Then
        assertThat(preload).isCompleted();
        assertThat(progress).isEmpty();
        assertThat(remote.fetchCount("p2")).isZero();
        assertThat(loader.ownedPaths()).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void missingPath_DoesNotStopPreload() {
        // Given
        remote.put("p0", "data").put("p2", "data");
        ResLoader loader = kit.allocate(BackendKind.REMOTE_PACKAGE);
        List<Double> progress = new CopyOnWriteArrayList<>();

        // When
        CompletableFuture<Void> preload = loader.preloadAsync(List.of("p0", "p1", "p2"), progress::add);
        remote.completeAll();
        remote.completeAll();

        // Then
        assertThat(preload).isCompleted();
        assertThat(progress).containsExactly(2.0 / 3, 1.0);
        assertThat(loader.ownedPaths()).containsExactlyInAnyOrder("p0", "p2");
    }
}
