package com.ryuqq.reskit.testkit.contract;

import com.ryuqq.reskit.application.loader.ResLoader;
import com.ryuqq.reskit.core.model.BackendKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: 참조 카운트.
 *
 * <p><strong>테스트 시나리오:</strong></p>
 * <ul>
 *   <li>N개 로더가 같은 키를 로드 → 참조 N, 조회 1회</li>
 *   <li>각 로더가 한 번씩 해제 → 0에서 항목 제거, 백엔드 해제 1회</li>
 *   <li>같은 로더의 중복 로드/해제는 참조를 늘리거나 줄이지 않음</li>
 *   <li>로더 반납은 보유 참조를 모두 해제</li>
 * </ul>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
class RefCountContractTest extends AbstractContractTest {

    private static final String HERO = "ui/hero.model";

    @Test
    void nLoadersSameKey_RefCountEqualsLoaderCount() {
        // Given
        flatFiles.put(HERO, "mesh");
        List<ResLoader> loaders = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            loaders.add(kit.allocate(BackendKind.FLAT_FILE));
        }

        // When
        loaders.forEach(loader -> assertLoaded(loader.load(HERO)));

        // Then
        assertRefCount(BackendKind.FLAT_FILE, HERO, 3);
        assertThat(flatFiles.fetchCount(HERO)).isEqualTo(1);

        // When: 각 로더가 한 번씩 해제
        loaders.get(0).unload(HERO);
        assertRefCount(BackendKind.FLAT_FILE, HERO, 2);
        loaders.get(1).unload(HERO);
        assertRefCount(BackendKind.FLAT_FILE, HERO, 1);
        assertThat(flatFiles.releaseCount(HERO)).isZero();
        loaders.get(2).unload(HERO);

        // Then
        assertNotCached(BackendKind.FLAT_FILE, HERO);
        assertThat(flatFiles.releaseCount(HERO)).isEqualTo(1);
    }

    @Test
    void sameLoaderLoadsTwice_HoldsSingleReference() {
        // Given
        flatFiles.put(HERO, "mesh");
        ResLoader loader = kit.allocate(BackendKind.FLAT_FILE);

        // When
        loader.load(HERO);
        loader.load(HERO);

        // Then
        assertRefCount(BackendKind.FLAT_FILE, HERO, 1);
        assertThat(loader.ownedPaths()).containsExactly(HERO);
    }

    @Test
    void unloadTwice_SecondIsNoOp() {
        // Given
        flatFiles.put(HERO, "mesh");
        ResLoader first = kit.allocate(BackendKind.FLAT_FILE);
        ResLoader second = kit.allocate(BackendKind.FLAT_FILE);
        first.load(HERO);
        second.load(HERO);

        // When
        first.unload(HERO);
        first.unload(HERO);

        // Then
        assertRefCount(BackendKind.FLAT_FILE, HERO, 1);
        assertThat(second.isLoaded(HERO)).isTrue();
    }

    @Test
    void reloadAfterFullRelease_FetchesAgain() {
        // Given
        flatFiles.put(HERO, "mesh");
        ResLoader loader = kit.allocate(BackendKind.FLAT_FILE);
        loader.load(HERO);
        loader.unload(HERO);

        // When
        assertLoaded(loader.load(HERO));

        // Then
        assertThat(flatFiles.fetchCount(HERO)).isEqualTo(2);
        assertRefCount(BackendKind.FLAT_FILE, HERO, 1);
    }

    @Test
    void recycle_ReleasesEveryOwnedReference() {
        // Given
        flatFiles.put("a.tex", "a").put("b.tex", "b");
        ResLoader loader = kit.allocate(BackendKind.FLAT_FILE);
        loader.load("a.tex");
        loader.load("b.tex");

        // When
        boolean recycled = kit.recycle(loader);

        // Then
        assertThat(recycled).isTrue();
        assertThat(cache.size()).isZero();
        assertThat(flatFiles.releaseCount("a.tex")).isEqualTo(1);
        assertThat(flatFiles.releaseCount("b.tex")).isEqualTo(1);
    }

    @Test
    void missingResource_NotFoundAndNothingCached() {
        // Given
        ResLoader loader = kit.allocate(BackendKind.FLAT_FILE);

        // When
        assertNotFound(loader.load("missing.tex"));

        // Then
        assertNotCached(BackendKind.FLAT_FILE, "missing.tex");
        assertThat(loader.ownedPaths()).isEmpty();
    }

    @Test
    void blankOrOversizedPath_NotFoundOnEveryLoadPath() {
        // Given
        ResLoader flat = kit.allocate(BackendKind.FLAT_FILE);
        ResLoader archive = kit.allocate(BackendKind.ARCHIVE);
        String oversized = "x".repeat(1025);

        // When & Then
        assertNotFound(flat.load(""));
        assertNotFound(flat.loadAsync(oversized).join());
        assertNotFound(archive.load("   "));
        flat.preloadAsync(List.of("", oversized), null).join();

        assertThat(flat.ownedPaths()).isEmpty();
        assertThat(archive.ownedPaths()).isEmpty();
        assertThat(cache.size()).isZero();
        assertThat(flatFiles.fetchCount("")).isZero();
    }
}
