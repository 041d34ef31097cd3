package com.ryuqq.reskit.adapter.inmemory;

import com.ryuqq.reskit.adapter.inmemory.archive.InMemoryBundleStore;
import com.ryuqq.reskit.adapter.inmemory.backend.InMemoryBackend;
import com.ryuqq.reskit.adapter.runner.DefaultResKit;
import com.ryuqq.reskit.adapter.runner.ResKitConfig;
import com.ryuqq.reskit.adapter.runner.archive.ArchiveBackend;
import com.ryuqq.reskit.adapter.runner.archive.DependencyGraph;
import com.ryuqq.reskit.application.loader.ResLoader;
import com.ryuqq.reskit.core.cache.BackendRegistry;
import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.ResourceKey;
import com.ryuqq.reskit.core.outcome.LoadResult;
import com.ryuqq.reskit.core.spi.BundleManifest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * In-memory 어댑터 통합 테스트.
 *
 * <p>실제 스레드 풀에서 비동기 조회가 완료되는 환경으로 전체 흐름을 검증합니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
class InMemoryResKitIntegrationTest {

    private ExecutorService executor;
    private InMemoryBackend files;
    private InMemoryBackend packages;
    private InMemoryBundleStore bundleStore;
    private DefaultResKit kit;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        files = new InMemoryBackend(BackendKind.FLAT_FILE, true, executor);
        packages = new InMemoryBackend(BackendKind.REMOTE_PACKAGE, false, executor);

        Map<String, List<String>> dependencies = new LinkedHashMap<>();
        dependencies.put("ui_atlas", List.of("shaders"));
        dependencies.put("shaders", List.of());
        BundleManifest manifest = new BundleManifest(dependencies, Map.of("ui/atlas.png", "ui_atlas"));
        Map<String, Map<String, Object>> bundles = new LinkedHashMap<>();
        bundles.put("ui_atlas", Map.of("ui/atlas.png", "atlas-pixels"));
        bundles.put("shaders", Map.of());
        bundleStore = new InMemoryBundleStore(manifest, bundles, true, executor);

        BackendRegistry backends = BackendRegistry.of(
            files, packages, new ArchiveBackend(new DependencyGraph(bundleStore), bundleStore));
        kit = new DefaultResKit(backends, new ResKitConfig(3), executor);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void concurrentLoaders_ShareOneFetchAndReleaseOnce() throws Exception {
        // Given
        packages.put("dlc/level1.pak", "pak");
        int loaderCount = 8;
        List<ResLoader> loaders = new ArrayList<>();
        for (int i = 0; i < loaderCount; i++) {
            loaders.add(kit.allocate(BackendKind.REMOTE_PACKAGE));
        }
        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<LoadResult>> results = new CopyOnWriteArrayList<>();
        List<Thread> threads = new ArrayList<>();
        for (ResLoader loader : loaders) {
            Thread thread = new Thread(() -> {
                try {
                    start.await();
                    results.add(loader.loadAsync("dlc/level1.pak"));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            threads.add(thread);
            thread.start();
        }

        // When
        start.countDown();
        for (Thread thread : threads) {
            thread.join(5000);
        }
        CompletableFuture.allOf(results.toArray(new CompletableFuture<?>[0])).get(5, TimeUnit.SECONDS);

        // Then
        assertThat(results).hasSize(loaderCount).allMatch(f -> f.join().isLoaded());
        assertThat(packages.fetchCount()).isEqualTo(1);
        assertThat(kit.cache().refCount(ResourceKey.of(BackendKind.REMOTE_PACKAGE, "dlc/level1.pak")))
            .isEqualTo(loaderCount);

        // When
        loaders.forEach(kit::recycle);

        // Then
        assertThat(kit.cache().size()).isZero();
        assertThat(packages.releaseCount()).isEqualTo(1);
    }

    @Test
    void preload_ReportsProgressPerBatch() throws Exception {
        // Given
        List<String> paths = List.of("t0.tex", "t1.tex", "t2.tex", "t3.tex", "t4.tex");
        paths.forEach(p -> files.put(p, "pixels:" + p));
        ResLoader loader = kit.allocate(BackendKind.FLAT_FILE);
        List<Double> progress = new CopyOnWriteArrayList<>();

        // When
        loader.preloadAsync(paths, progress::add).get(5, TimeUnit.SECONDS);

        // Then
        assertThat(progress).containsExactly(0.6, 1.0);
        assertThat(loader.ownedPaths()).containsExactlyInAnyOrderElementsOf(paths);
    }

    @Test
    void archiveAsset_LoadsBundleClosureAndReleasesOnRecycle() throws Exception {
        // Given
        ResLoader loader = kit.allocate(BackendKind.ARCHIVE);

        // When
        LoadResult result = loader.loadAsync("ui/atlas.png").get(5, TimeUnit.SECONDS);

        // Then
        assertThat(result.isLoaded()).isTrue();
        assertThat(bundleStore.fetchCount("ui_atlas")).isEqualTo(1);
        assertThat(bundleStore.fetchCount("shaders")).isEqualTo(1);

        // When
        kit.recycle(loader);

        // Then
        assertThat(bundleStore.releaseCount("ui_atlas")).isEqualTo(1);
        assertThat(bundleStore.releaseCount("shaders")).isZero();
    }

    @Test
    void syncLoad_FlatFile_AvailableImmediately() {
        // Given
        files.put("ui/hero.model", "mesh");
        ResLoader loader = kit.allocate(BackendKind.FLAT_FILE);

        // When
        LoadResult result = loader.load("ui/hero.model");

        // Then
        assertThat(result.isLoaded()).isTrue();
        assertThat(loader.isLoaded("ui/hero.model")).isTrue();
    }
}
