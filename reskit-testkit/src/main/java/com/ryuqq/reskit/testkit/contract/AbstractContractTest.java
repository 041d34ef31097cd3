package com.ryuqq.reskit.testkit.contract;

import com.ryuqq.reskit.adapter.runner.DefaultResKit;
import com.ryuqq.reskit.adapter.runner.ResKitConfig;
import com.ryuqq.reskit.adapter.runner.archive.ArchiveBackend;
import com.ryuqq.reskit.adapter.runner.archive.ArchiveConfig;
import com.ryuqq.reskit.adapter.runner.archive.DependencyGraph;
import com.ryuqq.reskit.core.cache.BackendRegistry;
import com.ryuqq.reskit.core.cache.ResourceCache;
import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.ResourceKey;
import com.ryuqq.reskit.core.outcome.LoadResult;
import com.ryuqq.reskit.core.spi.BundleManifest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test 추상 기반 클래스.
 *
 * <p>스크립트 백엔드 세 종류와 이를 등록한 {@link DefaultResKit}을 테스트마다 새로 구성합니다.
 * 풀의 배치 간 양보는 호출 스레드에서 바로 실행되므로, 모든 진행은 테스트가
 * 백엔드를 완료시키는 시점에 결정됩니다.</p>
 *
 * <p><strong>테스트 인프라:</strong></p>
 * <ul>
 *   <li>flatFiles: FLAT_FILE, 동기 조회 지원</li>
 *   <li>remote: REMOTE_PACKAGE, 비동기 전용</li>
 *   <li>bundleStore / graph: ARCHIVE, {@link #manifest()}의 번들 구성</li>
 * </ul>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void scenario() {
 *         flatFiles.put("ui/hero.model", "mesh");
 *         ResLoader loader = kit.allocate(BackendKind.FLAT_FILE);
 *
 *         loader.load("ui/hero.model");
 *
 *         assertRefCount(BackendKind.FLAT_FILE, "ui/hero.model", 1);
 *     }
 * }
 * </pre>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected ScriptedBackend flatFiles;
    protected ScriptedBackend remote;
    protected ScriptedBundleStore bundleStore;
    protected DependencyGraph graph;
    protected DefaultResKit kit;
    protected ResourceCache cache;

    /**
     * 테스트마다 새 인스턴스 구성.
     */
    @BeforeEach
    void setUpKit() {
        flatFiles = new ScriptedBackend(BackendKind.FLAT_FILE, true);
        remote = new ScriptedBackend(BackendKind.REMOTE_PACKAGE, false);
        bundleStore = new ScriptedBundleStore(manifest(), bundles(), true);
        graph = new DependencyGraph(bundleStore, archiveConfig());

        BackendRegistry backends = BackendRegistry.of(flatFiles, remote, new ArchiveBackend(graph, bundleStore));
        kit = new DefaultResKit(backends, config(), Runnable::run);
        cache = kit.cache();
    }

    /**
     * 테스트 간 간섭 방지를 위한 정리.
     */
    @AfterEach
    void tearDownKit() {
        if (flatFiles != null) {
            flatFiles.clear();
        }
        if (remote != null) {
            remote.clear();
        }
        if (bundleStore != null) {
            bundleStore.clear();
        }
    }

    /**
     * 풀 설정. 하위 클래스에서 재정의 가능.
     *
     * @return 설정
     */
    protected ResKitConfig config() {
        return new ResKitConfig();
    }

    /**
     * 아카이브 설정. 기본은 "shaders" 고정 및 미리 로드.
     *
     * @return 설정
     */
    protected ArchiveConfig archiveConfig() {
        return new ArchiveConfig();
    }

    /**
     * 번들 매니페스트.
     *
     * <p>기본 구성: {@code A → B → C}, {@code ui_atlas → shaders}.
     * 에셋 {@code level/a.map}은 A에, {@code ui/atlas.png}와 {@code ui/icons.png}는
     * ui_atlas에 속합니다.</p>
     *
     * @return 매니페스트
     */
    protected BundleManifest manifest() {
        Map<String, List<String>> dependencies = new LinkedHashMap<>();
        dependencies.put("A", List.of("B"));
        dependencies.put("B", List.of("C"));
        dependencies.put("C", List.of());
        dependencies.put("ui_atlas", List.of("shaders"));
        dependencies.put("shaders", List.of());

        Map<String, String> assetBundles = new LinkedHashMap<>();
        assetBundles.put("level/a.map", "A");
        assetBundles.put("ui/atlas.png", "ui_atlas");
        assetBundles.put("ui/icons.png", "ui_atlas");
        return new BundleManifest(dependencies, assetBundles);
    }

    /**
     * 번들 콘텐츠.
     *
     * @return 번들 이름별 에셋 콘텐츠
     */
    protected Map<String, Map<String, Object>> bundles() {
        Map<String, Map<String, Object>> bundles = new LinkedHashMap<>();
        bundles.put("A", Map.of("level/a.map", "map-data"));
        bundles.put("B", Map.of());
        bundles.put("C", Map.of());
        bundles.put("ui_atlas", Map.of("ui/atlas.png", "atlas-pixels", "ui/icons.png", "icon-pixels"));
        bundles.put("shaders", Map.of());
        return bundles;
    }

    protected static ResourceKey key(BackendKind kind, String path) {
        return ResourceKey.of(kind, path);
    }

    /**
     * 캐시 항목의 참조 카운트 검증.
     *
     * @param kind 백엔드 종류
     * @param path 경로
     * @param expected 기대 참조 카운트
     */
    protected void assertRefCount(BackendKind kind, String path, int expected) {
        assertThat(cache.refCount(key(kind, path)))
            .as("refCount of %s", key(kind, path).asCacheKey())
            .isEqualTo(expected);
    }

    /**
     * 캐시에 항목이 없음을 검증.
     *
     * @param kind 백엔드 종류
     * @param path 경로
     */
    protected void assertNotCached(BackendKind kind, String path) {
        assertThat(cache.contains(key(kind, path)))
            .as("%s should not be cached", key(kind, path).asCacheKey())
            .isFalse();
    }

    protected void assertLoaded(LoadResult result) {
        assertThat(result.isLoaded()).as("expected Loaded but was %s", result).isTrue();
    }

    protected void assertNotFound(LoadResult result) {
        assertThat(result.isNotFound()).as("expected NotFound but was %s", result).isTrue();
    }

    /**
     * 번들 참조 카운트 검증.
     *
     * @param bundleName 번들 이름
     * @param expected 기대 참조 카운트
     */
    protected void assertBundleRefCount(String bundleName, int expected) {
        assertThat(graph.refCount(bundleName))
            .as("refCount of bundle %s", bundleName)
            .isEqualTo(expected);
    }
}
