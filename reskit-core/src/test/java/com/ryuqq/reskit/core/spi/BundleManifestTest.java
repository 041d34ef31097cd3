package com.ryuqq.reskit.core.spi;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BundleManifest 테스트.
 *
 * @author ResKit Team
 * @since 1.0.0
 */
class BundleManifestTest {

    private static BundleManifest chain() {
        Map<String, List<String>> deps = new LinkedHashMap<>();
        deps.put("A", List.of("B"));
        deps.put("B", List.of("C"));
        deps.put("C", List.of());
        return new BundleManifest(deps, Map.of("ui/a.prefab", "A"));
    }

    @Test
    void dependenciesOf_DeclaredBundle_ReturnsDirectDependencies() {
        BundleManifest manifest = chain();

        assertThat(manifest.dependenciesOf("A")).containsExactly("B");
        assertThat(manifest.dependenciesOf("C")).isEmpty();
    }

    @Test
    void dependenciesOf_UnknownBundle_ReturnsEmpty() {
        assertThat(chain().dependenciesOf("Z")).isEmpty();
        assertThat(chain().dependenciesOf(null)).isEmpty();
    }

    @Test
    void transitiveDependenciesOf_Chain_ReturnsLoadOrder() {
        assertThat(chain().transitiveDependenciesOf("A")).containsExactly("C", "B");
    }

    @Test
    void transitiveDependenciesOf_Diamond_ListsSharedDependencyOnce() {
        // Given
        Map<String, List<String>> deps = new LinkedHashMap<>();
        deps.put("top", List.of("left", "right"));
        deps.put("left", List.of("base"));
        deps.put("right", List.of("base"));
        deps.put("base", List.of());

        // When
        BundleManifest manifest = new BundleManifest(deps, Map.of());

        // Then
        assertThat(manifest.transitiveDependenciesOf("top")).containsExactly("base", "left", "right");
    }

    @Test
    void bundleOf_MappedAsset_ReturnsBundle() {
        assertThat(chain().bundleOf("ui/a.prefab")).contains("A");
        assertThat(chain().bundleOf("missing")).isEmpty();
    }

    @Test
    void new_UndeclaredDependency_ThrowsException() {
        assertThatThrownBy(() -> new BundleManifest(Map.of("A", List.of("ghost")), Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ghost");
    }

    @Test
    void new_AssetMappedToUndeclaredBundle_ThrowsException() {
        assertThatThrownBy(() -> new BundleManifest(Map.of("A", List.of()), Map.of("x", "ghost")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ghost");
    }

    @Test
    void new_Cycle_ThrowsException() {
        Map<String, List<String>> deps = new LinkedHashMap<>();
        deps.put("A", List.of("B"));
        deps.put("B", List.of("A"));

        assertThatThrownBy(() -> new BundleManifest(deps, Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Cyclic");
    }

    @Test
    void new_SelfDependency_ThrowsException() {
        assertThatThrownBy(() -> new BundleManifest(Map.of("A", List.of("A")), Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dependencies_AreUnmodifiable() {
        BundleManifest manifest = chain();

        assertThatThrownBy(() -> manifest.dependencies().put("D", List.of()))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void empty_DeclaresNothing() {
        assertThat(BundleManifest.empty().bundleNames()).isEmpty();
        assertThat(BundleManifest.empty().declares("shaders")).isFalse();
    }
}
