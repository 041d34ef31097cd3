package com.ryuqq.reskit.core.spi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 번들 매니페스트 (불변 record).
 *
 * <p>번들별 직접 의존성 목록과 에셋 경로 → 번들 이름 매핑을 담습니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>의존성으로 참조된 번들은 모두 dependencies의 키로 선언되어 있어야 함</li>
 *   <li>에셋이 가리키는 번들도 선언되어 있어야 함</li>
 *   <li>의존성 그래프에 순환이 없어야 함 (자기 자신 포함)</li>
 * </ul>
 *
 * @param dependencies 번들 이름 → 직접 의존 번들 목록 (순서 유지)
 * @param assetBundles 에셋 경로 → 번들 이름
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public record BundleManifest(Map<String, List<String>> dependencies, Map<String, String> assetBundles) {

    private static final BundleManifest EMPTY = new BundleManifest(Map.of(), Map.of());

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException null이거나, 선언되지 않은 번들을 참조하거나, 순환 의존이 있는 경우
     */
    public BundleManifest {
        if (dependencies == null) {
            throw new IllegalArgumentException("dependencies cannot be null");
        }
        if (assetBundles == null) {
            throw new IllegalArgumentException("assetBundles cannot be null");
        }

        Map<String, List<String>> deps = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("bundle name cannot be null or blank");
            }
            List<String> direct = entry.getValue() == null ? List.of() : List.copyOf(entry.getValue());
            deps.put(entry.getKey(), direct);
        }
        for (Map.Entry<String, List<String>> entry : deps.entrySet()) {
            for (String dependency : entry.getValue()) {
                if (!deps.containsKey(dependency)) {
                    throw new IllegalArgumentException(
                        "Bundle " + entry.getKey() + " depends on undeclared bundle: " + dependency
                    );
                }
            }
        }

        Map<String, String> assets = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : assetBundles.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("asset mapping cannot contain null");
            }
            if (!deps.containsKey(entry.getValue())) {
                throw new IllegalArgumentException(
                    "Asset " + entry.getKey() + " maps to undeclared bundle: " + entry.getValue()
                );
            }
            assets.put(entry.getKey(), entry.getValue());
        }

        checkAcyclic(deps);

        dependencies = Collections.unmodifiableMap(deps);
        assetBundles = Collections.unmodifiableMap(assets);
    }

    /**
     * 빈 매니페스트.
     *
     * @return 번들이 선언되지 않은 매니페스트
     */
    public static BundleManifest empty() {
        return EMPTY;
    }

    /**
     * 번들 선언 여부.
     *
     * @param bundleName 번들 이름
     * @return 선언되어 있으면 true
     */
    public boolean declares(String bundleName) {
        return bundleName != null && dependencies.containsKey(bundleName);
    }

    /**
     * 직접 의존성 조회.
     *
     * @param bundleName 번들 이름
     * @return 직접 의존 번들 목록 (선언되지 않은 번들이면 빈 목록)
     */
    public List<String> dependenciesOf(String bundleName) {
        List<String> direct = bundleName == null ? null : dependencies.get(bundleName);
        return direct == null ? List.of() : direct;
    }

    /**
     * 전이 의존성 조회.
     *
     * <p>깊이 우선 후위 순서로 반환하므로, 목록의 앞쪽 번들이 먼저 로드되어야 합니다.
     * 요청한 번들 자신은 포함하지 않습니다.</p>
     *
     * @param bundleName 번들 이름
     * @return 전이 의존 번들 목록
     */
    public List<String> transitiveDependenciesOf(String bundleName) {
        Set<String> ordered = new LinkedHashSet<>();
        for (String dependency : dependenciesOf(bundleName)) {
            collect(dependency, ordered);
        }
        return new ArrayList<>(ordered);
    }

    /**
     * 에셋이 속한 번들 조회.
     *
     * @param assetPath 에셋 경로
     * @return 번들 이름 (매핑이 없으면 empty)
     */
    public Optional<String> bundleOf(String assetPath) {
        if (assetPath == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(assetBundles.get(assetPath));
    }

    /**
     * 선언된 번들 이름 목록.
     *
     * @return 번들 이름 집합
     */
    public Set<String> bundleNames() {
        return dependencies.keySet();
    }

    private void collect(String bundleName, Set<String> ordered) {
        if (ordered.contains(bundleName)) {
            return;
        }
        for (String dependency : dependenciesOf(bundleName)) {
            collect(dependency, ordered);
        }
        ordered.add(bundleName);
    }

    private static void checkAcyclic(Map<String, List<String>> deps) {
        // 0: 미방문, 1: 방문 중, 2: 완료
        Map<String, Integer> marks = new HashMap<>();
        for (String bundle : deps.keySet()) {
            visit(bundle, deps, marks);
        }
    }

    private static void visit(String bundle, Map<String, List<String>> deps, Map<String, Integer> marks) {
        int mark = marks.getOrDefault(bundle, 0);
        if (mark == 2) {
            return;
        }
        if (mark == 1) {
            throw new IllegalArgumentException("Cyclic bundle dependency detected at: " + bundle);
        }
        marks.put(bundle, 1);
        for (String dependency : deps.get(bundle)) {
            visit(dependency, deps, marks);
        }
        marks.put(bundle, 2);
    }
}
