/**
 * In-memory 번들 저장소 어댑터 패키지.
 *
 * <p>{@link com.ryuqq.reskit.adapter.inmemory.archive.InMemoryBundleStore}는 매니페스트와
 * 번들 콘텐츠를 메모리에 보관하는 {@link com.ryuqq.reskit.core.spi.BundleStore} 참조 구현입니다.
 * ARCHIVE 백엔드로 쓰려면 의존성 그래프와 함께 조립합니다.</p>
 *
 * <pre>
 * InMemoryBundleStore store = new InMemoryBundleStore(manifest, bundles);
 * DependencyGraph graph = new DependencyGraph(store);
 * Backend archive = new ArchiveBackend(graph, store);
 * </pre>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
package com.ryuqq.reskit.adapter.inmemory.archive;
