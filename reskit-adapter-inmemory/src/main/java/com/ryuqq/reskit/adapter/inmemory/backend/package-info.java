/**
 * In-memory Backend 어댑터 패키지.
 *
 * <p>FLAT_FILE, REMOTE_PACKAGE 백엔드의 참조 구현을 제공합니다.</p>
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.reskit.adapter.inmemory.backend.InMemoryBackend}:
 *       경로별 콘텐츠를 메모리에 보관하는 {@link com.ryuqq.reskit.core.spi.Backend}</li>
 * </ul>
 *
 * <p><strong>설계 원칙:</strong></p>
 * <ul>
 *   <li><strong>동시성:</strong> {@link java.util.concurrent.ConcurrentHashMap} 기반</li>
 *   <li><strong>비동기:</strong> 지정한 {@link java.util.concurrent.Executor}에서 조회 수행</li>
 * </ul>
 *
 * @see com.ryuqq.reskit.core.spi.Backend
 * @author ResKit Team
 * @since 1.0.0
 */
package com.ryuqq.reskit.adapter.inmemory.backend;
