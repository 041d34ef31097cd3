package com.ryuqq.reskit.application.loader;

import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.LoaderId;
import com.ryuqq.reskit.core.outcome.LoadResult;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.DoubleConsumer;

/**
 * 리소스 로더 (소비자 핸들).
 *
 * <p>ResLoader는 한 소비자(화면, 엔티티 등)가 보유한 참조를 추적합니다.
 * 같은 경로를 여러 번 로드해도 참조는 하나만 보유하며, {@link #releaseAll()}로
 * 보유한 참조를 한 번에 해제할 수 있습니다.</p>
 *
 * <p><strong>버전과 만료된 결과:</strong></p>
 * <ul>
 *   <li>로더는 일괄 해제와 할당 시마다 버전이 증가합니다</li>
 *   <li>비동기 로드는 호출 시점의 버전을 기억합니다</li>
 *   <li>완료 시점에 버전이 달라졌으면 결과를 폐기하고 참조를 해제하며,
 *       호출자에게는 {@link com.ryuqq.reskit.core.outcome.NotFound}를 반환합니다</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ResLoader loader = kit.allocate(BackendKind.FLAT_FILE);
 * LoadResult result = loader.load("ui/hero.model");
 * ...
 * kit.recycle(loader);   // releaseAll() 후 풀에 반납
 * </pre>
 *
 * <p>풀에 반납된 로더를 사용하면 {@link IllegalStateException}이 발생합니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public interface ResLoader {

    /**
     * 현재 세대의 로더 식별자.
     *
     * @return LoaderId (slot, 현재 버전)
     */
    LoaderId id();

    /**
     * 로더가 사용하는 저장소 종류.
     *
     * @return 저장소 종류
     */
    BackendKind kind();

    /**
     * 사용 가능 여부.
     *
     * @return 할당되어 사용 중이면 true
     */
    boolean isActive();

    /**
     * 리소스 동기 로드.
     *
     * <p>빈 경로나 1024자를 넘는 경로는 NotFound를 반환합니다.</p>
     *
     * @param path 리소스 경로
     * @return 로드 결과
     * @throws IllegalArgumentException path가 null인 경우
     * @throws IllegalStateException 풀에 반납된 로더인 경우
     */
    LoadResult load(String path);

    /**
     * 리소스 비동기 로드.
     *
     * @param path 리소스 경로
     * @return 로드 결과 future (유효하지 않은 경로는 NotFound)
     * @throws IllegalArgumentException path가 null인 경우
     * @throws IllegalStateException 풀에 반납된 로더인 경우
     */
    CompletableFuture<LoadResult> loadAsync(String path);

    /**
     * 여러 리소스를 배치 단위로 미리 로드.
     *
     * <p>배치 사이마다 스케줄링을 양보하며, 각 배치가 끝날 때 진행률
     * (완료 수 / 전체 수)을 보고합니다. 빈 목록은 즉시 1.0을 보고합니다.</p>
     *
     * @param paths 리소스 경로 목록
     * @param progress 진행률 콜백 (null 가능)
     * @return 모든 배치 완료 future
     * @throws IllegalStateException 풀에 반납된 로더인 경우
     */
    CompletableFuture<Void> preloadAsync(List<String> paths, DoubleConsumer progress);

    /**
     * 보유한 리소스 해제. 보유하지 않은 경로는 무시합니다.
     *
     * @param path 리소스 경로
     */
    void unload(String path);

    /**
     * 보유한 모든 리소스를 해제하고 버전을 증가시킵니다.
     */
    void releaseAll();

    /**
     * 경로 보유 여부.
     *
     * @param path 리소스 경로
     * @return 보유 중이면 true
     */
    boolean isLoaded(String path);

    /**
     * 보유 중인 경로 목록.
     *
     * @return 경로 집합 (스냅샷)
     */
    Set<String> ownedPaths();
}
