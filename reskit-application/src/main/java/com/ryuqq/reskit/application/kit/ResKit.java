package com.ryuqq.reskit.application.kit;

import com.ryuqq.reskit.application.loader.ResLoader;
import com.ryuqq.reskit.core.model.BackendKind;
import com.ryuqq.reskit.core.model.LoaderId;

import java.util.Optional;

/**
 * 리소스 킷 진입점 (Facade).
 *
 * <p>저장소 종류별 LIFO 풀에서 {@link ResLoader}를 할당하고 회수합니다.
 * 로더는 한 번 생성되면 파괴되지 않고 재사용됩니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * allocate(kind) → ACTIVE (버전 증가, 보유 목록 비어 있음)
 *   → load / loadAsync / unload ...
 * recycle(loader) → releaseAll() → POOLED
 * </pre>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public interface ResKit {

    /**
     * 로더 할당.
     *
     * @param kind 저장소 종류
     * @return 사용 가능한 로더
     * @throws IllegalArgumentException kind가 null이거나 등록되지 않은 경우
     */
    ResLoader allocate(BackendKind kind);

    /**
     * 로더 회수.
     *
     * <p>보유한 모든 참조를 해제한 뒤 풀에 반납합니다. 이미 반납된 로더는
     * 오류로 기록하고 false를 반환합니다.</p>
     *
     * @param loader 회수할 로더
     * @return 반납되었으면 true, 이미 반납된 로더면 false
     * @throws IllegalArgumentException loader가 null이거나 다른 킷의 로더인 경우
     */
    boolean recycle(ResLoader loader);

    /**
     * 식별자로 로더 조회.
     *
     * <p>로더가 사용 중이고 세대가 일치할 때만 반환합니다. 재활용이나 일괄 해제
     * 이전에 발급된 식별자는 조회되지 않습니다.</p>
     *
     * @param id 로더 식별자
     * @return 로더 (없거나 세대가 다르면 empty)
     */
    Optional<ResLoader> resolve(LoaderId id);
}
