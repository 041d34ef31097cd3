/**
 * ResKit Contract Test 지원 패키지.
 *
 * <p>{@link com.ryuqq.reskit.testkit.contract.AbstractContractTest}를 상속해
 * 참조 카운트, 중복 제거, 만료 결과 폐기, 번들 의존성 계약을 검증합니다.
 * 스크립트 백엔드는 비동기 조회를 테스트가 직접 완료할 때까지 붙잡아 둡니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
package com.ryuqq.reskit.testkit.contract;
