/**
 * Migration Engine 패키지.
 *
 * <p>{@link com.ryuqq.orgmigration.application.migration.OrgMigrationService}의 구현으로,
 * 각 명령을 이름 붙은 멱등 단계의 순서 목록으로 실행합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.orgmigration.engine.MigrationEngine}: 진입점</li>
 *   <li>{@link com.ryuqq.orgmigration.engine.MigrationEngineConfig}: URL 및 기본 멤버십 설정</li>
 *   <li>{@link com.ryuqq.orgmigration.engine.OrgUsernames}: 이메일 기반 username 파생</li>
 *   <li>{@link com.ryuqq.orgmigration.engine.OrgOrigins}: Organization URL 조립</li>
 * </ul>
 *
 * <p><strong>트랜잭션 모델:</strong> 단계 사이에 트랜잭션이 없습니다. 각 단계는 독립적으로
 * 커밋되고 재실행해도 안전하므로, 중간 실패의 복구 절차는 같은 명령의 재실행입니다.</p>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
package com.ryuqq.orgmigration.engine;
