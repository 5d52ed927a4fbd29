/**
 * 마이그레이션 오류 분류.
 *
 * <p>{@link com.ryuqq.orgmigration.core.error.ErrorKind}는 상태 코드와 오류 코드를,
 * {@link com.ryuqq.orgmigration.core.error.MigrationException}은 실패 시점까지
 * 완료된 단계 목록을 전달합니다.</p>
 *
 * @since 1.0.0
 * @author OrgMigration Team
 */
package com.ryuqq.orgmigration.core.error;
