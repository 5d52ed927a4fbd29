/**
 * 마이그레이션 애플리케이션 포트.
 *
 * <p>{@link com.ryuqq.orgmigration.application.migration.OrgMigrationService}는 네 가지 진입점을,
 * {@link com.ryuqq.orgmigration.application.migration.MigrationRequestHandler}는
 * 전송 계층이 사용하는 상태 코드/메시지 변환을 제공합니다.</p>
 *
 * @since 1.0.0
 * @author OrgMigration Team
 */
package com.ryuqq.orgmigration.application.migration;
