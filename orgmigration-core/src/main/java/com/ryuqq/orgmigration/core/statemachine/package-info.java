/**
 * 사용자 마이그레이션 상태 머신과 명령 단계 카탈로그.
 *
 * @since 1.0.0
 * @author OrgMigration Team
 */
package com.ryuqq.orgmigration.core.statemachine;
