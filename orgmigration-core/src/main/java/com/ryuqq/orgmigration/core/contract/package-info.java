/**
 * 마이그레이션 명령 계약.
 *
 * <p>인증/입력 검증을 마친 호출자가 전달하는 네 가지 명령을 정의합니다.</p>
 *
 * @since 1.0.0
 * @author OrgMigration Team
 */
package com.ryuqq.orgmigration.core.contract;
