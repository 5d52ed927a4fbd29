/**
 * Directory 데이터 모델.
 *
 * <p>User, Team, Membership, RedirectMapping 네 가지 엔티티와
 * Store 경계에서 한 번만 해석되는 메타데이터 타입을 정의합니다.</p>
 *
 * @since 1.0.0
 * @author OrgMigration Team
 */
package com.ryuqq.orgmigration.core.model;
