package com.ryuqq.orgmigration.core.statemachine;

import com.ryuqq.orgmigration.core.model.MigrationProvenance;
import com.ryuqq.orgmigration.core.model.User;

/**
 * 사용자 단위 마이그레이션 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * STANDALONE ──migrate──► MIGRATED ──revert──► REVERTED
 *                           │  ▲                  │
 *                           └──┘ (refresh)        │
 *                              ▲                  │
 *                              └────migrate───────┘
 *
 * ORGANIZATION_NATIVE ──migrate (같은 Org)──► MIGRATED
 * </pre>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public enum MigrationState {

    /**
     * Organization 미소속, 마이그레이션 이력 없음.
     */
    STANDALONE,

    /**
     * 마이그레이션으로 Organization에 소속됨.
     */
    MIGRATED,

    /**
     * 처음부터 Organization에 소속됨 (이력 없음).
     */
    ORGANIZATION_NATIVE,

    /**
     * 마이그레이션 후 revert됨.
     */
    REVERTED;

    /**
     * 사용자 레코드에서 현재 상태 도출.
     *
     * @param user 사용자
     * @return 현재 상태
     * @throws IllegalArgumentException user가 null인 경우
     */
    public static MigrationState of(User user) {
        if (user == null) {
            throw new IllegalArgumentException("user cannot be null");
        }
        MigrationProvenance provenance = user.provenance();
        if (provenance != null && provenance.reverted()) {
            return REVERTED;
        }
        if (user.isStandalone()) {
            return STANDALONE;
        }
        return provenance == null ? ORGANIZATION_NATIVE : MIGRATED;
    }
}
