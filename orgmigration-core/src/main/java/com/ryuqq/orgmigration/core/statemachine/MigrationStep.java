package com.ryuqq.orgmigration.core.statemachine;

/**
 * 마이그레이션 명령을 구성하는 이름 있는 단계.
 *
 * <p>각 명령은 이 단계들의 고정된 순서로 실행되며, 변경 단계는 모두
 * 독립적으로 커밋되고 재실행에 안전합니다.</p>
 *
 * <p><strong>명령별 순서:</strong></p>
 * <pre>
 * migrateUserToOrg:
 *   VALIDATE_ARGUMENTS → RESOLVE_ORGANIZATION → LOCATE_USER → RESOLVE_TARGET_USERNAME
 *   → CHECK_USERNAME_COLLISION → CHECK_REMIGRATION → RESOLVE_NON_ORG_USERNAME
 *   → UPDATE_USER → RELOCATE_TEAMS → UPSERT_MEMBERSHIP → ADD_REDIRECTS → BACKFILL_ORG_SLUG
 *
 * moveTeamToOrg:
 *   RESOLVE_ORGANIZATION → LOCATE_TEAM → REPARENT_TEAM → ADD_TEAM_REDIRECT
 *   → BACKFILL_ORG_SLUG → MIGRATE_MEMBERS
 *
 * removeTeamFromOrg:
 *   RESOLVE_ORGANIZATION → LOCATE_TEAM → DETACH_TEAM → REMOVE_TEAM_REDIRECT
 *
 * removeUserFromOrg:
 *   RESOLVE_ORGANIZATION → LOCATE_MIGRATED_USER → RESTORE_TEAMS → REMOVE_REDIRECTS
 *   → DELETE_MEMBERSHIP → RESTORE_USER
 * </pre>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public enum MigrationStep {

    VALIDATE_ARGUMENTS(false),
    RESOLVE_ORGANIZATION(false),
    LOCATE_USER(false),
    RESOLVE_TARGET_USERNAME(false),
    CHECK_USERNAME_COLLISION(false),
    CHECK_REMIGRATION(false),
    RESOLVE_NON_ORG_USERNAME(false),
    UPDATE_USER(true),
    RELOCATE_TEAMS(true),
    UPSERT_MEMBERSHIP(true),
    ADD_REDIRECTS(true),
    BACKFILL_ORG_SLUG(true),

    LOCATE_TEAM(false),
    REPARENT_TEAM(true),
    ADD_TEAM_REDIRECT(true),
    MIGRATE_MEMBERS(true),

    DETACH_TEAM(true),
    REMOVE_TEAM_REDIRECT(true),

    LOCATE_MIGRATED_USER(false),
    RESTORE_TEAMS(true),
    REMOVE_REDIRECTS(true),
    DELETE_MEMBERSHIP(true),
    RESTORE_USER(true);

    private final boolean mutation;

    MigrationStep(boolean mutation) {
        this.mutation = mutation;
    }

    /**
     * Directory Store에 쓰기를 수행하는 단계인지 확인.
     *
     * @return 변경 단계이면 true
     */
    public boolean isMutation() {
        return mutation;
    }
}
