package com.ryuqq.orgmigration.core.contract;

/**
 * 사용자 마이그레이션을 되돌리는 명령 (migrateUserToOrg의 역방향).
 *
 * @param userId 사용자 ID
 * @param targetOrgId 현재 소속 Organization ID
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public record RemoveUserCommand(long userId, long targetOrgId) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException ID가 양수가 아닌 경우
     */
    public RemoveUserCommand {
        if (userId <= 0) {
            throw new IllegalArgumentException("userId must be positive, but was: " + userId);
        }
        if (targetOrgId <= 0) {
            throw new IllegalArgumentException("targetOrgId must be positive, but was: " + targetOrgId);
        }
    }
}
