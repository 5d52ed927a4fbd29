package com.ryuqq.orgmigration.core.contract;

/**
 * 팀을 Organization에서 분리하는 명령 (moveTeamToOrg의 역방향).
 *
 * @param teamId 분리할 팀 ID
 * @param targetOrgId 현재 상위 Organization ID
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public record RemoveTeamCommand(long teamId, long targetOrgId) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException ID가 양수가 아닌 경우
     */
    public RemoveTeamCommand {
        if (teamId <= 0) {
            throw new IllegalArgumentException("teamId must be positive, but was: " + teamId);
        }
        if (targetOrgId <= 0) {
            throw new IllegalArgumentException("targetOrgId must be positive, but was: " + targetOrgId);
        }
    }
}
