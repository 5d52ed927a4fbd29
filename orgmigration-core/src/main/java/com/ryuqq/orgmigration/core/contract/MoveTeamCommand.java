package com.ryuqq.orgmigration.core.contract;

/**
 * 팀을 Organization 하위로 이동하는 명령.
 *
 * @param teamId 이동할 팀 ID
 * @param targetOrgId 대상 Organization ID
 * @param moveMembers true이면 팀의 모든 멤버도 마이그레이션
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public record MoveTeamCommand(long teamId, long targetOrgId, boolean moveMembers) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException ID가 양수가 아닌 경우
     */
    public MoveTeamCommand {
        if (teamId <= 0) {
            throw new IllegalArgumentException("teamId must be positive, but was: " + teamId);
        }
        if (targetOrgId <= 0) {
            throw new IllegalArgumentException("targetOrgId must be positive, but was: " + targetOrgId);
        }
    }
}
