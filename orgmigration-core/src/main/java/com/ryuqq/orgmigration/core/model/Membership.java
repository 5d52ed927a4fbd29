package com.ryuqq.orgmigration.core.model;

/**
 * 사용자-팀 멤버십.
 *
 * <p>(userId, teamId) 쌍마다 하나만 존재합니다 (upsert 시맨틱).</p>
 *
 * @param userId 사용자 ID
 * @param teamId 팀 ID
 * @param role 역할
 * @param accepted 수락 여부
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public record Membership(
    long userId,
    long teamId,
    MembershipRole role,
    boolean accepted
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException role이 null인 경우
     */
    public Membership {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
    }
}
