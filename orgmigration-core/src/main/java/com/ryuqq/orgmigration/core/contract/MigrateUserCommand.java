package com.ryuqq.orgmigration.core.contract;

import com.ryuqq.orgmigration.core.model.MembershipRole;

/**
 * 사용자를 Organization으로 마이그레이션하는 명령.
 *
 * <p>userId와 userName 중 정확히 하나만 지정해야 하며, 이 조건은 엔진의
 * VALIDATE_ARGUMENTS 단계에서 INVALID_ARGUMENT로 검증됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * MigrateUserCommand command = MigrateUserCommand.byUserId(7L, 3L, MembershipRole.MEMBER);
 * MigrateUserCommand named = MigrateUserCommand.byUserName("alice", 3L, MembershipRole.ADMIN)
 *     .withTargetOrgUsername("alice-acme");
 * </pre>
 *
 * @param userId 사용자 ID (null 가능)
 * @param userName 사용자명 (null 가능)
 * @param targetOrgId 대상 Organization ID
 * @param targetOrgUsername Organization 내 username (null이면 이메일에서 파생)
 * @param role Organization 멤버십 역할
 * @param accepted 멤버십 수락 여부 (null이면 설정 기본값)
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public record MigrateUserCommand(
    Long userId,
    String userName,
    long targetOrgId,
    String targetOrgUsername,
    MembershipRole role,
    Boolean accepted
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException targetOrgId가 양수가 아니거나 role이 null인 경우
     */
    public MigrateUserCommand {
        if (targetOrgId <= 0) {
            throw new IllegalArgumentException("targetOrgId must be positive, but was: " + targetOrgId);
        }
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
    }

    public static MigrateUserCommand byUserId(long userId, long targetOrgId, MembershipRole role) {
        return new MigrateUserCommand(userId, null, targetOrgId, null, role, null);
    }

    public static MigrateUserCommand byUserName(String userName, long targetOrgId, MembershipRole role) {
        return new MigrateUserCommand(null, userName, targetOrgId, null, role, null);
    }

    /**
     * targetOrgUsername만 변경한 새 인스턴스 생성.
     *
     * @param targetOrgUsername Organization 내 username
     * @return 새 MigrateUserCommand 인스턴스
     */
    public MigrateUserCommand withTargetOrgUsername(String targetOrgUsername) {
        return new MigrateUserCommand(userId, userName, targetOrgId, targetOrgUsername, role, accepted);
    }

    /**
     * accepted만 변경한 새 인스턴스 생성.
     *
     * @param accepted 멤버십 수락 여부
     * @return 새 MigrateUserCommand 인스턴스
     */
    public MigrateUserCommand withAccepted(boolean accepted) {
        return new MigrateUserCommand(userId, userName, targetOrgId, targetOrgUsername, role, accepted);
    }

    /**
     * 로그/메시지용 사용자 표현.
     *
     * @return userName 또는 "ID:{userId}"
     */
    public String userLabel() {
        return userName != null && !userName.isBlank() ? userName : "ID:" + userId;
    }
}
