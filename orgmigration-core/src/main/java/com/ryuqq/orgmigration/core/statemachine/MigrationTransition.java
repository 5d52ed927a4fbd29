package com.ryuqq.orgmigration.core.statemachine;

import com.ryuqq.orgmigration.core.error.MigrationException;

/**
 * 사용자 마이그레이션 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>STANDALONE → MIGRATED</li>
 *   <li>MIGRATED → MIGRATED (refresh)</li>
 *   <li>ORGANIZATION_NATIVE → MIGRATED (같은 Organization 내 refresh)</li>
 *   <li>REVERTED → MIGRATED (revert 플래그 덮어씀)</li>
 *   <li>MIGRATED → REVERTED</li>
 * </ul>
 *
 * <p>Organization 소유권 검사(다른 Organization 소속 여부)는 ID 비교가 필요하므로
 * 이 클래스가 아니라 각 명령에서 수행합니다.</p>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public final class MigrationTransition {

    // Utility class - prevent instantiation
    private MigrationTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param userId 메시지용 사용자 ID
     * @param from 현재 상태
     * @param to 목표 상태 (MIGRATED 또는 REVERTED)
     * @throws IllegalArgumentException from 또는 to가 null이거나 목표 상태가 아닌 경우
     * @throws MigrationException 허용되지 않은 전이인 경우 (INVALID_ARGUMENT 또는 CONFLICT)
     */
    public static void validate(long userId, MigrationState from, MigrationState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        switch (to) {
            case MIGRATED -> {
                // 모든 상태에서 (재)마이그레이션 허용
            }
            case REVERTED -> {
                if (from == MigrationState.REVERTED) {
                    throw MigrationException.conflict("User with id: " + userId + " is already reverted");
                }
                if (from != MigrationState.MIGRATED) {
                    throw MigrationException.invalidArgument(
                        "User with id: " + userId + " wasn't migrated. So, there is nothing to revert");
                }
            }
            default -> throw new IllegalArgumentException("Not a target state: " + to);
        }
    }
}
