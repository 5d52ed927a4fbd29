package com.ryuqq.orgmigration.core.error;

import com.ryuqq.orgmigration.core.statemachine.MigrationStep;

import java.util.List;

/**
 * 마이그레이션 실패.
 *
 * <p>각 단계는 독립적으로 커밋되므로, 실패 시점까지 완료된 단계 목록을 함께 전달합니다.
 * {@link #isPartiallyApplied()}가 true이면 일부 변경이 이미 반영된 상태이며,
 * 복구 절차는 동일한 명령을 다시 실행하는 것입니다.</p>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public class MigrationException extends RuntimeException {

    private final ErrorKind kind;
    private final List<MigrationStep> completedSteps;

    /**
     * 생성자.
     *
     * @param kind 실패 분류
     * @param message 사람이 읽을 수 있는 메시지
     * @param cause 원인 (null 가능)
     * @param completedSteps 실패 전에 완료된 단계 (null이면 빈 목록)
     * @throws IllegalArgumentException kind가 null이거나 message가 비어있는 경우
     */
    public MigrationException(ErrorKind kind, String message, Throwable cause, List<MigrationStep> completedSteps) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        this.kind = kind;
        this.completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
    }

    public static MigrationException invalidArgument(String message) {
        return new MigrationException(ErrorKind.INVALID_ARGUMENT, message, null, null);
    }

    public static MigrationException notFound(String message) {
        return new MigrationException(ErrorKind.NOT_FOUND, message, null, null);
    }

    public static MigrationException conflict(String message) {
        return new MigrationException(ErrorKind.CONFLICT, message, null, null);
    }

    public static MigrationException conflict(String message, Throwable cause) {
        return new MigrationException(ErrorKind.CONFLICT, message, cause, null);
    }

    public static MigrationException notAnOrganization(String message) {
        return new MigrationException(ErrorKind.NOT_AN_ORGANIZATION, message, null, null);
    }

    public static MigrationException internal(String message, Throwable cause) {
        return new MigrationException(ErrorKind.INTERNAL, message, cause, null);
    }

    /**
     * 완료된 단계 목록을 덧붙인 새 예외 생성.
     *
     * @param steps 완료된 단계
     * @return 같은 분류/메시지/원인을 가진 새 MigrationException
     */
    public MigrationException withCompletedSteps(List<MigrationStep> steps) {
        MigrationException copy = new MigrationException(kind, getMessage(), getCause(), steps);
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public ErrorKind kind() {
        return kind;
    }

    public int statusCode() {
        return kind.statusCode();
    }

    public List<MigrationStep> completedSteps() {
        return completedSteps;
    }

    /**
     * 이미 반영된 변경이 있는지 확인.
     *
     * @return 완료된 단계 중 변경 단계가 하나라도 있으면 true
     */
    public boolean isPartiallyApplied() {
        return completedSteps.stream().anyMatch(MigrationStep::isMutation);
    }
}
