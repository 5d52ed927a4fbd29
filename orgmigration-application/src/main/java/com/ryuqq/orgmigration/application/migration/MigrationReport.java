package com.ryuqq.orgmigration.application.migration;

import com.ryuqq.orgmigration.core.statemachine.MigrationStep;

import java.util.List;

/**
 * 성공한 마이그레이션 명령의 실행 보고서.
 *
 * @param operation 명령 이름 (예: migrateUserToOrg)
 * @param completedSteps 완료된 단계 (실행 순서)
 * @param warnings 멱등 no-op 등 건너뛴 작업에 대한 경고
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public record MigrationReport(
    String operation,
    List<MigrationStep> completedSteps,
    List<String> warnings
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operation이 비어있는 경우
     */
    public MigrationReport {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean completed(MigrationStep step) {
        return completedSteps.contains(step);
    }
}
