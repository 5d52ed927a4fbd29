package com.ryuqq.orgmigration.engine;

import com.ryuqq.orgmigration.application.migration.MigrationReport;
import com.ryuqq.orgmigration.core.error.MigrationException;
import com.ryuqq.orgmigration.core.spi.UniqueConstraintViolationException;
import com.ryuqq.orgmigration.core.statemachine.MigrationStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * 하나의 명령 실행 동안 이름 붙은 단계를 순서대로 실행합니다.
 *
 * <p><strong>실행 규칙:</strong></p>
 * <ul>
 *   <li>각 단계는 독립적으로 커밋되며, 완료 즉시 completedSteps에 기록</li>
 *   <li>첫 실패에서 중단하고, 그때까지 완료된 단계를 예외에 첨부</li>
 *   <li>멱등 no-op은 {@link #warn(String)}으로 기록 (warn 로그 + 보고서 경고)</li>
 * </ul>
 *
 * <p><strong>예외 매핑:</strong></p>
 * <pre>
 * MigrationException                  → 그대로 (completedSteps만 첨부)
 * UniqueConstraintViolationException  → CONFLICT
 * 기타 RuntimeException               → INTERNAL (cause 첨부)
 * </pre>
 *
 * <p>단일 스레드 전용입니다. 명령 실행마다 새 인스턴스를 만듭니다.</p>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
final class StepRunner {

    private static final Logger log = LoggerFactory.getLogger(StepRunner.class);

    private final String operation;
    private final String subject;
    private final List<MigrationStep> completed;
    private final List<String> warnings;

    /**
     * 생성자.
     *
     * @param operation 명령 이름 (예: migrateUserToOrg)
     * @param subject 로그용 대상 설명 (예: "user ID:7 -> org 3")
     */
    StepRunner(String operation, String subject) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        this.operation = operation;
        this.subject = subject;
        this.completed = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    /**
     * 결과를 반환하는 단계 실행.
     *
     * @param step 단계
     * @param action 단계 본문
     * @param <T> 결과 타입
     * @return 단계 결과
     * @throws MigrationException 단계 실패 시 (completedSteps 첨부)
     */
    <T> T call(MigrationStep step, Supplier<T> action) {
        T result;
        try {
            result = action.get();
        } catch (MigrationException e) {
            throw e.withCompletedSteps(completed);
        } catch (UniqueConstraintViolationException e) {
            throw MigrationException.conflict(e.getMessage(), e).withCompletedSteps(completed);
        } catch (RuntimeException e) {
            throw MigrationException.internal(
                operation + " failed at " + step + ": " + e.getMessage(), e
            ).withCompletedSteps(completed);
        }
        completed.add(step);
        log.debug("[{}] step {} completed for {}", operation, step, subject);
        return result;
    }

    /**
     * 결과 없는 단계 실행.
     *
     * @param step 단계
     * @param action 단계 본문
     * @throws MigrationException 단계 실패 시 (completedSteps 첨부)
     */
    void run(MigrationStep step, Runnable action) {
        call(step, () -> {
            action.run();
            return null;
        });
    }

    /**
     * 멱등 no-op 또는 건너뛴 작업 기록.
     *
     * @param message 경고 메시지
     */
    void warn(String message) {
        log.warn("[{}] {}", operation, message);
        warnings.add(message);
    }

    /**
     * 실행 보고서 생성.
     *
     * @return MigrationReport
     */
    MigrationReport report() {
        return new MigrationReport(operation, completed, warnings);
    }
}
