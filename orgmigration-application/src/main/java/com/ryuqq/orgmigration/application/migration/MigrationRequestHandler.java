package com.ryuqq.orgmigration.application.migration;

import com.ryuqq.orgmigration.core.contract.MigrateUserCommand;
import com.ryuqq.orgmigration.core.contract.MoveTeamCommand;
import com.ryuqq.orgmigration.core.contract.RemoveTeamCommand;
import com.ryuqq.orgmigration.core.contract.RemoveUserCommand;
import com.ryuqq.orgmigration.core.error.MigrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * 전송 계층 경계 핸들러.
 *
 * <p>{@link OrgMigrationService} 호출 결과를 상태 코드와 메시지로 변환합니다.</p>
 *
 * <p><strong>오류 매핑:</strong></p>
 * <ul>
 *   <li>null 명령 → {@link IllegalArgumentException} (호출자 프로그래밍 오류)</li>
 *   <li>{@link MigrationException} → 예외의 상태 코드 + 메시지</li>
 *   <li>그 밖의 예외 → 500 + 메시지</li>
 *   <li>상태 코드가 300을 넘는 실패만 error 레벨로 로깅</li>
 * </ul>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public final class MigrationRequestHandler {

    private static final Logger log = LoggerFactory.getLogger(MigrationRequestHandler.class);
    private static final int ERROR_LOG_THRESHOLD = 300;

    private final OrgMigrationService service;

    /**
     * 생성자.
     *
     * @param service 마이그레이션 서비스
     * @throws IllegalArgumentException service가 null인 경우
     */
    public MigrationRequestHandler(OrgMigrationService service) {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        this.service = service;
    }

    public MigrationResponse migrateUserToOrg(MigrateUserCommand command) {
        requireCommand(command);
        return handle("migrateUserToOrg",
            () -> service.migrateUserToOrg(command),
            "Added user " + command.userLabel() + " to Org: " + command.targetOrgId());
    }

    public MigrationResponse moveTeamToOrg(MoveTeamCommand command) {
        requireCommand(command);
        return handle("moveTeamToOrg",
            () -> service.moveTeamToOrg(command),
            "Added team " + command.teamId() + " to Org: " + command.targetOrgId()
                + (command.moveMembers() ? " along with the members" : " without the members"));
    }

    public MigrationResponse removeTeamFromOrg(RemoveTeamCommand command) {
        requireCommand(command);
        return handle("removeTeamFromOrg",
            () -> service.removeTeamFromOrg(command),
            "Removed team " + command.teamId() + " from " + command.targetOrgId());
    }

    public MigrationResponse removeUserFromOrg(RemoveUserCommand command) {
        requireCommand(command);
        return handle("removeUserFromOrg",
            () -> service.removeUserFromOrg(command),
            "Reverted");
    }

    private static void requireCommand(Object command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
    }

    private MigrationResponse handle(String operation, Supplier<MigrationReport> call, String successMessage) {
        try {
            MigrationReport report = call.get();
            return MigrationResponse.ok(successMessage, report);
        } catch (MigrationException e) {
            if (e.statusCode() > ERROR_LOG_THRESHOLD) {
                log.error("{} failed [{}] after steps {}: {}",
                    operation, e.kind().errorCode(), e.completedSteps(), e.getMessage());
            }
            return MigrationResponse.failed(e.statusCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly", operation, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return MigrationResponse.failed(500, message);
        }
    }
}
