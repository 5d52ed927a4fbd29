package com.ryuqq.orgmigration.application.migration;

import com.ryuqq.orgmigration.core.contract.MigrateUserCommand;
import com.ryuqq.orgmigration.core.contract.MoveTeamCommand;
import com.ryuqq.orgmigration.core.contract.RemoveTeamCommand;
import com.ryuqq.orgmigration.core.contract.RemoveUserCommand;
import com.ryuqq.orgmigration.core.error.MigrationException;

/**
 * Organization 마이그레이션 진입점.
 *
 * <p>호출자는 이미 인증/입력 검증을 마친 명령을 전달합니다. 각 메서드는 성공 시
 * {@link MigrationReport}를 반환하고, 실패 시 {@link MigrationException}을 던집니다.</p>
 *
 * <p><strong>멱등성:</strong> 동일한 명령을 다시 실행하면 같은 최종 상태가 됩니다.
 * 단계별로 독립 커밋되므로 중간 실패 후의 복구 절차는 "같은 명령 재실행"입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OrgMigrationService service = new MigrationEngine(store, new MigrationEngineConfig(), Clock.systemUTC());
 * service.migrateUserToOrg(MigrateUserCommand.byUserId(7L, 3L, MembershipRole.MEMBER));
 * service.removeUserFromOrg(new RemoveUserCommand(7L, 3L));
 * </pre>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public interface OrgMigrationService {

    /**
     * 사용자를 Organization으로 마이그레이션 (재실행 시 refresh).
     *
     * @param command 명령
     * @return 실행 보고서
     * @throws MigrationException 실패 시
     */
    MigrationReport migrateUserToOrg(MigrateUserCommand command);

    /**
     * 팀을 Organization 하위로 이동 (옵션: 멤버도 마이그레이션).
     *
     * @param command 명령
     * @return 실행 보고서
     * @throws MigrationException 실패 시
     */
    MigrationReport moveTeamToOrg(MoveTeamCommand command);

    /**
     * 팀을 Organization에서 분리.
     *
     * @param command 명령
     * @return 실행 보고서
     * @throws MigrationException 실패 시
     */
    MigrationReport removeTeamFromOrg(RemoveTeamCommand command);

    /**
     * 사용자 마이그레이션을 되돌림.
     *
     * @param command 명령
     * @return 실행 보고서
     * @throws MigrationException 실패 시
     */
    MigrationReport removeUserFromOrg(RemoveUserCommand command);
}
