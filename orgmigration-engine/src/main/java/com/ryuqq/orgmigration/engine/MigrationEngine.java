package com.ryuqq.orgmigration.engine;

import com.ryuqq.orgmigration.application.migration.MigrationReport;
import com.ryuqq.orgmigration.application.migration.OrgMigrationService;
import com.ryuqq.orgmigration.core.contract.MigrateUserCommand;
import com.ryuqq.orgmigration.core.contract.MoveTeamCommand;
import com.ryuqq.orgmigration.core.contract.RemoveTeamCommand;
import com.ryuqq.orgmigration.core.contract.RemoveUserCommand;
import com.ryuqq.orgmigration.core.spi.DirectoryStore;

import java.time.Clock;

/**
 * {@link OrgMigrationService} 구현체.
 *
 * <p>상태를 갖지 않으며, 모든 영속 상태는 주입된 {@link DirectoryStore}가 소유합니다.
 * 서로 다른 사용자/팀/Organization에 대한 동시 호출은 독립적이고, 같은 쌍에 대한 동시 호출은
 * Store의 유일성 제약에서 경쟁하여 한쪽이 CONFLICT로 실패합니다.</p>
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>{@link OrganizationResolver}: 대상 Organization 확인</li>
 *   <li>{@link RedirectMaintainer}: standalone → Organization 리다이렉트</li>
 *   <li>{@link OrgSlugBackfill}: Organization slug 지연 설정</li>
 *   <li>{@link UserMigration}, {@link TeamMigration}, {@link TeamRemoval}, {@link UserReversion}: 명령별 단계 실행</li>
 * </ul>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public final class MigrationEngine implements OrgMigrationService {

    private final UserMigration userMigration;
    private final TeamMigration teamMigration;
    private final TeamRemoval teamRemoval;
    private final UserReversion userReversion;

    /**
     * 생성자.
     *
     * @param store Directory Store
     * @param config 엔진 설정
     * @param clock 마이그레이션/되돌리기 시각에 사용할 Clock
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MigrationEngine(DirectoryStore store, MigrationEngineConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        OrganizationResolver organizationResolver = new OrganizationResolver(store);
        RedirectMaintainer redirectMaintainer = new RedirectMaintainer(store, config);
        OrgSlugBackfill slugBackfill = new OrgSlugBackfill(store);

        this.userMigration = new UserMigration(
            store, config, clock, organizationResolver, redirectMaintainer, slugBackfill);
        this.teamMigration = new TeamMigration(
            store, organizationResolver, redirectMaintainer, slugBackfill, userMigration);
        this.teamRemoval = new TeamRemoval(store, organizationResolver, redirectMaintainer);
        this.userReversion = new UserReversion(store, clock, organizationResolver, redirectMaintainer);
    }

    @Override
    public MigrationReport migrateUserToOrg(MigrateUserCommand command) {
        requireCommand(command);
        return userMigration.migrate(command);
    }

    @Override
    public MigrationReport moveTeamToOrg(MoveTeamCommand command) {
        requireCommand(command);
        return teamMigration.move(command);
    }

    @Override
    public MigrationReport removeTeamFromOrg(RemoveTeamCommand command) {
        requireCommand(command);
        return teamRemoval.remove(command);
    }

    @Override
    public MigrationReport removeUserFromOrg(RemoveUserCommand command) {
        requireCommand(command);
        return userReversion.revert(command);
    }

    private static void requireCommand(Object command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
    }
}
