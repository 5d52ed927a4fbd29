package com.ryuqq.orgmigration.engine;

import com.ryuqq.orgmigration.application.migration.MigrationReport;
import com.ryuqq.orgmigration.core.contract.MigrateUserCommand;
import com.ryuqq.orgmigration.core.contract.MoveTeamCommand;
import com.ryuqq.orgmigration.core.error.MigrationException;
import com.ryuqq.orgmigration.core.model.Membership;
import com.ryuqq.orgmigration.core.model.Organization;
import com.ryuqq.orgmigration.core.model.Team;
import com.ryuqq.orgmigration.core.spi.DirectoryStore;
import com.ryuqq.orgmigration.core.spi.TeamPatch;
import com.ryuqq.orgmigration.core.statemachine.MigrationStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * moveTeamToOrg 실행기.
 *
 * <p><strong>단계:</strong></p>
 * <pre>
 * RESOLVE_ORGANIZATION → LOCATE_TEAM → REPARENT_TEAM → ADD_TEAM_REDIRECT
 *   → BACKFILL_ORG_SLUG → MIGRATE_MEMBERS (moveMembers인 경우)
 * </pre>
 *
 * <p>MIGRATE_MEMBERS는 팀의 각 멤버십마다 역할과 수락 여부를 그대로 복사하여
 * {@link UserMigration}을 사용자 ID로 실행합니다. 한 멤버가 실패하면 나머지 멤버는
 * 실행하지 않으며, 재실행 시 이미 옮겨진 멤버는 refresh로 처리됩니다.</p>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
final class TeamMigration {

    static final String OPERATION = "moveTeamToOrg";

    private static final Logger log = LoggerFactory.getLogger(TeamMigration.class);

    private final DirectoryStore store;
    private final OrganizationResolver organizationResolver;
    private final RedirectMaintainer redirectMaintainer;
    private final OrgSlugBackfill slugBackfill;
    private final UserMigration userMigration;

    TeamMigration(
        DirectoryStore store,
        OrganizationResolver organizationResolver,
        RedirectMaintainer redirectMaintainer,
        OrgSlugBackfill slugBackfill,
        UserMigration userMigration
    ) {
        this.store = store;
        this.organizationResolver = organizationResolver;
        this.redirectMaintainer = redirectMaintainer;
        this.slugBackfill = slugBackfill;
        this.userMigration = userMigration;
    }

    /**
     * 팀 이동 실행.
     *
     * @param command 명령
     * @return 실행 보고서
     * @throws MigrationException 단계 실패 시
     */
    MigrationReport move(MoveTeamCommand command) {
        long teamId = command.teamId();
        long orgId = command.targetOrgId();
        StepRunner runner = new StepRunner(OPERATION, "team " + teamId + " -> org " + orgId);

        Organization organization = runner.call(MigrationStep.RESOLVE_ORGANIZATION,
            () -> organizationResolver.resolve(orgId));

        Team team = runner.call(MigrationStep.LOCATE_TEAM, () -> locateTeam(teamId));

        runner.run(MigrationStep.REPARENT_TEAM, () -> {
            if (team.isChildOf(orgId)) {
                runner.warn("Team " + teamId + " is already in org " + orgId);
                return;
            }
            store.updateTeam(teamId, TeamPatch.parent(orgId));
        });

        runner.run(MigrationStep.ADD_TEAM_REDIRECT, () -> {
            if (!team.hasSlug()) {
                throw MigrationException.invalidArgument("No slug for team " + teamId + ". Not adding the redirect");
            }
            Optional<String> origin = redirectMaintainer.originOf(organization);
            if (origin.isEmpty()) {
                runner.warn("No slug for org " + orgId + ". Not adding the redirect");
                return;
            }
            redirectMaintainer.addTeamRedirect(team.slug(), origin.get());
        });

        runner.run(MigrationStep.BACKFILL_ORG_SLUG, () -> slugBackfill.setOrgSlugIfNotSet(organization));

        if (command.moveMembers()) {
            runner.run(MigrationStep.MIGRATE_MEMBERS, () -> migrateMembers(teamId, orgId, runner));
        }

        log.debug("Successfully moved team {} to org {}", teamId, orgId);
        return runner.report();
    }

    private Team locateTeam(long teamId) {
        Team team = store.findTeamById(teamId)
            .orElseThrow(() -> MigrationException.notFound("Team with id: " + teamId + " not found"));
        if (team.isOrganization()) {
            throw MigrationException.invalidArgument("Team with id: " + teamId + " is an Org and can't be moved into another Org");
        }
        return team;
    }

    private void migrateMembers(long teamId, long orgId, StepRunner runner) {
        List<Membership> members = store.findMembershipsByTeam(teamId);
        for (Membership membership : members) {
            MigrateUserCommand memberCommand = new MigrateUserCommand(
                membership.userId(), null, orgId, null, membership.role(), membership.accepted());
            MigrationReport memberReport = userMigration.migrate(memberCommand);
            memberReport.warnings().forEach(warning -> runner.warn("user " + membership.userId() + ": " + warning));
        }
        log.debug("Migrated {} member(s) of team {} to org {}", members.size(), teamId, orgId);
    }
}
