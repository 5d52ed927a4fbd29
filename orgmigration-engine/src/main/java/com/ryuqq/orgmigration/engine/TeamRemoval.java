package com.ryuqq.orgmigration.engine;

import com.ryuqq.orgmigration.application.migration.MigrationReport;
import com.ryuqq.orgmigration.core.contract.RemoveTeamCommand;
import com.ryuqq.orgmigration.core.error.MigrationException;
import com.ryuqq.orgmigration.core.model.Team;
import com.ryuqq.orgmigration.core.spi.DirectoryStore;
import com.ryuqq.orgmigration.core.spi.TeamPatch;
import com.ryuqq.orgmigration.core.spi.UniqueConstraintViolationException;
import com.ryuqq.orgmigration.core.statemachine.MigrationStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * removeTeamFromOrg 실행기.
 *
 * <p><strong>단계:</strong></p>
 * <pre>
 * RESOLVE_ORGANIZATION → LOCATE_TEAM → DETACH_TEAM → REMOVE_TEAM_REDIRECT
 * </pre>
 *
 * <p>팀이 이미 Organization 밖에 있어도 리다이렉트 삭제는 실행되므로, 부분 실패 후 재실행하면
 * 정리가 완료됩니다.</p>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
final class TeamRemoval {

    static final String OPERATION = "removeTeamFromOrg";

    static final String SLUG_TAKEN_MESSAGE = "Looks like the team's name is already taken by some other team"
        + " outside the org or an org itself. Please change this team's name or the other team/org's name."
        + " If you rename the team that you are trying to remove from the org, you will have to manually"
        + " remove the redirect from the database for that team as the slug would have changed.";

    private static final Logger log = LoggerFactory.getLogger(TeamRemoval.class);

    private final DirectoryStore store;
    private final OrganizationResolver organizationResolver;
    private final RedirectMaintainer redirectMaintainer;

    TeamRemoval(DirectoryStore store, OrganizationResolver organizationResolver, RedirectMaintainer redirectMaintainer) {
        this.store = store;
        this.organizationResolver = organizationResolver;
        this.redirectMaintainer = redirectMaintainer;
    }

    /**
     * 팀 분리 실행.
     *
     * @param command 명령
     * @return 실행 보고서
     * @throws MigrationException 단계 실패 시
     */
    MigrationReport remove(RemoveTeamCommand command) {
        long teamId = command.teamId();
        long orgId = command.targetOrgId();
        StepRunner runner = new StepRunner(OPERATION, "team " + teamId + " <- org " + orgId);

        runner.call(MigrationStep.RESOLVE_ORGANIZATION, () -> organizationResolver.resolve(orgId));

        Team team = runner.call(MigrationStep.LOCATE_TEAM, () -> locateTeam(teamId));

        runner.run(MigrationStep.DETACH_TEAM, () -> {
            if (!team.isChildOf(orgId)) {
                runner.warn("Team " + teamId + " is not part of org " + orgId + ". Not updating");
                return;
            }
            detach(teamId);
        });

        runner.run(MigrationStep.REMOVE_TEAM_REDIRECT, () -> {
            if (!team.hasSlug()) {
                throw MigrationException.invalidArgument("No slug for team " + teamId + ". Not removing the redirect");
            }
            redirectMaintainer.removeTeamRedirect(team.slug());
        });

        log.debug("Successfully removed team {} from org {}", teamId, orgId);
        return runner.report();
    }

    private Team locateTeam(long teamId) {
        Team team = store.findTeamById(teamId)
            .orElseThrow(() -> MigrationException.notFound("Team with id: " + teamId + " not found"));
        if (team.isOrganization()) {
            throw MigrationException.invalidArgument("Team with id: " + teamId + " is an Org and can't be removed from an Org");
        }
        return team;
    }

    private void detach(long teamId) {
        try {
            store.updateTeam(teamId, TeamPatch.parent(null));
        } catch (UniqueConstraintViolationException e) {
            if (DirectoryStore.TEAM_SLUG_CONSTRAINT.equals(e.constraint())) {
                throw MigrationException.conflict(SLUG_TAKEN_MESSAGE, e);
            }
            throw e;
        }
    }
}
