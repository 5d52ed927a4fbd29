package com.ryuqq.orgmigration.engine;

import com.ryuqq.orgmigration.application.migration.MigrationReport;
import com.ryuqq.orgmigration.core.contract.RemoveUserCommand;
import com.ryuqq.orgmigration.core.error.MigrationException;
import com.ryuqq.orgmigration.core.model.Membership;
import com.ryuqq.orgmigration.core.model.MigrationProvenance;
import com.ryuqq.orgmigration.core.model.Team;
import com.ryuqq.orgmigration.core.model.User;
import com.ryuqq.orgmigration.core.spi.DirectoryStore;
import com.ryuqq.orgmigration.core.spi.TeamPatch;
import com.ryuqq.orgmigration.core.spi.UserPatch;
import com.ryuqq.orgmigration.core.statemachine.MigrationState;
import com.ryuqq.orgmigration.core.statemachine.MigrationStep;
import com.ryuqq.orgmigration.core.statemachine.MigrationTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * removeUserFromOrg 실행기 (마이그레이션 되돌리기).
 *
 * <p><strong>단계:</strong></p>
 * <pre>
 * RESOLVE_ORGANIZATION → LOCATE_MIGRATED_USER → RESTORE_TEAMS → REMOVE_REDIRECTS
 *   → DELETE_MEMBERSHIP → RESTORE_USER
 * </pre>
 *
 * <p>사용자 레코드({@code reverted} 플래그 포함)는 마지막에 기록합니다. 앞 단계에서 실패하면
 * 사용자는 MIGRATED 상태로 남고, 같은 명령을 다시 실행하면 되돌리기가 완료됩니다.</p>
 *
 * <p><strong>검증 순서:</strong></p>
 * <ol>
 *   <li>사용자 없음 → NOT_FOUND</li>
 *   <li>마이그레이션 이력 없음 → INVALID_ARGUMENT</li>
 *   <li>이미 되돌림 → CONFLICT</li>
 *   <li>다른 Organization 소속 → CONFLICT</li>
 *   <li>standalone username 기록 없음 → INTERNAL</li>
 * </ol>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
final class UserReversion {

    static final String OPERATION = "removeUserFromOrg";

    private static final Logger log = LoggerFactory.getLogger(UserReversion.class);

    private final DirectoryStore store;
    private final Clock clock;
    private final OrganizationResolver organizationResolver;
    private final RedirectMaintainer redirectMaintainer;

    UserReversion(
        DirectoryStore store,
        Clock clock,
        OrganizationResolver organizationResolver,
        RedirectMaintainer redirectMaintainer
    ) {
        this.store = store;
        this.clock = clock;
        this.organizationResolver = organizationResolver;
        this.redirectMaintainer = redirectMaintainer;
    }

    /**
     * 마이그레이션 되돌리기 실행.
     *
     * @param command 명령
     * @return 실행 보고서
     * @throws MigrationException 단계 실패 시
     */
    MigrationReport revert(RemoveUserCommand command) {
        long userId = command.userId();
        long orgId = command.targetOrgId();
        StepRunner runner = new StepRunner(OPERATION, "user " + userId + " <- org " + orgId);

        runner.call(MigrationStep.RESOLVE_ORGANIZATION, () -> organizationResolver.resolve(orgId));

        User user = runner.call(MigrationStep.LOCATE_MIGRATED_USER, () -> locateMigratedUser(userId, orgId));
        String nonOrgUsername = user.provenance().username();

        List<Team> restoredTeams = runner.call(MigrationStep.RESTORE_TEAMS, () -> restoreTeams(userId));

        runner.run(MigrationStep.REMOVE_REDIRECTS, () -> {
            redirectMaintainer.removeUserRedirect(nonOrgUsername);
            redirectMaintainer.removeTeamRedirects(restoredTeams, runner::warn);
        });

        runner.run(MigrationStep.DELETE_MEMBERSHIP, () -> {
            if (!store.deleteMembership(userId, orgId)) {
                runner.warn("Membership of user " + userId + " in org " + orgId + " was already removed");
            }
        });

        runner.run(MigrationStep.RESTORE_USER, () -> restoreUser(user, nonOrgUsername));

        log.debug("orgId:{} detached from userId:{}", orgId, userId);
        return runner.report();
    }

    private User locateMigratedUser(long userId, long orgId) {
        User user = store.findUserById(userId)
            .orElseThrow(() -> MigrationException.notFound("User with id: " + userId + " not found"));

        MigrationState state = MigrationState.of(user);
        MigrationTransition.validate(userId, state, MigrationState.REVERTED);

        if (!user.belongsTo(orgId)) {
            throw MigrationException.conflict("User with id: " + userId + " is not part of orgId: " + orgId);
        }
        if (!user.provenance().hasUsername()) {
            throw MigrationException.internal("User with id: " + userId + " doesn't have a non-org username", null);
        }
        return user;
    }

    private List<Team> restoreTeams(long userId) {
        Set<Long> teamIds = store.findMembershipsByUser(userId).stream()
            .map(Membership::teamId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        if (teamIds.isEmpty()) {
            return List.of();
        }

        List<Team> teams = store.findTeamsByIds(teamIds).stream()
            .filter(team -> !team.isOrganization())
            .collect(Collectors.toList());
        if (teams.isEmpty()) {
            return teams;
        }

        Set<Long> ids = teams.stream().map(Team::id).collect(Collectors.toCollection(LinkedHashSet::new));
        int updated = store.bulkUpdateTeams(ids, TeamPatch.parent(null));
        log.debug("Restored {} team(s) {} of user {} to standalone", updated, ids, userId);
        return teams;
    }

    private void restoreUser(User user, String nonOrgUsername) {
        Instant now = Instant.now(clock);
        UserPatch patch = UserPatch.empty()
            .withOrganizationId(null)
            .withUsername(nonOrgUsername)
            .withMetadata(user.metadata().withMigratedToOrgFrom(MigrationProvenance.reverted(now)));
        store.updateUser(user.id(), patch);
    }
}
