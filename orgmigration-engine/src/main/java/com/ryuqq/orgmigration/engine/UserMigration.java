package com.ryuqq.orgmigration.engine;

import com.ryuqq.orgmigration.application.migration.MigrationReport;
import com.ryuqq.orgmigration.core.contract.MigrateUserCommand;
import com.ryuqq.orgmigration.core.error.MigrationException;
import com.ryuqq.orgmigration.core.model.Membership;
import com.ryuqq.orgmigration.core.model.MigrationProvenance;
import com.ryuqq.orgmigration.core.model.Organization;
import com.ryuqq.orgmigration.core.model.Team;
import com.ryuqq.orgmigration.core.model.User;
import com.ryuqq.orgmigration.core.spi.DirectoryStore;
import com.ryuqq.orgmigration.core.spi.MembershipPatch;
import com.ryuqq.orgmigration.core.spi.TeamPatch;
import com.ryuqq.orgmigration.core.spi.UserFilter;
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
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * migrateUserToOrg 실행기.
 *
 * <p><strong>단계:</strong></p>
 * <pre>
 * VALIDATE_ARGUMENTS → RESOLVE_ORGANIZATION → LOCATE_USER → RESOLVE_TARGET_USERNAME
 *   → CHECK_USERNAME_COLLISION → CHECK_REMIGRATION → RESOLVE_NON_ORG_USERNAME
 *   → UPDATE_USER → RELOCATE_TEAMS → UPSERT_MEMBERSHIP → ADD_REDIRECTS → BACKFILL_ORG_SLUG
 * </pre>
 *
 * <p>이미 대상 Organization에 있는 사용자는 refresh로 처리되므로, 같은 명령을 다시 실행하면
 * 같은 최종 상태가 됩니다. 중간 실패 시 복구 절차는 재실행입니다.</p>
 *
 * <p>RELOCATE_TEAMS는 사용자가 속한 Organization이 아닌 모든 팀을 대상 Organization으로
 * 옮깁니다. 다른 Organization에 속해 있던 팀도 그대로 옮겨집니다.</p>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
final class UserMigration {

    static final String OPERATION = "migrateUserToOrg";

    private static final Logger log = LoggerFactory.getLogger(UserMigration.class);

    private final DirectoryStore store;
    private final MigrationEngineConfig config;
    private final Clock clock;
    private final OrganizationResolver organizationResolver;
    private final RedirectMaintainer redirectMaintainer;
    private final OrgSlugBackfill slugBackfill;

    UserMigration(
        DirectoryStore store,
        MigrationEngineConfig config,
        Clock clock,
        OrganizationResolver organizationResolver,
        RedirectMaintainer redirectMaintainer,
        OrgSlugBackfill slugBackfill
    ) {
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.organizationResolver = organizationResolver;
        this.redirectMaintainer = redirectMaintainer;
        this.slugBackfill = slugBackfill;
    }

    /**
     * 사용자 마이그레이션 실행.
     *
     * @param command 명령
     * @return 실행 보고서
     * @throws MigrationException 단계 실패 시
     */
    MigrationReport migrate(MigrateUserCommand command) {
        long orgId = command.targetOrgId();
        StepRunner runner = new StepRunner(OPERATION, "user " + command.userLabel() + " -> org " + orgId);

        runner.run(MigrationStep.VALIDATE_ARGUMENTS, () -> assertUserIdOrUserName(command));

        Organization organization = runner.call(MigrationStep.RESOLVE_ORGANIZATION,
            () -> organizationResolver.resolve(orgId));

        User user = runner.call(MigrationStep.LOCATE_USER, () -> locateUser(command));

        String targetOrgUsername = runner.call(MigrationStep.RESOLVE_TARGET_USERNAME,
            () -> resolveTargetOrgUsername(command, user, organization));

        runner.run(MigrationStep.CHECK_USERNAME_COLLISION,
            () -> assertUsernameFreeInOrg(user, targetOrgUsername, orgId));

        runner.run(MigrationStep.CHECK_REMIGRATION,
            () -> assertRemigrationAllowed(user, targetOrgUsername, orgId));

        String nonOrgUsername = runner.call(MigrationStep.RESOLVE_NON_ORG_USERNAME,
            () -> resolveNonOrgUsername(user));

        runner.run(MigrationStep.UPDATE_USER,
            () -> updateUser(user, orgId, targetOrgUsername, nonOrgUsername));

        List<Team> relocatedTeams = runner.call(MigrationStep.RELOCATE_TEAMS,
            () -> relocateTeams(user.id(), orgId));

        boolean accepted = command.accepted() != null ? command.accepted() : config.defaultMembershipAccepted();
        runner.run(MigrationStep.UPSERT_MEMBERSHIP,
            () -> store.upsertMembership(user.id(), orgId, new MembershipPatch(command.role(), accepted)));

        runner.run(MigrationStep.ADD_REDIRECTS, () -> {
            Optional<String> origin = redirectMaintainer.originOf(organization);
            if (origin.isEmpty()) {
                runner.warn("No slug for org " + orgId + ". Not adding the redirect");
                return;
            }
            redirectMaintainer.addUserRedirect(nonOrgUsername, origin.get(), targetOrgUsername);
            redirectMaintainer.addTeamRedirects(relocatedTeams, origin.get(), runner::warn);
        });

        runner.run(MigrationStep.BACKFILL_ORG_SLUG, () -> slugBackfill.setOrgSlugIfNotSet(organization));

        log.debug("orgId:{} attached to userId:{}", orgId, user.id());
        return runner.report();
    }

    private static void assertUserIdOrUserName(MigrateUserCommand command) {
        boolean hasUserId = command.userId() != null;
        boolean hasUserName = command.userName() != null && !command.userName().isBlank();
        if (!hasUserId && !hasUserName) {
            throw MigrationException.invalidArgument("userId or userName is required");
        }
        if (hasUserId && hasUserName) {
            throw MigrationException.invalidArgument("Provide either userId or userName");
        }
    }

    private User locateUser(MigrateUserCommand command) {
        long orgId = command.targetOrgId();
        Optional<User> candidate;
        if (command.userName() != null && !command.userName().isBlank()) {
            List<User> matching = store.findUsersByUsername(command.userName()).stream()
                .filter(user -> user.isStandalone() || user.belongsTo(orgId))
                .collect(Collectors.toList());
            if (matching.size() > 1) {
                throw MigrationException.conflict("More than one user found with username: " + command.userName());
            }
            candidate = matching.stream().findFirst();
        } else {
            candidate = store.findUserById(command.userId());
        }

        User user = candidate.orElseThrow(
            () -> MigrationException.notFound("User " + command.userLabel() + " not found"));

        if (!user.isStandalone() && !user.belongsTo(orgId)) {
            throw MigrationException.conflict("User " + command.userLabel() + " is already a part of an organization");
        }
        return user;
    }

    private static String resolveTargetOrgUsername(MigrateUserCommand command, User user, Organization organization) {
        String supplied = command.targetOrgUsername();
        if (supplied != null && !supplied.isBlank()) {
            return supplied;
        }
        if (user.email() == null || user.email().isBlank()) {
            throw MigrationException.invalidArgument(
                "User with id: " + user.id() + " has no email to derive an org username from");
        }
        String derived = OrgUsernames.fromEmail(user.email(), organization.metadata().orgAutoAcceptEmail());
        if (derived.isEmpty()) {
            throw MigrationException.invalidArgument(
                "Could not derive an org username for user with id: " + user.id());
        }
        log.debug("Derived org username {} for user {}", derived, user.id());
        return derived;
    }

    private void assertUsernameFreeInOrg(User user, String targetOrgUsername, long orgId) {
        Optional<User> holder = store.findFirstUser(UserFilter.inOrganization(targetOrgUsername, orgId));
        if (holder.isPresent() && holder.get().id() != user.id()) {
            throw MigrationException.conflict(
                "Username " + targetOrgUsername + " already exists for orgId: " + orgId + " for some other user");
        }
    }

    private static void assertRemigrationAllowed(User user, String targetOrgUsername, long orgId) {
        MigrationTransition.validate(user.id(), MigrationState.of(user), MigrationState.MIGRATED);
        if (user.isStandalone()) {
            return;
        }
        if (!user.belongsTo(orgId)) {
            throw MigrationException.conflict("User " + targetOrgUsername
                + " already exists for different Org with orgId: " + user.organizationId());
        }
        log.debug("Redoing migration for userId: {} to orgId:{}", user.id(), orgId);
    }

    private static String resolveNonOrgUsername(User user) {
        MigrationProvenance provenance = user.provenance();
        if (provenance != null && provenance.hasUsername()) {
            return provenance.username();
        }
        if (user.username() == null || user.username().isBlank()) {
            throw MigrationException.invalidArgument(
                "User with id: " + user.id() + " doesn't have a non-org username");
        }
        return user.username();
    }

    private void updateUser(User user, long orgId, String targetOrgUsername, String nonOrgUsername) {
        Instant now = Instant.now(clock);
        UserPatch patch = UserPatch.empty()
            .withOrganizationId(orgId)
            .withUsername(targetOrgUsername)
            .withMetadata(user.metadata().withMigratedToOrgFrom(MigrationProvenance.migrated(nonOrgUsername, now)));
        store.updateUser(user.id(), patch);
    }

    private List<Team> relocateTeams(long userId, long orgId) {
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
        int updated = store.bulkUpdateTeams(ids, TeamPatch.parent(orgId));
        log.debug("Relocated {} team(s) {} of user {} to org {}", updated, ids, userId, orgId);
        return teams;
    }
}
