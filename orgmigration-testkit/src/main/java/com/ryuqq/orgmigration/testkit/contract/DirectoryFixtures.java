package com.ryuqq.orgmigration.testkit.contract;

import com.ryuqq.orgmigration.core.model.Membership;
import com.ryuqq.orgmigration.core.model.MembershipRole;
import com.ryuqq.orgmigration.core.model.MigrationProvenance;
import com.ryuqq.orgmigration.core.model.Team;
import com.ryuqq.orgmigration.core.model.TeamMetadata;
import com.ryuqq.orgmigration.core.model.User;
import com.ryuqq.orgmigration.core.model.UserMetadata;

import java.time.Instant;

/**
 * Builders for directory records used by contract and scenario tests.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * store.putTeam(DirectoryFixtures.organization(3L, null, "acme", "acme.com"));
 * store.putUser(DirectoryFixtures.standaloneUser(7L, "alice", "alice@acme.com"));
 * store.putTeam(DirectoryFixtures.team(12L, "sales"));
 * store.putMembership(DirectoryFixtures.membership(7L, 12L, MembershipRole.OWNER));
 * </pre>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public final class DirectoryFixtures {

    // Utility class - prevent instantiation
    private DirectoryFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * User outside any organization, with no migration history.
     *
     * @param id user id
     * @param username username
     * @param email email
     * @return a new user
     */
    public static User standaloneUser(long id, String username, String email) {
        return new User(id, username, email, null, UserMetadata.empty());
    }

    /**
     * User created directly inside an organization (never migrated).
     *
     * @param id user id
     * @param username org username
     * @param email email
     * @param orgId organization id
     * @return a new user
     */
    public static User orgNativeUser(long id, String username, String email, long orgId) {
        return new User(id, username, email, orgId, UserMetadata.empty());
    }

    /**
     * User previously migrated into an organization.
     *
     * @param id user id
     * @param orgUsername current org username
     * @param email email
     * @param orgId organization id
     * @param nonOrgUsername standalone username recorded in the provenance
     * @param migratedAt last migration time
     * @return a new user
     */
    public static User migratedUser(long id, String orgUsername, String email, long orgId,
                                    String nonOrgUsername, Instant migratedAt) {
        return new User(id, orgUsername, email, orgId,
            UserMetadata.of(MigrationProvenance.migrated(nonOrgUsername, migratedAt)));
    }

    /**
     * Organization team.
     *
     * @param id organization id
     * @param slug slug (nullable)
     * @param requestedSlug slug to adopt lazily (nullable)
     * @param autoAcceptEmail email domain for username derivation (nullable)
     * @return a new organization team
     */
    public static Team organization(long id, String slug, String requestedSlug, String autoAcceptEmail) {
        return new Team(id, "Org " + id, slug, null, TeamMetadata.organization(requestedSlug, autoAcceptEmail));
    }

    /**
     * Standalone team.
     *
     * @param id team id
     * @param slug slug (nullable)
     * @return a new team
     */
    public static Team team(long id, String slug) {
        return teamIn(id, slug, null);
    }

    /**
     * Team under the given organization.
     *
     * @param id team id
     * @param slug slug (nullable)
     * @param parentId organization id (nullable)
     * @return a new team
     */
    public static Team teamIn(long id, String slug, Long parentId) {
        return new Team(id, "Team " + id, slug, parentId, TeamMetadata.empty());
    }

    /**
     * Accepted membership.
     *
     * @param userId user id
     * @param teamId team id
     * @param role role
     * @return a new membership
     */
    public static Membership membership(long userId, long teamId, MembershipRole role) {
        return new Membership(userId, teamId, role, true);
    }
}
