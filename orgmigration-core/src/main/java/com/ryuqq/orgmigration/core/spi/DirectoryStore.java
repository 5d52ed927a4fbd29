package com.ryuqq.orgmigration.core.spi;

import com.ryuqq.orgmigration.core.model.Membership;
import com.ryuqq.orgmigration.core.model.RedirectMapping;
import com.ryuqq.orgmigration.core.model.RedirectType;
import com.ryuqq.orgmigration.core.model.Team;
import com.ryuqq.orgmigration.core.model.User;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Directory Store SPI for user, team, membership and redirect records.
 *
 * <p>The migration engine only issues read/write intents against this contract. Every write
 * commits on its own: there is no transaction spanning several calls, so callers must keep
 * each write idempotent.</p>
 *
 * <p><strong>Uniqueness Constraints (enforced by the store):</strong></p>
 * <ul>
 *   <li>User: (username, organizationId), a null organizationId being the standalone scope</li>
 *   <li>Team: (slug, parentId), a null parentId being the standalone scope</li>
 *   <li>Membership: (userId, teamId)</li>
 *   <li>RedirectMapping: (type, from, fromOrgId)</li>
 * </ul>
 *
 * <p>A write that would break one of these constraints must fail with
 * {@link UniqueConstraintViolationException} naming the constraint. Concurrent writers for the
 * same user/org pair race on these constraints; that is the only exclusion mechanism.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Metadata is parsed once at the store boundary into {@code UserMetadata}/{@code TeamMetadata}</li>
 *   <li>Writes against a missing record fail with {@link IllegalStateException}</li>
 * </ul>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public interface DirectoryStore {

    /** Constraint name for (username, organizationId). */
    String USERNAME_CONSTRAINT = "users_username_organization_id_key";

    /** Constraint name for (slug, parentId). */
    String TEAM_SLUG_CONSTRAINT = "teams_slug_parent_id_key";

    /**
     * Looks up a user by id.
     *
     * @param id the user id
     * @return the user, or empty if none exists
     */
    Optional<User> findUserById(long id);

    /**
     * Scans all users holding the given username, across every namespace.
     *
     * @param username the username
     * @return matching users (may be empty)
     * @throws IllegalArgumentException if username is null
     */
    List<User> findUsersByUsername(String username);

    /**
     * Returns the first user matching the filter.
     *
     * @param filter username and namespace filter
     * @return the first match, or empty
     * @throws IllegalArgumentException if filter is null
     */
    Optional<User> findFirstUser(UserFilter filter);

    /**
     * Applies a partial update to a user.
     *
     * @param id the user id
     * @param patch the fields to change
     * @throws IllegalStateException if the user does not exist
     * @throws UniqueConstraintViolationException if the new (username, organizationId) is taken
     */
    void updateUser(long id, UserPatch patch);

    /**
     * Looks up a team (or organization) by id.
     *
     * @param id the team id
     * @return the team, or empty if none exists
     */
    Optional<Team> findTeamById(long id);

    /**
     * Fetches all teams whose id is in the given collection.
     *
     * @param ids team ids
     * @return the teams that exist, in no particular order
     */
    List<Team> findTeamsByIds(Collection<Long> ids);

    /**
     * Applies a partial update to a single team.
     *
     * @param id the team id
     * @param patch the fields to change
     * @throws IllegalStateException if the team does not exist
     * @throws UniqueConstraintViolationException if the new (slug, parentId) is taken
     */
    void updateTeam(long id, TeamPatch patch);

    /**
     * Applies the same partial update to every team in the id set.
     *
     * <p>Ids with no matching team are ignored. An empty set is a no-op.</p>
     *
     * @param ids team ids
     * @param patch the fields to change
     * @return number of teams updated
     * @throws UniqueConstraintViolationException if any resulting (slug, parentId) is taken
     */
    int bulkUpdateTeams(Set<Long> ids, TeamPatch patch);

    /**
     * Lists every membership of a user.
     *
     * @param userId the user id
     * @return memberships (may be empty)
     */
    List<Membership> findMembershipsByUser(long userId);

    /**
     * Lists every membership of a team.
     *
     * @param teamId the team id
     * @return memberships (may be empty)
     */
    List<Membership> findMembershipsByTeam(long teamId);

    /**
     * Creates the (userId, teamId) membership, or overwrites its role/accepted if present.
     *
     * @param userId the user id
     * @param teamId the team id
     * @param patch role and accepted flag
     */
    void upsertMembership(long userId, long teamId, MembershipPatch patch);

    /**
     * Deletes the (userId, teamId) membership.
     *
     * @param userId the user id
     * @param teamId the team id
     * @return true if a row was deleted, false if none existed
     */
    boolean deleteMembership(long userId, long teamId);

    /**
     * Creates the (type, from, fromOrgId) redirect, or overwrites its target URL if present.
     *
     * @param type redirect type
     * @param from previous identifier
     * @param fromOrgId previous namespace ({@link RedirectMapping#STANDALONE_ORG_ID} for standalone)
     * @param toUrl new organization URL
     */
    void upsertRedirect(RedirectType type, String from, long fromOrgId, String toUrl);

    /**
     * Deletes every redirect matching (type, from, fromOrgId).
     *
     * <p>Deleting when nothing matches is a no-op, not an error.</p>
     *
     * @param type redirect type
     * @param from previous identifier
     * @param fromOrgId previous namespace
     * @return number of rows deleted
     */
    int deleteRedirects(RedirectType type, String from, long fromOrgId);

    /**
     * Looks up a redirect by its unique key.
     *
     * @param type redirect type
     * @param from previous identifier
     * @param fromOrgId previous namespace
     * @return the redirect, or empty
     */
    Optional<RedirectMapping> findRedirect(RedirectType type, String from, long fromOrgId);
}
