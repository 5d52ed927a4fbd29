package com.ryuqq.orgmigration.adapter.inmemory.store;

import com.ryuqq.orgmigration.core.model.Membership;
import com.ryuqq.orgmigration.core.model.RedirectMapping;
import com.ryuqq.orgmigration.core.model.RedirectType;
import com.ryuqq.orgmigration.core.model.Team;
import com.ryuqq.orgmigration.core.model.User;
import com.ryuqq.orgmigration.core.spi.DirectoryStore;
import com.ryuqq.orgmigration.core.spi.MembershipPatch;
import com.ryuqq.orgmigration.core.spi.TeamPatch;
import com.ryuqq.orgmigration.core.spi.UniqueConstraintViolationException;
import com.ryuqq.orgmigration.core.spi.UserFilter;
import com.ryuqq.orgmigration.core.spi.UserPatch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link DirectoryStore} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>users:</strong> id → User</li>
 *   <li><strong>teams:</strong> id → Team (organizations included)</li>
 *   <li><strong>memberships:</strong> (userId, teamId) → Membership</li>
 *   <li><strong>redirects:</strong> (type, from, fromOrgId) → RedirectMapping</li>
 * </ul>
 *
 * <p><strong>Uniqueness Constraints:</strong></p>
 * <ul>
 *   <li>{@link DirectoryStore#USERNAME_CONSTRAINT}: (username, organizationId)</li>
 *   <li>{@link DirectoryStore#TEAM_SLUG_CONSTRAINT}: (slug, parentId)</li>
 *   <li>Membership and redirect keys are map keys, so duplicates cannot exist</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryDirectoryStore store = new InMemoryDirectoryStore();
 * store.putTeam(new Team(3L, "Acme", null, null, TeamMetadata.organization("acme", "acme.com")));
 * store.putUser(new User(7L, "alice", "alice@acme.com", null, null));
 *
 * OrgMigrationService service = new MigrationEngine(store, new MigrationEngineConfig(), Clock.systemUTC());
 * </pre>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public class InMemoryDirectoryStore implements DirectoryStore {

    private final Map<Long, User> users;
    private final Map<Long, Team> teams;
    private final Map<MembershipKey, Membership> memberships;
    private final Map<RedirectKey, RedirectMapping> redirects;

    /**
     * Creates a new InMemoryDirectoryStore with empty storage.
     */
    public InMemoryDirectoryStore() {
        this.users = new HashMap<>();
        this.teams = new HashMap<>();
        this.memberships = new LinkedHashMap<>();
        this.redirects = new LinkedHashMap<>();
    }

    // ============================================================
    // Users
    // ============================================================

    @Override
    public synchronized Optional<User> findUserById(long id) {
        return Optional.ofNullable(users.get(id));
    }

    @Override
    public synchronized List<User> findUsersByUsername(String username) {
        if (username == null) {
            throw new IllegalArgumentException("username cannot be null");
        }
        return users.values().stream()
                .filter(user -> username.equals(user.username()))
                .sorted(Comparator.comparingLong(User::id))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<User> findFirstUser(UserFilter filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        return users.values().stream()
                .filter(user -> filter.username().equals(user.username()))
                .filter(user -> Objects.equals(filter.organizationId(), user.organizationId()))
                .min(Comparator.comparingLong(User::id));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Checks (username, organizationId) against every other user before writing</li>
     *   <li>The write is all-or-nothing: a violation leaves the record unchanged</li>
     * </ul>
     */
    @Override
    public synchronized void updateUser(long id, UserPatch patch) {
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        User current = users.get(id);
        if (current == null) {
            throw new IllegalStateException("No user found for id: " + id);
        }
        User updated = patch.applyTo(current);
        assertUsernameAvailable(updated);
        users.put(id, updated);
    }

    // ============================================================
    // Teams
    // ============================================================

    @Override
    public synchronized Optional<Team> findTeamById(long id) {
        return Optional.ofNullable(teams.get(id));
    }

    @Override
    public synchronized List<Team> findTeamsByIds(Collection<Long> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        return ids.stream()
                .distinct()
                .map(teams::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void updateTeam(long id, TeamPatch patch) {
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        Team current = teams.get(id);
        if (current == null) {
            throw new IllegalStateException("No team found for id: " + id);
        }
        Team updated = patch.applyTo(current);
        assertSlugAvailable(updated, Set.of(id), List.of());
        teams.put(id, updated);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>All resulting rows are validated before any is written (single statement semantics)</li>
     *   <li>Rows within the batch are also checked against each other</li>
     * </ul>
     */
    @Override
    public synchronized int bulkUpdateTeams(Set<Long> ids, TeamPatch patch) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }

        List<Team> updated = ids.stream()
                .map(teams::get)
                .filter(Objects::nonNull)
                .map(patch::applyTo)
                .collect(Collectors.toList());

        Set<Long> batchIds = updated.stream().map(Team::id).collect(Collectors.toSet());
        for (Team team : updated) {
            assertSlugAvailable(team, batchIds, updated);
        }

        updated.forEach(team -> teams.put(team.id(), team));
        return updated.size();
    }

    // ============================================================
    // Memberships
    // ============================================================

    @Override
    public synchronized List<Membership> findMembershipsByUser(long userId) {
        return memberships.values().stream()
                .filter(membership -> membership.userId() == userId)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<Membership> findMembershipsByTeam(long teamId) {
        return memberships.values().stream()
                .filter(membership -> membership.teamId() == teamId)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void upsertMembership(long userId, long teamId, MembershipPatch patch) {
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        memberships.put(new MembershipKey(userId, teamId),
                new Membership(userId, teamId, patch.role(), patch.accepted()));
    }

    @Override
    public synchronized boolean deleteMembership(long userId, long teamId) {
        return memberships.remove(new MembershipKey(userId, teamId)) != null;
    }

    // ============================================================
    // Redirects
    // ============================================================

    @Override
    public synchronized void upsertRedirect(RedirectType type, String from, long fromOrgId, String toUrl) {
        RedirectMapping mapping = new RedirectMapping(type, from, fromOrgId, toUrl);
        redirects.put(new RedirectKey(type, from, fromOrgId), mapping);
    }

    @Override
    public synchronized int deleteRedirects(RedirectType type, String from, long fromOrgId) {
        return redirects.remove(new RedirectKey(type, from, fromOrgId)) != null ? 1 : 0;
    }

    @Override
    public synchronized Optional<RedirectMapping> findRedirect(RedirectType type, String from, long fromOrgId) {
        return Optional.ofNullable(redirects.get(new RedirectKey(type, from, fromOrgId)));
    }

    // ============================================================
    // Seeding and test helpers
    // ============================================================

    /**
     * Inserts or replaces a user, enforcing the username constraint.
     *
     * @param user the user to store
     * @return the stored user
     * @throws IllegalArgumentException if user is null
     * @throws UniqueConstraintViolationException if (username, organizationId) is taken
     */
    public synchronized User putUser(User user) {
        if (user == null) {
            throw new IllegalArgumentException("user cannot be null");
        }
        assertUsernameAvailable(user);
        users.put(user.id(), user);
        return user;
    }

    /**
     * Inserts or replaces a team, enforcing the slug constraint.
     *
     * @param team the team to store
     * @return the stored team
     * @throws IllegalArgumentException if team is null
     * @throws UniqueConstraintViolationException if (slug, parentId) is taken
     */
    public synchronized Team putTeam(Team team) {
        if (team == null) {
            throw new IllegalArgumentException("team cannot be null");
        }
        assertSlugAvailable(team, Set.of(team.id()), List.of());
        teams.put(team.id(), team);
        return team;
    }

    /**
     * Inserts or replaces a membership.
     *
     * @param membership the membership to store
     * @return the stored membership
     */
    public synchronized Membership putMembership(Membership membership) {
        if (membership == null) {
            throw new IllegalArgumentException("membership cannot be null");
        }
        memberships.put(new MembershipKey(membership.userId(), membership.teamId()), membership);
        return membership;
    }

    /**
     * Returns every redirect, in insertion order.
     *
     * @return redirect snapshot
     */
    public synchronized List<RedirectMapping> allRedirects() {
        return new ArrayList<>(redirects.values());
    }

    /**
     * Returns every membership, in insertion order.
     *
     * @return membership snapshot
     */
    public synchronized List<Membership> allMemberships() {
        return new ArrayList<>(memberships.values());
    }

    /**
     * Clears all stored data.
     */
    public synchronized void clear() {
        users.clear();
        teams.clear();
        memberships.clear();
        redirects.clear();
    }

    private void assertUsernameAvailable(User candidate) {
        if (candidate.username() == null) {
            return;
        }
        boolean taken = users.values().stream()
                .filter(other -> other.id() != candidate.id())
                .anyMatch(other -> candidate.username().equals(other.username())
                        && Objects.equals(candidate.organizationId(), other.organizationId()));
        if (taken) {
            throw new UniqueConstraintViolationException(USERNAME_CONSTRAINT,
                    String.format("Unique constraint failed on (username, organizationId) = (%s, %s)",
                            candidate.username(), candidate.organizationId()));
        }
    }

    /**
     * Checks (slug, parentId) against stored teams not being rewritten and against the
     * other rows of the same batch.
     */
    private void assertSlugAvailable(Team candidate, Set<Long> rewrittenIds, List<Team> batch) {
        if (!candidate.hasSlug()) {
            return;
        }
        boolean takenInStore = teams.values().stream()
                .filter(other -> !rewrittenIds.contains(other.id()))
                .anyMatch(other -> sameSlugScope(candidate, other));
        boolean takenInBatch = batch.stream()
                .filter(other -> other.id() != candidate.id())
                .anyMatch(other -> sameSlugScope(candidate, other));
        if (takenInStore || takenInBatch) {
            throw new UniqueConstraintViolationException(TEAM_SLUG_CONSTRAINT,
                    String.format("Unique constraint failed on (slug, parentId) = (%s, %s)",
                            candidate.slug(), candidate.parentId()));
        }
    }

    private static boolean sameSlugScope(Team a, Team b) {
        return a.slug().equals(b.slug()) && Objects.equals(a.parentId(), b.parentId());
    }

    private record MembershipKey(long userId, long teamId) {
    }

    private record RedirectKey(RedirectType type, String from, long fromOrgId) {
    }
}
