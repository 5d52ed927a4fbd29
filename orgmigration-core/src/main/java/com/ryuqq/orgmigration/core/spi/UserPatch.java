package com.ryuqq.orgmigration.core.spi;

import com.ryuqq.orgmigration.core.model.User;
import com.ryuqq.orgmigration.core.model.UserMetadata;

/**
 * Partial update for a {@link User}.
 *
 * <p>Only fields explicitly set are written; setting a field to {@code null} clears it.</p>
 *
 * <pre>
 * UserPatch patch = UserPatch.empty()
 *     .withOrganizationId(3L)
 *     .withUsername("alice-acme")
 *     .withMetadata(metadata);
 * </pre>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public final class UserPatch {

    private static final UserPatch EMPTY = new UserPatch(false, null, false, null, null);

    private final boolean organizationIdSet;
    private final Long organizationId;
    private final boolean usernameSet;
    private final String username;
    private final UserMetadata metadata;

    private UserPatch(boolean organizationIdSet, Long organizationId,
                      boolean usernameSet, String username, UserMetadata metadata) {
        this.organizationIdSet = organizationIdSet;
        this.organizationId = organizationId;
        this.usernameSet = usernameSet;
        this.username = username;
        this.metadata = metadata;
    }

    public static UserPatch empty() {
        return EMPTY;
    }

    public UserPatch withOrganizationId(Long organizationId) {
        return new UserPatch(true, organizationId, usernameSet, username, metadata);
    }

    public UserPatch withUsername(String username) {
        return new UserPatch(organizationIdSet, organizationId, true, username, metadata);
    }

    public UserPatch withMetadata(UserMetadata metadata) {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        return new UserPatch(organizationIdSet, organizationId, usernameSet, username, metadata);
    }

    /**
     * Returns a copy of the user with this patch applied.
     *
     * @param user the current record
     * @return the patched record
     */
    public User applyTo(User user) {
        return new User(
            user.id(),
            usernameSet ? username : user.username(),
            user.email(),
            organizationIdSet ? organizationId : user.organizationId(),
            metadata != null ? metadata : user.metadata()
        );
    }

    public boolean isOrganizationIdSet() {
        return organizationIdSet;
    }

    public Long organizationId() {
        return organizationId;
    }

    public boolean isUsernameSet() {
        return usernameSet;
    }

    public String username() {
        return username;
    }

    public UserMetadata metadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "UserPatch{"
            + (organizationIdSet ? "organizationId=" + organizationId + ", " : "")
            + (usernameSet ? "username=" + username + ", " : "")
            + (metadata != null ? "metadata=" + metadata : "")
            + '}';
    }
}
