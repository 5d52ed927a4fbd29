package com.ryuqq.orgmigration.core.spi;

/**
 * Filter for {@link DirectoryStore#findFirstUser(UserFilter)}.
 *
 * @param username the username to match
 * @param organizationId the namespace to match (null matches standalone users only)
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public record UserFilter(String username, Long organizationId) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if username is null or blank
     */
    public UserFilter {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username cannot be null or blank");
        }
    }

    public static UserFilter inOrganization(String username, long organizationId) {
        return new UserFilter(username, organizationId);
    }

    public static UserFilter standalone(String username) {
        return new UserFilter(username, null);
    }
}
