package com.ryuqq.orgmigration.core.spi;

/**
 * Raised by a {@link DirectoryStore} when a write would break a uniqueness constraint.
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public class UniqueConstraintViolationException extends RuntimeException {

    private final String constraint;

    /**
     * Constructor.
     *
     * @param constraint the violated constraint name
     * @param message detail message
     */
    public UniqueConstraintViolationException(String constraint, String message) {
        super(message);
        this.constraint = constraint;
    }

    /**
     * Returns the violated constraint name.
     *
     * @return constraint name (e.g. {@link DirectoryStore#TEAM_SLUG_CONSTRAINT})
     */
    public String constraint() {
        return constraint;
    }
}
