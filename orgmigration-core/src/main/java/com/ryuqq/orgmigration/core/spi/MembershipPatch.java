package com.ryuqq.orgmigration.core.spi;

import com.ryuqq.orgmigration.core.model.MembershipRole;

/**
 * Values written by {@link DirectoryStore#upsertMembership(long, long, MembershipPatch)}.
 *
 * @param role the membership role
 * @param accepted whether the membership is accepted
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public record MembershipPatch(MembershipRole role, boolean accepted) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if role is null
     */
    public MembershipPatch {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
    }
}
