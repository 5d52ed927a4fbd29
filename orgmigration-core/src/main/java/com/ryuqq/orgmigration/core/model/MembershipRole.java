package com.ryuqq.orgmigration.core.model;

/**
 * 멤버십 역할.
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public enum MembershipRole {
    MEMBER,
    ADMIN,
    OWNER
}
