package com.ryuqq.orgmigration.core.model;

/**
 * Redirect 매핑 대상 유형.
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public enum RedirectType {

    /**
     * 사용자 vanity URL.
     */
    USER,

    /**
     * 팀 vanity URL.
     */
    TEAM
}
