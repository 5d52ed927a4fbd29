package com.ryuqq.orgmigration.engine;

/**
 * Organization URL 조립 유틸리티.
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public final class OrgOrigins {

    // Utility class - prevent instantiation
    private OrgOrigins() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Organization의 전체 origin.
     *
     * @param orgSlug Organization slug
     * @param config 엔진 설정
     * @return {@code {scheme}://{orgSlug}.{orgBaseDomain}}
     * @throws IllegalArgumentException orgSlug가 비어있거나 config가 null인 경우
     */
    public static String fullOrigin(String orgSlug, MigrationEngineConfig config) {
        if (orgSlug == null || orgSlug.isBlank()) {
            throw new IllegalArgumentException("orgSlug cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config.scheme() + "://" + orgSlug + "." + config.orgBaseDomain();
    }

    /**
     * Organization 내 사용자 프로필 URL.
     *
     * @param origin Organization origin
     * @param username Organization username
     * @return {@code {origin}/{username}}
     */
    public static String userUrl(String origin, String username) {
        return origin + "/" + username;
    }

    /**
     * Organization 내 팀 URL.
     *
     * @param origin Organization origin
     * @param teamSlug 팀 slug
     * @return {@code {origin}/team/{teamSlug}}
     */
    public static String teamUrl(String origin, String teamSlug) {
        return origin + "/team/" + teamSlug;
    }
}
