package com.ryuqq.orgmigration.engine;

/**
 * Migration Engine 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scheme: Organization origin의 URL scheme (기본 https)</li>
 *   <li>orgBaseDomain: Organization 하위 도메인이 붙는 기본 도메인 (기본 example.com)</li>
 *   <li>defaultMembershipAccepted: 명령에 accepted가 없을 때 사용할 값 (기본 true)</li>
 * </ul>
 *
 * <p>Organization origin은 {@code {scheme}://{orgSlug}.{orgBaseDomain}} 형식입니다.</p>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 * @param scheme URL scheme (비어있으면 안 됨)
 * @param orgBaseDomain 기본 도메인 (비어있으면 안 됨)
 * @param defaultMembershipAccepted 기본 멤버십 수락 여부
 */
public record MigrationEngineConfig(String scheme, String orgBaseDomain, boolean defaultMembershipAccepted) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scheme=https, orgBaseDomain=example.com, defaultMembershipAccepted=true</p>
     */
    public MigrationEngineConfig() {
        this("https", "example.com", true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MigrationEngineConfig {
        if (scheme == null || scheme.isBlank()) {
            throw new IllegalArgumentException("scheme cannot be null or blank");
        }
        if (orgBaseDomain == null || orgBaseDomain.isBlank()) {
            throw new IllegalArgumentException("orgBaseDomain cannot be null or blank");
        }
        if (orgBaseDomain.startsWith(".") || orgBaseDomain.endsWith(".")) {
            throw new IllegalArgumentException(
                "orgBaseDomain must not start or end with a dot (current: " + orgBaseDomain + ")"
            );
        }
    }

    /**
     * scheme만 변경한 새 인스턴스 생성.
     *
     * @param scheme 새로운 scheme
     * @return 새 MigrationEngineConfig 인스턴스
     */
    public MigrationEngineConfig withScheme(String scheme) {
        return new MigrationEngineConfig(scheme, this.orgBaseDomain, this.defaultMembershipAccepted);
    }

    /**
     * orgBaseDomain만 변경한 새 인스턴스 생성.
     *
     * @param orgBaseDomain 새로운 기본 도메인
     * @return 새 MigrationEngineConfig 인스턴스
     */
    public MigrationEngineConfig withOrgBaseDomain(String orgBaseDomain) {
        return new MigrationEngineConfig(this.scheme, orgBaseDomain, this.defaultMembershipAccepted);
    }

    /**
     * defaultMembershipAccepted만 변경한 새 인스턴스 생성.
     *
     * @param defaultMembershipAccepted 새로운 기본 수락 여부
     * @return 새 MigrationEngineConfig 인스턴스
     */
    public MigrationEngineConfig withDefaultMembershipAccepted(boolean defaultMembershipAccepted) {
        return new MigrationEngineConfig(this.scheme, this.orgBaseDomain, defaultMembershipAccepted);
    }
}
