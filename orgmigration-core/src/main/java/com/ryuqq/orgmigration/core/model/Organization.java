package com.ryuqq.orgmigration.core.model;

/**
 * 검증된 Organization 팀.
 *
 * <p>{@code isOrganization} 태그가 확인된 팀만 이 타입으로 표현됩니다.</p>
 *
 * @param id Organization ID
 * @param slug slug (null 가능)
 * @param metadata 메타데이터
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public record Organization(
    long id,
    String slug,
    TeamMetadata metadata
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException metadata가 null이거나 Organization 태그가 없는 경우
     */
    public Organization {
        if (metadata == null || !metadata.isOrganization()) {
            throw new IllegalArgumentException("Team " + id + " is not tagged as an organization");
        }
    }

    /**
     * 검증된 팀 레코드에서 생성.
     *
     * @param team Organization 태그가 있는 팀
     * @return Organization 인스턴스
     */
    public static Organization from(Team team) {
        return new Organization(team.id(), team.slug(), team.metadata());
    }

    /**
     * slug가 있는지 확인.
     *
     * @return slug가 비어있지 않으면 true
     */
    public boolean hasSlug() {
        return slug != null && !slug.isBlank();
    }

    /**
     * Redirect URL에 사용할 slug (slug → requestedSlug 순).
     *
     * @return slug, requestedSlug, 또는 둘 다 없으면 null
     */
    public String effectiveSlug() {
        if (hasSlug()) {
            return slug;
        }
        return metadata.hasRequestedSlug() ? metadata.requestedSlug() : null;
    }
}
