package com.ryuqq.orgmigration.core.model;

/**
 * Directory 팀 레코드.
 *
 * <p>Organization도 팀 레코드이며 {@code metadata.isOrganization}으로 구분합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>Organization 팀의 parentId는 항상 null (중첩 불가)</li>
 *   <li>일반 팀의 parentId는 설정된 경우 Organization 팀을 가리킴</li>
 *   <li>slug는 (slug, parentId) 범위에서 유일</li>
 * </ul>
 *
 * @param id 팀 ID
 * @param name 표시 이름 (null 가능)
 * @param slug slug (null 가능)
 * @param parentId 상위 Organization ID (null 가능)
 * @param metadata 팀 메타데이터 (null이면 빈 메타데이터로 대체)
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public record Team(
    long id,
    String name,
    String slug,
    Long parentId,
    TeamMetadata metadata
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 양수가 아니거나 Organization에 parentId가 있는 경우
     */
    public Team {
        if (id <= 0) {
            throw new IllegalArgumentException("id must be positive, but was: " + id);
        }
        if (metadata == null) {
            metadata = TeamMetadata.empty();
        }
        if (metadata.isOrganization() && parentId != null) {
            throw new IllegalArgumentException("Organization " + id + " cannot have a parent (parentId: " + parentId + ")");
        }
    }

    /**
     * Organization 팀인지 확인.
     *
     * @return metadata.isOrganization
     */
    public boolean isOrganization() {
        return metadata.isOrganization();
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
     * 지정한 Organization 하위 팀인지 확인.
     *
     * @param orgId Organization ID
     * @return parentId == orgId
     */
    public boolean isChildOf(long orgId) {
        return parentId != null && parentId == orgId;
    }
}
