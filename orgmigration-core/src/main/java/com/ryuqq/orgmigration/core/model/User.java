package com.ryuqq.orgmigration.core.model;

/**
 * Directory 사용자 레코드.
 *
 * <p>organizationId가 null이면 standalone 네임스페이스에 속한 사용자입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>한 사용자는 최대 하나의 organizationId만 가짐</li>
 *   <li>username은 (username, organizationId) 범위에서 유일 (organizationId가 null이면 standalone 범위)</li>
 *   <li>metadata.migratedToOrgFrom.username은 마지막으로 알려진 standalone username</li>
 * </ul>
 *
 * @param id 안정적인 숫자 식별자
 * @param username 사용자명 (null 가능)
 * @param email 이메일 (null 가능, org username 파생에 사용)
 * @param organizationId 소속 Organization ID (null 가능)
 * @param metadata 메타데이터 (null이면 빈 메타데이터로 대체)
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public record User(
    long id,
    String username,
    String email,
    Long organizationId,
    UserMetadata metadata
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 양수가 아닌 경우
     */
    public User {
        if (id <= 0) {
            throw new IllegalArgumentException("id must be positive, but was: " + id);
        }
        if (metadata == null) {
            metadata = UserMetadata.empty();
        }
    }

    /**
     * standalone 사용자인지 확인.
     *
     * @return organizationId가 null이면 true
     */
    public boolean isStandalone() {
        return organizationId == null;
    }

    /**
     * 지정한 Organization 소속인지 확인.
     *
     * @param orgId Organization ID
     * @return 소속이면 true
     */
    public boolean belongsTo(long orgId) {
        return organizationId != null && organizationId == orgId;
    }

    /**
     * 마이그레이션 이력 조회 (없으면 null).
     *
     * @return migratedToOrgFrom
     */
    public MigrationProvenance provenance() {
        return metadata.migratedToOrgFrom();
    }
}
