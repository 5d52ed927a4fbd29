package com.ryuqq.orgmigration.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 사용자 메타데이터.
 *
 * <p>마이그레이션 엔진이 해석하는 필드는 {@code migratedToOrgFrom} 하나이며,
 * 나머지 키는 {@code attributes}에 그대로 보존됩니다.</p>
 *
 * @param migratedToOrgFrom 마이그레이션 이력 (null 가능)
 * @param attributes 엔진이 해석하지 않는 나머지 메타데이터 (읽기 전용 복사본)
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public record UserMetadata(
    MigrationProvenance migratedToOrgFrom,
    Map<String, Object> attributes
) {

    private static final UserMetadata EMPTY = new UserMetadata(null, Map.of());

    /**
     * Compact Constructor.
     */
    public UserMetadata {
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * 빈 메타데이터.
     *
     * @return UserMetadata 인스턴스
     */
    public static UserMetadata empty() {
        return EMPTY;
    }

    /**
     * 이력만 가진 메타데이터 생성.
     *
     * @param provenance 마이그레이션 이력
     * @return UserMetadata 인스턴스
     */
    public static UserMetadata of(MigrationProvenance provenance) {
        return new UserMetadata(provenance, Map.of());
    }

    /**
     * migratedToOrgFrom만 교체한 새 인스턴스 생성 (attributes 보존).
     *
     * @param provenance 새 마이그레이션 이력
     * @return 새 UserMetadata 인스턴스
     */
    public UserMetadata withMigratedToOrgFrom(MigrationProvenance provenance) {
        return new UserMetadata(provenance, attributes);
    }
}
