package com.ryuqq.orgmigration.core.model;

import java.time.Instant;

/**
 * 마이그레이션 이력 ({@code metadata.migratedToOrgFrom}).
 *
 * <p>원래의 standalone username과 타임스탬프를 보존하여
 * 역방향 마이그레이션과 재마이그레이션을 멱등하게 만듭니다.</p>
 *
 * <p><strong>두 가지 형태:</strong></p>
 * <pre>
 * migrated: {username: "alice", reverted: false, lastMigrationTime: t}
 * reverted: {username: null,    reverted: true,  revertTime: t}
 * </pre>
 *
 * @param username 마지막 standalone username (revert 이후 null)
 * @param reverted revert 여부
 * @param revertTime revert 시각 (null 가능)
 * @param lastMigrationTime 마지막 마이그레이션 시각 (null 가능)
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public record MigrationProvenance(
    String username,
    boolean reverted,
    Instant revertTime,
    Instant lastMigrationTime
) {

    /**
     * 마이그레이션 직후의 이력 생성.
     *
     * <p>이전 revert 플래그는 남기지 않습니다.</p>
     *
     * @param nonOrgUsername 보존할 standalone username
     * @param migratedAt 마이그레이션 시각
     * @return MigrationProvenance 인스턴스
     * @throws IllegalArgumentException nonOrgUsername이 null이거나 빈 문자열인 경우
     */
    public static MigrationProvenance migrated(String nonOrgUsername, Instant migratedAt) {
        if (nonOrgUsername == null || nonOrgUsername.isBlank()) {
            throw new IllegalArgumentException("nonOrgUsername cannot be null or blank");
        }
        return new MigrationProvenance(nonOrgUsername, false, null, migratedAt);
    }

    /**
     * revert 직후의 이력 생성.
     *
     * @param revertedAt revert 시각
     * @return MigrationProvenance 인스턴스
     */
    public static MigrationProvenance reverted(Instant revertedAt) {
        return new MigrationProvenance(null, true, revertedAt, null);
    }

    /**
     * 보존된 standalone username이 있는지 확인.
     *
     * @return username이 비어있지 않으면 true
     */
    public boolean hasUsername() {
        return username != null && !username.isBlank();
    }
}
