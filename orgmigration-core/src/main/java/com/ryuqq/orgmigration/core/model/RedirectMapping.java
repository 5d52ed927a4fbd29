package com.ryuqq.orgmigration.core.model;

/**
 * Standalone 식별자 → Organization URL 매핑.
 *
 * <p>유일 키는 (type, from, fromOrgId)이며, {@code fromOrgId = 0}은
 * standalone 네임스페이스를 의미합니다.</p>
 *
 * @param type 매핑 유형
 * @param from 이전 식별자 (username 또는 team slug)
 * @param fromOrgId 이전 네임스페이스 ({@link #STANDALONE_ORG_ID}이면 standalone)
 * @param toUrl 새 Organization URL
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public record RedirectMapping(
    RedirectType type,
    String from,
    long fromOrgId,
    String toUrl
) {

    /**
     * standalone 네임스페이스 sentinel.
     */
    public static final long STANDALONE_ORG_ID = 0L;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public RedirectMapping {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (from == null || from.isBlank()) {
            throw new IllegalArgumentException("from cannot be null or blank");
        }
        if (fromOrgId < 0) {
            throw new IllegalArgumentException("fromOrgId cannot be negative, but was: " + fromOrgId);
        }
        if (toUrl == null || toUrl.isBlank()) {
            throw new IllegalArgumentException("toUrl cannot be null or blank");
        }
    }
}
