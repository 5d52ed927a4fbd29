package com.ryuqq.orgmigration.core.model;

/**
 * 팀 메타데이터.
 *
 * <p>Store 경계에서 한 번만 해석되며, 호출부에서 다시 파싱하지 않습니다.</p>
 *
 * @param isOrganization Organization 팀 여부
 * @param requestedSlug slug가 없을 때 채택할 slug (null 가능)
 * @param orgAutoAcceptEmail username 파생에 사용하는 이메일 도메인 (null 가능)
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public record TeamMetadata(
    boolean isOrganization,
    String requestedSlug,
    String orgAutoAcceptEmail
) {

    private static final TeamMetadata EMPTY = new TeamMetadata(false, null, null);

    /**
     * 일반 팀용 빈 메타데이터.
     *
     * @return TeamMetadata 인스턴스
     */
    public static TeamMetadata empty() {
        return EMPTY;
    }

    /**
     * Organization 메타데이터 생성.
     *
     * @param requestedSlug 요청된 slug (null 가능)
     * @param orgAutoAcceptEmail 자동 수락 이메일 도메인 (null 가능)
     * @return TeamMetadata 인스턴스
     */
    public static TeamMetadata organization(String requestedSlug, String orgAutoAcceptEmail) {
        return new TeamMetadata(true, requestedSlug, orgAutoAcceptEmail);
    }

    /**
     * requestedSlug가 있는지 확인.
     *
     * @return requestedSlug가 비어있지 않으면 true
     */
    public boolean hasRequestedSlug() {
        return requestedSlug != null && !requestedSlug.isBlank();
    }
}
