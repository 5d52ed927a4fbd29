package com.ryuqq.orgmigration.core.error;

/**
 * 마이그레이션 실패 분류.
 *
 * <p>{@link #INTERNAL}을 제외한 모든 분류는 호출자 측 오류(400 계열)입니다.</p>
 *
 * <table>
 *   <caption>분류별 상태 코드</caption>
 *   <tr><th>Kind</th><th>Status</th><th>예시</th></tr>
 *   <tr><td>INVALID_ARGUMENT</td><td>400</td><td>userId와 userName 동시 지정, slug 누락</td></tr>
 *   <tr><td>NOT_FOUND</td><td>404</td><td>사용자/팀/Organization 없음</td></tr>
 *   <tr><td>CONFLICT</td><td>409</td><td>username 중복, 다른 Organization 소속, slug 충돌, 이미 revert됨</td></tr>
 *   <tr><td>NOT_AN_ORGANIZATION</td><td>400</td><td>대상 팀에 Organization 태그 없음</td></tr>
 *   <tr><td>INTERNAL</td><td>500</td><td>예상치 못한 Store 실패</td></tr>
 * </table>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public enum ErrorKind {

    INVALID_ARGUMENT(400, "MIG-400"),
    NOT_FOUND(404, "MIG-404"),
    CONFLICT(409, "MIG-409"),
    NOT_AN_ORGANIZATION(400, "MIG-422"),
    INTERNAL(500, "MIG-500");

    private final int statusCode;
    private final String errorCode;

    ErrorKind(int statusCode, String errorCode) {
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    /**
     * HTTP 유사 상태 코드.
     *
     * @return 상태 코드
     */
    public int statusCode() {
        return statusCode;
    }

    /**
     * 오류 코드 (예: MIG-409).
     *
     * @return 오류 코드
     */
    public String errorCode() {
        return errorCode;
    }
}
