package com.ryuqq.orgmigration.application.migration;

/**
 * 전송 계층에 넘겨줄 응답 (상태 코드 + 메시지).
 *
 * <p>성공 응답만 {@link MigrationReport}를 가집니다.</p>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public final class MigrationResponse {

    private final int statusCode;
    private final String message;
    private final MigrationReport reportOrNull;

    private MigrationResponse(int statusCode, String message, MigrationReport reportOrNull) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        this.statusCode = statusCode;
        this.message = message;
        this.reportOrNull = reportOrNull;
    }

    /**
     * 성공 응답 생성 (200).
     *
     * @param message 사람이 읽을 수 있는 메시지
     * @param report 실행 보고서
     * @return MigrationResponse 인스턴스
     * @throws IllegalArgumentException report가 null인 경우
     */
    public static MigrationResponse ok(String message, MigrationReport report) {
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null for ok response");
        }
        return new MigrationResponse(200, message, report);
    }

    /**
     * 실패 응답 생성.
     *
     * @param statusCode 상태 코드 (400 이상)
     * @param message 사람이 읽을 수 있는 메시지
     * @return MigrationResponse 인스턴스
     * @throws IllegalArgumentException statusCode가 400 미만인 경우
     */
    public static MigrationResponse failed(int statusCode, String message) {
        if (statusCode < 400) {
            throw new IllegalArgumentException("failed response requires status >= 400 (current: " + statusCode + ")");
        }
        return new MigrationResponse(statusCode, message, null);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getMessage() {
        return message;
    }

    public MigrationReport getReportOrNull() {
        return reportOrNull;
    }

    public boolean isSuccess() {
        return statusCode < 300;
    }

    @Override
    public String toString() {
        return "MigrationResponse{status=" + statusCode + ", message=" + message + "}";
    }
}
