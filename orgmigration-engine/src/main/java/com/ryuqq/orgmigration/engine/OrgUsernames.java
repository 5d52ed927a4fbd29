package com.ryuqq.orgmigration.engine;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 이메일에서 Organization username을 파생하는 유틸리티.
 *
 * <p><strong>규칙:</strong></p>
 * <pre>
 * alice@acme.com,   autoAccept=acme.com → alice
 * alice@gmail.com,  autoAccept=acme.com → alice-gmail
 * Zoë.B@acme.com,   autoAccept=acme.com → zoe-b
 * </pre>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public final class OrgUsernames {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");

    // Utility class - prevent instantiation
    private OrgUsernames() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 이메일과 auto-accept 도메인으로 username 파생.
     *
     * @param email 사용자 이메일
     * @param autoAcceptDomain Organization의 auto-accept 이메일 도메인 (null이면 빈 문자열로 취급)
     * @return slug 형태의 username (빈 문자열일 수 있음)
     * @throws IllegalArgumentException email이 null인 경우
     */
    public static String fromEmail(String email, String autoAcceptDomain) {
        if (email == null) {
            throw new IllegalArgumentException("email cannot be null");
        }
        String[] parts = email.split("@", -1);
        String local = parts[0];
        String domain = parts.length > 1 ? parts[1] : "";

        if (domain.equals(autoAcceptDomain == null ? "" : autoAcceptDomain)) {
            return slugify(local);
        }
        String firstLabel = domain.split("\\.", -1)[0];
        return slugify(local + "-" + firstLabel);
    }

    /**
     * 문자열을 URL slug로 변환.
     *
     * <p>소문자화, 발음 구별 기호 제거, {@code [a-z0-9]} 이외 문자열을 {@code -}로 치환,
     * 앞뒤 {@code -} 제거.</p>
     *
     * @param value 원본 문자열
     * @return slug
     */
    public static String slugify(String value) {
        if (value == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD);
        String stripped = DIACRITICS.matcher(decomposed).replaceAll("");
        String dashed = NON_SLUG.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll("-");
        return EDGE_DASHES.matcher(dashed).replaceAll("");
    }
}
