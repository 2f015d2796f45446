package com.jimin.digest.ingest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 교차 출처 중복 제거 해시
 *
 * SHA-256( 정규 식별자 | 정규화 제목 )
 *  - 정규 식별자: DOI가 있으면 DOI, 없으면 정규화 URL
 *    (소문자, scheme/www/쿼리/프래그먼트/끝 슬래시 제거)
 *  - 정규화 제목: 소문자 + 공백 하나로 축약
 */
public final class DedupeHasher {

    private static final Pattern DOI = Pattern.compile("10\\.\\d{4,}/[^\\s\\])]+");

    private DedupeHasher() {
    }

    public static String hash(String url, String title) {
        String doi = extractDoi(url);
        if (doi == null) {
            doi = extractDoi(title);
        }
        String canonicalId = doi != null ? doi : canonicalUrl(url);
        String normalizedTitle = title.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
        return sha256(canonicalId + "|" + normalizedTitle);
    }

    public static String extractDoi(String text) {
        if (text == null) return null;
        Matcher matcher = DOI.matcher(text);
        return matcher.find() ? matcher.group().toLowerCase(Locale.ROOT) : null;
    }

    static String canonicalUrl(String url) {
        String canonical = url.toLowerCase(Locale.ROOT).trim();
        canonical = canonical.split("\\?")[0].split("#")[0];
        canonical = canonical.replaceFirst("^https?://", "");
        canonical = canonical.replaceFirst("^www\\.", "");
        return canonical.replaceAll("/+$", "");
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 을 사용할 수 없습니다", e);
        }
    }
}
