package com.sitemirror.core.util;

import java.net.URI;
import java.util.Locale;

/** URL 정규화 + same-domain 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 중복 슬래시 축소, 끝 슬래시 제거(루트는 빈 경로)
     * - 쿼리는 원문 그대로 유지
     *
     * @return 정규화된 절대 URL, 파싱 불가/상대 URL이면 null
     */
    public static String normalize(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty()) return null;
        URI u;
        try {
            u = URI.create(s);
        } catch (IllegalArgumentException e) {
            return null;
        }
        return normalize(u);
    }

    public static String normalize(URI u) {
        if (u == null || u.getScheme() == null) return null;
        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        String host = u.getHost();
        if (host == null || host.isEmpty()) return null;
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        // 인코딩 보존을 위해 raw 컴포넌트로 조립
        String path = u.getRawPath() == null ? "" : u.getRawPath();
        path = path.replaceAll("/{2,}", "/");
        while (path.endsWith("/")) path = path.substring(0, path.length() - 1);

        StringBuilder sb = new StringBuilder(scheme.length() + host.length() + path.length() + 16);
        sb.append(scheme).append("://");
        if (u.getRawUserInfo() != null) sb.append(u.getRawUserInfo()).append('@');
        sb.append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());
        return sb.toString();
    }

    /** http/https 절대 URL 여부 */
    public static boolean isHttp(String url) {
        if (url == null) return false;
        String l = url.trim().toLowerCase(Locale.ROOT);
        return l.startsWith("http://") || l.startsWith("https://");
    }

    /** host 소문자, 없으면 빈 문자열 */
    public static String hostOf(String url) {
        if (url == null) return "";
        try {
            String h = URI.create(url.trim()).getHost();
            return h == null ? "" : h.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    /** host 기준 동일 도메인 판정(소문자 비교) */
    public static boolean sameDomain(String a, String b) {
        String ha = hostOf(a);
        return !ha.isEmpty() && ha.equals(hostOf(b));
    }

    /** scheme://host[:port] 형태의 도메인 루트 */
    public static String domainRoot(String url) {
        String n = normalize(url);
        if (n == null) return null;
        URI u = URI.create(n);
        return u.getScheme() + "://" + u.getRawAuthority();
    }

    /** fragment("#..."), 없으면 빈 문자열 */
    public static String fragmentOf(String href) {
        if (href == null) return "";
        int i = href.indexOf('#');
        return i >= 0 ? href.substring(i) : "";
    }

    public static String stripFragment(String href) {
        if (href == null) return null;
        int i = href.indexOf('#');
        return i >= 0 ? href.substring(0, i) : href;
    }
}
