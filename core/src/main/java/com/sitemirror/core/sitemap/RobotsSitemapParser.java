package com.sitemirror.core.sitemap;

import com.sitemirror.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * robots.txt에서 Sitemap 지시어만 추출.
 * - 키 대소문자 무시, '#' 이후 주석 제거
 * - 상대 값은 robots.txt 위치 기준으로 절대화
 * - 그룹(User-agent)과 무관하게 파일 전체에서 수집, 첫 등장 순서 유지
 */
public final class RobotsSitemapParser {

    private RobotsSitemapParser() {}

    private static final Pattern KV = Pattern.compile("^\\s*([A-Za-z-]+)\\s*:\\s*(.*?)\\s*$");

    public static List<String> parse(String robotsTxt, URI base) {
        Set<String> out = new LinkedHashSet<>();
        if (robotsTxt == null || robotsTxt.isEmpty()) return new ArrayList<>(out);

        for (String rawLine : robotsTxt.split("\\r?\\n|\\r")) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) continue;

            Matcher m = KV.matcher(line);
            if (!m.matches()) continue;

            String key = m.group(1).toLowerCase(Locale.ROOT);
            if (!key.equals("sitemap")) continue;   // 그 외 지시어는 무시

            String val = m.group(2).trim();
            if (val.isEmpty()) continue;
            String abs = resolve(base, val);
            if (abs != null) out.add(abs);
        }
        return new ArrayList<>(out);
    }

    private static String resolve(URI base, String val) {
        try {
            URI u = (base == null ? URI.create(val) : base.resolve(val));
            return UrlUtils.isHttp(u.toString()) ? UrlUtils.normalize(u) : null;
        } catch (IllegalArgumentException e) {
            return null; // 잘못된 값은 건너뜀
        }
    }

    // "http://" 안의 '#'은 fragment이므로 공백 뒤 '#'만 주석으로 본다
    private static String stripComment(String s) {
        int i = s.indexOf('#');
        while (i > 0 && !Character.isWhitespace(s.charAt(i - 1))) {
            i = s.indexOf('#', i + 1);
        }
        return i >= 0 ? s.substring(0, i) : s;
    }
}
