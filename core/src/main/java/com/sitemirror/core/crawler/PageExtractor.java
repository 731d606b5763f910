package com.sitemirror.core.crawler;

import com.sitemirror.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 다운로드한 HTML에서 제목/링크 추출 (jsoup) */
public final class PageExtractor {

    private PageExtractor() {}

    private static final Pattern CT_CHARSET = Pattern.compile("(?i)charset\\s*=\\s*\"?([^\";\\s]+)");

    /** 파싱된 문서 + 실제 사용된 문자셋 */
    public record ParsedPage(Document doc, Charset charset) {}

    /**
     * 문자셋 우선순위: Content-Type 헤더 → BOM/meta (jsoup 감지) → UTF-8
     */
    public static ParsedPage parse(byte[] body, String contentType, String baseUrl) throws IOException {
        Charset headerCs = charsetOf(contentType);
        Document doc = Jsoup.parse(new ByteArrayInputStream(body),
                headerCs == null ? null : headerCs.name(), baseUrl);
        return new ParsedPage(doc, doc.charset());
    }

    /** Content-Type이 없거나 HTML 계열이면 true */
    public static boolean isHtml(String contentType) {
        if (contentType == null || contentType.isBlank()) return true;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("text/html") || ct.contains("application/xhtml");
    }

    /** &lt;title&gt; → 첫 &lt;h1&gt; → URL 경로 */
    public static String title(Document doc, String url) {
        String t = doc.title() == null ? "" : doc.title().trim();
        if (!t.isEmpty()) return t;
        Element h1 = doc.selectFirst("h1");
        if (h1 != null && !h1.text().isBlank()) return h1.text().trim();
        return pathOf(url);
    }

    /** 같은 host의 http(s) a[href] (정규화, 문서 순서, 중복 제거) */
    public static List<String> sameDomainLinks(Document doc, String host) {
        Set<String> out = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            String abs = a.absUrl("href");
            if (!UrlUtils.isHttp(abs)) continue;
            if (!host.equalsIgnoreCase(UrlUtils.hostOf(abs))) continue;
            String n = UrlUtils.normalize(abs);
            if (n != null) out.add(n);
        }
        return new ArrayList<>(out);
    }

    static String pathOf(String url) {
        try {
            String p = URI.create(url).getPath();
            return (p == null || p.isEmpty()) ? "/" : p;
        } catch (IllegalArgumentException e) {
            return "/";
        }
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) return null;
        Matcher m = CT_CHARSET.matcher(contentType);
        if (!m.find()) return null;
        try {
            return Charset.forName(m.group(1).trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return null; // 모르는 문자셋이면 jsoup 감지에 맡김
        }
    }
}
