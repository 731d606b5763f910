package com.sitemirror.core.sitemap;

import com.sitemirror.core.api.Fetcher;
import com.sitemirror.core.model.FetchResult;
import com.sitemirror.core.util.StructuredLog;
import com.sitemirror.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 도메인의 사이트맵 후보 URL 탐색.
 * 1) robots.txt의 Sitemap: (항상 조회)
 * 2) 관례 경로 GET 프로브 (1에서 못 찾은 경우, 목록 전체)
 * 3) 루트 HTML의 link[rel=sitemap] / "sitemap" 앵커, 그래도 없으면 /sitemap HTML 페이지의 .xml 앵커
 * 각 단계는 독립적으로 실패해도 다음으로 넘어간다. 결과는 첫 등장 순으로 중복 제거.
 */
public class SitemapDiscoverer {

    private static final Logger LOG = LoggerFactory.getLogger(SitemapDiscoverer.class);
    private static final StructuredLog SLOG = StructuredLog.get(SitemapDiscoverer.class);

    /** 관례 경로 (프로브 순서) */
    public static final List<String> COMMON_PATHS = List.of(
            "/sitemap.xml",
            "/sitemap_index.xml",
            "/sitemap-index.xml",
            "/sitemaps.xml",
            "/sitemap1.xml",
            "/sitemap_1.xml"
    );

    private final Fetcher fetcher;

    public SitemapDiscoverer(Fetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    /**
     * @param domainRootOrUrl 도메인 루트 또는 그 도메인의 아무 URL
     * @return 후보 사이트맵 URL(정규화), 없으면 빈 리스트
     */
    public List<String> discover(String domainRootOrUrl) {
        String root = UrlUtils.domainRoot(domainRootOrUrl);
        if (root == null) return List.of();

        Set<String> found = new LinkedHashSet<>(fromRobots(root));
        if (found.isEmpty()) found.addAll(fromCommonPaths(root));
        if (found.isEmpty()) found.addAll(fromHtml(root));

        LOG.info("Sitemap discovery for {} -> {} candidate(s)", root, found.size());
        SLOG.info("sitemap-discovered", "root", root, "count", found.size());
        return new ArrayList<>(found);
    }

    // ---------- 1) robots.txt ----------
    List<String> fromRobots(String root) {
        String robotsUrl = root + "/robots.txt";
        FetchResult r = fetcher.fetch(robotsUrl);
        if (!r.isSuccess()) {
            LOG.debug("robots.txt unavailable: {} ({})", robotsUrl, r.failureReason());
            return List.of();
        }
        return RobotsSitemapParser.parse(r.bodyAsString(), URI.create(robotsUrl));
    }

    // ---------- 2) 관례 경로 ----------
    List<String> fromCommonPaths(String root) {
        List<String> hits = new ArrayList<>();
        for (String path : COMMON_PATHS) {
            String url = root + path;
            FetchResult r = fetcher.fetch(url);
            if (r.isSuccess() && looksLikeXml(r)) hits.add(UrlUtils.normalize(url));
        }
        return hits;
    }

    // ---------- 3) HTML 탐색 ----------
    List<String> fromHtml(String root) {
        Set<String> out = new LinkedHashSet<>();
        Document home = fetchHtml(root);
        if (home != null) {
            for (Element link : home.select("link[rel=sitemap][href]")) {
                addHttp(out, link.absUrl("href"));
            }
            for (Element a : home.select("a[href]")) {
                if (a.attr("href").toLowerCase(Locale.ROOT).contains("sitemap")) addHttp(out, a.absUrl("href"));
            }
        }
        if (!out.isEmpty()) return new ArrayList<>(out);

        // 사람이 보는 /sitemap 페이지에 XML 링크가 걸린 경우
        Document page = fetchHtml(root + "/sitemap");
        if (page != null) {
            for (Element a : page.select("a[href]")) {
                String abs = a.absUrl("href");
                String l = UrlUtils.stripFragment(abs).toLowerCase(Locale.ROOT);
                if (l.contains("sitemap") && l.endsWith(".xml")) addHttp(out, abs);
            }
        }
        return new ArrayList<>(out);
    }

    // ---------- helpers ----------

    private Document fetchHtml(String url) {
        FetchResult r = fetcher.fetch(url);
        if (!r.isSuccess()) return null;
        return Jsoup.parse(r.bodyAsString(), r.finalUrl());
    }

    private static void addHttp(Set<String> out, String abs) {
        if (UrlUtils.isHttp(abs)) {
            String n = UrlUtils.normalize(abs);
            if (n != null) out.add(n);
        }
    }

    /** XML 계열 Content-Type 이거나 본문이 XML/urlset/sitemapindex로 시작 */
    static boolean looksLikeXml(FetchResult r) {
        String ct = r.contentType() == null ? "" : r.contentType().toLowerCase(Locale.ROOT);
        if (ct.contains("xml")) return true;
        byte[] b = r.body();
        String head = new String(b, 0, Math.min(b.length, 512), StandardCharsets.UTF_8);
        if (!head.isEmpty() && head.charAt(0) == '\uFEFF') head = head.substring(1);
        head = head.stripLeading().toLowerCase(Locale.ROOT);
        return head.startsWith("<?xml") || head.startsWith("<urlset") || head.startsWith("<sitemapindex");
    }
}
