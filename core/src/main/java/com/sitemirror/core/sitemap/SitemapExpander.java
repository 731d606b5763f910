package com.sitemirror.core.sitemap;

import com.sitemirror.core.api.Fetcher;
import com.sitemirror.core.model.FetchResult;
import com.sitemirror.core.model.PageRef;
import com.sitemirror.core.model.SitemapNode;
import com.sitemirror.core.util.DefaultSleeper;
import com.sitemirror.core.util.Sleeper;
import com.sitemirror.core.util.StructuredLog;
import com.sitemirror.core.util.UrlUtils;
import crawlercommons.sitemaps.AbstractSiteMap;
import crawlercommons.sitemaps.SiteMap;
import crawlercommons.sitemaps.SiteMapIndex;
import crawlercommons.sitemaps.SiteMapParser;
import crawlercommons.sitemaps.SiteMapURL;
import crawlercommons.sitemaps.UnknownFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * 사이트맵 URL 하나를 말단 페이지 URL 집합으로 펼친다.
 * - 재귀 대신 명시적 작업 큐 사용
 * - 각 URL은 정규화 후 visited에 먼저 등록되고 나서 fetch된다 (순환 그래프에서도 노드당 최대 1회)
 * - 404/전송 오류/파싱 불가 문서는 소프트 실패로 기록하고 형제 노드는 계속 진행
 */
public class SitemapExpander {

    private static final Logger LOG = LoggerFactory.getLogger(SitemapExpander.class);
    private static final StructuredLog SLOG = StructuredLog.get(SitemapExpander.class);
    private static final String DEFAULT_CONTENT_TYPE = "application/xml";

    private final Fetcher fetcher;
    private final Sleeper sleeper;
    private final Duration delay;
    private final SiteMapParser parser = new SiteMapParser(false, false); // lenient, 부분 문서 불허

    public SitemapExpander(Fetcher fetcher) {
        this(fetcher, new DefaultSleeper(), Duration.ZERO);
    }

    public SitemapExpander(Fetcher fetcher, Sleeper sleeper, Duration delay) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.delay = (delay == null ? Duration.ZERO : delay);
    }

    /** 말단 PageRef만 필요할 때 */
    public Set<PageRef> expand(String sitemapUrl, Set<String> visited) {
        return new LinkedHashSet<>(expandDetailed(sitemapUrl, visited, SitemapSink.NONE, () -> false).pages());
    }

    /**
     * @param visited   세션 공유 방문 집합(정규화 URL). 호출 중에 갱신된다.
     * @param sink      파싱 성공 노드 + 원본 바이트 수신자
     * @param cancelled 각 fetch 전에 확인하는 취소 플래그
     */
    public SitemapExpansion expandDetailed(String sitemapUrl, Set<String> visited,
                                           SitemapSink sink, BooleanSupplier cancelled) {
        Objects.requireNonNull(visited, "visited");
        SitemapSink out = (sink != null ? sink : SitemapSink.NONE);
        BooleanSupplier stop = (cancelled != null ? cancelled : () -> false);

        String root = UrlUtils.normalize(sitemapUrl);
        if (root == null || !visited.add(root)) return SitemapExpansion.empty();

        Map<String, PageRef> pages = new LinkedHashMap<>();
        List<SitemapNode> nodes = new ArrayList<>();
        List<SitemapExpansion.Failure> failures = new ArrayList<>();

        Deque<String> work = new ArrayDeque<>();
        work.addLast(root);
        boolean requested = false;

        while (!work.isEmpty()) {
            if (stop.getAsBoolean()) break;
            String url = work.pollFirst();

            if (requested && !delay.isZero()) {
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (stop.getAsBoolean()) break;
            }

            FetchResult r = fetcher.fetch(url);
            requested = true;
            if (!r.isSuccess()) {
                softFail(failures, url, r.failureReason());
                continue;
            }

            SitemapNode node;
            try {
                node = parse(url, r);
            } catch (UnknownFormatException | IOException e) {
                softFail(failures, url, "parse: " + e.getMessage());
                continue;
            }
            nodes.add(node);

            switch (node.kind()) {
                case INDEX -> {
                    for (String child : node.sitemaps()) {
                        if (visited.add(child)) work.addLast(child);
                    }
                }
                case URLSET -> {
                    for (PageRef p : node.pages()) pages.putIfAbsent(p.url(), p);
                }
            }
            LOG.debug("Sitemap parsed: {} kind={} entries={}", url, node.kind(), node.entryCount());
            SLOG.info("sitemap-parsed", "url", url, "kind", node.kind().wire(), "entries", node.entryCount());

            try {
                out.accept(node, r.body());
            } catch (IOException e) {
                softFail(failures, url, "storage: " + e.getMessage());
            }
        }
        return new SitemapExpansion(new ArrayList<>(pages.values()), nodes, failures);
    }

    // ---------- helpers ----------

    private SitemapNode parse(String url, FetchResult r) throws UnknownFormatException, IOException {
        String ct = (r.contentType() == null || r.contentType().isBlank()) ? DEFAULT_CONTENT_TYPE : r.contentType();
        AbstractSiteMap asm = parser.parseSiteMap(ct, r.body(), URI.create(url).toURL());

        if (asm instanceof SiteMapIndex index) {
            List<String> children = new ArrayList<>();
            for (AbstractSiteMap child : index.getSitemaps()) {
                String n = UrlUtils.normalize(child.getUrl().toString());
                if (n != null && !children.contains(n)) children.add(n);
            }
            return SitemapNode.index(url, children);
        }
        if (asm instanceof SiteMap sm) {
            List<PageRef> refs = new ArrayList<>();
            Set<String> seen = new LinkedHashSet<>();
            for (SiteMapURL su : sm.getSiteMapUrls()) {
                String n = UrlUtils.normalize(su.getUrl().toString());
                if (n == null || !seen.add(n)) continue;
                Instant lm = (su.getLastModified() == null ? null : su.getLastModified().toInstant());
                refs.add(new PageRef(n, lm));
            }
            return SitemapNode.urlset(url, refs);
        }
        throw new UnknownFormatException("unsupported sitemap type: " + asm.getClass().getSimpleName());
    }

    private static void softFail(List<SitemapExpansion.Failure> failures, String url, String reason) {
        failures.add(new SitemapExpansion.Failure(url, reason));
        LOG.warn("Sitemap skipped: {} ({})", url, reason);
        SLOG.warn("sitemap-failed", "url", url, "reason", reason);
    }
}
