package com.sitemirror.core.model;

import com.sitemirror.core.util.UrlUtils;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * 미러링 설정 (mirror.yml 매핑 대상). 순수 설정 보관용.
 * CLI/컨트롤러 오버라이드는 copy() 후 세터로 적용한다.
 */
public final class MirrorConfig {

    // ---------- 기본 필드 ----------
    private String target;                 // 시드 URL (필수)
    private Mode mode = Mode.SITE;
    private Integer maxPages;              // null = 무제한
    private Duration timeout = Duration.ofSeconds(30);
    private Duration delay = Duration.ofMillis(500);          // 페이지 요청 간격
    private Duration sitemapDelay = Duration.ofSeconds(1);    // 사이트맵 요청 간격
    private String userAgent = "SiteMirror/1.0 (+offline-mirror)";
    private boolean followLinks = true;
    private boolean useSitemaps = true;
    private Path outputDir = Path.of("offline_output");
    private Path sitemapDir = Path.of("sitemap_output");

    // ---------- getters ----------
    public String getTarget() { return target; }
    public Mode getMode() { return mode == null ? Mode.SITE : mode; }
    public Integer getMaxPages() { return maxPages; }
    public Duration getTimeout() { return timeout; }
    public Duration getDelay() { return delay; }
    public Duration getSitemapDelay() { return sitemapDelay; }
    public String getUserAgent() { return userAgent; }
    public boolean isFollowLinks() { return followLinks; }
    public boolean isUseSitemaps() { return useSitemaps; }
    public Path getOutputDir() { return outputDir; }
    public Path getSitemapDir() { return sitemapDir; }

    // ---------- fluent setters ----------
    public MirrorConfig setTarget(String target) { this.target = (target == null ? null : target.trim()); return this; }
    public MirrorConfig setMode(Mode mode) { this.mode = (mode != null ? mode : Mode.SITE); return this; }
    public MirrorConfig setMaxPages(Integer maxPages) { this.maxPages = maxPages; return this; }
    public MirrorConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public MirrorConfig setDelay(Duration delay) { this.delay = delay; return this; }
    public MirrorConfig setSitemapDelay(Duration sitemapDelay) { this.sitemapDelay = sitemapDelay; return this; }
    public MirrorConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public MirrorConfig setFollowLinks(boolean v) { this.followLinks = v; return this; }
    public MirrorConfig setUseSitemaps(boolean v) { this.useSitemaps = v; return this; }
    public MirrorConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public MirrorConfig setSitemapDir(Path sitemapDir) { this.sitemapDir = sitemapDir; return this; }

    public MirrorConfig setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(ms); return this; }
    public MirrorConfig setDelayMs(long ms) { this.delay = Duration.ofMillis(ms); return this; }
    public MirrorConfig setSitemapDelayMs(long ms) { this.sitemapDelay = Duration.ofMillis(ms); return this; }

    // ---------- validate ----------
    /** @throws ConfigurationException 잘못된 값이 하나라도 있으면 */
    public void validate() {
        if (target == null || target.isBlank()) throw new ConfigurationException("URL is required");
        URI u;
        try {
            u = URI.create(target);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid URL: " + target, e);
        }
        String scheme = (u.getScheme() == null ? "" : u.getScheme().toLowerCase(Locale.ROOT));
        if (!scheme.equals("http") && !scheme.equals("https"))
            throw new ConfigurationException("Invalid URL (http/https only): " + target);
        if (u.getHost() == null || u.getHost().isBlank())
            throw new ConfigurationException("Invalid URL (no host): " + target);

        if (maxPages != null && maxPages < 0) throw new ConfigurationException("maxPages must be >= 0");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new ConfigurationException("timeout must be > 0");
        if (delay == null || delay.isNegative()) throw new ConfigurationException("delay must be >= 0");
        if (sitemapDelay == null || sitemapDelay.isNegative())
            throw new ConfigurationException("sitemapDelay must be >= 0");
        if (userAgent == null || userAgent.isBlank()) throw new ConfigurationException("userAgent must not be blank");
        if (outputDir == null) throw new ConfigurationException("output.dir must not be null");
        if (sitemapDir == null) throw new ConfigurationException("output.sitemapDir must not be null");
    }

    // ---------- helpers ----------
    public static MirrorConfig defaults() { return new MirrorConfig(); }

    /** 정규화된 시드 URL (validate 이후 호출) */
    public String normalizedTarget() { return UrlUtils.normalize(target); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public MirrorConfig copy() {
        MirrorConfig c = new MirrorConfig();
        c.target = target;
        c.mode = mode;
        c.maxPages = maxPages;
        c.timeout = timeout;
        c.delay = delay;
        c.sitemapDelay = sitemapDelay;
        c.userAgent = userAgent;
        c.followLinks = followLinks;
        c.useSitemaps = useSitemaps;
        c.outputDir = outputDir;
        c.sitemapDir = sitemapDir;
        return c;
    }
}
