package com.sitemirror.core.crawler;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * URL → 로컬 상대 경로 결정 (결정적, 충돌 안전).
 * 같은 슬러그를 다른 URL이 이미 쓰고 있으면 URL SHA-1 앞 8자리를 붙인다.
 */
public final class LocalPathAllocator {

    static final int MAX_SLUG = 120;

    private final String dir;
    private final String ext;
    private final Function<URI, String> namer;

    private final Map<String, String> ownerBySlug = new HashMap<>();  // slug → url
    private final Map<String, String> pathByUrl = new HashMap<>();    // url → path

    private LocalPathAllocator(String dir, String ext, Function<URI, String> namer) {
        this.dir = Objects.requireNonNull(dir, "dir");
        this.ext = Objects.requireNonNull(ext, "ext");
        this.namer = Objects.requireNonNull(namer, "namer");
    }

    /** pages/&lt;전체 경로 슬러그&gt;.html */
    public static LocalPathAllocator forPages() {
        return new LocalPathAllocator("pages", ".html", LocalPathAllocator::pathName);
    }

    /** sitemaps/&lt;마지막 경로 세그먼트&gt;.xml */
    public static LocalPathAllocator forSitemaps() {
        return new LocalPathAllocator("sitemaps", ".xml", LocalPathAllocator::lastSegmentName);
    }

    public synchronized String allocate(String url) {
        String existing = pathByUrl.get(url);
        if (existing != null) return existing;

        String base = sanitize(namer.apply(safeUri(url)));
        String slug = base;
        String owner = ownerBySlug.get(slug);
        if (owner != null && !owner.equals(url)) {
            slug = base + "-" + sha1Prefix(url);
        }
        ownerBySlug.put(slug, url);
        String path = dir + "/" + slug + ext;
        pathByUrl.put(url, path);
        return path;
    }

    // ---------- naming ----------

    static String pathName(URI u) {
        String p = (u == null || u.getRawPath() == null) ? "" : u.getRawPath();
        p = decode(p).replaceAll("^/+|/+$", "");
        if (p.isEmpty()) return "index";
        p = p.replaceAll("(?i)\\.html?$", "");
        return p.replace('/', '_');
    }

    static String lastSegmentName(URI u) {
        String p = (u == null || u.getRawPath() == null) ? "" : u.getRawPath();
        p = decode(p).replaceAll("/+$", "");
        String last = p.substring(p.lastIndexOf('/') + 1);
        if (last.isEmpty()) return "sitemap";
        return last.replaceAll("(?i)\\.xml$", "");
    }

    /** [A-Za-z0-9._-] 외 문자는 '_' 로, 최대 120자 */
    static String sanitize(String s) {
        String out = s.replaceAll("[^A-Za-z0-9._-]", "_");
        if (out.isEmpty()) out = "index";
        if (out.length() > MAX_SLUG) out = out.substring(0, MAX_SLUG);
        return out;
    }

    static String sha1Prefix(String url) {
        try {
            byte[] d = MessageDigest.getInstance("SHA-1").digest(url.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(d).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return s;
        }
    }

    private static URI safeUri(String url) {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
