package com.sitemirror.core.util;

import com.sitemirror.core.model.ConfigurationException;
import com.sitemirror.core.model.MirrorConfig;
import com.sitemirror.core.model.Mode;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * mirror.yml을 읽어 MirrorConfig로 변환.
 *
 * 예상 YAML 키:
 * target: "https://example.com"
 * mode: SITE | SITEMAPS
 * maxPages: 200            # 생략 = 무제한
 * timeoutMs: 30000
 * delayMs: 500
 * sitemapDelayMs: 1000
 * userAgent: "SiteMirror/1.0"
 * followLinks: true
 * useSitemaps: true
 * output:
 *   dir: "offline_output"
 *   sitemapDir: "sitemap_output"
 *
 * target은 CLI 인자로 덮어쓸 수 있으므로 로드 시점에는 검증하지 않는다.
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static final String DEFAULT_FILE = "mirror.yml";

    public static MirrorConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static MirrorConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("mirror.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static MirrorConfig load(InputStream in) {
        Object root;
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML: " + e.getMessage(), e);
        }

        MirrorConfig cfg = MirrorConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        try {
            // 1) 평면 키
            setString(map, "target", cfg::setTarget);
            setEnum(map, "mode", Mode.class, cfg::setMode);
            setInt(map, "maxPages", cfg::setMaxPages);
            setLong(map, "timeoutMs", cfg::setTimeoutMs);
            setLong(map, "delayMs", cfg::setDelayMs);
            setLong(map, "sitemapDelayMs", cfg::setSitemapDelayMs);
            setString(map, "userAgent", cfg::setUserAgent);
            setBoolean(map, "followLinks", cfg::setFollowLinks);
            setBoolean(map, "useSitemaps", cfg::setUseSitemaps);

            // 2) output.dir / output.sitemapDir
            Map<String, Object> output = getMap(map, "output");
            if (output != null) {
                setPath(output, "dir", cfg::setOutputDir);
                setPath(output, "sitemapDir", cfg::setSitemapDir);
            }
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number in config: " + e.getMessage(), e);
        }
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    /** 대소문자 무시. 모르는 값이면 ConfigurationException */
    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        throw new ConfigurationException("Unknown " + key + ": " + s.toLowerCase(Locale.ROOT));
    }
}
