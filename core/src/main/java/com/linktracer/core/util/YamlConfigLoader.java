package com.linktracer.core.util;

import com.linktracer.core.model.CrawlConfig;
import com.linktracer.core.model.CrawlConfig.StoreType;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * tracer.yml 을 읽어 CrawlConfig로 변환.
 *
 * 예상 YAML 키:
 * target: "https://example.com"
 * concurrency: 5
 * timeoutMs: 10000
 * userAgent: "Mozilla/5.0 (compatible; TraceBot/1.0)"
 * excludePatterns: ["/blog", "/admin"]     # 또는 "/blog,/admin"
 * skipDataImages: true
 * cleanupPriorState: false
 * maxRedirects: 5
 * scope:
 *   maxDepth: 10
 * output:
 *   dir: "out"
 * store:
 *   type: memory | file
 *   path: "out/tracer-store.json"
 *   keyPrefix: "tracer:"
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig loadDefault() throws IOException {
        return load(Path.of("tracer.yml"));
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("tracer.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);

            CrawlConfig cfg = CrawlConfig.defaults();
            if (!(root instanceof Map<?, ?> map)) {
                return cfg; // 비어 있으면 기본값(target은 CLI에서 채울 수 있음)
            }

            setString(map, "target", cfg::setTarget);
            setInt(map, "concurrency", cfg::setConcurrency);
            setIntAsDurationMs(map, "timeoutMs", cfg::setTimeout);
            setString(map, "userAgent", cfg::setUserAgent);
            setStringList(map, "excludePatterns", cfg::setExcludePatterns);
            setBoolean(map, "skipDataImages", cfg::setSkipDataImages);
            setBoolean(map, "cleanupPriorState", cfg::setCleanupPriorState);
            setInt(map, "maxRedirects", cfg::setMaxRedirects);
            // 평면 maxDepth 도 허용, scope.maxDepth 가 있으면 그쪽 우선
            setInt(map, "maxDepth", cfg::setMaxDepth);

            Map<String, Object> scope = getMap(map, "scope");
            if (scope != null) {
                setInt(scope, "maxDepth", cfg::setMaxDepth);
            }

            Map<String, Object> output = getMap(map, "output");
            if (output != null) {
                setPath(output, "dir", cfg::setOutputDir);
            }

            Map<String, Object> store = getMap(map, "store");
            if (store != null) {
                var s = cfg.getStore();
                setEnum(store, "type", StoreType.class, s::setType);
                setPath(store, "path", s::setPath);
                setString(store, "keyPrefix", s::setKeyPrefix);
            }
            return cfg;
        }
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

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).split(",")) {
                if (!p.isBlank()) out.add(p.trim());
            }
        }
        setter.accept(out);
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

    private static void setIntAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

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
        throw new IllegalArgumentException("Unknown " + key + ": " + s.toLowerCase(Locale.ROOT));
    }
}
