package com.linktracer.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 크롤 설정 (tracer.yml 매핑 대상). 순수 설정 보관용.
 * 실행 시작 시 {@link #copy()}로 고정 사본을 떠서 런 동안 바뀌지 않게 한다.
 */
public final class CrawlConfig {

    /** 결과 저장소 종류 */
    public enum StoreType { MEMORY, FILE }

    /** YAML의 `store:` 섹션과 매핑 */
    public static final class StoreCfg {
        private StoreType type = StoreType.MEMORY;
        private Path path = Path.of("out", "tracer-store.json");
        private String keyPrefix = "tracer:";

        public StoreType getType() { return type; }
        public StoreCfg setType(StoreType type) { this.type = (type != null ? type : StoreType.MEMORY); return this; }

        public Path getPath() { return path; }
        public StoreCfg setPath(Path path) { this.path = path; return this; }

        public String getKeyPrefix() { return keyPrefix; }
        public StoreCfg setKeyPrefix(String keyPrefix) { this.keyPrefix = (keyPrefix != null ? keyPrefix : ""); return this; }

        StoreCfg copy() {
            return new StoreCfg().setType(type).setPath(path).setKeyPrefix(keyPrefix);
        }
    }

    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (compatible; TraceBot/1.0)";

    // ---------- 기본 필드 ----------
    private String target;                 // 시드 URL (필수)
    private int maxDepth = 10;
    private int concurrency = 5;           // 동시 fetch 상한
    private Duration timeout = Duration.ofSeconds(10);
    private String userAgent = DEFAULT_USER_AGENT;
    private List<String> excludePatterns = List.of();
    private boolean skipDataImages = true;
    private boolean cleanupPriorState = false;
    private int maxRedirects = 5;
    private Path outputDir = Path.of("out");
    private StoreCfg store = new StoreCfg();

    // ---------- getters ----------
    public String getTarget() { return target; }
    public int getMaxDepth() { return maxDepth; }
    public int getConcurrency() { return concurrency; }
    public Duration getTimeout() { return timeout; }
    public String getUserAgent() { return userAgent; }
    public List<String> getExcludePatterns() { return excludePatterns; }
    public boolean isSkipDataImages() { return skipDataImages; }
    public boolean isCleanupPriorState() { return cleanupPriorState; }
    public int getMaxRedirects() { return maxRedirects; }
    public Path getOutputDir() { return outputDir; }
    public StoreCfg getStore() { return store; }

    // ---------- fluent setters ----------
    public CrawlConfig setTarget(String target) { this.target = target; return this; }
    public CrawlConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setUserAgent(String userAgent) {
        if (userAgent != null && !userAgent.isBlank()) this.userAgent = userAgent;
        return this;
    }
    public CrawlConfig setExcludePatterns(List<String> patterns) {
        List<String> out = new ArrayList<>();
        if (patterns != null) {
            for (String p : patterns) {
                if (p != null && !p.isBlank()) out.add(p.trim());
            }
        }
        this.excludePatterns = List.copyOf(out);
        return this;
    }
    public CrawlConfig setSkipDataImages(boolean v) { this.skipDataImages = v; return this; }
    public CrawlConfig setCleanupPriorState(boolean v) { this.cleanupPriorState = v; return this; }
    public CrawlConfig setMaxRedirects(int maxRedirects) { this.maxRedirects = Math.max(0, maxRedirects); return this; }
    public CrawlConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public CrawlConfig setStore(StoreCfg store) { this.store = (store != null ? store : new StoreCfg()); return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        String t = target.trim().toLowerCase(Locale.ROOT);
        if (!t.startsWith("http://") && !t.startsWith("https://"))
            throw new IllegalArgumentException("target must be an absolute http(s) URL: " + target);
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(store, "store");
        if (store.getType() == StoreType.FILE) Objects.requireNonNull(store.getPath(), "store.path");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    /** 런 동안 쓸 고정 사본 */
    public CrawlConfig copy() {
        return new CrawlConfig()
                .setTarget(target)
                .setMaxDepth(maxDepth)
                .setConcurrency(concurrency)
                .setTimeout(timeout)
                .setUserAgent(userAgent)
                .setExcludePatterns(excludePatterns)
                .setSkipDataImages(skipDataImages)
                .setCleanupPriorState(cleanupPriorState)
                .setMaxRedirects(maxRedirects)
                .setOutputDir(outputDir)
                .setStore(store.copy());
    }
}
