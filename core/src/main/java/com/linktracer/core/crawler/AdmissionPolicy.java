package com.linktracer.core.crawler;

import com.linktracer.core.model.CrawlConfig;
import com.linktracer.core.model.FrontierItem;
import com.linktracer.core.util.UrlExclusion;

import java.util.List;
import java.util.Objects;

/**
 * claim 직전 관문(shouldCrawl).
 * 깊이 초과, data: URL(skipDataImages 시), 제외 경로는 방문하지도 저장하지도 않는다.
 */
public final class AdmissionPolicy {

    public enum Verdict { ADMIT, TOO_DEEP, DATA_URL, EXCLUDED }

    private final int maxDepth;
    private final boolean skipDataUrls;
    private final List<String> excludePatterns;

    public AdmissionPolicy(CrawlConfig config) {
        Objects.requireNonNull(config, "config");
        this.maxDepth = config.getMaxDepth();
        this.skipDataUrls = config.isSkipDataImages();
        this.excludePatterns = config.getExcludePatterns();
    }

    public Verdict check(FrontierItem item) {
        if (item.getDepth() > maxDepth) return Verdict.TOO_DEEP;
        if (skipDataUrls && isDataUrl(item.getUrl())) return Verdict.DATA_URL;
        if (UrlExclusion.isExcluded(item.getUrl(), excludePatterns)) return Verdict.EXCLUDED;
        return Verdict.ADMIT;
    }

    public boolean shouldCrawl(FrontierItem item) {
        return check(item) == Verdict.ADMIT;
    }

    static boolean isDataUrl(String url) {
        return url != null && url.regionMatches(true, 0, "data:", 0, 5);
    }
}
