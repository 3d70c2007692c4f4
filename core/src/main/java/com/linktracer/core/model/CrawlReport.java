package com.linktracer.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 크롤 종료 후 집계 리포트. crawl-report.json 으로 그대로 직렬화된다.
 * 형태: {summary:{total,internal,external}, types:{...}, statusCodes:{code:{total,internal,external}}}
 * + samples / runtime / 메타 필드.
 */
@JsonPropertyOrder({"target", "generatedAt", "cancelled", "summary", "types", "statusCodes", "samples", "runtime"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CrawlReport {

    @JsonPropertyOrder({"total", "internal", "external"})
    public static final class Summary {
        public final long total;
        public final long internal;
        public final long external;

        public Summary(long total, long internal, long external) {
            this.total = total;
            this.internal = internal;
            this.external = external;
        }
    }

    @JsonPropertyOrder({"total", "internal", "external"})
    public static final class StatusBucket {
        public final long total;
        public final long internal;
        public final long external;

        public StatusBucket(long total, long internal) {
            this.total = total;
            this.internal = internal;
            this.external = Math.max(0, total - internal);
        }
    }

    /** 상태 코드별 예시 URL (내부 URL만) */
    @JsonPropertyOrder({"url", "sourceCount", "firstSource"})
    public static final class Sample {
        public final String url;
        public final long sourceCount;
        public final String firstSource;

        public Sample(String url, long sourceCount, String firstSource) {
            this.url = url;
            this.sourceCount = sourceCount;
            this.firstSource = firstSource;
        }
    }

    public final String target;
    public final Instant generatedAt;
    public final boolean cancelled;
    public final Summary summary;
    public final Map<String, Long> types;
    public final Map<String, StatusBucket> statusCodes;
    public final Map<String, List<Sample>> samples;
    public final CrawlStats.Snapshot runtime;

    public CrawlReport(String target, Instant generatedAt, boolean cancelled, Summary summary,
                       Map<String, Long> types, Map<String, StatusBucket> statusCodes,
                       Map<String, List<Sample>> samples, CrawlStats.Snapshot runtime) {
        this.target = target;
        this.generatedAt = generatedAt;
        this.cancelled = cancelled;
        this.summary = summary;
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
        this.statusCodes = Collections.unmodifiableMap(new LinkedHashMap<>(statusCodes));
        this.samples = Collections.unmodifiableMap(new LinkedHashMap<>(samples));
        this.runtime = runtime;
    }
}
