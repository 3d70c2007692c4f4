package com.linktracer.core.crawler;

import com.linktracer.core.model.AssetType;
import com.linktracer.core.model.CrawlReport;
import com.linktracer.core.model.CrawlStats;
import com.linktracer.core.model.ResourceRecord;
import com.linktracer.core.store.ResultStoreAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * 스케줄러 종료 후 저장소 최종 상태를 리포트로 집계. 런당 한 번 호출된다.
 * 저장소 읽기 실패는 어댑터가 빈 값으로 돌려주므로 해당 수치만 빠진다.
 */
public final class SummaryAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(SummaryAggregator.class);

    public static final int SAMPLES_PER_STATUS = 5;

    private final ResultStoreAdapter store;

    public SummaryAggregator(ResultStoreAdapter store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @param visitedCount 이번 런에서 claim 된 URL 수(total)
     */
    public CrawlReport aggregate(String target, long visitedCount, boolean cancelled, CrawlStats.Snapshot runtime) {
        // URL별 내부 여부 (레코드가 없으면 외부로 센다)
        Map<String, Boolean> inboundByUrl = new LinkedHashMap<>();
        long internal = 0;
        for (String url : store.allUrls()) {
            boolean in = store.getRecord(url).map(ResourceRecord::isInbound).orElse(false);
            inboundByUrl.put(url, in);
            if (in) internal++;
        }
        long external = inboundByUrl.size() - internal;

        Map<String, Long> types = new LinkedHashMap<>();
        for (AssetType t : AssetType.values()) {
            types.put(t.key(), store.typeCount(t));
        }

        Map<String, CrawlReport.StatusBucket> statusCodes = new LinkedHashMap<>();
        Map<String, List<CrawlReport.Sample>> samples = new LinkedHashMap<>();
        for (int code : new TreeSet<>(store.statusCodes())) {
            Set<String> urls = store.urlsWithStatus(code);
            List<String> internalUrls = new ArrayList<>();
            for (String u : urls) {
                Boolean in = inboundByUrl.get(u);
                if (in == null) in = store.getRecord(u).map(ResourceRecord::isInbound).orElse(false);
                if (in) internalUrls.add(u);
            }
            String key = String.valueOf(code);
            statusCodes.put(key, new CrawlReport.StatusBucket(urls.size(), internalUrls.size()));

            // 0(연결 실패)은 예시에서 뺀다
            if (code != 0 && !internalUrls.isEmpty()) {
                samples.put(key, samplesOf(internalUrls));
            }
        }

        LOG.debug("Aggregated {} urls ({} internal, {} external) across {} status codes",
                inboundByUrl.size(), internal, external, statusCodes.size());

        return new CrawlReport(
                target,
                Instant.now(),
                cancelled,
                new CrawlReport.Summary(visitedCount, internal, external),
                types,
                statusCodes,
                samples,
                runtime);
    }

    private List<CrawlReport.Sample> samplesOf(List<String> internalUrls) {
        List<CrawlReport.Sample> out = new ArrayList<>();
        for (String url : internalUrls.subList(0, Math.min(SAMPLES_PER_STATUS, internalUrls.size()))) {
            Set<String> sources = store.sources(url);
            Optional<String> first = sources.stream().findFirst();
            out.add(new CrawlReport.Sample(url, sources.size(), first.orElse(null)));
        }
        return out;
    }
}
