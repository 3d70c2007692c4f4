package com.linktracer.core.crawler;

import com.linktracer.core.api.CrawlEventListener;
import com.linktracer.core.api.IFetcher;
import com.linktracer.core.model.AssetType;
import com.linktracer.core.model.CrawlConfig;
import com.linktracer.core.model.CrawlStats;
import com.linktracer.core.model.DiscoveredLink;
import com.linktracer.core.model.FetchMethod;
import com.linktracer.core.model.FetchResult;
import com.linktracer.core.model.FrontierItem;
import com.linktracer.core.model.ResourceRecord;
import com.linktracer.core.store.ResultStoreAdapter;
import com.linktracer.core.util.ResourceClassifier;
import com.linktracer.core.util.StructuredLog;
import com.linktracer.core.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * URL 하나를 처리: fetch 전략 결정 → 요청 → 레코드 기록 → (HTML이면) 자식 추출.
 *
 * 전략:
 *  - 시드/a 태그로 발견된 내부 URL은 GET (본문 필요)
 *  - 그 외는 HEAD 존재 확인. 405/501 이면 GET 한 번 재시도
 *  - HEAD 응답이 text/html 이고 내부 + 깊이 여유가 있으면 GET 으로 승격
 *
 * 자식 항목은 이 URL의 레코드를 저장한 뒤에 돌려준다.
 * 이 클래스는 여러 워커 스레드가 동시에 호출한다(상태 없음).
 */
public final class FetchWorker {

    private static final Logger LOG = LoggerFactory.getLogger(FetchWorker.class);
    private static final StructuredLog SLOG = StructuredLog.get(FetchWorker.class);

    static final int DATA_URL_KEEP = 100;
    static final String TRUNCATED_SUFFIX = "... (truncated)";

    /** 처리 결과: 저장한 레코드 + 큐에 넣을 자식들 */
    public record WorkResult(ResourceRecord record, List<FrontierItem> children) {
        public WorkResult {
            children = List.copyOf(children);
        }
    }

    private final CrawlConfig config;
    private final IFetcher fetcher;
    private final LinkExtractor extractor;
    private final UrlNormalizer normalizer;
    private final ResultStoreAdapter store;
    private final AdmissionPolicy admission;
    private final CrawlStats stats;
    private final CrawlEventListener listener;

    public FetchWorker(CrawlConfig config, IFetcher fetcher, LinkExtractor extractor,
                       UrlNormalizer normalizer, ResultStoreAdapter store,
                       CrawlStats stats, CrawlEventListener listener) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.store = Objects.requireNonNull(store, "store");
        this.admission = new AdmissionPolicy(config);
        this.stats = (stats != null ? stats : new CrawlStats());
        this.listener = (listener != null ? listener : CrawlEventListener.NONE);
    }

    /** 예외를 밖으로 내보내지 않는다: 예상 못 한 실패도 그 URL의 error 레코드로 끝난다. */
    public WorkResult process(FrontierItem item) {
        Objects.requireNonNull(item, "item");
        try {
            if (config.isSkipDataImages() && JsoupLinkExtractor.isDataImage(item.getUrl())) {
                return new WorkResult(recordDataImage(item), List.of());
            }
            return fetchAndExtract(item);
        } catch (RuntimeException e) {
            LOG.warn("Processing failed for {}: {}", item.getUrl(), e.toString());
            SLOG.error("url-failed", e, "url", item.getUrl());
            ResourceRecord failed = baseRecord(item, typeHint(item, false), normalizer.isInbound(item.getUrl()))
                    .status(0)
                    .error(e.getClass().getSimpleName() + ": " + e.getMessage())
                    .build();
            persist(failed, item);
            return new WorkResult(failed, List.of());
        }
    }

    private WorkResult fetchAndExtract(FrontierItem item) {
        final String url = item.getUrl();
        final boolean inbound = normalizer.isInbound(url);
        final boolean expandable = inbound && item.getDepth() < config.getMaxDepth();
        final boolean fullBody = inbound && (item.isSeed() || item.getAssetType() == AssetType.LINK);

        long t0 = System.nanoTime();
        FetchResult res = fetcher.fetch(url, fullBody ? FetchMethod.GET : FetchMethod.HEAD);

        if (res.getMethod() == FetchMethod.HEAD && !res.isFailed()) {
            int sc = res.getStatusCode();
            if (sc == 405 || sc == 501) {
                LOG.debug("HEAD not supported by {} ({}), retrying with GET", url, sc);
                res = fetcher.fetch(url, FetchMethod.GET);
            } else if (res.isHtml() && expandable) {
                // 링크 추출에 본문이 필요
                FetchResult full = fetcher.fetch(url, FetchMethod.GET);
                if (!full.isFailed()) res = full;
            }
        }
        stats.addFetch(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));

        if (res.isFailed()) {
            stats.addFetchError();
            LOG.warn("Fetch failed: {} (status={}, error={})", url, res.getStatusCode(), res.getError());
        }

        ResourceRecord record = baseRecord(item, typeHint(item, res.isHtml()), inbound)
                .status(res.getStatusCode())
                .contentType(res.getContentType())
                .finalUrl(res.getFinalUrl())
                .redirect(res.isRedirect())
                .error(res.getError())
                .build();
        persist(record, item);

        SLOG.debug("url-checked",
                "url", url,
                "status", res.getStatusCode(),
                "method", res.getMethod().name(),
                "depth", item.getDepth());

        List<FrontierItem> children = List.of();
        if (!res.isFailed() && res.isHtml() && expandable && !res.getBody().isEmpty()) {
            try {
                children = extractChildren(item, res);
            } catch (RuntimeException e) {
                // fetch 결과는 이미 기록됨. 하위 탐색만 건너뛴다
                LOG.warn("Link extraction failed for {}: {}", url, e.toString());
                SLOG.error("extract-failed", e, "url", url);
            }
        }
        return new WorkResult(record, children);
    }

    private List<FrontierItem> extractChildren(FrontierItem item, FetchResult res) {
        final String pageUrl = item.getUrl();
        List<DiscoveredLink> links = extractor.extract(res.getBody(), res.getFinalUrl());
        List<FrontierItem> children = new ArrayList<>();
        Set<String> seenOnPage = new HashSet<>();

        for (DiscoveredLink link : links) {
            String childUrl = normalizer.normalize(link.getReference(), res.getFinalUrl());
            if (childUrl.isEmpty() || !seenOnPage.add(childUrl)) continue;

            boolean childInbound = normalizer.isInbound(childUrl);
            // 외부 링크는 maxDepth 로 고정: 존재 확인만 하고 펼치지 않는다
            int childDepth = childInbound ? item.getDepth() + 1 : config.getMaxDepth();
            AssetType type = ResourceClassifier.classify(childUrl, link.getTag());
            FrontierItem child = item.child(childUrl, childDepth, type, link.getTag());

            if (!admission.shouldCrawl(child)) {
                LOG.debug("Skipping {} found on {} ({})", childUrl, pageUrl, admission.check(child));
                continue;
            }

            ResourceRecord stub = ResourceRecord.builder()
                    .url(childUrl)
                    .depth(childDepth)
                    .assetType(type)
                    .inbound(childInbound)
                    .referrer(pageUrl)
                    .tag(link.getTag())
                    .build();
            store.putStub(stub);
            store.addProvenance(childUrl, pageUrl);
            children.add(child);
        }
        LOG.debug("Extracted {} references from {} ({} queued)", links.size(), pageUrl, children.size());
        return children;
    }

    /** 인라인 data:image 는 요청 없이 200 으로 기록 */
    private ResourceRecord recordDataImage(FrontierItem item) {
        String url = item.getUrl();
        String shown = url.length() > DATA_URL_KEEP ? url.substring(0, DATA_URL_KEEP) + TRUNCATED_SUFFIX : url;
        ResourceRecord record = ResourceRecord.builder()
                .url(shown)
                .originalUrl(url)
                .status(200)
                .contentType("image/embedded")
                .finalUrl(url)
                .depth(item.getDepth())
                .assetType(AssetType.IMAGE)
                .inbound(true)
                .checkedAt(Instant.now())
                .referrer(item.getReferrer())
                .tag(item.getTag())
                .dataImage(true)
                .build();
        // 키는 원본 URL 기준
        store.putRecordAt(url, record);
        store.addToTypeIndex(AssetType.IMAGE, url);
        store.addToStatusIndex(200, url);
        store.addProvenance(url, item.getReferrer());
        emitChecked(shown, 200, "", item);
        return record;
    }

    private void persist(ResourceRecord record, FrontierItem item) {
        String url = item.getUrl();
        store.putRecord(record);
        store.addToTypeIndex(record.getAssetType(), url);
        store.addToStatusIndex(record.getStatus(), url);
        store.addProvenance(url, item.getReferrer());
        emitChecked(url, record.getStatus(), UrlNormalizer.hostOfUrl(url), item);
    }

    private void emitChecked(String url, int status, String domain, FrontierItem item) {
        try {
            listener.onUrlChecked(url, status, domain, item.getSourcePages());
        } catch (RuntimeException e) {
            LOG.warn("Event listener failed for {}: {}", url, e.toString());
        }
    }

    /** 발견 시 분류가 우선. 시드처럼 분류가 없으면 응답으로 판단 */
    private static AssetType typeHint(FrontierItem item, boolean isHtml) {
        if (item.getAssetType() != null) return item.getAssetType();
        return isHtml ? AssetType.LINK : ResourceClassifier.classify(item.getUrl(), item.getTag());
    }

    private static ResourceRecord.Builder baseRecord(FrontierItem item, AssetType type, boolean inbound) {
        return ResourceRecord.builder()
                .url(item.getUrl())
                .depth(item.getDepth())
                .assetType(type)
                .inbound(inbound)
                .checkedAt(Instant.now())
                .referrer(item.getReferrer())
                .tag(item.getTag());
    }
}
