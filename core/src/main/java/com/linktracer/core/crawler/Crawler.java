package com.linktracer.core.crawler;

import com.linktracer.core.api.CrawlEventListener;
import com.linktracer.core.api.ICrawler;
import com.linktracer.core.api.IFetcher;
import com.linktracer.core.http.HttpFetcher;
import com.linktracer.core.model.CrawlConfig;
import com.linktracer.core.model.CrawlReport;
import com.linktracer.core.model.CrawlStats;
import com.linktracer.core.model.FrontierItem;
import com.linktracer.core.store.ResultStoreAdapter;
import com.linktracer.core.util.StructuredLog;
import com.linktracer.core.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 시드 하나에 대한 크롤 파사드.
 * - 설정은 실행 시작 시 사본으로 고정
 * - 프런티어 스케줄러 실행 후 집계는 정확히 한 번
 * - fetch/추출은 주입 가능(테스트용)
 */
public class Crawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);

    private final CrawlConfig config;
    private final IFetcher fetcher;
    private final LinkExtractor extractor;
    private final ResultStoreAdapter store;
    private final CrawlStats stats;
    private final CrawlEventListener listener;

    private volatile FrontierScheduler current;
    private volatile boolean stopRequested = false;

    public Crawler(CrawlConfig config, ResultStoreAdapter store, CrawlEventListener listener) {
        this(config, store, listener, new CrawlStats());
    }

    private Crawler(CrawlConfig config, ResultStoreAdapter store, CrawlEventListener listener, CrawlStats stats) {
        this(config, new HttpFetcher(config.copy(), stats), new JsoupLinkExtractor(), store, stats, listener);
    }

    /** DI/테스트용 */
    public Crawler(CrawlConfig config, IFetcher fetcher, LinkExtractor extractor,
                   ResultStoreAdapter store, CrawlStats stats, CrawlEventListener listener) {
        this.config = Objects.requireNonNull(config, "config").copy();
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.store = Objects.requireNonNull(store, "store");
        this.stats = (stats != null ? stats : new CrawlStats());
        this.listener = (listener != null ? listener : CrawlEventListener.NONE);
    }

    @Override
    public CrawlReport crawl() {
        UrlNormalizer normalizer = new UrlNormalizer(config.getTarget());
        String seed = normalizer.normalize(config.getTarget());

        FetchWorker worker = new FetchWorker(config, fetcher, extractor, normalizer, store, stats, listener);
        FrontierScheduler scheduler = new FrontierScheduler(config, worker, store, stats, listener);
        current = scheduler;
        if (stopRequested) scheduler.stop();

        LOG.info("Crawl start: seed={}, maxDepth={}, concurrency={}, timeoutMs={}",
                seed, config.getMaxDepth(), config.getConcurrency(), config.getTimeoutMs());
        SLOG.info("crawl-start",
                "seed", seed,
                "maxDepth", config.getMaxDepth(),
                "concurrency", config.getConcurrency(),
                "excludes", config.getExcludePatterns());

        FrontierScheduler.Outcome outcome = scheduler.run(FrontierItem.seed(seed));

        CrawlReport report = new SummaryAggregator(store)
                .aggregate(seed, outcome.visited(), outcome.cancelled(), stats.snapshot());

        CrawlStats.Snapshot rt = report.runtime;
        LOG.info("Crawl done. visited={}, cancelled={}, requests={}, fetchErrors={}, maxObservedCC={}",
                outcome.visited(), outcome.cancelled(), rt.requestsTotal, rt.fetchErrors, rt.maxObservedConcurrency);
        SLOG.info("crawl-done",
                "visited", outcome.visited(),
                "cancelled", outcome.cancelled(),
                "requests", rt.requestsTotal,
                "fetchErrors", rt.fetchErrors,
                "avgLatencyMs", rt.avgLatencyMs);

        try {
            listener.onSummary(report);
        } catch (RuntimeException e) {
            LOG.warn("Summary listener failed: {}", e.toString());
        }
        return report;
    }

    @Override
    public void stop() {
        stopRequested = true;
        FrontierScheduler s = current;
        if (s != null) s.stop();
    }

    public CrawlStats getStats() { return stats; }

    @Override
    public void close() throws Exception {
        fetcher.close();
    }
}
