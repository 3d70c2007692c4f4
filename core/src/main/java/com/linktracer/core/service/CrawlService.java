package com.linktracer.core.service;

import com.linktracer.core.api.CrawlEventListener;
import com.linktracer.core.api.ICrawler;
import com.linktracer.core.api.IResultStore;
import com.linktracer.core.crawler.Crawler;
import com.linktracer.core.model.CrawlConfig;
import com.linktracer.core.model.CrawlReport;
import com.linktracer.core.model.SourceLookupResult;
import com.linktracer.core.service.export.JsonReportExporter;
import com.linktracer.core.service.export.ReportExporter;
import com.linktracer.core.store.InMemoryResultStore;
import com.linktracer.core.store.JsonFileResultStore;
import com.linktracer.core.store.ResultStoreAdapter;
import com.linktracer.core.store.StoreException;
import com.linktracer.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * 크롤 오케스트레이터:
 *  - 저장소 열기/연결 확인(실패 시 치명)
 *  - cleanupPriorState 면 이전 데이터 삭제
 *  - crawl → 리포트 파일 → 저장소 flush
 *  - 출처 조회는 크롤 없이도 가능
 */
public final class CrawlService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlService.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlService.class);

    private final CrawlConfig config;
    private final IResultStore store;
    private final ResultStoreAdapter adapter;
    private final ReportExporter exporter;
    private final Function<CrawlEventListener, ICrawler> crawlerFactory;

    private volatile ICrawler running;
    private volatile Path lastReportPath;

    /** 기본 구현(설정의 store 섹션으로 저장소를 연다) */
    public CrawlService(CrawlConfig config) {
        this(config, openStore(config));
    }

    public CrawlService(CrawlConfig config, IResultStore store) {
        this(config, store, new JsonReportExporter(), null);
    }

    /** DI/테스트용. crawlerFactory 가 null 이면 기본 Crawler */
    public CrawlService(CrawlConfig config, IResultStore store, ReportExporter exporter,
                        Function<CrawlEventListener, ICrawler> crawlerFactory) {
        this.config = Objects.requireNonNull(config, "config").copy();
        this.store = Objects.requireNonNull(store, "store");
        this.adapter = new ResultStoreAdapter(store, this.config.getStore().getKeyPrefix());
        this.exporter = Objects.requireNonNull(exporter, "exporter");
        this.crawlerFactory = (crawlerFactory != null)
                ? crawlerFactory
                : l -> new Crawler(this.config, adapter, l);
    }

    /** 설정에 맞는 저장소. 스냅샷을 못 읽으면 치명 */
    public static IResultStore openStore(CrawlConfig config) {
        CrawlConfig.StoreCfg sc = config.getStore();
        if (sc.getType() == CrawlConfig.StoreType.FILE) {
            try {
                return JsonFileResultStore.open(sc.getPath());
            } catch (StoreException e) {
                throw new CrawlInitializationException("Cannot open result store: " + e.getMessage(), e);
            }
        }
        return new InMemoryResultStore();
    }

    /**
     * 크롤 한 번 실행(블로킹).
     * @throws CrawlInitializationException 설정 오류 또는 저장소 연결 실패
     */
    public CrawlReport run(CrawlEventListener listener) {
        final CrawlEventListener l = (listener != null ? listener : CrawlEventListener.NONE);
        try {
            config.validate();
        } catch (RuntimeException e) {
            throw new CrawlInitializationException("Invalid configuration: " + e.getMessage(), e);
        }
        prepareStore();

        ICrawler crawler = crawlerFactory.apply(l);
        running = crawler;
        CrawlReport report;
        try {
            report = crawler.crawl();
        } finally {
            running = null;
            try {
                crawler.close();
            } catch (Exception e) {
                LOG.warn("Crawler close failed: {}", e.toString());
            }
        }

        try {
            lastReportPath = exporter.export(config.getOutputDir(), report);
            LOG.info("Report written: {}", lastReportPath.toAbsolutePath());
            SLOG.info("report-written", "path", lastReportPath.toAbsolutePath().toString());
        } catch (IOException e) {
            LOG.error("Error writing report file: {}", e.toString());
            l.onError("Error writing report file: " + e.getMessage());
        }

        adapter.flush();
        if (adapter.failureCount() > 0) {
            LOG.warn("{} store operations failed during the crawl; some facts may be missing", adapter.failureCount());
        }
        return report;
    }

    /** 다른 스레드에서 호출: 실행 중인 크롤 취소 */
    public void stop() {
        ICrawler c = running;
        if (c != null) c.stop();
    }

    public SourceLookupResult lookup(String url) {
        try {
            adapter.ping();
        } catch (RuntimeException e) {
            throw new CrawlInitializationException("Result store unavailable: " + e.getMessage(), e);
        }
        return new SourceLookupService(adapter).lookup(url);
    }

    public Path getLastReportPath() { return lastReportPath; }

    public ResultStoreAdapter getStore() { return adapter; }

    @Override
    public void close() {
        try {
            store.close();
        } catch (StoreException e) {
            LOG.warn("Store close failed: {}", e.getMessage());
        }
    }

    private void prepareStore() {
        try {
            adapter.ping();
        } catch (RuntimeException e) {
            throw new CrawlInitializationException("Result store unavailable: " + e.getMessage(), e);
        }
        if (config.isCleanupPriorState()) {
            try {
                long deleted = adapter.clearAll();
                LOG.info("Cleaned up prior crawl data: {} keys deleted", deleted);
            } catch (RuntimeException e) {
                throw new CrawlInitializationException("Cannot clean up prior crawl data: " + e.getMessage(), e);
            }
        }
    }
}
