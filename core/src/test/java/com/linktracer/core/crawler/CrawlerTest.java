package com.linktracer.core.crawler;

import com.linktracer.core.api.CrawlEventListener;
import com.linktracer.core.model.CrawlConfig;
import com.linktracer.core.model.CrawlReport;
import com.linktracer.core.model.CrawlStats;
import com.linktracer.core.store.InMemoryResultStore;
import com.linktracer.core.store.ResultStoreAdapter;
import com.linktracer.core.store.StoreKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Crawler: 가짜 사이트 대상 전체 크롤 시나리오")
class CrawlerTest {

    private static final String SEED = "https://ex.com";

    private FakeFetcher site;
    private ResultStoreAdapter store;
    private CrawlStats stats;

    @BeforeEach
    void setUp() {
        site = new FakeFetcher();
        store = new ResultStoreAdapter(new InMemoryResultStore(), "crawl:");
        stats = new CrawlStats();
    }

    private static CrawlConfig cfg() {
        return new CrawlConfig().setTarget(SEED + "/").setMaxDepth(2).setConcurrency(4);
    }

    private Crawler crawler(CrawlConfig cfg, CrawlEventListener listener) {
        return crawler(cfg, new JsoupLinkExtractor(), listener);
    }

    private Crawler crawler(CrawlConfig cfg, LinkExtractor extractor, CrawlEventListener listener) {
        return new Crawler(cfg, site, extractor, store, stats, listener);
    }

    @Test
    @DisplayName("seed→/about, a.png, other.org : 내부 페이지 GET, 자산/외부는 HEAD, 외부는 펼치지 않음")
    void basic_site() {
        site.html(SEED, "<a href='/about'>About</a><img src='a.png'><a href='https://other.org/x'>x</a>");
        site.html(SEED + "/about", "<p>about us</p>");
        site.asset(SEED + "/a.png", 200, "image/png");
        site.html("https://other.org/x", "<a href='https://other.org/deeper'>d</a>");

        CrawlReport report = crawler(cfg(), null).crawl();

        assertThat(site.callsFor(SEED)).containsExactly("GET");
        assertThat(site.callsFor(SEED + "/about")).containsExactly("GET");
        assertThat(site.callsFor(SEED + "/a.png")).containsExactly("HEAD");
        assertThat(site.callsFor("https://other.org/x")).containsExactly("HEAD");
        assertThat(site.fetchCount("https://other.org/deeper")).isZero();

        assertThat(report.target).isEqualTo(SEED);
        assertThat(report.cancelled).isFalse();
        assertThat(report.summary.total).isEqualTo(4);
        assertThat(report.summary.internal).isEqualTo(3);
        assertThat(report.summary.external).isEqualTo(1);
        assertThat(report.types).containsEntry("link", 3L).containsEntry("image", 1L)
                .containsEntry("css", 0L).containsEntry("script", 0L).containsEntry("other", 0L);

        CrawlReport.StatusBucket ok = report.statusCodes.get("200");
        assertThat(ok.total).isEqualTo(4);
        assertThat(ok.internal).isEqualTo(3);
        assertThat(ok.external).isEqualTo(1);

        assertThat(report.samples.get("200")).extracting(s -> s.url)
                .containsExactlyInAnyOrder(SEED, SEED + "/about", SEED + "/a.png");
        assertThat(store.getRecord(SEED + "/about").orElseThrow().getDepth()).isEqualTo(1);
        assertThat(store.sources(SEED + "/about")).containsExactly(SEED);
    }

    @Test
    @DisplayName("두 페이지가 공유하는 CSS 는 한 번만 fetch, 출처는 2개")
    void shared_asset_fetched_once() {
        final String css = SEED + "/shared.css";
        site.html(SEED, "<a href='/a'>a</a><a href='/b'>b</a>");
        site.html(SEED + "/a", "<link rel='stylesheet' href='/shared.css'><a href='/'>home</a>");
        site.html(SEED + "/b", "<link rel='stylesheet' href='/shared.css'><a href='/a'>a</a>");
        site.asset(css, 200, "text/css");

        // shared.css 응답은 /b 가 그것을 발견(출처 기록)할 때까지 붙잡아 둔다
        CountDownLatch discoveredByB = new CountDownLatch(1);
        site.page(css).gate = discoveredByB;
        String cssSources = new StoreKeys("crawl:").sources(css);
        store = new ResultStoreAdapter(new InMemoryResultStore() {
            @Override
            public boolean addToSet(String key, String member) {
                boolean added = super.addToSet(key, member);
                if (key.equals(cssSources) && member.equals(SEED + "/b")) discoveredByB.countDown();
                return added;
            }
        }, "crawl:");
        List<Long> sourcesWhenChecked = new CopyOnWriteArrayList<>();
        CrawlEventListener listener = new CrawlEventListener() {
            @Override public void onUrlChecked(String url, int status, String domain, List<String> sourcePages) {
                if (url.equals(css)) sourcesWhenChecked.add(store.sourceCount(css));
            }
        };

        CrawlReport report = crawler(cfg(), listener).crawl();

        assertThat(discoveredByB.getCount()).isZero();
        assertThat(sourcesWhenChecked).containsExactly(2L);
        assertThat(site.fetchCount(css)).isEqualTo(1);
        assertThat(site.fetchCount(SEED)).isEqualTo(1);
        assertThat(site.fetchCount(SEED + "/a")).isEqualTo(1);
        assertThat(store.sources(css)).containsExactlyInAnyOrder(SEED + "/a", SEED + "/b");
        assertThat(store.sourceCount(SEED + "/a")).isEqualTo(2);
        assertThat(report.summary.total).isEqualTo(4);
        assertThat(report.types).containsEntry("css", 1L);
    }

    @Test
    @DisplayName("timeout 난 URL 은 status 0 으로 남고 크롤은 끝까지 진행")
    void timeout_does_not_abort() {
        site.html(SEED, "<a href='/slow'>s</a><a href='/fine'>f</a>");
        site.html(SEED + "/slow", "");
        site.page(SEED + "/slow").timeout = true;
        site.html(SEED + "/fine", "<p>ok</p>");

        CrawlReport report = crawler(cfg(), null).crawl();

        assertThat(report.summary.total).isEqualTo(3);
        assertThat(report.statusCodes.get("0").total).isEqualTo(1);
        assertThat(report.statusCodes.get("0").internal).isEqualTo(1);
        assertThat(report.samples).doesNotContainKey("0");
        assertThat(store.getRecord(SEED + "/slow").orElseThrow().getError()).contains("timed out");
        assertThat(report.runtime.fetchErrors).isEqualTo(1);
    }

    @Test
    @DisplayName("maxDepth 의 페이지는 fetch 만 하고 그 링크는 따라가지 않는다")
    void stops_at_max_depth() {
        site.html(SEED, "<a href='/d1'>1</a>");
        site.html(SEED + "/d1", "<a href='/d2'>2</a>");
        site.html(SEED + "/d2", "<a href='/d3'>3</a>");

        CrawlReport report = crawler(cfg(), null).crawl();

        assertThat(site.fetchCount(SEED + "/d2")).isEqualTo(1);
        assertThat(site.fetchCount(SEED + "/d3")).isZero();
        assertThat(store.allUrls()).doesNotContain(SEED + "/d3");
        assertThat(report.summary.total).isEqualTo(3);
    }

    @Test
    @DisplayName("제외 경로는 요청도 저장도 하지 않는다")
    void excluded_paths_never_touch_store() {
        site.html(SEED, "<a href='/admin/panel'>adm</a><a href='/ok'>ok</a>");
        site.html(SEED + "/admin/panel", "");
        site.html(SEED + "/ok", "");

        CrawlReport report = crawler(cfg().setExcludePatterns(List.of("/admin")), null).crawl();

        assertThat(site.fetchCount(SEED + "/admin/panel")).isZero();
        assertThat(store.getRecord(SEED + "/admin/panel")).isEmpty();
        assertThat(store.allUrls()).containsExactlyInAnyOrder(SEED, SEED + "/ok");
        assertThat(report.summary.total).isEqualTo(2);
    }

    @Test
    @DisplayName("동시 fetch 수는 concurrency 를 넘지 않는다")
    void respects_concurrency_cap() {
        StringBuilder html = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            String u = SEED + "/img" + i + ".png";
            html.append("<img src='").append(u).append("'>");
            site.asset(u, 200, "image/png");
            site.page(u).delayMs = 30;
        }
        site.html(SEED, html.toString());

        CrawlReport report = crawler(cfg().setConcurrency(3), null).crawl();

        assertThat(report.summary.total).isEqualTo(21);
        assertThat(site.maxInFlight.get()).isLessThanOrEqualTo(3);
        assertThat(report.runtime.maxObservedConcurrency).isBetween(1, 3);
        for (int i = 0; i < 20; i++) {
            assertThat(site.fetchCount(SEED + "/img" + i + ".png")).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("추출기 예외가 나도 다른 가지는 계속 탐색")
    void continues_when_extractor_throws() {
        site.html(SEED, "<a href='/ok'>ok</a><a href='/bad'>bad</a>");
        site.html(SEED + "/ok", "<a href='/deep'>deep</a>");
        site.html(SEED + "/bad", "<a href='/hidden'>h</a>");
        site.html(SEED + "/deep", "");
        JsoupLinkExtractor real = new JsoupLinkExtractor();
        LinkExtractor flaky = (html, base) -> {
            if (base.endsWith("/bad")) throw new RuntimeException("boom: " + base);
            return real.extract(html, base);
        };

        CrawlReport report = crawler(cfg(), flaky, null).crawl();

        assertThat(store.allUrls()).contains(SEED + "/deep").doesNotContain(SEED + "/hidden");
        assertThat(store.getRecord(SEED + "/bad").orElseThrow().getStatus()).isEqualTo(200);
        assertThat(report.summary.total).isEqualTo(4);
    }

    @Test
    @DisplayName("진행/URL/요약 이벤트가 전달된다")
    void emits_events() {
        site.html(SEED, "<a href='/x'>x</a>");
        site.html(SEED + "/x", "");
        List<String> events = new CopyOnWriteArrayList<>();
        CrawlEventListener listener = new CrawlEventListener() {
            @Override public void onProgress(long checked, long total) { events.add("progress " + checked + "/" + total); }
            @Override public void onUrlChecked(String url, int status, String domain, List<String> sourcePages) {
                events.add("checked " + url + " " + domain + " " + sourcePages);
            }
            @Override public void onSummary(CrawlReport report) { events.add("summary " + report.summary.total); }
        };

        crawler(cfg(), listener).crawl();

        assertThat(events).contains(
                "progress 1/1",
                "progress 2/2",
                "checked https://ex.com ex.com []",
                "checked https://ex.com/x ex.com [https://ex.com]");
        assertThat(events.get(events.size() - 1)).isEqualTo("summary 2");
        assertThat(events.stream().filter(e -> e.startsWith("summary"))).hasSize(1);
    }

    @Test
    @DisplayName("시작 전 stop 이면 아무것도 요청하지 않고 취소 리포트")
    void stop_before_crawl() {
        site.html(SEED, "<a href='/x'>x</a>");
        Crawler c = crawler(cfg(), null);
        c.stop();

        CrawlReport report = c.crawl();

        assertThat(report.cancelled).isTrue();
        assertThat(report.summary.total).isZero();
        assertThat(site.calls).isEmpty();
    }

    @Test
    @DisplayName("실행 중 stop → 새 디스패치 중단, 부분 리포트")
    void stop_during_crawl() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        StringBuilder html = new StringBuilder();
        for (int i = 0; i < 10; i++) {
            String u = SEED + "/p" + i;
            html.append("<a href='").append(u).append("'>p</a>");
            site.html(u, "");
            site.page(u).gate = gate;
        }
        site.html(SEED, html.toString());

        Crawler c = crawler(cfg().setConcurrency(2), null);
        CompletableFuture<CrawlReport> running = CompletableFuture.supplyAsync(c::crawl);

        long deadline = System.currentTimeMillis() + 5000;
        while (site.calls.size() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        c.stop();
        gate.countDown();

        CrawlReport report = running.get(10, TimeUnit.SECONDS);
        assertThat(report.cancelled).isTrue();
        assertThat(report.summary.total).isLessThan(11);
        assertThat(site.calls.size()).isLessThan(11);
    }

    @Test
    void rejects_invalid_config() {
        CrawlConfig bad = new CrawlConfig().setTarget("ftp://ex.com");
        assertThatThrownBy(() -> crawler(bad, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
