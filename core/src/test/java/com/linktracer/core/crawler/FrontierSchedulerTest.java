package com.linktracer.core.crawler;

import com.linktracer.core.model.CrawlConfig;
import com.linktracer.core.model.CrawlStats;
import com.linktracer.core.model.FrontierItem;
import com.linktracer.core.store.InMemoryResultStore;
import com.linktracer.core.store.ResultStoreAdapter;
import com.linktracer.core.util.UrlNormalizer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrontierSchedulerTest {

    private static final String SEED = "https://ex.com";

    private static FrontierScheduler scheduler(CrawlConfig cfg, FakeFetcher site, ResultStoreAdapter store) {
        CrawlStats stats = new CrawlStats();
        FetchWorker worker = new FetchWorker(cfg, site, new JsoupLinkExtractor(), new UrlNormalizer(SEED), store, stats, null);
        return new FrontierScheduler(cfg, worker, store, stats, null);
    }

    @Test
    void cyclic_links_are_claimed_once() {
        FakeFetcher site = new FakeFetcher()
                .html(SEED, "<a href='/a'>a</a><a href='/b'>b</a>")
                .html(SEED + "/a", "<a href='/b'>b</a><a href='/'>home</a>")
                .html(SEED + "/b", "<a href='/a'>a</a>");
        ResultStoreAdapter store = new ResultStoreAdapter(new InMemoryResultStore(), "");
        CrawlConfig cfg = new CrawlConfig().setTarget(SEED).setMaxDepth(5).setConcurrency(2);

        FrontierScheduler.Outcome out = scheduler(cfg, site, store).run(FrontierItem.seed(SEED));

        assertThat(out.visited()).isEqualTo(3);
        assertThat(out.completed()).isEqualTo(3);
        assertThat(out.cancelled()).isFalse();
        assertThat(site.calls).hasSize(3);
        assertThat(store.sources(SEED + "/b")).containsExactlyInAnyOrder(SEED, SEED + "/a");
        assertThat(store.sources(SEED)).containsExactly(SEED + "/a");
    }

    @Test
    void runs_only_once() {
        FakeFetcher site = new FakeFetcher().html(SEED, "");
        ResultStoreAdapter store = new ResultStoreAdapter(new InMemoryResultStore(), "");
        FrontierScheduler s = scheduler(new CrawlConfig().setTarget(SEED), site, store);
        s.run(FrontierItem.seed(SEED));

        assertThatThrownBy(() -> s.run(FrontierItem.seed(SEED))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void worker_threads_are_named_daemons() {
        Thread t = new FrontierScheduler.NamedThreadFactory("crawl-worker").newThread(() -> {});
        assertThat(t.getName()).isEqualTo("crawl-worker-1");
        assertThat(t.isDaemon()).isTrue();
    }
}
