package com.linktracer.core.crawler;

import com.linktracer.core.api.CrawlEventListener;
import com.linktracer.core.model.CrawlConfig;
import com.linktracer.core.model.CrawlStats;
import com.linktracer.core.model.FrontierItem;
import com.linktracer.core.store.ResultStoreAdapter;
import com.linktracer.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 크롤 한 번의 프런티어(대기열 + 방문 집합 + in-flight 카운터).
 *
 * 대기열/방문 집합/in-flight 는 {@link #run} 을 호출한 코디네이터 스레드만 만진다.
 * 워커는 고정 풀(동시성 = concurrency)에서 돌고, 끝나면 완료 큐에 결과를 올릴 뿐이다.
 * 그래서 같은 URL을 두 워커가 동시에 claim 하는 일은 없다.
 *
 * 종료 조건: 대기열이 비고 in-flight 가 0 (취소 시에는 in-flight 0 만).
 * 인스턴스는 한 번만 실행할 수 있다.
 */
public final class FrontierScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(FrontierScheduler.class);
    private static final StructuredLog SLOG = StructuredLog.get(FrontierScheduler.class);

    private static final long POLL_MS = 100;
    private static final long SHUTDOWN_WAIT_SEC = 30;

    /** 실행 결과 요약 */
    public record Outcome(int visited, long completed, boolean cancelled) {}

    /** 워커 → 코디네이터 완료 통지 */
    private record Completion(FrontierItem item, List<FrontierItem> children) {}

    private final int concurrency;
    private final FetchWorker worker;
    private final ResultStoreAdapter store;
    private final AdmissionPolicy admission;
    private final CrawlStats stats;
    private final CrawlEventListener listener;

    // ---- 코디네이터 전용 상태 ----
    private final Deque<FrontierItem> queue = new ArrayDeque<>();
    private final Set<String> visited = new HashSet<>();
    private int inFlight = 0;
    private long completed = 0;

    private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
    private final AtomicBoolean cancel = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);

    public FrontierScheduler(CrawlConfig config, FetchWorker worker, ResultStoreAdapter store,
                             CrawlStats stats, CrawlEventListener listener) {
        Objects.requireNonNull(config, "config");
        this.concurrency = Math.max(1, config.getConcurrency());
        this.worker = Objects.requireNonNull(worker, "worker");
        this.store = Objects.requireNonNull(store, "store");
        this.admission = new AdmissionPolicy(config);
        this.stats = (stats != null ? stats : new CrawlStats());
        this.listener = (listener != null ? listener : CrawlEventListener.NONE);
    }

    /** 다른 스레드에서 호출: 새 디스패치를 멈추고 진행 중 fetch 를 인터럽트 */
    public void stop() {
        if (cancel.compareAndSet(false, true)) {
            LOG.info("Stop requested; finishing in-flight work");
        }
    }

    public boolean isCancelled() { return cancel.get(); }

    /** 시드부터 끝까지 실행(블로킹). 호출 스레드가 코디네이터가 된다. */
    public Outcome run(FrontierItem seed) {
        Objects.requireNonNull(seed, "seed");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("FrontierScheduler can only run once");
        }

        ThreadPoolExecutor exec = new ThreadPoolExecutor(
                concurrency, concurrency,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("crawl-worker"));

        queue.addLast(seed);
        boolean interrupted = false;
        boolean poolStopped = false;
        try {
            while (true) {
                if (cancel.get() && !poolStopped) {
                    poolStopped = true;
                    // 아직 시작 못 한 작업은 완료 통지를 못 올리므로 여기서 차감
                    List<Runnable> neverRan = exec.shutdownNow();
                    inFlight -= neverRan.size();
                    LOG.info("Crawl cancelled: {} queued items dropped, {} in flight", queue.size(), inFlight);
                }

                dispatch(exec);

                if (inFlight == 0 && (queue.isEmpty() || cancel.get())) break;

                Completion done = completions.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (done != null) onComplete(done);
            }
        } catch (InterruptedException ie) {
            interrupted = true;
            cancel.set(true);
            LOG.warn("Coordinator interrupted; abandoning crawl");
        } finally {
            exec.shutdownNow();
            try {
                if (!exec.awaitTermination(SHUTDOWN_WAIT_SEC, TimeUnit.SECONDS)) {
                    LOG.warn("Crawl workers did not terminate within {}s", SHUTDOWN_WAIT_SEC);
                }
            } catch (InterruptedException ie) {
                interrupted = true;
            }
            if (interrupted) Thread.currentThread().interrupt();
        }

        SLOG.info("frontier-done",
                "visited", visited.size(),
                "completed", completed,
                "cancelled", cancel.get());
        return new Outcome(visited.size(), completed, cancel.get());
    }

    // ---------- 코디네이터 내부 ----------

    private void dispatch(ExecutorService exec) {
        while (!cancel.get() && inFlight < concurrency && !queue.isEmpty()) {
            FrontierItem item = queue.pollFirst();

            AdmissionPolicy.Verdict v = admission.check(item);
            if (v != AdmissionPolicy.Verdict.ADMIT) {
                LOG.debug("Rejected {} ({})", item.getUrl(), v);
                continue;
            }

            // 이미 claim 된 URL: fetch 없이 출처만 합친다
            if (!visited.add(item.getUrl())) {
                store.addProvenance(item.getUrl(), item.getReferrer());
                continue;
            }

            inFlight++;
            stats.observeConcurrency(inFlight);
            exec.execute(() -> runTask(item));
            emitProgress();
        }
    }

    private void onComplete(Completion done) {
        inFlight--;
        completed++;
        for (FrontierItem child : done.children()) {
            if (visited.contains(child.getUrl())) {
                store.addProvenance(child.getUrl(), child.getReferrer());
            } else {
                queue.addLast(child);
            }
        }
    }

    private void emitProgress() {
        try {
            listener.onProgress(visited.size(), (long) visited.size() + queue.size());
        } catch (RuntimeException e) {
            LOG.warn("Progress listener failed: {}", e.toString());
        }
    }

    // ---------- 워커 스레드 ----------

    private void runTask(FrontierItem item) {
        List<FrontierItem> children = List.of();
        try {
            children = worker.process(item).children();
        } catch (RuntimeException e) {
            LOG.warn("Worker failed for {}: {}", item.getUrl(), e.toString());
            SLOG.error("task-failed", e, "url", item.getUrl());
        } finally {
            completions.add(new Completion(item, children));
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
