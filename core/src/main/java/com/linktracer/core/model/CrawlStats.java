package com.linktracer.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong requestsTotal = new AtomicLong(0);     // HTTP 요청 수(리다이렉트 hop 포함)
    private final AtomicLong fetchErrors = new AtomicLong(0);       // status 0/예외로 끝난 URL 수
    private final AtomicLong urlsFetched = new AtomicLong(0);
    private final AtomicLong sumFetchMs = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addRequests(long n) { requestsTotal.addAndGet(n); }
    public void addFetchError() { fetchErrors.incrementAndGet(); }

    /** URL 하나의 fetch(에스컬레이션 포함) 벽시계 시간 */
    public void addFetch(long wallMs) {
        urlsFetched.incrementAndGet();
        sumFetchMs.addAndGet(wallMs);
    }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long fetched = urlsFetched.get();
        long avg = fetched == 0 ? 0 : sumFetchMs.get() / fetched;
        return new Snapshot(requestsTotal.get(), fetchErrors.get(), fetched, maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long requestsTotal;
        public final long fetchErrors;
        public final long urlsFetched;
        public final int maxObservedConcurrency;
        public final long avgLatencyMs;

        public Snapshot(long requestsTotal, long fetchErrors, long urlsFetched, int maxObservedConcurrency, long avgLatencyMs) {
            this.requestsTotal = requestsTotal;
            this.fetchErrors = fetchErrors;
            this.urlsFetched = urlsFetched;
            this.maxObservedConcurrency = maxObservedConcurrency;
            this.avgLatencyMs = avgLatencyMs;
        }
    }
}
