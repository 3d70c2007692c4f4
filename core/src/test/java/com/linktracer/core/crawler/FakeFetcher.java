package com.linktracer.core.crawler;

import com.linktracer.core.api.IFetcher;
import com.linktracer.core.model.FetchMethod;
import com.linktracer.core.model.FetchResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** 테스트용 가짜 사이트. URL → 응답, 호출 기록/동시성 관측 포함 */
final class FakeFetcher implements IFetcher {

    static final class Page {
        final int status;
        final String contentType;
        final String body;
        String redirectTo;
        long delayMs;
        boolean timeout;
        CountDownLatch gate;     // 열릴 때까지 응답 지연

        Page(int status, String contentType, String body) {
            this.status = status;
            this.contentType = contentType;
            this.body = body;
        }
    }

    private final Map<String, Page> pages = new ConcurrentHashMap<>();
    final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger inFlight = new AtomicInteger();
    final AtomicInteger maxInFlight = new AtomicInteger();

    FakeFetcher html(String url, String body) {
        pages.put(url, new Page(200, "text/html; charset=utf-8", body));
        return this;
    }

    FakeFetcher asset(String url, int status, String contentType) {
        pages.put(url, new Page(status, contentType, ""));
        return this;
    }

    Page page(String url) { return pages.get(url); }

    /** 메서드 무관 호출 수 */
    long fetchCount(String url) {
        synchronized (calls) {
            return calls.stream().filter(c -> c.endsWith(" " + url)).count();
        }
    }

    List<String> callsFor(String url) {
        synchronized (calls) {
            List<String> out = new ArrayList<>();
            for (String c : calls) if (c.endsWith(" " + url)) out.add(c.substring(0, c.indexOf(' ')));
            return out;
        }
    }

    @Override
    public FetchResult fetch(String url, FetchMethod method) {
        calls.add(method.name() + " " + url);
        int cur = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(cur, Math::max);
        try {
            Page p = pages.get(url);
            if (p == null) {
                return FetchResult.builder().requestedUrl(url).statusCode(404).contentType("text/html").method(method).build();
            }
            try {
                if (p.gate != null) p.gate.await(5, TimeUnit.SECONDS);
                if (p.delayMs > 0) Thread.sleep(p.delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchResult.failure(url, method, 0, "interrupted", 0);
            }
            if (p.timeout) {
                return FetchResult.failure(url, method, 0, "HttpTimeoutException: request timed out", 0);
            }
            return FetchResult.builder()
                    .requestedUrl(url)
                    .finalUrl(p.redirectTo != null ? p.redirectTo : url)
                    .statusCode(p.status)
                    .contentType(p.contentType)
                    .body(method == FetchMethod.HEAD ? "" : p.body)
                    .method(method)
                    .build();
        } finally {
            inFlight.decrementAndGet();
        }
    }
}
