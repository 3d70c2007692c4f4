package com.linktracer.core.api;

import com.linktracer.core.model.CrawlReport;

/** 크롤러 최소 계약: 한 번 실행하고 집계 리포트를 돌려준다. stop()은 다른 스레드에서 호출. */
public interface ICrawler extends AutoCloseable {
    CrawlReport crawl();
    void stop();
    @Override default void close() throws Exception {}
}
