package com.linktracer.core.service;

import com.linktracer.core.api.CrawlEventListener;
import com.linktracer.core.model.CrawlReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** 기본 콘솔 전송: 크롤 이벤트를 로그 라인으로 흘린다. */
public class LoggingEventListener implements CrawlEventListener {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingEventListener.class);

    private final int progressEvery;

    public LoggingEventListener() {
        this(25);
    }

    /** @param progressEvery 진행률을 INFO로 찍는 간격(claim 수 기준) */
    public LoggingEventListener(int progressEvery) {
        this.progressEvery = Math.max(1, progressEvery);
    }

    @Override
    public void onProgress(long checked, long total) {
        if (checked % progressEvery == 0) {
            LOG.info("Progress: {}/{}", checked, total);
        } else {
            LOG.debug("Progress: {}/{}", checked, total);
        }
    }

    @Override
    public void onUrlChecked(String url, int status, String domain, List<String> sourcePages) {
        if (status == 0 || status >= 400) {
            LOG.info("[{}] {} (depth {})", status, url, sourcePages.size());
        } else {
            LOG.debug("[{}] {}", status, url);
        }
    }

    @Override
    public void onSummary(CrawlReport report) {
        LOG.info("Summary: total={}, internal={}, external={}, statusCodes={}",
                report.summary.total, report.summary.internal, report.summary.external, report.statusCodes.keySet());
    }

    @Override
    public void onError(String message) {
        LOG.error(message);
    }
}
