package com.linktracer.core.api;

import com.linktracer.core.model.CrawlReport;

import java.util.List;

/**
 * 크롤 도메인 이벤트 수신자. 전송(콘솔/소켓)은 구현 쪽 몫.
 * 콜백은 워커/코디네이터 스레드에서 호출되므로 빨리 끝나야 한다.
 */
public interface CrawlEventListener {

    /**
     * @param checked 지금까지 claim(디스패치)된 URL 수
     * @param total   checked + 대기열 길이
     */
    default void onProgress(long checked, long total) {}

    /** URL 하나 처리 완료 */
    default void onUrlChecked(String url, int status, String domain, List<String> sourcePages) {}

    /** 집계 완료(런당 한 번) */
    default void onSummary(CrawlReport report) {}

    default void onError(String message) {}

    CrawlEventListener NONE = new CrawlEventListener() {};
}
