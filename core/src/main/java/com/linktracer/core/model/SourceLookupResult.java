package com.linktracer.core.model;

import java.util.List;

/** 출처 조회 결과: 레코드 요약 + 이 URL을 참조한 모든 페이지 */
public final class SourceLookupResult {
    private final String url;
    private final ResourceRecord record;   // null = 저장소에 없음
    private final List<String> sourcePages;

    private SourceLookupResult(String url, ResourceRecord record, List<String> sourcePages) {
        this.url = url;
        this.record = record;
        this.sourcePages = List.copyOf(sourcePages);
    }

    public static SourceLookupResult notFound(String url) {
        return new SourceLookupResult(url, null, List.of());
    }

    public static SourceLookupResult found(String url, ResourceRecord record, List<String> sourcePages) {
        return new SourceLookupResult(url, record, sourcePages);
    }

    public String getUrl() { return url; }
    public boolean isFound() { return record != null; }
    public ResourceRecord getRecord() { return record; }
    public List<String> getSourcePages() { return sourcePages; }
}
