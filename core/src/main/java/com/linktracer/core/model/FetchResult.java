package com.linktracer.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 한 URL에 대한 fetch 결과(리다이렉트 추적 후 최종 응답 기준).
 * 네트워크 예외도 여기에 담는다: error != null 이면 실패, statusCode는 0 또는 실패 직전 받은 코드.
 */
public final class FetchResult {
    private final String requestedUrl;
    private final String finalUrl;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final String contentType;
    private final FetchMethod method;
    private final long responseTimeMs;
    private final String error;

    private FetchResult(Builder b) {
        this.requestedUrl = b.requestedUrl;
        this.finalUrl = (b.finalUrl == null ? b.requestedUrl : b.finalUrl);
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.contentType = (b.contentType == null) ? "" : b.contentType;
        this.method = (b.method == null ? FetchMethod.GET : b.method);
        this.responseTimeMs = b.responseTimeMs;
        this.error = b.error;
    }

    public String getRequestedUrl() { return requestedUrl; }
    public String getFinalUrl() { return finalUrl; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public FetchMethod getMethod() { return method; }
    public long getResponseTimeMs() { return responseTimeMs; }
    public String getError() { return error; }

    public boolean isFailed() { return error != null; }
    public boolean isRedirect() { return !finalUrl.equals(requestedUrl); }
    public boolean isHtml() { return contentType.toLowerCase(Locale.ROOT).contains("text/html"); }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    /** 예외로 끝난 fetch */
    public static FetchResult failure(String url, FetchMethod method, int lastStatus, String error, long elapsedMs) {
        return builder().requestedUrl(url).finalUrl(url).method(method)
                .statusCode(Math.max(0, lastStatus))
                .error(error == null ? "unknown error" : error)
                .responseTimeMs(elapsedMs)
                .build();
    }

    public static final class Builder {
        private String requestedUrl;
        private String finalUrl;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private String contentType;
        private FetchMethod method;
        private long responseTimeMs;
        private String error;

        public Builder requestedUrl(String url) { this.requestedUrl = url; return this; }
        public Builder finalUrl(String url) { this.finalUrl = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder method(FetchMethod method) { this.method = method; return this; }
        public Builder responseTimeMs(long ms) { this.responseTimeMs = ms; return this; }
        public Builder error(String error) { this.error = error; return this; }

        public FetchResult build() {
            Objects.requireNonNull(requestedUrl, "requestedUrl");
            return new FetchResult(this);
        }
    }
}
