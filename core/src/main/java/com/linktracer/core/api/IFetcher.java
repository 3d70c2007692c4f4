package com.linktracer.core.api;

import com.linktracer.core.model.FetchMethod;
import com.linktracer.core.model.FetchResult;

/**
 * HTTP fetch 최소 계약: URL + 메서드 → 최종 응답(리다이렉트 추적 후).
 * 4xx/5xx도 정상 결과이며, 네트워크 예외는 던지지 않고 FetchResult.error 로 돌려준다.
 */
public interface IFetcher extends AutoCloseable {
    FetchResult fetch(String url, FetchMethod method);
    @Override default void close() throws Exception {}
}
