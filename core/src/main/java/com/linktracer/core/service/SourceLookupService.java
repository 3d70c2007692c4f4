package com.linktracer.core.service;

import com.linktracer.core.model.ResourceRecord;
import com.linktracer.core.model.SourceLookupResult;
import com.linktracer.core.store.ResultStoreAdapter;
import com.linktracer.core.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;

/**
 * 출처 조회: URL 하나의 상태/타입/리다이렉트 정보 + 그 URL을 참조한 모든 페이지.
 * 저장소만 읽으므로 크롤 실행 여부와 무관하게 쓸 수 있다.
 */
public final class SourceLookupService {

    private static final Logger LOG = LoggerFactory.getLogger(SourceLookupService.class);

    private final ResultStoreAdapter store;

    public SourceLookupService(ResultStoreAdapter store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /** 입력 그대로 먼저 찾고, 없으면 정규화한 형태로 한 번 더 */
    public SourceLookupResult lookup(String url) {
        if (url == null || url.isBlank()) return SourceLookupResult.notFound("");
        String exact = url.trim();

        Optional<ResourceRecord> rec = store.getRecord(exact);
        String key = exact;
        if (rec.isEmpty()) {
            String normalized = normalizeQuietly(exact);
            if (!normalized.equals(exact)) {
                rec = store.getRecord(normalized);
                key = normalized;
            }
        }
        if (rec.isEmpty()) {
            LOG.debug("No record for {}", exact);
            return SourceLookupResult.notFound(exact);
        }
        return SourceLookupResult.found(key, rec.get(), new ArrayList<>(store.sources(key)));
    }

    private static String normalizeQuietly(String url) {
        if (UrlNormalizer.parse(url) == null) return url;
        return new UrlNormalizer(url).normalize(url);
    }
}
