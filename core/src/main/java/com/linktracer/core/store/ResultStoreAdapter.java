package com.linktracer.core.store;

import com.linktracer.core.api.IResultStore;
import com.linktracer.core.model.AssetType;
import com.linktracer.core.model.ResourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * 크롤 코어가 쓰는 좁은 저장 인터페이스.
 * 저장 실패는 URL 하나의 사실이 빠지는 것으로 끝나야 하므로 여기서 로그 후 삼킨다.
 * (시작 시 연결 확인만 예외: {@link #ping()})
 */
public final class ResultStoreAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(ResultStoreAdapter.class);

    private final IResultStore store;
    private final StoreKeys keys;
    private final AtomicLong failures = new AtomicLong();

    public ResultStoreAdapter(IResultStore store, String keyPrefix) {
        this.store = Objects.requireNonNull(store, "store");
        this.keys = new StoreKeys(keyPrefix);
    }

    public StoreKeys keys() { return keys; }

    /** 누적 저장 실패 수 */
    public long failureCount() { return failures.get(); }

    // ---------- 쓰기 ----------

    /** fetch 결과 기록(필드 덮어쓰기) + all_urls */
    public void putRecord(ResourceRecord record) {
        putRecordAt(record.getUrl(), record);
    }

    /** 키 URL과 레코드의 url 필드가 다를 때(잘린 data URL 등) */
    public void putRecordAt(String url, ResourceRecord record) {
        run("putRecord", url, () -> store.putFields(keys.record(url), record.toFields()));
        run("all_urls", url, () -> store.addToSet(keys.allUrls(), url));
    }

    /** 발견 스텁: 이미 있는 필드는 건드리지 않음. 새로 생겼으면 true */
    public boolean putStub(ResourceRecord stub) {
        String url = stub.getUrl();
        Boolean created = call("putStub", url,
                () -> store.putFieldsIfAbsent(keys.record(url), stub.toFields()), Boolean.FALSE);
        run("all_urls", url, () -> store.addToSet(keys.allUrls(), url));
        return Boolean.TRUE.equals(created);
    }

    /** 출처 추가(멱등) */
    public void addProvenance(String url, String referrer) {
        if (referrer == null || referrer.isEmpty()) return;
        run("addProvenance", url, () -> store.addToSet(keys.sources(url), referrer));
    }

    public void addToTypeIndex(AssetType type, String url) {
        run("typeIndex", url, () -> store.addToSet(keys.type(type), url));
    }

    public void addToStatusIndex(int status, String url) {
        run("statusIndex", url, () -> {
            store.addToSet(keys.status(status), url);
            store.addToSet(keys.statusCodes(), String.valueOf(status));
        });
    }

    // ---------- 읽기 (실패 시 빈 값) ----------

    public Set<String> members(String setKey) {
        return call("members", setKey, () -> store.members(setKey), Set.of());
    }

    public long cardinality(String setKey) {
        return call("cardinality", setKey, () -> store.cardinality(setKey), 0L);
    }

    public Optional<ResourceRecord> getRecord(String url) {
        return call("getRecord", url, () -> {
            var fields = store.getFields(keys.record(url));
            return fields.isEmpty() ? Optional.<ResourceRecord>empty() : Optional.of(ResourceRecord.fromFields(url, fields));
        }, Optional.empty());
    }

    public Set<String> sources(String url) { return members(keys.sources(url)); }
    public long sourceCount(String url) { return cardinality(keys.sources(url)); }
    public Set<String> allUrls() { return members(keys.allUrls()); }
    public long typeCount(AssetType type) { return cardinality(keys.type(type)); }
    public Set<String> urlsWithStatus(int status) { return members(keys.status(status)); }
    public long statusCount(int status) { return cardinality(keys.status(status)); }

    /** 기록된 상태 코드(숫자 아닌 값은 건너뜀) */
    public Set<Integer> statusCodes() {
        Set<Integer> out = new LinkedHashSet<>();
        for (String s : members(keys.statusCodes())) {
            try { out.add(Integer.parseInt(s)); } catch (NumberFormatException ignore) { /* 손상된 항목 */ }
        }
        return out;
    }

    // ---------- 수명 ----------

    /** 연결 확인. 실패는 호출자에게 그대로 전달(치명) */
    public void ping() {
        store.ping();
    }

    /** prefix 아래 이전 크롤 데이터 삭제. 삭제한 키 수 */
    public long clearAll() {
        Set<String> found = store.keys(keys.prefix());
        return found.isEmpty() ? 0 : store.delete(found);
    }

    public void flush() {
        run("flush", keys.prefix(), store::flush);
    }

    // ---------- 내부 ----------

    private void run(String op, String subject, Runnable r) {
        try {
            r.run();
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            LOG.warn("Store {} failed for {}: {}", op, subject, e.toString());
        }
    }

    private <T> T call(String op, String subject, Supplier<T> s, T fallback) {
        try {
            return s.get();
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            LOG.warn("Store {} failed for {}: {}", op, subject, e.toString());
            return fallback;
        }
    }
}
