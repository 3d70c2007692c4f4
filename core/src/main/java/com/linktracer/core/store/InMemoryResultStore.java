package com.linktracer.core.store;

import com.linktracer.core.api.IResultStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/** 프로세스 내 저장소. 테스트 기본값이자 JsonFileResultStore의 작업 메모리. */
public class InMemoryResultStore implements IResultStore {

    private final ConcurrentHashMap<String, ConcurrentHashMap<String, String>> hashes = new ConcurrentHashMap<>();
    // 삽입 순서 유지 + 동기화 (출처의 "첫 번째" 항목이 의미 있음)
    private final ConcurrentHashMap<String, Set<String>> sets = new ConcurrentHashMap<>();

    @Override
    public void putFields(String key, Map<String, String> fields) {
        ConcurrentHashMap<String, String> h = hashes.computeIfAbsent(key, k -> new ConcurrentHashMap<>());
        fields.forEach((f, v) -> { if (f != null && v != null) h.put(f, v); });
    }

    @Override
    public boolean putFieldsIfAbsent(String key, Map<String, String> fields) {
        AtomicBoolean created = new AtomicBoolean(false);
        hashes.compute(key, (k, old) -> {
            ConcurrentHashMap<String, String> h = old;
            if (h == null) {
                h = new ConcurrentHashMap<>();
                created.set(true);
            }
            for (var e : fields.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) h.putIfAbsent(e.getKey(), e.getValue());
            }
            return h;
        });
        return created.get();
    }

    @Override
    public Map<String, String> getFields(String key) {
        Map<String, String> h = hashes.get(key);
        return h == null ? Map.of() : new LinkedHashMap<>(h);
    }

    @Override
    public boolean exists(String key) {
        return hashes.containsKey(key) || sets.containsKey(key);
    }

    @Override
    public boolean addToSet(String key, String member) {
        if (member == null) return false;
        Set<String> s = sets.computeIfAbsent(key, k -> Collections.synchronizedSet(new LinkedHashSet<>()));
        return s.add(member);
    }

    @Override
    public Set<String> members(String key) {
        Set<String> s = sets.get(key);
        if (s == null) return Set.of();
        synchronized (s) {
            return new LinkedHashSet<>(s);
        }
    }

    @Override
    public long cardinality(String key) {
        Set<String> s = sets.get(key);
        return s == null ? 0 : s.size();
    }

    @Override
    public Set<String> keys(String prefix) {
        String p = (prefix == null ? "" : prefix);
        Set<String> out = new TreeSet<>();
        for (String k : hashes.keySet()) if (k.startsWith(p)) out.add(k);
        for (String k : sets.keySet()) if (k.startsWith(p)) out.add(k);
        return out;
    }

    @Override
    public long delete(Collection<String> keys) {
        long n = 0;
        for (String k : keys) {
            boolean removed = (hashes.remove(k) != null);
            removed |= (sets.remove(k) != null);
            if (removed) n++;
        }
        return n;
    }

    @Override
    public void ping() {
        // 항상 가용
    }

    // ---------- 스냅샷 (파일 저장소용) ----------

    /** 현재 내용 사본: hashes / sets */
    protected Snapshot snapshot() {
        Map<String, Map<String, String>> h = new LinkedHashMap<>();
        for (String k : new TreeSet<>(hashes.keySet())) {
            Map<String, String> fields = hashes.get(k);
            if (fields != null) h.put(k, new LinkedHashMap<>(fields));
        }
        Map<String, List<String>> s = new LinkedHashMap<>();
        for (String k : new TreeSet<>(sets.keySet())) {
            s.put(k, new ArrayList<>(members(k)));
        }
        return new Snapshot(h, s);
    }

    /** 스냅샷 내용을 현재 저장소에 얹는다 */
    protected void restore(Snapshot snap) {
        if (snap == null) return;
        if (snap.hashes() != null) snap.hashes().forEach(this::putFields);
        if (snap.sets() != null) {
            snap.sets().forEach((k, members) -> {
                for (String m : members) addToSet(k, m);
            });
        }
    }

    /** 직렬화 형태 */
    public record Snapshot(Map<String, Map<String, String>> hashes, Map<String, List<String>> sets) {}
}
