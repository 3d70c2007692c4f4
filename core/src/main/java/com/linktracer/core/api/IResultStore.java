package com.linktracer.core.api;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * 결과 저장소 KV 계약. 해시(필드 맵)와 집합 두 종류의 값을 키로 보관한다.
 * 구현은 서로 다른 키에 대한 동시 호출을 견뎌야 하며, 같은 키에 대해서는
 * 필드 단위 last-write-wins, 집합은 합집합으로 동작한다.
 * 실패는 {@link com.linktracer.core.store.StoreException}(unchecked).
 */
public interface IResultStore extends AutoCloseable {

    /** 필드 병합(덮어쓰기) */
    void putFields(String key, Map<String, String> fields);

    /** 없는 필드만 채움. 해시가 새로 생겼으면 true */
    boolean putFieldsIfAbsent(String key, Map<String, String> fields);

    /** 없으면 빈 맵 */
    Map<String, String> getFields(String key);

    boolean exists(String key);

    /** 새로 추가됐으면 true */
    boolean addToSet(String key, String member);

    /** 삽입 순서 사본. 없으면 빈 집합 */
    Set<String> members(String key);

    long cardinality(String key);

    Set<String> keys(String prefix);

    long delete(Collection<String> keys);

    /** 연결 확인. 실패 시 StoreException */
    void ping();

    default void flush() {}

    @Override default void close() {}
}
