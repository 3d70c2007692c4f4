package com.linktracer.core.crawler;

import com.linktracer.core.model.DiscoveredLink;

import java.util.List;

/** 페이지 본문에서 태그 달린 참조를 뽑는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * html 문서에서 a/link/script/img 참조를 문서 순서대로 반환.
     * 값은 속성 원문 그대로(정규화는 호출자 몫).
     */
    List<DiscoveredLink> extract(String html, String baseUrl);
}
