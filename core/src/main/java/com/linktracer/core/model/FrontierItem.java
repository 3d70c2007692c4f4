package com.linktracer.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 디스패치 대기 중인 작업 단위. 스케줄러가 한 번 꺼내 워커에 넘기면 끝.
 * sourcePages = 시드부터 이 발견까지의 참조 경로.
 */
public final class FrontierItem {
    private final String url;
    private final String referrer;      // 시드는 ""
    private final int depth;
    private final List<String> sourcePages;
    private final AssetType assetType;  // 발견 시점 분류(시드는 null)
    private final TagKind tag;

    public FrontierItem(String url, String referrer, int depth, List<String> sourcePages,
                        AssetType assetType, TagKind tag) {
        this.url = Objects.requireNonNull(url, "url");
        this.referrer = (referrer == null ? "" : referrer);
        this.depth = Math.max(0, depth);
        this.sourcePages = (sourcePages == null ? List.of() : List.copyOf(sourcePages));
        this.assetType = assetType;
        this.tag = (tag == null ? TagKind.NONE : tag);
    }

    /** 시드 항목: referrer 없음, depth 0 */
    public static FrontierItem seed(String url) {
        return new FrontierItem(url, "", 0, List.of(), null, TagKind.NONE);
    }

    /** 이 페이지에서 발견한 자식 항목 (경로에 현재 URL 추가) */
    public FrontierItem child(String childUrl, int childDepth, AssetType type, TagKind childTag) {
        List<String> chain = new ArrayList<>(sourcePages.size() + 1);
        chain.addAll(sourcePages);
        chain.add(url);
        return new FrontierItem(childUrl, url, childDepth, chain, type, childTag);
    }

    public String getUrl() { return url; }
    public String getReferrer() { return referrer; }
    public int getDepth() { return depth; }
    public List<String> getSourcePages() { return sourcePages; }
    public AssetType getAssetType() { return assetType; }
    public TagKind getTag() { return tag; }
    public boolean isSeed() { return referrer.isEmpty(); }

    @Override public String toString() {
        return "FrontierItem{" + url + ", depth=" + depth + ", referrer=" + referrer + "}";
    }
}
