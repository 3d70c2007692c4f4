package com.linktracer.core.model;

/** 참조를 발견한 HTML 요소 종류. 시드처럼 요소가 없으면 NONE. */
public enum TagKind {
    ANCHOR("a"),
    STYLESHEET_LINK("link"),
    SCRIPT("script"),
    IMG("img"),
    NONE("");

    private final String tagName;

    TagKind(String tagName) { this.tagName = tagName; }

    public String tagName() { return tagName; }
}
