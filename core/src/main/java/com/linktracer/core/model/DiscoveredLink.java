package com.linktracer.core.model;

import java.util.Objects;

/** 문서에서 추출한 원시 참조(정규화 전) + 요소 종류 */
public final class DiscoveredLink {
    private final String reference;
    private final TagKind tag;

    public DiscoveredLink(String reference, TagKind tag) {
        this.reference = Objects.requireNonNull(reference, "reference");
        this.tag = (tag == null ? TagKind.NONE : tag);
    }

    public String getReference() { return reference; }
    public TagKind getTag() { return tag; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiscoveredLink)) return false;
        DiscoveredLink that = (DiscoveredLink) o;
        return reference.equals(that.reference) && tag == that.tag;
    }

    @Override public int hashCode() { return Objects.hash(reference, tag); }

    @Override public String toString() { return tag.tagName() + ":" + reference; }
}
