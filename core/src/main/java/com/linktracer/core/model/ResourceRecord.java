package com.linktracer.core.model;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * URL 하나에 대한 사실(fact) 레코드. 저장소에는 문자열 해시로 들어간다.
 * 발견 시점에 status 없는 스텁으로 생기고, 그 URL을 맡은 fetch가 한 번 갱신한다.
 */
public final class ResourceRecord {

    // 저장 필드명 (저장소 스키마)
    public static final String F_URL = "url";
    public static final String F_ORIGINAL_URL = "originalUrl";
    public static final String F_STATUS = "status";
    public static final String F_CONTENT_TYPE = "contentType";
    public static final String F_FINAL_URL = "finalUrl";
    public static final String F_IS_REDIRECT = "isRedirect";
    public static final String F_DEPTH = "depth";
    public static final String F_TYPE = "type";
    public static final String F_IS_INBOUND = "isInbound";
    public static final String F_CHECKED_AT = "checkedAt";
    public static final String F_ERROR = "error";
    public static final String F_REFERRER = "referrer";
    public static final String F_TAG = "tag";
    public static final String F_IS_DATA_IMAGE = "isDataImage";

    private final String url;
    private final String originalUrl;
    private final Integer status;        // null = 아직 fetch 안 됨(스텁)
    private final String contentType;
    private final String finalUrl;
    private final boolean redirect;
    private final int depth;
    private final AssetType assetType;
    private final boolean inbound;
    private final Instant checkedAt;
    private final String error;
    private final String referrer;
    private final TagKind tag;
    private final boolean dataImage;

    private ResourceRecord(Builder b) {
        this.url = b.url;
        this.originalUrl = b.originalUrl;
        this.status = b.status;
        this.contentType = (b.contentType == null ? "" : b.contentType);
        this.finalUrl = (b.finalUrl == null ? b.url : b.finalUrl);
        this.redirect = b.redirect;
        this.depth = Math.max(0, b.depth);
        this.assetType = (b.assetType == null ? AssetType.OTHER : b.assetType);
        this.inbound = b.inbound;
        this.checkedAt = b.checkedAt;
        this.error = b.error;
        this.referrer = (b.referrer == null ? "" : b.referrer);
        this.tag = (b.tag == null ? TagKind.NONE : b.tag);
        this.dataImage = b.dataImage;
    }

    public String getUrl() { return url; }
    public String getOriginalUrl() { return originalUrl; }
    /** 0 = 연결 실패/미확인 */
    public int getStatus() { return status == null ? 0 : status; }
    public boolean isFetched() { return status != null; }
    public String getContentType() { return contentType; }
    public String getFinalUrl() { return finalUrl; }
    public boolean isRedirect() { return redirect; }
    public int getDepth() { return depth; }
    public AssetType getAssetType() { return assetType; }
    public boolean isInbound() { return inbound; }
    public Instant getCheckedAt() { return checkedAt; }
    public String getError() { return error; }
    public String getReferrer() { return referrer; }
    public TagKind getTag() { return tag; }
    public boolean isDataImage() { return dataImage; }

    /** 저장용 평면 필드. null 값은 필드 자체를 생략한다. */
    public Map<String, String> toFields() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put(F_URL, url);
        if (originalUrl != null) m.put(F_ORIGINAL_URL, originalUrl);
        if (status != null) {
            m.put(F_STATUS, String.valueOf(status));
            m.put(F_CONTENT_TYPE, contentType);
            m.put(F_FINAL_URL, finalUrl);
            m.put(F_IS_REDIRECT, redirect ? "1" : "0");
        }
        m.put(F_DEPTH, String.valueOf(depth));
        m.put(F_TYPE, assetType.key());
        m.put(F_IS_INBOUND, inbound ? "1" : "0");
        if (checkedAt != null) m.put(F_CHECKED_AT, checkedAt.toString());
        if (error != null) m.put(F_ERROR, error);
        // 확인된 레코드는 빈 값도 쓴다: 뒤이은 stub 의 putFieldsIfAbsent 가 채우지 못하게
        if (status != null || !referrer.isEmpty()) m.put(F_REFERRER, referrer);
        if (status != null || tag != TagKind.NONE) m.put(F_TAG, tag.tagName());
        if (dataImage) m.put(F_IS_DATA_IMAGE, "1");
        return m;
    }

    /** 저장소 해시 → 레코드. 깨진 숫자/시각은 기본값으로 읽는다. */
    public static ResourceRecord fromFields(String key, Map<String, String> f) {
        Objects.requireNonNull(f, "fields");
        Builder b = builder().url(f.getOrDefault(F_URL, key));
        b.originalUrl(f.get(F_ORIGINAL_URL));
        String st = f.get(F_STATUS);
        if (st != null && !st.isBlank()) b.status(parseInt(st, 0));
        b.contentType(f.get(F_CONTENT_TYPE));
        b.finalUrl(emptyToNull(f.get(F_FINAL_URL)));
        b.redirect("1".equals(f.get(F_IS_REDIRECT)));
        b.depth(parseInt(f.get(F_DEPTH), 0));
        b.assetType(AssetType.fromKey(f.get(F_TYPE)));
        b.inbound("1".equals(f.get(F_IS_INBOUND)));
        String at = f.get(F_CHECKED_AT);
        if (at != null && !at.isBlank()) {
            try { b.checkedAt(Instant.parse(at)); } catch (DateTimeParseException ignore) { /* 미기록 취급 */ }
        }
        b.error(emptyToNull(f.get(F_ERROR)));
        b.referrer(f.get(F_REFERRER));
        b.tag(tagOf(f.get(F_TAG)));
        b.dataImage("1".equals(f.get(F_IS_DATA_IMAGE)));
        return b.build();
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException e) { return def; }
    }

    private static String emptyToNull(String s) { return (s == null || s.isEmpty()) ? null : s; }

    private static TagKind tagOf(String name) {
        if (name == null) return TagKind.NONE;
        for (TagKind t : TagKind.values()) {
            if (t != TagKind.NONE && t.tagName().equalsIgnoreCase(name)) return t;
        }
        return TagKind.NONE;
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private String originalUrl;
        private Integer status;
        private String contentType;
        private String finalUrl;
        private boolean redirect;
        private int depth;
        private AssetType assetType;
        private boolean inbound;
        private Instant checkedAt;
        private String error;
        private String referrer;
        private TagKind tag;
        private boolean dataImage;

        public Builder url(String url) { this.url = url; return this; }
        public Builder originalUrl(String v) { this.originalUrl = v; return this; }
        public Builder status(int status) { this.status = status; return this; }
        public Builder contentType(String v) { this.contentType = v; return this; }
        public Builder finalUrl(String v) { this.finalUrl = v; return this; }
        public Builder redirect(boolean v) { this.redirect = v; return this; }
        public Builder depth(int v) { this.depth = v; return this; }
        public Builder assetType(AssetType v) { this.assetType = v; return this; }
        public Builder inbound(boolean v) { this.inbound = v; return this; }
        public Builder checkedAt(Instant v) { this.checkedAt = v; return this; }
        public Builder error(String v) { this.error = v; return this; }
        public Builder referrer(String v) { this.referrer = v; return this; }
        public Builder tag(TagKind v) { this.tag = v; return this; }
        public Builder dataImage(boolean v) { this.dataImage = v; return this; }

        public ResourceRecord build() {
            Objects.requireNonNull(url, "url");
            return new ResourceRecord(this);
        }
    }
}
