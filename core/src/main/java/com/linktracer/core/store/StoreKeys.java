package com.linktracer.core.store;

import com.linktracer.core.model.AssetType;
import com.linktracer.core.util.UrlKeyCodec;

/**
 * 저장소 키 스키마 (prefix 공통):
 * url:&lt;b64&gt; 레코드, sources:&lt;b64&gt; 출처 집합, all_urls, type:&lt;t&gt;, status:&lt;code&gt;, status_codes
 */
public final class StoreKeys {
    private final String prefix;

    public StoreKeys(String prefix) { this.prefix = (prefix == null ? "" : prefix); }

    public String prefix() { return prefix; }
    public String record(String url) { return prefix + "url:" + UrlKeyCodec.encode(url); }
    public String sources(String url) { return prefix + "sources:" + UrlKeyCodec.encode(url); }
    public String allUrls() { return prefix + "all_urls"; }
    public String type(AssetType t) { return prefix + "type:" + t.key(); }
    public String status(int code) { return prefix + "status:" + code; }
    public String statusCodes() { return prefix + "status_codes"; }
}
