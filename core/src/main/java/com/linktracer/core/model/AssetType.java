package com.linktracer.core.model;

import java.util.Locale;

/** 리소스 분류. 저장소 인덱스 키(type:&lt;key&gt;)에 소문자 키가 그대로 쓰인다. */
public enum AssetType {
    LINK, CSS, SCRIPT, IMAGE, OTHER;

    public String key() { return name().toLowerCase(Locale.ROOT); }

    /** 저장된 키 → enum. 모르는 값은 OTHER */
    public static AssetType fromKey(String key) {
        if (key == null || key.isBlank()) return OTHER;
        for (AssetType t : values()) {
            if (t.key().equalsIgnoreCase(key.trim())) return t;
        }
        return OTHER;
    }
}
