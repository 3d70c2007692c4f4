package com.linktracer.core.util;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/** 저장소 키용 URL 인코딩: UTF-8 바이트의 base64. 충돌 없이 원문 복원 가능. */
public final class UrlKeyCodec {
    private UrlKeyCodec() {}

    public static String encode(String url) {
        return Base64.getEncoder().encodeToString(url.getBytes(StandardCharsets.UTF_8));
    }

    /** @throws IllegalArgumentException base64가 아니면 */
    public static String decode(String key) {
        return new String(Base64.getDecoder().decode(key), StandardCharsets.UTF_8);
    }
}
