package com.linktracer.core.util;

import com.linktracer.core.model.AssetType;
import com.linktracer.core.model.TagKind;

import java.util.regex.Pattern;

/**
 * URL + 발견 요소 → 리소스 분류.
 * 우선순위: 요소 종류(a/script/img) → link 요소는 .css 일 때만 css → 확장자 추정 → other
 */
public final class ResourceClassifier {
    private ResourceClassifier() {}

    private static final Pattern IMAGE_EXT = Pattern.compile("\\.(jpg|jpeg|png|gif|svg|webp|ico)($|\\?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CSS_EXT = Pattern.compile("\\.css($|\\?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern JS_EXT = Pattern.compile("\\.js($|\\?)", Pattern.CASE_INSENSITIVE);

    public static AssetType classify(String url, TagKind tag) {
        String u = (url == null ? "" : url);
        TagKind t = (tag == null ? TagKind.NONE : tag);

        switch (t) {
            case ANCHOR: return AssetType.LINK;
            case SCRIPT: return AssetType.SCRIPT;
            case IMG: return AssetType.IMAGE;
            case STYLESHEET_LINK:
                // rel=stylesheet 라도 .css 가 아니면 확장자 추정으로 넘어간다
                if (CSS_EXT.matcher(u).find()) return AssetType.CSS;
                break;
            default:
                break;
        }

        if (IMAGE_EXT.matcher(u).find()) return AssetType.IMAGE;
        if (CSS_EXT.matcher(u).find()) return AssetType.CSS;
        if (JS_EXT.matcher(u).find()) return AssetType.SCRIPT;
        return AssetType.OTHER;
    }

    /** 요소 정보 없이 URL만으로 분류 */
    public static AssetType classify(String url) {
        return classify(url, TagKind.NONE);
    }
}
