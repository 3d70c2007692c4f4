package com.linktracer.core.util;

/** 콘솔 출력용 URL 줄이기 */
public final class UrlDisplay {
    private UrlDisplay() {}

    /** 도메인은 살리고 경로를 잘라 maxLength 이내로 */
    public static String truncate(String url, int maxLength) {
        if (url == null) return "";
        if (url.length() <= maxLength) return url;

        UrlNormalizer.Parts p = UrlNormalizer.parse(url);
        if (p == null) return url.substring(0, Math.max(0, maxLength - 3)) + "...";

        String domain = p.scheme() + "://" + UrlNormalizer.hostOf(p.authority());
        if (domain.length() >= maxLength - 5) {
            return domain.substring(0, Math.max(0, maxLength - 5)) + "...";
        }
        String path = UrlNormalizer.pathOf(url);
        int pathMax = maxLength - domain.length() - 5;
        return domain + path.substring(0, Math.min(path.length(), pathMax)) + "...";
    }
}
