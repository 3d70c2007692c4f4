package com.linktracer.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 발견한 참조 → 비교 가능한 절대 URL.
 * 네트워크 접근 없음, 같은 입력이면 항상 같은 출력(방문 집합 dedupe의 전제).
 *
 * 규칙:
 * - "//host/.." → 시드 scheme 부착
 * - "/path" → 시드 scheme + authority 부착
 * - scheme 없는 상대경로 → base URL의 디렉터리 기준으로 결합, ./ ../ 정리
 * - scheme/host 소문자, 기본 포트 제거
 * - fragment 제거, utm_* 추적 파라미터 제거, 경로 끝 슬래시 제거
 * - 실패 시 원본 문자열 그대로(fail-open)
 */
public final class UrlNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(UrlNormalizer.class);

    public static final Set<String> TRACKING_PARAMS =
            Set.of("utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content");

    private static final Pattern HAS_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");
    private static final Pattern HIERARCHICAL = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]*)://([^/?#]*)(.*)$", Pattern.DOTALL);

    /** scheme://authority + (path?query#fragment) 분해 결과 */
    public record Parts(String scheme, String authority, String rest) {
        public String origin() { return scheme + "://" + authority; }
    }

    private final String seedScheme;
    private final String seedAuthority;
    private final String seedHost;

    public UrlNormalizer(String seedUrl) {
        Parts p = parse(Objects.requireNonNull(seedUrl, "seedUrl").trim());
        if (p == null) throw new IllegalArgumentException("seed must be an absolute URL: " + seedUrl);
        this.seedScheme = p.scheme().toLowerCase(Locale.ROOT);
        this.seedAuthority = canonicalAuthority(seedScheme, p.authority());
        this.seedHost = hostOf(p.authority());
    }

    public String getSeedHost() { return seedHost; }

    /** reference를 baseUrl 기준으로 정규화 */
    public String normalize(String reference, String baseUrl) {
        if (reference == null) return "";
        String url = reference.trim();
        if (url.regionMatches(true, 0, "data:", 0, 5)) return url; // 인라인 데이터는 손대지 않음
        try {
            if (url.startsWith("//")) {
                url = seedScheme + ":" + url;
            } else if (url.startsWith("/")) {
                url = seedScheme + "://" + seedAuthority + url;
            } else if (!HAS_SCHEME.matcher(url).find()) {
                url = resolveRelative(url, baseUrl);
            }

            url = stripFragment(url);

            Parts p = parse(url);
            if (p != null) {
                String scheme = p.scheme().toLowerCase(Locale.ROOT);
                url = scheme + "://" + canonicalAuthority(scheme, p.authority()) + removeDotSegments(p.rest());
            }

            url = stripTrackingParams(url);
            return stripTrailingSlash(url);
        } catch (RuntimeException e) {
            LOG.debug("Error normalizing URL: {} ({})", reference, e.toString());
            return reference;
        }
    }

    /** 시드 기준 정규화(base = 시드) */
    public String normalize(String reference) {
        return normalize(reference, seedScheme + "://" + seedAuthority);
    }

    /** 호스트가 시드 호스트와 정확히 같은가 */
    public boolean isInbound(String url) {
        Parts p = parse(url);
        if (p == null) return false;
        return seedHost.equals(hostOf(p.authority()));
    }

    // ------------ 정적 헬퍼 ------------

    /** 계층형 URL이 아니면(data:, mailto: 등) null */
    public static Parts parse(String url) {
        if (url == null) return null;
        Matcher m = HIERARCHICAL.matcher(url);
        if (!m.matches()) return null;
        return new Parts(m.group(1), m.group(2), m.group(3));
    }

    /** authority → 소문자 host (userinfo/port 제외). IPv6는 대괄호 유지 */
    public static String hostOf(String authority) {
        if (authority == null) return "";
        String a = authority;
        int at = a.lastIndexOf('@');
        if (at >= 0) a = a.substring(at + 1);
        if (a.startsWith("[")) {
            int close = a.indexOf(']');
            return (close > 0 ? a.substring(0, close + 1) : a).toLowerCase(Locale.ROOT);
        }
        int colon = a.lastIndexOf(':');
        if (colon >= 0) a = a.substring(0, colon);
        return a.toLowerCase(Locale.ROOT);
    }

    /** 절대 URL의 host. 파싱 불가면 "" */
    public static String hostOfUrl(String url) {
        Parts p = parse(url);
        return p == null ? "" : hostOf(p.authority());
    }

    /** 절대 URL의 경로(쿼리/fragment 제외). 비어 있으면 "/" */
    public static String pathOf(String url) {
        Parts p = parse(url);
        if (p == null) return null;
        String rest = p.rest();
        int cut = indexOfAny(rest, '?', '#');
        String path = cut >= 0 ? rest.substring(0, cut) : rest;
        return path.isEmpty() ? "/" : path;
    }

    // ------------ 내부 ------------

    private static String canonicalAuthority(String scheme, String authority) {
        String a = authority;
        String userInfo = "";
        int at = a.lastIndexOf('@');
        if (at >= 0) {
            userInfo = a.substring(0, at + 1);
            a = a.substring(at + 1);
        }
        String host = a;
        String port = "";
        if (!a.startsWith("[") || a.indexOf(']') < a.lastIndexOf(':')) {
            int colon = a.lastIndexOf(':');
            if (colon >= 0) {
                host = a.substring(0, colon);
                port = a.substring(colon + 1);
            }
        }
        // 기본 포트 제거
        if (("http".equals(scheme) && "80".equals(port)) || ("https".equals(scheme) && "443".equals(port))) {
            port = "";
        }
        return userInfo + host.toLowerCase(Locale.ROOT) + (port.isEmpty() ? "" : ":" + port);
    }

    private static String resolveRelative(String ref, String baseUrl) {
        String base = stripFragment(baseUrl == null ? "" : baseUrl.trim());
        if (ref.isEmpty() || ref.startsWith("#")) return base; // 같은 문서

        int q = base.indexOf('?');
        if (q >= 0) base = base.substring(0, q);

        if (ref.startsWith("?")) return base + ref; // 쿼리만 바뀌는 참조

        Parts p = parse(base);
        String dir;
        if (p != null && p.rest().lastIndexOf('/') < 0) {
            dir = base; // 경로 없는 루트 (https://ex.com)
        } else {
            int slash = base.lastIndexOf('/');
            dir = slash >= 0 ? base.substring(0, slash) : base;
        }
        return dir + "/" + ref;
    }

    private static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }

    /** path 부분의 "." ".." 세그먼트 정리 (쿼리는 그대로) */
    static String removeDotSegments(String rest) {
        int q = rest.indexOf('?');
        String path = q >= 0 ? rest.substring(0, q) : rest;
        String tail = q >= 0 ? rest.substring(q) : "";
        if (!path.contains("/.")) return rest;

        String[] segs = path.split("/", -1);
        Deque<String> out = new ArrayDeque<>();
        for (int i = 1; i < segs.length; i++) { // segs[0]은 선행 "/" 앞의 빈 문자열
            String s = segs[i];
            boolean last = (i == segs.length - 1);
            if (".".equals(s)) {
                if (last) out.addLast("");
            } else if ("..".equals(s)) {
                if (!out.isEmpty()) out.removeLast();
                if (last) out.addLast("");
            } else {
                out.addLast(s);
            }
        }
        return "/" + String.join("/", out) + tail;
    }

    private static String stripTrackingParams(String url) {
        int q = url.indexOf('?');
        if (q < 0) return url;
        String query = url.substring(q + 1);
        List<String> kept = new ArrayList<>();
        boolean removed = false;
        try {
            for (String pair : query.split("&", -1)) {
                if (pair.isEmpty()) {
                    // "a=1&" 의 빈 조각, 빈 쿼리 "?" 자체
                    removed = true;
                    continue;
                }
                String name = pair.split("=", 2)[0];
                String decoded = URLDecoder.decode(name, StandardCharsets.UTF_8);
                if (TRACKING_PARAMS.contains(decoded)) {
                    removed = true;
                } else {
                    kept.add(pair);
                }
            }
        } catch (IllegalArgumentException e) {
            LOG.debug("Skipping query parameter cleanup for: {}", url);
            return url;
        }
        if (!removed) return url;
        String base = url.substring(0, q);
        return kept.isEmpty() ? base : base + "?" + String.join("&", kept);
    }

    /** 경로 끝 슬래시 제거(authority 바로 뒤까지만). 쿼리가 있으면 건드리지 않음 */
    private static String stripTrailingSlash(String url) {
        if (url.indexOf('?') >= 0) return url;
        int sep = url.indexOf("://");
        int floor = sep >= 0 ? sep + 3 : 1;
        String out = url;
        while (out.endsWith("/") && out.length() - 1 >= floor + 1) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a), j = s.indexOf(b);
        if (i < 0) return j;
        if (j < 0) return i;
        return Math.min(i, j);
    }
}
