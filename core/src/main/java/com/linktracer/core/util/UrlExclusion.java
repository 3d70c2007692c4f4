package com.linktracer.core.util;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 제외 규칙 판정. 비교 대상은 URL의 경로(쿼리 제외).
 * <ul>
 *   <li>접두(prefix): {@code "/blog"} → 경로가 /blog 로 시작하면 제외</li>
 *   <li>절대 접두: {@code "https://host/path"} → 쿼리 뗀 URL이 그 문자열로 시작하면 제외</li>
 *   <li>glob: {@code '*'}, {@code '?'} 포함 (예: {@code "/archive/*.zip"}): 경로 전체 매치</li>
 *   <li>정규식: {@code "re:"} 접두, 경로에 대해 find</li>
 * </ul>
 */
public final class UrlExclusion {
    private UrlExclusion(){}

    public static boolean isExcluded(String url, List<String> patterns){
        if (url == null || patterns == null || patterns.isEmpty()) return false;
        final String path = UrlNormalizer.pathOf(url);
        if (path == null) return false; // data:, mailto: 등은 경로 규칙 대상 아님

        for (String p : patterns) {
            if (p == null || p.isBlank()) continue;

            if (p.startsWith("re:")) {
                if (Pattern.compile(p.substring(3), Pattern.CASE_INSENSITIVE).matcher(path).find()) return true;

            } else if (p.contains("://")) {
                int q = url.indexOf('?');
                String noQuery = q >= 0 ? url.substring(0, q) : url;
                if (noQuery.startsWith(p)) return true;

            } else if (p.indexOf('*') >= 0 || p.indexOf('?') >= 0) {
                if (Pattern.compile(globToRegex(p), Pattern.CASE_INSENSITIVE).matcher(path).matches()) return true;

            } else if (path.startsWith(p)) {
                return true;
            }
        }
        return false;
    }

    private static String globToRegex(String glob){
        StringBuilder r = new StringBuilder();
        for (int i = 0; i < glob.length(); i++){
            char c = glob.charAt(i);
            switch(c){
                case '*': r.append(".*"); break;
                case '?': r.append('.'); break;
                case '.': case '\\': case '+': case '(': case ')':
                case '^': case '$': case '|': case '{': case '}':
                case '[': case ']': r.append('\\').append(c); break;
                default: r.append(c);
            }
        }
        return r.toString();
    }
}
