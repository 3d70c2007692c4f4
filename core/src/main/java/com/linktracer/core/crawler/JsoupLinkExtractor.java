package com.linktracer.core.crawler;

import com.linktracer.core.model.DiscoveredLink;
import com.linktracer.core.model.TagKind;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 기본 JSoup 기반 추출기.
 * a[href], 스타일시트 link[href], script[src], img[src] 수집.
 * 탐색 대상이 아닌 스킴(javascript:, mailto:, tel:)과 인라인 data:image 는 버린다.
 */
public class JsoupLinkExtractor implements LinkExtractor {

    @Override
    public List<DiscoveredLink> extract(String html, String baseUrl) {
        List<DiscoveredLink> out = new ArrayList<>();
        if (html == null || html.isEmpty()) return out;

        Document doc = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);

        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href").trim();
            if (href.isEmpty() || isSkippedAnchor(href)) continue;
            out.add(new DiscoveredLink(href, TagKind.ANCHOR));
        }
        for (Element l : doc.select("link[rel=stylesheet], link[type=text/css]")) {
            String href = l.attr("href").trim();
            if (href.isEmpty()) continue;
            out.add(new DiscoveredLink(href, TagKind.STYLESHEET_LINK));
        }
        for (Element s : doc.select("script[src]")) {
            String src = s.attr("src").trim();
            if (src.isEmpty()) continue;
            out.add(new DiscoveredLink(src, TagKind.SCRIPT));
        }
        for (Element img : doc.select("img[src]")) {
            String src = img.attr("src").trim();
            if (src.isEmpty() || isDataImage(src)) continue;
            out.add(new DiscoveredLink(src, TagKind.IMG));
        }
        return out;
    }

    private static boolean isSkippedAnchor(String href) {
        String h = href.toLowerCase(Locale.ROOT);
        return h.startsWith("javascript:") || h.startsWith("mailto:") || h.startsWith("tel:") || isDataImage(h);
    }

    static boolean isDataImage(String ref) {
        return ref.regionMatches(true, 0, "data:image", 0, 10);
    }
}
