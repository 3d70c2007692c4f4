package com.linktracer.core.crawler;

import com.linktracer.core.model.DiscoveredLink;
import com.linktracer.core.model.TagKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupLinkExtractorTest {

    private final JsoupLinkExtractor extractor = new JsoupLinkExtractor();

    @Test
    @DisplayName("a/link/script/img 참조를 원문 그대로 수집")
    void collects_four_element_kinds() {
        String html = "<html><head>"
                + "<link rel='stylesheet' href='/s.css'>"
                + "<link rel='icon' href='/favicon.ico'>"
                + "<script src='app.js'></script>"
                + "</head><body>"
                + "<a href='/about'>a</a>"
                + "<img src='https://cdn.ex.com/a.png'>"
                + "</body></html>";

        List<DiscoveredLink> links = extractor.extract(html, "https://ex.com/");

        assertThat(links).containsExactly(
                new DiscoveredLink("/about", TagKind.ANCHOR),
                new DiscoveredLink("/s.css", TagKind.STYLESHEET_LINK),
                new DiscoveredLink("app.js", TagKind.SCRIPT),
                new DiscoveredLink("https://cdn.ex.com/a.png", TagKind.IMG));
    }

    @Test
    @DisplayName("javascript:/mailto:/tel:/data:image 는 버린다")
    void skips_non_navigable_schemes() {
        String html = "<a href='javascript:void(0)'>x</a>"
                + "<a href='MAILTO:a@b.c'>m</a>"
                + "<a href='tel:123'>t</a>"
                + "<a href='data:image/png;base64,AAA'>d</a>"
                + "<img src='data:image/gif;base64,R0l'>"
                + "<a href='/ok'>ok</a>";

        assertThat(extractor.extract(html, "https://ex.com"))
                .containsExactly(new DiscoveredLink("/ok", TagKind.ANCHOR));
    }

    @Test
    @DisplayName("type=text/css 인 link 도 스타일시트로 취급, 빈 href 는 무시")
    void text_css_link_and_blank_attrs() {
        String html = "<link type='text/css' href='/t.css'><a href='  '>blank</a><script src=''></script>";
        assertThat(extractor.extract(html, "https://ex.com"))
                .containsExactly(new DiscoveredLink("/t.css", TagKind.STYLESHEET_LINK));
    }

    @Test
    void empty_input_yields_nothing() {
        assertThat(extractor.extract("", "https://ex.com")).isEmpty();
        assertThat(extractor.extract(null, null)).isEmpty();
    }

    @Test
    void data_image_detection_is_case_insensitive() {
        assertThat(JsoupLinkExtractor.isDataImage("DATA:image/png;base64,x")).isTrue();
        assertThat(JsoupLinkExtractor.isDataImage("data:text/plain,x")).isFalse();
    }
}
