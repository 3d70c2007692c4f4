package com.linktracer.core.crawler;

import com.linktracer.core.model.AssetType;
import com.linktracer.core.model.CrawlConfig;
import com.linktracer.core.model.FrontierItem;
import com.linktracer.core.model.TagKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AdmissionPolicyTest {

    private static FrontierItem at(String url, int depth) {
        return new FrontierItem(url, "https://ex.com", depth, List.of("https://ex.com"), AssetType.LINK, TagKind.ANCHOR);
    }

    @Test
    void verdicts() {
        CrawlConfig cfg = new CrawlConfig().setTarget("https://ex.com").setMaxDepth(2)
                .setSkipDataImages(true).setExcludePatterns(List.of("/private"));
        AdmissionPolicy p = new AdmissionPolicy(cfg);

        assertThat(p.check(at("https://ex.com/a", 2))).isEqualTo(AdmissionPolicy.Verdict.ADMIT);
        assertThat(p.check(at("https://ex.com/a", 3))).isEqualTo(AdmissionPolicy.Verdict.TOO_DEEP);
        assertThat(p.check(at("data:image/png;base64,AA", 1))).isEqualTo(AdmissionPolicy.Verdict.DATA_URL);
        assertThat(p.check(at("https://ex.com/private/x", 1))).isEqualTo(AdmissionPolicy.Verdict.EXCLUDED);
        assertThat(p.shouldCrawl(FrontierItem.seed("https://ex.com"))).isTrue();
    }

    @Test
    void data_urls_pass_when_not_skipping() {
        AdmissionPolicy p = new AdmissionPolicy(new CrawlConfig().setTarget("https://ex.com").setSkipDataImages(false));
        assertThat(p.shouldCrawl(at("DATA:image/gif;base64,R0", 0))).isTrue();
    }
}
