package com.linktracer.core.model;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class CrawlConfigTest {

    @Test
    void defaultsAreValid() {
        CrawlConfig cfg = new CrawlConfig().setTarget("https://example.com");
        cfg.validate();

        assertThat(cfg.getMaxDepth()).isEqualTo(10);
        assertThat(cfg.getConcurrency()).isEqualTo(5);
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(cfg.getTimeoutMs()).isEqualTo(10_000L);
        assertThat(cfg.getUserAgent()).isEqualTo(CrawlConfig.DEFAULT_USER_AGENT);
        assertThat(cfg.isSkipDataImages()).isTrue();
        assertThat(cfg.isCleanupPriorState()).isFalse();
        assertThat(cfg.getMaxRedirects()).isEqualTo(5);
        assertThat(cfg.getExcludePatterns()).isEmpty();
        assertThat(cfg.getOutputDir()).isEqualTo(Path.of("out"));
        assertThat(cfg.getStore().getType()).isEqualTo(CrawlConfig.StoreType.MEMORY);
        assertThat(cfg.getStore().getKeyPrefix()).isEqualTo("tracer:");
    }

    @Test
    void setTimeoutMsClampsToPositive() {
        CrawlConfig cfg = new CrawlConfig().setTarget("https://example.com");
        cfg.setTimeoutMs(0);
        assertThat(cfg.getTimeoutMs()).isEqualTo(1L);
        cfg.setTimeoutMs(-5);
        assertThat(cfg.getTimeoutMs()).isEqualTo(1L);
        cfg.validate();
    }

    @Test
    void setConcurrencyHasLowerBoundOne() {
        CrawlConfig cfg = new CrawlConfig().setTarget("https://example.com").setConcurrency(0);
        assertThat(cfg.getConcurrency()).isEqualTo(1);
        cfg.validate();
    }

    @Test
    void validateRejectsMissingOrNonHttpTarget() {
        assertThrows(NullPointerException.class, () -> new CrawlConfig().validate());
        assertThatThrownBy(() -> new CrawlConfig().setTarget("ftp://example.com").validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("http");
    }

    @Test
    void validateRejectsNegativeDepth() {
        assertThatThrownBy(() -> new CrawlConfig().setTarget("https://example.com").setMaxDepth(-1).validate())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void excludePatternsAreTrimmedAndBlankDropped() {
        CrawlConfig cfg = new CrawlConfig().setExcludePatterns(Arrays.asList(" /blog ", "", null, "/admin"));
        assertThat(cfg.getExcludePatterns()).containsExactly("/blog", "/admin");
    }

    @Test
    void copyIsIndependentOfLaterChanges() {
        CrawlConfig cfg = new CrawlConfig().setTarget("https://example.com").setExcludePatterns(List.of("/a"));
        CrawlConfig frozen = cfg.copy();

        cfg.setTarget("https://other.org").setMaxDepth(1);
        cfg.getStore().setKeyPrefix("changed:");

        assertThat(frozen.getTarget()).isEqualTo("https://example.com");
        assertThat(frozen.getMaxDepth()).isEqualTo(10);
        assertThat(frozen.getExcludePatterns()).containsExactly("/a");
        assertThat(frozen.getStore().getKeyPrefix()).isEqualTo("tracer:");
    }
}
