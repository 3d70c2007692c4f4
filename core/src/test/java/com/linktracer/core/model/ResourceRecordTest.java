package com.linktracer.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceRecordTest {

    @Test
    void stub_has_no_fetch_fields() {
        ResourceRecord stub = ResourceRecord.builder()
                .url("https://ex.com/a.png")
                .depth(1)
                .assetType(AssetType.IMAGE)
                .inbound(true)
                .referrer("https://ex.com")
                .tag(TagKind.IMG)
                .build();

        Map<String, String> f = stub.toFields();
        assertThat(f).doesNotContainKeys(ResourceRecord.F_STATUS, ResourceRecord.F_CHECKED_AT,
                ResourceRecord.F_FINAL_URL, ResourceRecord.F_IS_REDIRECT);
        assertThat(f).containsEntry(ResourceRecord.F_TYPE, "image")
                .containsEntry(ResourceRecord.F_IS_INBOUND, "1")
                .containsEntry(ResourceRecord.F_TAG, "img");
        assertThat(stub.isFetched()).isFalse();
        assertThat(stub.getStatus()).isZero();
    }

    @Test
    void fetched_record_reads_back_from_fields() {
        Instant at = Instant.parse("2024-05-01T10:00:00Z");
        ResourceRecord rec = ResourceRecord.builder()
                .url("https://ex.com/old")
                .status(200)
                .contentType("text/html; charset=utf-8")
                .finalUrl("https://ex.com/new")
                .redirect(true)
                .depth(2)
                .assetType(AssetType.LINK)
                .inbound(true)
                .checkedAt(at)
                .build();

        ResourceRecord back = ResourceRecord.fromFields("ignored", rec.toFields());

        assertThat(back.getUrl()).isEqualTo("https://ex.com/old");
        assertThat(back.isFetched()).isTrue();
        assertThat(back.getStatus()).isEqualTo(200);
        assertThat(back.isRedirect()).isTrue();
        assertThat(back.getFinalUrl()).isEqualTo("https://ex.com/new");
        assertThat(back.getCheckedAt()).isEqualTo(at);
        assertThat(back.getError()).isNull();
    }

    @Test
    void fromFields_is_lenient_with_damaged_values() {
        ResourceRecord r = ResourceRecord.fromFields("https://ex.com/x",
                Map.of(ResourceRecord.F_STATUS, "abc", ResourceRecord.F_DEPTH, "", ResourceRecord.F_TYPE, "weird",
                        ResourceRecord.F_CHECKED_AT, "yesterday"));
        assertThat(r.getUrl()).isEqualTo("https://ex.com/x");
        assertThat(r.getStatus()).isZero();
        assertThat(r.getDepth()).isZero();
        assertThat(r.getAssetType()).isEqualTo(AssetType.OTHER);
        assertThat(r.getCheckedAt()).isNull();
    }
}
