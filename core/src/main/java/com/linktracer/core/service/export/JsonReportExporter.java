package com.linktracer.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.linktracer.core.model.CrawlReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * crawl-report.json 작성기 (pretty print).
 * 형태: target / generatedAt / cancelled / summary / types / statusCodes / samples / runtime
 */
public class JsonReportExporter implements ReportExporter {

    public static final String FILE_NAME = "crawl-report.json";

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public Path export(Path outputDir, CrawlReport report) throws IOException {
        Objects.requireNonNull(report, "report");
        Path dir = (outputDir == null ? Path.of("out") : outputDir);
        Files.createDirectories(dir);
        Path out = dir.resolve(FILE_NAME);
        om.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), report);
        return out;
    }

    /** 콘솔/테스트용 문자열 직렬화 */
    public String toJson(CrawlReport report) throws IOException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(report);
    }
}
