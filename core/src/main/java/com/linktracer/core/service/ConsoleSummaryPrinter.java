package com.linktracer.core.service;

import com.linktracer.core.model.CrawlReport;
import com.linktracer.core.model.ResourceRecord;
import com.linktracer.core.model.SourceLookupResult;
import com.linktracer.core.util.UrlDisplay;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 사람이 읽는 콘솔 요약: 합계, 타입별 수, 내부/외부, 상태별 예시 URL, 출처 조회 안내 */
public final class ConsoleSummaryPrinter {

    static final String LOOKUP_HINT = "  linktracer --source \"URL_HERE\"";

    private final PrintStream out;

    public ConsoleSummaryPrinter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public void print(CrawlReport report, Path reportPath) {
        out.println();
        out.println(report.cancelled ? "Crawl cancelled! Partial summary:" : "Crawl complete! Summary:");
        out.println("Total URLs checked: " + report.summary.total);
        for (Map.Entry<String, Long> e : report.types.entrySet()) {
            out.println(e.getKey() + ": " + e.getValue());
        }
        out.println();
        out.println("Internal URLs: " + report.summary.internal);
        out.println("External URLs: " + report.summary.external);

        if (!report.samples.isEmpty()) {
            out.println();
            out.println("Sample URLs with source counts:");
        }
        for (Map.Entry<String, List<CrawlReport.Sample>> e : report.samples.entrySet()) {
            CrawlReport.StatusBucket bucket = report.statusCodes.get(e.getKey());
            long internal = (bucket != null ? bucket.internal : e.getValue().size());
            out.println();
            out.println("Status " + e.getKey() + " (" + internal + " internal URLs):");
            for (CrawlReport.Sample s : e.getValue()) {
                out.println("- " + UrlDisplay.truncate(s.url, 100) + foundOnText(s));
            }
            if (internal > e.getValue().size()) {
                out.println("  ... and " + (internal - e.getValue().size()) + " more");
            }
        }

        if (reportPath != null) {
            out.println();
            out.println("Detailed report written to " + reportPath);
        }
        out.println();
        out.println("To view all source URLs for a specific URL:");
        out.println(LOOKUP_HINT);
    }

    public void printLookup(SourceLookupResult r) {
        out.println("Finding source pages for: " + r.getUrl());
        if (!r.isFound()) {
            out.println("URL not found in the crawl database");
            return;
        }
        ResourceRecord rec = r.getRecord();
        out.println();
        out.println("URL information:");
        out.println("Status: " + (rec.isFetched() ? String.valueOf(rec.getStatus()) : "not checked"));
        out.println("Type: " + rec.getAssetType().key());
        out.println("Is internal: " + (rec.isInbound() ? "Yes" : "No"));
        if (rec.isRedirect()) {
            out.println("Redirects to: " + rec.getFinalUrl());
        }
        if (rec.getError() != null) {
            out.println("Error: " + rec.getError());
        }

        List<String> pages = r.getSourcePages();
        out.println();
        out.println("Found on " + pages.size() + " page(s):");
        if (pages.isEmpty()) {
            out.println("No source pages recorded (this might be the starting URL)");
        } else {
            for (String p : pages) out.println("- " + p);
        }
    }

    static String foundOnText(CrawlReport.Sample s) {
        if (s.sourceCount <= 0) return "";
        if (s.sourceCount == 1) return " (found on: " + UrlDisplay.truncate(s.firstSource, 50) + ")";
        return " (found on " + s.sourceCount + " pages)";
    }
}
