package com.linktracer.core.service.export;

import com.linktracer.core.model.CrawlReport;

import java.io.IOException;
import java.nio.file.Path;

/** 크롤 리포트를 파일로 내보내는 책임 */
public interface ReportExporter {
    /**
     * @param outputDir 출력 디렉터리 (없으면 생성)
     * @param report    집계 결과
     * @return 생성된 파일의 경로
     */
    Path export(Path outputDir, CrawlReport report) throws IOException;
}
