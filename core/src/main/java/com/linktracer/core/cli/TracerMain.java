package com.linktracer.core.cli;

import com.linktracer.core.model.CrawlConfig;
import com.linktracer.core.model.CrawlReport;
import com.linktracer.core.model.SourceLookupResult;
import com.linktracer.core.service.ConsoleSummaryPrinter;
import com.linktracer.core.service.CrawlInitializationException;
import com.linktracer.core.service.CrawlService;
import com.linktracer.core.service.LoggingEventListener;
import com.linktracer.core.util.LoggingConfigurator;
import com.linktracer.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 명령줄 진입점.
 * <pre>
 *   linktracer [--config tracer.yml] [--url URL] [--depth N] [--concurrency N] [--cleanup]
 *   linktracer [--config tracer.yml] --source URL
 * </pre>
 * 종료 코드: 0 정상, 1 치명 오류(저장소/설정), 2 사용법 오류
 */
public final class TracerMain {

    private static final Logger LOG = LoggerFactory.getLogger(TracerMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(30);

    private TracerMain() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** 테스트용: System.exit 없이 종료 코드만 돌려준다 */
    static int run(String[] args, PrintStream out, PrintStream err) {
        Options opts;
        try {
            opts = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }
        if (opts.help) {
            printUsage(out);
            return EXIT_OK;
        }

        CrawlConfig cfg;
        try {
            cfg = loadConfig(opts.configPath);
        } catch (IOException | RuntimeException e) {
            err.println("Cannot load configuration: " + e.getMessage());
            return EXIT_FATAL;
        }
        if (opts.url != null) cfg.setTarget(opts.url);
        if (opts.depth != null) cfg.setMaxDepth(opts.depth);
        if (opts.concurrency != null) cfg.setConcurrency(opts.concurrency);
        if (opts.cleanup) cfg.setCleanupPriorState(true);

        LoggingConfigurator.init(cfg.getOutputDir().resolve("logs"));
        ConsoleSummaryPrinter printer = new ConsoleSummaryPrinter(out);

        // 종료 훅은 이 래치가 내려갈 때까지(보고서 기록, 저장소 flush/close 후) 기다린다
        CountDownLatch finished = new CountDownLatch(1);
        try (CrawlService service = new CrawlService(cfg)) {
            if (opts.sourceUrl != null) {
                SourceLookupResult r = service.lookup(opts.sourceUrl);
                printer.printLookup(r);
                return EXIT_OK;
            }
            if (cfg.getTarget() == null || cfg.getTarget().isBlank()) {
                err.println("No target URL: set 'target' in tracer.yml or pass --url");
                return EXIT_USAGE;
            }

            out.println("Starting crawler for " + cfg.getTarget());
            out.println("Max depth: " + cfg.getMaxDepth() + ", Concurrency: " + cfg.getConcurrency());

            Thread hook = shutdownHook(service::stop, finished, SHUTDOWN_WAIT);
            Runtime.getRuntime().addShutdownHook(hook);
            try {
                CrawlReport report = service.run(new LoggingEventListener());
                printer.print(report, service.getLastReportPath());
            } finally {
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException ignore) {
                    // JVM 종료 중에는 제거 불가
                }
            }
            return EXIT_OK;
        } catch (CrawlInitializationException e) {
            LOG.error("Fatal: {}", e.getMessage(), e);
            err.println("Fatal: " + e.getMessage());
            return EXIT_FATAL;
        } finally {
            finished.countDown();
        }
    }

    /**
     * Ctrl+C 등 종료 신호용 훅: 크롤 중단을 요청하고, 메인 경로가 보고서 기록과
     * 저장소 정리를 마칠 때까지 최대 {@code maxWait} 기다린다.
     */
    static Thread shutdownHook(Runnable stop, CountDownLatch finished, Duration maxWait) {
        return new Thread(() -> {
            stop.run();
            try {
                if (!finished.await(maxWait.toMillis(), TimeUnit.MILLISECONDS)) {
                    LOG.warn("Shutdown: crawl did not finish within {} ms, report may be incomplete", maxWait.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "crawl-shutdown");
    }

    /** 명시 경로 → 없으면 작업 디렉터리의 tracer.yml → 그것도 없으면 기본값 */
    static CrawlConfig loadConfig(Path explicit) throws IOException {
        if (explicit != null) return YamlConfigLoader.load(explicit);
        if (Files.exists(Path.of("tracer.yml"))) return YamlConfigLoader.loadDefault();
        return CrawlConfig.defaults();
    }

    static void printUsage(PrintStream ps) {
        ps.println("Usage: linktracer [--config FILE] [--url URL] [--depth N] [--concurrency N] [--cleanup]");
        ps.println("       linktracer [--config FILE] --source URL");
    }

    /** 인자 파싱 결과 */
    static final class Options {
        Path configPath;
        String url;
        Integer depth;
        Integer concurrency;
        boolean cleanup;
        String sourceUrl;
        boolean help;

        static Options parse(String[] args) {
            Options o = new Options();
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                switch (a) {
                    case "--config": o.configPath = Path.of(value(args, ++i, a)); break;
                    case "--url": o.url = value(args, ++i, a); break;
                    case "--depth": o.depth = intValue(args, ++i, a, 0); break;
                    case "--concurrency": o.concurrency = intValue(args, ++i, a, 1); break;
                    case "--cleanup": o.cleanup = true; break;
                    case "--source": o.sourceUrl = value(args, ++i, a); break;
                    case "-h":
                    case "--help": o.help = true; break;
                    default: throw new IllegalArgumentException("Unknown option: " + a);
                }
            }
            return o;
        }

        private static String value(String[] args, int i, String flag) {
            if (i >= args.length || args[i].startsWith("--")) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            return args[i];
        }

        private static int intValue(String[] args, int i, String flag, int min) {
            String v = value(args, i, flag);
            try {
                int n = Integer.parseInt(v.trim());
                if (n < min) throw new IllegalArgumentException(flag + " must be >= " + min + ": " + v);
                return n;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + flag + ": " + v);
            }
        }
    }
}
