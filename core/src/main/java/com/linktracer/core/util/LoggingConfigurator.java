package com.linktracer.core.util;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 + 사이즈 롤링. SLF4J(slf4j-jdk14)도 여기로 흘러든다.
 * System props:
 *  -Dtracer.log.level=FINE|INFO|WARNING|SEVERE
 *  -Dtracer.log.sizeMb=2
 *  -Dtracer.log.files=5
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    private static volatile boolean initialized = false;

    public static synchronized void init(Path logDir) {
        init(logDir, levelOf(System.getProperty("tracer.log.level", "INFO")));
    }

    public static synchronized void init(Path logDir, Level level) {
        if (initialized) return;
        initialized = true;

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        Formatter fmt = new LineFormatter();

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(fmt);
        root.addHandler(console);

        int sizeMb = parseInt(System.getProperty("tracer.log.sizeMb"), 2);
        int files = parseInt(System.getProperty("tracer.log.files"), 5);
        try {
            Files.createDirectories(logDir);
            FileHandler file = new FileHandler(logDir.resolve("tracer-%g.log").toString(), sizeMb * 1024 * 1024, files, true);
            file.setLevel(level);
            file.setFormatter(fmt);
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 로그 없이 콘솔만으로 진행
            Logger.getAnonymousLogger().log(Level.WARNING, "Log file setup failed: " + e.getMessage(), e);
        }
        root.setLevel(level);
    }

    /** 런타임 레벨 변경(루트 + 핸들러) */
    public static void setLevel(Level level) {
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) h.setLevel(level);
    }

    /** 문자열 → Level (실패 시 INFO) */
    public static Level levelOf(String s) {
        try { return Level.parse(String.valueOf(s).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), formatMessage(r));

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
