package com.webcrawler.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 루트 설정: 콘솔(stderr) + 사이즈 롤링 파일(crawl-%g.log).
 * SLF4J는 slf4j-jdk14 바인딩으로 여기 핸들러를 그대로 탄다.
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    public static final int DEFAULT_MAX_BYTES = 2 * 1024 * 1024;
    public static final int DEFAULT_FILE_COUNT = 5;

    /** 한 줄 포맷: 메시지 그대로(StructuredLog는 이미 JSON) */
    private static final Formatter LINE = new Formatter() {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            if (r.getThrown() == null) return msg + System.lineSeparator();
            return msg + " (" + r.getThrown() + ")" + System.lineSeparator();
        }
    };

    /** 콘솔만 (logDir == null) */
    public static void initConsole(Level rootLevel) {
        init(null, rootLevel, DEFAULT_MAX_BYTES, DEFAULT_FILE_COUNT);
    }

    /**
     * @param logDir null이면 파일 핸들러 생략
     */
    public static void init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(LINE);
        root.addHandler(console);

        if (logDir != null) {
            try {
                Files.createDirectories(logDir);
                String pattern = logDir.resolve("crawl-%g.log").toString();
                FileHandler file = new FileHandler(pattern, Math.max(1, maxBytes), Math.max(1, fileCount), true);
                file.setLevel(rootLevel);
                file.setFormatter(LINE); // 같은 포맷
                root.addHandler(file);
            } catch (IOException e) {
                System.err.println("Failed to init file handler: " + e.getMessage());
            }
        }

        root.setLevel(rootLevel);
    }
}
