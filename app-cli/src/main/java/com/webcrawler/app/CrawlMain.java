package com.webcrawler.app;

import com.webcrawler.core.api.PageCallback;
import com.webcrawler.core.crawler.Crawler;
import com.webcrawler.core.model.CrawlStats;
import com.webcrawler.core.util.LoggingConfigurator;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;

/**
 * 명령행 크롤러.
 * 종료 코드: 0 정상, 1 사용법 오류/시드 없음, 2 입출력 오류, 130 시작 전 취소
 */
public final class CrawlMain {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_IO = 2;
    static final int EXIT_CANCELLED = 130;

    private CrawlMain() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, System.getProperties()));
    }

    static int run(String[] args, PrintStream stdout, PrintStream stderr, Properties sysProps) {
        PrintWriter err = new PrintWriter(stderr, true, StandardCharsets.UTF_8);
        CliOptions opts;
        try {
            opts = CliOptions.parse(args, sysProps);
        } catch (ParseException e) {
            err.println("error: " + e.getMessage());
            CliOptions.printUsage(err);
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("error: " + e.getMessage());
            return EXIT_IO;
        }

        if (opts.help) {
            CliOptions.printUsage(new PrintWriter(stdout, true, StandardCharsets.UTF_8));
            return EXIT_OK;
        }
        if (opts.seeds.isEmpty()) {
            err.println("error: no seed URLs (use --urls, --file or 'seeds:' in the config)");
            CliOptions.printUsage(err);
            return EXIT_USAGE;
        }

        initLogging(opts.verbose, sysProps);

        Crawler crawler = Crawler.builder(opts.config)
                .defaultParser(new TitleParser())
                .build();

        long t0 = System.nanoTime();
        try (JsonlResultWriter writer = (opts.out != null) ? JsonlResultWriter.open(opts.out) : null) {
            PageCallback callback = (req, parsed, error) -> {
                if (error == null) LOG.info("OK   {} {}", req.getUrl(), parsed);
                else LOG.warn("FAIL {} {}", req.getUrl(), JsonlResultWriter.describe(error));
                if (writer != null) writer.onPage(req, parsed, error);
            };
            crawler.crawl(opts.seeds, callback);
        } catch (CancellationException e) {
            err.println("cancelled: " + e.getMessage());
            return EXIT_CANCELLED;
        } catch (IOException e) {
            err.println("error: " + e.getMessage());
            return EXIT_IO;
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - t0);
        stdout.println(summary(crawler.getStats().snapshot(), elapsed));
        stdout.flush();
        return EXIT_OK;
    }

    static String summary(CrawlStats.Snapshot s, Duration elapsed) {
        double secs = Math.max(elapsed.toMillis(), 1) / 1000.0;
        return String.format(Locale.ROOT,
                "Crawl finished in %.1fs: processed=%d, succeeded=%d, failed=%d, rate=%.2f pages/s",
                secs, s.processed, s.succeeded, s.failed, s.processed / secs);
    }

    /** -Dwc.log.dir 지정 시 파일 로그(crawl-%g.log)도 남김 */
    private static void initLogging(boolean verbose, Properties p) {
        Level level = verbose ? Level.FINE : Level.INFO;
        String dir = (p == null) ? null : p.getProperty("wc.log.dir");
        if (dir == null || dir.isBlank()) {
            LoggingConfigurator.initConsole(level);
        } else {
            LoggingConfigurator.init(Path.of(dir), level,
                    LoggingConfigurator.DEFAULT_MAX_BYTES, LoggingConfigurator.DEFAULT_FILE_COUNT);
        }
    }
}
