package com.webcrawler.app;

import com.webcrawler.core.model.CrawlConfig;
import com.webcrawler.core.model.FollowBehavior;
import com.webcrawler.core.util.YamlConfigLoader;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * 명령행 → CrawlConfig.
 * 우선순위: 기본값 < crawl.yml < -Dwc.* 시스템 프로퍼티 < 플래그.
 */
final class CliOptions {

    static final String SYNTAX = "webcrawler [--urls a,b,c | --file urls.txt] [options]";

    final CrawlConfig config;
    final List<String> seeds;
    final boolean verbose;
    final boolean help;
    final Path out;

    private CliOptions(CrawlConfig config, List<String> seeds, boolean verbose, boolean help, Path out) {
        this.config = config;
        this.seeds = seeds;
        this.verbose = verbose;
        this.help = help;
        this.out = out;
    }

    static Options options() {
        Options o = new Options();
        o.addOption(Option.builder().longOpt("urls").hasArg().argName("a,b,c")
                .desc("comma-separated seed URLs").build());
        o.addOption(Option.builder().longOpt("file").hasArg().argName("path")
                .desc("seed file, one URL per line (# comments allowed)").build());
        o.addOption(Option.builder().longOpt("config").hasArg().argName("crawl.yml")
                .desc("YAML config file").build());
        o.addOption(Option.builder().longOpt("max-urls").hasArg().argName("n")
                .desc("maximum URLs to process (default 100)").build());
        o.addOption(Option.builder().longOpt("workers").hasArg().argName("n")
                .desc("concurrent workers (default 5)").build());
        o.addOption(Option.builder().longOpt("delay-ms").hasArg().argName("ms")
                .desc("per-worker delay between requests").build());
        o.addOption(Option.builder().longOpt("timeout-ms").hasArg().argName("ms")
                .desc("HTTP request timeout").build());
        o.addOption(Option.builder().longOpt("follow").hasArg().argName("mode")
                .desc("any | same-domain | related-subdomains | none (default same-domain)").build());
        o.addOption(Option.builder().longOpt("progress").desc("log progress periodically").build());
        o.addOption(Option.builder("v").longOpt("verbose").desc("debug logging").build());
        o.addOption(Option.builder().longOpt("cache-dir").hasArg().argName("dir")
                .desc("file cache directory").build());
        o.addOption(Option.builder().longOpt("out").hasArg().argName("results.jsonl")
                .desc("write page results as JSON lines").build());
        o.addOption(Option.builder("h").longOpt("help").desc("show this help").build());
        return o;
    }

    /**
     * @throws ParseException 알 수 없는 플래그, 숫자/모드 형식 오류
     * @throws IOException config/seed 파일 읽기 실패
     */
    static CliOptions parse(String[] args, Properties sysProps) throws ParseException, IOException {
        CommandLine cl = new DefaultParser().parse(options(), args);
        if (cl.hasOption("help")) {
            return new CliOptions(CrawlConfig.defaults(), List.of(), false, true, null);
        }

        CrawlConfig cfg = cl.hasOption("config")
                ? YamlConfigLoader.load(Path.of(cl.getOptionValue("config")))
                : CrawlConfig.defaults();

        applySystemProperties(cfg, sysProps);

        try {
            if (cl.hasOption("max-urls")) cfg.setMaxUrls(Integer.parseInt(cl.getOptionValue("max-urls").trim()));
            if (cl.hasOption("workers")) cfg.setWorkers(Integer.parseInt(cl.getOptionValue("workers").trim()));
            if (cl.hasOption("delay-ms")) cfg.setRequestDelayMs(Long.parseLong(cl.getOptionValue("delay-ms").trim()));
            if (cl.hasOption("timeout-ms")) {
                cfg.getHttp().setTimeout(Duration.ofMillis(Long.parseLong(cl.getOptionValue("timeout-ms").trim())));
            }
            if (cl.hasOption("follow")) cfg.setFollowBehavior(FollowBehavior.parse(cl.getOptionValue("follow")));
        } catch (IllegalArgumentException e) {
            // NumberFormatException 포함
            throw new ParseException("invalid option value: " + e.getMessage());
        }
        if (cl.hasOption("progress")) cfg.setShowProgress(true);
        if (cl.hasOption("cache-dir")) cfg.getCache().setDir(Path.of(cl.getOptionValue("cache-dir")));

        // 시드: --urls + --file, 둘 다 없으면 YAML seeds
        Set<String> seeds = new LinkedHashSet<>();
        if (cl.hasOption("urls")) {
            for (String u : cl.getOptionValue("urls").split(",")) {
                if (!u.isBlank()) seeds.add(u.trim());
            }
        }
        if (cl.hasOption("file")) seeds.addAll(readSeedFile(Path.of(cl.getOptionValue("file"))));
        if (seeds.isEmpty()) seeds.addAll(cfg.getSeeds());
        cfg.setSeeds(new ArrayList<>(seeds));

        try {
            cfg.validate();
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage());
        }

        Path out = cl.hasOption("out") ? Path.of(cl.getOptionValue("out")) : null;
        return new CliOptions(cfg, List.copyOf(seeds), cl.hasOption("verbose"), false, out);
    }

    /** -Dwc.crawl.maxUrls / workers / delayMs / follow */
    static void applySystemProperties(CrawlConfig cfg, Properties p) {
        if (p == null) return;
        Integer maxUrls = intProp(p, "wc.crawl.maxUrls");
        if (maxUrls != null) cfg.setMaxUrls(maxUrls);
        Integer workers = intProp(p, "wc.crawl.workers");
        if (workers != null) cfg.setWorkers(workers);
        Integer delay = intProp(p, "wc.crawl.delayMs");
        if (delay != null) cfg.setRequestDelayMs(delay);
        String follow = p.getProperty("wc.crawl.follow");
        if (follow != null && !follow.isBlank()) {
            try { cfg.setFollowBehavior(FollowBehavior.parse(follow)); }
            catch (IllegalArgumentException ignore) { /* 기본값 유지 */ }
        }
    }

    static List<String> readSeedFile(Path file) throws IOException {
        List<String> out = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String s = line.trim();
            if (s.isEmpty() || s.startsWith("#")) continue;
            out.add(s);
        }
        return out;
    }

    static void printUsage(PrintWriter pw) {
        new HelpFormatter().printHelp(pw, 100, SYNTAX, "", options(), 2, 2,
                "Seeds may also come from 'seeds:' in the YAML config.");
        pw.flush();
    }

    private static Integer intProp(Properties p, String key) {
        String v = p.getProperty(key);
        if (v == null || v.isBlank()) return null;
        try { return Integer.parseInt(v.trim().toLowerCase(Locale.ROOT)); }
        catch (NumberFormatException e) { return null; }
    }
}
