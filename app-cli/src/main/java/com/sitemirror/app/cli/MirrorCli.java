package com.sitemirror.app.cli;

import com.sitemirror.app.logging.LogSetup;
import com.sitemirror.core.model.ConfigurationException;
import com.sitemirror.core.model.MirrorConfig;
import com.sitemirror.core.model.Mode;
import com.sitemirror.core.model.Report;
import com.sitemirror.core.model.ScrapeOutcome;
import com.sitemirror.core.model.SessionState;
import com.sitemirror.core.model.SitemapReport;
import com.sitemirror.core.service.ScrapeController;
import com.sitemirror.core.service.ScrapeService;
import com.sitemirror.core.service.SessionHandle;
import com.sitemirror.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;

/**
 * sitemirror &lt;url&gt; [--max-pages N] [--mode site|sitemaps] [--config mirror.yml] [--out DIR] [--verbose]
 *
 * 종료 코드: 0 성공, 1 실행 실패, 2 사용법/설정 오류
 */
public final class MirrorCli {

    private static final Logger LOG = LoggerFactory.getLogger(MirrorCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(30);

    private MirrorCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, true));
    }

    /** 테스트에서는 initLogging=false 로 전역 JUL 설정을 건드리지 않는다 */
    static int run(String[] args, PrintStream out, PrintStream err, boolean initLogging) {
        Options opts;
        MirrorConfig cfg;
        try {
            opts = Options.parse(args);
            if (opts.help()) {
                printUsage(out);
                return EXIT_OK;
            }
            cfg = resolveConfig(opts);
            cfg.validate();
        } catch (ConfigurationException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (initLogging) {
            LogSetup.configure(cfg.getMode() == Mode.SITEMAPS ? cfg.getSitemapDir() : cfg.getOutputDir());
            if (opts.verbose()) LogSetup.setLevel(Level.FINE);
        }
        LOG.info("CLI start: target={}, mode={}, maxPages={}", cfg.getTarget(), cfg.getMode(), cfg.getMaxPages());

        ScrapeController controller = new ScrapeController(cfg, ScrapeService::new, out::println);
        // Ctrl+C: 취소 후 진행 중 페이지와 산출물 기록이 끝날 때까지 잠시 대기
        Thread hook = new Thread(() -> {
            if (!controller.stop()) return;
            try {
                controller.lastSession().await(SHUTDOWN_WAIT);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                LOG.warn("Session did not finish cleanly on shutdown: {}", e.toString());
            }
        }, "mirror-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            SessionHandle handle = controller.start(cfg.getTarget(), cfg.getMaxPages());
            ScrapeOutcome outcome = handle.await();
            printSummary(out, cfg, outcome);
            return outcome.state() == SessionState.FAILED ? EXIT_FAILED : EXIT_OK;
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            err.println("Scrape failed: " + cause.getMessage());
            LOG.error("Scrape failed", cause);
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            controller.stop();
            err.println("Interrupted");
            return EXIT_FAILED;
        } finally {
            controller.close();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException shuttingDown) {
                // JVM 종료 중이면 훅이 이미 실행 중
                LOG.debug("Shutdown in progress, hook left registered");
            }
        }
    }

    static MirrorConfig resolveConfig(Options opts) throws IOException {
        MirrorConfig cfg = (opts.config() != null)
                ? YamlConfigLoader.load(opts.config())
                : MirrorConfig.defaults();
        if (opts.url() != null) cfg.setTarget(opts.url());
        if (opts.maxPages() != null) cfg.setMaxPages(opts.maxPages());
        if (opts.mode() != null) cfg.setMode(opts.mode());
        if (opts.outDir() != null) {
            if (cfg.getMode() == Mode.SITEMAPS) cfg.setSitemapDir(opts.outDir());
            else cfg.setOutputDir(opts.outDir());
        }
        return cfg;
    }

    // ---------- output ----------

    private static void printSummary(PrintStream out, MirrorConfig cfg, ScrapeOutcome o) {
        out.println("============================================================");
        if (o.report() != null) {
            Report r = o.report();
            out.println("Scraping " + o.state().name().toLowerCase(Locale.ROOT));
            out.println("Discovered: " + r.totalDiscovered());
            out.println("Downloaded: " + r.totalDownloaded() + " pages");
            out.println("Failed:     " + r.totalFailed() + " pages");
            out.println("Open " + cfg.getOutputDir().resolve("index.html").toAbsolutePath() + " to browse offline");
        }
        if (o.sitemapReport() != null) {
            SitemapReport r = o.sitemapReport();
            out.println("Sitemaps downloaded: " + r.sitemapCount());
            out.println("Total URLs found:    " + r.urls().size());
            out.println("Saved under " + cfg.getSitemapDir().toAbsolutePath());
        }
        out.println("============================================================");
    }

    static void printUsage(PrintStream ps) {
        ps.println("Usage: sitemirror <url> [options]");
        ps.println("  -n, --max-pages N        Stop after N pages (default: unlimited)");
        ps.println("  -m, --mode MODE          site (mirror pages) | sitemaps (download sitemap XML only)");
        ps.println("  -c, --config FILE        Load settings from mirror.yml");
        ps.println("  -o, --out DIR            Output directory");
        ps.println("  -v, --verbose            Debug-level file logging");
        ps.println("  -h, --help");
    }

    // ---------- args ----------

    record Options(String url, Integer maxPages, Mode mode, Path config, Path outDir, boolean verbose, boolean help) {

        static Options parse(String[] args) {
            String url = null;
            Integer maxPages = null;
            Mode mode = null;
            Path config = null;
            Path outDir = null;
            boolean verbose = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--help", "-h" -> {
                        return new Options(null, null, null, null, null, false, true);
                    }
                    case "--max-pages", "-n" -> maxPages = parseMaxPages(value(args, ++i, "--max-pages"));
                    case "--mode", "-m" -> mode = parseMode(value(args, ++i, "--mode"));
                    case "--config", "-c" -> config = Path.of(value(args, ++i, "--config"));
                    case "--out", "-o" -> outDir = Path.of(value(args, ++i, "--out"));
                    case "--verbose", "-v" -> verbose = true;
                    default -> {
                        if (args[i].startsWith("-")) throw new ConfigurationException("Unknown option: " + args[i]);
                        if (url != null) throw new ConfigurationException("Only one URL may be given");
                        url = args[i];
                    }
                }
            }
            if (url == null && config == null) throw new ConfigurationException("URL is required");
            return new Options(url, maxPages, mode, config, outDir, verbose, false);
        }

        private static String value(String[] args, int i, String opt) {
            if (i >= args.length) throw new ConfigurationException("Missing value for " + opt);
            return args[i];
        }

        private static Integer parseMaxPages(String s) {
            try {
                int n = Integer.parseInt(s.trim());
                if (n < 0) throw new ConfigurationException("--max-pages must be >= 0");
                return n;
            } catch (NumberFormatException e) {
                throw new ConfigurationException("--max-pages must be a number: " + s);
            }
        }

        private static Mode parseMode(String s) {
            for (Mode m : Mode.values()) {
                if (m.name().equalsIgnoreCase(s.trim())) return m;
            }
            throw new ConfigurationException("Unknown mode: " + s + " (site|sitemaps)");
        }
    }
}
