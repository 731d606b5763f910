package com.sitemirror.app.cli;

import com.sitemirror.core.model.ConfigurationException;
import com.sitemirror.core.model.MirrorConfig;
import com.sitemirror.core.model.Mode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MirrorCliTest {

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(outBuf, true, StandardCharsets.UTF_8);
    private final PrintStream err = new PrintStream(errBuf, true, StandardCharsets.UTF_8);

    private int run(String... args) {
        return MirrorCli.run(args, out, err, false);
    }

    private String err() { return errBuf.toString(StandardCharsets.UTF_8); }

    @Test
    void noArgs_printsUsage_exit2() {
        assertThat(run()).isEqualTo(MirrorCli.EXIT_USAGE);
        assertThat(err()).contains("URL is required").contains("Usage: sitemirror");
    }

    @Test
    void help_exit0() {
        assertThat(run("--help")).isEqualTo(MirrorCli.EXIT_OK);
        assertThat(outBuf.toString(StandardCharsets.UTF_8)).contains("--max-pages");
    }

    @Test
    @DisplayName("잘못된 URL/옵션은 실행 전에 종료 코드 2")
    void badInput_exit2() {
        assertThat(run("ftp://example.com")).isEqualTo(MirrorCli.EXIT_USAGE);
        assertThat(run("https://example.com", "--max-pages", "many")).isEqualTo(MirrorCli.EXIT_USAGE);
        assertThat(run("https://example.com", "--max-pages", "-3")).isEqualTo(MirrorCli.EXIT_USAGE);
        assertThat(run("https://example.com", "--mode", "turbo")).isEqualTo(MirrorCli.EXIT_USAGE);
        assertThat(run("https://example.com", "--bogus")).isEqualTo(MirrorCli.EXIT_USAGE);
        assertThat(run("https://example.com", "--out")).isEqualTo(MirrorCli.EXIT_USAGE);
        assertThat(err()).contains("Unknown option: --bogus").contains("Missing value for --out");
    }

    @Test
    void missingConfigFile_exit2(@TempDir Path dir) {
        assertThat(run("https://example.com", "--config", dir.resolve("none.yml").toString()))
                .isEqualTo(MirrorCli.EXIT_USAGE);
        assertThat(err()).contains("not found");
    }

    @Test
    void options_parse() {
        MirrorCli.Options o = MirrorCli.Options.parse(new String[] {
                "-n", "50", "https://example.com", "-m", "SITEMAPS", "-o", "maps"});

        assertThat(o.url()).isEqualTo("https://example.com");
        assertThat(o.maxPages()).isEqualTo(50);
        assertThat(o.mode()).isEqualTo(Mode.SITEMAPS);
        assertThat(o.outDir()).isEqualTo(Path.of("maps"));
        assertThatThrownBy(() -> MirrorCli.Options.parse(new String[] {"https://a.com", "https://b.com"}))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("CLI 인자가 mirror.yml 값을 덮어씀")
    void cliOverridesYaml(@TempDir Path dir) throws IOException {
        Path yml = dir.resolve("mirror.yml");
        Files.writeString(yml, """
                target: "https://from-yaml.example"
                maxPages: 10
                delayMs: 0
                output:
                  dir: "yaml_out"
                  sitemapDir: "yaml_maps"
                """);

        MirrorConfig fromYaml = MirrorCli.resolveConfig(
                MirrorCli.Options.parse(new String[] {"--config", yml.toString()}));
        assertThat(fromYaml.getTarget()).isEqualTo("https://from-yaml.example");
        assertThat(fromYaml.getMaxPages()).isEqualTo(10);

        MirrorConfig overridden = MirrorCli.resolveConfig(MirrorCli.Options.parse(new String[] {
                "https://cli.example", "--config", yml.toString(), "--max-pages", "3",
                "--mode", "sitemaps", "--out", "cli_maps"}));
        assertThat(overridden.getTarget()).isEqualTo("https://cli.example");
        assertThat(overridden.getMaxPages()).isEqualTo(3);
        assertThat(overridden.getMode()).isEqualTo(Mode.SITEMAPS);
        assertThat(overridden.getSitemapDir()).isEqualTo(Path.of("cli_maps"));
        assertThat(overridden.getOutputDir()).isEqualTo(Path.of("yaml_out"));
        assertThat(overridden.getDelay()).isZero();
    }

    @Test
    @DisplayName("E2E: 로컬 서버 미러링 → index.html/report.json, 종료 코드 0")
    void mirrorsLocalSite(@TempDir Path dir) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", MirrorCliTest::route);
        server.start();
        try {
            String base = "http://127.0.0.1:" + server.getAddress().getPort();
            Path yml = dir.resolve("mirror.yml");
            Files.writeString(yml, "delayMs: 0\nsitemapDelayMs: 0\nuseSitemaps: false\n");
            Path outDir = dir.resolve("site");

            int code = run(base, "--config", yml.toString(), "--out", outDir.toString(), "--max-pages", "5");

            assertThat(code).isEqualTo(MirrorCli.EXIT_OK);
            assertThat(outDir.resolve("index.html")).exists();
            assertThat(outDir.resolve("report.json")).exists();
            assertThat(outDir.resolve("pages/docs.html")).exists();
            String printed = outBuf.toString(StandardCharsets.UTF_8);
            assertThat(printed).contains("Downloaded: Docs").contains("Downloaded: 2 pages");
        } finally {
            server.stop(0);
        }
    }

    private static void route(HttpExchange ex) throws IOException {
        String path = ex.getRequestURI().getPath();
        String body = switch (path) {
            case "/" -> "<html><head><title>Root</title></head><body><a href=\"/docs\">Docs</a></body></html>";
            case "/docs" -> "<html><head><title>Docs</title></head><body><a href=\"/\">Root</a></body></html>";
            default -> null;
        };
        byte[] b = (body == null ? "not found" : body).getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", body == null ? "text/plain" : "text/html; charset=UTF-8");
        ex.sendResponseHeaders(body == null ? 404 : 200, b.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(b);
        }
    }
}
