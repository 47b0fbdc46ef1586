package com.vidnyan.hint.adapter.in.cli;

import com.vidnyan.hint.HintProperties;
import com.vidnyan.hint.adapter.out.config.JsonLintConfigLoader;
import com.vidnyan.hint.application.port.in.LintSourceUseCase;
import com.vidnyan.hint.application.port.out.SourceParseException;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.Problem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * CLI Runner for linting Go sources.
 * Runs when hint.lint.paths is set; the exit code is 1 when any problem was reported.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LintCliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final LintSourceUseCase lintSourceUseCase;
    private final JsonLintConfigLoader configLoader;
    private final HintProperties properties;

    private int exitCode;

    @Override
    public void run(String... args) {
        List<String> paths = properties.getPaths();
        if (paths == null || paths.isEmpty()) {
            log.info("No source paths specified. Set hint.lint.paths property.");
            return;
        }

        LintConfig config;
        List<Path> files;
        try {
            config = resolveConfig();
            files = collectGoFiles(paths);
        } catch (IOException e) {
            log.error("Cannot start linting: {}", e.getMessage());
            exitCode = 2;
            return;
        }

        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║                  HINT - Go style checker                      ║");
        log.info("╠══════════════════════════════════════════════════════════════╣");
        log.info("║ Files:          {}", files.size());
        log.info("║ Min confidence: {}", config.getMinConfidence());
        log.info("╚══════════════════════════════════════════════════════════════╝");

        int problemCount = 0;
        int failedFiles = 0;
        for (Path file : files) {
            try {
                byte[] source = Files.readAllBytes(file);
                List<Problem> problems = lintSourceUseCase.lint(file.toString(), config, source);
                for (Problem p : problems) {
                    log.info("{}: {}", p.position().format(), p.text());
                }
                problemCount += problems.size();
            } catch (SourceParseException e) {
                log.error("{}", e.getMessage());
                failedFiles++;
            } catch (IOException e) {
                log.error("Cannot read {}: {}", file, e.getMessage());
                failedFiles++;
            }
        }

        log.info("───────────────────────────────────────────────────────────────");
        log.info(" Problems: {}", problemCount);
        if (failedFiles > 0) {
            log.info(" Files that could not be linted: {}", failedFiles);
        }

        if (failedFiles > 0) {
            exitCode = 2;
        } else if (problemCount > 0) {
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private LintConfig resolveConfig() throws IOException {
        LintConfig base = properties.toLintConfig();
        String configFile = properties.getConfigFile();
        if (configFile == null || configFile.isBlank()) {
            return base;
        }
        return configLoader.load(Path.of(configFile), base);
    }

    /**
     * Expands directories into the .go files below them, in path order. Plain files are taken as given.
     */
    static List<Path> collectGoFiles(List<String> paths) throws IOException {
        List<Path> files = new ArrayList<>();
        for (String p : paths) {
            Path path = Path.of(p);
            if (!Files.isDirectory(path)) {
                if (!Files.exists(path)) {
                    throw new IOException("no such file or directory: " + p);
                }
                files.add(path);
                continue;
            }
            try (Stream<Path> walk = Files.walk(path)) {
                files.addAll(walk
                        .filter(Files::isRegularFile)
                        .filter(f -> f.getFileName().toString().endsWith(".go"))
                        .sorted()
                        .collect(Collectors.toList()));
            }
        }
        return files;
    }
}
