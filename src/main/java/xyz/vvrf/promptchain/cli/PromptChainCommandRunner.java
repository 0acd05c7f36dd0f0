package xyz.vvrf.promptchain.cli;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;
import xyz.vvrf.promptchain.core.ChainNames;
import xyz.vvrf.promptchain.core.ExecutionReport;
import xyz.vvrf.promptchain.core.PromptNode;
import xyz.vvrf.promptchain.exception.ChainDefinitionException;
import xyz.vvrf.promptchain.graph.DependencyGraph;
import xyz.vvrf.promptchain.report.RunArtifactWriter;
import xyz.vvrf.promptchain.service.CompiledChain;
import xyz.vvrf.promptchain.service.PromptChainService;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;

/**
 * 读取链文件和输入文件，运行整条链并写入产物。
 * 退出码：0 成功；1 参数、读取、定义错误或运行失败。
 *
 * @author Refactored
 */
@Slf4j
@Component
public class PromptChainCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final String USAGE = "Usage: prompt-chain <chain-file> <input-file> [--debug]";

    private final PromptChainService service;
    private final RunArtifactWriter artifactWriter;
    private final ObjectProvider<LoggingSystem> loggingSystem;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    public PromptChainCommandRunner(PromptChainService service,
                                    RunArtifactWriter artifactWriter,
                                    ObjectProvider<LoggingSystem> loggingSystem) {
        this(service, artifactWriter, loggingSystem, System.out);
    }

    PromptChainCommandRunner(PromptChainService service,
                             RunArtifactWriter artifactWriter,
                             ObjectProvider<LoggingSystem> loggingSystem,
                             PrintStream out) {
        this.service = Objects.requireNonNull(service, "PromptChainService 不能为空");
        this.artifactWriter = Objects.requireNonNull(artifactWriter, "RunArtifactWriter 不能为空");
        this.loggingSystem = loggingSystem;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getNonOptionArgs(), args.containsOption("debug"));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(List<String> positional, boolean debug) {
        if (positional.size() != 2) {
            log.error("Expected 2 positional arguments, got {}. {}", positional.size(), USAGE);
            out.println(USAGE);
            return EXIT_ERROR;
        }
        if (debug) {
            enableDebugLogging();
        }

        Path chainFile = Paths.get(positional.get(0));
        Path inputFile = Paths.get(positional.get(1));
        String chainText;
        String inputText;
        try {
            chainText = new String(Files.readAllBytes(chainFile), StandardCharsets.UTF_8);
            inputText = new String(Files.readAllBytes(inputFile), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Could not read input files: {}", e.toString());
            out.println("Error: Could not read a file - " + e.getMessage());
            return EXIT_ERROR;
        }

        log.info("Parsing prompt chain file '{}' and resolving dependencies...", chainFile);
        CompiledChain compiled;
        try {
            compiled = service.compile(chainText);
        } catch (ChainDefinitionException e) {
            log.error("Invalid prompt chain '{}': {}", chainFile, e.getMessage());
            out.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
        if (debug) {
            logDefinitions(compiled);
        }
        log.info("Execution levels determined: {}", compiled.getGraph().getLevels());

        ExecutionReport report = service.run(compiled, inputText, null, null).block();
        if (report == null) {
            log.error("Resolver completed without a report.");
            return EXIT_ERROR;
        }

        RunArtifactWriter.RunArtifacts artifacts;
        try {
            artifacts = artifactWriter.write(report, inputFile.getFileName().toString());
        } catch (IOException e) {
            log.error("[RequestId: {}] Error writing run artifacts: {}", report.getRequestId(), e.toString());
            out.println("Error writing output files: " + e.getMessage());
            return EXIT_ERROR;
        }

        if (!report.isSuccess()) {
            out.println();
            out.println("Processing failed. No output file was written.");
            report.getFailures().forEach((name, error) ->
                    out.println("  " + ChainNames.placeholder(name) + ": " + error.getMessage()));
            out.println("Full log written to:    " + artifacts.getLogFile());
            return EXIT_ERROR;
        }

        out.println();
        out.println("===================================");
        out.println("        PROCESSING COMPLETE");
        out.println("===================================");
        out.println();
        out.println("Full log written to:    " + artifacts.getLogFile());
        artifacts.outputFile().ifPresent(p -> out.println("Final output written to: " + p));
        return EXIT_OK;
    }

    private void enableDebugLogging() {
        LoggingSystem system = (loggingSystem != null) ? loggingSystem.getIfAvailable() : null;
        if (system == null) {
            log.warn("--debug requested but no LoggingSystem is available.");
            return;
        }
        system.setLogLevel("xyz.vvrf.promptchain", LogLevel.DEBUG);
        log.debug("Debug logging enabled for xyz.vvrf.promptchain.");
    }

    private void logDefinitions(CompiledChain compiled) {
        DependencyGraph graph = compiled.getGraph();
        log.debug("--- DEBUG: Parsed Prompt Definitions ---");
        for (PromptNode node : compiled.getDefinition().getNodes().values()) {
            log.debug("  {} = {}", ChainNames.placeholder(node.getName()), node.getTemplate());
        }
        log.debug("--- DEBUG: Dependency Graph ---");
        for (PromptNode node : compiled.getDefinition().getNodes().values()) {
            log.debug("  '{}' depends on: {} (depth {}, {})", node.getName(), graph.getDependencies(node.getName()),
                    graph.getDepth(node.getName()), node.getKind());
        }
        if (!graph.getDeadNodes().isEmpty()) {
            log.debug("  Unreferenced nodes (never dispatched): {}", graph.getDeadNodes());
        }
    }
}
