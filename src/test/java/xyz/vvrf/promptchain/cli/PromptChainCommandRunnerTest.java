package xyz.vvrf.promptchain.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.vvrf.promptchain.execution.StandardChainResolver;
import xyz.vvrf.promptchain.execution.WorkerPool;
import xyz.vvrf.promptchain.generation.TextGenerator;
import xyz.vvrf.promptchain.parser.ChainParser;
import xyz.vvrf.promptchain.report.RunArtifactWriter;
import xyz.vvrf.promptchain.report.TraceLogFormatter;
import xyz.vvrf.promptchain.service.PromptChainService;
import xyz.vvrf.promptchain.test.util.RecordingTextGenerator;
import xyz.vvrf.promptchain.test.util.TestChains;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class PromptChainCommandRunnerTest {

    @TempDir
    Path tempDir;

    private WorkerPool workerPool;
    private ByteArrayOutputStream console;
    private Path outputDir;

    @BeforeEach
    void setUp() {
        workerPool = WorkerPool.boundedElastic("cli-test", 2);
        console = new ByteArrayOutputStream();
        outputDir = tempDir.resolve("out");
    }

    @AfterEach
    void tearDown() {
        workerPool.dispose();
    }

    private PromptChainCommandRunner runner(TextGenerator generator) {
        PromptChainService service = new PromptChainService(new ChainParser(),
                new StandardChainResolver(generator, workerPool), 10);
        return new PromptChainCommandRunner(service, new RunArtifactWriter(outputDir, new TraceLogFormatter()), null,
                new PrintStream(console, true));
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private List<String> outputFiles() throws IOException {
        if (!Files.exists(outputDir)) {
            return Collections.emptyList();
        }
        try (Stream<Path> files = Files.list(outputDir)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    private String console() {
        return new String(console.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    void successfulRunWritesLogAndOutputFiles() throws IOException {
        Path chain = write("chain.txt", TestChains.SUMMARY_KEYWORDS);
        Path input = write("article.txt", "X");

        int code = runner(RecordingTextGenerator.echo()).execute(Arrays.asList(chain.toString(), input.toString()), false);

        assertThat(code).isEqualTo(PromptChainCommandRunner.EXIT_OK);
        List<String> files = outputFiles();
        assertThat(files).hasSize(2);
        assertThat(files).anyMatch(f -> f.endsWith("_article.txt_promptchain.log"));
        String outputName = files.stream().filter(f -> f.endsWith("_article.txt_output.txt")).findFirst().orElseThrow();
        assertThat(new String(Files.readAllBytes(outputDir.resolve(outputName)), StandardCharsets.UTF_8))
                .isEqualTo("R(S=R(Summarize: X) K=R(Keywords of: X))");
        assertThat(console()).contains("PROCESSING COMPLETE", "Full log written to:", "Final output written to:");
    }

    @Test
    void debugFlagWithoutLoggingSystemStillRuns() throws IOException {
        Path chain = write("chain.txt", TestChains.STATIC_STYLE_GUIDE);
        Path input = write("input.txt", "hello");

        int code = runner(RecordingTextGenerator.echo()).execute(Arrays.asList(chain.toString(), input.toString()), true);

        assertThat(code).isEqualTo(PromptChainCommandRunner.EXIT_OK);
    }

    @Test
    void wrongArgumentCountPrintsUsage() {
        int code = runner(RecordingTextGenerator.echo()).execute(Collections.singletonList("only-one"), false);

        assertThat(code).isEqualTo(PromptChainCommandRunner.EXIT_ERROR);
        assertThat(console()).contains(PromptChainCommandRunner.USAGE);
    }

    @Test
    void unreadableFileFails() throws IOException {
        Path chain = write("chain.txt", TestChains.SUMMARY_KEYWORDS);

        int code = runner(RecordingTextGenerator.echo())
                .execute(Arrays.asList(chain.toString(), tempDir.resolve("missing.txt").toString()), false);

        assertThat(code).isEqualTo(PromptChainCommandRunner.EXIT_ERROR);
        assertThat(console()).contains("Could not read a file");
        assertThat(outputFiles()).isEmpty();
    }

    @Test
    void invalidChainFailsBeforeAnyGeneration() throws IOException {
        RecordingTextGenerator generator = RecordingTextGenerator.echo();
        Path chain = write("chain.txt", TestChains.CYCLE);
        Path input = write("input.txt", "X");

        int code = runner(generator).execute(Arrays.asList(chain.toString(), input.toString()), false);

        assertThat(code).isEqualTo(PromptChainCommandRunner.EXIT_ERROR);
        assertThat(generator.callCount()).isZero();
        assertThat(outputFiles()).isEmpty();
        assertThat(console()).contains("Error:");
    }

    @Test
    void failedRunWritesOnlyTheLog() throws IOException {
        RecordingTextGenerator generator = RecordingTextGenerator.builder().failWhen(p -> p.startsWith("Keywords")).build();
        Path chain = write("chain.txt", TestChains.SUMMARY_KEYWORDS);
        Path input = write("input.txt", "X");

        int code = runner(generator).execute(Arrays.asList(chain.toString(), input.toString()), false);

        assertThat(code).isEqualTo(PromptChainCommandRunner.EXIT_ERROR);
        assertThat(outputFiles()).hasSize(1).allMatch(f -> f.endsWith("_promptchain.log"));
        assertThat(console()).contains("Processing failed", "[[keywords]]");
    }
}
