package xyz.vvrf.promptchain.report;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.promptchain.core.ExecutionReport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * 将一次运行的产物写入输出目录：
 * 总是写入 {@code {时间戳}_{输入文件名}_promptchain.log}，
 * 仅在运行成功时写入 {@code {时间戳}_{输入文件名}_output.txt}。
 *
 * @author Refactored
 */
@Slf4j
public class RunArtifactWriter {

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    private final Path outputDirectory;
    private final TraceLogFormatter formatter;
    private final Clock clock;

    public RunArtifactWriter(Path outputDirectory, TraceLogFormatter formatter) {
        this(outputDirectory, formatter, Clock.systemDefaultZone());
    }

    public RunArtifactWriter(Path outputDirectory, TraceLogFormatter formatter, Clock clock) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "输出目录不能为空");
        this.formatter = Objects.requireNonNull(formatter, "TraceLogFormatter 不能为空");
        this.clock = Objects.requireNonNull(clock, "Clock 不能为空");
    }

    /**
     * 写入运行产物。
     *
     * @param report        执行报告
     * @param inputFileName 输入文件名 (不含目录)，用于组成产物文件名
     * @return 已写入的文件
     * @throws IOException 创建目录或写入文件失败
     */
    public RunArtifacts write(ExecutionReport report, String inputFileName) throws IOException {
        Objects.requireNonNull(report, "执行报告不能为空");
        Objects.requireNonNull(inputFileName, "输入文件名不能为空");

        Files.createDirectories(outputDirectory);
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);

        Path logFile = outputDirectory.resolve(timestamp + "_" + inputFileName + "_promptchain.log");
        Files.write(logFile, formatter.format(report).getBytes(StandardCharsets.UTF_8));
        log.info("[RequestId: {}][Chain: '{}'] Trace log written to {}", report.getRequestId(), report.getChainName(), logFile);

        Path outputFile = null;
        if (report.isSuccess()) {
            outputFile = outputDirectory.resolve(timestamp + "_" + inputFileName + "_output.txt");
            Files.write(outputFile, report.getOutput().orElse("").getBytes(StandardCharsets.UTF_8));
            log.info("[RequestId: {}][Chain: '{}'] Output written to {}", report.getRequestId(), report.getChainName(), outputFile);
        } else {
            log.warn("[RequestId: {}][Chain: '{}'] Run failed, no output file written.", report.getRequestId(), report.getChainName());
        }
        return new RunArtifacts(logFile, outputFile);
    }

    /**
     * 一次运行写入的文件。
     */
    @Getter
    public static final class RunArtifacts {
        private final Path logFile;
        private final Path outputFile;

        RunArtifacts(Path logFile, Path outputFile) {
            this.logFile = logFile;
            this.outputFile = outputFile;
        }

        public Optional<Path> outputFile() {
            return Optional.ofNullable(outputFile);
        }
    }
}
