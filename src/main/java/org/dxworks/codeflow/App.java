package org.dxworks.codeflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.codeflow.analyzer.FlowAnalyzer;
import org.dxworks.codeflow.dfg.DfgPathFormatter;
import org.dxworks.codeflow.model.FileFlowAnalysis;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar codeflow.jar <input> <output-file>");
            System.err.println("  <input>:       Path to a source file or a source directory");
            System.err.println("  <output-file>: Path to the output file; .txt writes a data-flow report, anything else JSONL");
            System.err.println("Supported languages: Java, Python");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path output = Paths.get(args[1]);
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        boolean textReport = output.getFileName().toString().toLowerCase().endsWith(".txt");

        System.out.println("Starting flow analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        CodeflowConfig config = CodeflowConfig.load();
        FlowAnalyzer analyzer = new FlowAnalyzer(config);
        List<Path> files = collectSourceFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " source files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            if (!textReport) {
                Map<String, Object> runInfo = new HashMap<>();
                runInfo.put("kind", "run");
                runInfo.put("started_at", startTime.toString());
                runInfo.put("input_path", input.toString());
                runInfo.put("total_files", files.size());
                writer.write(MAPPER.writeValueAsString(runInfo));
                writer.newLine();
            }

            // JSONL records are written as they complete; the text report keeps file order
            Stream<Path> fileStream = textReport ? files.stream() : files.parallelStream();
            fileStream.forEach(file -> {
                Optional<Language> langOpt = LanguageDetector.detectLanguage(file);
                if (langOpt.isEmpty()) {
                    return;
                }

                Language language = langOpt.get();
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Analyzing "
                            + language.getName() + ": " + file.getFileName());
                }

                try {
                    FileFlowAnalysis analysis = analyzeFile(file, language, analyzer);
                    String record = textReport
                            ? "File: " + analysis.filePath + "\n" + DfgPathFormatter.formatReport(analysis)
                            : MAPPER.writeValueAsString(analysis);

                    synchronized (writer) {
                        writer.write(record);
                        writer.newLine();
                        writer.flush();
                    }

                    successCount.incrementAndGet();
                } catch (Exception e) {
                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error analyzing " + file.getFileName() + ": " + e.getMessage());
                    }
                    if (!textReport) {
                        writeError(writer, file, language, e);
                    }
                }
            });

            if (!textReport) {
                Instant endTime = Instant.now();
                Map<String, Object> doneInfo = new HashMap<>();
                doneInfo.put("kind", "done");
                doneInfo.put("ended_at", endTime.toString());
                doneInfo.put("files_analyzed", successCount.get());
                doneInfo.put("files_with_errors", errorCount.get());
                doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
                writer.write(MAPPER.writeValueAsString(doneInfo));
                writer.newLine();
            }
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + output.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    private static void writeError(BufferedWriter writer, Path file, Language language, Exception e) {
        Map<String, String> error = new HashMap<>();
        error.put("kind", "error");
        error.put("file", file.toString());
        error.put("language", language.getName());
        error.put("error", e.getMessage());

        try {
            synchronized (writer) {
                writer.write(MAPPER.writeValueAsString(error));
                writer.newLine();
                writer.flush();
            }
        } catch (IOException ioException) {
            System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
        }
    }

    static List<Path> collectSourceFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> LanguageDetector.detectLanguage(p).isPresent())
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (LanguageDetector.detectLanguage(input).isPresent() && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            System.err.println("Warning: could not count lines of " + path + ": " + e.getMessage());
            return true;
        }
    }

    public static FileFlowAnalysis analyzeFile(Path filePath, Language language, FlowAnalyzer analyzer) throws IOException {
        String sourceCode = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }

        return analyzer.analyze(filePath.toString(), sourceCode, language);
    }
}
