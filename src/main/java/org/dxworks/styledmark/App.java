package org.dxworks.styledmark;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.styledmark.converter.ConversionException;
import org.dxworks.styledmark.converter.MarkdownConverter;
import org.dxworks.styledmark.model.ConvertedDocument;
import org.dxworks.styledmark.model.StyledText;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar styledmark.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a markdown file or a directory containing markdown files");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("Options are read from styledmark-config.yml in the working directory, if present");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting markdown conversion...");
        System.out.println("Input: " + input.toAbsolutePath());

        StyledmarkConfig config = StyledmarkConfig.load();
        MarkdownConverter converter = new MarkdownConverter(config.getConversionOptions());
        List<Path> files = collectMarkdownFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " markdown files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Converting " + file.getFileName());
                }

                Object result;
                try {
                    result = new ConvertedDocument(file.toString(), convertFile(file, converter));
                    successCount.incrementAndGet();
                } catch (ConversionException e) {
                    result = errorRecord(file, e.rootCause().getMessage(), e.describeChain());
                    reportError(file, e.describeChain());
                    errorCount.incrementAndGet();
                } catch (IOException e) {
                    result = errorRecord(file, e.getMessage(), List.of());
                    reportError(file, List.of(e.getMessage()));
                    errorCount.incrementAndGet();
                }

                try {
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(result));
                        writer.newLine();
                        writer.flush();
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to write result for " + file, e);
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_converted", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Successfully converted: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static List<Path> collectMarkdownFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(MarkdownFileDetector::isMarkdown)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (MarkdownFileDetector.isMarkdown(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            // unreadable files are kept so the conversion reports them
            return true;
        }
    }

    public static StyledText convertFile(Path filePath, MarkdownConverter converter)
            throws IOException, ConversionException {
        String markdown = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (markdown.startsWith("\uFEFF")) {
            markdown = markdown.substring(1);
        }

        return converter.convert(markdown);
    }

    public static StyledText convertFile(Path filePath, StyledmarkConfig config)
            throws IOException, ConversionException {
        return convertFile(filePath, new MarkdownConverter(config.getConversionOptions()));
    }

    private static Map<String, Object> errorRecord(Path file, String error, List<String> causes) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("kind", "error");
        record.put("file", file.toString());
        record.put("error", error);
        record.put("causes", causes);
        return record;
    }

    private static void reportError(Path file, List<String> messages) {
        synchronized (System.err) {
            System.err.println("  Error converting " + file.getFileName() + ":");
            for (String message : messages) {
                System.err.println("    " + message);
            }
        }
    }
}
