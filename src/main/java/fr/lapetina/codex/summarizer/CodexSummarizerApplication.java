package fr.lapetina.codex.summarizer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.codex.summarizer.batch.BatchResult;
import fr.lapetina.codex.summarizer.domain.exception.ConfigurationException;
import fr.lapetina.codex.summarizer.domain.model.SummaryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Main entry point: summarizes the files given on the command line.
 *
 * <pre>
 * java -jar codex-summarizer.jar config.yaml src/Main.java src/Util.java
 * </pre>
 */
public class CodexSummarizerApplication {

    private static final Logger log = LoggerFactory.getLogger(CodexSummarizerApplication.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry("java", "java"),
            Map.entry("kt", "kotlin"),
            Map.entry("py", "python"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("go", "go"),
            Map.entry("rs", "rust"),
            Map.entry("rb", "ruby"),
            Map.entry("php", "php"),
            Map.entry("cs", "csharp"),
            Map.entry("c", "c"),
            Map.entry("h", "c"),
            Map.entry("cpp", "cpp"),
            Map.entry("hpp", "cpp"),
            Map.entry("sh", "bash"),
            Map.entry("sql", "sql"),
            Map.entry("css", "css"),
            Map.entry("dart", "dart")
    );

    private final SummarizerFactory factory;

    public CodexSummarizerApplication(SummarizerFactory factory) {
        this.factory = factory;
    }

    /**
     * Reads the files, runs the batch and returns its result.
     *
     * @throws IOException if a file cannot be read
     */
    public BatchResult run(List<Path> files) throws IOException {
        List<SummaryRequest> units = new ArrayList<>(files.size());
        for (Path file : files) {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            units.add(SummaryRequest.ofFile(file.toString(), detectLanguage(file), content));
        }
        log.info("Summarizing files: count={}, chain={}", units.size(), factory.getChain());
        return factory.getParallelSummarizer().summarize(units);
    }

    /**
     * Writes the master summary and the per-unit errors to {@code out}.
     */
    public void report(BatchResult result, PrintStream out) {
        out.println(result.masterSummary());
        if (!result.errors().isEmpty()) {
            out.println();
            out.println("Errors:");
            result.errors().forEach(error -> out.println("- " + error));
        }

        try {
            log.info("Usage: {}", MAPPER.writeValueAsString(result.usage()));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize usage snapshot: {}", e.getMessage());
        }
        if (factory.getConfig().getMetrics().isEnabled()) {
            log.debug("Metrics:\n{}", factory.getMetricsRegistry().scrape());
        }
    }

    static String detectLanguage(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "unknown";
        }
        return LANGUAGES.getOrDefault(name.substring(dot + 1).toLowerCase(Locale.ROOT), "unknown");
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: codex-summarizer <config.yaml> <file>...");
            System.exit(2);
        }

        String configPath = args[0];
        List<Path> files = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            files.add(Paths.get(args[i]));
        }

        SummarizerFactory factory;
        try {
            factory = SummarizerFactory.create(configPath);
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            System.exit(1);
            return;
        }

        try (factory) {
            CodexSummarizerApplication app = new CodexSummarizerApplication(factory);
            app.report(app.run(files), System.out);
        } catch (IOException e) {
            log.error("Failed to read input files", e);
            System.exit(1);
        }
    }
}
