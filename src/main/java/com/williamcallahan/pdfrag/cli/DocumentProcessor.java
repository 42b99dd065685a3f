package com.williamcallahan.pdfrag.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.williamcallahan.pdfrag.domain.ingestion.IngestionResult;
import com.williamcallahan.pdfrag.domain.ingestion.IngestionStatus;
import com.williamcallahan.pdfrag.domain.retrieval.RetrievalFilter;
import com.williamcallahan.pdfrag.domain.retrieval.RetrievalTrace;
import com.williamcallahan.pdfrag.service.ingestion.DocumentIngestionService;
import com.williamcallahan.pdfrag.service.retrieval.RetrievalService;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point, active with {@code app.cli.enabled=true}.
 *
 * <pre>
 *   ingest &lt;dir|file.pdf&gt; [--force] [--sequential]
 *   delete &lt;filename&gt;
 *   clear
 *   query &lt;text...&gt; [--k=N]
 *   gate &lt;text...&gt;
 * </pre>
 *
 * Results are printed to standard output as JSON.
 */
@Component
@ConditionalOnProperty(prefix = "app.cli", name = "enabled", havingValue = "true")
public class DocumentProcessor implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(DocumentProcessor.class);
    private static final String FORCE_FLAG = "--force";
    private static final String SEQUENTIAL_FLAG = "--sequential";
    private static final String K_FLAG = "--k=";

    private final DocumentIngestionService ingestionService;
    private final RetrievalService retrievalService;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    public DocumentProcessor(
            DocumentIngestionService ingestionService, RetrievalService retrievalService, ObjectMapper objectMapper) {
        this(ingestionService, retrievalService, objectMapper, System.out);
    }

    DocumentProcessor(
            DocumentIngestionService ingestionService,
            RetrievalService retrievalService,
            ObjectMapper objectMapper,
            PrintStream out) {
        this.ingestionService = ingestionService;
        this.retrievalService = retrievalService;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.out = out;
    }

    @Override
    public void run(String... args) throws IOException {
        List<String> arguments = Arrays.stream(args).filter(arg -> !arg.startsWith("--spring.")).toList();
        if (arguments.isEmpty()) {
            printUsage();
            return;
        }
        String command = arguments.get(0);
        List<String> rest = arguments.subList(1, arguments.size());
        switch (command) {
            case "ingest" -> ingest(rest);
            case "delete" -> delete(rest);
            case "clear" -> print(Map.of("deleted", ingestionService.clearIndex()));
            case "query" -> query(rest);
            case "gate" -> print(retrievalService.gatingDecision(joinText(rest)));
            default -> {
                log.warn("Unknown command: {}", command);
                printUsage();
            }
        }
    }

    private void ingest(List<String> args) throws IOException {
        boolean force = args.contains(FORCE_FLAG);
        boolean parallel = !args.contains(SEQUENTIAL_FLAG);
        String target = args.stream().filter(arg -> !arg.startsWith("--")).findFirst().orElse(null);
        if (target == null) {
            printUsage();
            return;
        }
        Path path = Paths.get(target);
        log.info("===============================================");
        log.info("Starting PDF ingestion with deduplication");
        log.info("Target: {} (force={}, parallel={})", path.toAbsolutePath(), force, parallel);
        log.info("===============================================");

        long startTime = System.currentTimeMillis();
        List<IngestionResult> results = path.toFile().isDirectory()
                ? ingestionService.ingestDirectory(path, parallel, force)
                : List.of(ingestionService.ingestDocument(path, force));
        print(results);

        Map<IngestionStatus, Long> summary = new LinkedHashMap<>();
        for (IngestionStatus status : IngestionStatus.values()) {
            summary.put(status, results.stream().filter(result -> result.status() == status).count());
        }
        log.info("Ingestion complete in {}ms: {} success, {} skipped, {} error",
                System.currentTimeMillis() - startTime,
                summary.get(IngestionStatus.SUCCESS),
                summary.get(IngestionStatus.SKIPPED),
                summary.get(IngestionStatus.ERROR));
    }

    private void delete(List<String> args) throws JsonProcessingException {
        if (args.isEmpty()) {
            printUsage();
            return;
        }
        String filename = args.get(0);
        Map<String, Object> outcome = new LinkedHashMap<>();
        outcome.put("filename", filename);
        outcome.put("deleted", ingestionService.deleteDocument(filename));
        print(outcome);
    }

    private void query(List<String> args) throws JsonProcessingException {
        int k = args.stream()
                .filter(arg -> arg.startsWith(K_FLAG))
                .map(arg -> Integer.parseInt(arg.substring(K_FLAG.length())))
                .findFirst()
                .orElse(-1);
        String text = joinText(args);
        RetrievalTrace trace = retrievalService.retrieveWithTrace(
                text, k > 0 ? k : retrievalService.defaultK(), RetrievalFilter.none(), true);
        print(trace);
    }

    private static String joinText(List<String> args) {
        return String.join(" ", args.stream().filter(arg -> !arg.startsWith("--")).toList());
    }

    private void print(Object value) throws JsonProcessingException {
        out.println(objectMapper.writeValueAsString(value));
    }

    private void printUsage() {
        out.println("Usage: ingest <dir|file.pdf> [--force] [--sequential] | delete <filename> | clear"
                + " | query <text> [--k=N] | gate <text>");
    }
}
