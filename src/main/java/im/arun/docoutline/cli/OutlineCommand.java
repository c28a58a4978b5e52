package im.arun.docoutline.cli;

import im.arun.docoutline.config.ConfigLoader;
import im.arun.docoutline.config.OutlineConfig;
import im.arun.docoutline.service.BatchProcessor;
import im.arun.docoutline.service.OutlineService;
import im.arun.docoutline.util.ExecutorProvider;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Command(
    name = "outline",
    description = "Write {title, outline} JSON for a PDF or every PDF in a directory",
    mixinStandardHelpOptions = true
)
public class OutlineCommand implements Callable<Integer> {

    @Option(names = {"--input"}, description = "PDF file or directory of PDFs", required = true)
    private String input;

    @Option(names = {"--output"}, description = "Output directory", defaultValue = "output")
    private String output;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--trace"}, description = "Write a per-document decision trace")
    private boolean trace;

    @Option(names = {"--no-ocr"}, description = "Skip OCR for pages without a text layer")
    private boolean noOcr;

    @Option(names = {"--timeout-seconds"}, description = "Per-document timeout", defaultValue = "60")
    private long timeoutSeconds;

    @Option(names = {"--workers"}, description = "Documents processed in parallel (default: one per processor)",
        defaultValue = "0")
    private int workers;

    @Override
    public Integer call() throws IOException {
        Path inputPath = Paths.get(input);
        if (!Files.exists(inputPath)) {
            System.err.println("Error: input not found: " + input);
            return 1;
        }
        List<Path> pdfs = listPdfs(inputPath);
        if (pdfs.isEmpty()) {
            System.err.println("Error: no PDF files in " + input);
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        if (trace) {
            overrides.put("trace", true);
        }
        if (noOcr) {
            overrides.put("ocr", false);
        }
        OutlineConfig config = new ConfigLoader(configPath).load(overrides);

        System.out.println("DocOutline - " + pdfs.size() + " document(s)");
        BatchProcessor processor = new BatchProcessor(new OutlineService(config), ExecutorProvider.getExecutor(workers));
        BatchProcessor.BatchReport report = processor.process(pdfs, Paths.get(output), Duration.ofSeconds(timeoutSeconds));

        report.getWritten().forEach(path -> System.out.println("Wrote " + path));
        report.getFailures().forEach((pdf, reason) -> System.err.println("Failed " + pdf.getFileName() + ": " + reason));
        return 0;
    }

    static List<Path> listPdfs(Path input) throws IOException {
        if (!Files.isDirectory(input)) {
            return isPdf(input) ? List.of(input) : List.of();
        }
        try (Stream<Path> files = Files.list(input)) {
            return files.filter(Files::isRegularFile)
                .filter(OutlineCommand::isPdf)
                .sorted()
                .collect(Collectors.toList());
        }
    }

    private static boolean isPdf(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }
}
