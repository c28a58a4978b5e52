package im.arun.docoutline.cli;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.docoutline.config.ConfigLoader;
import im.arun.docoutline.config.OutlineConfig;
import im.arun.docoutline.model.CollectionJob;
import im.arun.docoutline.model.CollectionResult;
import im.arun.docoutline.ranking.SemanticRanker;
import im.arun.docoutline.service.CollectionJobParser;
import im.arun.docoutline.service.CollectionService;
import im.arun.docoutline.service.OutlineService;
import im.arun.docoutline.util.JsonFiles;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "collection",
    description = "Rank the sections of a document collection against a persona and task",
    mixinStandardHelpOptions = true
)
public class CollectionCommand implements Callable<Integer> {

    @Option(names = {"--job"}, description = "Job description JSON", required = true)
    private String jobPath;

    @Option(names = {"--input"}, description = "Directory holding the job's documents (default: job file directory)")
    private String inputDir;

    @Option(names = {"--output"}, description = "Output JSON file", defaultValue = "output/collection_output.json")
    private String output;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--top"}, description = "Number of sections to extract")
    private Integer top;

    @Option(names = {"--embedding-url"}, description = "OpenAI-compatible embeddings endpoint")
    private String embeddingUrl;

    @Option(names = {"--embedding-model"}, description = "Embedding model name")
    private String embeddingModel;

    @Option(names = {"--api-key"}, description = "Embedding API key (or set OPENAI_API_KEY env var)")
    private String apiKey;

    @Override
    public Integer call() throws IOException {
        Path jobFile = Paths.get(jobPath);
        if (!Files.exists(jobFile)) {
            System.err.println("Error: job file not found: " + jobPath);
            return 1;
        }

        CollectionJob job;
        try {
            JsonNode root = JsonFiles.mapper().readTree(jobFile.toFile());
            job = new CollectionJobParser().parse(root);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error: invalid job file: " + e.getMessage());
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        overrides.put("top_sections", top);
        overrides.put("embedding_url", embeddingUrl);
        overrides.put("embedding_model", embeddingModel);
        overrides.put("api_key", apiKey);
        OutlineConfig config = new ConfigLoader(configPath).load(overrides);

        Path documents = inputDir != null ? Paths.get(inputDir) : jobFile.toAbsolutePath().getParent();
        System.out.println("Persona: " + job.getPersona());
        System.out.println("Task: " + job.getJobToBeDone());

        CollectionService service = new CollectionService(new OutlineService(config),
            SemanticRanker.create(config.getRanking()), config.getRanking().getTopSections());
        CollectionResult result = service.process(job, documents);

        Path outputPath = Paths.get(output);
        JsonFiles.writeAtomically(outputPath, result);
        System.out.println("Output written to: " + outputPath);
        return 0;
    }
}
