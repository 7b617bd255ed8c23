package com.tumorboard;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tumorboard.evidence.MyVariantClient;
import com.tumorboard.llm.LlmService;
import com.tumorboard.llm.completion.CompletionClientFactory;
import com.tumorboard.models.ActionabilityAssessment;
import com.tumorboard.models.ActionabilityTier;
import com.tumorboard.models.GoldStandardEntry;
import com.tumorboard.models.ValidationMetrics;
import com.tumorboard.models.VariantInput;
import com.tumorboard.storage.JsonStorage;
import com.tumorboard.validation.Validator;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command-line front end: {@code assess}, {@code batch}, {@code validate} and {@code version}.
 * Every command returns 0 on success and 1 on a usage or runtime error.
 */
public class TumorBoardCli {

    public static final String VERSION = "0.1.0";

    private static final String USAGE = String.join(System.lineSeparator(),
        "Usage: tumorboard <command> [options]",
        "",
        "Commands:",
        "  assess <gene> <variant> --tumor <type>   Assess a single variant",
        "  batch <input.json> [-o results.json]      Assess variants from a JSON file",
        "  validate <gold_standard.json> [-o file]   Score the model against a gold standard",
        "  version                                   Show version information",
        "",
        "Options:",
        "  -m, --model <id>           LLM model (default " + AppConfig.DEFAULT_MODEL + ")",
        "  -t, --tumor <type>         Tumor type (assess)",
        "  -o, --output <file>        Output JSON file",
        "  -c, --max-concurrent <n>   Maximum concurrent assessments",
        "      --temperature <t>      Sampling temperature",
        "      --max-tokens <n>       Completion token limit",
        "  -v, --verbose              Debug logging");

    private final PrintStream out;
    private final PrintStream err;
    private final Map<String, String> environment;

    public TumorBoardCli(PrintStream out, PrintStream err, Map<String, String> environment) {
        this.out = out;
        this.err = err;
        this.environment = environment;
    }

    public TumorBoardCli() {
        this(System.out, System.err, System.getenv());
    }

    public int run(String[] args) {
        AppConfig config;
        try {
            config = new AppConfig.Builder()
                .environment(environment)
                .parseArgs(args != null ? args : new String[0])
                .build();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return 1;
        }

        String command = config.getCommand();
        if (command == null) {
            err.println(USAGE);
            return 1;
        }
        if ("version".equals(command)) {
            out.println("TumorBoard version " + VERSION);
            return 0;
        }

        try {
            AppLogger.initialize(config.getLogFile(), true, config.isVerbose());
        } catch (Exception e) {
            err.println("Error: could not open log file " + config.getLogFile() + ": " + e.getMessage());
            return 1;
        }

        try {
            switch (command) {
                case "assess":
                    return assess(config);
                case "batch":
                    return batch(config);
                case "validate":
                    return validate(config);
                default:
                    err.println("Error: unknown command '" + command + "'");
                    err.println(USAGE);
                    return 1;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Error: interrupted");
            return 1;
        } catch (Exception e) {
            AppLogger.get().error("Command '" + command + "' failed", e);
            err.println("Error: " + describe(e));
            return 1;
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }

    private int assess(AppConfig config) throws Exception {
        List<String> arguments = config.getArguments();
        if (arguments.size() != 2) {
            err.println("Error: assess requires <gene> <variant>");
            return 1;
        }
        if (config.getTumorType() == null || config.getTumorType().isBlank()) {
            err.println("Error: --tumor is required for assess");
            return 1;
        }
        VariantInput input = new VariantInput(arguments.get(0), arguments.get(1), config.getTumorType());
        out.println("Assessing " + input.getGene() + " " + input.getVariant() + " in " + input.getTumorType() + "...");

        try (AssessmentEngine engine = createEngine(config)) {
            ActionabilityAssessment assessment = engine.assessVariant(input);
            out.println(assessment.toReport());
            if (config.getOutputPath() != null) {
                JsonStorage.writeJson(config.getOutputPath(), assessment);
                out.println("Results saved to " + config.getOutputPath());
            }
        }
        return 0;
    }

    private int batch(AppConfig config) throws Exception {
        if (config.getArguments().size() != 1) {
            err.println("Error: batch requires <input.json>");
            return 1;
        }
        Path inputPath = Paths.get(config.getArguments().get(0));
        List<VariantInput> inputs = JsonStorage.readJsonList(inputPath, VariantInput[].class);
        out.println("Loaded " + inputs.size() + " variants from " + inputPath);

        Path outputPath = config.getOutputPath() != null ? config.getOutputPath() : Paths.get("results.json");
        try (AssessmentEngine engine = createEngine(config)) {
            List<ActionabilityAssessment> assessments =
                engine.batchAssess(inputs, config.getMaxConcurrent(AssessmentEngine.DEFAULT_MAX_CONCURRENT));
            out.println("Successfully assessed " + assessments.size() + "/" + inputs.size() + " variants");

            JsonStorage.writeJson(outputPath, assessments);
            out.println("Results saved to " + outputPath);

            out.println("Tier Distribution:");
            for (Map.Entry<ActionabilityTier, Integer> entry : tierDistribution(assessments).entrySet()) {
                int count = entry.getValue();
                double share = assessments.isEmpty() ? 0.0 : count * 100.0 / assessments.size();
                out.println(String.format(Locale.ROOT, "  %s: %d (%.1f%%)", entry.getKey().getLabel(), count, share));
            }
        }
        return 0;
    }

    private int validate(AppConfig config) throws Exception {
        if (config.getArguments().size() != 1) {
            err.println("Error: validate requires <gold_standard.json>");
            return 1;
        }
        Path goldStandard = Paths.get(config.getArguments().get(0));
        try (AssessmentEngine engine = createEngine(config)) {
            Validator validator = new Validator(engine, JsonStorage.newObjectMapper());
            List<GoldStandardEntry> entries = validator.loadGoldStandard(goldStandard);
            out.println("Validating " + entries.size() + " entries with " + config.getModel() + "...");

            ValidationMetrics metrics =
                validator.validateDataset(entries, config.getMaxConcurrent(Validator.DEFAULT_MAX_CONCURRENT));
            out.println(metrics.toReport());
            if (config.getOutputPath() != null) {
                JsonStorage.writeJson(config.getOutputPath(), metrics);
                out.println("Results saved to " + config.getOutputPath());
            }
        }
        return 0;
    }

    /**
     * Builds the evidence client and LLM service for one invocation.
     */
    protected AssessmentEngine createEngine(AppConfig config) {
        ObjectMapper mapper = JsonStorage.newObjectMapper();
        MyVariantClient evidenceClient =
            new MyVariantClient(mapper, config.getMyVariantBaseUrl(), config.getEvidenceTimeout());
        CompletionClientFactory factory = new CompletionClientFactory(mapper, config);
        LlmService llmService = new LlmService(factory.forModel(config.getModel()), config.getModel(),
            config.getTemperature(), config.getMaxTokens(), null, mapper);
        return new AssessmentEngine(evidenceClient, llmService);
    }

    static Map<ActionabilityTier, Integer> tierDistribution(List<ActionabilityAssessment> assessments) {
        Map<ActionabilityTier, Integer> counts = new LinkedHashMap<>();
        for (ActionabilityAssessment assessment : assessments) {
            counts.merge(assessment.getTier(), 1, Integer::sum);
        }
        Map<ActionabilityTier, Integer> ordered = new LinkedHashMap<>();
        for (ActionabilityTier tier : ActionabilityTier.values()) {
            if (counts.containsKey(tier)) {
                ordered.put(tier, counts.get(tier));
            }
        }
        return ordered;
    }
}
