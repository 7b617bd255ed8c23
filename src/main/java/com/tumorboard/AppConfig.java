package com.tumorboard;

import com.tumorboard.evidence.MyVariantClient;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Run configuration: command-line options layered over environment variables.
 */
public class AppConfig {

    public static final String DEFAULT_MODEL = "gpt-4o-mini";
    public static final double DEFAULT_TEMPERATURE = 0.1;
    public static final int DEFAULT_MAX_TOKENS = 2000;

    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_OPENAI_BASE_URL = "OPENAI_BASE_URL";
    static final String ENV_ANTHROPIC_API_KEY = "ANTHROPIC_API_KEY";
    static final String ENV_ANTHROPIC_BASE_URL = "ANTHROPIC_BASE_URL";
    static final String ENV_MODEL = "TUMORBOARD_MODEL";
    static final String ENV_MYVARIANT_URL = "TUMORBOARD_MYVARIANT_URL";
    static final String ENV_LOG_FILE = "TUMORBOARD_LOG_FILE";

    private final String command;
    private final List<String> arguments;
    private final String model;
    private final String tumorType;
    private final Path outputPath;
    private final Integer maxConcurrent;
    private final boolean verbose;
    private final double temperature;
    private final int maxTokens;
    private final String openAiApiKey;
    private final String openAiBaseUrl;
    private final String anthropicApiKey;
    private final String anthropicBaseUrl;
    private final String myVariantBaseUrl;
    private final Path logFile;
    private final Duration evidenceTimeout;
    private final Duration completionTimeout;

    private AppConfig(Builder b, Map<String, String> env) {
        this.command = b.command;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(b.arguments));
        this.model = firstNonBlank(b.model, env.get(ENV_MODEL), DEFAULT_MODEL);
        this.tumorType = b.tumorType;
        this.outputPath = b.outputPath;
        this.maxConcurrent = b.maxConcurrent;
        this.verbose = b.verbose;
        this.temperature = b.temperature != null ? b.temperature : DEFAULT_TEMPERATURE;
        this.maxTokens = b.maxTokens != null ? b.maxTokens : DEFAULT_MAX_TOKENS;
        this.openAiApiKey = blankToNull(env.get(ENV_OPENAI_API_KEY));
        this.openAiBaseUrl = blankToNull(env.get(ENV_OPENAI_BASE_URL));
        this.anthropicApiKey = blankToNull(env.get(ENV_ANTHROPIC_API_KEY));
        this.anthropicBaseUrl = blankToNull(env.get(ENV_ANTHROPIC_BASE_URL));
        this.myVariantBaseUrl = firstNonBlank(env.get(ENV_MYVARIANT_URL), MyVariantClient.DEFAULT_BASE_URL);
        String logFileValue = blankToNull(env.get(ENV_LOG_FILE));
        this.logFile = logFileValue != null ? Paths.get(logFileValue) : null;
        this.evidenceTimeout = Duration.ofSeconds(30);
        this.completionTimeout = Duration.ofSeconds(300);
    }

    public String getCommand() {
        return command;
    }

    public List<String> getArguments() {
        return arguments;
    }

    public String getModel() {
        return model;
    }

    public String getTumorType() {
        return tumorType;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    /**
     * Concurrency bound, or the given default when the option was not supplied.
     */
    public int getMaxConcurrent(int defaultValue) {
        return maxConcurrent != null ? maxConcurrent : defaultValue;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public double getTemperature() {
        return temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public String getOpenAiApiKey() {
        return openAiApiKey;
    }

    public String getOpenAiBaseUrl() {
        return openAiBaseUrl;
    }

    public String getAnthropicApiKey() {
        return anthropicApiKey;
    }

    public String getAnthropicBaseUrl() {
        return anthropicBaseUrl;
    }

    public String getMyVariantBaseUrl() {
        return myVariantBaseUrl;
    }

    public Path getLogFile() {
        return logFile;
    }

    public Duration getEvidenceTimeout() {
        return evidenceTimeout;
    }

    public Duration getCompletionTimeout() {
        return completionTimeout;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private String command;
        private final List<String> arguments = new ArrayList<>();
        private String model;
        private String tumorType;
        private Path outputPath;
        private Integer maxConcurrent;
        private boolean verbose;
        private Double temperature;
        private Integer maxTokens;
        private Map<String, String> environment = System.getenv();

        public Builder environment(Map<String, String> environment) {
            this.environment = environment != null ? environment : Collections.emptyMap();
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            if (maxConcurrent < 1) {
                throw new IllegalArgumentException("--max-concurrent must be at least 1");
            }
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        /**
         * Parses {@code <command> [args...] [options]}. Options accept both
         * {@code --name value} and {@code --name=value} forms.
         *
         * @throws IllegalArgumentException on a missing option value or a malformed number
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                String name = arg;
                String inlineValue = null;
                int eq = arg.indexOf('=');
                if (arg.startsWith("--") && eq > 0) {
                    name = arg.substring(0, eq);
                    inlineValue = arg.substring(eq + 1);
                }

                switch (name) {
                    case "--model":
                    case "-m":
                        model = inlineValue != null ? inlineValue : requireValue(args, ++i, name);
                        break;
                    case "--tumor":
                    case "-t":
                        tumorType = inlineValue != null ? inlineValue : requireValue(args, ++i, name);
                        break;
                    case "--output":
                    case "-o":
                        outputPath = Paths.get(inlineValue != null ? inlineValue : requireValue(args, ++i, name));
                        break;
                    case "--max-concurrent":
                    case "-c":
                        maxConcurrent(parseInt(inlineValue != null ? inlineValue : requireValue(args, ++i, name), name));
                        break;
                    case "--temperature":
                        temperature = parseDouble(inlineValue != null ? inlineValue : requireValue(args, ++i, name), name);
                        break;
                    case "--max-tokens":
                        maxTokens = parseInt(inlineValue != null ? inlineValue : requireValue(args, ++i, name), name);
                        break;
                    case "--verbose":
                    case "-v":
                        verbose = true;
                        break;
                    default:
                        if (arg.startsWith("-") && arg.length() > 1) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (command == null) {
                            command = arg;
                        } else {
                            arguments.add(arg);
                        }
                }
            }
            return this;
        }

        public AppConfig build() {
            return new AppConfig(this, environment);
        }

        private static String requireValue(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }

        private static int parseInt(String value, String option) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + option + ": " + value, e);
            }
        }

        private static double parseDouble(String value, String option) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + option + ": " + value, e);
            }
        }
    }
}
