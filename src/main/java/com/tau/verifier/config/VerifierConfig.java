package com.tau.verifier.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

/**
 * Settings for translation output, the prover, the feedback loop, the oracle and the proof cache.
 *
 * Values come from {@code tau-verifier.properties} on the classpath and can be overridden
 * with system properties of the same name. The oracle API key is read from the
 * {@code ANTHROPIC_API_KEY} environment variable unless set explicitly.
 */
public class VerifierConfig {

    private static final Logger logger = LoggerFactory.getLogger(VerifierConfig.class);

    public static final String RESOURCE_NAME = "tau-verifier.properties";
    public static final String API_KEY_ENV = "ANTHROPIC_API_KEY";

    private String proverCommand = "why3";
    private String proverId = "Alt-Ergo,2.6.2";
    private int proverTimeoutSeconds = 10;

    private int maxRounds = 3;
    private boolean classifyEveryRound = false;

    private Path outputDirectory = Paths.get("why_out");
    private Path proofsDirectory = Paths.get("proofs");
    private int proofsMaxAgeDays = 365;

    private String oracleEndpoint = "https://api.anthropic.com/v1/messages";
    private String oracleModel = "claude-3-5-haiku-20241022";
    private int oracleMaxTokens = 600;
    private double oracleTemperature = 0.2;
    private int oracleTimeoutSeconds = 60;
    private String apiKey;

    /**
     * Loads the classpath defaults, system property overrides and the API key from the environment.
     */
    public static VerifierConfig load() {
        Properties properties = new Properties();
        try (InputStream in = VerifierConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}, using built-in defaults", RESOURCE_NAME, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith("tau.")) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        VerifierConfig config = fromProperties(properties);
        String key = System.getenv(API_KEY_ENV);
        if (key != null && !key.isBlank()) {
            config.setApiKey(key);
        }
        return config;
    }

    /**
     * Builds a configuration from explicit properties; unset keys keep their defaults.
     */
    public static VerifierConfig fromProperties(Properties p) {
        VerifierConfig c = new VerifierConfig();
        c.proverCommand = p.getProperty("tau.prover.command", c.proverCommand);
        c.proverId = p.getProperty("tau.prover.id", c.proverId);
        c.proverTimeoutSeconds = intValue(p, "tau.prover.timeout-seconds", c.proverTimeoutSeconds);
        c.maxRounds = intValue(p, "tau.feedback.max-rounds", c.maxRounds);
        c.classifyEveryRound = Boolean.parseBoolean(
                p.getProperty("tau.feedback.classify-every-round", String.valueOf(c.classifyEveryRound)));
        c.outputDirectory = Paths.get(p.getProperty("tau.output.directory", c.outputDirectory.toString()));
        c.proofsDirectory = Paths.get(p.getProperty("tau.proofs.directory", c.proofsDirectory.toString()));
        c.proofsMaxAgeDays = intValue(p, "tau.proofs.max-age-days", c.proofsMaxAgeDays);
        c.oracleEndpoint = p.getProperty("tau.oracle.endpoint", c.oracleEndpoint);
        c.oracleModel = p.getProperty("tau.oracle.model", c.oracleModel);
        c.oracleMaxTokens = intValue(p, "tau.oracle.max-tokens", c.oracleMaxTokens);
        c.oracleTimeoutSeconds = intValue(p, "tau.oracle.timeout-seconds", c.oracleTimeoutSeconds);
        String temperature = p.getProperty("tau.oracle.temperature");
        if (temperature != null) {
            try {
                c.oracleTemperature = Double.parseDouble(temperature.trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid tau.oracle.temperature: {}", temperature);
            }
        }
        return c;
    }

    private static int intValue(Properties p, String key, int defaultValue) {
        String value = p.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid {}: {}", key, value);
            return defaultValue;
        }
    }

    public String getProverCommand() {
        return proverCommand;
    }

    public VerifierConfig setProverCommand(String proverCommand) {
        this.proverCommand = proverCommand;
        return this;
    }

    public String getProverId() {
        return proverId;
    }

    public VerifierConfig setProverId(String proverId) {
        this.proverId = proverId;
        return this;
    }

    public int getProverTimeoutSeconds() {
        return proverTimeoutSeconds;
    }

    public VerifierConfig setProverTimeoutSeconds(int proverTimeoutSeconds) {
        this.proverTimeoutSeconds = proverTimeoutSeconds;
        return this;
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    public VerifierConfig setMaxRounds(int maxRounds) {
        this.maxRounds = maxRounds;
        return this;
    }

    /**
     * Whether bug classification runs after every failed round instead of only the first.
     */
    public boolean isClassifyEveryRound() {
        return classifyEveryRound;
    }

    public VerifierConfig setClassifyEveryRound(boolean classifyEveryRound) {
        this.classifyEveryRound = classifyEveryRound;
        return this;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public VerifierConfig setOutputDirectory(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
        return this;
    }

    public Path getProofsDirectory() {
        return proofsDirectory;
    }

    public VerifierConfig setProofsDirectory(Path proofsDirectory) {
        this.proofsDirectory = proofsDirectory;
        return this;
    }

    public int getProofsMaxAgeDays() {
        return proofsMaxAgeDays;
    }

    public Duration getProofsMaxAge() {
        return Duration.ofDays(proofsMaxAgeDays);
    }

    public VerifierConfig setProofsMaxAgeDays(int proofsMaxAgeDays) {
        this.proofsMaxAgeDays = proofsMaxAgeDays;
        return this;
    }

    public String getOracleEndpoint() {
        return oracleEndpoint;
    }

    public VerifierConfig setOracleEndpoint(String oracleEndpoint) {
        this.oracleEndpoint = oracleEndpoint;
        return this;
    }

    public String getOracleModel() {
        return oracleModel;
    }

    public VerifierConfig setOracleModel(String oracleModel) {
        this.oracleModel = oracleModel;
        return this;
    }

    public int getOracleMaxTokens() {
        return oracleMaxTokens;
    }

    public VerifierConfig setOracleMaxTokens(int oracleMaxTokens) {
        this.oracleMaxTokens = oracleMaxTokens;
        return this;
    }

    public double getOracleTemperature() {
        return oracleTemperature;
    }

    public VerifierConfig setOracleTemperature(double oracleTemperature) {
        this.oracleTemperature = oracleTemperature;
        return this;
    }

    public int getOracleTimeoutSeconds() {
        return oracleTimeoutSeconds;
    }

    public VerifierConfig setOracleTimeoutSeconds(int oracleTimeoutSeconds) {
        this.oracleTimeoutSeconds = oracleTimeoutSeconds;
        return this;
    }

    public String getApiKey() {
        return apiKey;
    }

    public VerifierConfig setApiKey(String apiKey) {
        this.apiKey = apiKey;
        return this;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
