package org.puneet.smpso.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

import org.puneet.smpso.algorithm.SmpsoParameters;
import org.puneet.smpso.exceptions.SwarmOptimizationException;
import org.puneet.smpso.exceptions.SwarmOptimizationException.ErrorCode;
import org.puneet.smpso.problem.ConvexBiObjectiveProblem;
import org.puneet.smpso.problem.FloatProblem;
import org.puneet.smpso.problem.ZDT1;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads run configuration from a properties file on the classpath.
 *
 * <p>Algorithm keys ({@code smpso.*}) override the defaults of
 * {@link SmpsoParameters}; missing keys keep the default. Run keys
 * ({@code run.*}) select the problem, evaluator threads, output file and
 * progress logging frequency.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-10
 */
public class SmpsoConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(SmpsoConfigLoader.class);

    public static final String DEFAULT_CONFIG_FILE = "smpso.properties";

    public static final String SWARM_SIZE_KEY = "smpso.swarm.size";
    public static final String MAX_EVALUATIONS_KEY = "smpso.max.evaluations";
    public static final String ARCHIVE_SIZE_KEY = "smpso.archive.size";
    public static final String MAX_COMPUTING_TIME_KEY = "smpso.max.computing.time.ms";
    public static final String SEED_KEY = "smpso.seed";
    public static final String C1_MIN_KEY = "smpso.c1.min";
    public static final String C1_MAX_KEY = "smpso.c1.max";
    public static final String C2_MIN_KEY = "smpso.c2.min";
    public static final String C2_MAX_KEY = "smpso.c2.max";
    public static final String MIN_WEIGHT_KEY = "smpso.weight.min";
    public static final String MAX_WEIGHT_KEY = "smpso.weight.max";
    public static final String CHANGE_VELOCITY_1_KEY = "smpso.change.velocity1";
    public static final String CHANGE_VELOCITY_2_KEY = "smpso.change.velocity2";

    public static final String PROBLEM_KEY = "run.problem";
    public static final String PROBLEM_VARIABLES_KEY = "run.problem.variables";
    public static final String EVALUATOR_THREADS_KEY = "run.evaluator.threads";
    public static final String OUTPUT_FILE_KEY = "run.output.file";
    public static final String PROGRESS_FREQUENCY_KEY = "run.progress.frequency";

    private final Properties config;

    /**
     * Loads the default configuration resource.
     *
     * @throws SwarmOptimizationException if the resource is missing or unreadable
     */
    public SmpsoConfigLoader() throws SwarmOptimizationException {
        this(DEFAULT_CONFIG_FILE);
    }

    /**
     * Loads the named configuration resource.
     *
     * @param resourceName classpath resource name
     * @throws SwarmOptimizationException if the resource is missing or unreadable
     */
    public SmpsoConfigLoader(String resourceName) throws SwarmOptimizationException {
        this.config = loadConfiguration(resourceName);
    }

    /**
     * Uses already loaded properties.
     */
    public SmpsoConfigLoader(Properties properties) {
        this.config = new Properties();
        this.config.putAll(properties);
    }

    private Properties loadConfiguration(String resourceName) throws SwarmOptimizationException {
        Properties props = new Properties();

        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                throw new SwarmOptimizationException(ErrorCode.CONFIGURATION_NOT_FOUND,
                    "Configuration file " + resourceName + " not found in classpath", "Resource: " + resourceName);
            }

            props.load(inputStream);
            logger.info("Successfully loaded configuration from {}", resourceName);

        } catch (IOException e) {
            throw new SwarmOptimizationException(ErrorCode.CONFIGURATION_LOAD_FAILURE,
                "Failed to load configuration from " + resourceName, e);
        }

        return props;
    }

    /**
     * Builds validated algorithm parameters.
     *
     * @return parameters with every configured override applied
     * @throws SwarmOptimizationException if a value is malformed or out of range
     */
    public SmpsoParameters loadParameters() throws SwarmOptimizationException {
        SmpsoParameters parameters = new SmpsoParameters();

        applyInt(SWARM_SIZE_KEY, parameters::setSwarmSize);
        applyInt(MAX_EVALUATIONS_KEY, parameters::setMaxEvaluations);
        applyInt(ARCHIVE_SIZE_KEY, parameters::setArchiveSize);
        applyLong(MAX_COMPUTING_TIME_KEY, parameters::setMaxComputingTimeMillis);
        applyLong(SEED_KEY, parameters::setSeed);
        applyDouble(C1_MIN_KEY, parameters::setC1Min);
        applyDouble(C1_MAX_KEY, parameters::setC1Max);
        applyDouble(C2_MIN_KEY, parameters::setC2Min);
        applyDouble(C2_MAX_KEY, parameters::setC2Max);
        applyDouble(MIN_WEIGHT_KEY, parameters::setMinWeight);
        applyDouble(MAX_WEIGHT_KEY, parameters::setMaxWeight);
        applyDouble(CHANGE_VELOCITY_1_KEY, parameters::setChangeVelocity1);
        applyDouble(CHANGE_VELOCITY_2_KEY, parameters::setChangeVelocity2);

        try {
            parameters.validate();
        } catch (IllegalArgumentException e) {
            throw SwarmOptimizationException.invalidParameter("smpso.*", parameters, e);
        }

        logger.info("Loaded {}", parameters);
        return parameters;
    }

    /**
     * Creates the configured problem instance.
     *
     * @throws SwarmOptimizationException if the problem name is unknown or the
     *         variable count is invalid
     */
    public FloatProblem createProblem() throws SwarmOptimizationException {
        String name = config.getProperty(PROBLEM_KEY, "ZDT1").trim();
        int variables = getInt(PROBLEM_VARIABLES_KEY, ZDT1.DEFAULT_NUMBER_OF_VARIABLES);

        try {
            switch (name.toLowerCase(Locale.ROOT)) {
                case "zdt1":
                    return new ZDT1(variables);
                case "convexbiobjective":
                case "convex":
                    return new ConvexBiObjectiveProblem(variables);
                default:
                    throw SwarmOptimizationException.unknownProblem(name);
            }
        } catch (IllegalArgumentException e) {
            throw SwarmOptimizationException.invalidParameter(PROBLEM_VARIABLES_KEY, variables, e);
        }
    }

    /**
     * @return evaluator thread count; 1 means sequential evaluation
     */
    public int getEvaluatorThreads() throws SwarmOptimizationException {
        int threads = getInt(EVALUATOR_THREADS_KEY, 1);
        if (threads <= 0) {
            throw SwarmOptimizationException.invalidParameter(EVALUATOR_THREADS_KEY, threads,
                new IllegalArgumentException("Thread count must be positive"));
        }
        return threads;
    }

    public Path getOutputFile() {
        return Paths.get(config.getProperty(OUTPUT_FILE_KEY, "results/front.csv").trim());
    }

    public int getProgressFrequency() throws SwarmOptimizationException {
        int frequency = getInt(PROGRESS_FREQUENCY_KEY, 10);
        if (frequency <= 0) {
            throw SwarmOptimizationException.invalidParameter(PROGRESS_FREQUENCY_KEY, frequency,
                new IllegalArgumentException("Frequency must be positive"));
        }
        return frequency;
    }

    public String getProperty(String key) {
        return config.getProperty(key);
    }

    // ===================================================================================
    // PARSING HELPERS
    // ===================================================================================

    @FunctionalInterface
    private interface IntSetter {
        void set(int value);
    }

    @FunctionalInterface
    private interface LongSetter {
        void set(long value);
    }

    @FunctionalInterface
    private interface DoubleSetter {
        void set(double value);
    }

    private int getInt(String key, int defaultValue) throws SwarmOptimizationException {
        String value = config.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw SwarmOptimizationException.invalidParameter(key, value, e);
        }
    }

    private void applyInt(String key, IntSetter setter) throws SwarmOptimizationException {
        String value = config.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return;
        }
        try {
            setter.set(Integer.parseInt(value.trim()));
        } catch (IllegalArgumentException e) {
            throw SwarmOptimizationException.invalidParameter(key, value, e);
        }
    }

    private void applyLong(String key, LongSetter setter) throws SwarmOptimizationException {
        String value = config.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return;
        }
        try {
            setter.set(Long.parseLong(value.trim()));
        } catch (IllegalArgumentException e) {
            throw SwarmOptimizationException.invalidParameter(key, value, e);
        }
    }

    private void applyDouble(String key, DoubleSetter setter) throws SwarmOptimizationException {
        String value = config.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return;
        }
        try {
            setter.set(Double.parseDouble(value.trim()));
        } catch (IllegalArgumentException e) {
            throw SwarmOptimizationException.invalidParameter(key, value, e);
        }
    }
}
