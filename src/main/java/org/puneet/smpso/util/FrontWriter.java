package org.puneet.smpso.util;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.puneet.smpso.exceptions.SwarmOptimizationException;
import org.puneet.smpso.exceptions.SwarmOptimizationException.ErrorCode;
import org.puneet.smpso.solution.FloatSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a Pareto front approximation to CSV, one row per solution with the
 * decision variables first ({@code x0..xn-1}) and the objectives after
 * ({@code f0..fm-1}).
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-10
 */
public class FrontWriter {

    private static final Logger logger = LoggerFactory.getLogger(FrontWriter.class);

    /**
     * Writes the front, replacing any existing file and creating missing
     * parent directories.
     *
     * @param front solutions to write, all with the same shape
     * @param file target path
     * @return number of rows written
     * @throws SwarmOptimizationException if the file cannot be written
     * @throws IllegalArgumentException if the solutions differ in shape
     */
    public int write(List<FloatSolution> front, Path file) throws SwarmOptimizationException {
        Objects.requireNonNull(front, "Front cannot be null");
        Objects.requireNonNull(file, "Output file cannot be null");

        if (front.isEmpty()) {
            logger.warn("Front is empty, writing header-less file {}", file);
        }

        CSVFormat format = front.isEmpty()
            ? CSVFormat.DEFAULT.withRecordSeparator("\n")
            : CSVFormat.DEFAULT.withHeader(header(front.get(0))).withRecordSeparator("\n");

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, format)) {

                int variables = front.isEmpty() ? 0 : front.get(0).getNumberOfVariables();
                int objectives = front.isEmpty() ? 0 : front.get(0).getNumberOfObjectives();

                for (FloatSolution solution : front) {
                    if (solution.getNumberOfVariables() != variables
                        || solution.getNumberOfObjectives() != objectives) {
                        throw new IllegalArgumentException("Front mixes solutions of different shapes");
                    }
                    printer.printRecord(row(solution));
                }
                printer.flush();
            }
        } catch (IOException e) {
            throw new SwarmOptimizationException(ErrorCode.OUTPUT_FAILURE,
                "Failed to write front", "File: " + file, e);
        }

        logger.info("Wrote {} solutions to {}", front.size(), file);
        return front.size();
    }

    private static String[] header(FloatSolution sample) {
        int variables = sample.getNumberOfVariables();
        int objectives = sample.getNumberOfObjectives();
        String[] header = new String[variables + objectives];
        for (int j = 0; j < variables; j++) {
            header[j] = "x" + j;
        }
        for (int k = 0; k < objectives; k++) {
            header[variables + k] = "f" + k;
        }
        return header;
    }

    private static List<Object> row(FloatSolution solution) {
        List<Object> values = new ArrayList<>(solution.getNumberOfVariables() + solution.getNumberOfObjectives());
        for (double v : solution.getVariables()) {
            values.add(v);
        }
        for (double f : solution.getObjectives()) {
            values.add(f);
        }
        return values;
    }
}
