package org.puneet.smpso.exceptions;

import java.io.Serial;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checked exception for failures around an SMPSO run that the caller is
 * expected to handle: loading and validating configuration, resolving the
 * problem to solve and writing results.
 *
 * <p>Each instance carries an {@link ErrorCode}, an optional context string
 * and the time it was raised. Programming errors inside the optimizer itself
 * are reported with the standard unchecked exceptions instead.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-06
 */
public class SwarmOptimizationException extends Exception {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final Logger logger = LoggerFactory.getLogger(SwarmOptimizationException.class);

    /**
     * Error codes for the different kinds of SMPSO failures
     */
    public enum ErrorCode {
        INVALID_PARAMETER("SM001", "Invalid algorithm parameter"),
        CONFIGURATION_NOT_FOUND("SM002", "Configuration resource not found"),
        CONFIGURATION_LOAD_FAILURE("SM003", "Configuration could not be read"),
        UNKNOWN_PROBLEM("SM004", "Unknown problem"),
        OUTPUT_FAILURE("SM005", "Result output failed"),
        UNKNOWN("SM999", "Unknown error");

        private final String code;
        private final String description;

        ErrorCode(String code, String description) {
            this.code = code;
            this.description = description;
        }

        public String getCode() {
            return code;
        }

        public String getDescription() {
            return description;
        }
    }

    private final ErrorCode errorCode;
    private final String context;
    private final LocalDateTime timestamp;

    public SwarmOptimizationException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public SwarmOptimizationException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    public SwarmOptimizationException(ErrorCode errorCode, String message, String context) {
        this(errorCode, message, context, null);
    }

    /**
     * @param errorCode the specific error code
     * @param message the detailed error message
     * @param context additional context, such as a property key or file path
     * @param cause the underlying cause, may be null
     * @throws NullPointerException if errorCode is null
     */
    public SwarmOptimizationException(ErrorCode errorCode, String message, String context, Throwable cause) {
        super(formatMessage(Objects.requireNonNull(errorCode, "Error code cannot be null"), message, context), cause);

        this.errorCode = errorCode;
        this.context = context;
        this.timestamp = LocalDateTime.now();

        logger.debug("SwarmOptimizationException created: [{}] {}", errorCode.getCode(), getMessage());
    }

    /**
     * Creates an exception for a configuration value that fails validation.
     *
     * @param parameterName the property key
     * @param value the rejected value
     * @param cause the validation failure
     */
    public static SwarmOptimizationException invalidParameter(String parameterName, Object value, Throwable cause) {
        String message = String.format("Invalid parameter '%s' with value '%s'", parameterName, value);
        return new SwarmOptimizationException(
            ErrorCode.INVALID_PARAMETER, message, "Parameter: " + parameterName, cause);
    }

    /**
     * Creates an exception for a problem name with no known implementation.
     */
    public static SwarmOptimizationException unknownProblem(String problemName) {
        return new SwarmOptimizationException(
            ErrorCode.UNKNOWN_PROBLEM, String.format("No problem named '%s'", problemName),
            "Problem: " + problemName);
    }

    private static String formatMessage(ErrorCode errorCode, String message, String context) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(errorCode.getCode()).append("] ");
        sb.append(errorCode.getDescription());

        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }

        if (context != null && !context.isEmpty()) {
            sb.append(" | Context: ").append(context);
        }

        return sb.toString();
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return the context string, may be null
     */
    public String getContext() {
        return context;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    /**
     * Configuration errors must be fixed before a run can start; output
     * failures leave a completed run's result intact.
     *
     * @return true if the run result is still usable
     */
    public boolean isRecoverable() {
        return errorCode == ErrorCode.OUTPUT_FAILURE;
    }

    @Override
    public String toString() {
        return String.format("SwarmOptimizationException[code=%s, timestamp=%s]: %s",
            errorCode.getCode(),
            timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
            getMessage());
    }
}
