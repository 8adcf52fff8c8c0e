package com.example.teambalancer.exception;

import com.example.teambalancer.generation.ErrorKind;

import java.util.List;

/**
 * Raised by the fail-fast checks of the generation pipeline. The orchestrator
 * converts it into a {@code GenerationResult.Failure}; it never escapes
 * {@code TeamGenerator#generate}.
 */
public class TeamGenerationException extends RuntimeException {

    private final ErrorKind errorKind;
    private final String suggestion;
    private final List<String> parameters;

    public TeamGenerationException(ErrorKind errorKind) {
        this(errorKind, List.of());
    }

    public TeamGenerationException(ErrorKind errorKind, List<String> parameters) {
        super(formatMessage(errorKind.getMessage(), parameters));
        this.errorKind = errorKind;
        this.suggestion = errorKind.getSuggestion();
        this.parameters = List.copyOf(parameters);
    }

    public TeamGenerationException(ErrorKind errorKind, String message, List<String> parameters) {
        super(formatMessage(message, parameters));
        this.errorKind = errorKind;
        this.suggestion = errorKind.getSuggestion();
        this.parameters = List.copyOf(parameters);
    }

    private static String formatMessage(String message, List<String> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return message;
        }
        return message + ": " + String.join(", ", parameters);
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getSuggestion() {
        return suggestion;
    }

    public List<String> getParameters() {
        return parameters;
    }
}
