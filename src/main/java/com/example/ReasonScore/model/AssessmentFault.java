package com.example.ReasonScore.model;

/**
 * Raised inside the scoring engine when a chain cannot be assessed.
 * It never crosses the aggregator boundary.
 */
public class AssessmentFault extends RuntimeException {

    public enum Kind {
        MALFORMED_INPUT,
        INTERNAL_COMPUTATION
    }

    private final Kind kind;

    public AssessmentFault(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AssessmentFault(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static AssessmentFault malformed(String message) {
        return new AssessmentFault(Kind.MALFORMED_INPUT, message);
    }

    public static AssessmentFault computation(String message, Throwable cause) {
        return new AssessmentFault(Kind.INTERNAL_COMPUTATION, message, cause);
    }

    public Kind kind() {
        return kind;
    }
}
