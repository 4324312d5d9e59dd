package dev.treebleshooter.engine;

import java.util.List;

/**
 * One problem found while validating a guide. Findings are returned, never thrown.
 */
public record ValidationFinding(
    Severity severity,
    String nodeId, // nullable
    String answerId, // nullable
    String message
) {

    public enum Severity {
        /** The guide must not be executed. */
        ERROR,
        /** Worth fixing, but execution is still safe. */
        WARNING
    }

    static ValidationFinding error(String nodeId, String answerId, String message) {
        return new ValidationFinding(Severity.ERROR, nodeId, answerId, message);
    }

    static ValidationFinding warning(String nodeId, String answerId, String message) {
        return new ValidationFinding(Severity.WARNING, nodeId, answerId, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public static boolean hasErrors(List<ValidationFinding> findings) {
        return findings.stream().anyMatch(ValidationFinding::isError);
    }

    public static List<ValidationFinding> errors(List<ValidationFinding> findings) {
        return findings.stream().filter(ValidationFinding::isError).toList();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(severity.name());
        if (nodeId != null) {
            sb.append(" [node ").append(nodeId);
            if (answerId != null) {
                sb.append(", answer ").append(answerId);
            }
            sb.append(']');
        }
        return sb.append(": ").append(message).toString();
    }
}
