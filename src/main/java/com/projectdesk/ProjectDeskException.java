package com.projectdesk;

/**
 * Typed failure raised by the sandbox, staging, pipeline and agent layers.
 * None of these are retried by the core.
 */
public class ProjectDeskException extends RuntimeException {

    private final ErrorKind kind;

    public ProjectDeskException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProjectDeskException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static ProjectDeskException pathEscape(String relativePath) {
        return new ProjectDeskException(ErrorKind.PATH_ESCAPE, "Path escapes sandbox: " + relativePath);
    }

    public static ProjectDeskException missingInput(String relativePath) {
        return new ProjectDeskException(ErrorKind.MISSING_INPUT, "Input not found: " + relativePath);
    }

    public static ProjectDeskException notStaged(String relativePath) {
        return new ProjectDeskException(ErrorKind.NOT_STAGED, "No staged file at: " + relativePath);
    }

    public static ProjectDeskException alreadyExists(String relativePath) {
        return new ProjectDeskException(ErrorKind.ALREADY_EXISTS, "Destination exists: " + relativePath);
    }

    public static ProjectDeskException generationFailure(String message, Throwable cause) {
        return new ProjectDeskException(ErrorKind.GENERATION_FAILURE, message, cause);
    }

    public static ProjectDeskException unknownProject(String projectId) {
        return new ProjectDeskException(ErrorKind.UNKNOWN_PROJECT, "Unknown project: " + projectId);
    }

    public static ProjectDeskException notFound(String message) {
        return new ProjectDeskException(ErrorKind.NOT_FOUND, message);
    }

    public static ProjectDeskException invalidRequest(String message) {
        return new ProjectDeskException(ErrorKind.INVALID_REQUEST, message);
    }
}
