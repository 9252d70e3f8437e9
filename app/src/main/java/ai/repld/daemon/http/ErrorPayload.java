package ai.repld.daemon.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

/**
 * Structured error response payload, the body of every non-2xx response.
 *
 * @param code The error code (e.g., "VALIDATION_ERROR", "SESSION_NOT_FOUND", "INTERNAL_ERROR").
 * @param message A human-readable error message.
 * @param details Additional details; null if no extra information is available.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorPayload(String code, String message, @Nullable String details) {

    /**
     * Validate that code and message are non-blank.
     */
    public ErrorPayload {
        if (code.isBlank()) {
            throw new IllegalArgumentException("code must not be blank");
        }
        if (message.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
    }

    /**
     * Common error codes as constants.
     */
    public static final class Code {
        public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
        public static final String NOT_FOUND = "NOT_FOUND";
        public static final String METHOD_NOT_ALLOWED = "METHOD_NOT_ALLOWED";
        public static final String SESSION_NOT_FOUND = "SESSION_NOT_FOUND";
        public static final String INITIALIZATION_ERROR = "INITIALIZATION_ERROR";
        public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

        private Code() {}
    }

    /**
     * Create an error without additional details.
     * @param code The error code.
     * @param message The error message.
     * @return A new ErrorPayload with details set to null.
     */
    public static ErrorPayload of(String code, String message) {
        return new ErrorPayload(code, message, null);
    }

    /**
     * Create a validation error.
     * @param message The validation error message.
     * @return A new ErrorPayload with code VALIDATION_ERROR.
     */
    public static ErrorPayload validationError(String message) {
        return of(Code.VALIDATION_ERROR, message);
    }

    /**
     * Create a session-not-found error.
     * @param message The lookup failure reported by the REPL service.
     * @return A new ErrorPayload with code SESSION_NOT_FOUND.
     */
    public static ErrorPayload sessionNotFound(String message) {
        return of(Code.SESSION_NOT_FOUND, message);
    }

    /**
     * Create an internal error.
     * @param message The error message.
     * @param throwable The underlying exception (for details).
     * @return A new ErrorPayload with code INTERNAL_ERROR and details from the exception.
     */
    public static ErrorPayload internalError(String message, Throwable throwable) {
        return new ErrorPayload(
                Code.INTERNAL_ERROR, message, throwable.getClass().getSimpleName() + ": " + throwable.getMessage());
    }
}
