package com.drawiomcp.exceptions;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.Map;

import com.drawiomcp.models.DrawioMcpError;

/**
 * Unchecked exception carrying a structured {@link DrawioMcpError}.
 * The tool layer unwraps it and sends the error object to MCP clients.
 */
public class DrawioMcpException extends RuntimeException {

    private final DrawioMcpError err;

    public DrawioMcpException(DrawioMcpError err) {
        super(err.getMessage());
        this.err = err;
    }

    public DrawioMcpException(DrawioMcpError err, Throwable cause) {
        super(err.getMessage(), cause);
        this.err = err;
    }

    /**
     * Gets the structured error information.
     *
     * @return the error including context and suggestions
     */
    public DrawioMcpError getErr() {
        return err;
    }

    public DrawioMcpError.ErrorType getErrorType() {
        return err.getErrorType();
    }

    public String getErrorCode() {
        return err.getErrorCode();
    }

    public boolean isValidationError() {
        return err.getErrorType() == DrawioMcpError.ErrorType.VALIDATION;
    }

    public boolean isResourceNotFoundError() {
        return err.getErrorType() == DrawioMcpError.ErrorType.RESOURCE_NOT_FOUND;
    }

    public boolean isDocumentParsingError() {
        return err.getErrorType() == DrawioMcpError.ErrorType.DOCUMENT_PARSING;
    }

    /**
     * Wraps an unexpected throwable into an internal error.
     *
     * @param cause         the original exception
     * @param toolOperation the operation that was being performed
     * @param toolClass     the tool class that failed
     * @return a new exception with minimal structured information
     */
    public static DrawioMcpException fromException(Throwable cause, String toolOperation, String toolClass) {
        String original = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        DrawioMcpError error = DrawioMcpError.internal()
                .errorCode(DrawioMcpError.ErrorCode.UNEXPECTED_ERROR)
                .message("Unexpected error occurred: " + original)
                .context(new DrawioMcpError.ErrorContext(
                        toolOperation,
                        "internal operation",
                        null,
                        null,
                        Map.of("exceptionType", cause.getClass().getSimpleName())))
                .debugInfo(new DrawioMcpError.ErrorDebugInfo(
                        stackTraceOf(cause),
                        toolClass,
                        Instant.now().toString(),
                        Map.of("originalMessage", original)))
                .build();
        return new DrawioMcpException(error, cause);
    }

    private static String stackTraceOf(Throwable throwable) {
        StringWriter sw = new StringWriter();
        throwable.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    @Override
    public String toString() {
        return "DrawioMcpException{errorType=" + err.getErrorType()
                + ", errorCode='" + err.getErrorCode() + '\''
                + ", message='" + getMessage() + '\'' + '}';
    }
}
