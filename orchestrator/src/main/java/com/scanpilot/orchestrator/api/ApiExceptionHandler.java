package com.scanpilot.orchestrator.api;

import com.scanpilot.orchestrator.api.dto.ErrorResponse;
import com.scanpilot.orchestrator.queue.QueueUnavailableException;
import com.scanpilot.orchestrator.report.ReportNotFoundException;
import com.scanpilot.orchestrator.report.UnsupportedReportFormatException;
import com.scanpilot.orchestrator.service.JobNotFoundException;
import com.scanpilot.orchestrator.service.ValidationException;
import com.scanpilot.orchestrator.tool.ToolPolicyException;
import com.scanpilot.orchestrator.tool.UnknownToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps exceptions to {@code {success:false, error, message}} bodies. */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({ValidationException.class, IllegalArgumentException.class, ToolPolicyException.class})
    public ResponseEntity<ErrorResponse> badRequest(RuntimeException e) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", e.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> unreadable(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", "Malformed request");
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> jobNotFound(JobNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(ReportNotFoundException.class)
    public ResponseEntity<ErrorResponse> reportNotFound(ReportNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(UnknownToolException.class)
    public ResponseEntity<ErrorResponse> toolNotFound(UnknownToolException e) {
        return respond(HttpStatus.NOT_FOUND, "unknown_tool", e.getMessage());
    }

    @ExceptionHandler(UnsupportedReportFormatException.class)
    public ResponseEntity<ErrorResponse> notImplemented(UnsupportedReportFormatException e) {
        return respond(HttpStatus.NOT_IMPLEMENTED, "not_supported", e.getMessage());
    }

    @ExceptionHandler(QueueUnavailableException.class)
    public ResponseEntity<ErrorResponse> unavailable(QueueUnavailableException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "queue_unavailable", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        log.error("Unhandled API error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                e.getMessage() != null ? e.getMessage() : "Unknown error");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(error, message));
    }
}
