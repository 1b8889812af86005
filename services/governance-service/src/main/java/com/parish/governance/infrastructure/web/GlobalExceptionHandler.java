package com.parish.governance.infrastructure.web;

import com.parish.observability.CorrelationContextHolder;
import com.parish.observability.MetricFactory;
import com.parish.security.AccessControlException;
import com.parish.security.AccessErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://parish.app/errors/forbidden",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "Missing permission: users.manage",
 *   "code": "FORBIDDEN",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Authentication failures always carry the same generic detail; the reason is only
 * logged. Every access denial is counted in {@code parish.access.denied} by code.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String AUTHENTICATION_REQUIRED = "Authentication required";

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String ERROR_TYPE_BASE = "https://parish.app/errors/";

    private final MetricFactory metrics;

    public GlobalExceptionHandler(MetricFactory metrics) {
        this.metrics = metrics;
    }

    @ExceptionHandler(AccessControlException.class)
    public ProblemDetail handleAccessControl(AccessControlException ex, HttpServletRequest request) {
        AccessErrorCode code = ex.code();
        metrics.counter("parish.access.denied", "Requests rejected by the authorization core",
                "code", code.name()).increment();

        String detail;
        if (code == AccessErrorCode.UNAUTHENTICATED) {
            log.info("Unauthenticated request {} {}: {}", request.getMethod(), request.getRequestURI(),
                    ex.getMessage());
            detail = AUTHENTICATION_REQUIRED;
        } else {
            log.warn("Access denied on {} {}: code={}, reason={}", request.getMethod(), request.getRequestURI(),
                    code, ex.getMessage());
            detail = ex.getMessage();
        }
        HttpStatus status = HttpStatus.valueOf(code.httpStatus());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + code.name().toLowerCase(Locale.ROOT).replace('_', '-')));
        problem.setProperty("code", code.name());
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ProblemDetail handleDuplicateKey(DuplicateKeyException ex) {
        log.warn("Unique constraint violated: {}", ex.getMostSpecificCause().getMessage());
        return badRequest("A record with the same name already exists.", "Conflicting Record");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "validation"));
        problem.setProperty("code", AccessErrorCode.BAD_REQUEST.name());
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class})
    public ProblemDetail handleMalformed(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return badRequest("Malformed request.", "Bad Request");
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class, MissingServletRequestParameterException.class,
            ErrorResponseException.class})
    public ProblemDetail handleFrameworkError(Exception ex) {
        ProblemDetail problem = ((ErrorResponse) ex).getBody();
        HttpStatusCode status = HttpStatusCode.valueOf(problem.getStatus());
        if (status.is5xxServerError()) {
            log.error("Request failed", ex);
        } else {
            log.debug("Request rejected by the web layer: {}", ex.getMessage());
        }
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "internal"));
        enrichWithCorrelation(problem);
        return problem;
    }

    private ProblemDetail badRequest(String detail, String title) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        problem.setProperty("code", AccessErrorCode.BAD_REQUEST.name());
        enrichWithCorrelation(problem);
        return problem;
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
