package com.mqol.teamservice.infrastructure.web;

import com.mqol.access.AccessDeniedException;
import com.mqol.access.DenyReason;
import com.mqol.access.TenantNotFoundException;
import com.mqol.observability.CorrelationContextHolder;
import com.mqol.teamservice.domain.ConflictException;
import com.mqol.teamservice.domain.FeatureDisabledException;
import com.mqol.teamservice.domain.MembershipRuleException;
import com.mqol.teamservice.domain.RecordNotFoundException;
import com.mqol.teamservice.domain.UnauthenticatedException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://mqol.com/errors/not-found",
 *   "title": "Not Found",
 *   "status": 404,
 *   "detail": "Team not found",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>WHY a non-member gets the same 404 as an unknown team: a caller outside a team must not be
 * able to tell whether the slug exists. The precise reason stays in the logs.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String TEAM_NOT_FOUND = "Team not found";

    @ExceptionHandler(TenantNotFoundException.class)
    public ProblemDetail handleTenantNotFound(TenantNotFoundException ex) {
        log.debug("Team lookup failed: reason=tenant_not_found {}", ex.identifier());
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", TEAM_NOT_FOUND);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDenied(AccessDeniedException ex) {
        log.debug("Access denied: reason={} {}", ex.reason().code(), ex.decision());
        if (ex.reason() == DenyReason.NOT_A_MEMBER) {
            return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", TEAM_NOT_FOUND);
        }
        return problem(HttpStatus.FORBIDDEN, "Forbidden", "forbidden",
                "You do not have permission to %s %s".formatted(
                        ex.decision().action().value(), ex.decision().resource().key()));
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ProblemDetail handleRecordNotFound(RecordNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(FeatureDisabledException.class)
    public ProblemDetail handleFeatureDisabled(FeatureDisabledException ex) {
        log.debug("Feature disabled: {}", ex.feature());
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", "Not Found");
    }

    @ExceptionHandler(ConflictException.class)
    public ProblemDetail handleConflict(ConflictException ex) {
        log.info("Conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", "conflict", ex.getMessage());
    }

    // Membership rules such as "the last owner cannot leave"
    @ExceptionHandler(MembershipRuleException.class)
    public ProblemDetail handleMembershipRule(MembershipRuleException ex) {
        log.info("Rule violation: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", "conflict", ex.getMessage());
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ProblemDetail handleUnauthenticated(UnauthenticatedException ex) {
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Malformed request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler({
        NoResourceFoundException.class,
        HttpRequestMethodNotSupportedException.class,
        HttpMediaTypeNotSupportedException.class
    })
    public ProblemDetail handleFrameworkError(Exception ex) {
        ProblemDetail problem = ((ErrorResponse) ex).getBody();
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://mqol.com/errors/" + type));
        enrichWithCorrelation(problem);
        return problem;
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
