package com.work.federation.web;

import com.work.federation.core.exception.DomainStateException;
import com.work.federation.core.exception.FederationException;
import com.work.federation.core.exception.LedgerRejectedException;
import com.work.federation.core.exception.LedgerUnavailableException;
import com.work.federation.core.exception.MalformedInputException;
import com.work.federation.core.exception.NotWinnerException;
import com.work.federation.core.exception.ServiceNotFoundException;
import com.work.federation.orchestrator.NegotiationFailedException;
import com.work.federation.orchestrator.NegotiationTimeoutException;
import com.work.federation.web.dto.ErrorView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 异常到 HTTP 状态码的统一映射。
 */
@RestControllerAdvice(basePackages = "com.work.federation.web")
public class FederationExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(FederationExceptionHandler.class);

    @ExceptionHandler({MalformedInputException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorView> handleBadInput(RuntimeException e) {
        return respond(HttpStatus.BAD_REQUEST, null, e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorView> handleValidation(MethodArgumentNotValidException e) {
        FieldError field = e.getBindingResult().getFieldError();
        String message = field != null ? field.getField() + ": " + field.getDefaultMessage() : "invalid request";
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorView(null, MalformedInputException.class.getSimpleName(), message));
    }

    @ExceptionHandler({ServiceNotFoundException.class, NotWinnerException.class})
    public ResponseEntity<ErrorView> handleNotFound(FederationException e) {
        return respond(HttpStatus.NOT_FOUND, null, e);
    }

    @ExceptionHandler({LedgerRejectedException.class, DomainStateException.class})
    public ResponseEntity<ErrorView> handleConflict(FederationException e) {
        return respond(HttpStatus.CONFLICT, null, e);
    }

    @ExceptionHandler(NegotiationTimeoutException.class)
    public ResponseEntity<ErrorView> handleTimeout(NegotiationTimeoutException e) {
        return respond(HttpStatus.GATEWAY_TIMEOUT, e.getStep().name(), e);
    }

    @ExceptionHandler(LedgerUnavailableException.class)
    public ResponseEntity<ErrorView> handleUnavailable(LedgerUnavailableException e) {
        log.warn("[federation] ledger unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, null, e);
    }

    @ExceptionHandler(NegotiationFailedException.class)
    public ResponseEntity<ErrorView> handleNegotiationFailed(NegotiationFailedException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.error("[federation] negotiation failed at step={}", e.getStep(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorView(e.getStep().name(), cause.getClass().getSimpleName(), cause.getMessage()));
    }

    @ExceptionHandler(FederationException.class)
    public ResponseEntity<ErrorView> handleOther(FederationException e) {
        log.error("[federation] request failed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, null, e);
    }

    private ResponseEntity<ErrorView> respond(HttpStatus status, String step, RuntimeException e) {
        return ResponseEntity.status(status).body(new ErrorView(step, e.getClass().getSimpleName(), e.getMessage()));
    }
}
