package com.example.supplymatch.interfaces.api.error;

import com.example.supplymatch.application.exception.ApplicationException;
import com.example.supplymatch.application.exception.UseCaseValidationException;
import com.example.supplymatch.domain.exception.CatalogItemNotFoundException;
import com.example.supplymatch.domain.exception.DocumentNotFoundException;
import com.example.supplymatch.domain.exception.DomainException;
import com.example.supplymatch.domain.exception.InvalidMatchTargetException;
import com.example.supplymatch.domain.exception.MalformedDocumentException;
import com.example.supplymatch.infrastructure.exception.CatalogUnavailableException;
import com.example.supplymatch.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Map;

/**
 * Centralized API-layer exception handler that maps domain/application/infrastructure failures to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleDocumentNotFound(DocumentNotFoundException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "DOCUMENT_NOT_FOUND");
    }

    @ExceptionHandler(CatalogItemNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleCatalogItemNotFound(CatalogItemNotFoundException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "CATALOG_ITEM_NOT_FOUND");
    }

    /**
     * A document that was readable but held no product table.
     */
    @ExceptionHandler(MalformedDocumentException.class)
    public ResponseEntity<ErrorResponse> handleMalformedDocument(MalformedDocumentException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "MALFORMED_DOCUMENT");
    }

    /**
     * Confirmation targets a category or an excluded item; the id is echoed so a client can
     * highlight the offending choice.
     */
    @ExceptionHandler(InvalidMatchTargetException.class)
    public ResponseEntity<ErrorResponse> handleInvalidMatchTarget(InvalidMatchTargetException ex, HttpServletRequest request) {
        ErrorResponse response = ErrorResponse.of(HttpStatus.UNPROCESSABLE_ENTITY.value(), "INVALID_MATCH_TARGET",
                ex.getMessage(), request.getRequestURI())
                .withDetails(Map.of("catalogItemId", String.valueOf(ex.getCatalogItemId())));
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
    }

    /**
     * Maps generic domain validation exceptions to a 400 response.
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR");
    }

    @ExceptionHandler(UseCaseValidationException.class)
    public ResponseEntity<ErrorResponse> handleUseCaseValidation(UseCaseValidationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "USE_CASE_VALIDATION_ERROR");
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ErrorResponse> handleMissingParameter(Exception ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "MISSING_PARAMETER");
    }

    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR");
    }

    @ExceptionHandler(CatalogUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleCatalogUnavailable(CatalogUnavailableException ex, HttpServletRequest request) {
        log.warn("Catalog unavailable while handling {}: {}", request.getRequestURI(), ex.getMessage());
        return buildResponse(ex, request, HttpStatus.SERVICE_UNAVAILABLE, "CATALOG_UNAVAILABLE");
    }

    /**
     * Maps infrastructure exceptions to a 500 response.
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Infrastructure failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR");
    }

    /**
     * Fallback for unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    /**
     * Central helper that creates a consistent {@link ErrorResponse} envelope.
     *
     * @param error     exception that triggered the handler
     * @param request   incoming HTTP request
     * @param status    HTTP status code to return
     * @param errorCode application-specific error code
     * @return response entity containing the serialized error
     */
    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, error.getMessage(), request.getRequestURI());
        return ResponseEntity.status(status).body(response);
    }
}
