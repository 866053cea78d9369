package com.adobe.items.exception;

import com.adobe.items.filter.CorrelationIdFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.nio.charset.StandardCharsets;

/**
 * Global exception handler for the Items API.
 *
 * <p>Converts exceptions into HTTP responses. Error responses are
 * <b>plain text</b>; success responses are JSON.</p>
 *
 * <h2>Mapping:</h2>
 * <ul>
 *   <li>{@link InvalidInputException} - 400, message as body</li>
 *   <li>{@link ItemNotFoundException} - 404, "Item not found"</li>
 *   <li>Malformed JSON body - 400</li>
 *   <li>Unsupported method / media type - 405 / 415</li>
 *   <li>Unacceptable {@code Accept} header - 406, no body</li>
 *   <li>Unknown path - 404</li>
 *   <li>Other Spring MVC request errors - their own status</li>
 *   <li>Anything else - 500 with a correlation reference</li>
 * </ul>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String MALFORMED_BODY_MESSAGE = "Malformed JSON request body.";

    static final MediaType TEXT_PLAIN_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    /**
     * Handles validation failures raised by the service layer.
     *
     * @param ex the InvalidInputException
     * @return 400 with the exception message
     */
    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<String> handleInvalidInputException(InvalidInputException ex) {
        logger.warn("Invalid input: {}", ex.getMessage());

        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Handles lookups of ids that match no item.
     *
     * @param ex the ItemNotFoundException
     * @return 404 with "Item not found"
     */
    @ExceptionHandler(ItemNotFoundException.class)
    public ResponseEntity<String> handleItemNotFound(ItemNotFoundException ex) {
        logger.info("Item not found: id={}", ex.getRequestedId());

        return buildErrorResponse(HttpStatus.NOT_FOUND, ItemNotFoundException.MESSAGE);
    }

    /**
     * Handles request bodies that cannot be parsed as JSON.
     *
     * @param ex the HttpMessageNotReadableException
     * @return 400 with a fixed message
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<String> handleMessageNotReadable(HttpMessageNotReadableException ex) {
        logger.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());

        return buildErrorResponse(HttpStatus.BAD_REQUEST, MALFORMED_BODY_MESSAGE);
    }

    /**
     * Handles request bodies sent with a content type other than JSON.
     *
     * @param ex the HttpMediaTypeNotSupportedException
     * @return 415 naming the accepted type
     */
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<String> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException ex) {
        logger.warn("Unsupported content type: {}", ex.getContentType());

        return buildErrorResponse(HttpStatus.UNSUPPORTED_MEDIA_TYPE,
            "Unsupported content type. Send the request body as " + MediaType.APPLICATION_JSON_VALUE + ".");
    }

    /**
     * Handles known paths called with a method they do not support.
     *
     * @param ex the HttpRequestMethodNotSupportedException
     * @return 405 naming the rejected method
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<String> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        logger.warn("Method not supported: {}", ex.getMethod());

        return buildErrorResponse(HttpStatus.METHOD_NOT_ALLOWED,
            "Method " + ex.getMethod() + " is not supported for this resource.");
    }

    /**
     * Handles requests whose {@code Accept} header excludes JSON. The response
     * has no body since no acceptable representation exists.
     *
     * @param ex the HttpMediaTypeNotAcceptableException
     * @return 406 with no body
     */
    @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
    public ResponseEntity<Void> handleMediaTypeNotAcceptable(HttpMediaTypeNotAcceptableException ex) {
        logger.warn("Not acceptable: supported types {}", ex.getSupportedMediaTypes());

        return ResponseEntity.status(HttpStatus.NOT_ACCEPTABLE).build();
    }

    /**
     * Handles requests for non-existent resources (404).
     *
     * @param ex the NoResourceFoundException
     * @return 404 naming the path
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<String> handleNoResourceFound(NoResourceFoundException ex) {
        logger.warn("Resource not found: {}", ex.getResourcePath());

        return buildErrorResponse(HttpStatus.NOT_FOUND,
            "Resource not found: " + ex.getResourcePath());
    }

    /**
     * Catch-all handler for unexpected exceptions.
     *
     * <p>Spring MVC exceptions that carry their own status (missing
     * parameters, payload too large and the like) are client errors and keep
     * that status. Everything else is a 500 that never exposes stack traces
     * and includes the correlation ID for issue reporting.</p>
     *
     * @param ex the Exception
     * @return the framework status, or 500 with a generic message
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleGenericException(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            return handleFrameworkError(errorResponse);
        }

        String correlationId = MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY);
        logger.error("Unexpected error occurred [correlationId={}]", correlationId, ex);

        String message = "An unexpected error occurred. Please try again later.";
        if (correlationId != null) {
            message += " (Reference: " + correlationId + ")";
        }

        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    private ResponseEntity<String> handleFrameworkError(ErrorResponse errorResponse) {
        HttpStatusCode status = errorResponse.getStatusCode();
        String detail = errorResponse.getBody().getDetail();
        logger.warn("Request rejected with {}: {}", status.value(), detail);

        String message = detail != null ? detail : "Request could not be processed.";
        return ResponseEntity
            .status(status)
            .headers(errorResponse.getHeaders())
            .contentType(TEXT_PLAIN_UTF8)
            .body(message);
    }

    private ResponseEntity<String> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity
            .status(status)
            .contentType(TEXT_PLAIN_UTF8)
            .body(message);
    }
}
