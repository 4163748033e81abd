package com.artgrid.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.validation.BindException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.net.URI;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for REST API endpoints.
 *
 * Converts exceptions thrown by controllers and services into RFC 7807
 * (Problem Details for HTTP APIs) responses:
 *
 * <pre>
 * {
 *   "type": "https://api.artgrid.app/errors/invalid-state",
 *   "title": "Invalid Artwork State",
 *   "status": 400,
 *   "detail": "Artwork '12' is not pending moderation (current status: approved).",
 *   "instance": "/api/admin/approve/12",
 *   "timestamp": "2024-02-26T10:30:00"
 * }
 * </pre>
 *
 * <p>Handled Exception Categories:
 * <ul>
 *   <li>Validation errors (400): bean validation, malformed bodies, invalid arguments, oversize uploads</li>
 *   <li>State errors (400): moderation transitions from the wrong status</li>
 *   <li>Authentication errors (401): bad credentials</li>
 *   <li>Authorization errors (403): missing moderator or admin role</li>
 *   <li>Not found errors (404): missing or unpublished resources, unknown endpoints</li>
 *   <li>Conflicts (409): concurrent moderation, duplicate likes</li>
 *   <li>Busy database (503): write lock not acquired within the busy timeout</li>
 *   <li>Storage errors (500): object storage upload failures</li>
 * </ul>
 *
 * Missing or invalid tokens never reach this class; they are answered by
 * {@link com.artgrid.security.RestAuthenticationEntryPoint} in the same format.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7807">RFC 7807 Specification</a>
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    public static final String BASE_ERROR_URI = "https://api.artgrid.app/errors";
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ISO_DATE_TIME;

    /**
     * Handles UnauthorizedException - authenticated user lacks the required role.
     *
     * @param ex the UnauthorizedException
     * @param request the web request context
     * @return RFC 7807 problem details with 403 status
     */
    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ProblemDetail> handleUnauthorizedException(
            UnauthorizedException ex,
            WebRequest request
    ) {
        log.warn("Authorization failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.FORBIDDEN,
                "Access Denied",
                ex.getMessage(),
                request,
                "access-denied"
        );

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problemDetail);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            WebRequest request
    ) {
        log.debug("Resource not found: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.NOT_FOUND,
                "Resource Not Found",
                ex.getMessage(),
                request,
                "resource-not-found"
        );

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problemDetail);
    }

    /**
     * Handles InvalidStateException - moderation transition from the wrong status.
     *
     * Approving or rejecting a non-pending artwork, or featuring a non-approved one.
     * Mapped to HTTP 400 Bad Request.
     *
     * @param ex the InvalidStateException
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status
     */
    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ProblemDetail> handleInvalidStateException(
            InvalidStateException ex,
            WebRequest request
    ) {
        log.warn("Invalid state transition: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Artwork State",
                ex.getMessage(),
                request,
                "invalid-state"
        );
        problemDetail.setProperty("currentStatus", ex.getCurrentStatus());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles StorageException - the object storage provider rejected the upload.
     *
     * @param ex the StorageException
     * @param request the web request context
     * @return RFC 7807 problem details with 500 status
     */
    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ProblemDetail> handleStorageException(
            StorageException ex,
            WebRequest request
    ) {
        log.error("Storage failure: error={}, message={}", ex.getErrorCode(), ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Upload Failed",
                ex.getMessage(),
                request,
                "upload-failed"
        );
        if (ex.getErrorCode() != null) {
            problemDetail.setProperty("errorCode", ex.getErrorCode());
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problemDetail);
    }

    /**
     * Handles BadCredentialsException - wrong email or password at login.
     *
     * @param ex the BadCredentialsException
     * @param request the web request context
     * @return RFC 7807 problem details with 401 status
     */
    @ExceptionHandler(BadCredentialsException.class)
    public ResponseEntity<ProblemDetail> handleBadCredentialsException(
            BadCredentialsException ex,
            WebRequest request
    ) {
        log.warn("Authentication failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.UNAUTHORIZED,
                "Authentication Failed",
                "Invalid email or password.",
                request,
                "authentication-failed"
        );

        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(problemDetail);
    }

    /**
     * Handles SecurityException - the token was valid but its subject no longer exists.
     *
     * @param ex the SecurityException
     * @param request the web request context
     * @return RFC 7807 problem details with 401 status
     */
    @ExceptionHandler(SecurityException.class)
    public ResponseEntity<ProblemDetail> handleSecurityException(
            SecurityException ex,
            WebRequest request
    ) {
        log.warn("Security violation: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.UNAUTHORIZED,
                "Security Violation",
                ex.getMessage(),
                request,
                "security-violation"
        );

        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(problemDetail);
    }

    /**
     * Handles BindException - bean validation failures on JSON bodies and multipart forms.
     *
     * MethodArgumentNotValidException is a subclass and is handled here too.
     *
     * @param ex the BindException
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status and validation errors
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ProblemDetail> handleValidationException(
            BindException ex,
            WebRequest request
    ) {
        log.warn("Request validation failed: {}", ex.getMessage());

        Map<String, String> validationErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                validationErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));

        String detail = validationErrors.isEmpty()
                ? "Request validation failed."
                : validationErrors.values().iterator().next();

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Validation Failed",
                detail,
                request,
                "validation-failed"
        );
        problemDetail.setProperty("errors", validationErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleHttpMessageNotReadableException(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        log.warn("Request body parsing failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Request Body",
                "The request body is malformed or contains invalid JSON. Please check your request format.",
                request,
                "invalid-request-body"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles missing query parameters, missing multipart parts and unparseable path
     * variables.
     *
     * @param ex the binding exception
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status
     */
    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ProblemDetail> handleRequestBindingException(
            Exception ex,
            WebRequest request
    ) {
        log.warn("Request binding failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Request",
                ex.getMessage(),
                request,
                "invalid-request"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ProblemDetail> handleMaxUploadSizeExceededException(
            MaxUploadSizeExceededException ex,
            WebRequest request
    ) {
        log.warn("Upload rejected: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "File Too Large",
                "The uploaded file exceeds the maximum allowed size of 10 MB.",
                request,
                "file-too-large"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles IllegalArgumentException - invalid input detected by a service.
     *
     * Registration rules (email domain, duplicates), upload validation and empty
     * comments all end up here. Mapped to HTTP 400 Bad Request.
     *
     * @param ex the IllegalArgumentException
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(
            IllegalArgumentException ex,
            WebRequest request
    ) {
        log.warn("Invalid argument: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Argument",
                ex.getMessage(),
                request,
                "invalid-argument"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles concurrent modification of the same artwork or a duplicate like.
     *
     * The optimistic version column rejects the second of two simultaneous moderation
     * decisions; the unique index on likes rejects a racing duplicate insert.
     * Mapped to HTTP 409 Conflict.
     *
     * @param ex the persistence exception
     * @param request the web request context
     * @return RFC 7807 problem details with 409 status
     */
    @ExceptionHandler({OptimisticLockingFailureException.class, DataIntegrityViolationException.class})
    public ResponseEntity<ProblemDetail> handleConflictException(
            Exception ex,
            WebRequest request
    ) {
        log.warn("Concurrent modification rejected: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.CONFLICT,
                "Conflict",
                "The resource was modified by another request. Please reload and try again.",
                request,
                "conflict"
        );

        return ResponseEntity.status(HttpStatus.CONFLICT).body(problemDetail);
    }

    /**
     * Handles a write that could not get the database lock in time.
     *
     * Writers queue on the SQLite busy timeout; only a request that waited out the
     * whole timeout ends up here. Mapped to HTTP 503 so clients may retry.
     *
     * @param ex the lock acquisition failure
     * @param request the web request context
     * @return RFC 7807 problem details with 503 status
     */
    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ProblemDetail> handleLockFailureException(
            PessimisticLockingFailureException ex,
            WebRequest request
    ) {
        log.warn("Database busy, request rejected: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Service Busy",
                "The server is handling too many changes at once. Please try again shortly.",
                request,
                "database-busy"
        );

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, "1")
                .body(problemDetail);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ProblemDetail> handleNoResourceFoundException(
            NoResourceFoundException ex,
            WebRequest request
    ) {
        log.debug("Endpoint not found: {} /{}", ex.getHttpMethod(), ex.getResourcePath());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.NOT_FOUND,
                "Endpoint Not Found",
                String.format("The requested endpoint '%s /%s' does not exist.",
                        ex.getHttpMethod(), ex.getResourcePath()),
                request,
                "endpoint-not-found"
        );

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problemDetail);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ProblemDetail> handleMethodNotSupportedException(
            HttpRequestMethodNotSupportedException ex,
            WebRequest request
    ) {
        log.debug("Method not supported: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.METHOD_NOT_ALLOWED,
                "Method Not Allowed",
                ex.getMessage(),
                request,
                "method-not-allowed"
        );

        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(problemDetail);
    }

    /**
     * Fallback handler for all unhandled exceptions.
     *
     * Logs the full stack trace and returns a generic 500 with an error ID that can be
     * matched against the log.
     *
     * @param ex the unhandled exception
     * @param request the web request context
     * @return RFC 7807 problem details with 500 status
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnhandledException(
            Exception ex,
            WebRequest request
    ) {
        String errorId = generateErrorId();
        log.error("Unexpected error occurred [{}]: {}", errorId, ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred. Please try again later or contact support if the issue persists.",
                request,
                "internal-error"
        );
        problemDetail.setProperty("errorId", errorId);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problemDetail);
    }

    private ProblemDetail createProblemDetail(
            HttpStatus status,
            String title,
            String detail,
            WebRequest request,
            String errorType
    ) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);

        problemDetail.setType(URI.create(String.format("%s/%s", BASE_ERROR_URI, errorType)));
        problemDetail.setTitle(title);

        // WebRequest description has the form "uri=/api/..."
        String description = request.getDescription(false);
        if (description != null && description.startsWith("uri=")) {
            problemDetail.setInstance(URI.create(description.substring(4)));
        }

        problemDetail.setProperty("timestamp", LocalDateTime.now().format(TIMESTAMP_FORMATTER));

        return problemDetail;
    }

    private String generateErrorId() {
        return String.format("ERR-%d", System.currentTimeMillis());
    }
}
