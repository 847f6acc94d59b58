package com.ospicorp.anomalydetection.config;

import com.ospicorp.anomalydetection.error.ApiException;
import com.ospicorp.anomalydetection.error.UnavailableException;
import com.ospicorp.anomalydetection.error.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final String PROBLEM_BASE = "https://docs.anomaly-detection.dev/problems/";
  private static final String GENERIC_ERROR = "Unexpected server error.";

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.UNAUTHORIZED, "unauthorized",
      HttpStatus.FORBIDDEN, "forbidden",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.UNPROCESSABLE_ENTITY, "validation-error",
      HttpStatus.SERVICE_UNAVAILABLE, "unavailable",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler(ApiException.class)
  public ResponseEntity<ProblemDetail> handleApiException(ApiException ex,
      HttpServletRequest request) {
    HttpStatus status = ex.status();
    ResponseEntity<ProblemDetail> response = buildProblem(status, ex, ex.getMessage(), request);
    if (ex instanceof ValidationException validation) {
      response.getBody().setProperty("errors", validation.errors());
    }
    if (ex instanceof UnavailableException unavailable) {
      return ResponseEntity.status(status)
          .header(HttpHeaders.RETRY_AFTER, String.valueOf(unavailable.retryAfterSeconds()))
          .body(response.getBody());
    }
    return response;
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException ex,
      HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.UNPROCESSABLE_ENTITY, ex,
        "Malformed request body.", request);
    response.getBody().setProperty("errors", List.of("Malformed request body."));
    return response;
  }

  @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class,
      MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, ex.getMessage(), request);
  }

  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoSuchElementException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex, ex.getMessage(), request);
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<ProblemDetail> handleUnauthorized(AuthenticationException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.UNAUTHORIZED, ex, ex.getMessage(), request);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(AccessDeniedException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.FORBIDDEN, ex, ex.getMessage(), request);
  }

  @ExceptionHandler({ErrorResponseException.class, NoResourceFoundException.class,
      HttpRequestMethodNotSupportedException.class, HttpMediaTypeNotSupportedException.class,
      HttpMediaTypeNotAcceptableException.class})
  public ResponseEntity<ProblemDetail> handleFrameworkError(Exception ex,
      HttpServletRequest request) {
    HttpStatus status = HttpStatus.resolve(((ErrorResponse) ex).getStatusCode().value());
    if (status == null) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
    }
    return buildProblem(status, ex, ex.getMessage(), request);
  }

  // Anything unexpected is reported without its message so internals never reach the client.
  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, GENERIC_ERROR, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      String message, HttpServletRequest request) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, message);
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create(PROBLEM_BASE + TYPE_SLUGS.getOrDefault(status, "internal-error")));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String method = request.getMethod();
    String uriWithQuery = RequestInfo.uriWithQuery(request);
    String clientIp = RequestInfo.clientIp(request);
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }

    if (status.is5xxServerError()) {
      log.error("Request {} {} from {} failed with status {}: {}",
          method,
          uriWithQuery,
          clientIp,
          status.value(),
          errorMessage,
          ex);
    } else {
      log.warn("Request {} {} from {} returned status {}: {}",
          method,
          uriWithQuery,
          clientIp,
          status.value(),
          errorMessage);
    }
  }
}
