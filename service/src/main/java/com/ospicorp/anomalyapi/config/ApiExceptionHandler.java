package com.ospicorp.anomalyapi.config;

import com.ospicorp.anomalyapi.store.ModelPersistenceException;
import com.ospicorp.anomalyapi.support.BackendTimeoutException;
import com.ospicorp.anomalyapi.support.BackendUnavailableException;
import com.ospicorp.anomalyapi.training.InvalidTrainingBatchException;
import com.ospicorp.anomalyapi.web.InvalidParameterException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.UNAUTHORIZED, "unauthorized",
      HttpStatus.FORBIDDEN, "forbidden",
      HttpStatus.NOT_FOUND, "model-not-found",
      HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed",
      HttpStatus.NOT_ACCEPTABLE, "not-acceptable",
      HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported-media-type",
      HttpStatus.INTERNAL_SERVER_ERROR, "persistence-error",
      HttpStatus.SERVICE_UNAVAILABLE, "backend-unavailable",
      HttpStatus.GATEWAY_TIMEOUT, "backend-timeout"
  );

  @ExceptionHandler({ConstraintViolationException.class, MethodArgumentNotValidException.class,
      HandlerMethodValidationException.class, MethodArgumentTypeMismatchException.class,
      HttpMessageNotReadableException.class, IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidParameter(InvalidParameterException ex,
      HttpServletRequest request) {
    logException(HttpStatus.BAD_REQUEST, ex, request);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", ex.getMessage());
    body.put("errorCode", ex.errorCode());
    body.put("moreInfo", ex.moreInfo());
    body.put("path", request.getRequestURI());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(InvalidTrainingBatchException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidBatch(InvalidTrainingBatchException ex,
      HttpServletRequest request) {
    logException(HttpStatus.UNPROCESSABLE_ENTITY, ex, request);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", ex.getMessage());
    body.put("errorCode", ex.errorCode());
    body.put("reason", ex.reason().name());
    body.put("moreInfo", ex.moreInfo());
    body.put("path", request.getRequestURI());
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
  }

  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoSuchElementException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex, request);
  }

  @ExceptionHandler(BackendTimeoutException.class)
  public ResponseEntity<ProblemDetail> handleTimeout(BackendTimeoutException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.GATEWAY_TIMEOUT, ex, request);
  }

  @ExceptionHandler(BackendUnavailableException.class)
  public ResponseEntity<ProblemDetail> handleUnavailable(BackendUnavailableException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.SERVICE_UNAVAILABLE, ex, request);
  }

  @ExceptionHandler(ModelPersistenceException.class)
  public ResponseEntity<ProblemDetail> handlePersistence(ModelPersistenceException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<ProblemDetail> handleUnauthorized(AuthenticationException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.UNAUTHORIZED, ex, request);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(AccessDeniedException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.FORBIDDEN, ex, request);
  }

  @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class,
      HttpMediaTypeNotSupportedException.class, HttpMediaTypeNotAcceptableException.class})
  public ResponseEntity<ProblemDetail> handleFrameworkError(Exception ex,
      HttpServletRequest request) {
    HttpStatus status = HttpStatus.resolve(((ErrorResponse) ex).getStatusCode().value());
    return buildProblem(status == null ? HttpStatus.BAD_REQUEST : status, ex, request);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatus(ResponseStatusException ex,
      HttpServletRequest request) {
    HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
    if (status == null) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
    }
    return buildProblem(status, ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create("https://docs.anomaly-api.dev/problems/"
        + TYPE_SLUGS.getOrDefault(status, "internal-error")));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String target = request.getMethod() + " " + RequestLoggingFilter.uriWithQuery(request);
    String clientIp = RequestLoggingFilter.clientIp(request);
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }

    if (status.is5xxServerError()) {
      log.error("Request {} from {} failed with status {}: {}", target, clientIp, status.value(),
          errorMessage, ex);
    } else {
      log.warn("Request {} from {} returned status {}: {}", target, clientIp, status.value(),
          errorMessage);
    }
  }
}
