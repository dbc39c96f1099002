package io.b2mash.crmsync.exception;

import io.b2mash.crmsync.config.DiagnosticsProperties;
import io.b2mash.crmsync.integration.mapping.FieldMappingException;
import io.b2mash.crmsync.integration.provider.CrmApiException;
import io.b2mash.crmsync.integration.provider.CrmAuthenticationException;
import io.b2mash.crmsync.integration.provider.CrmProviderException;
import io.b2mash.crmsync.integration.provider.UnsupportedCrmTypeException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
@EnableConfigurationProperties(DiagnosticsProperties.class)
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final DiagnosticsProperties diagnostics;

  public GlobalExceptionHandler(DiagnosticsProperties diagnostics) {
    this.diagnostics = diagnostics;
  }

  @ExceptionHandler(CrmAuthenticationException.class)
  public ResponseEntity<ProblemDetail> handleCrmAuthentication(CrmAuthenticationException ex) {
    log.warn("CRM authentication failed: crmType={}, reason={}", slug(ex), ex.getMessage());
    var problem = problem(HttpStatus.UNAUTHORIZED, "CRM authentication failed", ex.getMessage());
    problem.setProperty("crmType", slug(ex));
    problem.setProperty("errorCode", "CRM_INVALID_CREDENTIALS");
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(problem);
  }

  @ExceptionHandler(CrmApiException.class)
  public ResponseEntity<ProblemDetail> handleCrmApi(CrmApiException ex) {
    log.warn(
        "CRM request failed: crmType={}, remoteStatus={}, reason={}",
        slug(ex),
        ex.getStatusCode(),
        ex.getMessage());
    var problem = problem(HttpStatus.SERVICE_UNAVAILABLE, "CRM request failed", ex.getMessage());
    problem.setProperty("crmType", slug(ex));
    problem.setProperty("errorCode", "CRM_CONNECTION_FAILED");
    if (ex.getStatusCode() != null) {
      problem.setProperty("remoteStatus", ex.getStatusCode());
    }
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
  }

  @ExceptionHandler(FieldMappingException.class)
  public ResponseEntity<ProblemDetail> handleFieldMapping(FieldMappingException ex) {
    var problem = problem(HttpStatus.BAD_REQUEST, "Invalid contact", ex.getMessage());
    if (ex.getCrmType() != null) {
      problem.setProperty("crmType", ex.getCrmType().slug());
    }
    if (ex.getField() != null) {
      problem.setProperty("field", ex.getField());
    }
    problem.setProperty("errorCode", "CRM_FIELD_MAPPING_FAILED");
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(UnsupportedCrmTypeException.class)
  public ResponseEntity<ProblemDetail> handleUnsupportedCrmType(UnsupportedCrmTypeException ex) {
    var problem = problem(HttpStatus.BAD_REQUEST, "Unsupported CRM type", ex.getMessage());
    problem.setProperty("errorCode", "CRM_INVALID_TYPE");
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest request) {
    log.error(
        "Unhandled error: path={}, method={}", request.getRequestURI(), request.getMethod(), ex);
    var detail =
        diagnostics.exposeErrors()
            ? ex.getClass().getSimpleName() + ": " + ex.getMessage()
            : "An unexpected error occurred";
    var problem = problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", detail);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  private static ProblemDetail problem(HttpStatus status, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }

  private static String slug(CrmProviderException ex) {
    return ex.getCrmType() != null ? ex.getCrmType().slug() : null;
  }
}
