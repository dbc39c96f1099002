package io.b2mash.crmsync.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    this(
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " found with id " + id,
        "CRM_INTEGRATION_NOT_FOUND");
  }

  public static ResourceNotFoundException withDetail(String title, String detail) {
    return new ResourceNotFoundException(title, detail, "CRM_INTEGRATION_NOT_FOUND");
  }

  public static ResourceNotFoundException noActiveIntegrations() {
    return new ResourceNotFoundException(
        "No active integrations",
        "No active CRM integrations are available for this sync",
        "CRM_NO_ACTIVE_INTEGRATIONS");
  }

  private ResourceNotFoundException(String title, String detail, String errorCode) {
    super(HttpStatus.NOT_FOUND, createProblem(title, detail, errorCode), null);
  }

  private static ProblemDetail createProblem(String title, String detail, String errorCode) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("errorCode", errorCode);
    return problem;
  }
}
