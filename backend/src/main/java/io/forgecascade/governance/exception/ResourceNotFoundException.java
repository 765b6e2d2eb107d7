package io.forgecascade.governance.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        createProblem(
            resourceType + " not found",
            "No " + resourceType.toLowerCase() + " found with id " + id,
            ErrorCodes.notFound(resourceType)),
        null);
  }

  public static ResourceNotFoundException withDetail(String resourceType, String detail) {
    return new ResourceNotFoundException(resourceType, detail, HttpStatus.NOT_FOUND);
  }

  private ResourceNotFoundException(String resourceType, String detail, HttpStatus status) {
    super(
        status,
        createProblem(resourceType + " not found", detail, ErrorCodes.notFound(resourceType)),
        null);
  }

  private static ProblemDetail createProblem(String title, String detail, String code) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty(ErrorCodes.PROPERTY, code);
    return problem;
  }
}
