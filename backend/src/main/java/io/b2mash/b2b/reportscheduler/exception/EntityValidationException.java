package io.b2mash.b2b.reportscheduler.exception;

import io.b2mash.b2b.reportscheduler.validation.EntityValidationError;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when an entity fails validation and the caller asked for a hard failure. Results in HTTP
 * 422 Unprocessable Entity with the recorded errors attached.
 */
public class EntityValidationException extends ErrorResponseException {

  private final List<EntityValidationError> errors;

  public EntityValidationException(String entityType, List<EntityValidationError> errors) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(entityType, errors), null);
    this.errors = List.copyOf(errors);
  }

  public List<EntityValidationError> getErrors() {
    return errors;
  }

  private static ProblemDetail createProblem(
      String entityType, List<EntityValidationError> errors) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Validation failed");
    problem.setDetail(errors.size() + " validation error(s) for " + entityType);
    problem.setProperty("errors", errors);
    return problem;
  }
}
