package io.relaypay.merchant.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The delivering listener is unregistered, inactive, slashed or under-qualified. */
public class ListenerNotAuthorizedException extends ErrorResponseException {

  public ListenerNotAuthorizedException(String reason) {
    super(HttpStatus.FORBIDDEN, createProblem(reason), null);
  }

  private static ProblemDetail createProblem(String reason) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Unauthorized listener");
    problem.setDetail(
        reason != null ? reason : "Listener not registered or not authorized");
    return problem;
  }
}
