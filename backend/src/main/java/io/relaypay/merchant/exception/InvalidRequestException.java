package io.relaypay.merchant.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Structurally invalid input. The offending fields are listed under {@code violations}. */
public class InvalidRequestException extends ErrorResponseException {

  public InvalidRequestException(String detail, List<String> violations) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail, violations), null);
  }

  private static ProblemDetail createProblem(String detail, List<String> violations) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid payload");
    problem.setDetail(detail);
    problem.setProperty("violations", List.copyOf(violations));
    return problem;
  }
}
