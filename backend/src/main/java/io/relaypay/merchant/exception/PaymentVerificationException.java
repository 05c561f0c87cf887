package io.relaypay.merchant.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class PaymentVerificationException extends ErrorResponseException {

  public PaymentVerificationException(String reason) {
    super(HttpStatus.BAD_REQUEST, createProblem(reason), null);
  }

  private static ProblemDetail createProblem(String reason) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid payment");
    problem.setDetail(reason);
    return problem;
  }
}
