package io.relaypay.merchant.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(WebhookSignatureException.class)
  public ResponseEntity<ProblemDetail> handleBadSignature(
      WebhookSignatureException ex, HttpServletRequest request) {
    log.warn(
        "Rejected webhook: path={}, reason={}", request.getRequestURI(), ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ex.getBody());
  }

  @ExceptionHandler(ListenerNotAuthorizedException.class)
  public ResponseEntity<ProblemDetail> handleUnauthorizedListener(
      ListenerNotAuthorizedException ex, HttpServletRequest request) {
    log.warn(
        "Forbidden listener: path={}, reason={}",
        request.getRequestURI(),
        ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  /** Last resort. Internals stay in the log, never in the response. */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpected(
      Exception ex, HttpServletRequest request) {
    log.error(
        "Unhandled error: path={}, method={}", request.getRequestURI(), request.getMethod(), ex);
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Internal server error");
    problem.setDetail("Internal server error");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }
}
