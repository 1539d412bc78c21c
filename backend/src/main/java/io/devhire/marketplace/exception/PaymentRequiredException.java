package io.devhire.marketplace.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised by the release gate when a solution is requested before the buyer's payment for the task
 * has been recorded. Rendered as HTTP 402.
 */
public class PaymentRequiredException extends ErrorResponseException {

  public PaymentRequiredException(UUID taskId) {
    super(HttpStatus.PAYMENT_REQUIRED, createProblem(taskId), null);
  }

  private static ProblemDetail createProblem(UUID taskId) {
    var problem = ProblemDetail.forStatus(HttpStatus.PAYMENT_REQUIRED);
    problem.setTitle("Payment required");
    problem.setDetail("Solution for task " + taskId + " is released only after payment");
    return problem;
  }
}
