package io.b2mash.hms.hmsadmin.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when every backend a write depends on rejected it. Returns HTTP 503. */
public class BackendUnavailableException extends ErrorResponseException {

  public BackendUnavailableException(String detail, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Backend unavailable");
    problem.setDetail(detail);
    return problem;
  }
}
