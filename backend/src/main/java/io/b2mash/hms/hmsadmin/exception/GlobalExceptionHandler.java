package io.b2mash.hms.hmsadmin.exception;

import io.b2mash.hms.hmsadmin.kvstore.KeyValueStoreException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(KeyValueStoreException.class)
  public ResponseEntity<ProblemDetail> handleKeyValueStoreFailure(
      KeyValueStoreException ex, HttpServletRequest request) {
    log.error(
        "Fast store failure: path={}, method={}, operation={}, key={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getOperation(),
        ex.getKey(),
        ex);
    return unavailable("The key-value store could not complete the request");
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ProblemDetail> handleDataAccessFailure(
      DataAccessException ex, HttpServletRequest request) {
    log.error(
        "Relational store failure: path={}, method={}",
        request.getRequestURI(),
        request.getMethod(),
        ex);
    return unavailable("The relational store could not complete the request");
  }

  private static ResponseEntity<ProblemDetail> unavailable(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Backend unavailable");
    problem.setDetail(detail);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
  }
}
