package io.machtrack.backend.exception;

import io.machtrack.backend.sequence.SequenceErrorCode;
import io.machtrack.backend.sequence.SequenceException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(SequenceException.class)
  public ResponseEntity<ProblemDetail> handleSequenceFailure(
      SequenceException ex, HttpServletRequest request) {
    if (ex.getErrorCode() == SequenceErrorCode.GENERATION_EXHAUSTED) {
      log.error(
          "Sequence failure: path={}, method={}, code={}, detail={}",
          request.getRequestURI(),
          request.getMethod(),
          ex.getErrorCode().code(),
          ex.getBody().getDetail());
    } else {
      log.warn(
          "Sequence failure: path={}, method={}, code={}",
          request.getRequestURI(),
          request.getMethod(),
          ex.getErrorCode().code());
    }
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleDataIntegrityViolation(
      DataIntegrityViolationException ex) {
    log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Conflicting data");
    problem.setDetail("The request conflicts with existing data. Please retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail("Resource was modified concurrently. Please retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}
