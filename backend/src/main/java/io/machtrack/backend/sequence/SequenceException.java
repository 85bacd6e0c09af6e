package io.machtrack.backend.sequence;

import java.util.UUID;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Failure raised by the sequence engine. The {@link SequenceErrorCode} is exposed both on the
 * exception and as the {@code code} property of the problem body, so callers can branch on it
 * without parsing messages.
 */
public class SequenceException extends ErrorResponseException {

  private final SequenceErrorCode errorCode;

  public SequenceException(SequenceErrorCode errorCode, String detail) {
    super(errorCode.status(), createProblem(errorCode, detail), null);
    this.errorCode = errorCode;
  }

  public SequenceErrorCode getErrorCode() {
    return errorCode;
  }

  public static SequenceException configNotFound(SequenceScope scope) {
    return new SequenceException(
        SequenceErrorCode.CONFIG_NOT_FOUND, "No active sequence configuration for " + scope);
  }

  public static SequenceException configNotFound(UUID configId) {
    return new SequenceException(
        SequenceErrorCode.CONFIG_NOT_FOUND, "No sequence configuration found with id " + configId);
  }

  public static SequenceException referenceNotFound(String kind, UUID categoryId) {
    return new SequenceException(
        SequenceErrorCode.REFERENCE_NOT_FOUND, "No " + kind + " found with id " + categoryId);
  }

  public static SequenceException exhausted(SequenceScope scope, int attempts) {
    return new SequenceException(
        SequenceErrorCode.GENERATION_EXHAUSTED,
        "No free identifier for "
            + scope
            + " after "
            + attempts
            + " attempts. Check for duplicate sequences in the machine records.");
  }

  public static SequenceException cancelled(SequenceScope scope) {
    return new SequenceException(
        SequenceErrorCode.GENERATION_CANCELLED,
        "Sequence generation for " + scope + " was interrupted");
  }

  public static SequenceException duplicateConfig(SequenceScope scope) {
    return new SequenceException(
        SequenceErrorCode.DUPLICATE_CONFIG,
        "A sequence configuration already exists for " + scope);
  }

  public static SequenceException invalidTemplate(String detail) {
    return new SequenceException(SequenceErrorCode.INVALID_TEMPLATE, detail);
  }

  public static SequenceException invalidPrefix(String prefix) {
    return new SequenceException(
        SequenceErrorCode.INVALID_PREFIX,
        "Prefix must be 1-10 characters of uppercase letters, digits and hyphens: " + prefix);
  }

  public static SequenceException invalidStartingNumber(Long startingNumber) {
    return new SequenceException(
        SequenceErrorCode.INVALID_STARTING_NUMBER,
        "Starting number must be at least 1, got " + startingNumber);
  }

  private static ProblemDetail createProblem(SequenceErrorCode errorCode, String detail) {
    var problem = ProblemDetail.forStatus(errorCode.status());
    problem.setTitle(errorCode.title());
    problem.setDetail(detail);
    problem.setProperty("code", errorCode.code());
    return problem;
  }
}
