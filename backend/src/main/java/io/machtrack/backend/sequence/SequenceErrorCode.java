package io.machtrack.backend.sequence;

import org.springframework.http.HttpStatus;

/** Typed failures raised by the sequence engine, with the HTTP status each one maps to. */
public enum SequenceErrorCode {
  CONFIG_NOT_FOUND(
      "SEQUENCE_CONFIG_NOT_FOUND", HttpStatus.NOT_FOUND, "Sequence configuration not found"),
  REFERENCE_NOT_FOUND(
      "SEQUENCE_REFERENCE_NOT_FOUND", HttpStatus.NOT_FOUND, "Category or subcategory not found"),
  GENERATION_EXHAUSTED(
      "SEQUENCE_GENERATION_EXHAUSTED",
      HttpStatus.INTERNAL_SERVER_ERROR,
      "Unable to generate a unique sequence"),
  GENERATION_CANCELLED(
      "SEQUENCE_GENERATION_CANCELLED",
      HttpStatus.SERVICE_UNAVAILABLE,
      "Sequence generation was cancelled"),
  DUPLICATE_CONFIG(
      "DUPLICATE_SEQUENCE_CONFIG", HttpStatus.CONFLICT, "Sequence configuration already exists"),
  INVALID_TEMPLATE(
      "INVALID_SEQUENCE_TEMPLATE", HttpStatus.BAD_REQUEST, "Invalid sequence template"),
  INVALID_PREFIX("INVALID_SEQUENCE_PREFIX", HttpStatus.BAD_REQUEST, "Invalid sequence prefix"),
  INVALID_STARTING_NUMBER(
      "INVALID_STARTING_NUMBER", HttpStatus.BAD_REQUEST, "Invalid starting number");

  private final String code;
  private final HttpStatus status;
  private final String title;

  SequenceErrorCode(String code, HttpStatus status, String title) {
    this.code = code;
    this.status = status;
    this.title = title;
  }

  public String code() {
    return code;
  }

  public HttpStatus status() {
    return status;
  }

  public String title() {
    return title;
  }
}
