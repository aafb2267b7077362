package io.b2mash.ismsp.exception;

import org.springframework.http.HttpStatus;

/** Failure categories surfaced to callers of the tool operations. */
public enum ErrorKind {
  VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
  NOT_FOUND(HttpStatus.NOT_FOUND),
  SCHEMA_MISSING(HttpStatus.SERVICE_UNAVAILABLE),
  STORAGE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

  private final HttpStatus status;

  ErrorKind(HttpStatus status) {
    this.status = status;
  }

  public HttpStatus status() {
    return status;
  }
}
