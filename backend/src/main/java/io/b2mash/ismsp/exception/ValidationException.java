package io.b2mash.ismsp.exception;

public class ValidationException extends IsmsException {

  public ValidationException(String detail) {
    super(ErrorKind.VALIDATION_ERROR, "Invalid argument", detail, null);
  }

  public static ValidationException missing(String argument) {
    return new ValidationException("Required argument '" + argument + "' is missing or empty");
  }
}
