package io.b2mash.ismsp.exception;

public class SchemaMissingException extends IsmsException {

  public SchemaMissingException(String detail) {
    super(ErrorKind.SCHEMA_MISSING, "Requirement catalog unavailable", detail, null);
  }
}
