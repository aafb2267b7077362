package io.b2mash.ismsp.exception;

public class NotFoundException extends IsmsException {

  public NotFoundException(String resourceType, Object id) {
    super(
        ErrorKind.NOT_FOUND,
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " found with id " + id,
        null);
  }

  public static NotFoundException withDetail(String title, String detail) {
    return new NotFoundException(title, detail, ErrorKind.NOT_FOUND);
  }

  private NotFoundException(String title, String detail, ErrorKind kind) {
    super(kind, title, detail, null);
  }
}
