package io.b2mash.ismsp.exception;

public class StorageException extends IsmsException {

  public StorageException(String detail) {
    super(ErrorKind.STORAGE_ERROR, "Storage failure", detail, null);
  }

  public StorageException(String detail, Throwable cause) {
    super(ErrorKind.STORAGE_ERROR, "Storage failure", detail, cause);
  }
}
