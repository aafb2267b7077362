package io.b2mash.ismsp.store;

/** Raised when SQLite reports the database busy or locked; retried by {@link StoreTemplate}. */
public class StoreContentionException extends RuntimeException {

  public StoreContentionException(String message, Throwable cause) {
    super(message, cause);
  }
}
