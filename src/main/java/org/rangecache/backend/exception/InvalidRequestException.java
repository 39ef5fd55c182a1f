package org.rangecache.backend.exception;

/** Request rejected before any cache or remote interaction (unknown table, bad filter syntax, ...). */
public class InvalidRequestException extends RuntimeException {

  public InvalidRequestException(String message) {
    super(message);
  }

  public InvalidRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
