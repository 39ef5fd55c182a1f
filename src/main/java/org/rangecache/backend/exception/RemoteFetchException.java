package org.rangecache.backend.exception;

/**
 * Failure reported by, or while reaching, the remote table source. {@code status} is the remote
 * HTTP status, or 0 when no response was received.
 */
public class RemoteFetchException extends RuntimeException {

  private final int status;

  public RemoteFetchException(int status, String message) {
    super(message);
    this.status = status;
  }

  public RemoteFetchException(int status, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  public int getStatus() {
    return status;
  }
}
