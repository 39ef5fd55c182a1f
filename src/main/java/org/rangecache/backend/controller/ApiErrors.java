package org.rangecache.backend.controller;

import java.util.Map;
import org.rangecache.backend.exception.InvalidRequestException;
import org.rangecache.backend.exception.RemoteFetchException;
import org.slf4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/** Maps failures to the JSON error body shared by all endpoints. Never reports empty rows. */
final class ApiErrors {

  private ApiErrors() {}

  static ResponseEntity<Map<String, Object>> toResponse(Exception e, Map<String, Object> body, Logger log) {
    body.remove("rows");
    body.put("error", e.getMessage());

    if (e instanceof InvalidRequestException) {
      log.warn("Rejected request: {}", e.getMessage());
      return ResponseEntity.badRequest().body(body);
    }
    if (e instanceof RemoteFetchException remote) {
      log.error("Remote source failed: {}", e.getMessage(), e);
      body.put("remoteStatus", remote.getStatus());
      return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }
    log.error("Unexpected error: {}", e.getMessage(), e);
    return ResponseEntity.internalServerError().body(body);
  }
}
