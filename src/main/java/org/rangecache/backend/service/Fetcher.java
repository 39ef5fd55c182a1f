package org.rangecache.backend.service;

import org.rangecache.backend.exception.RemoteFetchException;
import org.rangecache.backend.model.FetchRequest;
import org.rangecache.backend.model.FetchResult;

/** Remote table source. Retries, if any, belong to the implementation. */
public interface Fetcher {

  /**
   * @throws RemoteFetchException when the remote side fails or cannot be reached
   */
  FetchResult fetch(FetchRequest request);
}
