package org.rangecache.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Connection settings for the remote OData source. */
@ConfigurationProperties(prefix = "remote")
public class RemoteSourceProperties {

  private String host;
  private String database;
  private String username;
  private String password;

  /** Overrides the {@code https://{host}/fmi/odata/v4/{database}} default when set. */
  private String baseUrl;

  private int connectTimeoutMs = 10_000;
  private int readTimeoutMs = 60_000;

  /** Rows per remote call when paging through a full fetch. */
  private int pageSize = 10_000;

  public String odataBaseUrl() {
    if (baseUrl != null && !baseUrl.isBlank()) {
      return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
    return "https://" + host + "/fmi/odata/v4/" + database;
  }

  public String getHost() {
    return host;
  }

  public void setHost(String host) {
    this.host = host;
  }

  public String getDatabase() {
    return database;
  }

  public void setDatabase(String database) {
    this.database = database;
  }

  public String getUsername() {
    return username;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public int getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  public void setConnectTimeoutMs(int connectTimeoutMs) {
    this.connectTimeoutMs = connectTimeoutMs;
  }

  public int getReadTimeoutMs() {
    return readTimeoutMs;
  }

  public void setReadTimeoutMs(int readTimeoutMs) {
    this.readTimeoutMs = readTimeoutMs;
  }

  public int getPageSize() {
    return pageSize;
  }

  public void setPageSize(int pageSize) {
    this.pageSize = pageSize;
  }
}
