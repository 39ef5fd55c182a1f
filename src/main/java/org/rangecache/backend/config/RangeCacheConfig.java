package org.rangecache.backend.config;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import org.rangecache.backend.cache.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties({CacheProperties.class, RemoteSourceProperties.class})
public class RangeCacheConfig {

  private static final Logger log = LoggerFactory.getLogger(RangeCacheConfig.class);

  @Bean
  public Clock clock(CacheProperties cacheProperties) {
    String zone = cacheProperties.getZone();
    ZoneId zoneId = (zone == null || zone.isBlank()) ? ZoneId.systemDefault() : ZoneId.of(zone);
    log.info("🕐 Cache day boundary zone: {}", zoneId);
    return Clock.system(zoneId);
  }

  /** One store per application context; tests build their own. */
  @Bean
  public CacheStore cacheStore(Clock clock, CacheProperties cacheProperties) {
    return new CacheStore(clock, cacheProperties.getRowWarningThreshold());
  }

  @Bean
  public RestTemplate remoteRestTemplate(RestTemplateBuilder builder, RemoteSourceProperties remote) {
    RestTemplateBuilder b = builder
        .setConnectTimeout(Duration.ofMillis(remote.getConnectTimeoutMs()))
        .setReadTimeout(Duration.ofMillis(remote.getReadTimeoutMs()));
    if (remote.getUsername() != null && !remote.getUsername().isBlank()) {
      b = b.basicAuthentication(remote.getUsername(), remote.getPassword() != null ? remote.getPassword() : "");
    } else {
      log.warn("⚠️ remote.username is not set, remote calls go out without credentials");
    }
    return b.build();
  }
}
