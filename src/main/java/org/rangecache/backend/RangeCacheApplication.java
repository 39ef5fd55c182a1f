package org.rangecache.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RangeCacheApplication {

  public static void main(String[] args) {
    SpringApplication.run(RangeCacheApplication.class, args);
  }
}
