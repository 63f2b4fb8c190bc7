package io.b2mash.payables.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the unified entry feed.
 *
 * @param defaultPageSize page size used when the caller sends none
 * @param maxPageSize upper bound on the requested page size
 */
@ConfigurationProperties(prefix = "payables.feed")
public record FeedProperties(int defaultPageSize, int maxPageSize) {

  public FeedProperties {
    if (defaultPageSize <= 0) {
      defaultPageSize = 25;
    }
    if (maxPageSize <= 0) {
      maxPageSize = 100;
    }
  }
}
