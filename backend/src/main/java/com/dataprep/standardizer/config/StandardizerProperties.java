package com.dataprep.standardizer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "standardizer")
public class StandardizerProperties {

  /** Pattern matches at or below this confidence are never canonicalized. */
  private double confidenceThreshold = 0.3;

  /** Pairs must be strictly more similar than this to be clustered. */
  private double similarityThreshold = 0.7;

  /** Above this many distinct values the similarity pass is skipped. */
  private int similarityMaxDistinctValues = 2000;

  private Recommendation recommendation = new Recommendation();

  private Analysis analysis = new Analysis();

  @Data
  public static class Recommendation {
    private int sampleSize = 100;
    private double dominanceRatio = 0.6;
  }

  @Data
  public static class Analysis {
    private long timeoutSeconds = 60;
    private int corePoolSize = 4;
    private int maxPoolSize = 8;
    private int queueCapacity = 100;
  }
}
