package com.flamingo.ai.assessrec.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the recommendation pipeline. */
@Configuration
@ConfigurationProperties(prefix = "recommender")
@Getter
@Setter
public class RecommenderConfig {

  private Catalog catalog = new Catalog();
  private Query query = new Query();
  private Retrieval retrieval = new Retrieval();
  private Embedding embedding = new Embedding();
  private Diversity diversity = new Diversity();
  private Reranking reranking = new Reranking();
  private Confidence confidence = new Confidence();
  private Evaluation evaluation = new Evaluation();

  @Getter
  @Setter
  public static class Catalog {
    /** Spring resource location of the catalog JSON file. */
    private String location = "classpath:catalog/assessments.json";
  }

  @Getter
  @Setter
  public static class Query {
    private int maxLength = 2000;

    /** What to do with queries longer than {@code maxLength}: TRUNCATE or REJECT. */
    private OverflowPolicy overflowPolicy = OverflowPolicy.TRUNCATE;
  }

  public enum OverflowPolicy {
    TRUNCATE,
    REJECT
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int defaultK = 10;
    private int maxK = 10;

    /** Candidates fetched per requested result before diversity balancing. */
    private int overFetchMultiplier = 3;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** "local" (in-process MiniLM) or "openai". */
    private String provider = "local";

    private long timeoutMs = 2000;
    private int dimension = 384;
    private String queryPrefix = "";
    private String passagePrefix = "";
  }

  @Getter
  @Setter
  public static class Diversity {
    private boolean enabled = true;
  }

  @Getter
  @Setter
  public static class Reranking {
    /** Reranking strategy: "none" (default), "llm" (prompt-based) or "tei" (cross-encoder). */
    private String strategy = "none";

    private long timeoutMs = 5000;

    private Tei tei = new Tei();
    private Llm llm = new Llm();

    /** Configuration for TEI (Text Embeddings Inference) cross-encoder reranker. */
    @Getter
    @Setter
    public static class Tei {
      private String baseUrl = "http://localhost:8090";
      private String modelId = "cross-encoder/ms-marco-MiniLM-L6-v2";
      private boolean truncate = true;
      private boolean rawScores = false;
      private int readTimeoutMs = 10000;
    }

    @Getter
    @Setter
    public static class Llm {
      /** Maximum description characters sent per assessment. */
      private int maxPassageChars = 400;
    }
  }

  @Getter
  @Setter
  public static class Confidence {
    private double high = 0.6;
    private double medium = 0.35;
  }

  @Getter
  @Setter
  public static class Evaluation {
    /** Labelled query set read by the {@code evaluate} profile. */
    private String labeledSet = "classpath:evaluation/labeled-queries.json";

    private int k = 10;
  }
}
