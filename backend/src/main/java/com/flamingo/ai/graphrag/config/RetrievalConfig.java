package com.flamingo.ai.graphrag.config;

import com.flamingo.ai.graphrag.domain.enums.HopDiscountPolicy;
import com.flamingo.ai.graphrag.domain.enums.RetrievalMode;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "retrieval")
@Getter
@Setter
public class RetrievalConfig {

  private Request request = new Request();
  private Lexical lexical = new Lexical();
  private Embedding embedding = new Embedding();
  private Similarity similarity = new Similarity();
  private Graph graph = new Graph();
  private Fusion fusion = new Fusion();
  private Reranking reranking = new Reranking();

  @Getter
  @Setter
  public static class Request {
    private int defaultTopK = 10;
    private int maxTopK = 50;
    private String defaultNamespace = "Test_rel_2";
    private RetrievalMode defaultMode = RetrievalMode.GRAPH_HYBRID;

    /** Largest number of queries accepted by one batch retrieval. */
    private int maxBatchSize = 100;

    /** Characters of neighbor text kept in graph-context previews. */
    private int textPreviewLength = 100;
  }

  @Getter
  @Setter
  public static class Lexical {
    /** Seed candidates kept after word matching. */
    private int seedCandidates = 20;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Candidates kept after embedding reranking. */
    private int topK = 5;

    /** Inputs longer than this are truncated before embedding. */
    private int maxInputChars = 10_000;

    /** Optional instruction prefix prepended to queries (model dependent, empty by default). */
    private String queryPrefix = "";

    private String modelName = "text-embedding-3-small";
    private Integer dimensions = 768;
    private Duration timeout = Duration.ofSeconds(30);

    /**
     * When an embedding scan cannot obtain a query vector, seed the pipeline from word matching
     * instead of continuing with no candidates.
     */
    private boolean fallbackToLexicalSeeds = false;
  }

  @Getter
  @Setter
  public static class Similarity {
    /** "in-process" (cosine over fetched vectors) or "store" (computed by Neo4j). */
    private String mode = "in-process";
  }

  @Getter
  @Setter
  public static class Graph {
    /** "neo4j" or "in-memory". */
    private String store = "neo4j";

    private int hopDepth = 1;
    private int maxHopDepth = 3;
    private int neighborLimit = 10;
    private double neighborDiscount = 0.8;
    private HopDiscountPolicy discountPolicy = HopDiscountPolicy.COMPOUND;

    /** Traverse edges source to target only instead of in both directions. */
    private boolean directed = false;

    private Duration queryTimeout = Duration.ofSeconds(5);

    /** Node property holding the vector compared against the query embedding. */
    private String embeddingProperty = "original_embedding";

    private InMemory inMemory = new InMemory();

    @Getter
    @Setter
    public static class InMemory {
      /** Spring resource location of the JSON graph fixture; empty starts an empty graph. */
      private String fixture = "";
    }
  }

  @Getter
  @Setter
  public static class Fusion {
    /** Weight of the lexical signal; 1 - alpha goes to the embedding signal. */
    private double alpha = 0.5;
  }

  @Getter
  @Setter
  public static class Reranking {
    /** "tei" (cross-encoder served by Text Embeddings Inference) or "none". */
    private String strategy = "tei";

    private boolean enabledByDefault = false;
    private int topN = 5;

    private Tei tei = new Tei();

    /** Configuration for the TEI (Text Embeddings Inference) cross-encoder endpoint. */
    @Getter
    @Setter
    public static class Tei {
      private String baseUrl = "http://localhost:8090";
      private String modelId = "BAAI/bge-reranker-base";
      private boolean truncate = true;
      private boolean rawScores = false;
      private int readTimeoutMs = 10000;
    }
  }
}
