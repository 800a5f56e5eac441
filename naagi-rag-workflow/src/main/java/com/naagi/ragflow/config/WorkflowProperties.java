package com.naagi.ragflow.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "naagi.workflow")
public class WorkflowProperties {

    @Valid
    private RetryConfig retry = new RetryConfig();
    @Valid
    private RetrievalConfig retrieval = new RetrievalConfig();
    @Valid
    private QualityConfig quality = new QualityConfig();
    @Valid
    private HybridConfig hybrid = new HybridConfig();
    @Valid
    private RerankConfig rerank = new RerankConfig();
    @Valid
    private CacheConfig cache = new CacheConfig();
    @Valid
    private TimeoutConfig timeouts = new TimeoutConfig();
    @Valid
    private FormatConfig format = new FormatConfig();
    @Valid
    private HistoryConfig history = new HistoryConfig();
    @Valid
    private CheckpointConfig checkpoint = new CheckpointConfig();
    @Valid
    private ExecutorConfig executor = new ExecutorConfig();
    @Valid
    private HttpConfig http = new HttpConfig();

    @Data
    public static class RetryConfig {
        @Min(0)
        private int maxRetries = 2;
        @NotNull
        private Duration initialDelay = Duration.ofSeconds(1);
        @DecimalMin("1.0")
        private double backoffFactor = 2.0;
    }

    @Data
    public static class RetrievalConfig {
        @Min(1)
        private int topK = 5;
    }

    @Data
    public static class QualityConfig {
        @Min(0)
        private int fastPathMinChunks = 3;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double fastPathMinSimilarity = 0.7;
    }

    @Data
    public static class HybridConfig {
        @DecimalMin("0.0")
        private double semanticWeight = 0.7;
        @DecimalMin("0.0")
        private double keywordWeight = 0.3;
        @Min(1)
        private int finalK = 5;
        private int keywordTopK = 10;
        // > retrieval.topK issues a wider semantic query next to the keyword search
        private int semanticCandidateK = 5;
    }

    @Data
    public static class RerankConfig {
        private boolean enabled = true;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        @Min(1)
        private int capacity = 500;
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double similarityThreshold = 0.85;
    }

    @Data
    public static class TimeoutConfig {
        private Duration router = Duration.ofSeconds(20);
        private Duration embedding = Duration.ofSeconds(15);
        private Duration vectorSearch = Duration.ofSeconds(15);
        private Duration keywordSearch = Duration.ofSeconds(15);
        private Duration generation = Duration.ofSeconds(60);
        private Duration scoring = Duration.ofSeconds(15);
    }

    @Data
    public static class FormatConfig {
        @Min(1)
        private int previewLength = 100;
    }

    @Data
    public static class HistoryConfig {
        private int summaryTurns = 4;
    }

    @Data
    public static class CheckpointConfig {
        private boolean enabled = true;
    }

    @Data
    public static class ExecutorConfig {
        private int poolSize = 16;
        private int requestPoolSize = 8;
    }

    // adapter HTTP settings; per-call deadlines are the timeouts above
    @Data
    public static class HttpConfig {
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(120);
    }
}
