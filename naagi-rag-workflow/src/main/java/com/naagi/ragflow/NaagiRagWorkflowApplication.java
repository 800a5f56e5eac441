package com.naagi.ragflow;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
@OpenAPIDefinition(
    info = @Info(
        title = "NAAGI RAG Workflow API",
        version = "1.0.0",
        description = "Question answering over categorized documents: routing, hybrid retrieval, " +
                     "reranking, fallback search, checkpointing and a conversation answer cache."
    )
)
public class NaagiRagWorkflowApplication {
    public static void main(String[] args) {
        SpringApplication.run(NaagiRagWorkflowApplication.class, args);
    }
}
