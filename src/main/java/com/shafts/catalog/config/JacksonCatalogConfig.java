package com.shafts.catalog.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonCatalogConfig {

    /**
     * The {@link ObjectMapper} used for catalog JSON: exports, snapshots, raw JSON ingestion and
     * the REST layer.
     * <p>
     * Property names come from the {@code @JsonProperty} annotations on the model, so they are
     * the canonical column names regardless of any naming strategy.
     *
     * @return ObjectMapper for catalog documents
     */
    @Bean
    @Qualifier("catalogObjectMapper")
    public ObjectMapper catalogObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
