package com.packages.search.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonSearchConfig {

    /**
     * A dedicated {@link ObjectMapper} for catalogs and telemetry payloads.
     * <p>
     * • Has its own qualifier (<b>searchObjectMapper</b>) so it never clashes with a
     * mapper Spring Boot may auto‑configure.<br>
     * • Catalog documents may carry fields this application does not read.
     *
     * @return ObjectMapper for the search engine
     */
    @Bean
    @Qualifier("searchObjectMapper")
    public ObjectMapper searchObjectMapper() {

        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }

}
