package com.products.lookup.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class JacksonLookupConfig {

    /**
     * A dedicated {@link ObjectMapper} for catalog and pricing payloads.
     * <p>
     * • Injected by qualifier (<b>lookupObjectMapper</b>) into the remote clients; being the
     * only mapper in the context, it also serialises the MVC responses.<br>
     * • Writes {@code LocalDate} and {@code Instant} as ISO strings.<br>
     * • Tolerates unknown fields: both remote services add fields freely.
     *
     * @return ObjectMapper for remote payloads
     */
    @Bean
    @Qualifier("lookupObjectMapper")
    public ObjectMapper lookupObjectMapper() {

        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }

    /**
     * Time source for session expiry and cache freshness.
     *
     * @return the system UTC clock
     */
    @Bean
    public Clock lookupClock() {
        return Clock.systemUTC();
    }
}
