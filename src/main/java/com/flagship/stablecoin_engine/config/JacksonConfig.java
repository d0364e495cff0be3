package com.flagship.stablecoin_engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.math.BigInteger;

/**
 * Jackson configuration shared by the REST layer and event forwarding.
 *
 * Key features:
 * - Java 8 date/time support, ISO-8601 instead of timestamps
 * - BigInteger written as a JSON string; 18-decimal amounts overflow
 *   the double precision most JSON clients parse numbers into
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(new ParameterNamesModule());

        SimpleModule amounts = new SimpleModule("amounts");
        amounts.addSerializer(BigInteger.class, ToStringSerializer.instance);
        mapper.registerModule(amounts);

        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        return mapper;
    }
}
