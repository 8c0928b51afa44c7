package com.subtrack.backend.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.subtrack.backend.util.DateOrDateTimeDeserializer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

@Configuration
public class JacksonConfig {

    private final ZoneId zone;

    public JacksonConfig() {
        this(ZoneOffset.UTC.getId());
    }

    @Autowired
    public JacksonConfig(@Value("${app.time-zone:UTC}") String timeZone) {
        this.zone = ZoneId.of(timeZone);
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // OffsetDateTime support, written as ISO-8601 strings
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // Clients may send "2024-02-15" for a date; registered after JavaTimeModule so it wins
        SimpleModule dates = new SimpleModule("date-or-date-time");
        dates.addDeserializer(OffsetDateTime.class, new DateOrDateTimeDeserializer(zone));
        mapper.registerModule(dates);

        // Don't fail on empty beans (handles Hibernate proxies)
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        return mapper;
    }
}
