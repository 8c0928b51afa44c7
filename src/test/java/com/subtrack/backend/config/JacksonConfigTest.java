package com.subtrack.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.subtrack.backend.dto.CreateSubscriptionRequest;
import com.subtrack.backend.dto.UpdateSubscriptionRequest;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.*;

class JacksonConfigTest {

    private static final String CREATE_BODY = """
            {"name":"Netflix","price":15.99,"currency":"USD","frequency":"monthly",
             "category":"Streaming","paymentMethod":"Credit Card",
             "startDate":"%s","renewalDate":"%s"}
            """;

    @Test
    void dateOnlyValuesMeanStartOfDayInUtcByDefault() throws Exception {
        ObjectMapper mapper = new JacksonConfig().objectMapper();

        CreateSubscriptionRequest request = mapper.readValue(
                CREATE_BODY.formatted("2024-01-15", "2024-02-15"), CreateSubscriptionRequest.class);

        assertThat(request.getStartDate()).isEqualTo(OffsetDateTime.parse("2024-01-15T00:00:00Z"));
        assertThat(request.getRenewalDate()).isEqualTo(OffsetDateTime.parse("2024-02-15T00:00:00Z"));
    }

    @Test
    void dateOnlyValuesUseTheConfiguredTimeZone() throws Exception {
        ObjectMapper mapper = new JacksonConfig("Asia/Kolkata").objectMapper();

        UpdateSubscriptionRequest request = mapper.readValue(
                "{\"renewalDate\":\"2024-02-15\"}", UpdateSubscriptionRequest.class);

        assertThat(request.getRenewalDate()).isEqualTo(OffsetDateTime.parse("2024-02-15T00:00:00+05:30"));
        assertThat(request.getRenewalDate().toInstant()).isEqualTo(OffsetDateTime.parse("2024-02-14T18:30:00Z").toInstant());
    }

    @Test
    void fullTimestampsAreStillAccepted() throws Exception {
        ObjectMapper mapper = new JacksonConfig("Asia/Kolkata").objectMapper();

        CreateSubscriptionRequest request = mapper.readValue(
                CREATE_BODY.formatted("2024-01-15T09:30:00Z", "2024-02-15T09:30:00+01:00"), CreateSubscriptionRequest.class);

        assertThat(request.getStartDate().toInstant()).isEqualTo(OffsetDateTime.parse("2024-01-15T09:30:00Z").toInstant());
        assertThat(request.getRenewalDate().toInstant()).isEqualTo(OffsetDateTime.parse("2024-02-15T08:30:00Z").toInstant());
    }

    @Test
    void impossibleDateIsRejected() {
        ObjectMapper mapper = new JacksonConfig().objectMapper();

        assertThatThrownBy(() -> mapper.readValue("{\"renewalDate\":\"2024-02-30\"}", UpdateSubscriptionRequest.class))
                .isInstanceOf(InvalidFormatException.class);
    }
}
