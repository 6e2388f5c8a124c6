package com.openavail.availability;

import com.openavail.availability.config.AvailabilityProperties;
import com.openavail.availability.document.DocumentFormat;
import com.openavail.availability.domain.service.AvailabilityService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the application context with the shipped {@code application.yml}.
 */
@SpringBootTest
class AvailabilityServiceApplicationTest {

    @Autowired
    private AvailabilityProperties properties;

    @Autowired
    private AvailabilityService availabilityService;

    @Test
    @DisplayName("context: business rules bound from application.yml")
    void contextLoads_propertiesBound() {
        assertThat(properties.allowedLanguages()).containsExactlyInAnyOrder("en", "fr", "de", "es");
        assertThat(properties.maxDestinations()).isEqualTo(10);
        assertThat(properties.defaultOptionsQuota()).isEqualTo(20);
        assertThat(properties.enforceChildAccompaniment()).isFalse();
        assertThat(properties.defaults().market()).isEqualTo("ES");
        assertThat(properties.pricing().supplierHotelCode()).isEqualTo("39971881");
        assertThat(properties.pricing().markupPercentage()).isEqualByComparingTo("3.2");
    }

    @Test
    @DisplayName("context: wired pipeline answers a rule violation with an error object")
    void process_invalidLanguage_errorResponse() {
        String response = availabilityService.process(
                "<AvailRQ><source><languageCode>it</languageCode></source></AvailRQ>", DocumentFormat.XML);

        assertThat(response).isEqualTo("{\"error\":\"Invalid language code: it\"}");
    }
}
