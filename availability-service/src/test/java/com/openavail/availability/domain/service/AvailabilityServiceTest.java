package com.openavail.availability.domain.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openavail.availability.document.AvailRequestDocumentReader;
import com.openavail.availability.document.DocumentFormat;
import com.openavail.availability.document.MalformedRequestException;
import com.openavail.availability.domain.pricing.FixedNetRateSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.openavail.availability.AvailabilityTestFixtures.CLOCK;
import static com.openavail.availability.AvailabilityTestFixtures.TODAY;
import static com.openavail.availability.AvailabilityTestFixtures.properties;
import static com.openavail.availability.AvailabilityTestFixtures.resource;
import static com.openavail.availability.AvailabilityTestFixtures.sampleXml;
import static com.openavail.availability.AvailabilityTestFixtures.stayDate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link AvailabilityService}: document text in, response JSON out.
 */
class AvailabilityServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private AvailabilityService service;

    @BeforeEach
    void setUp() {
        service = new AvailabilityService(
                new AvailRequestDocumentReader(),
                new RequestValidator(properties(), CLOCK),
                new ResponseBuilder(new FixedNetRateSource(properties()), new ObjectMapper()));
    }

    @Test
    @DisplayName("process sample Multiple request with future dates: three priced offers")
    void process_sampleMultiple_threeOffers() throws Exception {
        String xml = sampleXml(TODAY.plusDays(10), TODAY.plusDays(13));

        JsonNode response = objectMapper.readTree(service.process(xml, DocumentFormat.XML));

        assertThat(response.isArray()).isTrue();
        assertThat(response.size()).isEqualTo(3);
        for (int i = 0; i < 3; i++) {
            JsonNode offer = response.get(i);
            assertThat(offer.get("id").asText()).isEqualTo("A#" + (i + 1));
            assertThat(offer.get("market").asText()).isEqualTo("ES");
            assertThat(offer.get("price").get("selling_price").decimalValue()).isEqualByComparingTo("136.65744");
            assertThat(offer.get("price").get("selling_currency").asText()).isEqualTo("USD");
        }
    }

    @Test
    @DisplayName("process sample request with its original 2024 dates: lead time error")
    void process_sampleWithPastDates_leadTimeError() throws Exception {
        String xml = resource("/requests/avail-rq-multiple.xml");

        JsonNode response = objectMapper.readTree(service.process(xml, DocumentFormat.XML));

        assertThat(response.get("error").asText()).isEqualTo("Start date must be at least 2 days after today.");
    }

    @Test
    @DisplayName("process Single request with three destinations: error object, no offers")
    void process_singleWithThreeDestinations_error() throws Exception {
        String xml = sampleXml(TODAY.plusDays(10), TODAY.plusDays(13))
                .replace("<SearchType>Multiple</SearchType>", "<SearchType>Single</SearchType>");

        JsonNode response = objectMapper.readTree(service.process(xml, DocumentFormat.XML));

        assertThat(response.isObject()).isTrue();
        assertThat(response.size()).isEqualTo(1);
        assertThat(response.get("error").asText()).contains("exactly one destination");
    }

    @Test
    @DisplayName("process JSON Single request: market and currency taken from the request")
    void process_jsonSingle_oneOffer() throws Exception {
        JsonNode response = objectMapper.readTree(
                service.process(resource("/requests/avail-rq-single.json"), DocumentFormat.JSON));

        assertThat(response.size()).isEqualTo(1);
        JsonNode offer = response.get(0);
        assertThat(offer.get("id").asText()).isEqualTo("A#1");
        assertThat(offer.get("market").asText()).isEqualTo("GB");
        assertThat(offer.get("price").get("currency").asText()).isEqualTo("USD");
        assertThat(offer.get("price").get("selling_currency").asText()).isEqualTo("GBP");
    }

    @Test
    @DisplayName("process request with bad language and bad end date: language reported first")
    void process_badLanguageAndBadDate_languageError() {
        String xml = resource("/requests/avail-rq-multiple.xml")
                .replace("<languageCode>en</languageCode>", "<languageCode>it</languageCode>")
                .replace("<EndDate>16/10/2024</EndDate>", "<EndDate>2030-14/03/2026</EndDate>");

        assertThat(service.process(xml, DocumentFormat.XML)).isEqualTo("{\"error\":\"Invalid language code: it\"}");
    }

    @Test
    @DisplayName("process request with end date not in day/month/year form: date error object")
    void process_badEndDate_dateError() throws Exception {
        String xml = sampleXml(TODAY.plusDays(10), TODAY.plusDays(13))
                .replace("<EndDate>" + stayDate(TODAY.plusDays(13)) + "</EndDate>", "<EndDate>2030-14/03/2026</EndDate>");

        JsonNode response = objectMapper.readTree(service.process(xml, DocumentFormat.XML));

        assertThat(response.size()).isEqualTo(1);
        assertThat(response.get("error").asText())
                .isEqualTo("EndDate must be a day/month/year date: 2030-14/03/2026");
    }

    @Test
    @DisplayName("process malformed document: MalformedRequestException propagates")
    void process_malformed_throws() {
        assertThatThrownBy(() -> service.process("<AvailRQ>", DocumentFormat.XML))
                .isInstanceOf(MalformedRequestException.class);
    }
}
