package com.openavail.availability.domain.service;

import com.openavail.availability.document.AvailRequestDocument;
import com.openavail.availability.document.AvailRequestDocumentReader;
import com.openavail.availability.document.DocumentFormat;
import com.openavail.availability.domain.exception.AvailabilityValidationException;
import com.openavail.availability.domain.model.PricedOffer;
import com.openavail.availability.domain.model.ValidatedRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Availability request pipeline: read, validate, price, serialize.
 * <p>
 * A business-rule violation is answered with {@code {"error": "..."}}.
 * A document that cannot be read at all raises
 * {@link com.openavail.availability.document.MalformedRequestException} instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final AvailRequestDocumentReader documentReader;
    private final RequestValidator requestValidator;
    private final ResponseBuilder responseBuilder;

    public String process(String content, DocumentFormat format) {
        AvailRequestDocument document = documentReader.read(content, format);
        return process(document);
    }

    public String process(AvailRequestDocument document) {
        try {
            ValidatedRequest request = requestValidator.validate(document);
            List<PricedOffer> offers = responseBuilder.build(request);
            log.info("Availability request accepted: searchType={}, destinations={}, rooms={}, company={}",
                    request.searchType(), offers.size(), request.rooms().size(),
                    request.credentials().companyId());
            return responseBuilder.render(offers);
        } catch (AvailabilityValidationException ex) {
            log.warn("Availability request rejected [{}]: {}", ex.getErrorCode(), ex.getMessage());
            return responseBuilder.renderError(ex);
        }
    }
}
