package com.openavail.availability.domain.service;

import com.openavail.availability.config.AvailabilityProperties;
import com.openavail.availability.document.AvailRequestDocument;
import com.openavail.availability.domain.exception.DateRuleException;
import com.openavail.availability.domain.exception.DestinationCountException;
import com.openavail.availability.domain.exception.InvalidLanguageException;
import com.openavail.availability.domain.exception.InvalidSearchTypeException;
import com.openavail.availability.domain.exception.MissingCredentialException;
import com.openavail.availability.domain.exception.QuotaExceededException;
import com.openavail.availability.domain.exception.RoomCapacityException;
import com.openavail.availability.domain.exception.UnaccompaniedChildException;
import com.openavail.availability.domain.model.Credentials;
import com.openavail.availability.domain.model.Destination;
import com.openavail.availability.domain.model.Occupant;
import com.openavail.availability.domain.model.RoomOccupancy;
import com.openavail.availability.domain.model.SearchType;
import com.openavail.availability.domain.model.ValidatedRequest;
import com.openavail.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Applies the availability business rules to a request document.
 * <p>
 * Rules run in a fixed order and the first violation is thrown:
 * language, credentials, search type and destinations, stay dates, options quota,
 * currency/nationality/market (defaulted, never rejected), rooms and occupants.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestValidator {

    private static final DateTimeFormatter STAY_DATE_FORMAT = DateTimeFormatter
            .ofPattern(Constants.STAY_DATE_PATTERN)
            .withResolverStyle(ResolverStyle.STRICT);

    private final AvailabilityProperties properties;
    private final Clock clock;

    public ValidatedRequest validate(AvailRequestDocument document) {
        String languageCode = resolveLanguage(document.languageCode());
        Credentials credentials = validateCredentials(document);
        SearchType searchType = resolveSearchType(document.searchType());
        validateDestinations(searchType, document.destinations());
        Stay stay = validateStay(document.startDate(), document.endDate());
        int optionsQuota = resolveOptionsQuota(document.optionsQuota());

        AvailabilityProperties.Defaults defaults = properties.defaults();
        String currency = resolveOrDefault("currency", document.currency(),
                properties.allowedCurrencies(), defaults.currency());
        String nationality = resolveOrDefault("nationality", document.nationality(),
                properties.allowedNationalities(), defaults.nationality());
        String market = resolveOrDefault("market", document.market(),
                properties.allowedMarkets(), defaults.market());

        List<RoomOccupancy> rooms = validateRooms(document.rooms());

        return ValidatedRequest.builder()
                .languageCode(languageCode)
                .optionsQuota(optionsQuota)
                .credentials(credentials)
                .searchType(searchType)
                .destinations(document.destinations())
                .stayStart(stay.start())
                .stayEnd(stay.end())
                .currency(currency)
                .nationality(nationality)
                .market(market)
                .rooms(rooms)
                .build();
    }

    /**
     * The default only replaces an absent language; a present but unknown one is rejected.
     */
    private String resolveLanguage(String languageCode) {
        String resolved = languageCode == null ? properties.defaults().language() : languageCode;
        if (!properties.allowedLanguages().contains(resolved)) {
            throw new InvalidLanguageException(resolved, properties.allowedLanguages());
        }
        return resolved;
    }

    private Credentials validateCredentials(AvailRequestDocument document) {
        List<String> missing = new ArrayList<>();
        if (isEmpty(document.password())) {
            missing.add("password");
        }
        if (isEmpty(document.username())) {
            missing.add("username");
        }
        if (isEmpty(document.companyId())) {
            missing.add("CompanyID");
        }
        if (!missing.isEmpty()) {
            throw new MissingCredentialException(missing);
        }
        return new Credentials(document.username(), document.password(), document.companyId());
    }

    private SearchType resolveSearchType(String searchType) {
        return SearchType.fromWireValue(searchType)
                .orElseThrow(() -> new InvalidSearchTypeException(searchType));
    }

    private void validateDestinations(SearchType searchType, List<Destination> destinations) {
        int count = destinations.size();
        if (searchType == SearchType.SINGLE && count != 1) {
            throw new DestinationCountException(searchType, count, 1);
        }
        if (searchType == SearchType.MULTIPLE && count > properties.maxDestinations()) {
            throw new DestinationCountException(searchType, count, properties.maxDestinations());
        }
    }

    /**
     * Start must fall strictly after today plus the lead time: with a two day lead,
     * today+2 is rejected and today+3 is the earliest accepted start.
     */
    private Stay validateStay(String startText, String endText) {
        if (startText == null || endText == null) {
            throw DateRuleException.datesRequired();
        }
        LocalDate start = parseStayDate("StartDate", startText);
        LocalDate end = parseStayDate("EndDate", endText);
        LocalDate earliestRejected = LocalDate.now(clock).plusDays(properties.minLeadDays());
        if (!start.isAfter(earliestRejected)) {
            throw DateRuleException.leadTime(start, end, properties.minLeadDays());
        }
        if (ChronoUnit.DAYS.between(start, end) < properties.minNights()) {
            throw DateRuleException.minimumStay(start, end, properties.minNights());
        }
        return new Stay(start, end);
    }

    private static LocalDate parseStayDate(String field, String value) {
        try {
            return LocalDate.parse(value, STAY_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw DateRuleException.invalidFormat(field, value, e);
        }
    }

    private int resolveOptionsQuota(Integer optionsQuota) {
        int resolved = optionsQuota == null || optionsQuota == 0
                ? properties.defaultOptionsQuota()
                : optionsQuota;
        if (resolved > properties.maxOptionsQuota()) {
            throw new QuotaExceededException(resolved, properties.maxOptionsQuota());
        }
        return resolved;
    }

    private String resolveOrDefault(String field, String value, Set<String> allowed, String defaultValue) {
        if (value != null && allowed.contains(value)) {
            return value;
        }
        log.debug("Using default {} {} in place of {}", field, defaultValue, value);
        return defaultValue;
    }

    private List<RoomOccupancy> validateRooms(List<AvailRequestDocument.RoomEntry> roomEntries) {
        if (roomEntries.size() > properties.maxRooms()) {
            throw RoomCapacityException.tooManyRooms(roomEntries.size(), properties.maxRooms());
        }
        List<RoomOccupancy> rooms = new ArrayList<>(roomEntries.size());
        int roomNumber = 0;
        for (AvailRequestDocument.RoomEntry entry : roomEntries) {
            roomNumber++;
            if (entry.ages().size() > properties.maxGuestsPerRoom()) {
                throw RoomCapacityException.tooManyGuests(
                        roomNumber, entry.ages().size(), properties.maxGuestsPerRoom());
            }
            RoomOccupancy room = new RoomOccupancy(entry.ages().stream()
                    .map(age -> Occupant.of(age, properties.childAgeThreshold()))
                    .toList());
            if (room.hasUnaccompaniedChildren()) {
                if (properties.enforceChildAccompaniment()) {
                    throw new UnaccompaniedChildException(roomNumber, room.childCount());
                }
                log.debug("Room {} has {} children and no adult, accepted", roomNumber, room.childCount());
            }
            rooms.add(room);
        }
        return rooms;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    private record Stay(LocalDate start, LocalDate end) {
    }
}
