package com.openavail.availability.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.openavail.availability.domain.model.Destination;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads an availability request (XML or JSON) into an {@link AvailRequestDocument}.
 * <p>
 * Both encodings are first parsed into a Jackson tree with the same shape: element names
 * become field names, attributes become fields of their element, and repeated elements
 * become arrays. Field extraction then works on the tree only.
 * <pre>
 * &lt;AvailRQ&gt;
 *   &lt;source&gt;&lt;languageCode&gt;en&lt;/languageCode&gt;&lt;/source&gt;
 *   &lt;optionsQuota&gt;20&lt;/optionsQuota&gt;
 *   &lt;Configuration&gt;&lt;Parameters&gt;
 *     &lt;Parameter password="..." username="..." CompanyID="..."/&gt;
 *   &lt;/Parameters&gt;&lt;/Configuration&gt;
 *   &lt;SearchType&gt;Multiple&lt;/SearchType&gt;
 *   &lt;StartDate&gt;14/10/2024&lt;/StartDate&gt;&lt;EndDate&gt;17/10/2024&lt;/EndDate&gt;
 *   &lt;Currency&gt;USD&lt;/Currency&gt;&lt;Nationality&gt;US&lt;/Nationality&gt;&lt;Market&gt;ES&lt;/Market&gt;
 *   &lt;AvailDestinations&gt;...&lt;/AvailDestinations&gt;
 *   &lt;Paxes&gt;&lt;Pax age="35"/&gt;&lt;Pax age="2"/&gt;&lt;/Paxes&gt;
 * &lt;/AvailRQ&gt;
 * </pre>
 */
@Slf4j
@Component
public class AvailRequestDocumentReader {

    private static final String JSON_ROOT = "AvailRQ";

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final XmlMapper xmlMapper = new XmlMapper();

    public AvailRequestDocument read(String content, DocumentFormat format) {
        if (content == null || content.isBlank()) {
            throw new MalformedRequestException("Request document is empty");
        }
        JsonNode root = parseTree(content, format);
        log.debug("Read {} request document with fields {}", format, root.size());
        return extract(root);
    }

    /**
     * Extracts the request fields from an already-parsed document tree.
     */
    public AvailRequestDocument extract(JsonNode root) {
        JsonNode parameter = first(root.path("Configuration").path("Parameters").path("Parameter"));

        return AvailRequestDocument.builder()
                .languageCode(trimmed(text(root.path("source").path("languageCode"))))
                .optionsQuota(optionsQuota(root.path("optionsQuota")))
                .username(text(parameter.path("username")))
                .password(text(parameter.path("password")))
                .companyId(text(parameter.path("CompanyID")))
                .searchType(trimmed(text(root.path("SearchType"))))
                .destinations(destinations(root.path("AvailDestinations")))
                .startDate(nonBlank(text(root.path("StartDate"))))
                .endDate(nonBlank(text(root.path("EndDate"))))
                .currency(trimmed(text(root.path("Currency"))))
                .nationality(trimmed(text(root.path("Nationality"))))
                .market(trimmed(text(root.path("Market"))))
                .rooms(rooms(root.path("Paxes")))
                .build();
    }

    private JsonNode parseTree(String content, DocumentFormat format) {
        try {
            JsonNode root = switch (format) {
                case XML -> xmlMapper.readTree(content);
                case JSON -> unwrapJsonRoot(jsonMapper.readTree(content));
            };
            if (root == null || !root.isObject()) {
                throw new MalformedRequestException("Request document has no element content");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedRequestException("Request document is not well-formed " + format, e);
        }
    }

    // XML drops the root element name; JSON documents may or may not carry it
    private JsonNode unwrapJsonRoot(JsonNode node) {
        if (node != null && node.size() == 1 && node.has(JSON_ROOT)) {
            return node.get(JSON_ROOT);
        }
        return node;
    }

    private List<Destination> destinations(JsonNode node) {
        List<Destination> destinations = new ArrayList<>();
        for (JsonNode entry : elements(node)) {
            String code = entry.isObject() ? text(entry.path("code")) : text(entry);
            destinations.add(new Destination(trimmed(code)));
        }
        return destinations;
    }

    private List<AvailRequestDocument.RoomEntry> rooms(JsonNode node) {
        List<AvailRequestDocument.RoomEntry> rooms = new ArrayList<>();
        for (JsonNode room : elements(node)) {
            List<Integer> ages = new ArrayList<>();
            for (JsonNode pax : elements(room.path("Pax"))) {
                ages.add(age(pax.path("age")));
            }
            rooms.add(new AvailRequestDocument.RoomEntry(ages));
        }
        return rooms;
    }

    private int age(JsonNode node) {
        Integer age = integer("age", node);
        if (age == null) {
            return 0;
        }
        if (age < 0) {
            throw new MalformedRequestException("Pax age must not be negative: " + age);
        }
        return age;
    }

    private Integer optionsQuota(JsonNode node) {
        Integer quota = integer("optionsQuota", node);
        if (quota != null && quota < 0) {
            throw new MalformedRequestException("optionsQuota must not be negative: " + quota);
        }
        return quota;
    }

    private Integer integer(String field, JsonNode node) {
        if (node.isIntegralNumber()) {
            if (!node.canConvertToInt()) {
                throw new MalformedRequestException(field + " is out of range: " + node.asText());
            }
            return node.intValue();
        }
        String value = trimmed(text(node));
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new MalformedRequestException(field + " is not a whole number: " + value, e);
        }
    }

    /**
     * Text content of a leaf, or of an element whose attributes turned it into an object.
     */
    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        if (node.isObject() && node.has("")) {
            return node.get("").asText();
        }
        return null;
    }

    private static String trimmed(String value) {
        return value == null ? null : value.trim();
    }

    private static String nonBlank(String value) {
        String trimmed = trimmed(value);
        return trimmed == null || trimmed.isEmpty() ? null : trimmed;
    }

    private static JsonNode first(JsonNode node) {
        return node.isArray() ? node.path(0) : node;
    }

    private static List<JsonNode> elements(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (node.isArray()) {
            List<JsonNode> elements = new ArrayList<>(node.size());
            node.forEach(elements::add);
            return elements;
        }
        return List.of(node);
    }
}
