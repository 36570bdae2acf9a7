package com.umitunal.pipeq.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.pipeq.model.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a JSON listing: either an array of items or an object with an {@code items} array.
 *
 * Each item needs a {@code url} (or {@code link}); {@code title} and {@code identifier} are
 * picked up when present and every other scalar field lands in the subject's attributes.
 * Relative URLs are resolved against the base URL. Items without a usable URL are dropped,
 * and repeated URLs keep their first occurrence.
 */
public class JsonListingParser implements ListingParser {
    private static final Logger log = LoggerFactory.getLogger(JsonListingParser.class);

    private final ObjectMapper mapper;

    public JsonListingParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<Subject> parse(String rawListing, String baseUrl) {
        if (rawListing == null || rawListing.isBlank()) {
            return List.of();
        }

        JsonNode root;
        try {
            root = mapper.readTree(rawListing);
        } catch (JsonProcessingException e) {
            log.warn("Listing is not valid JSON: {}", e.getOriginalMessage());
            return List.of();
        }

        JsonNode items = root.isArray() ? root : root.path("items");
        if (!items.isArray()) {
            log.warn("Listing has no item array");
            return List.of();
        }

        Map<String, Subject> subjects = new LinkedHashMap<>();
        for (JsonNode item : items) {
            if (!item.isObject()) {
                continue;
            }
            String url = resolve(baseUrl, text(item, "url", text(item, "link", null)));
            if (url == null) {
                continue;
            }
            subjects.putIfAbsent(url, new Subject(url, text(item, "title", null),
                    text(item, "identifier", null), attributes(item)));
        }
        return new ArrayList<>(subjects.values());
    }

    private static Map<String, String> attributes(JsonNode item) {
        Map<String, String> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode value = field.getValue();
            if (name.equals("url") || name.equals("link") || name.equals("title") || name.equals("identifier")) {
                continue;
            }
            if (value.isValueNode() && !value.isNull()) {
                attributes.put(name, value.asText());
            }
        }
        return attributes;
    }

    private static String text(JsonNode item, String field, String fallback) {
        JsonNode value = item.get(field);
        if (value == null || !value.isValueNode() || value.isNull() || value.asText().isBlank()) {
            return fallback;
        }
        return value.asText().trim();
    }

    private static String resolve(String baseUrl, String link) {
        if (link == null) {
            return null;
        }
        try {
            URI uri = baseUrl == null ? URI.create(link) : URI.create(baseUrl).resolve(link);
            return uri.isAbsolute() ? uri.toString() : null;
        } catch (IllegalArgumentException e) {
            log.debug("Skipping unparseable link {}", link);
            return null;
        }
    }
}
