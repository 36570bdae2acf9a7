package com.umitunal.pipeq.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An item found on the listing: its canonical URL plus whatever descriptive fields the
 * parser could extract. Every field except the URL may be null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Subject {
    private final String url;
    private final String title;
    private final String identifier;
    private final Map<String, String> attributes;

    @JsonCreator
    public Subject(@JsonProperty("url") String url,
                   @JsonProperty("title") String title,
                   @JsonProperty("identifier") String identifier,
                   @JsonProperty("attributes") Map<String, String> attributes) {
        this.url = Objects.requireNonNull(url, "url");
        this.title = title;
        this.identifier = identifier;
        this.attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Subject(String url, String title, String identifier) {
        this(url, title, identifier, null);
    }

    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public String getIdentifier() { return identifier; }
    public Map<String, String> getAttributes() { return attributes; }

    /**
     * Short human label for log lines: identifier, then title, then URL.
     */
    public String label() {
        if (identifier != null && !identifier.isBlank()) {
            return identifier;
        }
        if (title != null && !title.isBlank()) {
            return title;
        }
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Subject)) return false;
        Subject other = (Subject) o;
        return url.equals(other.url)
                && Objects.equals(title, other.title)
                && Objects.equals(identifier, other.identifier)
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, title, identifier, attributes);
    }

    @Override
    public String toString() {
        return String.format("Subject{url='%s', title='%s', identifier='%s'}", url, title, identifier);
    }
}
