package io.scrapehive.scraper.discovery;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * A pod as listed in the discovery file: identity, IP and the annotations and labels that
 * decide whether and how it is scraped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PodEndpoint(
    String name,
    String namespace,
    String ip,
    Map<String, String> annotations,
    Map<String, String> labels
) {
    public PodEndpoint {
        annotations = annotations == null ? Map.of() : annotations;
        labels = labels == null ? Map.of() : labels;
    }

    public String key() {
        return (namespace == null ? "" : namespace) + "/" + name;
    }

    public String annotation(String key, String defaultValue) {
        String value = annotations.get(key);
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
