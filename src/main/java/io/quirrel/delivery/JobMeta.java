package io.quirrel.delivery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.quirrel.util.Jsons;

import java.time.Instant;
import java.util.List;

/**
 * Delivery metadata carried in the {@value #HEADER} header.
 *
 * @param count          attempt or repetition number, starting at 1
 * @param nextRepetition when the next repetition fires, null for one-shot jobs
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobMeta(String id, Integer count, List<Long> retry, Instant nextRepetition, Boolean exclusive) {
    public static final String HEADER = "x-quirrel-meta";

    public static JobMeta empty() {
        return new JobMeta(null, null, null, null, null);
    }

    /**
     * Parses the header value. A missing header yields {@link #empty()}.
     *
     * @throws IllegalArgumentException if the header is present but not a JSON object
     */
    public static JobMeta parse(String header) {
        if (header == null || header.isBlank()) {
            return empty();
        }
        try {
            JobMeta meta = Jsons.compact().readValue(header, JobMeta.class);
            return meta == null ? empty() : meta;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + HEADER + " header", e);
        }
    }

    public String toHeader() {
        return Jsons.toCompactJson(this);
    }
}
