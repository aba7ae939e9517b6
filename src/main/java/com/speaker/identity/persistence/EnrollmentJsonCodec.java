package com.speaker.identity.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.speaker.identity.core.model.EnrolledSpeaker;
import com.speaker.identity.core.model.UnknownClusterSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of the persisted speaker state.
 *
 * <p>Enrolled speakers are stored as
 * {@code [{"id":"...","name":"...","centroid":[...],"colorIndex":0}]} and unknown
 * clusters as {@code [{"id":-100,"centroid":[...],"count":3,"closestEnrolledAggregate":{...},"retired":false}]}.
 * Unrecognised properties are ignored so older and newer stores stay readable.</p>
 */
public class EnrollmentJsonCodec {

    private static final TypeReference<List<EnrolledSpeaker>> ENROLLED_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<UnknownClusterSnapshot>> UNKNOWN_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public EnrollmentJsonCodec() {
        this(new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public EnrollmentJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String writeEnrolledSpeakers(List<EnrolledSpeaker> speakers) {
        return write(speakers != null ? speakers : List.of(), "enrolled speakers");
    }

    /**
     * @return the stored speakers; empty for null or blank input
     * @throws SpeakerStateException if the JSON is malformed
     */
    public List<EnrolledSpeaker> readEnrolledSpeakers(String json) {
        return read(json, ENROLLED_LIST, "enrolled speakers");
    }

    public String writeUnknownClusters(List<UnknownClusterSnapshot> clusters) {
        return write(clusters != null ? clusters : List.of(), "unknown clusters");
    }

    /**
     * @return the stored clusters; empty for null or blank input
     * @throws SpeakerStateException if the JSON is malformed
     */
    public List<UnknownClusterSnapshot> readUnknownClusters(String json) {
        return read(json, UNKNOWN_LIST, "unknown clusters");
    }

    private String write(Object value, String what) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SpeakerStateException("Failed to serialize " + what, e);
        }
    }

    private <T> List<T> read(String json, TypeReference<List<T>> type, String what) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<T> values = objectMapper.readValue(json, type);
            if (values == null) {
                return List.of();
            }
            List<T> present = new ArrayList<>(values.size());
            for (T value : values) {
                if (value != null) {
                    present.add(value);
                }
            }
            return present;
        } catch (JsonProcessingException e) {
            throw new SpeakerStateException("Failed to deserialize " + what + ": " + e.getOriginalMessage(), e);
        }
    }
}
