package com.speaker.identity.persistence;

import com.speaker.identity.clustering.SpeakerClusteringEngine;
import com.speaker.identity.core.model.EnrollmentWarning;
import com.speaker.identity.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Moves engine state across the persistence boundary as JSON.
 * Nothing here runs on the assignment path; the engine itself never does I/O.
 */
public class PersistenceBridge {
    private static final Logger log = LoggerFactory.getLogger(PersistenceBridge.class);

    private final EnrollmentJsonCodec codec;

    public PersistenceBridge() {
        this(new EnrollmentJsonCodec());
    }

    public PersistenceBridge(EnrollmentJsonCodec codec) {
        this.codec = codec;
    }

    public String exportEnrolledSpeakers(SpeakerClusteringEngine engine) {
        return codec.writeEnrolledSpeakers(engine.exportEnrolledSpeakers());
    }

    /**
     * Replaces the engine's enrolled set with the stored one.
     *
     * @throws SpeakerStateException if the JSON is malformed; the engine is left untouched
     */
    public List<EnrollmentWarning> importEnrolledSpeakers(SpeakerClusteringEngine engine, String channelId, String json) {
        try (LogContext ctx = LogContext.forEnrollment(channelId)) {
            List<EnrollmentWarning> warnings = engine.importEnrolledSpeakers(codec.readEnrolledSpeakers(json));
            log.info("enrollment.restored enrolled={} warnings={}", engine.getEnrolledCount(), warnings.size());
            return warnings;
        }
    }

    public String exportUnknownClusters(SpeakerClusteringEngine engine) {
        return codec.writeUnknownClusters(engine.getUnknownClusterer().serialize());
    }

    /**
     * Replaces the engine's unknown clusters with the stored ones.
     *
     * @throws SpeakerStateException if the JSON is malformed; the clusters are left untouched
     */
    public void importUnknownClusters(SpeakerClusteringEngine engine, String json) {
        engine.getUnknownClusterer().restore(codec.readUnknownClusters(json));
    }
}
