package com.speaker.identity.cdi;

import com.speaker.identity.clustering.ClusteringOptions;
import com.speaker.identity.clustering.SpeakerClusteringEngine;
import com.speaker.identity.clustering.UnknownClusteringOptions;
import com.speaker.identity.clustering.UnknownRoutingPolicy;
import com.speaker.identity.clustering.UnknownSpeakerClusterer;
import com.speaker.identity.metrics.MetricsService;
import com.speaker.identity.metrics.MicrometerMetricsService;
import com.speaker.identity.metrics.NoOpMetricsService;
import com.speaker.identity.persistence.ChannelEngineRegistry;
import com.speaker.identity.persistence.PersistenceBridge;
import com.speaker.identity.similarity.CosineSimilarity;
import io.micrometer.core.instrument.Metrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * CDI producer that wires the speaker identity library from MicroProfile Config properties.
 *
 * <p>All keys are optional:</p>
 * <pre>
 * speaker-identity:
 *   clustering:
 *     num-speakers: 4
 *     similarity-threshold: 0.75
 *     unknown-routing: WHEN_ENROLLED
 *   unknown:
 *     max-speakers: 5
 *   metrics:
 *     enabled: true
 * </pre>
 *
 * <p>Inject the per-channel registry and run work against a channel:</p>
 * <pre>
 * &#64;Inject ChannelEngineRegistry registry;
 * registry.withChannel("mic-1", engine -&gt; engine.assignSpeaker(embedding));
 * </pre>
 */
@ApplicationScoped
public class SpeakerIdentityProducer {

    private static final Logger log = LoggerFactory.getLogger(SpeakerIdentityProducer.class);

    // ── Primary clustering ────────────────────────────────────

    @Inject
    @ConfigProperty(name = "speaker-identity.clustering.num-speakers", defaultValue = "2")
    int numSpeakers;

    @Inject
    @ConfigProperty(name = "speaker-identity.clustering.similarity-threshold", defaultValue = "0.75")
    double similarityThreshold;

    @Inject
    @ConfigProperty(name = "speaker-identity.clustering.minimum-similarity-threshold", defaultValue = "0.5")
    double minimumSimilarityThreshold;

    @Inject
    @ConfigProperty(name = "speaker-identity.clustering.confidence-margin", defaultValue = "0.15")
    double confidenceMargin;

    @Inject
    @ConfigProperty(name = "speaker-identity.clustering.inter-enrollment-warning-threshold", defaultValue = "0.72")
    double interEnrollmentWarningThreshold;

    @Inject
    @ConfigProperty(name = "speaker-identity.clustering.enrolled-tie-tolerance", defaultValue = "0.01")
    double enrolledTieTolerance;

    @Inject
    @ConfigProperty(name = "speaker-identity.clustering.update-enrolled-centroids", defaultValue = "false")
    boolean updateEnrolledCentroids;

    @Inject
    @ConfigProperty(name = "speaker-identity.clustering.unknown-routing", defaultValue = "WHEN_ENROLLED")
    String unknownRouting;

    @Inject
    @ConfigProperty(name = "speaker-identity.clustering.undo-history-depth", defaultValue = "16")
    int undoHistoryDepth;

    // ── Unknown speakers ──────────────────────────────────────

    @Inject
    @ConfigProperty(name = "speaker-identity.unknown.similarity-threshold", defaultValue = "0.70")
    double unknownSimilarityThreshold;

    @Inject
    @ConfigProperty(name = "speaker-identity.unknown.confidence-margin", defaultValue = "0.10")
    double unknownConfidenceMargin;

    @Inject
    @ConfigProperty(name = "speaker-identity.unknown.max-speakers", defaultValue = "5")
    int maxUnknownSpeakers;

    @Inject
    @ConfigProperty(name = "speaker-identity.unknown.min-segments-for-cluster", defaultValue = "2")
    int minSegmentsForCluster;

    // ── Metrics ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "speaker-identity.metrics.enabled", defaultValue = "false")
    boolean metricsEnabled;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @Singleton
    public ClusteringOptions clusteringOptions() {
        ClusteringOptions options = ClusteringOptions.builder()
                .numSpeakers(numSpeakers)
                .similarityThreshold(similarityThreshold)
                .minimumSimilarityThreshold(minimumSimilarityThreshold)
                .confidenceMargin(confidenceMargin)
                .interEnrollmentWarningThreshold(interEnrollmentWarningThreshold)
                .enrolledTieTolerance(enrolledTieTolerance)
                .updateEnrolledCentroids(updateEnrolledCentroids)
                .unknownRoutingPolicy(parseRoutingPolicy(unknownRouting))
                .undoHistoryDepth(undoHistoryDepth)
                .build();
        log.info("Producing ClusteringOptions: {}", options);
        return options;
    }

    @Produces
    @Singleton
    public UnknownClusteringOptions unknownClusteringOptions() {
        return new UnknownClusteringOptions(unknownSimilarityThreshold, unknownConfidenceMargin,
                maxUnknownSpeakers, minSegmentsForCluster, undoHistoryDepth);
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (metricsEnabled) {
            log.info("Speaker metrics enabled: registry=global");
            return new MicrometerMetricsService(Metrics.globalRegistry);
        }
        log.info("Speaker metrics disabled");
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public ChannelEngineRegistry channelEngineRegistry(ClusteringOptions options,
                                                       UnknownClusteringOptions unknownOptions,
                                                       MetricsService metricsService) {
        CosineSimilarity similarity = new CosineSimilarity();
        return new ChannelEngineRegistry(() -> new SpeakerClusteringEngine(options,
                new UnknownSpeakerClusterer(unknownOptions, similarity, metricsService),
                similarity, metricsService));
    }

    @Produces
    @ApplicationScoped
    public PersistenceBridge persistenceBridge() {
        return new PersistenceBridge();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    static UnknownRoutingPolicy parseRoutingPolicy(String value) {
        if (value == null || value.isBlank()) {
            return UnknownRoutingPolicy.WHEN_ENROLLED;
        }
        try {
            return UnknownRoutingPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown routing policy '{}', falling back to WHEN_ENROLLED", value);
            return UnknownRoutingPolicy.WHEN_ENROLLED;
        }
    }
}
