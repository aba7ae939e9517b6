package com.speaker.identity.clustering;

import com.speaker.identity.core.model.AssignmentReason;
import com.speaker.identity.core.model.ClosestEnrolled;
import com.speaker.identity.core.model.SpeakerIds;
import com.speaker.identity.core.model.SpeakerSimilarity;
import com.speaker.identity.core.model.UnknownClusterRecord;
import com.speaker.identity.core.model.UnknownClusterResult;
import com.speaker.identity.core.model.UnknownClusterSnapshot;
import com.speaker.identity.core.model.UnknownSpeakerSummary;
import com.speaker.identity.metrics.MetricsService;
import com.speaker.identity.metrics.NoOpMetricsService;
import com.speaker.identity.similarity.CosineSimilarity;
import com.speaker.identity.similarity.EmbeddingSimilarity;
import com.speaker.identity.similarity.EmbeddingVectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Secondary clustering pass over utterances the primary engine could not place.
 *
 * <p>Builds pseudo-speakers ("Unknown 1", "Unknown 2", ...) from scratch, so several
 * non-enrolled voices in one conversation stay distinguishable. Cluster ids count down
 * from {@link SpeakerIds#UNKNOWN_SPEAKER_BASE} in order of first appearance. A cluster
 * retired by correction keeps its id as a hole; ids are never reused.</p>
 *
 * <p>Not thread-safe; owned by a single {@link SpeakerClusteringEngine}.</p>
 */
public class UnknownSpeakerClusterer {
    private static final Logger log = LoggerFactory.getLogger(UnknownSpeakerClusterer.class);

    private static final double MAX_REPORTED_CONFIDENCE = 0.9;
    private static final double BASE_REPORTED_CONFIDENCE = 0.5;
    private static final double CONFIDENCE_PER_SEGMENT = 0.05;

    private final UnknownClusteringOptions options;
    private final EmbeddingSimilarity similarity;
    private final MetricsService metricsService;
    private final List<UnknownClusterRecord> clusters = new ArrayList<>();
    private final Set<Integer> suspended = new TreeSet<>();

    public UnknownSpeakerClusterer() {
        this(UnknownClusteringOptions.defaults());
    }

    public UnknownSpeakerClusterer(UnknownClusteringOptions options) {
        this(options, new CosineSimilarity(), new NoOpMetricsService());
    }

    public UnknownSpeakerClusterer(UnknownClusteringOptions options, EmbeddingSimilarity similarity,
                                   MetricsService metricsService) {
        this.options = options;
        this.similarity = similarity;
        this.metricsService = metricsService;
    }

    /**
     * Assigns an unplaced utterance to an unknown pseudo-speaker.
     *
     * @param embedding            the utterance embedding, may be null
     * @param enrolledSimilarities the primary engine's similarity list, used to note the
     *                             closest enrolled voice; may be null or empty
     */
    public UnknownClusterResult processUnknownSegment(float[] embedding, List<SpeakerSimilarity> enrolledSimilarities) {
        ClosestEnrolled closestEnrolled = closestEnrolled(enrolledSimilarities);

        float[] normalized = EmbeddingVectors.normalizedCopy(embedding);
        if (normalized == null || !dimensionMatches(normalized)) {
            if (normalized != null) {
                log.warn("unknown.dimension_mismatch expected={} actual={}",
                        clusters.get(0).getDimension(), normalized.length);
            }
            return new UnknownClusterResult(SpeakerIds.UNKNOWN_SPEAKER_BASE, closestEnrolled,
                    AssignmentReason.NO_EMBEDDING, 0.0, 0.0, false, getClusterCount());
        }

        int live = getClusterCount();
        if (live == 0) {
            return createCluster(normalized, closestEnrolled);
        }

        // Score pass
        int bestIndex = -1;
        double best = -Double.MAX_VALUE;
        double secondBest = -Double.MAX_VALUE;
        for (int i = 0; i < clusters.size(); i++) {
            if (clusters.get(i).isRetired()) {
                continue;
            }
            double score = clusters.get(i).similarityTo(normalized, similarity);
            if (score > best) {
                secondBest = best;
                best = score;
                bestIndex = i;
            } else if (score > secondBest) {
                secondBest = score;
            }
        }
        double margin = live > 1 ? best - Math.max(secondBest, 0.0) : best;

        if (best >= options.similarityThreshold()) {
            if (live > 1 && margin < options.confidenceMargin()) {
                log.debug("unknown.ambiguous clusterId={} similarity={} margin={}",
                        clusters.get(bestIndex).getId(), best, margin);
            }
            return assignTo(bestIndex, normalized, closestEnrolled, best, margin, false);
        }

        if (live < options.maxUnknownSpeakers()) {
            return createCluster(normalized, closestEnrolled);
        }

        log.debug("unknown.forced clusterId={} similarity={} clusterCount={}",
                clusters.get(bestIndex).getId(), best, live);
        return assignTo(bestIndex, normalized, closestEnrolled, best, margin, true);
    }

    private UnknownClusterResult assignTo(int index, float[] normalized, ClosestEnrolled closestEnrolled,
                                          double score, double margin, boolean forced) {
        UnknownClusterRecord cluster = clusters.get(index);
        cluster.addSample(normalized, closestEnrolled);
        return new UnknownClusterResult(cluster.getId(), closestEnrolled,
                AssignmentReason.UNKNOWN_CLUSTER_MATCH, score, margin, forced, getClusterCount());
    }

    private UnknownClusterResult createCluster(float[] normalized, ClosestEnrolled closestEnrolled) {
        Optional<UnknownClusterRecord> founded = suspendedFoundedBy(normalized);
        int id;
        if (founded.isPresent()) {
            id = founded.get().getId();
            refound(id, normalized, closestEnrolled);
        } else {
            id = SpeakerIds.unknownIdAt(clusters.size());
            clusters.add(new UnknownClusterRecord(id, normalized, closestEnrolled, options.undoHistoryDepth()));
            metricsService.incrementUnknownClusterCreated();
            log.info("unknown.cluster_created clusterId={} label='{}' closestEnrolled={}",
                    id, getLabel(id), closestEnrolled != null ? closestEnrolled.name() : null);
        }
        return new UnknownClusterResult(id, closestEnrolled, AssignmentReason.UNKNOWN_NEW_CLUSTER,
                1.0, 1.0, false, getClusterCount());
    }

    private Optional<UnknownClusterRecord> suspendedFoundedBy(float[] normalized) {
        for (int id : suspended) {
            UnknownClusterRecord cluster = clusters.get(SpeakerIds.unknownIndex(id));
            if (cluster.isFoundedBy(normalized)) {
                return Optional.of(cluster);
            }
        }
        return Optional.empty();
    }

    private void refound(int id, float[] normalized, ClosestEnrolled closestEnrolled) {
        clusters.set(SpeakerIds.unknownIndex(id),
                new UnknownClusterRecord(id, normalized, closestEnrolled, options.undoHistoryDepth()));
        suspended.remove(id);
        log.debug("unknown.cluster_refounded clusterId={}", id);
    }

    private boolean dimensionMatches(float[] normalized) {
        return clusters.isEmpty() || clusters.get(0).getDimension() == normalized.length;
    }

    /**
     * Picks the most similar enrolled entry; the first one wins a tie.
     */
    private static ClosestEnrolled closestEnrolled(List<SpeakerSimilarity> similarities) {
        if (similarities == null || similarities.isEmpty()) {
            return null;
        }
        SpeakerSimilarity best = null;
        for (SpeakerSimilarity s : similarities) {
            if (s.enrolled() && s.speakerName() != null
                    && (best == null || s.similarity() > best.similarity())) {
                best = s;
            }
        }
        return best != null ? new ClosestEnrolled(best.speakerName(), best.similarity()) : null;
    }

    // ========== Correction support ==========

    /**
     * Folds an embedding into an existing cluster. A cluster suspended by
     * {@link #suspendFounder(int, float[])} is founded again by the embedding.
     *
     * @return false if the id is not a live or suspended cluster or the embedding is unusable
     */
    public boolean addToCentroid(int unknownId, float[] embedding) {
        float[] normalized = EmbeddingVectors.normalizedCopy(embedding);
        if (suspended.contains(unknownId) && normalized != null && dimensionMatches(normalized)) {
            refound(unknownId, normalized, null);
            return true;
        }
        Optional<UnknownClusterRecord> cluster = findCluster(unknownId);
        if (cluster.isEmpty() || normalized == null || normalized.length != cluster.get().getDimension()) {
            return false;
        }
        cluster.get().addSample(normalized, null);
        return true;
    }

    /**
     * Removes an embedding's contribution from a cluster.
     *
     * @return false (no change) if the id is not a live cluster, the embedding is unusable,
     * or only the founding sample remains
     */
    public boolean removeFromCentroid(int unknownId, float[] embedding) {
        Optional<UnknownClusterRecord> cluster = findCluster(unknownId);
        float[] normalized = EmbeddingVectors.normalizedCopy(embedding);
        if (cluster.isEmpty() || normalized == null || normalized.length != cluster.get().getDimension()) {
            return false;
        }
        return cluster.get().removeSample(normalized);
    }

    /**
     * Retires a cluster that holds only the sample that founded it, so a replay can drop it.
     * The cluster comes back under the same id if the replay creates a cluster from the
     * same sample; otherwise it stays a hole after {@link #releaseSuspended()}.
     *
     * @return false if the id is not a live cluster holding only this sample
     */
    public boolean suspendFounder(int unknownId, float[] embedding) {
        Optional<UnknownClusterRecord> cluster = findCluster(unknownId);
        float[] normalized = EmbeddingVectors.normalizedCopy(embedding);
        if (cluster.isEmpty() || normalized == null || cluster.get().getCount() != 1
                || !cluster.get().isFoundedBy(normalized)) {
            return false;
        }
        cluster.get().retire();
        suspended.add(unknownId);
        return true;
    }

    /**
     * Ends a replay: clusters still suspended stay retired for good.
     */
    public void releaseSuspended() {
        if (!suspended.isEmpty()) {
            log.info("unknown.clusters_dropped clusterIds={}", suspended);
            suspended.clear();
        }
    }

    // ========== Queries ==========

    private Optional<UnknownClusterRecord> findCluster(int unknownId) {
        if (!SpeakerIds.isUnknownId(unknownId)) {
            return Optional.empty();
        }
        int index = SpeakerIds.unknownIndex(unknownId);
        if (index >= clusters.size() || clusters.get(index).isRetired()) {
            return Optional.empty();
        }
        return Optional.of(clusters.get(index));
    }

    /**
     * Returns a summary of one cluster regardless of its size.
     */
    public Optional<UnknownSpeakerSummary> getClusterInfo(int unknownId) {
        return findCluster(unknownId).map(this::summarize);
    }

    /**
     * Returns clusters with at least {@code minSegmentsForCluster} segments, in id order.
     * Smaller clusters are treated as stray detections and left out.
     */
    public List<UnknownSpeakerSummary> getAllUnknownSpeakers() {
        List<UnknownSpeakerSummary> result = new ArrayList<>();
        for (UnknownClusterRecord cluster : clusters) {
            if (!cluster.isRetired() && cluster.getCount() >= options.minSegmentsForCluster()) {
                result.add(summarize(cluster));
            }
        }
        return result;
    }

    private UnknownSpeakerSummary summarize(UnknownClusterRecord cluster) {
        double confidence = Math.min(MAX_REPORTED_CONFIDENCE,
                BASE_REPORTED_CONFIDENCE + CONFIDENCE_PER_SEGMENT * cluster.getCount());
        return new UnknownSpeakerSummary(getLabel(cluster.getId()), cluster.getId(), cluster.getCount(),
                cluster.getClosestEnrolledAggregate(), confidence);
    }

    /**
     * Returns the display label for an unknown id: -100 is "Unknown 1".
     */
    public String getLabel(int unknownId) {
        return "Unknown " + (SpeakerIds.unknownIndex(unknownId) + 1);
    }

    /**
     * Returns true if the id denotes an unknown pseudo-speaker rather than the
     * unassigned sentinel.
     */
    public static boolean isUnknownId(int speakerId) {
        return SpeakerIds.isUnknownId(speakerId);
    }

    /**
     * Returns the number of live clusters; retired ids are not counted.
     */
    public int getClusterCount() {
        int live = 0;
        for (UnknownClusterRecord cluster : clusters) {
            if (!cluster.isRetired()) {
                live++;
            }
        }
        return live;
    }

    /**
     * Returns the embedding dimension the clusters were built with, or 0 if there are none.
     */
    public int getDimension() {
        return clusters.isEmpty() ? 0 : clusters.get(0).getDimension();
    }

    /**
     * Live view of the clusters in id order, retired ones included. Intended for
     * inspection; mutate only through this clusterer.
     */
    public List<UnknownClusterRecord> getClusters() {
        return Collections.unmodifiableList(clusters);
    }

    public UnknownClusteringOptions getOptions() {
        return options;
    }

    // ========== Snapshot ==========

    /**
     * Captures every cluster's centroid, count, closest-enrolled aggregate and retirement.
     */
    public List<UnknownClusterSnapshot> serialize() {
        List<UnknownClusterSnapshot> snapshots = new ArrayList<>(clusters.size());
        for (UnknownClusterRecord cluster : clusters) {
            snapshots.add(new UnknownClusterSnapshot(cluster.getId(), cluster.getCentroid(),
                    cluster.getCount(), cluster.getClosestEnrolledAggregate(), cluster.isRetired()));
        }
        return snapshots;
    }

    /**
     * Replaces all clusters with a snapshot. Entries are ordered by id; restoring stops at
     * the first entry that would leave a gap in the id sequence or has no usable centroid,
     * since later ids could then collide with newly created clusters.
     */
    public void restore(List<UnknownClusterSnapshot> snapshots) {
        clusters.clear();
        suspended.clear();
        if (snapshots == null) {
            return;
        }
        List<UnknownClusterSnapshot> ordered = new ArrayList<>(snapshots);
        ordered.sort(Comparator.comparingInt((UnknownClusterSnapshot s) -> SpeakerIds.unknownIndex(s.id())));
        for (UnknownClusterSnapshot snapshot : ordered) {
            float[] centroid = EmbeddingVectors.normalizedCopy(snapshot.centroid());
            boolean inSequence = snapshot.id() == SpeakerIds.unknownIdAt(clusters.size());
            boolean sameDimension = centroid != null && (clusters.isEmpty()
                    || clusters.get(0).getDimension() == centroid.length);
            if (!inSequence || !sameDimension) {
                log.warn("unknown.restore_truncated clusterId={} restored={} total={}",
                        snapshot.id(), clusters.size(), snapshots.size());
                break;
            }
            clusters.add(UnknownClusterRecord.restored(snapshot.id(), centroid, snapshot.count(),
                    snapshot.closestEnrolledAggregate(), snapshot.retired(), options.undoHistoryDepth()));
        }
        log.info("unknown.restored clusters={}", clusters.size());
    }

    /**
     * Drops all clusters.
     */
    public void reset() {
        clusters.clear();
        suspended.clear();
    }
}
