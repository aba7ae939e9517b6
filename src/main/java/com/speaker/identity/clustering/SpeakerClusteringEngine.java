package com.speaker.identity.clustering;

import com.speaker.identity.core.model.AssignmentDecision;
import com.speaker.identity.core.model.AssignmentReason;
import com.speaker.identity.core.model.EnrolledSpeaker;
import com.speaker.identity.core.model.EnrollmentWarning;
import com.speaker.identity.core.model.SpeakerIds;
import com.speaker.identity.core.model.SpeakerInfo;
import com.speaker.identity.core.model.SpeakerRecord;
import com.speaker.identity.core.model.SpeakerSimilarity;
import com.speaker.identity.core.model.UnknownClusterResult;
import com.speaker.identity.metrics.MetricsService;
import com.speaker.identity.metrics.NoOpMetricsService;
import com.speaker.identity.similarity.CosineSimilarity;
import com.speaker.identity.similarity.EmbeddingSimilarity;
import com.speaker.identity.similarity.EmbeddingVectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * Online speaker clustering engine: the primary per-utterance decision.
 *
 * <p>Each embedding is scored against every live speaker (enrolled and discovered),
 * then one of the following applies, in order:</p>
 * <ol>
 *   <li>confident match: best similarity at or above the threshold with a clear margin;
 *       a discovered winner absorbs the embedding into its running-average centroid</li>
 *   <li>ambiguous match: above the threshold but the runner-up is too close; the best
 *       candidate is assigned and the decision flagged</li>
 *   <li>new speaker: between the minimum and the threshold while under the speaker cap</li>
 *   <li>no confident match: handed to the {@link UnknownSpeakerClusterer} when unknown
 *       routing is active</li>
 *   <li>otherwise a new speaker while under the cap, or a forced assignment to the best
 *       candidate once the cap is reached</li>
 * </ol>
 *
 * <p>Speakers live in an arena indexed by id. Ids are never compacted or reused within a
 * session; replacing enrollments retires the old records instead of removing them.</p>
 *
 * <p>The engine is synchronous and single-threaded. Running-average updates do not
 * commute, so utterances must be processed strictly in arrival order; callers sharing an
 * engine across threads must serialise access.</p>
 */
public class SpeakerClusteringEngine {
    private static final Logger log = LoggerFactory.getLogger(SpeakerClusteringEngine.class);

    private final ClusteringOptions options;
    private final EmbeddingSimilarity similarity;
    private final MetricsService metricsService;
    private final UnknownSpeakerClusterer unknownClusterer;
    private final List<SpeakerRecord> speakers = new ArrayList<>();
    private final Set<Integer> suspended = new TreeSet<>();
    private int numSpeakers;
    private int dimension;

    public SpeakerClusteringEngine() {
        this(ClusteringOptions.defaults());
    }

    public SpeakerClusteringEngine(ClusteringOptions options) {
        this(options, new UnknownSpeakerClusterer());
    }

    public SpeakerClusteringEngine(ClusteringOptions options, UnknownSpeakerClusterer unknownClusterer) {
        this(options, unknownClusterer, new CosineSimilarity(), new NoOpMetricsService());
    }

    public SpeakerClusteringEngine(ClusteringOptions options, UnknownSpeakerClusterer unknownClusterer,
                                   EmbeddingSimilarity similarity, MetricsService metricsService) {
        this.options = options;
        this.unknownClusterer = unknownClusterer;
        this.similarity = similarity;
        this.metricsService = metricsService;
        this.numSpeakers = options.getNumSpeakers();
    }

    /**
     * Assigns a speaker to one utterance and updates the engine state.
     * Never throws; every degraded outcome is expressed as an {@link AssignmentReason}.
     *
     * @param embedding the utterance embedding, or null if none could be extracted
     */
    public AssignmentDecision assignSpeaker(float[] embedding) {
        long start = System.nanoTime();
        AssignmentDecision decision = decide(embedding);
        metricsService.recordAssignment(decision.getReason(), Duration.ofNanos(System.nanoTime() - start));
        log.debug("speaker.assigned speakerId={} reason={} similarity={} margin={} forced={}",
                decision.getSpeakerId(), decision.getReason().getCode(), decision.getSimilarity(),
                decision.getMargin(), decision.isForcedAssignment());
        return decision;
    }

    private AssignmentDecision decide(float[] embedding) {
        float[] normalized = EmbeddingVectors.normalizedCopy(embedding);
        if (normalized == null) {
            return AssignmentDecision.noEmbedding();
        }
        if (dimension != 0 && normalized.length != dimension) {
            log.warn("speaker.dimension_mismatch expected={} actual={}", dimension, normalized.length);
            return AssignmentDecision.noEmbedding();
        }

        List<SpeakerRecord> live = liveSpeakers();
        if (live.isEmpty()) {
            SpeakerRecord created = createDiscovered(normalized);
            return AssignmentDecision.builder()
                    .speakerId(created.getId())
                    .reason(AssignmentReason.NEW_SPEAKER)
                    .similarity(1.0)
                    .margin(1.0)
                    .allSimilarities(List.of(new SpeakerSimilarity(created.getId(), labelOf(created), 1.0, false)))
                    .build();
        }

        // Read-only scoring pass; the single write happens below, on the winner only.
        List<SpeakerSimilarity> ranked = rank(normalized, live);
        SpeakerSimilarity best = ranked.get(0);
        SpeakerSimilarity second = ranked.size() > 1 ? ranked.get(1) : null;
        double margin = second != null ? Math.max(0.0, best.similarity() - second.similarity()) : 0.0;
        metricsService.recordSimilarityScore(best.similarity());

        AssignmentDecision.Builder decision = AssignmentDecision.builder()
                .similarity(best.similarity())
                .secondBestSimilarity(second != null ? second.similarity() : 0.0)
                .margin(margin)
                .allSimilarities(ranked);

        if (best.similarity() >= options.getSimilarityThreshold()) {
            SpeakerRecord winner = speakers.get(best.speakerId());
            if (second == null || margin >= options.getConfidenceMargin()) {
                if (!winner.isEnrolled() || options.isUpdateEnrolledCentroids()) {
                    winner.addSample(normalized);
                }
                return decision.speakerId(winner.getId())
                        .reason(AssignmentReason.CONFIDENT_MATCH)
                        .enrolled(winner.isEnrolled())
                        .build();
            }
            return decision.speakerId(winner.getId())
                    .reason(AssignmentReason.AMBIGUOUS_MATCH)
                    .enrolled(winner.isEnrolled())
                    .ambiguous(true)
                    .secondBestSpeakerId(second.speakerId())
                    .build();
        }

        boolean hasRoom = live.size() < numSpeakers;
        if (best.similarity() >= options.getMinimumSimilarityThreshold() && hasRoom) {
            return newSpeakerDecision(decision, normalized);
        }

        if (routesToUnknown()) {
            UnknownClusterResult unknown = unknownClusterer.processUnknownSegment(normalized, ranked);
            if (unknown.reason() == AssignmentReason.NO_EMBEDDING) {
                log.warn("speaker.unknown_rejected clusterCount={} dimension={}",
                        unknown.clusterCount(), normalized.length);
                return AssignmentDecision.noEmbedding();
            }
            return decision.speakerId(unknown.unknownId())
                    .reason(AssignmentReason.NO_CONFIDENT_MATCH)
                    .forcedAssignment(unknown.forcedAssignment())
                    .unknownResult(unknown)
                    .build();
        }

        if (hasRoom) {
            return newSpeakerDecision(decision, normalized);
        }

        SpeakerRecord forced = speakers.get(best.speakerId());
        log.debug("speaker.forced speakerId={} similarity={} liveSpeakers={}",
                forced.getId(), best.similarity(), live.size());
        return decision.speakerId(forced.getId())
                .reason(AssignmentReason.BELOW_MINIMUM_THRESHOLD)
                .enrolled(forced.isEnrolled())
                .forcedAssignment(true)
                .build();
    }

    private AssignmentDecision newSpeakerDecision(AssignmentDecision.Builder decision, float[] normalized) {
        SpeakerRecord created = createDiscovered(normalized);
        return decision.speakerId(created.getId())
                .reason(AssignmentReason.NEW_SPEAKER)
                .similarity(1.0)
                .margin(1.0)
                .build();
    }

    /**
     * Scores every live speaker and orders them best first. Equal scores fall back to
     * enrolled first, then lower id. A discovered winner yields first place to the best
     * enrolled candidate within {@code enrolledTieTolerance} of it.
     */
    private List<SpeakerSimilarity> rank(float[] normalized, List<SpeakerRecord> live) {
        List<SpeakerSimilarity> ranked = new ArrayList<>(live.size());
        for (SpeakerRecord record : live) {
            ranked.add(new SpeakerSimilarity(record.getId(), labelOf(record),
                    record.similarityTo(normalized, similarity), record.isEnrolled()));
        }
        ranked.sort(Comparator.comparingDouble(SpeakerSimilarity::similarity).reversed()
                .thenComparing(SpeakerSimilarity::enrolled, Comparator.reverseOrder())
                .thenComparingInt(SpeakerSimilarity::speakerId));

        SpeakerSimilarity top = ranked.get(0);
        if (!top.enrolled()) {
            for (int i = 1; i < ranked.size(); i++) {
                SpeakerSimilarity candidate = ranked.get(i);
                if (top.similarity() - candidate.similarity() > options.getEnrolledTieTolerance()) {
                    break;
                }
                if (candidate.enrolled()) {
                    ranked.remove(i);
                    ranked.add(0, candidate);
                    break;
                }
            }
        }
        return ranked;
    }

    private boolean routesToUnknown() {
        switch (options.getUnknownRoutingPolicy()) {
            case ALWAYS:
                return true;
            case NEVER:
                return false;
            default:
                return hasEnrolledSpeaker();
        }
    }

    private SpeakerRecord createDiscovered(float[] normalized) {
        for (int id : suspended) {
            if (speakers.get(id).isFoundedBy(normalized)) {
                return refound(id, normalized);
            }
        }
        SpeakerRecord record = SpeakerRecord.discovered(speakers.size(), normalized, options.getUndoHistoryDepth());
        speakers.add(record);
        adoptDimension(normalized.length);
        metricsService.incrementSpeakerCreated();
        log.info("speaker.created speakerId={} label='{}' liveSpeakers={}",
                record.getId(), labelOf(record), liveSpeakers().size());
        return record;
    }

    private SpeakerRecord refound(int speakerId, float[] normalized) {
        SpeakerRecord record = SpeakerRecord.discovered(speakerId, normalized, options.getUndoHistoryDepth());
        speakers.set(speakerId, record);
        suspended.remove(speakerId);
        adoptDimension(normalized.length);
        log.debug("speaker.refounded speakerId={}", speakerId);
        return record;
    }

    /**
     * Fixes the dimension on first use. Unknown clusters left from an earlier dimension
     * could never match again, so they are dropped.
     */
    private void adoptDimension(int length) {
        if (dimension != 0) {
            return;
        }
        dimension = length;
        int unknownDimension = unknownClusterer.getDimension();
        if (unknownDimension != 0 && unknownDimension != length) {
            log.warn("unknown.dimension_changed previous={} current={} clusters={}",
                    unknownDimension, length, unknownClusterer.getClusterCount());
            unknownClusterer.reset();
        }
    }

    private List<SpeakerRecord> liveSpeakers() {
        List<SpeakerRecord> live = new ArrayList<>(speakers.size());
        for (SpeakerRecord record : speakers) {
            if (!record.isRetired()) {
                live.add(record);
            }
        }
        return live;
    }

    private Optional<SpeakerRecord> liveSpeaker(int speakerId) {
        if (speakerId < 0 || speakerId >= speakers.size()) {
            return Optional.empty();
        }
        SpeakerRecord record = speakers.get(speakerId);
        return record.isRetired() ? Optional.empty() : Optional.of(record);
    }

    // ========== Centroid corrections ==========

    /**
     * Folds an embedding into a speaker's centroid outside the normal decision flow,
     * for example when a user moves an utterance to another speaker. Negative ids
     * address unknown clusters. A speaker suspended by {@link #suspendFounder(int, float[])} is
     * founded again by the embedding.
     *
     * @return false if the id is not live or suspended, the speaker is an enrolled anchor,
     * or the embedding is unusable
     */
    public boolean addToCentroid(int speakerId, float[] embedding) {
        if (speakerId < 0) {
            return unknownClusterer.addToCentroid(speakerId, embedding);
        }
        float[] normalized = EmbeddingVectors.normalizedCopy(embedding);
        if (suspended.contains(speakerId) && normalized != null
                && (dimension == 0 || normalized.length == dimension)) {
            refound(speakerId, normalized);
            return true;
        }
        Optional<SpeakerRecord> record = liveSpeaker(speakerId);
        if (record.isEmpty() || normalized == null || normalized.length != dimension) {
            return false;
        }
        if (record.get().isEnrolled() && !options.isUpdateEnrolledCentroids()) {
            return false;
        }
        record.get().addSample(normalized);
        return true;
    }

    /**
     * Removes one embedding's contribution from a speaker's centroid, the inverse of the
     * running-average update. Negative ids address unknown clusters.
     *
     * <p>Enrolled speakers accept removal only while {@code updateEnrolledCentroids} is on,
     * since only then did matches move them. Their imported anchor is never removed.</p>
     *
     * @return false (nothing changed) if the speaker refuses removal, holds only its founding
     * sample, is out of range or retired, or the embedding is unusable
     */
    public boolean removeFromCentroid(int speakerId, float[] embedding) {
        boolean applied;
        if (speakerId < 0) {
            applied = unknownClusterer.removeFromCentroid(speakerId, embedding);
        } else {
            Optional<SpeakerRecord> record = liveSpeaker(speakerId);
            float[] normalized = EmbeddingVectors.normalizedCopy(embedding);
            applied = record.isPresent()
                    && (!record.get().isEnrolled() || options.isUpdateEnrolledCentroids())
                    && normalized != null
                    && normalized.length == dimension
                    && record.get().removeSample(normalized);
        }
        metricsService.recordCentroidUndo(applied);
        if (!applied) {
            log.debug("speaker.undo_rejected speakerId={}", speakerId);
        }
        return applied;
    }

    /**
     * Retires a discovered speaker that holds only the sample that founded it, so a replay
     * can drop it. The speaker comes back under the same id if the replay creates a speaker
     * from the same sample; otherwise it stays a hole after {@link #releaseSuspended()}.
     * Negative ids address unknown clusters.
     *
     * @return false if the id is not a live discovered speaker holding only this sample
     */
    public boolean suspendFounder(int speakerId, float[] embedding) {
        if (speakerId < 0) {
            return unknownClusterer.suspendFounder(speakerId, embedding);
        }
        Optional<SpeakerRecord> record = liveSpeaker(speakerId);
        float[] normalized = EmbeddingVectors.normalizedCopy(embedding);
        if (record.isEmpty() || normalized == null || record.get().isEnrolled()
                || record.get().getSampleCount() != 1 || !record.get().isFoundedBy(normalized)) {
            return false;
        }
        record.get().retire();
        suspended.add(speakerId);
        return true;
    }

    /**
     * Ends a replay: speakers and clusters still suspended stay retired for good.
     */
    public void releaseSuspended() {
        if (!suspended.isEmpty()) {
            log.info("speaker.dropped speakerIds={} liveSpeakers={}", suspended, liveSpeakers().size());
            suspended.clear();
        }
        unknownClusterer.releaseSuspended();
    }

    // ========== Enrollment ==========

    /**
     * Replaces the enrolled set with a snapshot. Previously enrolled speakers are retired,
     * entries without a usable centroid are skipped, order is preserved and discovered
     * speakers are untouched.
     *
     * @return warnings for enrolled pairs that are similar enough to be confused
     */
    public List<EnrollmentWarning> importEnrolledSpeakers(List<EnrolledSpeaker> enrollments) {
        for (SpeakerRecord record : speakers) {
            if (record.isEnrolled()) {
                record.retire();
            }
        }
        if (liveSpeakers().isEmpty()) {
            dimension = 0;
        }

        int imported = 0;
        if (enrollments != null) {
            for (int i = 0; i < enrollments.size(); i++) {
                EnrolledSpeaker entry = enrollments.get(i);
                if (entry == null) {
                    continue;
                }
                int colorIndex = entry.colorIndex() != null ? entry.colorIndex() : i;
                if (addEnrolled(entry.id(), entry.name(), entry.centroid(), colorIndex).isPresent()) {
                    imported++;
                }
            }
        }

        metricsService.recordEnrollmentImport(imported);
        log.info("enrollment.imported count={} skipped={} liveSpeakers={}",
                imported, enrollments != null ? enrollments.size() - imported : 0, liveSpeakers().size());
        return checkEnrolledSpeakerSimilarities();
    }

    /**
     * Adds one enrolled voice after the existing ones.
     *
     * @return the new speaker id, or empty if the centroid is missing, zero or of the wrong dimension
     */
    public OptionalInt enrollSpeaker(String name, float[] centroid, String enrollmentId, int colorIndex) {
        return addEnrolled(enrollmentId, name, centroid, colorIndex);
    }

    private OptionalInt addEnrolled(String enrollmentId, String name, float[] centroid, int colorIndex) {
        float[] normalized = EmbeddingVectors.normalizedCopy(centroid);
        if (normalized == null) {
            log.warn("enrollment.skipped enrollmentId={} reason=missing_centroid", enrollmentId);
            return OptionalInt.empty();
        }
        if (dimension != 0 && normalized.length != dimension) {
            log.warn("enrollment.skipped enrollmentId={} reason=dimension_mismatch expected={} actual={}",
                    enrollmentId, dimension, normalized.length);
            return OptionalInt.empty();
        }
        int id = speakers.size();
        String key = enrollmentId != null ? enrollmentId : "enrolled-" + id;
        speakers.add(SpeakerRecord.enrolled(id, key, name, normalized, colorIndex, options.getUndoHistoryDepth()));
        adoptDimension(normalized.length);
        return OptionalInt.of(id);
    }

    /**
     * Serialises the live enrolled speakers, in enrollment order.
     */
    public List<EnrolledSpeaker> exportEnrolledSpeakers() {
        List<EnrolledSpeaker> exported = new ArrayList<>();
        for (SpeakerRecord record : liveSpeakers()) {
            if (record.isEnrolled()) {
                exported.add(new EnrolledSpeaker(record.getEnrollmentId(), record.getName(),
                        record.getCentroid(), record.getColorIndex()));
            }
        }
        return exported;
    }

    /**
     * Retires one enrolled speaker.
     *
     * @return true if a live enrolled speaker had that enrollment id
     */
    public boolean removeEnrolledSpeaker(String enrollmentId) {
        for (SpeakerRecord record : liveSpeakers()) {
            if (record.isEnrolled() && record.getEnrollmentId().equals(enrollmentId)) {
                record.retire();
                log.info("enrollment.removed enrollmentId={} speakerId={}", enrollmentId, record.getId());
                return true;
            }
        }
        return false;
    }

    /**
     * Retires every enrolled speaker; discovered speakers are kept.
     */
    public void clearAllEnrollments() {
        for (SpeakerRecord record : speakers) {
            if (record.isEnrolled()) {
                record.retire();
            }
        }
    }

    public boolean hasEnrolledSpeaker() {
        return getEnrolledCount() > 0;
    }

    public int getEnrolledCount() {
        int count = 0;
        for (SpeakerRecord record : speakers) {
            if (record.isEnrolled() && !record.isRetired()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Compares every pair of live enrolled centroids and reports pairs above the
     * inter-enrollment warning threshold.
     */
    public List<EnrollmentWarning> checkEnrolledSpeakerSimilarities() {
        List<SpeakerRecord> enrolled = new ArrayList<>();
        for (SpeakerRecord record : liveSpeakers()) {
            if (record.isEnrolled()) {
                enrolled.add(record);
            }
        }

        List<EnrollmentWarning> warnings = new ArrayList<>();
        for (int i = 0; i < enrolled.size(); i++) {
            for (int j = i + 1; j < enrolled.size(); j++) {
                SpeakerRecord a = enrolled.get(i);
                SpeakerRecord b = enrolled.get(j);
                double score = similarity.compute(a.getCentroid(), b.getCentroid());
                if (score > options.getInterEnrollmentWarningThreshold()) {
                    warnings.add(new EnrollmentWarning(labelOf(a), labelOf(b), score));
                    log.warn("enrollment.similar_pair speaker1='{}' speaker2='{}' similarity={}",
                            labelOf(a), labelOf(b), score);
                } else {
                    log.debug("enrollment.pair speaker1='{}' speaker2='{}' similarity={}",
                            labelOf(a), labelOf(b), score);
                }
            }
        }
        return warnings;
    }

    // ========== Session state ==========

    /**
     * Starts a new session. With {@code preserveEnrolled} the live enrolled speakers are
     * kept and renumbered from 0 in their current order; everything else, including the
     * unknown clusters, is dropped.
     */
    public void reset(boolean preserveEnrolled) {
        List<SpeakerRecord> kept = new ArrayList<>();
        if (preserveEnrolled) {
            for (SpeakerRecord record : liveSpeakers()) {
                if (record.isEnrolled()) {
                    kept.add(SpeakerRecord.enrolled(kept.size(), record.getEnrollmentId(), record.getName(),
                            record.getCentroid(), record.getColorIndex(), options.getUndoHistoryDepth()));
                }
            }
        }
        speakers.clear();
        speakers.addAll(kept);
        suspended.clear();
        dimension = kept.isEmpty() ? 0 : kept.get(0).getDimension();
        unknownClusterer.reset();
        log.info("session.reset preserveEnrolled={} enrolledKept={}", preserveEnrolled, kept.size());
    }

    /**
     * Sets the speaker cap, clamped to [1, 10].
     */
    public void setNumSpeakers(int numSpeakers) {
        this.numSpeakers = ClusteringOptions.clampNumSpeakers(numSpeakers);
    }

    public int getNumSpeakers() {
        return numSpeakers;
    }

    /**
     * Number of live speakers, enrolled and discovered.
     */
    public int getDetectedSpeakerCount() {
        return liveSpeakers().size();
    }

    /**
     * Embedding dimension fixed by the first embedding or enrollment, or 0 if not yet known.
     */
    public int getDimension() {
        return dimension;
    }

    /**
     * Snapshots of all live speakers in id order.
     */
    public List<SpeakerInfo> getSpeakers() {
        List<SpeakerInfo> infos = new ArrayList<>();
        for (SpeakerRecord record : liveSpeakers()) {
            infos.add(toInfo(record));
        }
        return infos;
    }

    public Optional<SpeakerInfo> getSpeaker(int speakerId) {
        return liveSpeaker(speakerId).map(this::toInfo);
    }

    private SpeakerInfo toInfo(SpeakerRecord record) {
        String key = record.isEnrolled() ? record.getEnrollmentId() : "discovered-" + record.getId();
        return new SpeakerInfo(record.getId(), key, labelOf(record), record.getCentroid(),
                record.isEnrolled(), record.getColorIndex(), record.getSampleCount());
    }

    /**
     * Human-readable label: the enrolled name, "Speaker n" for discovered speakers,
     * "Unknown n" for unknown clusters and "Unknown" for the unassigned sentinel.
     */
    public String getSpeakerLabel(int speakerId) {
        if (speakerId == SpeakerIds.UNASSIGNED_SPEAKER_ID) {
            return "Unknown";
        }
        if (SpeakerIds.isUnknownId(speakerId)) {
            return unknownClusterer.getLabel(speakerId);
        }
        if (speakerId >= 0 && speakerId < speakers.size()) {
            return labelOf(speakers.get(speakerId));
        }
        return "Speaker " + (speakerId + 1);
    }

    private static String labelOf(SpeakerRecord record) {
        return record.getName() != null ? record.getName() : "Speaker " + (record.getId() + 1);
    }

    public UnknownSpeakerClusterer getUnknownClusterer() {
        return unknownClusterer;
    }

    public ClusteringOptions getOptions() {
        return options;
    }

    /**
     * Returns true if the id denotes an unknown pseudo-speaker.
     */
    public static boolean isUnknownId(int speakerId) {
        return SpeakerIds.isUnknownId(speakerId);
    }
}
