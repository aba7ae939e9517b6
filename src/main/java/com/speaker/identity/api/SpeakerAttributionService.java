package com.speaker.identity.api;

import com.speaker.identity.clustering.SpeakerClusteringEngine;
import com.speaker.identity.core.model.AssignmentDecision;
import com.speaker.identity.core.model.Segment;
import com.speaker.identity.core.model.SegmentReassignment;
import com.speaker.identity.core.model.SpeakerIds;
import com.speaker.identity.core.model.UnknownSpeakerSummary;
import com.speaker.identity.correction.CorrectionReplay;
import com.speaker.identity.logging.LogContext;
import com.speaker.identity.metrics.MetricsService;
import com.speaker.identity.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Phrase-level entry point for one input channel.
 *
 * <p>Wraps a {@link SpeakerClusteringEngine} and its {@link CorrectionReplay}. Phrases
 * too short to embed inherit the previous phrase's speaker instead of defaulting to
 * speaker 0; non-speech markers are passed through unassigned.</p>
 *
 * <pre>
 * SpeakerAttributionService service = new SpeakerAttributionService("mic-1", engine);
 * List&lt;Segment&gt; attributed = service.processPhrases(phrases);
 * String label = service.getSpeakerLabel(attributed.get(0).speakerId());
 * </pre>
 */
public class SpeakerAttributionService {
    private static final Logger log = LoggerFactory.getLogger(SpeakerAttributionService.class);

    private final String channelId;
    private final SpeakerClusteringEngine engine;
    private final CorrectionReplay correctionReplay;
    private int lastSpeakerId = SpeakerIds.UNASSIGNED_SPEAKER_ID;

    public SpeakerAttributionService(String channelId, SpeakerClusteringEngine engine) {
        this(channelId, engine, new NoOpMetricsService());
    }

    public SpeakerAttributionService(String channelId, SpeakerClusteringEngine engine, MetricsService metricsService) {
        this.channelId = channelId;
        this.engine = engine;
        this.correctionReplay = new CorrectionReplay(engine, channelId, metricsService);
    }

    /**
     * Assigns one embedding and remembers the speaker for inheritance.
     */
    public AssignmentDecision assign(float[] embedding) {
        try (LogContext ctx = LogContext.forAssignment(channelId)) {
            AssignmentDecision decision = engine.assignSpeaker(embedding);
            lastSpeakerId = decision.getSpeakerId();
            return decision;
        }
    }

    /**
     * Attributes a batch of phrases in order.
     *
     * @return the phrases with their assignments, same order and size
     */
    public List<Segment> processPhrases(List<Segment> phrases) {
        if (phrases == null || phrases.isEmpty()) {
            return List.of();
        }
        List<Segment> attributed = new ArrayList<>(phrases.size());
        int inherited = 0;
        try (LogContext ctx = LogContext.forAssignment(channelId)) {
            for (Segment phrase : phrases) {
                if (phrase.environmental()) {
                    attributed.add(phrase);
                } else if (!phrase.isAssignable() && lastSpeakerId != SpeakerIds.UNASSIGNED_SPEAKER_ID) {
                    attributed.add(phrase.withAssignment(AssignmentDecision.inherited(lastSpeakerId)));
                    inherited++;
                } else {
                    AssignmentDecision decision = engine.assignSpeaker(phrase.embedding());
                    lastSpeakerId = decision.getSpeakerId();
                    attributed.add(phrase.withAssignment(decision));
                }
            }
        }
        log.debug("phrases.processed channelId={} count={} inherited={}", channelId, phrases.size(), inherited);
        return attributed;
    }

    /**
     * Re-runs attribution from {@code fromIndex} after an upstream correction.
     */
    public List<SegmentReassignment> reclusterFromIndex(List<Segment> orderedSegments, int fromIndex) {
        return correctionReplay.reclusterFromIndex(orderedSegments, fromIndex);
    }

    /**
     * Moves one segment to another speaker and re-runs attribution after it.
     */
    public List<SegmentReassignment> relabelSegment(List<Segment> orderedSegments, int index, int newSpeakerId) {
        return correctionReplay.relabelSegment(orderedSegments, index, newSpeakerId);
    }

    public String getSpeakerLabel(int speakerId) {
        return engine.getSpeakerLabel(speakerId);
    }

    /**
     * Label for an ambiguous decision, e.g. "Speaker 1 (Speaker 2?)".
     */
    public String getDisplayLabel(AssignmentDecision decision) {
        String label = engine.getSpeakerLabel(decision.getSpeakerId());
        if (decision.isAmbiguous() && decision.getSecondBestSpeakerId().isPresent()) {
            return label + " (" + engine.getSpeakerLabel(decision.getSecondBestSpeakerId().get()) + "?)";
        }
        return label;
    }

    public List<UnknownSpeakerSummary> getUnknownSpeakers() {
        return engine.getUnknownClusterer().getAllUnknownSpeakers();
    }

    /**
     * Starts a new session on this channel.
     */
    public void reset(boolean preserveEnrolled) {
        engine.reset(preserveEnrolled);
        lastSpeakerId = SpeakerIds.UNASSIGNED_SPEAKER_ID;
    }

    public String getChannelId() {
        return channelId;
    }

    public SpeakerClusteringEngine getEngine() {
        return engine;
    }

    public CorrectionReplay getCorrectionReplay() {
        return correctionReplay;
    }
}
