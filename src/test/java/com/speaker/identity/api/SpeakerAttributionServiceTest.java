package com.speaker.identity.api;

import com.speaker.identity.clustering.ClusteringOptions;
import com.speaker.identity.clustering.SpeakerClusteringEngine;
import com.speaker.identity.core.model.AssignmentDecision;
import com.speaker.identity.core.model.AssignmentReason;
import com.speaker.identity.core.model.EnrolledSpeaker;
import com.speaker.identity.core.model.Segment;
import com.speaker.identity.core.model.SpeakerIds;
import com.speaker.identity.core.model.UnknownSpeakerSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.speaker.identity.Embeddings.axis;
import static com.speaker.identity.Embeddings.combine;
import static com.speaker.identity.Embeddings.noisy;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SpeakerAttributionService Tests")
class SpeakerAttributionServiceTest {

    private SpeakerClusteringEngine engine;
    private SpeakerAttributionService service;

    @BeforeEach
    void setUp() {
        engine = new SpeakerClusteringEngine(ClusteringOptions.builder().numSpeakers(3).build());
        service = new SpeakerAttributionService("mic-1", engine);
    }

    @Test
    @DisplayName("Short phrases should inherit the previous speaker")
    void testInheritance() {
        List<Segment> attributed = service.processPhrases(List.of(
                Segment.of(axis(0)),
                Segment.of(null),
                Segment.of(axis(1)),
                Segment.of(new float[0])));

        assertEquals(4, attributed.size());
        assertEquals(0, attributed.get(0).speakerId());
        assertEquals(0, attributed.get(1).speakerId());
        assertEquals(AssignmentReason.INHERITED, attributed.get(1).reason());
        assertEquals(1, attributed.get(2).speakerId());
        assertEquals(1, attributed.get(3).speakerId());
        assertEquals(AssignmentReason.INHERITED, attributed.get(3).reason());
    }

    @Test
    @DisplayName("A leading phrase without an embedding should fall back to no_embedding")
    void testLeadingShortPhrase() {
        List<Segment> attributed = service.processPhrases(List.of(Segment.of(null)));

        assertEquals(SpeakerIds.DEFAULT_SPEAKER_ID, attributed.get(0).speakerId());
        assertEquals(AssignmentReason.NO_EMBEDDING, attributed.get(0).reason());
    }

    @Test
    @DisplayName("Environmental markers should stay unassigned")
    void testEnvironmental() {
        List<Segment> attributed = service.processPhrases(List.of(Segment.of(axis(0)), Segment.nonSpeech()));

        assertEquals(SpeakerIds.UNASSIGNED_SPEAKER_ID, attributed.get(1).speakerId());
        assertNull(attributed.get(1).reason());
        assertTrue(service.processPhrases(null).isEmpty());
    }

    @Test
    @DisplayName("Inheritance should carry across batches and stop at reset")
    void testInheritanceAcrossBatches() {
        service.assign(axis(0));
        assertEquals(AssignmentReason.INHERITED, service.processPhrases(List.of(Segment.of(null))).get(0).reason());

        service.reset(false);

        assertEquals(AssignmentReason.NO_EMBEDDING, service.processPhrases(List.of(Segment.of(null))).get(0).reason());
    }

    @Test
    @DisplayName("Ambiguous decisions should name the runner-up")
    void testDisplayLabel() {
        service.assign(axis(0));
        service.assign(combine(0.6, 0.8));

        AssignmentDecision decision = service.assign(combine(1.7, 0.8));

        assertEquals("Speaker 1 (Speaker 2?)", service.getDisplayLabel(decision));
        assertEquals("Speaker 1", service.getSpeakerLabel(0));
    }

    @Test
    @DisplayName("Should report unknown speakers and relabel through the replay")
    void testUnknownAndRelabel() {
        engine.importEnrolledSpeakers(List.of(new EnrolledSpeaker("alice", "Alice", axis(0), null)));
        List<Segment> attributed = service.processPhrases(List.of(
                Segment.of(axis(1)),
                Segment.of(noisy(axis(1), 2, 0.05))));

        assertEquals(-100, attributed.get(0).speakerId());
        List<UnknownSpeakerSummary> unknown = service.getUnknownSpeakers();
        assertEquals(1, unknown.size());
        assertEquals("Unknown 1", unknown.get(0).speakerName());

        assertEquals(1, service.relabelSegment(attributed, 1, 0).size());
        assertTrue(service.reclusterFromIndex(attributed, 5).isEmpty());
        assertEquals("mic-1", service.getChannelId());
        assertSame(engine, service.getEngine());
    }
}
