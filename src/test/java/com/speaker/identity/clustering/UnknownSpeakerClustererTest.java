package com.speaker.identity.clustering;

import com.speaker.identity.core.model.AssignmentReason;
import com.speaker.identity.core.model.ClosestEnrolledAggregate;
import com.speaker.identity.core.model.SpeakerIds;
import com.speaker.identity.core.model.SpeakerSimilarity;
import com.speaker.identity.core.model.UnknownClusterResult;
import com.speaker.identity.core.model.UnknownClusterSnapshot;
import com.speaker.identity.core.model.UnknownSpeakerSummary;
import com.speaker.identity.metrics.MetricsService;
import com.speaker.identity.similarity.CosineSimilarity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.speaker.identity.Embeddings.axis;
import static com.speaker.identity.Embeddings.combine;
import static com.speaker.identity.Embeddings.noisy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("UnknownSpeakerClusterer Tests")
class UnknownSpeakerClustererTest {

    private UnknownSpeakerClusterer clusterer;

    @BeforeEach
    void setUp() {
        clusterer = new UnknownSpeakerClusterer();
    }

    @Nested
    @DisplayName("Cluster assignment")
    class AssignmentTests {

        @Test
        @DisplayName("Missing embedding should return the base id without creating a cluster")
        void testNoEmbedding() {
            UnknownClusterResult result = clusterer.processUnknownSegment(null, List.of());

            assertEquals(SpeakerIds.UNKNOWN_SPEAKER_BASE, result.unknownId());
            assertEquals(AssignmentReason.NO_EMBEDDING, result.reason());
            assertEquals(0, clusterer.getClusterCount());
        }

        @Test
        @DisplayName("Ids should be issued in order of first appearance, moving away from the base")
        void testIdOrdering() {
            List<Integer> ids = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                UnknownClusterResult result = clusterer.processUnknownSegment(axis(i), null);
                assertEquals(AssignmentReason.UNKNOWN_NEW_CLUSTER, result.reason());
                assertTrue(result.isNewCluster());
                ids.add(result.unknownId());
            }

            assertEquals(List.of(-100, -101, -102, -103), ids);
        }

        @Test
        @DisplayName("A close repeat should join the existing cluster")
        void testJoinExisting() {
            clusterer.processUnknownSegment(axis(0), null);

            UnknownClusterResult result = clusterer.processUnknownSegment(noisy(axis(0), 1, 0.05), null);

            assertEquals(-100, result.unknownId());
            assertEquals(AssignmentReason.UNKNOWN_CLUSTER_MATCH, result.reason());
            assertFalse(result.forcedAssignment());
            assertEquals(2, clusterer.getClusters().get(0).getCount());
            assertEquals(1, result.clusterCount());
        }

        @Test
        @DisplayName("Beyond the cap utterances should be forced into the closest cluster")
        void testForcedAtCap() {
            UnknownSpeakerClusterer capped = new UnknownSpeakerClusterer(
                    UnknownClusteringOptions.defaults().withMaxUnknownSpeakers(2));
            capped.processUnknownSegment(axis(0), null);
            capped.processUnknownSegment(axis(1), null);

            UnknownClusterResult result = capped.processUnknownSegment(combine(0.2, 0.5, 1.0), null);

            assertEquals(-101, result.unknownId());
            assertEquals(AssignmentReason.UNKNOWN_CLUSTER_MATCH, result.reason());
            assertTrue(result.forcedAssignment());
            assertEquals(2, capped.getClusterCount());
        }

        @Test
        @DisplayName("Should note the closest enrolled voice and ignore discovered speakers")
        void testClosestEnrolled() {
            List<SpeakerSimilarity> similarities = List.of(
                    new SpeakerSimilarity(2, "Speaker 3", 0.6, false),
                    new SpeakerSimilarity(1, "Bob", 0.45, true),
                    new SpeakerSimilarity(0, "Alice", 0.45, true));

            UnknownClusterResult result = clusterer.processUnknownSegment(axis(0), similarities);

            assertEquals("Bob", result.closestEnrolled().name());
            assertEquals(0.45, result.closestEnrolled().similarity());
        }

        @Test
        @DisplayName("Should count created clusters")
        void testMetrics() {
            MetricsService metrics = mock(MetricsService.class);
            UnknownSpeakerClusterer instrumented = new UnknownSpeakerClusterer(
                    UnknownClusteringOptions.defaults(), new CosineSimilarity(), metrics);

            instrumented.processUnknownSegment(axis(0), null);
            instrumented.processUnknownSegment(axis(0), null);
            instrumented.processUnknownSegment(axis(1), null);

            verify(metrics, times(2)).incrementUnknownClusterCreated();
        }
    }

    @Nested
    @DisplayName("Reporting")
    class ReportingTests {

        @Test
        @DisplayName("Should only report clusters with enough segments")
        void testMinimumSegments() {
            clusterer.processUnknownSegment(axis(0), null);
            clusterer.processUnknownSegment(noisy(axis(0), 2, 0.05), null);
            clusterer.processUnknownSegment(axis(1), null);

            List<UnknownSpeakerSummary> speakers = clusterer.getAllUnknownSpeakers();

            assertEquals(1, speakers.size());
            UnknownSpeakerSummary summary = speakers.get(0);
            assertEquals("Unknown 1", summary.speakerName());
            assertEquals(-100, summary.unknownId());
            assertEquals(2, summary.segmentCount());
            assertEquals(0.6, summary.confidence(), 1e-9);
            assertTrue(clusterer.getClusterInfo(-101).isPresent());
            assertTrue(clusterer.getClusterInfo(-105).isEmpty());
            assertTrue(clusterer.getClusterInfo(3).isEmpty());
        }

        @Test
        @DisplayName("Confidence should saturate at 0.9")
        void testConfidenceCap() {
            clusterer.processUnknownSegment(axis(0), null);
            for (int i = 0; i < 12; i++) {
                clusterer.processUnknownSegment(noisy(axis(0), 1 + i % 3, 0.02), null);
            }

            assertEquals(0.9, clusterer.getClusterInfo(-100).orElseThrow().confidence(), 1e-9);
        }

        @Test
        @DisplayName("Should aggregate the closest enrolled voice across segments")
        void testAggregate() {
            clusterer.processUnknownSegment(axis(0), List.of(new SpeakerSimilarity(0, "Alice", 0.30, true)));
            clusterer.processUnknownSegment(noisy(axis(0), 1, 0.05),
                    List.of(new SpeakerSimilarity(1, "Bob", 0.40, true)));

            ClosestEnrolledAggregate aggregate = clusterer.getClusterInfo(-100).orElseThrow().closestEnrolled();

            assertEquals("Bob", aggregate.name());
            assertEquals(2, aggregate.totalSegments());
        }
    }

    @Nested
    @DisplayName("Corrections and snapshots")
    class SnapshotTests {

        @Test
        @DisplayName("Should add and remove contributions on a cluster")
        void testCorrections() {
            clusterer.processUnknownSegment(axis(0), null);
            float[] sample = combine(1.0, 0.3);

            assertTrue(clusterer.addToCentroid(-100, sample));
            assertTrue(clusterer.removeFromCentroid(-100, sample));
            assertFalse(clusterer.removeFromCentroid(-100, axis(0)));
            assertFalse(clusterer.addToCentroid(-101, sample));
            assertFalse(clusterer.addToCentroid(SpeakerIds.UNASSIGNED_SPEAKER_ID, sample));
            assertFalse(clusterer.addToCentroid(-100, new float[]{1.0f}));
        }

        @Test
        @DisplayName("Restored clusters should continue the id sequence")
        void testSerializeRestore() {
            clusterer.processUnknownSegment(axis(0), List.of(new SpeakerSimilarity(0, "Alice", 0.3, true)));
            clusterer.processUnknownSegment(noisy(axis(0), 2, 0.05), null);
            clusterer.processUnknownSegment(axis(1), null);
            List<UnknownClusterSnapshot> snapshot = clusterer.serialize();

            UnknownSpeakerClusterer restored = new UnknownSpeakerClusterer();
            restored.restore(snapshot);

            assertEquals(2, restored.getClusterCount());
            assertEquals(2, restored.getClusterInfo(-100).orElseThrow().segmentCount());
            assertEquals("Alice", restored.getClusterInfo(-100).orElseThrow().closestEnrolled().name());
            assertArrayEquals(snapshot.get(1).centroid(), restored.getClusters().get(1).getCentroid());

            UnknownClusterResult next = restored.processUnknownSegment(axis(2), null);
            assertEquals(-102, next.unknownId());
        }

        @Test
        @DisplayName("Restore should stop at a gap in the id sequence")
        void testRestoreStopsAtGap() {
            List<UnknownClusterSnapshot> snapshot = List.of(
                    new UnknownClusterSnapshot(-100, axis(0), 3, null, false),
                    new UnknownClusterSnapshot(-102, axis(2), 1, null, false));

            clusterer.restore(snapshot);

            assertEquals(1, clusterer.getClusterCount());
            assertEquals(-101, clusterer.processUnknownSegment(axis(5), null).unknownId());
        }

        @Test
        @DisplayName("Retired clusters should be stored and keep their id after a restore")
        void testRetiredSurvivesRestore() {
            clusterer.processUnknownSegment(axis(0), null);
            clusterer.processUnknownSegment(axis(1), null);
            assertTrue(clusterer.suspendFounder(-100, axis(0)));
            clusterer.releaseSuspended();
            List<UnknownClusterSnapshot> snapshot = clusterer.serialize();

            UnknownSpeakerClusterer restored = new UnknownSpeakerClusterer();
            restored.restore(snapshot);

            assertTrue(snapshot.get(0).retired());
            assertFalse(snapshot.get(1).retired());
            assertEquals(1, restored.getClusterCount());
            assertTrue(restored.getClusterInfo(-100).isEmpty());
            assertEquals(-102, restored.processUnknownSegment(axis(2), null).unknownId());
        }

        @Test
        @DisplayName("Reset should drop every cluster")
        void testReset() {
            clusterer.processUnknownSegment(axis(0), null);
            clusterer.reset();

            assertEquals(0, clusterer.getClusterCount());
            assertEquals(-100, clusterer.processUnknownSegment(axis(1), null).unknownId());
        }
    }

    @Nested
    @DisplayName("Founder suspension")
    class SuspensionTests {

        @Test
        @DisplayName("A suspended cluster should be founded again by the same sample under its old id")
        void testRefound() {
            MetricsService metrics = mock(MetricsService.class);
            UnknownSpeakerClusterer counted = new UnknownSpeakerClusterer(UnknownClusteringOptions.defaults(),
                    new CosineSimilarity(), metrics);
            counted.processUnknownSegment(axis(0), null);
            counted.processUnknownSegment(axis(1), null);

            assertTrue(counted.suspendFounder(-100, axis(0)));
            assertEquals(1, counted.getClusterCount());

            UnknownClusterResult again = counted.processUnknownSegment(axis(0), null);
            counted.releaseSuspended();

            assertEquals(-100, again.unknownId());
            assertEquals(AssignmentReason.UNKNOWN_NEW_CLUSTER, again.reason());
            assertEquals(2, counted.getClusterCount());
            assertEquals(1, counted.getClusterInfo(-100).orElseThrow().segmentCount());
            verify(metrics, times(2)).incrementUnknownClusterCreated();
        }

        @Test
        @DisplayName("Only a cluster holding nothing but that founding sample can be suspended")
        void testSuspendRefused() {
            clusterer.processUnknownSegment(axis(0), null);
            clusterer.processUnknownSegment(noisy(axis(0), 2, 0.05), null);
            clusterer.processUnknownSegment(axis(1), null);

            assertFalse(clusterer.suspendFounder(-100, axis(0)));
            assertFalse(clusterer.suspendFounder(-101, axis(2)));
            assertFalse(clusterer.suspendFounder(-105, axis(1)));
            assertFalse(clusterer.suspendFounder(-101, null));
            assertEquals(2, clusterer.getClusterCount());
        }

        @Test
        @DisplayName("Clusters still suspended at release should stay holes that never match")
        void testReleasedHole() {
            clusterer.processUnknownSegment(axis(0), null);
            clusterer.processUnknownSegment(axis(1), null);
            assertTrue(clusterer.suspendFounder(-100, axis(0)));
            clusterer.releaseSuspended();

            assertEquals(1, clusterer.getClusterCount());
            assertTrue(clusterer.getClusterInfo(-100).isEmpty());
            assertFalse(clusterer.addToCentroid(-100, axis(0)));
            UnknownClusterResult next = clusterer.processUnknownSegment(axis(0), null);
            assertEquals(-102, next.unknownId());
            assertEquals("Unknown 3", clusterer.getLabel(next.unknownId()));
        }

        @Test
        @DisplayName("Folding into a suspended cluster should found it again")
        void testAddToSuspended() {
            clusterer.processUnknownSegment(axis(0), null);
            assertTrue(clusterer.suspendFounder(-100, axis(0)));

            assertTrue(clusterer.addToCentroid(-100, combine(1.0, 0.2)));
            clusterer.releaseSuspended();

            assertEquals(1, clusterer.getClusterCount());
            assertEquals(1, clusterer.getClusterInfo(-100).orElseThrow().segmentCount());
        }
    }
}
