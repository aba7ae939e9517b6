package com.speaker.identity.persistence;

import com.speaker.identity.clustering.ClusteringOptions;
import com.speaker.identity.clustering.SpeakerClusteringEngine;
import com.speaker.identity.core.model.AssignmentDecision;
import com.speaker.identity.core.model.EnrolledSpeaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.speaker.identity.Embeddings.axis;
import static com.speaker.identity.Embeddings.noisy;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChannelEngineRegistry Tests")
class ChannelEngineRegistryTest {

    private ChannelEngineRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ChannelEngineRegistry(() -> new SpeakerClusteringEngine(
                ClusteringOptions.builder().numSpeakers(4).build()));
    }

    @Test
    @DisplayName("Each channel should get its own engine")
    void testIsolatedChannels() {
        registry.withChannel("mic-1", engine -> engine.assignSpeaker(axis(0)));
        registry.withChannel("mic-1", engine -> engine.assignSpeaker(axis(1)));
        registry.withChannel("mic-2", engine -> engine.assignSpeaker(axis(2)));

        assertEquals(2, registry.withChannel("mic-1", SpeakerClusteringEngine::getDetectedSpeakerCount));
        assertEquals(1, registry.withChannel("mic-2", SpeakerClusteringEngine::getDetectedSpeakerCount));
        assertEquals(Set.of("mic-1", "mic-2"), registry.getChannelIds());
    }

    @Test
    @DisplayName("Should reject a missing channel id")
    void testBlankChannel() {
        assertThrows(IllegalArgumentException.class,
                () -> registry.withChannel(" ", SpeakerClusteringEngine::getDetectedSpeakerCount));
    }

    @Test
    @DisplayName("Propagation should copy enrollments to existing and future channels")
    void testPropagate() {
        registry.withChannel("mic-2", engine -> engine.assignSpeaker(axis(3)));
        registry.withChannel("mic-1", engine -> engine.enrollSpeaker("Alice", axis(0), "alice", 0));

        int updated = registry.propagateEnrollments("mic-1");

        assertEquals(1, updated);
        assertEquals(1, registry.withChannel("mic-2", SpeakerClusteringEngine::getEnrolledCount));
        assertEquals(1, registry.withChannel("mic-3", SpeakerClusteringEngine::getEnrolledCount));
        AssignmentDecision decision = registry.withChannel("mic-3",
                engine -> engine.assignSpeaker(noisy(axis(0), 1, 0.05)));
        assertTrue(decision.isEnrolled());
        assertEquals("Alice", registry.withChannel("mic-3", engine -> engine.getSpeakerLabel(decision.getSpeakerId())));
    }

    @Test
    @DisplayName("Propagation is a point-in-time copy")
    void testPropagateSnapshot() {
        registry.withChannel("mic-1", engine -> engine.enrollSpeaker("Alice", axis(0), "alice", 0));
        registry.withChannel("mic-2", engine -> engine.getEnrolledCount());
        registry.propagateEnrollments("mic-1");

        registry.withChannel("mic-1", engine -> engine.enrollSpeaker("Bob", axis(1), "bob", 1));

        assertEquals(2, registry.withChannel("mic-1", SpeakerClusteringEngine::getEnrolledCount));
        assertEquals(1, registry.withChannel("mic-2", SpeakerClusteringEngine::getEnrolledCount));
        assertEquals(0, registry.propagateEnrollments("missing"));
    }

    @Test
    @DisplayName("setEnrollments should replace the enrolled set everywhere")
    void testSetEnrollments() {
        registry.withChannel("mic-1", engine -> engine.enrollSpeaker("Alice", axis(0), "alice", 0));

        registry.setEnrollments(List.of(new EnrolledSpeaker("bob", "Bob", axis(1), null)));

        assertEquals(List.of("bob"), registry.withChannel("mic-1",
                engine -> engine.exportEnrolledSpeakers().stream().map(EnrolledSpeaker::id).toList()));
        assertEquals(1, registry.getEnrolledSnapshot().size());
        assertTrue(registry.removeChannel("mic-1"));
        assertFalse(registry.hasChannel("mic-1"));
        assertFalse(registry.removeChannel("mic-1"));
    }

    @Test
    @DisplayName("Concurrent work on one channel should be serialised")
    void testConcurrentAccess() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<AssignmentDecision>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                float amount = 0.01f * (i % 10);
                futures.add(executor.submit(() -> registry.withChannel("mic-1",
                        engine -> engine.assignSpeaker(noisy(axis(0), 1, amount)))));
            }
            for (Future<AssignmentDecision> future : futures) {
                assertEquals(0, future.get(10, TimeUnit.SECONDS).getSpeakerId());
            }
        } finally {
            executor.shutdownNow();
        }

        int samples = registry.withChannel("mic-1", engine -> engine.getSpeaker(0).orElseThrow().sampleCount());
        assertEquals(200, samples);
    }
}
