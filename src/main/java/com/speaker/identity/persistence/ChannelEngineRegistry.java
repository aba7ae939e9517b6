package com.speaker.identity.persistence;

import com.speaker.identity.clustering.SpeakerClusteringEngine;
import com.speaker.identity.core.model.EnrolledSpeaker;
import com.speaker.identity.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One {@link SpeakerClusteringEngine} per input channel.
 *
 * <p>Engines are created on first use and seeded with the most recent enrolled
 * snapshot. Each engine is single-threaded; {@link #withChannel(String, Function)}
 * serialises access per channel while different channels run concurrently.
 * Enrollments made on one channel reach the others only through
 * {@link #propagateEnrollments(String)}, as a point-in-time copy.</p>
 */
public class ChannelEngineRegistry {
    private static final Logger log = LoggerFactory.getLogger(ChannelEngineRegistry.class);

    private final Supplier<SpeakerClusteringEngine> engineFactory;
    private final Map<String, SpeakerClusteringEngine> engines = new ConcurrentHashMap<>();
    private volatile List<EnrolledSpeaker> enrolledSnapshot = List.of();

    /**
     * Registry whose channels run engines with default options.
     */
    public ChannelEngineRegistry() {
        this(SpeakerClusteringEngine::new);
    }

    public ChannelEngineRegistry(Supplier<SpeakerClusteringEngine> engineFactory) {
        this.engineFactory = engineFactory;
    }

    /**
     * Runs {@code action} against the channel's engine, creating it if needed.
     * Calls for the same channel never overlap.
     */
    public <T> T withChannel(String channelId, Function<SpeakerClusteringEngine, T> action) {
        SpeakerClusteringEngine engine = engineFor(channelId);
        synchronized (engine) {
            return action.apply(engine);
        }
    }

    private SpeakerClusteringEngine engineFor(String channelId) {
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("channelId is required");
        }
        return engines.computeIfAbsent(channelId, id -> {
            SpeakerClusteringEngine engine = engineFactory.get();
            List<EnrolledSpeaker> seed = enrolledSnapshot;
            if (!seed.isEmpty()) {
                engine.importEnrolledSpeakers(seed);
            }
            log.info("channel.created channelId={} enrolled={}", id, engine.getEnrolledCount());
            return engine;
        });
    }

    /**
     * Replaces the enrolled set everywhere: the seed for new channels and every
     * existing channel's engine.
     */
    public void setEnrollments(List<EnrolledSpeaker> enrollments) {
        enrolledSnapshot = enrollments != null ? List.copyOf(enrollments) : List.of();
        for (Map.Entry<String, SpeakerClusteringEngine> entry : engines.entrySet()) {
            applySnapshot(entry.getKey(), entry.getValue(), enrolledSnapshot);
        }
    }

    /**
     * Copies the source channel's enrolled set to every other channel and to channels
     * created later.
     *
     * @return number of other channels updated
     */
    public int propagateEnrollments(String sourceChannelId) {
        SpeakerClusteringEngine source = engines.get(sourceChannelId);
        if (source == null) {
            log.warn("enrollment.propagate_skipped channelId={} reason=unknown_channel", sourceChannelId);
            return 0;
        }
        List<EnrolledSpeaker> snapshot;
        synchronized (source) {
            snapshot = List.copyOf(source.exportEnrolledSpeakers());
        }
        enrolledSnapshot = snapshot;

        int updated = 0;
        try (LogContext ctx = LogContext.forEnrollment(sourceChannelId)) {
            for (Map.Entry<String, SpeakerClusteringEngine> entry : engines.entrySet()) {
                if (entry.getKey().equals(sourceChannelId)) {
                    continue;
                }
                applySnapshot(entry.getKey(), entry.getValue(), snapshot);
                updated++;
            }
            log.info("enrollment.propagated enrolled={} channels={}", snapshot.size(), updated);
        }
        return updated;
    }

    private void applySnapshot(String channelId, SpeakerClusteringEngine engine, List<EnrolledSpeaker> snapshot) {
        synchronized (engine) {
            engine.importEnrolledSpeakers(snapshot);
        }
        log.debug("enrollment.applied channelId={} enrolled={}", channelId, snapshot.size());
    }

    /**
     * Drops a channel's engine and all of its session state.
     *
     * @return true if the channel existed
     */
    public boolean removeChannel(String channelId) {
        boolean removed = engines.remove(channelId) != null;
        if (removed) {
            log.info("channel.removed channelId={}", channelId);
        }
        return removed;
    }

    public boolean hasChannel(String channelId) {
        return engines.containsKey(channelId);
    }

    public Set<String> getChannelIds() {
        return Set.copyOf(engines.keySet());
    }

    public List<EnrolledSpeaker> getEnrolledSnapshot() {
        return enrolledSnapshot;
    }
}
