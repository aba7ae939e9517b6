package com.speaker.identity.core.model;

/**
 * Reserved speaker ids shared by the clustering engine and its collaborators.
 *
 * <p>Primary speakers (enrolled or discovered) use non-negative ids. Unknown
 * pseudo-speakers count down from {@link #UNKNOWN_SPEAKER_BASE}: the first unknown
 * cluster is -100, the second -101, and so on.</p>
 */
public final class SpeakerIds {

    /**
     * "Nothing assigned yet" sentinel used elsewhere in the pipeline.
     */
    public static final int UNASSIGNED_SPEAKER_ID = -1;

    /**
     * Id of the first unknown cluster.
     */
    public static final int UNKNOWN_SPEAKER_BASE = -100;

    /**
     * Speaker used when an utterance has no embedding.
     */
    public static final int DEFAULT_SPEAKER_ID = 0;

    private SpeakerIds() {
    }

    /**
     * Returns true if the id denotes an unknown pseudo-speaker rather than the
     * unassigned sentinel.
     */
    public static boolean isUnknownId(int speakerId) {
        return speakerId <= UNKNOWN_SPEAKER_BASE && speakerId != UNASSIGNED_SPEAKER_ID;
    }

    /**
     * Zero-based position of an unknown cluster id (-100 → 0, -101 → 1).
     */
    public static int unknownIndex(int unknownId) {
        return UNKNOWN_SPEAKER_BASE - unknownId;
    }

    /**
     * Unknown cluster id for a zero-based position.
     */
    public static int unknownIdAt(int index) {
        return UNKNOWN_SPEAKER_BASE - index;
    }
}
