package com.speaker.identity.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-utterance output of the speaker clustering engine.
 *
 * <p>Carries the assigned speaker id, the {@link AssignmentReason} and enough of the
 * scoring breakdown for a UI to disclose how the decision was made (for example
 * "Speaker A (Speaker B?)" for an ambiguous match). Decisions are ephemeral and never
 * persisted by this library.</p>
 *
 * <p>Speaker id conventions: non-negative ids are primary speakers, ids at or below
 * {@link SpeakerIds#UNKNOWN_SPEAKER_BASE} are unknown pseudo-speakers.</p>
 */
public final class AssignmentDecision {

    private final int speakerId;
    private final AssignmentReason reason;
    private final double similarity;
    private final double secondBestSimilarity;
    private final double margin;
    private final boolean enrolled;
    private final boolean forcedAssignment;
    private final boolean ambiguous;
    private final Integer secondBestSpeakerId;
    private final List<SpeakerSimilarity> allSimilarities;
    private final UnknownClusterResult unknownResult;

    private AssignmentDecision(Builder builder) {
        this.speakerId = builder.speakerId;
        this.reason = Objects.requireNonNull(builder.reason, "reason is required");
        this.similarity = builder.similarity;
        this.secondBestSimilarity = builder.secondBestSimilarity;
        this.margin = builder.margin;
        this.enrolled = builder.enrolled;
        this.forcedAssignment = builder.forcedAssignment;
        this.ambiguous = builder.ambiguous;
        this.secondBestSpeakerId = builder.secondBestSpeakerId;
        this.allSimilarities = builder.allSimilarities != null ? List.copyOf(builder.allSimilarities) : List.of();
        this.unknownResult = builder.unknownResult;
    }

    public int getSpeakerId() {
        return speakerId;
    }

    public AssignmentReason getReason() {
        return reason;
    }

    public double getSimilarity() {
        return similarity;
    }

    public double getSecondBestSimilarity() {
        return secondBestSimilarity;
    }

    public double getMargin() {
        return margin;
    }

    /**
     * Returns true if the assigned speaker is an enrolled voice.
     */
    public boolean isEnrolled() {
        return enrolled;
    }

    public boolean isForcedAssignment() {
        return forcedAssignment;
    }

    /**
     * Returns true if the runner-up was within the confidence margin.
     * {@link #getSecondBestSpeakerId()} then names the alternative.
     */
    public boolean isAmbiguous() {
        return ambiguous;
    }

    public Optional<Integer> getSecondBestSpeakerId() {
        return Optional.ofNullable(secondBestSpeakerId);
    }

    /**
     * Similarities to every live speaker, best first.
     */
    public List<SpeakerSimilarity> getAllSimilarities() {
        return allSimilarities;
    }

    /**
     * Present only when the utterance was routed to the unknown-speaker clusterer.
     */
    public Optional<UnknownClusterResult> getUnknownResult() {
        return Optional.ofNullable(unknownResult);
    }

    public boolean isUnknownSpeaker() {
        return SpeakerIds.isUnknownId(speakerId);
    }

    // ========== Static Factory Methods ==========

    /**
     * Decision for an utterance without an embedding. Never mutates engine state.
     */
    public static AssignmentDecision noEmbedding() {
        return builder()
                .speakerId(SpeakerIds.DEFAULT_SPEAKER_ID)
                .reason(AssignmentReason.NO_EMBEDDING)
                .build();
    }

    /**
     * Decision carried over from a previous utterance.
     */
    public static AssignmentDecision inherited(int speakerId) {
        return builder()
                .speakerId(speakerId)
                .reason(AssignmentReason.INHERITED)
                .build();
    }

    public Builder toBuilder() {
        return builder()
                .speakerId(speakerId)
                .reason(reason)
                .similarity(similarity)
                .secondBestSimilarity(secondBestSimilarity)
                .margin(margin)
                .enrolled(enrolled)
                .forcedAssignment(forcedAssignment)
                .ambiguous(ambiguous)
                .secondBestSpeakerId(secondBestSpeakerId)
                .allSimilarities(allSimilarities)
                .unknownResult(unknownResult);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "AssignmentDecision{" +
                "speakerId=" + speakerId +
                ", reason=" + reason.getCode() +
                ", similarity=" + similarity +
                ", margin=" + margin +
                ", enrolled=" + enrolled +
                ", forcedAssignment=" + forcedAssignment +
                ", ambiguous=" + ambiguous +
                '}';
    }

    public static class Builder {
        private int speakerId;
        private AssignmentReason reason;
        private double similarity;
        private double secondBestSimilarity;
        private double margin;
        private boolean enrolled;
        private boolean forcedAssignment;
        private boolean ambiguous;
        private Integer secondBestSpeakerId;
        private List<SpeakerSimilarity> allSimilarities = List.of();
        private UnknownClusterResult unknownResult;

        public Builder speakerId(int speakerId) {
            this.speakerId = speakerId;
            return this;
        }

        public Builder reason(AssignmentReason reason) {
            this.reason = reason;
            return this;
        }

        public Builder similarity(double similarity) {
            this.similarity = similarity;
            return this;
        }

        public Builder secondBestSimilarity(double secondBestSimilarity) {
            this.secondBestSimilarity = secondBestSimilarity;
            return this;
        }

        public Builder margin(double margin) {
            this.margin = margin;
            return this;
        }

        public Builder enrolled(boolean enrolled) {
            this.enrolled = enrolled;
            return this;
        }

        public Builder forcedAssignment(boolean forcedAssignment) {
            this.forcedAssignment = forcedAssignment;
            return this;
        }

        public Builder ambiguous(boolean ambiguous) {
            this.ambiguous = ambiguous;
            return this;
        }

        public Builder secondBestSpeakerId(Integer secondBestSpeakerId) {
            this.secondBestSpeakerId = secondBestSpeakerId;
            return this;
        }

        public Builder allSimilarities(List<SpeakerSimilarity> allSimilarities) {
            this.allSimilarities = allSimilarities;
            return this;
        }

        public Builder unknownResult(UnknownClusterResult unknownResult) {
            this.unknownResult = unknownResult;
            return this;
        }

        public AssignmentDecision build() {
            return new AssignmentDecision(this);
        }
    }
}
