package com.speaker.identity.persistence;

/**
 * Runtime exception thrown when persisted speaker state cannot be read or written.
 */
public class SpeakerStateException extends RuntimeException {

    public SpeakerStateException(String message) {
        super(message);
    }

    public SpeakerStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
