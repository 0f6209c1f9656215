package org.lamportmachine.wire;

/**
 * Raised when an inbound record does not follow {@code <timestamp>:<senderId>}.
 */
public class MalformedMessageException extends Exception {

    private final String fragment;

    public MalformedMessageException(String message, String fragment) {
        super(message);
        this.fragment = fragment;
    }

    public MalformedMessageException(String message, String fragment, Throwable cause) {
        super(message, cause);
        this.fragment = fragment;
    }

    /** The offending input, as received. */
    public String fragment() {
        return fragment;
    }
}
