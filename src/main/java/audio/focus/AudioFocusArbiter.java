package audio.focus;

import lombok.NonNull;

/** Platform service that decides which holder may produce sound. */
public interface AudioFocusArbiter {

    enum RequestResult {
        GRANTED,
        FAILED
    }

    /**
     * Requests focus. On {@link RequestResult#GRANTED} the caller holds focus immediately; later
     * changes are delivered to the request's listener.
     */
    RequestResult requestFocus(@NonNull AudioFocusRequest request);

    /** Releases focus held or queued by {@code request}. Unknown requests are ignored. */
    void abandonFocus(@NonNull AudioFocusRequest request);
}
