package audio.focus;

import audio.AudioAttributes;
import com.google.errorprone.annotations.ThreadSafe;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link AudioFocusManager} backed by an {@link AudioFocusArbiter}. Requests indefinite focus for
 * the given attributes and translates arbiter focus changes into {@link Listener} callbacks.
 *
 * <p>After a transient loss the request stays queued with the arbiter, so focus comes back on its
 * own once the interrupting holder is done, unless {@link #abandonFocus()} withdraws it. A
 * permanent loss or a rejected request is reported as a non-transient loss.
 *
 * <p>The listener is never called with a lock held: callbacks arrive either on the caller's thread
 * from {@link #requestFocus()} or on the arbiter's dispatch thread.
 */
@ThreadSafe
@Slf4j
public class DefaultAudioFocusManager implements AudioFocusManager {

    private final AudioFocusArbiter arbiter;
    private final AudioFocusRequest request;
    private final Listener listener;
    private volatile boolean hasFocus;
    private volatile boolean registered;

    public DefaultAudioFocusManager(
            @NonNull AudioFocusArbiter arbiter,
            @NonNull AudioAttributes attributes,
            @NonNull Listener listener) {
        this.arbiter = arbiter;
        this.listener = listener;
        this.request = new AudioFocusRequest(attributes, FocusGain.GAIN, this::onFocusChange);
    }

    @Override
    public boolean hasFocus() {
        return hasFocus;
    }

    @Override
    public void requestFocus() {
        if (hasFocus) {
            return;
        }

        switch (arbiter.requestFocus(request)) {
            case GRANTED -> {
                registered = true;
                onFocusChange(FocusChange.GAIN);
            }
            case FAILED -> {
                log.info("Audio focus request rejected");
                hasFocus = false;
                listener.onAudioFocusLost(false);
            }
        }
    }

    /** Gives up focus, or withdraws the queued request after a transient loss. */
    @Override
    public void abandonFocus() {
        if (!registered) {
            return;
        }

        registered = false;
        hasFocus = false;
        arbiter.abandonFocus(request);
        log.debug("Audio focus abandoned");
    }

    AudioFocusRequest getRequest() {
        return request;
    }

    private void onFocusChange(FocusChange change) {
        log.debug("Audio focus change: {}", change);
        if (change == FocusChange.GAIN) {
            hasFocus = true;
            listener.onAudioFocusGained();
        } else {
            hasFocus = false;
            if (!change.isTransientLoss()) {
                registered = false;
            }
            listener.onAudioFocusLost(change.isTransientLoss());
        }
    }
}
