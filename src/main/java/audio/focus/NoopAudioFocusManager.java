package audio.focus;

import lombok.NonNull;

/** {@link AudioFocusManager} for when focus management is turned off: focus is always held. */
public class NoopAudioFocusManager implements AudioFocusManager {

    private final Listener listener;

    public NoopAudioFocusManager(@NonNull Listener listener) {
        this.listener = listener;
    }

    @Override
    public boolean hasFocus() {
        return true;
    }

    @Override
    public void requestFocus() {
        listener.onAudioFocusGained();
    }

    @Override
    public void abandonFocus() {}
}
