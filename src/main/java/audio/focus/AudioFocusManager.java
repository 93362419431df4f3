package audio.focus;

/**
 * Mediates access to the shared audio output. Holders are expected to stop producing sound while
 * they do not have focus.
 */
public interface AudioFocusManager {

    /** Whether this manager currently holds audio focus. */
    boolean hasFocus();

    /**
     * Asks for audio focus. The outcome is reported to the {@link Listener}, either before this
     * method returns or later if the grant is deferred. Does nothing if focus is already held.
     */
    void requestFocus();

    /** Gives up audio focus. Does nothing if focus is not held. */
    void abandonFocus();

    /** Receives audio focus changes. */
    interface Listener {

        /** Focus was granted or returned after a transient loss. */
        void onAudioFocusGained();

        /**
         * Focus was taken away.
         *
         * @param transientLoss whether focus is expected to come back once the other holder is
         *     done
         */
        void onAudioFocusLost(boolean transientLoss);
    }
}
