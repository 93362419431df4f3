package playback;

import audio.AudioAttributes;
import audio.AudioBitrates;
import audio.SoundPlayer;
import audio.exceptions.AudioPlaybackException;
import audio.focus.AudioFocusArbiter;
import audio.focus.AudioFocusManager;
import audio.focus.DefaultAudioFocusManager;
import audio.focus.NoopAudioFocusManager;
import com.google.errorprone.annotations.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the {@link SoundPlayer} of every sound that is currently playing, pausing, paused or
 * stopping, and keeps one aggregate {@link State} for all of them.
 *
 * <p>Manager-wide settings (fades, premium segments, bitrate, audio attributes and the global
 * volume) are applied to each player when it is created and pushed to all live players when they
 * change. A player's volume is always the global volume times the sound's own volume.
 *
 * <p>Audio focus is requested before anything starts playing. A transient focus loss pauses all
 * sounds and resumes them once focus comes back; a permanent loss only pauses them. Focus is given
 * up as soon as everything is paused or stopped.
 *
 * <p>Thread Safety: player callbacks and focus changes arrive on their own threads. Every operation
 * runs under one reentrant lock, so callbacks fired synchronously from inside a player call are
 * safe, and listeners are notified from whichever thread triggered the change.
 */
@ThreadSafe
@Slf4j
public class SoundPlayerManager implements AudioFocusManager.Listener, AutoCloseable {

    private final ReentrantLock lock = new ReentrantLock();
    private final AudioFocusArbiter focusArbiter;
    private final Map<String, SoundPlayer> soundPlayers = new ConcurrentHashMap<>();
    private final Map<String, Float> soundPlayerVolumes = new ConcurrentHashMap<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    // Guarded by lock
    private SoundPlayer.Factory soundPlayerFactory;
    private Duration fadeInDuration = Duration.ZERO;
    private Duration fadeOutDuration = Duration.ZERO;
    private boolean premiumSegmentsEnabled;
    private String audioBitrate = AudioBitrates.DEFAULT;
    private AudioAttributes audioAttributes = AudioAttributes.DEFAULT;
    private float volume = 1F;
    private AudioFocusManager focusManager;
    private boolean shouldResumeOnFocusGain;

    private volatile State state = State.STOPPED;

    public SoundPlayerManager(
            @NonNull AudioFocusArbiter focusArbiter,
            @NonNull SoundPlayer.Factory soundPlayerFactory) {
        this.focusArbiter = focusArbiter;
        this.soundPlayerFactory = soundPlayerFactory;
        this.focusManager = createFocusManager(true);
    }

    public State getState() {
        return state;
    }

    public void addListener(@NonNull Listener listener) {
        listeners.add(listener);
    }

    public void removeListener(@NonNull Listener listener) {
        listeners.remove(listener);
    }

    @Override
    public void onAudioFocusGained() {
        withLock(
                () -> {
                    if (shouldResumeOnFocusGain) {
                        log.debug("Audio focus regained, resuming");
                        shouldResumeOnFocusGain = false;
                        resume();
                    }
                });
    }

    @Override
    public void onAudioFocusLost(boolean transientLoss) {
        withLock(
                () -> {
                    if (!transientLoss) {
                        shouldResumeOnFocusGain = false;
                    }
                    if (state == State.PAUSED || state == State.STOPPED) {
                        return;
                    }

                    log.info("Audio focus lost (transient: {}), pausing", transientLoss);
                    shouldResumeOnFocusGain = transientLoss;
                    pauseAll(true);
                });
    }

    public void setFadeInDuration(@NonNull Duration duration) {
        withLock(
                () -> {
                    if (duration.equals(fadeInDuration)) {
                        return;
                    }
                    fadeInDuration = duration;
                    forEachPlayer(player -> player.setFadeInDuration(duration));
                });
    }

    public void setFadeOutDuration(@NonNull Duration duration) {
        withLock(
                () -> {
                    if (duration.equals(fadeOutDuration)) {
                        return;
                    }
                    fadeOutDuration = duration;
                    forEachPlayer(player -> player.setFadeOutDuration(duration));
                });
    }

    public void setPremiumSegmentsEnabled(boolean enabled) {
        withLock(
                () -> {
                    if (enabled == premiumSegmentsEnabled) {
                        return;
                    }
                    premiumSegmentsEnabled = enabled;
                    forEachPlayer(player -> player.setPremiumSegmentsEnabled(enabled));
                });
    }

    /**
     * Sets the streaming bitrate of all current and future players.
     *
     * @param bitrate one of {@link AudioBitrates#ALL}; other values are passed through to the
     *     players unchanged
     */
    public void setAudioBitrate(@NonNull String bitrate) {
        withLock(
                () -> {
                    if (bitrate.equals(audioBitrate)) {
                        return;
                    }
                    if (!AudioBitrates.isKnown(bitrate)) {
                        log.warn("Unrecognized audio bitrate: {}", bitrate);
                    }
                    audioBitrate = bitrate;
                    forEachPlayer(player -> player.setAudioBitrate(bitrate));
                });
    }

    /**
     * Sets the audio attributes of all current and future players. With focus management enabled,
     * focus is re-negotiated under the new attributes.
     */
    public void setAudioAttributes(@NonNull AudioAttributes attributes) {
        withLock(
                () -> {
                    if (attributes.equals(audioAttributes)) {
                        return;
                    }
                    audioAttributes = attributes;
                    forEachPlayer(player -> player.setAudioAttributes(attributes));
                    if (focusManager instanceof DefaultAudioFocusManager) {
                        swapFocusManager(true);
                    }
                });
    }

    public void setAudioFocusManagementEnabled(boolean enabled) {
        withLock(
                () -> {
                    if (isAudioFocusManagementEnabled() == enabled) {
                        return;
                    }
                    swapFocusManager(enabled);
                });
    }

    public boolean isAudioFocusManagementEnabled() {
        return withLock(() -> focusManager instanceof DefaultAudioFocusManager);
    }

    /**
     * Replaces the player factory and rebuilds every sound that has not been stopped. Paused
     * sounds stay paused in their new players; the others are started again.
     */
    public void setSoundPlayerFactory(@NonNull SoundPlayer.Factory factory) {
        withLock(
                () -> {
                    if (factory == soundPlayerFactory) {
                        return;
                    }

                    soundPlayerFactory = factory;
                    List<String> pausedSoundIds = new ArrayList<>();
                    List<String> activeSoundIds = new ArrayList<>();
                    soundPlayers.forEach(
                            (soundId, player) -> {
                                SoundPlayer.State playerState = player.getState();
                                if (playerState == SoundPlayer.State.STOPPING
                                        || playerState == SoundPlayer.State.STOPPED) {
                                    return;
                                }
                                if (playerState == SoundPlayer.State.PAUSING
                                        || playerState == SoundPlayer.State.PAUSED) {
                                    pausedSoundIds.add(soundId);
                                } else {
                                    activeSoundIds.add(soundId);
                                }
                            });

                    log.info(
                            "Switching player factory: {} paused, {} active sounds",
                            pausedSoundIds.size(),
                            activeSoundIds.size());
                    List<SoundPlayer> oldPlayers = List.copyOf(soundPlayers.values());
                    soundPlayers.clear();
                    for (SoundPlayer player : oldPlayers) {
                        player.setStateChangeListener(null);
                        player.stop(true);
                    }

                    for (String soundId : pausedSoundIds) {
                        SoundPlayer player = initPlayer(soundId);
                        notifySoundStateChange(soundId, player.getState());
                    }
                    activeSoundIds.forEach(this::playSound);
                    reconcileState();
                });
    }

    /**
     * Sets the global multiplier applied to every sound's volume. Listeners are notified even if
     * the value is unchanged.
     *
     * @param volume must be within [0, 1]
     * @throws IllegalArgumentException if the volume is not within the accepted range
     */
    public void setVolume(float volume) {
        checkVolume(volume);
        withLock(
                () -> {
                    this.volume = volume;
                    soundPlayers.forEach(
                            (soundId, player) ->
                                    player.setVolume(volume * getSoundVolume(soundId)));
                    notifyListeners(l -> l.onSoundPlayerManagerVolumeChange(volume));
                });
    }

    public float getVolume() {
        return withLock(() -> volume);
    }

    /**
     * Sets the volume of a single sound. The value is remembered even if the sound is not playing.
     *
     * @param volume must be within [0, 1]
     * @throws IllegalArgumentException if the volume is not within the accepted range
     */
    public void setSoundVolume(@NonNull String soundId, float volume) {
        checkVolume(volume);
        withLock(
                () -> {
                    soundPlayerVolumes.put(soundId, volume);
                    SoundPlayer player = soundPlayers.get(soundId);
                    if (player != null) {
                        player.setVolume(this.volume * volume);
                    }
                    notifyListeners(l -> l.onSoundVolumeChange(soundId, volume));
                });
    }

    /** Returns the volume of the sound, or 1 if it was never set. */
    public float getSoundVolume(@NonNull String soundId) {
        return soundPlayerVolumes.getOrDefault(soundId, 1F);
    }

    /**
     * Plays the sound. If the manager is paused or does not hold audio focus, all sounds are
     * resumed together with it.
     */
    public void playSound(@NonNull String soundId) {
        withLock(
                () -> {
                    SoundPlayer previous = soundPlayers.get(soundId);
                    SoundPlayer player = initPlayer(soundId);
                    if (!focusManager.hasFocus()
                            || state == State.PAUSING
                            || state == State.PAUSED) {
                        resume();
                    } else {
                        player.play();
                    }
                    if (player != previous) {
                        reconcileState();
                    }
                });
    }

    /** Stops the sound with a fade-out. Unknown sounds are ignored. */
    public void stopSound(@NonNull String soundId) {
        withLock(
                () -> {
                    SoundPlayer player = soundPlayers.get(soundId);
                    if (player != null) {
                        player.stop(false);
                    }
                });
    }

    /**
     * Stops all sounds.
     *
     * @param immediate skip the fade-out
     */
    public void stop(boolean immediate) {
        withLock(
                () -> {
                    shouldResumeOnFocusGain = false;
                    forEachPlayer(player -> player.stop(immediate));
                });
    }

    /**
     * Pauses all sounds. A pending resume on focus gain is cancelled.
     *
     * @param immediate skip the fade-out
     */
    public void pause(boolean immediate) {
        withLock(
                () -> {
                    shouldResumeOnFocusGain = false;
                    pauseAll(immediate);
                });
    }

    /** Resumes all sounds, first acquiring audio focus if it is not held. */
    public void resume() {
        withLock(
                () -> {
                    if (focusManager.hasFocus()) {
                        forEachPlayer(SoundPlayer::play);
                    } else {
                        shouldResumeOnFocusGain = true;
                        focusManager.requestFocus();
                    }
                });
    }

    /**
     * Plays the given mix: sounds not in the preset are stopped with a fade-out, the others get the
     * preset volume and are started unless already playing.
     *
     * @param soundVolumes sound ids mapped to their volumes in [0, 1]
     * @throws IllegalArgumentException if any volume is not within the accepted range
     */
    public void playPreset(@NonNull Map<String, Float> soundVolumes) {
        soundVolumes.forEach(
                (soundId, volume) -> {
                    if (soundId == null || volume == null) {
                        throw new IllegalArgumentException("preset entries must not be null");
                    }
                    checkVolume(volume);
                });

        withLock(
                () -> {
                    for (String soundId : List.copyOf(soundPlayers.keySet())) {
                        if (!soundVolumes.containsKey(soundId)) {
                            stopSound(soundId);
                        }
                    }

                    soundVolumes.forEach(
                            (soundId, volume) -> {
                                SoundPlayer player = soundPlayers.get(soundId);
                                boolean playing =
                                        player != null
                                                && player.getState() == SoundPlayer.State.PLAYING;
                                setSoundVolume(soundId, volume);
                                if (!playing) {
                                    playSound(soundId);
                                }
                            });
                });
    }

    /**
     * @return ids of the sounds that are buffering, playing, pausing or paused, mapped to their
     *     volumes
     */
    public Map<String, Float> getCurrentPreset() {
        return withLock(
                () -> {
                    Map<String, Float> preset = new HashMap<>();
                    soundPlayers.forEach(
                            (soundId, player) -> {
                                SoundPlayer.State playerState = player.getState();
                                if (playerState != SoundPlayer.State.STOPPING
                                        && playerState != SoundPlayer.State.STOPPED) {
                                    preset.put(soundId, getSoundVolume(soundId));
                                }
                            });
                    return Map.copyOf(preset);
                });
    }

    /** Stops everything immediately and gives up audio focus. */
    @Override
    public void close() {
        withLock(
                () -> {
                    log.debug("Closing sound player manager");
                    stop(true);
                    focusManager.abandonFocus();
                });
    }

    private SoundPlayer initPlayer(String soundId) {
        SoundPlayer existing = soundPlayers.get(soundId);
        if (existing != null && existing.getState() != SoundPlayer.State.STOPPED) {
            return existing;
        }

        SoundPlayer player = soundPlayerFactory.buildPlayer(soundId);
        if (player.getState() == SoundPlayer.State.STOPPED) {
            throw new AudioPlaybackException(
                    "Player factory returned a stopped player for " + soundId);
        }

        player.setFadeInDuration(fadeInDuration);
        player.setFadeOutDuration(fadeOutDuration);
        player.setPremiumSegmentsEnabled(premiumSegmentsEnabled);
        player.setAudioBitrate(audioBitrate);
        player.setAudioAttributes(audioAttributes);
        player.setVolume(volume * getSoundVolume(soundId));
        player.setStateChangeListener(
                playerState -> onSoundPlayerStateChange(soundId, player, playerState));
        soundPlayers.put(soundId, player);
        log.debug("Created player for {}", soundId);
        return player;
    }

    private void onSoundPlayerStateChange(
            String soundId, SoundPlayer player, SoundPlayer.State playerState) {
        withLock(
                () -> {
                    if (soundPlayers.get(soundId) != player) {
                        log.trace("Ignoring {} from discarded player of {}", playerState, soundId);
                        return;
                    }

                    if (playerState == SoundPlayer.State.STOPPED) {
                        soundPlayers.remove(soundId, player);
                    }

                    reconcileState();
                    if (state == State.STOPPED) {
                        shouldResumeOnFocusGain = false;
                        focusManager.abandonFocus();
                    } else if (state == State.PAUSED && !shouldResumeOnFocusGain) {
                        // a pending resume keeps the request queued with the arbiter
                        focusManager.abandonFocus();
                    }

                    notifySoundStateChange(soundId, playerState);
                });
    }

    private void reconcileState() {
        List<SoundPlayer.State> playerStates = new ArrayList<>(soundPlayers.size());
        soundPlayers.values().forEach(player -> playerStates.add(player.getState()));
        setState(State.reconcile(playerStates));
    }

    private void setState(State newState) {
        State oldState = state;
        if (oldState == newState) {
            return;
        }
        log.debug("State transition: {} -> {}", oldState, newState);
        state = newState;
        notifyListeners(l -> l.onSoundPlayerManagerStateChange(newState));
    }

    private void pauseAll(boolean immediate) {
        forEachPlayer(player -> player.pause(immediate));
    }

    private void swapFocusManager(boolean enabled) {
        boolean wasPlaying = state == State.PLAYING;
        pauseAll(true);
        focusManager.abandonFocus();
        focusManager = createFocusManager(enabled);
        log.info("Audio focus management {}", enabled ? "enabled" : "disabled");
        if (wasPlaying) {
            resume();
        }
    }

    private AudioFocusManager createFocusManager(boolean enabled) {
        ScopedFocusListener listener = new ScopedFocusListener();
        AudioFocusManager manager =
                enabled
                        ? new DefaultAudioFocusManager(focusArbiter, audioAttributes, listener)
                        : new NoopAudioFocusManager(listener);
        listener.owner = manager;
        return manager;
    }

    /** Runs {@code action} on a snapshot of the current players. Must be called under the lock. */
    private void forEachPlayer(Consumer<SoundPlayer> action) {
        for (SoundPlayer player : List.copyOf(soundPlayers.values())) {
            action.accept(player);
        }
    }

    private void notifySoundStateChange(String soundId, SoundPlayer.State playerState) {
        notifyListeners(l -> l.onSoundStateChange(soundId, playerState));
    }

    private void notifyListeners(Consumer<Listener> notification) {
        for (Listener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.warn("Error in sound player manager listener", e);
            }
        }
    }

    private void withLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static void checkVolume(float volume) {
        if (!(volume >= 0F && volume <= 1F)) {
            throw new IllegalArgumentException("volume must be in range [0, 1], got " + volume);
        }
    }

    /** Forwards focus changes only while its focus manager is the active one. */
    private final class ScopedFocusListener implements AudioFocusManager.Listener {

        private volatile AudioFocusManager owner;

        @Override
        public void onAudioFocusGained() {
            if (isActive()) {
                SoundPlayerManager.this.onAudioFocusGained();
            }
        }

        @Override
        public void onAudioFocusLost(boolean transientLoss) {
            if (isActive()) {
                SoundPlayerManager.this.onAudioFocusLost(transientLoss);
            }
        }

        private boolean isActive() {
            return withLock(
                    () -> {
                        if (owner != focusManager) {
                            log.debug("Ignoring focus change for a replaced focus manager");
                            return false;
                        }
                        return true;
                    });
        }
    }

    /**
     * Playback state of the manager as a whole. The manager starts in {@link #STOPPED}; there is no
     * terminal state.
     */
    public enum State {
        /** At least one sound is buffering or playing. */
        PLAYING,
        /** Every sound is pausing, or pausing and stopping. */
        PAUSING,
        /** Every sound is paused. */
        PAUSED,
        /** Every sound is stopping. */
        STOPPING,
        /** No sounds. */
        STOPPED;

        /**
         * Derives the manager state from the states of its players. Rules, first match wins:
         *
         * <pre>
         * no players                   -> STOPPED
         * all STOPPING                 -> STOPPING
         * all PAUSED                   -> PAUSED
         * all PAUSING or STOPPING      -> PAUSING
         * anything else                -> PLAYING
         * </pre>
         *
         * A sound can be stopping (e.g. dropped from a preset) while the rest are pausing; the
         * manager then reports PAUSING.
         */
        public static State reconcile(@NonNull Collection<SoundPlayer.State> playerStates) {
            if (playerStates.isEmpty()) {
                return STOPPED;
            }
            if (allMatch(playerStates, SoundPlayer.State.STOPPING)) {
                return STOPPING;
            }
            if (allMatch(playerStates, SoundPlayer.State.PAUSED)) {
                return PAUSED;
            }
            if (allMatch(playerStates, SoundPlayer.State.PAUSING, SoundPlayer.State.STOPPING)) {
                return PAUSING;
            }
            return PLAYING;
        }

        private static boolean allMatch(
                Collection<SoundPlayer.State> states, SoundPlayer.State... accepted) {
            for (SoundPlayer.State state : states) {
                boolean match = false;
                for (SoundPlayer.State candidate : accepted) {
                    if (state == candidate) {
                        match = true;
                        break;
                    }
                }
                if (!match) {
                    return false;
                }
            }
            return true;
        }
    }

    /**
     * Receives changes of the manager's state and volume and of the sounds it manages. Called
     * synchronously from the thread that caused the change.
     */
    public interface Listener {

        default void onSoundPlayerManagerStateChange(@NonNull State state) {}

        default void onSoundPlayerManagerVolumeChange(float volume) {}

        default void onSoundStateChange(
                @NonNull String soundId, @NonNull SoundPlayer.State state) {}

        default void onSoundVolumeChange(@NonNull String soundId, float volume) {}
    }
}
