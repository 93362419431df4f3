package audio.silent;

import audio.SoundPlayer;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/** Builds {@link SilentSoundPlayer}s that share one scheduler for buffering and fade timers. */
@Slf4j
public class SilentSoundPlayerFactory implements SoundPlayer.Factory {

    private final ScheduledExecutorService scheduler;
    private final Duration bufferingDelay;

    public SilentSoundPlayerFactory(
            @NonNull ScheduledExecutorService scheduler, @NonNull Duration bufferingDelay) {
        if (bufferingDelay.isNegative()) {
            throw new IllegalArgumentException("buffering delay must not be negative");
        }
        this.scheduler = scheduler;
        this.bufferingDelay = bufferingDelay;
    }

    @Override
    public SoundPlayer buildPlayer(@NonNull String soundId) {
        log.trace("Building silent player for {}", soundId);
        return new SilentSoundPlayer(soundId, scheduler, bufferingDelay);
    }
}
