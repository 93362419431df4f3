package playback;

import audio.AudioAttributes;
import audio.SoundPlayer;
import audio.focus.AudioFocusArbiter;
import audio.focus.InProcessAudioFocusArbiter;
import audio.silent.SilentSoundPlayerFactory;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(PlaybackProperties.class)
public class PlaybackAutoConfiguration {

    @Bean(name = "audioFocusDispatcher", destroyMethod = "shutdown")
    public ExecutorService audioFocusDispatcher() {
        return Executors.newSingleThreadExecutor(
                r -> {
                    Thread t = new Thread(r, "AudioFocusDispatcher");
                    t.setDaemon(true);
                    return t;
                });
    }

    @Bean
    @ConditionalOnMissingBean
    public AudioFocusArbiter audioFocusArbiter(
            @Qualifier("audioFocusDispatcher") ExecutorService audioFocusDispatcher) {
        return new InProcessAudioFocusArbiter(audioFocusDispatcher);
    }

    @Bean(name = "soundPlayerScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService soundPlayerScheduler() {
        return Executors.newSingleThreadScheduledExecutor(
                r -> {
                    Thread t = new Thread(r, "SoundPlayerScheduler");
                    t.setDaemon(true);
                    return t;
                });
    }

    @Bean
    @ConditionalOnMissingBean
    public SoundPlayer.Factory soundPlayerFactory(
            @Qualifier("soundPlayerScheduler") ScheduledExecutorService soundPlayerScheduler,
            PlaybackProperties properties) {
        return new SilentSoundPlayerFactory(soundPlayerScheduler, properties.bufferingDelay());
    }

    @Bean(destroyMethod = "close")
    public SoundPlayerManager soundPlayerManager(
            AudioFocusArbiter audioFocusArbiter,
            SoundPlayer.Factory soundPlayerFactory,
            PlaybackProperties properties) {
        var manager = new SoundPlayerManager(audioFocusArbiter, soundPlayerFactory);
        manager.setFadeInDuration(properties.fadeInDuration());
        manager.setFadeOutDuration(properties.fadeOutDuration());
        manager.setPremiumSegmentsEnabled(properties.premiumSegmentsEnabled());
        manager.setAudioBitrate(properties.audioBitrate());
        manager.setAudioAttributes(
                properties.alarmAudioStream() ? AudioAttributes.ALARM : AudioAttributes.DEFAULT);
        manager.setAudioFocusManagementEnabled(properties.audioFocusManagementEnabled());
        manager.setVolume(properties.volume());
        log.debug("Sound player manager configured: {}", properties);
        return manager;
    }
}
