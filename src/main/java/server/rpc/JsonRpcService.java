package server.rpc;

import audio.AudioAttributes;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.lsp4j.jsonrpc.ResponseErrorException;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;
import org.eclipse.lsp4j.jsonrpc.services.JsonRequest;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Import;
import org.springframework.stereotype.Service;
import playback.SoundPlayerManager;
import server.rpc.dto.CurrentPreset;
import server.rpc.dto.Pause;
import server.rpc.dto.PlayPreset;
import server.rpc.dto.PlaySound;
import server.rpc.dto.PlaybackStatus;
import server.rpc.dto.Pong;
import server.rpc.dto.SetSoundVolume;
import server.rpc.dto.SetVolume;
import server.rpc.dto.Stop;
import server.rpc.dto.StopSound;
import server.rpc.dto.UpdateSettings;

/**
 * JSON-RPC front end of the {@link SoundPlayerManager}. Requests are run one at a time on the
 * {@code edt} executor; invalid arguments are answered with {@code InvalidParams}.
 */
@Slf4j
@Service
@Import(EventDispatchThreadConfig.class)
public class JsonRpcService {
    private final SoundPlayerManager manager;
    private final ExecutorService edt;

    public JsonRpcService(SoundPlayerManager manager, @Qualifier("edt") ExecutorService edt) {
        this.manager = manager;
        this.edt = edt;
    }

    private <T> CompletableFuture<T> onEdt(Callable<T> task) {
        var cf = new CompletableFuture<T>();
        edt.execute(
                () -> {
                    try {
                        cf.complete(task.call());
                    } catch (IllegalArgumentException e) {
                        log.debug("Rejected request: {}", e.getMessage());
                        cf.completeExceptionally(invalidParams(e.getMessage()));
                    } catch (Throwable t) {
                        cf.completeExceptionally(t);
                    }
                });
        return cf;
    }

    private CompletableFuture<Void> runOnEdt(Runnable task) {
        return onEdt(
                () -> {
                    task.run();
                    return null;
                });
    }

    @JsonRequest("ping")
    public CompletableFuture<Pong> ping() {
        return onEdt(Pong::new);
    }

    @JsonRequest("sound/play")
    public CompletableFuture<Void> playSound(PlaySound req) {
        return runOnEdt(
                () -> {
                    requireParams(req);
                    manager.playSound(requireSoundId(req.soundId()));
                });
    }

    @JsonRequest("sound/stop")
    public CompletableFuture<Void> stopSound(StopSound req) {
        return runOnEdt(
                () -> {
                    requireParams(req);
                    manager.stopSound(requireSoundId(req.soundId()));
                });
    }

    @JsonRequest("sound/setVolume")
    public CompletableFuture<Void> setSoundVolume(SetSoundVolume req) {
        return runOnEdt(
                () -> {
                    requireParams(req);
                    manager.setSoundVolume(requireSoundId(req.soundId()), req.volume());
                });
    }

    @JsonRequest("playback/pause")
    public CompletableFuture<Void> pause(Pause req) {
        return runOnEdt(() -> manager.pause(req != null && req.immediate()));
    }

    @JsonRequest("playback/resume")
    public CompletableFuture<Void> resume() {
        return runOnEdt(manager::resume);
    }

    @JsonRequest("playback/stop")
    public CompletableFuture<Void> stop(Stop req) {
        return runOnEdt(() -> manager.stop(req != null && req.immediate()));
    }

    @JsonRequest("playback/setVolume")
    public CompletableFuture<Void> setVolume(SetVolume req) {
        return runOnEdt(
                () -> {
                    requireParams(req);
                    manager.setVolume(req.volume());
                });
    }

    @JsonRequest("playback/status")
    public CompletableFuture<PlaybackStatus> status() {
        return onEdt(() -> new PlaybackStatus(manager.getState(), manager.getVolume()));
    }

    @JsonRequest("preset/play")
    public CompletableFuture<Void> playPreset(PlayPreset req) {
        return runOnEdt(
                () -> {
                    if (req == null || req.sounds() == null) {
                        throw new IllegalArgumentException("sounds are required");
                    }
                    manager.playPreset(req.sounds());
                });
    }

    @JsonRequest("preset/current")
    public CompletableFuture<CurrentPreset> currentPreset() {
        return onEdt(() -> new CurrentPreset(manager.getCurrentPreset()));
    }

    @JsonRequest("settings/update")
    public CompletableFuture<Void> updateSettings(UpdateSettings req) {
        return runOnEdt(
                () -> {
                    requireParams(req);
                    if (req.fadeInMillis() != null) {
                        manager.setFadeInDuration(nonNegativeMillis(req.fadeInMillis()));
                    }
                    if (req.fadeOutMillis() != null) {
                        manager.setFadeOutDuration(nonNegativeMillis(req.fadeOutMillis()));
                    }
                    if (req.premiumSegmentsEnabled() != null) {
                        manager.setPremiumSegmentsEnabled(req.premiumSegmentsEnabled());
                    }
                    if (req.audioBitrate() != null) {
                        manager.setAudioBitrate(req.audioBitrate());
                    }
                    if (req.alarmAudioStream() != null) {
                        manager.setAudioAttributes(
                                req.alarmAudioStream()
                                        ? AudioAttributes.ALARM
                                        : AudioAttributes.DEFAULT);
                    }
                    if (req.audioFocusManagementEnabled() != null) {
                        manager.setAudioFocusManagementEnabled(req.audioFocusManagementEnabled());
                    }
                });
    }

    private static void requireParams(Object req) {
        if (req == null) {
            throw new IllegalArgumentException("params are required");
        }
    }

    private static String requireSoundId(String soundId) {
        if (soundId == null || soundId.isBlank()) {
            throw new IllegalArgumentException("soundId is required");
        }
        return soundId;
    }

    private static Duration nonNegativeMillis(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("duration must not be negative: " + millis);
        }
        return Duration.ofMillis(millis);
    }

    private static ResponseErrorException invalidParams(String message) {
        return new ResponseErrorException(
                new ResponseError(ResponseErrorCode.InvalidParams, message, null));
    }
}
