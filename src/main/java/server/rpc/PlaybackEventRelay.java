package server.rpc;

import audio.SoundPlayer;
import lombok.NonNull;
import org.springframework.stereotype.Component;
import playback.SoundPlayerManager;
import server.rpc.dto.PlaybackStateChanged;
import server.rpc.dto.PlaybackVolumeChanged;
import server.rpc.dto.SoundStateChanged;
import server.rpc.dto.SoundVolumeChanged;

/** Forwards sound player manager events to the client as JSON-RPC notifications. */
@Component
public class PlaybackEventRelay implements SoundPlayerManager.Listener {

    private final ClientGateway clientGateway;

    public PlaybackEventRelay(
            @NonNull SoundPlayerManager soundPlayerManager, @NonNull ClientGateway clientGateway) {
        this.clientGateway = clientGateway;
        soundPlayerManager.addListener(this);
    }

    @Override
    public void onSoundPlayerManagerStateChange(@NonNull SoundPlayerManager.State state) {
        clientGateway.playbackStateChanged(new PlaybackStateChanged(state));
    }

    @Override
    public void onSoundPlayerManagerVolumeChange(float volume) {
        clientGateway.playbackVolumeChanged(new PlaybackVolumeChanged(volume));
    }

    @Override
    public void onSoundStateChange(@NonNull String soundId, @NonNull SoundPlayer.State state) {
        clientGateway.soundStateChanged(new SoundStateChanged(soundId, state));
    }

    @Override
    public void onSoundVolumeChange(@NonNull String soundId, float volume) {
        clientGateway.soundVolumeChanged(new SoundVolumeChanged(soundId, volume));
    }
}
