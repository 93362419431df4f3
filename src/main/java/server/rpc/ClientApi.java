package server.rpc;

import org.eclipse.lsp4j.jsonrpc.services.JsonNotification;
import server.rpc.dto.PlaybackStateChanged;
import server.rpc.dto.PlaybackVolumeChanged;
import server.rpc.dto.SoundStateChanged;
import server.rpc.dto.SoundVolumeChanged;

/** Notifications the server pushes to the connected client. */
public interface ClientApi {

    @JsonNotification("playback/stateChanged")
    void playbackStateChanged(PlaybackStateChanged payload);

    @JsonNotification("playback/volumeChanged")
    void playbackVolumeChanged(PlaybackVolumeChanged payload);

    @JsonNotification("sound/stateChanged")
    void soundStateChanged(SoundStateChanged payload);

    @JsonNotification("sound/volumeChanged")
    void soundVolumeChanged(SoundVolumeChanged payload);
}
