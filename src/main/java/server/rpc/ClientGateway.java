package server.rpc;

import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import server.rpc.dto.PlaybackStateChanged;
import server.rpc.dto.PlaybackVolumeChanged;
import server.rpc.dto.SoundStateChanged;
import server.rpc.dto.SoundVolumeChanged;

/** Sends notifications to the connected client, if there is one. */
@Component
@Slf4j
public class ClientGateway {

    private volatile ClientApi client;

    public void setClient(ClientApi client) {
        this.client = client;
    }

    public boolean isConnected() {
        return client != null;
    }

    public void playbackStateChanged(PlaybackStateChanged payload) {
        send("playbackStateChanged", payload, c -> c.playbackStateChanged(payload));
    }

    public void playbackVolumeChanged(PlaybackVolumeChanged payload) {
        send("playbackVolumeChanged", payload, c -> c.playbackVolumeChanged(payload));
    }

    public void soundStateChanged(SoundStateChanged payload) {
        send("soundStateChanged", payload, c -> c.soundStateChanged(payload));
    }

    public void soundVolumeChanged(SoundVolumeChanged payload) {
        send("soundVolumeChanged", payload, c -> c.soundVolumeChanged(payload));
    }

    private void send(String name, Object payload, Consumer<ClientApi> notification) {
        ClientApi c = this.client;
        if (c == null) {
            log.debug("Client not connected; dropping {}: {}", name, payload);
            return;
        }

        try {
            notification.accept(c);
        } catch (Exception e) {
            log.warn("Failed to notify client: {}", name, e);
        }
    }
}
