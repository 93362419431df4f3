package server.rpc.dto;

import audio.SoundPlayer;

public record SoundStateChanged(String soundId, SoundPlayer.State state) {}
