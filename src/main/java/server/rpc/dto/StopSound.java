package server.rpc.dto;

public record StopSound(String soundId) {}
