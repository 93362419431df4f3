package server.rpc.dto;

public record Pause(boolean immediate) {}
