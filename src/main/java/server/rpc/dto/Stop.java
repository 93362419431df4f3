package server.rpc.dto;

public record Stop(boolean immediate) {}
