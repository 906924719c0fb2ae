package com.dreambig.chat.client;

public record ClientConfig(
        String baseWsUrl,   // ws://localhost:8080/api/v1/chat/ws
        String token,       // bearer token appended as the last path segment
        String roomId,      // room to join and post into
        int count,          // number of chat messages to send
        long waitSeconds    // how long to keep listening after the last send
) {
    public static ClientConfig fromArgs(String[] args) {
        String base  = args.length > 0 ? args[0] : "ws://localhost:8080/api/v1/chat/ws";
        String token = args.length > 1 ? args[1] : "dev-token";
        String room  = args.length > 2 ? args[2] : "property_1";
        int count    = args.length > 3 ? Integer.parseInt(args[3]) : 1;
        long wait    = args.length > 4 ? Long.parseLong(args[4]) : 5L;
        if (count < 0) throw new IllegalArgumentException("count must be >= 0");
        return new ClientConfig(base, token, room, count, wait);
    }

    public String url() {
        String base = baseWsUrl.endsWith("/") ? baseWsUrl.substring(0, baseWsUrl.length() - 1) : baseWsUrl;
        return base + "/" + token;
    }
}
