package com.dreambig.chat.client;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Opens one chat connection, joins a room, posts messages, asks for history, leaves the room
 * and prints everything the server pushes back.
 *
 * Usage: ChatSmokeClient [wsBase] [token] [roomId] [count] [waitSeconds]
 */
public class ChatSmokeClient {

    public static void main(String[] args) throws Exception {
        ClientConfig cfg = ClientConfig.fromArgs(args);
        OkHttpClient client = new OkHttpClient.Builder().build();
        Request req = new Request.Builder().url(cfg.url()).build();

        CountDownLatch opened = new CountDownLatch(1);
        CountDownLatch acks = new CountDownLatch(cfg.count());
        CountDownLatch closed = new CountDownLatch(1);
        AtomicInteger received = new AtomicInteger();

        WebSocket ws = client.newWebSocket(req, new WebSocketListener() {
            @Override public void onOpen(WebSocket ws, Response resp) {
                opened.countDown();
            }
            @Override public void onMessage(WebSocket ws, String text) {
                received.incrementAndGet();
                System.out.println("<- " + text);
                if ("message_sent".equals(Envelopes.typeOf(text))) acks.countDown();
            }
            @Override public void onClosing(WebSocket ws, int code, String reason) {
                System.out.println("closing: " + code + " " + reason);
                ws.close(code, null);
            }
            @Override public void onClosed(WebSocket ws, int code, String reason) {
                closed.countDown();
            }
            @Override public void onFailure(WebSocket ws, Throwable t, Response r) {
                System.err.println("failure: " + t);
                opened.countDown();
                closed.countDown();
            }
        });

        try {
            if (!opened.await(5, TimeUnit.SECONDS) || closed.getCount() == 0) {
                System.err.println("could not connect to " + cfg.url());
                return;
            }
            ws.send(Envelopes.joinRoom(cfg.roomId()));
            for (int i = 0; i < cfg.count(); i++) {
                ws.send(Envelopes.chatMessage(cfg.roomId(), "smoke " + (i + 1) + "/" + cfg.count()));
            }
            boolean allAcked = acks.await(cfg.waitSeconds(), TimeUnit.SECONDS);
            ws.send(Envelopes.chatHistory(cfg.roomId(), Math.max(cfg.count(), 1)));
            closed.await(cfg.waitSeconds(), TimeUnit.SECONDS);

            System.out.printf("SENT=%d ACKED=%d RECEIVED=%d%n",
                    cfg.count(), cfg.count() - acks.getCount(), received.get());
            if (!allAcked) System.err.println("not every message was acknowledged");
        } finally {
            ws.send(Envelopes.leaveRoom(cfg.roomId()));
            ws.close(1000, "done");
            client.dispatcher().executorService().shutdown();
        }
    }
}
