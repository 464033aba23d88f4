package com.example.goserver.ai;

import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.StoneColor;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link AiEngine} over a GTP connection. Every request replays the full position first, so a
 * restarted process picks up exactly where the old one stopped. Failed requests restart the
 * connection and retry up to {@code maxRetries} times; an interrupted request is not retried.
 */
@Slf4j
public class GtpAiEngine implements AiEngine {

    private final String name;
    private final Supplier<GtpClient> connector;
    private final int maxRetries;

    private volatile GtpClient client;
    private volatile boolean closed;

    public GtpAiEngine(String name, Supplier<GtpClient> connector, int maxRetries) {
        this.name = name;
        this.connector = connector;
        this.maxRetries = maxRetries;
    }

    /**
     * Opens the first connection eagerly so a missing engine is reported at game creation.
     */
    public GtpAiEngine start() {
        synchronized (this) {
            connect();
        }
        return this;
    }

    @Override
    public GeneratedMove generateMove(AiPosition position, StoneColor color) {
        return withRetry("genmove", gtp -> {
            sync(gtp, position);
            long started = System.nanoTime();
            String reply = gtp.execute("genmove", GtpVertex.color(color));
            long thinkingMs = (System.nanoTime() - started) / 1_000_000;
            return GeneratedMove.parse(reply, position.boardSize(), thinkingMs);
        });
    }

    @Override
    public String finalScore(AiPosition position) {
        return withRetry("final_score", gtp -> {
            sync(gtp, position);
            return gtp.execute("final_score");
        });
    }

    private void sync(GtpClient gtp, AiPosition position) {
        int size = position.boardSize();
        gtp.execute("boardsize", size);
        gtp.execute("clear_board");
        gtp.execute("komi", position.komi());
        for (Position stone : position.handicapStones()) {
            gtp.execute("play", GtpVertex.color(StoneColor.BLACK), GtpVertex.encode(stone, size));
        }
        for (AiPosition.Move move : position.moves()) {
            gtp.execute("play", GtpVertex.color(move.color()), GtpVertex.encode(move.position(), size));
        }
    }

    private synchronized <T> T withRetry(String operation, Function<GtpClient, T> action) {
        RuntimeException last = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (closed) {
                throw new AiUnresponsiveException(name + " is closed", last);
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new AiCancelledException(name + " " + operation + " cancelled", last);
            }
            try {
                if (client == null || client.isClosed()) {
                    connect();
                }
                return action.apply(client);
            } catch (GtpCommandException | AiUnavailableException e) {
                last = e;
                if (closed) {
                    break;
                }
                log.warn("{} {} failed (attempt {}/{}): {}", name, operation, attempt + 1, maxRetries + 1, e.getMessage());
                restart();
            }
        }
        throw new AiUnresponsiveException(name + " did not answer " + operation, last);
    }

    /**
     * Opens a fresh connection. A connection that completes after {@link #close()} is closed again
     * right away.
     */
    private void connect() {
        GtpClient fresh = connector.get();
        client = fresh;
        if (closed) {
            fresh.close();
            client = null;
            throw new AiUnresponsiveException(name + " is closed", null);
        }
    }

    private void restart() {
        GtpClient old = client;
        client = null;
        if (old != null) {
            old.close();
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        GtpClient current = client;
        if (current != null) {
            current.close();
        }
        log.info("{} released", name);
    }
}
