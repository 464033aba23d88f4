package com.example.goserver.ai;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Line protocol client for one engine connection.
 *
 * <p>Each command goes out as {@code "<id> <command> <args>\n"}. Replies start with {@code =}
 * (success) or {@code ?} (failure) followed by the same id, and are matched to the pending
 * command by that id. A command that gets no reply within the timeout fails.
 */
@Slf4j
public class GtpClient implements AutoCloseable {

    private final String name;
    private final BufferedReader reader;
    private final Writer writer;
    private final Duration commandTimeout;
    private final Runnable onClose;

    private final Map<Integer, CompletableFuture<String>> pending = new ConcurrentHashMap<>();
    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Thread readerThread;
    private volatile boolean closed;

    public GtpClient(String name, InputStream in, OutputStream out, Duration commandTimeout, Runnable onClose) {
        this.name = name;
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        this.commandTimeout = commandTimeout;
        this.onClose = onClose;
        this.readerThread = new Thread(this::readLoop, name + "-reader");
        this.readerThread.setDaemon(true);
    }

    public GtpClient start() {
        readerThread.start();
        return this;
    }

    /**
     * Sends a command without waiting. The future fails with {@link GtpCommandException} on an
     * error reply, a timeout, or a lost connection.
     */
    public CompletableFuture<String> send(String command, Object... args) {
        CompletableFuture<String> reply = new CompletableFuture<>();
        if (closed) {
            reply.completeExceptionally(new GtpCommandException(name + " is closed"));
            return reply;
        }
        int id = nextId.getAndIncrement();
        StringBuilder line = new StringBuilder().append(id).append(' ').append(command);
        for (Object arg : args) {
            line.append(' ').append(arg);
        }
        pending.put(id, reply);
        try {
            synchronized (writer) {
                writer.write(line.append('\n').toString());
                writer.flush();
            }
            log.debug("{} << {}", name, line.toString().trim());
        } catch (IOException e) {
            pending.remove(id);
            reply.completeExceptionally(new GtpCommandException(name + " write failed: " + e.getMessage(), false, e));
            return reply;
        }
        reply.whenComplete((r, e) -> pending.remove(id));
        return reply;
    }

    /**
     * Sends a command and waits for its reply.
     *
     * @return the reply text after the id, trimmed
     * @throws AiCancelledException when the waiting thread is interrupted
     */
    public String execute(String command, Object... args) {
        CompletableFuture<String> reply = send(command, args);
        try {
            return reply.get(commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            reply.cancel(false);
            throw new GtpCommandException("Command timeout: " + command, true, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GtpCommandException) {
                throw (GtpCommandException) cause;
            }
            throw new GtpCommandException(command + " failed: " + cause, false, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reply.cancel(false);
            throw new AiCancelledException(name + " " + command + " interrupted", e);
        }
    }

    private void readLoop() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                handleLine(line.trim());
            }
        } catch (IOException e) {
            if (!closed) {
                log.warn("{} read failed: {}", name, e.getMessage());
            }
        } finally {
            failPending(name + " connection closed");
        }
    }

    void handleLine(String line) {
        if (line.isEmpty()) {
            return;
        }
        char status = line.charAt(0);
        if (status != '=' && status != '?') {
            log.debug("{} >> {}", name, line);
            return;
        }
        int end = 1;
        while (end < line.length() && Character.isDigit(line.charAt(end))) {
            end++;
        }
        if (end == 1) {
            log.debug("{} >> reply without id: {}", name, line);
            return;
        }
        int id = Integer.parseInt(line.substring(1, end));
        String body = line.substring(end).trim();
        CompletableFuture<String> reply = pending.remove(id);
        if (reply == null) {
            log.debug("{} >> late reply {}: {}", name, id, body);
            return;
        }
        log.debug("{} >> {}", name, line);
        if (status == '=') {
            reply.complete(body);
        } else {
            reply.completeExceptionally(new GtpCommandException(body.isEmpty() ? "engine error" : body));
        }
    }

    private void failPending(String reason) {
        for (Integer id : pending.keySet()) {
            CompletableFuture<String> reply = pending.remove(id);
            if (reply != null) {
                reply.completeExceptionally(new GtpCommandException(reason));
            }
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        failPending(name + " closed");
        try {
            synchronized (writer) {
                writer.write("quit\n");
                writer.flush();
            }
        } catch (IOException e) {
            log.debug("{} already gone: {}", name, e.getMessage());
        }
        onClose.run();
    }
}
