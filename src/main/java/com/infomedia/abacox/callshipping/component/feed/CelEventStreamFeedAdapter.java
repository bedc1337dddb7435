package com.infomedia.abacox.callshipping.component.feed;

import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.normalizer.DateTimeUtil;
import com.infomedia.abacox.callshipping.component.normalizer.RecordType;
import jakarta.annotation.PreDestroy;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CEL events read live from the Asterisk Manager Interface. A reader thread keeps the connection
 * open, logging in again after failures, and buffers CEL events in a bounded queue that
 * {@link #fetchSince} drains. The stream cannot be replayed, so the cursor is only a sequence number.
 */
@Component
@Log4j2
public class CelEventStreamFeedAdapter implements CelFeedAdapter {

    public static final String NAME = "cel-ami";

    private static final int CONNECT_TIMEOUT_MS = 10_000;
    private static final long RECONNECT_DELAY_MS = 5_000;
    private static final int RECENT_LINKED_IDS = 10_000;

    private final EngineConfigService engineConfig;
    private final AtomicLong sequence = new AtomicLong();
    private final Set<String> recentLinkedIds = Collections.synchronizedSet(Collections.newSetFromMap(
            new LinkedHashMap<>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > RECENT_LINKED_IDS;
                }
            }));

    private volatile BlockingQueue<RawRecord> buffer;
    private volatile Thread readerThread;
    private volatile Socket socket;
    private volatile boolean running;
    private volatile Instant lastEventTime;

    public CelEventStreamFeedAdapter(EngineConfigService engineConfig) {
        this.engineConfig = engineConfig;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RecordType recordType() {
        return RecordType.CEL;
    }

    @Override
    public CelMode celMode() {
        return CelMode.AMI;
    }

    @Override
    public boolean isResumable() {
        return false;
    }

    @Override
    public FeedCursor cursorAfter(Instant watermark) {
        return FeedCursor.atPosition(sequence.get());
    }

    @Override
    public FeedBatch fetchSince(FeedCursor cursor, int limit) {
        ensureStarted();
        List<RawRecord> records = new ArrayList<>(Math.min(limit, buffer.size()));
        buffer.drainTo(records, limit);
        if (records.isEmpty()) {
            return FeedBatch.empty(cursor);
        }
        RawRecord last = records.get(records.size() - 1);
        return new FeedBatch(records, FeedCursor.atPosition(last.getCursor().getPosition() + 1));
    }

    @Override
    public Optional<Instant> maxTimestamp() {
        return Optional.ofNullable(lastEventTime);
    }

    @Override
    public boolean linkedIdExists(String linkedId) {
        return recentLinkedIds.contains(linkedId);
    }

    synchronized void ensureStarted() {
        if (running) {
            return;
        }
        buffer = new ArrayBlockingQueue<>(engineConfig.getAmiBufferSize());
        running = true;
        readerThread = new Thread(this::readLoop, "ami-cel-reader");
        readerThread.setDaemon(true);
        readerThread.start();
    }

    private void readLoop() {
        while (running) {
            String host = engineConfig.getAmiHost();
            int port = engineConfig.getAmiPort();
            try (Socket s = new Socket()) {
                socket = s;
                s.connect(new InetSocketAddress(host, port), CONNECT_TIMEOUT_MS);
                log.info("Connected to AMI at {}:{}", host, port);
                BufferedReader reader = new BufferedReader(new InputStreamReader(s.getInputStream(), StandardCharsets.UTF_8));
                OutputStream out = s.getOutputStream();
                out.write(AmiMessageParser.loginAction(engineConfig.getAmiUsername(), engineConfig.getAmiPassword())
                        .getBytes(StandardCharsets.UTF_8));
                out.flush();
                readMessages(reader);
            } catch (IOException e) {
                if (running) {
                    log.warn("AMI connection to {}:{} failed: {}. Reconnecting in {} ms", host, port, e.getMessage(), RECONNECT_DELAY_MS);
                }
            } finally {
                socket = null;
            }
            if (running) {
                try {
                    TimeUnit.MILLISECONDS.sleep(RECONNECT_DELAY_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    private void readMessages(BufferedReader reader) throws IOException {
        List<String> lines = new ArrayList<>();
        boolean loggedIn = false;
        String line;
        while (running && (line = reader.readLine()) != null) {
            if (!line.isEmpty()) {
                lines.add(line);
                continue;
            }
            if (lines.isEmpty()) {
                continue;
            }
            Map<String, String> message = AmiMessageParser.parse(lines);
            lines.clear();
            if (!loggedIn && message.containsKey("Response")) {
                if (!AmiMessageParser.isSuccessResponse(message)) {
                    throw new IOException("AMI login rejected: " + message.get("Message"));
                }
                loggedIn = true;
                log.info("Logged in to AMI, receiving CEL events");
                continue;
            }
            if (AmiMessageParser.isCelEvent(message)) {
                offer(AmiMessageParser.toCelFields(message));
            }
        }
        throw new IOException("AMI connection closed by server");
    }

    void offer(Map<String, String> fields) {
        long seq = sequence.getAndIncrement();
        RawRecord record = RawRecord.builder()
                .type(RecordType.CEL)
                .feedName(NAME)
                .fields(fields)
                .cursor(FeedCursor.atPosition(seq))
                .build();
        String linkedId = fields.get("linkedid");
        if (linkedId != null && !linkedId.isEmpty()) {
            recentLinkedIds.add(linkedId);
        }
        while (!buffer.offer(record)) {
            RawRecord dropped = buffer.poll();
            if (dropped != null) {
                log.warn("AMI event buffer full, dropped CEL event {} of call {}",
                        dropped.get("eventtype"), dropped.get("linkedid"));
            }
        }
        Instant eventTime = DateTimeUtil.parseInstant(fields.get("eventtime"));
        lastEventTime = eventTime != null ? eventTime : Instant.now();
    }

    @PreDestroy
    public void stop() {
        running = false;
        Socket current = socket;
        if (current != null) {
            try {
                current.close();
            } catch (IOException e) {
                log.debug("Error closing AMI socket", e);
            }
        }
        Thread thread = readerThread;
        if (thread != null) {
            thread.interrupt();
        }
    }
}
