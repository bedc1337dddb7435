package com.infomedia.abacox.callshipping.component.feed;

import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.normalizer.DateTimeUtil;
import com.infomedia.abacox.callshipping.component.normalizer.RecordType;
import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tails the CEL master CSV written by {@code cel_custom}. The cursor is a byte offset; a file that
 * shrank or was replaced is read again from the start. Quoted values may span lines.
 */
@Component
@Log4j2
public class CelCsvFeedAdapter implements CelFeedAdapter {

    public static final String NAME = "cel-csv";

    // Column order of the cel_custom.conf mapping
    static final List<String> COLUMNS = List.of(
            "eventtype", "eventtime", "cid_name", "cid_num", "cid_ani", "cid_rdnis", "cid_dnid", "exten",
            "context", "channame", "appname", "appdata", "amaflags", "accountcode", "uniqueid", "linkedid",
            "peer", "userdeftype", "extra");

    private static final int MAX_READ_BYTES = 4 * 1024 * 1024;
    private static final int TAIL_BYTES = 64 * 1024;

    private final EngineConfigService engineConfig;

    private volatile Object lastFileKey;

    public CelCsvFeedAdapter(EngineConfigService engineConfig) {
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
        return CelMode.CSV;
    }

    @Override
    public FeedCursor cursorAfter(Instant watermark) {
        // Offsets are not comparable with times; start at the current end of the file
        try {
            Path path = path();
            return FeedCursor.atPosition(Files.exists(path) ? Files.size(path) : 0L);
        } catch (IOException e) {
            log.warn("Could not read size of {}: {}", engineConfig.getCelCsvPath(), e.getMessage());
            return FeedCursor.start();
        }
    }

    @Override
    public FeedBatch fetchSince(FeedCursor cursor, int limit) throws FeedException {
        Path path = path();
        if (!Files.exists(path)) {
            log.debug("CEL CSV file {} does not exist yet", path);
            return FeedBatch.empty(cursor);
        }
        try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "r")) {
            long length = file.length();
            long position = resolveStart(path, cursor.getPosition(), length);
            if (position >= length) {
                return FeedBatch.empty(FeedCursor.atPosition(position));
            }
            byte[] buffer = new byte[(int) Math.min(length - position, MAX_READ_BYTES)];
            file.seek(position);
            file.readFully(buffer);
            return parse(buffer, position, limit);
        } catch (IOException e) {
            throw new FeedException("Failed to read CEL CSV " + path + ": " + e.getMessage(), e);
        }
    }

    private long resolveStart(Path path, long position, long length) throws IOException {
        Object fileKey = Files.readAttributes(path, BasicFileAttributes.class).fileKey();
        boolean replaced = lastFileKey != null && fileKey != null && !Objects.equals(lastFileKey, fileKey);
        lastFileKey = fileKey;
        if (position > length || (replaced && position > 0)) {
            log.info("CEL CSV {} was rotated (offset {}, size {}), reading from the start", path, position, length);
            return 0L;
        }
        return position;
    }

    /**
     * Parses complete records from the buffer, which starts at byte {@code base} of the file.
     */
    FeedBatch parse(byte[] buffer, long base, int limit) throws FeedException {
        CSVParser parser = newParser();
        List<RawRecord> records = new ArrayList<>();
        int lineStart = 0;
        int recordStart = 0;
        for (int i = 0; i < buffer.length && records.size() < limit; i++) {
            if (buffer[i] != '\n') {
                continue;
            }
            int end = i > lineStart && buffer[i - 1] == '\r' ? i - 1 : i;
            String line = new String(buffer, lineStart, end - lineStart, StandardCharsets.UTF_8);
            lineStart = i + 1;
            String[] values;
            try {
                values = parser.parseLineMulti(line);
            } catch (IOException e) {
                log.warn("Skipping malformed CEL CSV record at offset {}: {}", base + recordStart, e.getMessage());
                parser = newParser();
                recordStart = lineStart;
                continue;
            }
            if (parser.isPending()) {
                continue;
            }
            if (values != null && !(values.length == 1 && values[0].isBlank())) {
                records.add(RawRecord.builder()
                        .type(RecordType.CEL)
                        .feedName(NAME)
                        .fields(toFields(values))
                        .cursor(FeedCursor.atPosition(base + recordStart))
                        .build());
            }
            recordStart = lineStart;
        }
        if (records.isEmpty() && recordStart == 0 && buffer.length == MAX_READ_BYTES) {
            throw new FeedException("CEL CSV record at offset " + base + " exceeds " + MAX_READ_BYTES + " bytes");
        }
        return new FeedBatch(records, FeedCursor.atPosition(base + recordStart));
    }

    static Map<String, String> toFields(String[] values) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < COLUMNS.size(); i++) {
            fields.put(COLUMNS.get(i), i < values.length && values[i] != null ? values[i] : "");
        }
        return fields;
    }

    @Override
    public Optional<Instant> maxTimestamp() throws FeedException {
        Path path = path();
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "r")) {
            long length = file.length();
            int size = (int) Math.min(length, TAIL_BYTES);
            byte[] tail = new byte[size];
            file.seek(length - size);
            file.readFully(tail);
            String[] lines = new String(tail, StandardCharsets.UTF_8).split("\r?\n");
            CSVParser parser = newParser();
            for (int i = lines.length - 1; i >= 0; i--) {
                try {
                    String[] values = parser.parseLine(lines[i]);
                    if (values != null && values.length > 1) {
                        Instant eventTime = DateTimeUtil.parseInstant(values[1]);
                        if (eventTime != null) {
                            return Optional.of(eventTime);
                        }
                    }
                } catch (IOException e) {
                    // Partial line at the start of the tail window
                    parser = newParser();
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new FeedException("Failed to read the tail of CEL CSV " + path, e);
        }
    }

    @Override
    public boolean linkedIdExists(String linkedId) throws FeedException {
        Path path = path();
        if (!Files.exists(path)) {
            return false;
        }
        String quoted = "\"" + linkedId + "\"";
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.contains(quoted) || line.contains("," + linkedId + ",")) {
                    return true;
                }
            }
            return false;
        } catch (IOException e) {
            throw new FeedException("Failed to scan CEL CSV " + path, e);
        }
    }

    private Path path() {
        return Paths.get(engineConfig.getCelCsvPath());
    }

    private static CSVParser newParser() {
        return new CSVParserBuilder()
                .withSeparator(',')
                .withIgnoreQuotations(false)
                .withQuoteChar('"')
                .withEscapeChar('\\')
                .build();
    }
}
