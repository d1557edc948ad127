package io.healthsamurai.auditledger.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.healthsamurai.auditledger.builder.RecordDocumentMapper;
import io.healthsamurai.auditledger.exception.StorageException;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import io.healthsamurai.auditledger.util.JsonUtil;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Record database kept as one JSON document per line in an append-only file.
 *
 * <p>Each append is a single write of one complete line followed by a sync to disk. Lines can
 * arrive out of sequence order because writes are concurrent, so reads sort by sequence number.
 *
 * <p>A crash in the middle of an append leaves a last line without its newline. Reads skip such a
 * line. The next append moves it to {@code <file>.torn} and cuts the file back to the last
 * complete line before writing. A malformed line anywhere else is corruption and fails the read.
 */
public class JsonLinesAuditRecordStore implements AuditRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesAuditRecordStore.class);

    private final Path file;

    public JsonLinesAuditRecordStore(Path file) {
        this.file = file;
    }

    @Override
    public synchronized void append(ImmutableAuditRecord record) throws StorageException {
        byte[] line;
        try {
            line = (JsonUtil.toJson(RecordDocumentMapper.toDocument(record)) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Cannot serialize record " + record.getRecordId(), e);
        }

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
                fenceTornTail(channel);
                long position = channel.size();
                ByteBuffer buffer = ByteBuffer.wrap(line);
                while (buffer.hasRemaining()) {
                    position += channel.write(buffer, position);
                }
                channel.force(true);
            }
            log.debug("Appended record {} (sequence {}) to {}", record.getRecordId(), record.getSequenceNumber(), file);
        } catch (IOException e) {
            throw new StorageException("Cannot append record " + record.getRecordId() + " to " + file, e);
        }
    }

    @Override
    public Optional<ImmutableAuditRecord> findLatest() throws StorageException {
        return readAll().stream().max(Comparator.comparingLong(ImmutableAuditRecord::getSequenceNumber));
    }

    @Override
    public List<ImmutableAuditRecord> findAll() throws StorageException {
        List<ImmutableAuditRecord> records = readAll();
        records.sort(Comparator.comparingLong(ImmutableAuditRecord::getSequenceNumber));
        return records;
    }

    private synchronized List<ImmutableAuditRecord> readAll() throws StorageException {
        List<ImmutableAuditRecord> records = new ArrayList<>();
        if (!Files.exists(file)) {
            return records;
        }

        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Cannot read record file " + file, e);
        }
        boolean unterminated = !content.isEmpty() && !content.endsWith("\n");
        List<String> lines = content.lines().toList();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            JsonNode node = JsonUtil.parseJson(line);
            if (node == null || !node.isObject()) {
                if (unterminated && i == lines.size() - 1) {
                    log.error("Ignoring incomplete last line {} of {} ({} chars), left by an interrupted append",
                            i + 1, file, line.length());
                    continue;
                }
                throw new StorageException("Malformed record at line " + (i + 1) + " of " + file);
            }
            try {
                records.add(RecordDocumentMapper.fromDocument(node));
            } catch (IllegalArgumentException e) {
                throw new StorageException("Invalid record at line " + (i + 1) + " of " + file, e);
            }
        }
        return records;
    }

    /**
     * Cuts an unterminated last line off the file, keeping a copy of it in {@code <file>.torn}.
     */
    private void fenceTornTail(FileChannel channel) throws IOException {
        long size = channel.size();
        if (size == 0 || readByte(channel, size - 1) == '\n') {
            return;
        }

        long keep = size - 1;
        while (keep > 0 && readByte(channel, keep - 1) != '\n') {
            keep--;
        }

        ByteBuffer tail = ByteBuffer.allocate((int) (size - keep));
        while (tail.hasRemaining()) {
            if (channel.read(tail, keep + tail.position()) < 0) {
                break;
            }
        }
        Files.write(getTornFile(), tail.array(), StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        channel.truncate(keep);
        channel.force(true);
        log.error("Moved {} bytes of an incomplete last line from {} to {}", size - keep, file, getTornFile());
    }

    private static byte readByte(FileChannel channel, long position) throws IOException {
        ByteBuffer single = ByteBuffer.allocate(1);
        if (channel.read(single, position) != 1) {
            throw new IOException("Cannot read byte " + position + " of record file");
        }
        return single.get(0);
    }

    public Path getTornFile() {
        return file.resolveSibling(file.getFileName() + ".torn");
    }

    public Path getFile() {
        return file;
    }
}
