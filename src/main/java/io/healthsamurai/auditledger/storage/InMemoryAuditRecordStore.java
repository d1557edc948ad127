package io.healthsamurai.auditledger.storage;

import io.healthsamurai.auditledger.exception.StorageException;
import io.healthsamurai.auditledger.model.ImmutableAuditRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Record database held in memory, ordered by sequence number. Lost on restart.
 */
public class InMemoryAuditRecordStore implements AuditRecordStore {

    private final ConcurrentSkipListMap<Long, ImmutableAuditRecord> records = new ConcurrentSkipListMap<>();

    @Override
    public void append(ImmutableAuditRecord record) throws StorageException {
        ImmutableAuditRecord existing = records.putIfAbsent(record.getSequenceNumber(), record);
        if (existing != null) {
            throw new StorageException("Sequence number " + record.getSequenceNumber() + " already stored");
        }
    }

    @Override
    public Optional<ImmutableAuditRecord> findLatest() {
        Map.Entry<Long, ImmutableAuditRecord> last = records.lastEntry();
        return last == null ? Optional.empty() : Optional.of(last.getValue());
    }

    @Override
    public List<ImmutableAuditRecord> findAll() {
        return new ArrayList<>(records.values());
    }

    @Override
    public List<ImmutableAuditRecord> findBySequenceRange(long from, long to) {
        if (from > to) {
            return List.of();
        }
        return new ArrayList<>(records.subMap(from, true, to, true).values());
    }

    public int size() {
        return records.size();
    }
}
