package com.expense.audit.service;

import com.expense.audit.config.AuditProperties;
import com.expense.audit.model.ExpenseRecord;
import com.expense.audit.model.PagedResponse;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * The live expense table: insertion-ordered rows plus an index from record id to position.
 *
 * Readers only ever get immutable copies, so an audit never sees the table change
 * underneath it. Records with a blank id are kept but not indexed.
 */
@Component
public class ExpenseRecordStore {

    private final String idColumn;
    private final List<ExpenseRecord> rows = new ArrayList<>();
    private final Map<String, Integer> positionById = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public ExpenseRecordStore(AuditProperties properties) {
        this.idColumn = properties.getColumns().getId();
    }

    public void replaceAll(List<ExpenseRecord> records) {
        write(() -> {
            rows.clear();
            rows.addAll(records);
            reindex();
            return null;
        });
    }

    public List<ExpenseRecord> snapshot() {
        return read(() -> List.copyOf(rows));
    }

    public PagedResponse<ExpenseRecord> page(int offset, int limit) {
        return read(() -> {
            int total = rows.size();
            int from = Math.min(Math.max(offset, 0), total);
            int to = (int) Math.min((long) from + Math.max(limit, 0), total);
            return new PagedResponse<>(List.copyOf(rows.subList(from, to)), total, to < total);
        });
    }

    public int size() {
        return read(rows::size);
    }

    public Optional<ExpenseRecord> findById(String id) {
        return read(() -> {
            Integer pos = positionById.get(id);
            return pos == null ? Optional.<ExpenseRecord>empty() : Optional.of(rows.get(pos));
        });
    }

    public int indexOf(String id) {
        return read(() -> positionById.getOrDefault(id, -1));
    }

    /**
     * Appends a record. Returns false if a record with the same id already exists.
     */
    public boolean add(ExpenseRecord record) {
        return write(() -> {
            String id = record.getOrEmpty(idColumn);
            if (!id.isBlank() && positionById.containsKey(id)) {
                return false;
            }
            rows.add(record);
            if (!id.isBlank()) {
                positionById.put(id, rows.size() - 1);
            }
            return true;
        });
    }

    /**
     * Swaps the record stored under {@code id} for {@code replacement}.
     *
     * @return the record that was replaced, or empty if {@code id} is unknown
     */
    public Optional<ExpenseRecord> replace(String id, ExpenseRecord replacement) {
        return write(() -> {
            Integer pos = positionById.get(id);
            if (pos == null) {
                return Optional.<ExpenseRecord>empty();
            }
            ExpenseRecord previous = rows.set(pos, replacement);
            reindex();
            return Optional.of(previous);
        });
    }

    public Optional<ExpenseRecord> remove(String id) {
        return write(() -> {
            Integer pos = positionById.get(id);
            if (pos == null) {
                return Optional.<ExpenseRecord>empty();
            }
            ExpenseRecord removed = rows.remove((int) pos);
            reindex();
            return Optional.of(removed);
        });
    }

    /**
     * Puts a record back at a given position, used to undo a removal.
     */
    public void insert(int index, ExpenseRecord record) {
        write(() -> {
            rows.add(Math.min(Math.max(index, 0), rows.size()), record);
            reindex();
            return null;
        });
    }

    // Caller must hold the write lock
    private void reindex() {
        positionById.clear();
        for (int i = 0; i < rows.size(); i++) {
            String id = rows.get(i).getOrEmpty(idColumn);
            if (!id.isBlank()) {
                positionById.putIfAbsent(id, i);
            }
        }
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
