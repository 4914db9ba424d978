package com.expense.audit.repository;

import com.expense.audit.config.AuditProperties;
import com.expense.audit.model.ExpenseRecord;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes the expense table as a headed CSV file.
 *
 * Loading accepts UTF-8 (with or without BOM) and falls back to windows-1252 for files
 * exported from older spreadsheet tools. Saving writes UTF-8 with BOM to a temp file
 * and moves it over the target, so a failed write never truncates the table.
 */
@Repository
public class ExpenseCsvRepository {

    private static final Logger log = LoggerFactory.getLogger(ExpenseCsvRepository.class);

    private static final char BOM = '\uFEFF';
    private static final List<Charset> LOAD_CHARSETS = List.of(StandardCharsets.UTF_8, Charset.forName("windows-1252"));

    private final Path dataFile;
    private final CsvMapper csvMapper;

    public ExpenseCsvRepository(AuditProperties properties) {
        this.dataFile = Paths.get(properties.getDataFile());
        this.csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .build();
    }

    public Path getDataFile() {
        return dataFile;
    }

    public boolean exists() {
        return Files.isRegularFile(dataFile);
    }

    public List<ExpenseRecord> load() {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(dataFile);
        } catch (IOException e) {
            throw new ExpenseStorageException("Failed to read " + dataFile, e);
        }

        String text = decode(bytes);
        try {
            List<ExpenseRecord> records = parse(text);
            log.info("Loaded {} expense records from {}", records.size(), dataFile);
            return records;
        } catch (IOException e) {
            throw new ExpenseStorageException("Malformed CSV in " + dataFile, e);
        }
    }

    /**
     * Writes the full table. Returns false without touching the file when there is nothing to write.
     */
    public boolean save(List<ExpenseRecord> records) {
        if (records.isEmpty()) {
            log.warn("Refusing to save an empty expense table to {}", dataFile);
            return false;
        }

        Set<String> header = new LinkedHashSet<>();
        for (ExpenseRecord record : records) {
            header.addAll(record.asMap().keySet());
        }
        List<Map<String, String>> rows = new ArrayList<>(records.size());
        for (ExpenseRecord record : records) {
            rows.add(record.asMap());
        }

        Path temp = dataFile.resolveSibling(dataFile.getFileName() + ".tmp");
        try {
            Path parent = dataFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                writer.write(BOM);
                writer.write(toCsv(header, rows));
            }
            moveIntoPlace(temp);
            log.debug("Saved {} expense records to {}", records.size(), dataFile);
            return true;
        } catch (IOException e) {
            throw new ExpenseStorageException("Failed to write " + dataFile, e);
        }
    }

    /**
     * Renders rows as UTF-8 CSV bytes (with BOM, for spreadsheet tools) under the given header.
     * Cells for columns a row does not have are left empty.
     */
    public byte[] export(Collection<String> header, List<? extends Map<String, ?>> rows) {
        if (header.isEmpty()) {
            return String.valueOf(BOM).getBytes(StandardCharsets.UTF_8);
        }
        try {
            return (BOM + toCsv(header, rows)).getBytes(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExpenseStorageException("Failed to render CSV export", e);
        }
    }

    private List<ExpenseRecord> parse(String text) throws IOException {
        List<ExpenseRecord> records = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = csvMapper.readerForMapOf(String.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(text)) {
            while (it.hasNextValue()) {
                Map<String, String> row = it.nextValue();
                CsvSchema schema = (CsvSchema) it.getParserSchema();
                Map<String, String> ordered = new LinkedHashMap<>();
                for (CsvSchema.Column column : schema) {
                    ordered.put(column.getName(), row.getOrDefault(column.getName(), ""));
                }
                records.add(new ExpenseRecord(ordered));
            }
        }
        return records;
    }

    private String toCsv(Collection<String> header, List<? extends Map<String, ?>> rows) throws IOException {
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        for (String column : header) {
            schema.addColumn(column);
        }

        List<Map<String, Object>> filled = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            Map<String, Object> full = new LinkedHashMap<>();
            for (String column : header) {
                Object value = row.get(column);
                full.put(column, value == null ? "" : value);
            }
            filled.add(full);
        }
        return csvMapper.writer(schema.build()).writeValueAsString(filled);
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, dataFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", dataFile);
            Files.move(temp, dataFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private String decode(byte[] bytes) {
        CharacterCodingException firstFailure = null;
        for (Charset charset : LOAD_CHARSETS) {
            try {
                String text = charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
                if (!text.isEmpty() && text.charAt(0) == BOM) {
                    text = text.substring(1);
                }
                if (charset != StandardCharsets.UTF_8) {
                    log.info("{} is not valid UTF-8, read as {}", dataFile, charset.name());
                }
                return text;
            } catch (CharacterCodingException e) {
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }
        throw new ExpenseStorageException("Unsupported text encoding in " + dataFile, firstFailure);
    }
}
