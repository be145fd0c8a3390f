package com.paymentsengine.csv;

import com.paymentsengine.common.PrecisionPolicy;
import com.paymentsengine.common.exception.CsvFormatException;
import com.paymentsengine.common.exception.InvalidTransactionRecordException;
import com.paymentsengine.transaction.TransactionRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Lazy, single-pass reader of transaction records from CSV.
 *
 * Expects a header naming {@code type, client, tx, amount}; surrounding whitespace
 * is ignored and the amount column may be empty or absent on dispute rows.
 * Rows that do not form a valid record are logged, counted and skipped.
 * Structural failures of the underlying stream surface as
 * {@link java.io.UncheckedIOException} from the iterator.
 */
@Slf4j
public class TransactionCsvReader implements Iterable<TransactionRecord>, Closeable {

    static final String TYPE = "type";
    static final String CLIENT = "client";
    static final String TX = "tx";
    static final String AMOUNT = "amount";

    private static final List<String> REQUIRED_HEADERS = List.of(TYPE, CLIENT, TX);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setTrim(true)
        .setIgnoreSurroundingSpaces(true)
        .setIgnoreEmptyLines(true)
        .setIgnoreHeaderCase(true)
        .build();

    private final CSVParser parser;

    private final PrecisionPolicy precisionPolicy;

    private long skipped;

    private boolean iterated;

    public TransactionCsvReader(Reader reader, PrecisionPolicy precisionPolicy) throws IOException {
        this.precisionPolicy = precisionPolicy;
        try {
            this.parser = FORMAT.parse(reader);
        } catch (IllegalArgumentException e) {
            throw new CsvFormatException("Invalid CSV header: " + e.getMessage(), e);
        }
        verifyHeaders(parser.getHeaderMap());
    }

    public static TransactionCsvReader open(Path path, PrecisionPolicy precisionPolicy) throws IOException {
        Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        try {
            return new TransactionCsvReader(reader, precisionPolicy);
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }
    }

    @Override
    public Iterator<TransactionRecord> iterator() {
        if (iterated) {
            throw new IllegalStateException("Transaction CSV can only be read once");
        }
        iterated = true;
        Iterator<CSVRecord> rows = parser.iterator();

        return new Iterator<>() {
            private TransactionRecord next;

            @Override
            public boolean hasNext() {
                while (next == null && rows.hasNext()) {
                    next = toRecord(rows.next());
                }
                return next != null;
            }

            @Override
            public TransactionRecord next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                TransactionRecord record = next;
                next = null;
                return record;
            }
        };
    }

    /**
     * Number of malformed rows skipped so far.
     */
    public long getSkipped() {
        return skipped;
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }

    private TransactionRecord toRecord(CSVRecord row) {
        try {
            return TransactionRecord.parse(
                field(row, TYPE), field(row, CLIENT), field(row, TX), field(row, AMOUNT), precisionPolicy);
        } catch (InvalidTransactionRecordException e) {
            skipped++;
            log.warn("Skipping malformed transaction at line {}: {}", parser.getCurrentLineNumber(), e.getMessage());
            return null;
        }
    }

    private static String field(CSVRecord row, String name) {
        return row.isSet(name) ? row.get(name) : null;
    }

    private static void verifyHeaders(Map<String, Integer> headers) {
        if (headers == null) {
            throw new CsvFormatException("CSV input has no header");
        }
        for (String required : REQUIRED_HEADERS) {
            if (!headers.containsKey(required)) {
                throw new CsvFormatException(
                    String.format("CSV header is missing column '%s', found %s", required, headers.keySet()));
            }
        }
    }
}
