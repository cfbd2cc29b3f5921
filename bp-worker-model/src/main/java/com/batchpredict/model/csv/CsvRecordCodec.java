package com.batchpredict.model.csv;

import com.batchpredict.model.CandidateRecord;
import com.batchpredict.model.FeatureValue;
import com.batchpredict.model.PredictionRecord;
import com.batchpredict.model.RecordTable;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes the pipeline's CSV files. Every reader returns rows in file order and never drops a
 * non-empty line, since row position is the join key between submitted input and prediction output.
 * <p>
 * Parse failures are reported as {@link UncheckedIOException}.
 */
public final class CsvRecordCodec {

    private static final CsvMapper CSV = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private CsvRecordCodec() {
    }

    /**
     * Reads a file with a header row into a {@link RecordTable}. The identifier column must be present
     * in the header unless the file is empty.
     *
     * @throws IllegalArgumentException if the header lacks {@code idColumn}
     */
    public static RecordTable readTable(String content, String idColumn) {
        Objects.requireNonNull(idColumn, "idColumn");
        List<String[]> lines = readLines(content);
        if (lines.isEmpty()) {
            return new RecordTable(List.of(), idColumn, List.of());
        }
        List<String> header = trimAll(lines.get(0));
        int idIndex = header.indexOf(idColumn);
        if (idIndex < 0) {
            throw new IllegalArgumentException("Identifier column '" + idColumn + "' not found in header " + header);
        }
        List<CandidateRecord> rows = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            String[] cells = lines.get(i);
            List<FeatureValue> features = new ArrayList<>(header.size() - 1);
            for (int c = 0; c < header.size(); c++) {
                if (c == idIndex) continue;
                features.add(new FeatureValue(header.get(c), cell(cells, c)));
            }
            rows.add(new CandidateRecord(cell(cells, idIndex), features));
        }
        return new RecordTable(header, idColumn, rows);
    }

    /** Writes a table with its header, columns in table order. */
    public static String writeTable(RecordTable table) {
        List<List<String>> rows = new ArrayList<>(table.size());
        for (CandidateRecord r : table.getRows()) {
            List<String> cells = new ArrayList<>(table.getColumns().size());
            for (String column : table.getColumns()) {
                cells.add(table.cell(r, column));
            }
            rows.add(cells);
        }
        return writeRows(table.getColumns(), rows, true);
    }

    /**
     * Writes rows under the given columns. Each row must have exactly one cell per column.
     *
     * @param withHeader false for files consumed by the prediction service, which takes no header
     */
    public static String writeRows(List<String> columns, List<List<String>> rows, boolean withHeader) {
        CsvSchema.Builder sb = CsvSchema.builder();
        for (String c : columns) {
            sb.addColumn(c);
        }
        CsvSchema schema = withHeader ? sb.build().withHeader() : sb.build().withoutHeader();
        StringWriter out = new StringWriter();
        try (SequenceWriter writer = CSV.writer(schema).writeValues(out)) {
            for (List<String> row : rows) {
                if (row.size() != columns.size()) {
                    throw new IllegalArgumentException("Row has " + row.size() + " cells for " + columns.size() + " columns");
                }
                Map<String, String> values = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    values.put(columns.get(i), row.get(i) != null ? row.get(i) : "");
                }
                writer.write(values);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV", e);
        }
        return out.toString();
    }

    /**
     * Reads raw prediction output: no header, score in the first column, one line per submitted row.
     */
    public static List<PredictionRecord> readPredictions(String content) {
        List<String[]> lines = readLines(content);
        List<PredictionRecord> predictions = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            predictions.add(new PredictionRecord(i, cell(lines.get(i), 0)));
        }
        return predictions;
    }

    /** Reads a file with a header row as ordered column→value maps, one per line. */
    public static List<Map<String, String>> readRows(String content) {
        List<String[]> lines = readLines(content);
        if (lines.isEmpty()) {
            return List.of();
        }
        List<String> header = trimAll(lines.get(0));
        List<Map<String, String>> rows = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < header.size(); c++) {
                row.put(header.get(c), cell(lines.get(i), c));
            }
            rows.add(row);
        }
        return rows;
    }

    private static List<String[]> readLines(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        try (MappingIterator<String[]> it = CSV.readerFor(String[].class).readValues(content)) {
            return it.readAll();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse CSV", e);
        }
    }

    private static List<String> trimAll(String[] cells) {
        List<String> out = new ArrayList<>(Arrays.asList(cells));
        out.replaceAll(s -> s != null ? s.trim() : "");
        return out;
    }

    private static String cell(String[] cells, int index) {
        return index < cells.length && cells[index] != null ? cells[index] : "";
    }
}
