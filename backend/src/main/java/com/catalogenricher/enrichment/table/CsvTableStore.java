package com.catalogenricher.enrichment.table;

import com.catalogenricher.domain.TabularData;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * UTF-8 CSV table store backed by OpenCSV. First line is the header; a leading BOM is dropped.
 */
@Component
@Slf4j
public class CsvTableStore implements TableStore {

    private static final String BOM = "\uFEFF";

    @Override
    public TabularData load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new TableStoreException("Input table not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(reader)) {
            List<String[]> lines = csv.readAll();
            if (lines.isEmpty()) {
                return new TabularData(List.of(), List.of());
            }
            List<String> header = new ArrayList<>(Arrays.asList(lines.get(0)));
            if (!header.isEmpty() && header.get(0) != null && header.get(0).startsWith(BOM)) {
                header.set(0, header.get(0).substring(1));
            }
            header.replaceAll(h -> h == null ? "" : h.strip());
            List<List<String>> rows = new ArrayList<>(lines.size() - 1);
            for (int i = 1; i < lines.size(); i++) {
                String[] line = lines.get(i);
                if (line.length == 1 && (line[0] == null || line[0].isBlank())) {
                    continue;
                }
                rows.add(Arrays.asList(line));
            }
            log.info("Loaded {} rows ({} columns) from {}", rows.size(), header.size(), path);
            return new TabularData(header, rows);
        } catch (IOException | CsvException e) {
            throw new TableStoreException("Failed to read table " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void save(Path path, TabularData data) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                 CSVWriter csv = new CSVWriter(writer)) {
                csv.writeNext(data.columns().toArray(new String[0]));
                for (List<String> row : data.rows()) {
                    String[] cells = new String[data.columns().size()];
                    for (int c = 0; c < cells.length; c++) {
                        String cell = c < row.size() ? row.get(c) : null;
                        cells[c] = cell == null ? "" : cell;
                    }
                    csv.writeNext(cells);
                }
            }
            log.info("Wrote {} rows to {}", data.size(), path);
        } catch (IOException e) {
            throw new TableStoreException("Failed to write table " + path + ": " + e.getMessage(), e);
        }
    }
}
