package com.rymharvest.scraper;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Service for exporting aggregation rows to CSV files using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Validates the header and row shapes before opening the file.</li>
 *   <li>Ensures the target directory exists.</li>
 *   <li>Writes the header row, then one row per record in input order.</li>
 * </ul>
 *
 * @author RYM Harvest Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    public void writeRows(Path path, List<String> headers, List<List<Double>> rows) throws IOException {
        if (path == null) {
            logger.warn("Attempted to write CSV without a target path");
            throw new IllegalArgumentException("Path cannot be null");
        }
        if (headers == null || headers.isEmpty()) {
            logger.warn("Attempted to write CSV with no headers: {}", path);
            throw new IllegalArgumentException("Headers cannot be null or empty");
        }
        if (rows == null) {
            logger.warn("Attempted to write null row list to CSV: {}", path);
            throw new IllegalArgumentException("Row list cannot be null");
        }
        for (int i = 0; i < rows.size(); i++) {
            List<Double> row = rows.get(i);
            if (row == null || row.size() != headers.size()) {
                throw new IllegalArgumentException("Row " + i + " does not match the " + headers.size() + " headers");
            }
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);

        try (CSVWriter writer = new CSVWriter(new FileWriter(path.toFile(), StandardCharsets.UTF_8))) {
            writer.writeNext(headers.toArray(String[]::new));
            for (List<Double> row : rows) {
                writer.writeNext(row.stream().map(CsvService::format).toArray(String[]::new));
            }
        }
        logger.info("Wrote {} rows to CSV file: {}", rows.size(), path);
    }

    private static String format(Double value) {
        return value == null ? "" : Double.toString(value);
    }
}
