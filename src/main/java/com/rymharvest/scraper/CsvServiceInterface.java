package com.rymharvest.scraper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for CSV export of tabular numeric data.
 */
public interface CsvServiceInterface {
    /**
     * Writes a header row followed by one row per record. Parent directories are created.
     * @param path output file
     * @param headers column names
     * @param rows rows, each the same length as {@code headers}
     * @throws IOException if file writing fails
     */
    void writeRows(Path path, List<String> headers, List<List<Double>> rows) throws IOException;
}
