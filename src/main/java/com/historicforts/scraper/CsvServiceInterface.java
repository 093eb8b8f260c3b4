package com.historicforts.scraper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for CSV export of scraped fort data.
 */
public interface CsvServiceInterface {
    /**
     * Writes one row per fort with the {@link FortRecord#COLUMNS} header.
     * @param records forts to export
     * @param filename name of the output file inside the output directory
     * @return path of the written file
     * @throws IOException if file writing fails
     */
    Path writeFortsToCsv(List<FortRecord> records, String filename) throws IOException;

    /**
     * Writes one row per period, keyed by the fort's name and state.
     * @param records forts whose periods are exported, in order
     * @param filename name of the output file inside the output directory
     * @return path of the written file
     * @throws IOException if file writing fails
     */
    Path writePeriodsToCsv(List<FortRecord> records, String filename) throws IOException;
}
