package com.di.sheetload.source;

import java.nio.file.Path;
import java.util.Set;

/**
 * Reads one kind of tabular file into a {@link SourceSheet}.
 * <p>
 * Implementations are Spring beans collected by {@link SourceReaderRegistry}. Reading never
 * modifies the file.
 */
public interface SourceReader {

    /**
     * @return lower-case file extensions handled by this reader, without the dot (e.g. "xlsx")
     */
    Set<String> extensions();

    /**
     * Reads the header row and every non-blank data row below it.
     *
     * @throws com.di.sheetload.exception.MalformedSourceException if the file cannot be parsed or
     *         has no header row at the configured position
     */
    SourceSheet read(Path path, ReadOptions options);

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
