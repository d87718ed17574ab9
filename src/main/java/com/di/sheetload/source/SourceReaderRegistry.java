package com.di.sheetload.source;

import com.di.sheetload.exception.MalformedSourceException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Registry of {@link SourceReader} beans keyed by file extension.
 *
 * <p>Every reader bean is discovered through Spring injection and registered under each extension
 * it declares. Lookup is case-insensitive. Two readers claiming the same extension is a start-up
 * error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceReaderRegistry {

    private final List<SourceReader> readers;

    private Map<String, SourceReader> readersByExtension;

    @PostConstruct
    public void initialize() {
        if (readers == null || readers.isEmpty()) {
            log.warn("No SourceReader beans found. Registry will be empty.");
            readersByExtension = Collections.emptyMap();
            return;
        }

        Map<String, List<SourceReader>> grouped = readers.stream()
                .flatMap(reader -> reader.extensions().stream()
                        .map(ext -> Map.entry(normalizeExtension(ext), reader)))
                .collect(Collectors.groupingBy(Map.Entry::getKey,
                        Collectors.mapping(Map.Entry::getValue, Collectors.toList())));

        String duplicates = grouped.entrySet().stream()
                .filter(entry -> entry.getValue().size() > 1)
                .map(entry -> String.format("'%s' -> [%s]", entry.getKey(), entry.getValue().stream()
                        .map(reader -> reader.getClass().getName())
                        .collect(Collectors.joining(", "))))
                .collect(Collectors.joining(" ; "));
        if (!duplicates.isEmpty()) {
            throw new IllegalStateException("Duplicate SourceReader extensions detected: " + duplicates);
        }

        readersByExtension = grouped.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, entry -> entry.getValue().get(0)));
        log.info("Registered {} source reader extension(s): {}", readersByExtension.size(),
                new TreeSet<>(readersByExtension.keySet()));
    }

    /**
     * Returns the reader for the file's extension.
     *
     * @throws IllegalArgumentException if the file does not exist
     * @throws MalformedSourceException if no reader handles the extension
     */
    public SourceReader readerFor(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Source file not found: " + path);
        }
        String extension = extensionOf(path);
        SourceReader reader = readersByExtension.get(extension);
        if (reader == null) {
            throw new MalformedSourceException(String.format(
                    "Unsupported source type: '%s'. Available types: %s",
                    extension, new TreeSet<>(readersByExtension.keySet())));
        }
        return reader;
    }

    public SourceSheet read(Path path, ReadOptions options) {
        return readerFor(path).read(path, options);
    }

    public Set<String> getRegisteredExtensions() {
        return Collections.unmodifiableSet(readersByExtension.keySet());
    }

    private static String extensionOf(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : normalizeExtension(fileName.substring(dot + 1));
    }

    private static String normalizeExtension(String extension) {
        return extension == null ? null : extension.trim().toLowerCase(Locale.ROOT);
    }
}
