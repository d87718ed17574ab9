package com.di.sheetload.runner;

import com.di.sheetload.exception.PartialLoadException;
import com.di.sheetload.service.IngestionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Runs one ingestion command at start-up and prints its report as JSON:
 *
 * <pre>
 * java -jar sheetload.jar --sheetload.command=load --sheetload.file=/data/delivery.xlsx
 * </pre>
 *
 * Without {@code sheetload.command} nothing runs and the service only serves REST. A failing
 * command fails start-up, so the process exits non-zero.
 */
@Slf4j
@Component
@Order(1)
public class IngestionCommandRunner implements ApplicationRunner {

    private final IngestionService ingestionService;
    private final ObjectMapper objectMapper;
    private final String command;
    private final String file;
    private final PrintStream out;

    @Autowired
    public IngestionCommandRunner(IngestionService ingestionService, ObjectMapper objectMapper,
                                  @Value("${sheetload.command:}") String command,
                                  @Value("${sheetload.file:}") String file) {
        this(ingestionService, objectMapper, command, file, System.out);
    }

    IngestionCommandRunner(IngestionService ingestionService, ObjectMapper objectMapper,
                           String command, String file, PrintStream out) {
        this.ingestionService = ingestionService;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.command = command == null ? "" : command.trim().toLowerCase(Locale.ROOT);
        this.file = file == null ? "" : file.trim();
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws JsonProcessingException {
        if (command.isEmpty()) {
            return;
        }
        if (file.isEmpty()) {
            throw new IllegalArgumentException("--sheetload.file is required with --sheetload.command=" + command);
        }
        Path path = Path.of(file);
        log.info("Running command '{}' on {}", command, path);
        Object report;
        try {
            report = execute(path);
        } catch (PartialLoadException e) {
            if (e.getReport() != null) {
                out.println(objectMapper.writeValueAsString(e.getReport()));
            }
            throw e;
        }
        out.println(objectMapper.writeValueAsString(report));
    }

    private Object execute(Path path) {
        return switch (command) {
            case "profile" -> ingestionService.profile(path);
            case "reconcile" -> ingestionService.reconcile(path);
            case "filter-preview" -> ingestionService.filterPreview(path);
            case "load" -> ingestionService.load(path);
            default -> throw new IllegalArgumentException("Unknown command '" + command
                    + "'; expected one of profile, reconcile, filter-preview, load");
        };
    }
}
