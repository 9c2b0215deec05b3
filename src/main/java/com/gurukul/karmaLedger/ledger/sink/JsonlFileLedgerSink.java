package com.gurukul.karmaLedger.ledger.sink;

import com.gurukul.karmaLedger.ledger.model.LedgerChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Appends each entry as one JSON line to a per-channel file under the ledger directory
 * (api.jsonl, audit.jsonl, errors.jsonl).
 *
 * Writes are serialized by the ledger's lock, so no locking happens here.
 */
@Slf4j
@Component
public class JsonlFileLedgerSink implements LedgerSink {

    private final Path directory;

    @Autowired
    public JsonlFileLedgerSink(@Value("${karma.ledger.directory:logs}") String directory) {
        this(Paths.get(directory));
    }

    public JsonlFileLedgerSink(Path directory) {
        this.directory = directory;
        log.info("JSONL ledger sink initialized - directory: {}", directory.toAbsolutePath());
    }

    @Override
    public void append(LedgerChannel channel, String line) throws IOException {
        Files.createDirectories(directory);
        Path file = resolve(channel);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
            // line and separator go out in a single write
            writer.write(line + System.lineSeparator());
        }
    }

    public Path resolve(LedgerChannel channel) {
        return directory.resolve(channel.fileName());
    }
}
