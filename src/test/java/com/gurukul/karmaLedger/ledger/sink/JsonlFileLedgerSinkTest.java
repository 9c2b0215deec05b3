package com.gurukul.karmaLedger.ledger.sink;

import com.gurukul.karmaLedger.ledger.model.LedgerChannel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonlFileLedgerSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void appendsOneLinePerEntryPerChannel() throws IOException {
        JsonlFileLedgerSink sink = new JsonlFileLedgerSink(tempDir.resolve("ledger"));

        sink.append(LedgerChannel.AUDIT, "{\"ledgerIndex\":0}");
        sink.append(LedgerChannel.AUDIT, "{\"ledgerIndex\":1}");
        sink.append(LedgerChannel.API, "{\"ledgerIndex\":2}");

        assertEquals(List.of("{\"ledgerIndex\":0}", "{\"ledgerIndex\":1}"),
                Files.readAllLines(tempDir.resolve("ledger/audit.jsonl")));
        assertEquals(List.of("{\"ledgerIndex\":2}"), Files.readAllLines(sink.resolve(LedgerChannel.API)));
        assertFalse(Files.exists(sink.resolve(LedgerChannel.ERRORS)));
    }

    @Test
    void eachAppendIsExactlyOneTerminatedLine() throws IOException {
        JsonlFileLedgerSink sink = new JsonlFileLedgerSink(tempDir);

        sink.append(LedgerChannel.ERRORS, "{\"ledgerIndex\":0}");
        sink.append(LedgerChannel.ERRORS, "{\"ledgerIndex\":1}");

        String separator = System.lineSeparator();
        assertEquals("{\"ledgerIndex\":0}" + separator + "{\"ledgerIndex\":1}" + separator,
                Files.readString(sink.resolve(LedgerChannel.ERRORS)));
    }

    @Test
    void unwritableDirectoryFails() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("not-a-directory"));
        JsonlFileLedgerSink sink = new JsonlFileLedgerSink(blocker);

        assertThrows(IOException.class, () -> sink.append(LedgerChannel.AUDIT, "{}"));
    }
}
