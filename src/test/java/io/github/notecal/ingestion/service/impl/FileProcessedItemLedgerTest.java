package io.github.notecal.ingestion.service.impl;

import io.github.notecal.ingestion.domain.exception.LedgerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileProcessedItemLedgerTest {

    @TempDir
    Path tempDir;

    private Path ledgerFile;
    private FileProcessedItemLedger ledger;

    @BeforeEach
    void setUp() {
        ledgerFile = tempDir.resolve("processed_items.log");
        ledger = new FileProcessedItemLedger(ledgerFile.toString());
    }

    @Test
    void missingFileMeansNothingProcessed() {
        assertThat(ledger.snapshot()).isEmpty();
    }

    @Test
    void commitAppendsOneNewlineTerminatedLine() throws Exception {
        ledger.commit("18c2a");
        ledger.commit("18c2b");

        assertThat(Files.readString(ledgerFile)).isEqualTo("18c2a\n18c2b\n");
        assertThat(ledger.snapshot()).containsExactly("18c2a", "18c2b");
    }

    @Test
    void committingTheSameIdTwiceIsANoOp() throws Exception {
        ledger.commit("18c2a");
        ledger.commit("18c2a");

        assertThat(Files.readAllLines(ledgerFile)).containsExactly("18c2a");
    }

    @Test
    void commitsSurviveANewLedgerInstance() {
        ledger.commit("18c2a");

        FileProcessedItemLedger reopened = new FileProcessedItemLedger(ledgerFile.toString());

        assertThat(reopened.snapshot()).containsExactly("18c2a");
    }

    @Test
    void snapshotIgnoresBlankLinesAndTrimsWhitespace() throws Exception {
        Files.writeString(ledgerFile, "a1\n\n  b2  \n\n");

        assertThat(ledger.snapshot()).containsExactlyInAnyOrder("a1", "b2");
    }

    @Test
    void snapshotIsACopyOfPersistedState() {
        var before = ledger.snapshot();

        ledger.commit("later");

        assertThat(before).isEmpty();
        assertThat(ledger.snapshot()).containsExactly("later");
    }

    @Test
    void commitCreatesMissingDirectories() {
        Path nested = tempDir.resolve("data/ledger/processed.log");
        FileProcessedItemLedger nestedLedger = new FileProcessedItemLedger(nested.toString());

        nestedLedger.commit("x1");

        assertThat(Files.exists(nested)).isTrue();
    }

    @Test
    void tornTrailingLineIsFatal() throws Exception {
        Files.writeString(ledgerFile, "a1\nb2");

        assertThatThrownBy(() -> ledger.snapshot())
                .isInstanceOf(LedgerException.class)
                .hasMessageContaining("incompleta");
        assertThatThrownBy(() -> ledger.commit("c3")).isInstanceOf(LedgerException.class);
    }

    @Test
    void invalidUtf8IsFatal() throws Exception {
        Files.write(ledgerFile, new byte[]{'a', (byte) 0xC3, (byte) 0x28, '\n'});

        assertThatThrownBy(() -> ledger.snapshot()).isInstanceOf(LedgerException.class);
    }

    @Test
    void unreadableStoreIsFatal() {
        FileProcessedItemLedger directoryLedger = new FileProcessedItemLedger(tempDir.toString());

        assertThatThrownBy(directoryLedger::snapshot).isInstanceOf(LedgerException.class);
    }

    @Test
    void rejectsIdsThatWouldBreakTheLineFormat() {
        assertThatThrownBy(() -> ledger.commit("a\nb")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledger.commit(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledger.commit(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledger.commit("abc ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void storesNonAsciiIdsAsUtf8() throws Exception {
        ledger.commit("nota-ção");

        assertThat(Files.readString(ledgerFile, StandardCharsets.UTF_8)).isEqualTo("nota-ção\n");
    }

    @Test
    void concurrentCommitsWriteEachIdExactlyOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String id = "item-" + (i % 50);
                futures.add(pool.submit(() -> ledger.commit(id)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdown();
        }

        List<String> lines = Files.readAllLines(ledgerFile);
        assertThat(lines).hasSize(50).doesNotHaveDuplicates();
    }
}
