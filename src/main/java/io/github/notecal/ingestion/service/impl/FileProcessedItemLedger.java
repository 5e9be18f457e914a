package io.github.notecal.ingestion.service.impl;

import io.github.notecal.ingestion.domain.exception.LedgerException;
import io.github.notecal.ingestion.service.ProcessedItemLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

@Slf4j
@Service
public class FileProcessedItemLedger implements ProcessedItemLedger {

    private final Path ledgerFile;

    public FileProcessedItemLedger(@Value("${app.ledger.path:data/processed_items.log}") String ledgerPath) {
        this.ledgerFile = Path.of(ledgerPath);
    }

    @Override
    public Set<String> snapshot() {
        return Collections.unmodifiableSet(readPersisted());
    }

    @Override
    public synchronized void commit(String itemId) {
        validate(itemId);
        if (readPersisted().contains(itemId)) {
            log.debug("Item {} já consta no registro de processados.", itemId);
            return;
        }

        try {
            Path parent = ledgerFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ByteBuffer line = ByteBuffer.wrap((itemId + "\n").getBytes(StandardCharsets.UTF_8));
            try (FileChannel channel = FileChannel.open(ledgerFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                while (line.hasRemaining()) {
                    channel.write(line);
                }
                channel.force(true);
            }
        } catch (IOException e) {
            throw new LedgerException("Falha ao gravar item " + itemId + " no registro " + ledgerFile, e);
        }
    }

    private Set<String> readPersisted() {
        if (!Files.exists(ledgerFile)) {
            return new LinkedHashSet<>();
        }

        String content;
        try {
            content = Files.readString(ledgerFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LedgerException("Registro de processados ilegível: " + ledgerFile, e);
        }

        if (!content.isEmpty() && !content.endsWith("\n")) {
            throw new LedgerException("Registro de processados corrompido (última linha incompleta): " + ledgerFile);
        }

        Set<String> ids = new LinkedHashSet<>();
        for (String line : content.split("\n")) {
            String id = line.strip();
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static void validate(String itemId) {
        if (!ProcessedItemLedger.isValidId(itemId)) {
            throw new IllegalArgumentException("Id do item inválido para o registro: '" + itemId + "'");
        }
    }
}
