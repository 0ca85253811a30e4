package com.github.spud.primus.domain.sandbox;

import com.github.spud.primus.application.config.SandboxProperties;
import com.github.spud.primus.domain.state.ModeController;
import com.github.spud.primus.util.JsonUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Encrypted Captain's Log journal. Usable only in sandbox mode; every operation holds the mode read
 * lock so the sandbox cannot be left halfway through.
 */
@Slf4j
@Component
public class SandboxJournal {

  private final List<JournalEntry> entries = new ArrayList<>();

  private final ModeController modeController;

  private final AesGcmCipher cipher;

  private final Path file;

  private final Clock clock;

  @Autowired
  public SandboxJournal(ModeController modeController, AesGcmCipher cipher,
    SandboxProperties properties) {
    this(modeController, cipher, properties, Clock.systemUTC());
  }

  public SandboxJournal(ModeController modeController, AesGcmCipher cipher,
    SandboxProperties properties, Clock clock) {
    this.modeController = modeController;
    this.cipher = cipher;
    this.clock = clock;
    this.file = StringUtils.hasText(properties.getJournalFile())
      ? Path.of(properties.getJournalFile()) : null;
    load();
  }

  public JournalEntrySummary add(String text) {
    return inSandbox(() -> {
      byte[] nonce = cipher.newNonce();
      byte[] sealed = cipher.seal(nonce, text.getBytes(StandardCharsets.UTF_8));
      JournalEntry entry = JournalEntry.builder()
        .id(UUID.randomUUID().toString())
        .createdAt(clock.instant())
        .nonce(Base64.getEncoder().encodeToString(nonce))
        .ciphertext(Base64.getEncoder().encodeToString(sealed))
        .build();
      synchronized (entries) {
        entries.add(entry);
        persist(entry);
      }
      return summarize(entry);
    });
  }

  /**
   * Metadata of the newest entries, newest first.
   */
  public List<JournalEntrySummary> list(int limit) {
    return inSandbox(() -> {
      synchronized (entries) {
        return entries.stream()
          .sorted(Comparator.comparing(JournalEntry::getCreatedAt).reversed())
          .limit(Math.max(0, limit))
          .map(this::summarize)
          .collect(Collectors.toList());
      }
    });
  }

  /**
   * Decrypted text of one entry.
   *
   * @throws IllegalArgumentException when no entry has that id
   */
  public String read(String entryId) {
    return inSandbox(() -> {
      JournalEntry entry;
      synchronized (entries) {
        entry = entries.stream()
          .filter(e -> e.getId().equals(entryId))
          .findFirst()
          .orElseThrow(() -> new IllegalArgumentException("Journal entry not found: " + entryId));
      }
      byte[] plain = cipher.open(Base64.getDecoder().decode(entry.getNonce()),
        Base64.getDecoder().decode(entry.getCiphertext()));
      return new String(plain, StandardCharsets.UTF_8);
    });
  }

  /**
   * @return number of removed entries
   */
  public int clear() {
    return inSandbox(() -> {
      synchronized (entries) {
        int removed = entries.size();
        entries.clear();
        rewrite();
        return removed;
      }
    });
  }

  private <T> T inSandbox(Supplier<T> work) {
    return modeController.withReadLock(snapshot -> {
      if (!snapshot.isSandbox()) {
        throw new SandboxInactiveException();
      }
      return work.get();
    });
  }

  private JournalEntrySummary summarize(JournalEntry entry) {
    int size = Base64.getDecoder().decode(entry.getCiphertext()).length;
    return new JournalEntrySummary(entry.getId(), entry.getCreatedAt(), size);
  }

  private void load() {
    if (file == null || !Files.exists(file)) {
      return;
    }
    try {
      for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
        if (StringUtils.hasText(line)) {
          entries.add(JsonUtils.fromJson(line, JournalEntry.class));
        }
      }
      log.info("Loaded encrypted journal: entries={}", entries.size());
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot load journal file " + file, e);
    }
  }

  private void persist(JournalEntry entry) {
    if (file == null) {
      return;
    }
    try {
      Files.writeString(file, JsonUtils.toJson(entry) + System.lineSeparator(),
        StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot write journal file", e);
    }
  }

  private void rewrite() {
    if (file == null) {
      return;
    }
    try {
      Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot clear journal file", e);
    }
  }
}
