package com.github.spud.primus.domain.sandbox;

import java.time.Instant;
import lombok.Value;

@Value
public class JournalEntrySummary {

  String id;

  Instant createdAt;

  int sizeBytes;
}
