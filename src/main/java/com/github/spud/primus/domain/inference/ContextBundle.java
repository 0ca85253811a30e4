package com.github.spud.primus.domain.inference;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Context handed to the inference backend. Contains only entries the requesting actor was allowed to
 * read.
 */
@Value
@Builder
public class ContextBundle {

  String actorId;

  String personality;

  @Singular
  List<Snippet> snippets;

  /**
   * Renders the bundle as a system prompt.
   */
  public String render() {
    StringBuilder sb = new StringBuilder();
    if (personality != null && !personality.isBlank()) {
      sb.append(personality.strip()).append("\n\n");
    }
    for (Snippet snippet : snippets) {
      sb.append("[").append(snippet.getSource()).append("]\n")
        .append(snippet.getText().strip()).append("\n\n");
    }
    return sb.toString().strip();
  }

  @Value
  public static class Snippet {

    String source;

    String text;
  }
}
