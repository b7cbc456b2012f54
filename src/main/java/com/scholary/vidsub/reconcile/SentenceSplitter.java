package com.scholary.vidsub.reconcile;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a block of text into sentence-like chunks.
 *
 * <p>Sentence-terminal punctuation ({@code .}, {@code !}, {@code ?}) closes a chunk and stays with
 * it. A run of terminals ("Wait...", "Really?!") closes a single chunk. Content after the last
 * terminal becomes a final chunk. Chunks are trimmed and blank chunks are dropped.
 */
public final class SentenceSplitter {

  private SentenceSplitter() {}

  public static List<String> split(String text) {
    List<String> chunks = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return chunks;
    }

    StringBuilder current = new StringBuilder();
    int length = text.length();

    for (int i = 0; i < length; i++) {
      char c = text.charAt(i);
      current.append(c);

      if (isTerminal(c)) {
        // Absorb the rest of a terminal run before closing the chunk
        while (i + 1 < length && isTerminal(text.charAt(i + 1))) {
          current.append(text.charAt(++i));
        }
        addChunk(chunks, current);
      }
    }
    addChunk(chunks, current);

    return chunks;
  }

  private static boolean isTerminal(char c) {
    return c == '.' || c == '!' || c == '?';
  }

  private static void addChunk(List<String> chunks, StringBuilder current) {
    String chunk = current.toString().trim();
    if (!chunk.isEmpty()) {
      chunks.add(chunk);
    }
    current.setLength(0);
  }
}
