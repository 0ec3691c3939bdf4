package com.flamingo.ai.factextraction.service.chunking;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits plain text into pieces of at most {@code chunkSize} characters, preferring the coarsest
 * separator that occurs in the text and falling back to finer ones for pieces that are still too
 * large.
 *
 * <p>Separators stay attached to the start of the piece that follows them, so the pieces are
 * contiguous. Pieces are merged greedily up to the size limit without overlap and trimmed.
 */
public class RecursiveCharacterSplitter {

  static final List<String> DEFAULT_SEPARATORS =
      List.of("\n\n", "\n", ". ", "! ", "? ", "; ", ", ", " ", "");

  private final int chunkSize;
  private final List<String> separators;

  public RecursiveCharacterSplitter(int chunkSize) {
    this(chunkSize, DEFAULT_SEPARATORS);
  }

  public RecursiveCharacterSplitter(int chunkSize, List<String> separators) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    this.chunkSize = chunkSize;
    this.separators = List.copyOf(separators);
  }

  public List<String> split(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return split(text, separators);
  }

  private List<String> split(String text, List<String> candidates) {
    String separator = candidates.get(candidates.size() - 1);
    List<String> finer = List.of();
    for (int i = 0; i < candidates.size(); i++) {
      String candidate = candidates.get(i);
      if (candidate.isEmpty()) {
        separator = candidate;
        break;
      }
      if (text.contains(candidate)) {
        separator = candidate;
        finer = candidates.subList(i + 1, candidates.size());
        break;
      }
    }

    List<String> chunks = new ArrayList<>();
    List<String> small = new ArrayList<>();
    for (String piece : splitKeepingSeparator(text, separator)) {
      if (piece.length() < chunkSize) {
        small.add(piece);
        continue;
      }
      if (!small.isEmpty()) {
        chunks.addAll(merge(small));
        small.clear();
      }
      if (finer.isEmpty()) {
        chunks.add(piece);
      } else {
        chunks.addAll(split(piece, finer));
      }
    }
    if (!small.isEmpty()) {
      chunks.addAll(merge(small));
    }
    return chunks;
  }

  /** Splits before every occurrence of {@code separator}; an empty separator yields code points. */
  private static List<String> splitKeepingSeparator(String text, String separator) {
    List<String> pieces = new ArrayList<>();
    if (separator.isEmpty()) {
      text.codePoints().forEach(cp -> pieces.add(new String(Character.toChars(cp))));
      return pieces;
    }
    int start = 0;
    int pos = text.indexOf(separator);
    while (pos >= 0) {
      if (pos > start) {
        pieces.add(text.substring(start, pos));
      }
      start = pos;
      pos = text.indexOf(separator, pos + separator.length());
    }
    if (start < text.length()) {
      pieces.add(text.substring(start));
    }
    return pieces;
  }

  private List<String> merge(List<String> pieces) {
    List<String> merged = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String piece : pieces) {
      if (current.length() + piece.length() > chunkSize && current.length() > 0) {
        addTrimmed(merged, current);
        current.setLength(0);
      }
      current.append(piece);
    }
    addTrimmed(merged, current);
    return merged;
  }

  private static void addTrimmed(List<String> target, StringBuilder chunk) {
    String trimmed = chunk.toString().strip();
    if (!trimmed.isEmpty()) {
      target.add(trimmed);
    }
  }
}
