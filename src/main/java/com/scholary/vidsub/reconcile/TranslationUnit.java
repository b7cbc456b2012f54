package com.scholary.vidsub.reconcile;

import java.util.List;

/**
 * Translated text as returned by the translation service.
 *
 * <p>Either one undifferentiated block ({@link FullText}) or an array of strings ({@link
 * SegmentedText}) whose length may or may not match the number of original segments. Both preserve
 * the logical reading order of the source.
 */
public interface TranslationUnit {

  /** The whole translation as a single block of text. */
  record FullText(String text) implements TranslationUnit {

    public FullText {
      if (text == null) {
        text = "";
      }
    }
  }

  /**
   * The translation split into entries, ideally one per original segment. Null entries read as
   * empty.
   */
  record SegmentedText(List<String> entries) implements TranslationUnit {

    public SegmentedText {
      entries =
          entries == null
              ? List.of()
              : entries.stream().map(entry -> entry == null ? "" : entry).toList();
    }

    public int size() {
      return entries.size();
    }
  }
}
