package com.scholary.vidsub.translation;

import com.scholary.vidsub.reconcile.TranslationUnit.FullText;
import com.scholary.vidsub.reconcile.TranslationUnit.SegmentedText;
import java.util.List;

/**
 * Interface for machine-translation services.
 *
 * <p>No guarantee is made that a segmented translation has as many entries as were sent; the
 * reconciler checks that.
 */
public interface TranslationService {

  /**
   * Translate a block of text.
   *
   * @throws TranslationException if the service fails or returns nothing usable
   */
  FullText translateText(String text);

  /**
   * Translate each entry separately, asking the service to keep one output entry per input entry.
   *
   * @throws TranslationException if the service fails or the response is not a list of strings
   */
  SegmentedText translateSegments(List<String> texts);
}
