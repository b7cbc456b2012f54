package com.scholary.vidsub.reconcile;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SentenceSplitterTest {

  @Test
  void split_shouldKeepTerminalPunctuationWithEachSentence() {
    assertThat(SentenceSplitter.split("Hello world. How are you? Fine!"))
        .containsExactly("Hello world.", "How are you?", "Fine!");
  }

  @Test
  void split_shouldTreatTerminalRunAsOneBoundary() {
    assertThat(SentenceSplitter.split("Wait... Really?! Yes."))
        .containsExactly("Wait...", "Really?!", "Yes.");
  }

  @Test
  void split_shouldKeepTrailingTextWithoutTerminal() {
    assertThat(SentenceSplitter.split("First. and then")).containsExactly("First.", "and then");
  }

  @Test
  void split_shouldHandleHebrewText() {
    assertThat(SentenceSplitter.split("שלום עולם. מה שלומך?"))
        .containsExactly("שלום עולם.", "מה שלומך?");
  }

  @Test
  void split_shouldReturnEmptyForBlankInput() {
    assertThat(SentenceSplitter.split(null)).isEmpty();
  }
}
