package com.scholary.vidsub.layout;

/**
 * A single word is wider than the maximum line width.
 *
 * <p>Not an error: the word is emitted as its own, oversized line without hyphenation.
 */
public record LayoutOverflowWarning(String word, int width, int maxWidth) {}
