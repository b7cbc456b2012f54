package com.scholary.vidsub.layout;

/**
 * One wrapped subtitle line.
 *
 * @param text the line in visual (drawing) order
 * @param logicalText the same line in reading order, used for text output and re-wrapping
 * @param width measured width in pixels, stroke included
 * @param height measured height in pixels, stroke included
 * @param ascent distance from the top of the line box to the baseline
 */
public record Line(String text, String logicalText, int width, int height, int ascent) {}
