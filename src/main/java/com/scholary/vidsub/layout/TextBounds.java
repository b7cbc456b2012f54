package com.scholary.vidsub.layout;

/**
 * Measured box of a rendered string, in pixels, including outline inflation.
 *
 * @param width advance width plus the stroke on both sides
 * @param height line height plus the stroke on both sides
 * @param ascent distance from the top of the box to the baseline
 */
public record TextBounds(int width, int height, int ascent) {}
