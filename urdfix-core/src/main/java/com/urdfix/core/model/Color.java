package com.urdfix.core.model;

/**
 * RGBA color, each channel in {@code [0, 1]}.
 *
 * @param red red channel
 * @param green green channel
 * @param blue blue channel
 * @param alpha alpha channel
 */
public record Color(
    double red,
    double green,
    double blue,
    double alpha
) {
}
