package com.nayem.strata.model;

/**
 * How a platform formats token values.
 */
public record ValueFormatters(String color, String dimension, Integer numberPrecision) {
}
