package com.urdfix.core.model;

/**
 * Joint limits. Every bound is optional.
 *
 * @param lower lower position bound
 * @param upper upper position bound
 * @param effort maximum effort
 * @param velocity maximum velocity
 */
public record Limit(
    Double lower,
    Double upper,
    Double effort,
    Double velocity
) {
}
