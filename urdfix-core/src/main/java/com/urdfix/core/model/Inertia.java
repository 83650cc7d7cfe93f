package com.urdfix.core.model;

/**
 * Upper triangle of the symmetric 3x3 rotational inertia tensor.
 *
 * @param ixx xx entry
 * @param ixy xy entry
 * @param ixz xz entry
 * @param iyy yy entry
 * @param iyz yz entry
 * @param izz zz entry
 */
public record Inertia(
    double ixx,
    double ixy,
    double ixz,
    double iyy,
    double iyz,
    double izz
) {
    /**
     * Creates a tensor with only diagonal entries.
     *
     * @param ixx xx entry
     * @param iyy yy entry
     * @param izz zz entry
     * @return diagonal inertia
     */
    public static Inertia diagonal(double ixx, double iyy, double izz) {
        return new Inertia(ixx, 0.0, 0.0, iyy, 0.0, izz);
    }
}
