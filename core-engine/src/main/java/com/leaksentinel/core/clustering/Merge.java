package com.leaksentinel.core.clustering;

/**
 * One agglomeration step: clusters represented by {@code left} and
 * {@code right} joined at {@code height}.
 */
final class Merge {

    final double height;
    final int left;
    final int right;

    Merge(double height, int left, int right) {
        this.height = height;
        this.left = left;
        this.right = right;
    }
}
