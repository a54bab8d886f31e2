package com.archebuild.core.model;

/**
 * Inclusive range of construction years a type element is valid for.
 *
 * @param lower first year (inclusive)
 * @param upper last year (inclusive)
 */
public record AgeRange(
    int lower,
    int upper
) {
    /**
     * Checks whether the given construction year lies within this range.
     *
     * @param year construction year
     * @return true if {@code lower <= year <= upper}
     */
    public boolean contains(int year) {
        return lower <= year && year <= upper;
    }

    /**
     * Number of years covered by this range. Used as specificity measure when
     * several records match the same year.
     *
     * @return {@code upper - lower}
     */
    public int span() {
        return upper - lower;
    }

    /**
     * @return true if lower bound exceeds upper bound
     */
    public boolean isInverted() {
        return lower > upper;
    }

    /**
     * Checks whether two ranges share at least one year.
     *
     * @param other range to compare with
     * @return true if the ranges overlap
     */
    public boolean overlaps(AgeRange other) {
        return lower <= other.upper && other.lower <= upper;
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + "]";
    }
}
