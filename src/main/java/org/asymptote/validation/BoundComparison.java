package org.asymptote.validation;

/**
 * One compared bound.
 *
 * @param bound         Which bound: {@code O}, {@code Omega} or {@code Theta}.
 * @param deterministic The normalized computed label.
 * @param external      The normalized external label.
 * @param match         Whether both agree.
 */
public record BoundComparison(String bound, String deterministic, String external, boolean match) {
}
