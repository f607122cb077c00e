package org.calista.elicitation.select;

import java.util.Objects;

/**
 * Small immutable scored wrapper.
 * Comparable uses descending score order; ties keep insertion order ({@link #order}).
 */
public final class Scored<T> implements Comparable<Scored<T>> {
    public final T item;
    public final double score;
    /** Position of the item in the candidate list it was scored from. */
    public final int order;

    public Scored(T item, double score, int order) {
        this.item = item;
        this.score = score;
        this.order = order;
    }

    public static <T> Scored<T> of(T item, double score, int order) {
        return new Scored<>(item, score, order);
    }

    @Override
    public int compareTo(Scored<T> o) {
        int c = Double.compare(o.score, this.score);
        if (c != 0) return c;
        return Integer.compare(this.order, o.order);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Scored<?>)) return false;
        Scored<?> s = (Scored<?>) other;
        return Double.doubleToLongBits(score) == Double.doubleToLongBits(s.score)
                && order == s.order
                && Objects.equals(item, s.item);
    }

    @Override
    public int hashCode() {
        return Objects.hash(item, Double.doubleToLongBits(score), order);
    }

    @Override
    public String toString() {
        return "Scored{score=" + score + ", order=" + order + ", item=" + item + '}';
    }
}
