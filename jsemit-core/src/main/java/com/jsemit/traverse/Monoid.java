package com.jsemit.traverse;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * An associative combination with an identity element, used to accumulate fold results.
 *
 * @param <T> accumulated value
 */
public interface Monoid<T> {

    T identity();

    T combine(T left, T right);

    static <T> Monoid<T> of(T identity, BiFunction<T, T, T> combine) {
        return new Monoid<>() {
            @Override
            public T identity() {
                return identity;
            }

            @Override
            public T combine(T left, T right) {
                return combine.apply(left, right);
            }
        };
    }

    static Monoid<Integer> intSum() {
        return of(0, Integer::sum);
    }

    static Monoid<Boolean> any() {
        return of(false, (a, b) -> a || b);
    }

    static Monoid<Boolean> all() {
        return of(true, (a, b) -> a && b);
    }

    /**
     * Concatenation, keeping left-to-right order.
     */
    static <E> Monoid<List<E>> list() {
        return of(List.of(), (a, b) -> {
            if (a.isEmpty()) {
                return b;
            }
            if (b.isEmpty()) {
                return a;
            }
            List<E> joined = new ArrayList<>(a.size() + b.size());
            joined.addAll(a);
            joined.addAll(b);
            return joined;
        });
    }
}
