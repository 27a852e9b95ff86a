package com.dnobretech.contentalignerbackend.alignment;

import com.dnobretech.contentalignerbackend.exception.DimensionMismatchException;

import java.util.Objects;

public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * Cosseno entre dois vetores do mesmo tamanho, em [-1, 1].
     * Acumula em double mesmo com entrada float (vetores de centenas de dimensões).
     *
     * @return 0.0 se algum dos vetores tiver magnitude zero
     * @throws DimensionMismatchException se os tamanhos forem diferentes
     */
    public static double of(float[] a, float[] b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }

        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            double x = a[i], y = b[i];
            dot += x * y;
            na  += x * x;
            nb  += y * y;
        }
        if (na == 0.0 || nb == 0.0) return 0.0;

        double sim = dot / (Math.sqrt(na) * Math.sqrt(nb));
        // arredondamento pode passar 1 por um ulp
        return Math.max(-1.0, Math.min(1.0, sim));
    }
}
