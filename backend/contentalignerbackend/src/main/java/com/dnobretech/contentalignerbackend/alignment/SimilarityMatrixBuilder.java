package com.dnobretech.contentalignerbackend.alignment;

import com.dnobretech.contentalignerbackend.dto.ContentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Matriz reference × target de similaridades.
 *
 * <p>Custo O(R·T·D), D = dimensão do embedding. É a parte mais cara de uma rodada;
 * não tem cache porque cada alinhamento monta a sua matriz.
 */
@Slf4j
@Component
public class SimilarityMatrixBuilder {

    /** Só os registros com embedding; os outros viram gap/sobra direto, nunca score 0. */
    public static List<ContentRecord> withEmbeddings(List<ContentRecord> records) {
        return records.stream().filter(ContentRecord::hasEmbedding).toList();
    }

    public double[][] build(List<ContentRecord> reference, List<ContentRecord> target) {
        final int R = reference.size(), T = target.size();
        double[][] matrix = new double[R][T];

        for (int i = 0; i < R; i++) {
            float[] vr = requireEmbedding(reference.get(i));
            for (int j = 0; j < T; j++) {
                matrix[i][j] = CosineSimilarity.of(vr, requireEmbedding(target.get(j)));
            }
        }
        log.debug("Matriz de similaridade {}x{} montada", R, T);
        return matrix;
    }

    private static float[] requireEmbedding(ContentRecord r) {
        if (!r.hasEmbedding()) {
            throw new IllegalArgumentException(
                    "Registro sem embedding na matriz (originalIndex=" + r.originalIndex() + ")");
        }
        return r.embedding();
    }
}
