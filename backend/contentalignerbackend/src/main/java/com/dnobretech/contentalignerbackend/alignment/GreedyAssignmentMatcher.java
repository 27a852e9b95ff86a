package com.dnobretech.contentalignerbackend.alignment;

import com.dnobretech.contentalignerbackend.dto.ContentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Atribuição gulosa: todos os pares com score >= threshold, ordenados por score
 * decrescente; o par entra se a reference e o target ainda estão livres.
 *
 * <p>Aproxima o matching bipartido de peso máximo, sem garantir o ótimo.
 * Empates: menor índice de reference, depois menor índice de target, então duas
 * rodadas com a mesma entrada dão exatamente a mesma atribuição.
 */
@Slf4j
@Component
public class GreedyAssignmentMatcher implements AssignmentStrategy {

    static final Comparator<ScoredPair> BEST_FIRST =
            Comparator.<ScoredPair>comparingDouble(ScoredPair::score).reversed()
                    .thenComparingInt(ScoredPair::referenceIndex)
                    .thenComparingInt(ScoredPair::targetIndex);

    @Override
    public Assignment assign(double[][] matrix, List<ContentRecord> reference, List<ContentRecord> target, double threshold) {
        List<ScoredPair> candidates = candidates(matrix, threshold);
        candidates.sort(BEST_FIRST);

        Assignment.Builder assignment = Assignment.builder();
        int rejected = 0;
        for (ScoredPair p : candidates) {
            if (!assignment.tryAccept(p, target.get(p.targetIndex()))) rejected++;
        }

        Assignment out = assignment.build();
        log.debug("Greedy: candidatos={}, aceitos={}, rejeitados={} (threshold={})",
                candidates.size(), out.size(), rejected, threshold);
        return out;
    }

    static List<ScoredPair> candidates(double[][] matrix, double threshold) {
        List<ScoredPair> out = new ArrayList<>();
        for (int i = 0; i < matrix.length; i++) {
            for (int j = 0; j < matrix[i].length; j++) {
                // + 0.0 transforma -0.0 em 0.0; Double.compare os separa e quebraria o desempate
                double score = matrix[i][j] + 0.0;
                if (score >= threshold) out.add(new ScoredPair(i, j, score));
            }
        }
        return out;
    }
}
