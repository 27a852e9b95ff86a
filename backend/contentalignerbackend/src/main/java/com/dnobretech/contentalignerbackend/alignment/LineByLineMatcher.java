package com.dnobretech.contentalignerbackend.alignment;

import com.dnobretech.contentalignerbackend.dto.AlignmentStatistics;
import com.dnobretech.contentalignerbackend.dto.ContentRecord;
import com.dnobretech.contentalignerbackend.dto.LineByLineDiagnostic;
import com.dnobretech.contentalignerbackend.dto.Suggestion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Modo de revisão rápida: reference[i] contra target[i], sem reordenar.
 * Quando o par posicional é fraco, sugere a melhor reference da lista inteira.
 * Não há controle de uso: a mesma reference pode ser sugerida para vários targets.
 */
@Slf4j
@Component
public class LineByLineMatcher {

    public List<LineByLineDiagnostic> compare(List<ContentRecord> reference, List<ContentRecord> target, double threshold) {
        final int N = reference.size(), M = target.size(), L = Math.min(N, M);
        if (N != M) {
            log.info("Line-by-line: reference e target com tamanhos diferentes ({} != {}), comparando {} linhas", N, M, L);
        }

        List<ContentRecord> refEmb = SimilarityMatrixBuilder.withEmbeddings(reference);
        List<LineByLineDiagnostic> out = new ArrayList<>(M);

        for (int i = 0; i < L; i++) {
            ContentRecord ref = reference.get(i);
            ContentRecord tgt = target.get(i);

            double score = (ref.hasEmbedding() && tgt.hasEmbedding())
                    ? CosineSimilarity.of(ref.embedding(), tgt.embedding())
                    : 0.0;
            boolean good = ref.hasEmbedding() && tgt.hasEmbedding() && score >= threshold;

            Suggestion suggestion = good ? null : bestReference(tgt, refEmb, threshold);
            out.add(new LineByLineDiagnostic(tgt, ref, score, good, QualityClassifier.classify(score), suggestion));
        }

        // targets além do fim da reference: sem par posicional, só sugestão
        for (int i = L; i < M; i++) {
            ContentRecord tgt = target.get(i);
            out.add(new LineByLineDiagnostic(tgt, null, 0.0, false,
                    QualityClassifier.classify(0.0), bestReference(tgt, refEmb, threshold)));
        }
        return out;
    }

    /** busca sem restrição de posição nem de uso; empate fica com a menor posição */
    Suggestion bestReference(ContentRecord target, List<ContentRecord> referenceWithEmbeddings, double threshold) {
        if (!target.hasEmbedding()) return null;

        ContentRecord best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (ContentRecord ref : referenceWithEmbeddings) {
            double sim = CosineSimilarity.of(ref.embedding(), target.embedding());
            if (sim > bestScore) {
                bestScore = sim;
                best = ref;
            }
        }
        if (best == null) return null;
        return new Suggestion(best, bestScore, bestScore >= threshold, QualityClassifier.classify(bestScore));
    }

    public AlignmentStatistics statistics(List<LineByLineDiagnostic> diagnostics) {
        int good = 0, trailing = 0, high = 0, medium = 0, low = 0, poor = 0;
        double sum = 0.0;
        for (LineByLineDiagnostic d : diagnostics) {
            if (d.good()) good++;
            if (!d.hasPositionalReference()) trailing++;
            switch (d.quality()) {
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
                default -> poor++;
            }
            sum += d.positionalScore();
        }
        int total = diagnostics.size();
        return new AlignmentStatistics(
                total,
                good,
                total - good,
                trailing,
                high, medium, low, poor,
                total > 0 ? sum / total : 0.0,
                total > 0 ? (double) good / total * 100.0 : 0.0
        );
    }
}
