package com.dnobretech.contentalignerbackend.alignment;

import com.dnobretech.contentalignerbackend.dto.AlignedRow;
import com.dnobretech.contentalignerbackend.dto.AlignmentResult;
import com.dnobretech.contentalignerbackend.dto.AlignmentStatistics;
import com.dnobretech.contentalignerbackend.dto.ContentRecord;
import com.dnobretech.contentalignerbackend.dto.DisplayRow;
import com.dnobretech.contentalignerbackend.enums.MatchStatus;
import com.dnobretech.contentalignerbackend.enums.QualityBand;
import com.dnobretech.contentalignerbackend.enums.RowType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Monta a saída alinhada: uma linha por reference (match ou gap) na ordem original,
 * depois os targets que sobraram, por originalIndex.
 *
 * <p>Tudo é resolvido por {@code originalIndex}. Os registros são recriados a cada
 * etapa (limpeza, tradução, embedding), então comparar objetos dá resultado errado.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlignmentAssembler {

    private static final Comparator<ContentRecord> BY_ORIGINAL_INDEX =
            Comparator.comparingInt(ContentRecord::originalIndex);

    private final SimilarityMatrixBuilder matrixBuilder;
    private final AssignmentStrategy assignmentStrategy;

    public AlignmentResult align(List<ContentRecord> reference, List<ContentRecord> target, double threshold) {
        List<ContentRecord> refEmb = SimilarityMatrixBuilder.withEmbeddings(reference);
        List<ContentRecord> tgtEmb = SimilarityMatrixBuilder.withEmbeddings(target);
        log.info("Alinhando: srcN={} (com embedding={}), tgtN={} (com embedding={}), threshold={}",
                reference.size(), refEmb.size(), target.size(), tgtEmb.size(), threshold);

        Assignment assignment = Assignment.empty();
        if (!refEmb.isEmpty() && !tgtEmb.isEmpty()) {
            double[][] matrix = matrixBuilder.build(refEmb, tgtEmb);
            assignment = assignmentStrategy.assign(matrix, refEmb, tgtEmb, threshold);
        }

        AlignmentResult result = assemble(reference, target, refEmb, assignment);
        log.info("Alinhamento: matched={}, missing={}, leftover={}",
                result.matchedCount(), result.missingCount(), result.leftoverCount());
        return result;
    }

    /**
     * @param referenceWithEmbeddings a lista filtrada que gerou os índices da atribuição
     */
    public AlignmentResult assemble(List<ContentRecord> reference,
                                    List<ContentRecord> target,
                                    List<ContentRecord> referenceWithEmbeddings,
                                    Assignment assignment) {
        // originalIndex -> posição na lista filtrada
        Map<Integer, Integer> filteredPos = new HashMap<>(referenceWithEmbeddings.size() * 2);
        for (int k = 0; k < referenceWithEmbeddings.size(); k++) {
            filteredPos.put(referenceWithEmbeddings.get(k).originalIndex(), k);
        }

        List<ContentRecord> refOrdered = new ArrayList<>(reference);
        refOrdered.sort(BY_ORIGINAL_INDEX);

        List<AlignedRow> rows = new ArrayList<>(refOrdered.size());
        for (ContentRecord ref : refOrdered) {
            Integer k = filteredPos.get(ref.originalIndex());
            var match = (k == null) ? null : assignment.forReference(k).orElse(null);
            if (match != null) {
                rows.add(new AlignedRow(ref.originalIndex(), ref, match.target(), match.score()));
            } else {
                rows.add(AlignedRow.gap(ref.originalIndex(), ref));
            }
        }

        Set<Integer> usedTargets = new HashSet<>();
        for (Assignment.Match m : assignment.matches()) usedTargets.add(m.target().originalIndex());

        List<ContentRecord> leftovers = target.stream()
                .filter(t -> !usedTargets.contains(t.originalIndex()))
                .sorted(BY_ORIGINAL_INDEX)
                .toList();

        return AlignmentResult.of(rows, leftovers);
    }

    // ===== linhas de exibição/export (mesma fonte para os dois) =====

    public List<DisplayRow> toDisplayRows(AlignmentResult result) {
        List<DisplayRow> out = new ArrayList<>(result.alignedRows().size() + result.leftoverCount());

        for (AlignedRow row : result.alignedRows()) {
            ContentRecord ref = row.referenceRecord();
            ContentRecord tgt = row.targetRecord();
            out.add(new DisplayRow(
                    RowType.REFERENCE_ALIGNED,
                    row.referenceIndex() + 1,
                    ref != null ? nvl(ref.rawText()) : "",
                    tgt != null ? tgt.originalIndex() + 1 : null,
                    tgt != null ? nvl(tgt.rawText()) : "",
                    tgt != null ? nvl(tgt.translatedText()) : "",
                    tgt != null ? nvl(tgt.id()) : "",
                    row.status(),
                    row.score(),
                    QualityClassifier.classify(row.score())
            ));
        }

        for (ContentRecord tgt : result.leftoverTargets()) {
            out.add(new DisplayRow(
                    RowType.UNMATCHED_TARGET,
                    null,
                    "",
                    tgt.originalIndex() + 1,
                    nvl(tgt.rawText()),
                    nvl(tgt.translatedText()),
                    nvl(tgt.id()),
                    MatchStatus.UNMATCHED_TARGET,
                    null,
                    QualityBand.POOR
            ));
        }
        return out;
    }

    // ===== estatística =====

    public AlignmentStatistics statistics(AlignmentResult result) {
        int high = 0, medium = 0, low = 0, poor = 0;
        double sum = 0.0;
        for (AlignedRow row : result.alignedRows()) {
            switch (QualityClassifier.classify(row.score())) {
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
                default -> poor++;
            }
            if (row.hasMatch()) sum += row.score();
        }
        int total = result.totalReference();
        int matched = result.matchedCount();
        return new AlignmentStatistics(
                total,
                matched,
                result.missingCount(),
                result.leftoverCount(),
                high, medium, low, poor,
                matched > 0 ? sum / matched : 0.0,
                total > 0 ? (double) matched / total * 100.0 : 0.0
        );
    }

    private static String nvl(String s) {
        return s == null ? "" : s;
    }
}
