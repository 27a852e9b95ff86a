package com.dnobretech.contentalignerbackend.service.impl;

import com.dnobretech.contentalignerbackend.alignment.AlignmentAssembler;
import com.dnobretech.contentalignerbackend.alignment.AlignmentInputValidator;
import com.dnobretech.contentalignerbackend.alignment.LineByLineMatcher;
import com.dnobretech.contentalignerbackend.dto.AlignmentReport;
import com.dnobretech.contentalignerbackend.dto.AlignmentResult;
import com.dnobretech.contentalignerbackend.dto.ContentRecord;
import com.dnobretech.contentalignerbackend.dto.LineByLineDiagnostic;
import com.dnobretech.contentalignerbackend.dto.LineByLineReport;
import com.dnobretech.contentalignerbackend.dto.PreparationOptions;
import com.dnobretech.contentalignerbackend.service.AlignmentService;
import com.dnobretech.contentalignerbackend.service.ContentPreparationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AlignmentServiceImpl implements AlignmentService {

    private final AlignmentAssembler assembler;
    private final LineByLineMatcher lineByLineMatcher;
    private final ContentPreparationService preparationService;

    @Value("${aligner.similarity-threshold:0.5}")
    private double defaultThreshold = 0.5;

    @Override
    public AlignmentReport align(List<ContentRecord> reference, List<ContentRecord> target, Double threshold) {
        double th = resolve(threshold);
        AlignmentInputValidator.validate(reference, target, th);

        AlignmentResult result = assembler.align(reference, target, th);
        // tela e export saem do mesmo resultado
        return new AlignmentReport(result, assembler.toDisplayRows(result), assembler.statistics(result));
    }

    @Override
    public LineByLineReport lineByLine(List<ContentRecord> reference, List<ContentRecord> target, Double threshold) {
        double th = resolve(threshold);
        AlignmentInputValidator.validate(reference, target, th);

        List<LineByLineDiagnostic> diagnostics = lineByLineMatcher.compare(reference, target, th);
        log.info("Line-by-line: srcN={}, tgtN={}, diagnósticos={}", reference.size(), target.size(), diagnostics.size());
        return new LineByLineReport(diagnostics, lineByLineMatcher.statistics(diagnostics));
    }

    @Override
    public AlignmentReport prepareAndAlign(List<ContentRecord> reference,
                                           List<ContentRecord> target,
                                           Double threshold,
                                           PreparationOptions targetOptions) {
        // valida antes de gastar chamadas de embedding/tradução
        AlignmentInputValidator.validate(reference, target, resolve(threshold));
        return align(
                preparationService.prepare(reference, PreparationOptions.none()),
                preparationService.prepare(target, targetOptions),
                threshold);
    }

    @Override
    public LineByLineReport prepareAndLineByLine(List<ContentRecord> reference,
                                                 List<ContentRecord> target,
                                                 Double threshold,
                                                 PreparationOptions targetOptions) {
        AlignmentInputValidator.validate(reference, target, resolve(threshold));
        return lineByLine(
                preparationService.prepare(reference, PreparationOptions.none()),
                preparationService.prepare(target, targetOptions),
                threshold);
    }

    private double resolve(Double threshold) {
        return threshold != null ? threshold : defaultThreshold;
    }
}
