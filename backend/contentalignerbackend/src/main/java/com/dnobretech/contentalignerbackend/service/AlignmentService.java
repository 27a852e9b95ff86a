package com.dnobretech.contentalignerbackend.service;

import com.dnobretech.contentalignerbackend.dto.AlignmentReport;
import com.dnobretech.contentalignerbackend.dto.ContentRecord;
import com.dnobretech.contentalignerbackend.dto.LineByLineReport;
import com.dnobretech.contentalignerbackend.dto.PreparationOptions;

import java.util.List;

public interface AlignmentService {

    /** registros já com embedding; threshold null = valor configurado */
    AlignmentReport align(List<ContentRecord> reference, List<ContentRecord> target, Double threshold);

    LineByLineReport lineByLine(List<ContentRecord> reference, List<ContentRecord> target, Double threshold);

    /** prepara as duas listas (target com as opções dadas) e alinha */
    AlignmentReport prepareAndAlign(List<ContentRecord> reference,
                                    List<ContentRecord> target,
                                    Double threshold,
                                    PreparationOptions targetOptions);

    LineByLineReport prepareAndLineByLine(List<ContentRecord> reference,
                                          List<ContentRecord> target,
                                          Double threshold,
                                          PreparationOptions targetOptions);
}
