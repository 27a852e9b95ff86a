package com.dnobretech.contentalignerbackend.service;

import com.dnobretech.contentalignerbackend.dto.AlignmentReport;
import com.dnobretech.contentalignerbackend.dto.ContentRecord;
import com.dnobretech.contentalignerbackend.dto.LineByLineReport;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

public interface AlignmentExcelService {
    List<ContentRecord> readRecords(InputStream in) throws IOException;
    byte[] exportAlignment(AlignmentReport report) throws IOException;
    byte[] exportLineByLine(LineByLineReport report) throws IOException;
}
