package com.dnobretech.contentalignerbackend.service.impl;

import com.dnobretech.contentalignerbackend.dto.AlignmentReport;
import com.dnobretech.contentalignerbackend.dto.AlignmentStatistics;
import com.dnobretech.contentalignerbackend.dto.ContentRecord;
import com.dnobretech.contentalignerbackend.dto.DisplayRow;
import com.dnobretech.contentalignerbackend.dto.LineByLineDiagnostic;
import com.dnobretech.contentalignerbackend.dto.LineByLineReport;
import com.dnobretech.contentalignerbackend.dto.Suggestion;
import com.dnobretech.contentalignerbackend.enums.QualityBand;
import com.dnobretech.contentalignerbackend.service.AlignmentExcelService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.output.ByteArrayOutputStream;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

@Slf4j
@Service
public class AlignmentExcelServiceImpl implements AlignmentExcelService {

    static final String COL_ID = "ContentId";
    static final String COL_CONTENT = "Content";

    private static final String[] ALIGNMENT_HEADER = {
            "ContentId", "Content", "TranslatedContent", "Status", "SimilarityScore", "Quality", "RowType"
    };

    private static final String[] LINE_BY_LINE_HEADER = {
            "ContentId", "Content", "TranslatedContent", "RefContentId", "RefContent",
            "LineScore", "Quality", "IsGoodMatch", "SuggestedContentId", "SuggestedContent", "SuggestedScore"
    };

    // --------- IMPORT ---------
    @Override
    public List<ContentRecord> readRecords(InputStream in) throws IOException {
        try (Workbook wb = WorkbookFactory.create(in)) {
            Sheet sh = wb.getSheetAt(0);
            if (sh.getPhysicalNumberOfRows() < 1) {
                throw new IllegalArgumentException("Planilha vazia: header " + COL_ID + "," + COL_CONTENT + " ausente");
            }

            Map<String, Integer> col = headerIndex(sh.getRow(sh.getFirstRowNum()));
            DataFormatter fmt = new DataFormatter();
            List<ContentRecord> out = new ArrayList<>();
            int index = 0;

            for (int r = sh.getFirstRowNum() + 1; r <= sh.getLastRowNum(); r++) {
                Row row = sh.getRow(r);
                if (row == null) {
                    continue;
                }
                String id = str(row, col, COL_ID, fmt);
                String content = str(row, col, COL_CONTENT, fmt);
                if (id.isEmpty() && content.isEmpty()) {
                    continue; // linha em branco não consome índice
                }
                out.add(ContentRecord.of(id, content, index++));
            }
            log.info("[excel] {} registros lidos", out.size());
            return out;
        }
    }

    // --------- EXPORT ---------
    @Override
    public byte[] exportAlignment(AlignmentReport report) throws IOException {
        try (Workbook wb = new XSSFWorkbook()) {
            Map<QualityBand, CellStyle> styles = bandStyles(wb);
            Sheet sh = wb.createSheet("Alignment");
            int r = 0;
            writeHeader(sh.createRow(r++), ALIGNMENT_HEADER);

            for (DisplayRow d : report.displayRows()) {
                Row row = sh.createRow(r++);
                write(row, 0, d.targetContentId());
                write(row, 1, d.targetContent());
                write(row, 2, d.translatedContent());
                write(row, 3, d.status().label());
                writeScore(row, 4, d.score(), styles.get(d.quality()));
                write(row, 5, d.quality().name());
                write(row, 6, d.rowType().name());
            }
            setWidths(sh, ALIGNMENT_HEADER.length);

            writeStatistics(wb.createSheet("Statistics"), report.statistics());
            return toBytes(wb);
        }
    }

    @Override
    public byte[] exportLineByLine(LineByLineReport report) throws IOException {
        try (Workbook wb = new XSSFWorkbook()) {
            Map<QualityBand, CellStyle> styles = bandStyles(wb);
            Sheet sh = wb.createSheet("LineByLine");
            int r = 0;
            writeHeader(sh.createRow(r++), LINE_BY_LINE_HEADER);

            for (LineByLineDiagnostic d : report.diagnostics()) {
                ContentRecord t = d.targetRecord();
                ContentRecord ref = d.referenceRecord();
                Suggestion s = d.suggestion();

                Row row = sh.createRow(r++);
                write(row, 0, t.id());
                write(row, 1, t.rawText());
                write(row, 2, t.translatedText());
                write(row, 3, ref != null ? ref.id() : "");
                write(row, 4, ref != null ? ref.rawText() : "");
                writeScore(row, 5, d.positionalScore(), styles.get(d.quality()));
                write(row, 6, d.quality().name());
                write(row, 7, d.good() ? "true" : "false");
                write(row, 8, s != null ? s.referenceRecord().id() : "");
                write(row, 9, s != null ? s.referenceRecord().rawText() : "");
                writeScore(row, 10, s != null ? s.score() : null, s != null ? styles.get(s.quality()) : null);
            }
            setWidths(sh, LINE_BY_LINE_HEADER.length);

            writeStatistics(wb.createSheet("Statistics"), report.statistics());
            return toBytes(wb);
        }
    }

    // ---------- helpers ----------
    private static Map<String, Integer> headerIndex(Row header) {
        if (header == null) {
            throw new IllegalArgumentException("Header ausente: " + COL_ID);
        }
        Map<String, Integer> map = new HashMap<>();
        for (int i = 0; i < header.getLastCellNum(); i++) {
            Cell c = header.getCell(i);
            if (c != null && c.getCellType() == CellType.STRING) map.put(c.getStringCellValue().trim(), i);
        }
        for (String req : List.of(COL_ID, COL_CONTENT))
            if (!map.containsKey(req))
                throw new IllegalArgumentException("Header ausente: " + req);
        return map;
    }

    private static String str(Row r, Map<String, Integer> col, String h, DataFormatter fmt) {
        Integer i = col.get(h); if (i == null) return "";
        Cell c = r.getCell(i); if (c == null) return "";
        return fmt.formatCellValue(c).trim();
    }

    private static Map<QualityBand, CellStyle> bandStyles(Workbook wb) {
        Map<QualityBand, CellStyle> m = new EnumMap<>(QualityBand.class);
        m.put(QualityBand.HIGH, fill(wb, IndexedColors.LIGHT_GREEN));
        m.put(QualityBand.MEDIUM, fill(wb, IndexedColors.LIGHT_YELLOW));
        m.put(QualityBand.LOW, fill(wb, IndexedColors.LIGHT_ORANGE));
        m.put(QualityBand.POOR, fill(wb, IndexedColors.ROSE));
        return m;
    }

    private static CellStyle fill(Workbook wb, IndexedColors color) {
        CellStyle st = wb.createCellStyle();
        st.setFillForegroundColor(color.getIndex());
        st.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        st.setDataFormat(wb.createDataFormat().getFormat("0.0000"));
        return st;
    }

    private static void writeStatistics(Sheet sh, AlignmentStatistics s) {
        int r = 0;
        writeHeader(sh.createRow(r++), new String[]{"Metric", "Value"});
        Object[][] rows = {
                {"TotalReference", s.totalReference()},
                {"Matched", s.matchedCount()},
                {"Missing", s.missingCount()},
                {"Leftover", s.leftoverCount()},
                {"High", s.highCount()},
                {"Medium", s.mediumCount()},
                {"Low", s.lowCount()},
                {"Poor", s.poorCount()},
                {"AverageScore", s.averageScore()},
                {"MatchPercentage", s.matchPercentage()}
        };
        for (Object[] kv : rows) {
            Row row = sh.createRow(r++);
            write(row, 0, (String) kv[0]);
            row.createCell(1, CellType.NUMERIC).setCellValue(((Number) kv[1]).doubleValue());
        }
        sh.setColumnWidth(0, 20 * 256);
    }

    // autoSizeColumn precisa de fontes AWT; em container headless não tem
    private static void setWidths(Sheet sh, int n) {
        for (int i = 0; i < n; i++) sh.setColumnWidth(i, 24 * 256);
    }

    private static byte[] toBytes(Workbook wb) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream(1 << 16);
        wb.write(bos);
        return bos.toByteArray();
    }

    private static void writeHeader(Row r, String[] h) {
        for (int i = 0; i < h.length; i++) r.createCell(i).setCellValue(h[i]);
    }
    private static void write(Row r, int i, String v) { r.createCell(i, CellType.STRING).setCellValue(v == null ? "" : v); }
    private static void writeScore(Row r, int i, Double v, CellStyle st) {
        if (v == null) { write(r, i, ""); return; }
        Cell c = r.createCell(i, CellType.NUMERIC);
        c.setCellValue(v);
        if (st != null) c.setCellStyle(st);
    }
}
