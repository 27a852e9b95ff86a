package com.dnobretech.contentalignerbackend.controller;

import com.dnobretech.contentalignerbackend.client.EmbeddingProvider;
import com.dnobretech.contentalignerbackend.dto.AlignRequest;
import com.dnobretech.contentalignerbackend.dto.AlignmentReport;
import com.dnobretech.contentalignerbackend.dto.ContentRecord;
import com.dnobretech.contentalignerbackend.dto.LineByLineReport;
import com.dnobretech.contentalignerbackend.dto.PreparationOptions;
import com.dnobretech.contentalignerbackend.exception.CollaboratorException;
import com.dnobretech.contentalignerbackend.service.AlignmentExcelService;
import com.dnobretech.contentalignerbackend.service.AlignmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/alignment")
@RequiredArgsConstructor
public class AlignmentController {

    static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final AlignmentService alignmentService;
    private final AlignmentExcelService excelService;
    private final EmbeddingProvider embeddingProvider;

    /** registros já com embedding → linhas alinhadas + estatística */
    @PostMapping("/align")
    public AlignmentReport align(@Valid @RequestBody AlignRequest req) {
        return alignmentService.align(req.reference(), req.target(), req.threshold());
    }

    @PostMapping("/line-by-line")
    public LineByLineReport lineByLine(@Valid @RequestBody AlignRequest req) {
        return alignmentService.lineByLine(req.reference(), req.target(), req.threshold());
    }

    /**
     * Duas planilhas (ContentId, Content) → limpeza, tradução opcional do target,
     * embeddings, alinhamento e export .xlsx.
     *
     * @param translate  traduz o target antes do embedding (cross-language)
     * @param sourceLang idioma do target, ex.: "ko", "zh"
     */
    @PostMapping(value = "/align/workbook", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> alignWorkbook(
            @RequestPart("reference") MultipartFile reference,
            @RequestPart("target") MultipartFile target,
            @RequestParam(required = false) Double threshold,
            @RequestParam(defaultValue = "false") boolean translate,
            @RequestParam(required = false) String sourceLang
    ) throws IOException {
        AlignmentReport report = alignmentService.prepareAndAlign(
                read(reference), read(target), threshold, new PreparationOptions(translate, sourceLang));
        return xlsx(excelService.exportAlignment(report), "aligned_target.xlsx");
    }

    @PostMapping(value = "/line-by-line/workbook", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> lineByLineWorkbook(
            @RequestPart("reference") MultipartFile reference,
            @RequestPart("target") MultipartFile target,
            @RequestParam(required = false) Double threshold,
            @RequestParam(defaultValue = "false") boolean translate,
            @RequestParam(required = false) String sourceLang
    ) throws IOException {
        LineByLineReport report = alignmentService.prepareAndLineByLine(
                read(reference), read(target), threshold, new PreparationOptions(translate, sourceLang));
        return xlsx(excelService.exportLineByLine(report), "line_by_line.xlsx");
    }

    @GetMapping("/embeddings/health")
    public Map<String, Object> embeddingsHealth() {
        try {
            return Map.of("available", embeddingProvider.isAvailable());
        } catch (CollaboratorException e) {
            log.warn("Provedor de embedding indisponível: {}", e.getMessage());
            return Map.of("available", false, "reason", e.getMessage());
        }
    }

    private List<ContentRecord> read(MultipartFile file) throws IOException {
        try (InputStream in = file.getInputStream()) {
            return excelService.readRecords(in);
        }
    }

    private static ResponseEntity<byte[]> xlsx(byte[] bytes, String filename) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(XLSX)
                .body(bytes);
    }
}
