package com.dnobretech.contentalignerbackend.exception;

import com.dnobretech.contentalignerbackend.enums.ErrorCategory;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // 400 - entrada do alinhamento rejeitada antes de calcular
    @ExceptionHandler(AlignmentValidationException.class)
    public ResponseEntity<ApiError> handleAlignmentValidation(AlignmentValidationException ex, HttpServletRequest req) {
        log.info("Alinhamento rejeitado [{}]: {}", ex.getCategory(), ex.getMessage());
        return ResponseEntity.badRequest().body(
                new ApiError(400, "Bad Request", ex.getCategory().name(), ex.getMessage(),
                        ex.getSuggestedAction(), req.getRequestURI(), Instant.now())
        );
    }

    // 422 - embeddings fora do contrato (dimensões diferentes)
    @ExceptionHandler(DimensionMismatchException.class)
    public ResponseEntity<ApiError> handleDimensionMismatch(DimensionMismatchException ex, HttpServletRequest req) {
        log.warn("Embeddings incompatíveis: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(
                new ApiError(422, "Unprocessable Entity", ErrorCategory.EMBEDDING_CONTRACT.name(), ex.getMessage(),
                        "Gere novamente os embeddings com o mesmo modelo para reference e target.",
                        req.getRequestURI(), Instant.now())
        );
    }

    // 502 - provedor externo inutilizável
    @ExceptionHandler(CollaboratorException.class)
    public ResponseEntity<ApiError> handleCollaborator(CollaboratorException ex, HttpServletRequest req) {
        log.warn("Falha no provedor externo: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(
                new ApiError(502, "Bad Gateway", ErrorCategory.COLLABORATOR.name(), ex.getMessage(),
                        "Verifique a configuração do serviço de embedding/tradução.",
                        req.getRequestURI(), Instant.now())
        );
    }

    // 400 - argumentos inválidos em geral (ex.: header ausente na planilha)
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(
                new ApiError(400, "Bad Request", ErrorCategory.USER_INPUT.name(), ex.getMessage(), null,
                        req.getRequestURI(), Instant.now())
        );
    }

    // 400 - validação do corpo com @Valid (@RequestBody)
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationError> handleBodyValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        var errs = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> new FieldErr(fe.getField(), fe.getDefaultMessage()))
                .toList();
        return ResponseEntity.badRequest().body(
                new ValidationError(400, "Bad Request", ErrorCategory.USER_INPUT.name(), errs, req.getRequestURI(), Instant.now())
        );
    }

    // 400 - params/query (@Validated) e binding de objetos simples
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ValidationError> handleBindValidation(BindException ex, HttpServletRequest req) {
        var errs = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> new FieldErr(fe.getField(), fe.getDefaultMessage()))
                .toList();
        return ResponseEntity.badRequest().body(
                new ValidationError(400, "Bad Request", ErrorCategory.USER_INPUT.name(), errs, req.getRequestURI(), Instant.now())
        );
    }

    // 500 - fallback único
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Erro não tratado", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                new ApiError(500, "Internal Server Error", ErrorCategory.UNEXPECTED.name(), ex.getMessage(), null,
                        req.getRequestURI(), Instant.now())
        );
    }
}
