package com.vidnyan.wdllint.adapter.out.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.wdllint.domain.model.Diagnostic;
import com.vidnyan.wdllint.domain.model.SourcePosition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Serializes diagnostics as JSON, one object per diagnostic:
 * {@code {"filename", "line", "end_line", "column", "end_column", "lint", "message"}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonDiagnosticWriter {

    private final ObjectMapper objectMapper;

    /**
     * All diagnostics as a JSON array.
     */
    public String toJson(List<Diagnostic> diagnostics) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toRecords(diagnostics));
    }

    /**
     * One compact JSON object per line.
     */
    public String toJsonLines(List<Diagnostic> diagnostics) throws JsonProcessingException {
        ObjectWriter writer = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
        StringBuilder out = new StringBuilder();
        for (DiagnosticRecord entry : toRecords(diagnostics)) {
            out.append(writer.writeValueAsString(entry)).append('\n');
        }
        return out.toString();
    }

    /**
     * Write the JSON array to {@code file}, replacing it.
     */
    public void write(List<Diagnostic> diagnostics, Path file) throws IOException {
        Files.writeString(file, toJson(diagnostics), StandardCharsets.UTF_8);
        log.info("Wrote {} diagnostics to {}", diagnostics.size(), file);
    }

    private static List<DiagnosticRecord> toRecords(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(DiagnosticRecord::from).toList();
    }

    record DiagnosticRecord(
        String filename,
        int line,
        @JsonProperty("end_line") int endLine,
        int column,
        @JsonProperty("end_column") int endColumn,
        String lint,
        String message
    ) {
        static DiagnosticRecord from(Diagnostic diagnostic) {
            SourcePosition pos = diagnostic.position();
            return new DiagnosticRecord(pos.filename(), pos.line(), pos.endLine(), pos.column(),
                    pos.endColumn(), diagnostic.rule(), diagnostic.message());
        }
    }
}
