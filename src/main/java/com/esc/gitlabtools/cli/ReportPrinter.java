package com.esc.gitlabtools.cli;

import com.esc.gitlabtools.bulkmr.model.BulkMergeRequestReport;
import com.esc.gitlabtools.bulkmr.model.ProjectResult;
import com.esc.gitlabtools.console.ConsoleRenderer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.UncheckedIOException;

/**
 * bulk-mr / bulk-mr-topic 결과 출력 (text 또는 json)
 */
@Component
@RequiredArgsConstructor
public class ReportPrinter {

    private final ConsoleRenderer renderer;
    private final ObjectMapper objectMapper;

    public void print(PrintWriter out, BulkMergeRequestReport report, OutputFormat format) {
        if (format == OutputFormat.JSON) {
            try {
                out.println(objectMapper.writeValueAsString(report));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("Failed to serialize report", e);
            }
            out.flush();
            return;
        }

        for (ProjectResult result : report.getResults()) {
            renderer.printResult(out, result);
        }
        out.println();
        renderer.printSummary(out, report.getSummary());
        out.flush();
    }
}
