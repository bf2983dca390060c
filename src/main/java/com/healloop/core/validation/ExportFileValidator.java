package com.healloop.core.validation;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Checks that a data export really produced a file on disk.
 * <p>
 * The result must be a map naming the file under {@code file_path} or {@code final_path};
 * the file must exist and be non-empty. A reported {@code row_count} of zero is an issue.
 */
@Component
public class ExportFileValidator implements ToolValidator {

    static final String TOOL = "aws_export_data";
    private static final Set<String> FORMATS = Set.of("csv", "json", "xlsx");

    @Override
    public Set<String> tools() {
        return Set.of(TOOL);
    }

    @Override
    public List<String> validateParameters(Map<String, Object> params) {
        Object format = params.get("format");
        if (format != null && !FORMATS.contains(String.valueOf(format).toLowerCase(Locale.ROOT))) {
            return List.of("Unsupported export format: " + format + " (expected one of csv, json, xlsx)");
        }
        return List.of();
    }

    @Override
    public List<String> validateResult(Object result) {
        if (!(result instanceof Map<?, ?> map)) {
            return List.of("Export result is not an object");
        }
        Object location = map.get("file_path") != null ? map.get("file_path") : map.get("final_path");
        if (location == null || String.valueOf(location).isBlank()) {
            return List.of("Export result does not name a file");
        }
        Path file = Path.of(String.valueOf(location));
        if (!Files.isRegularFile(file)) {
            return List.of("Export file not found: " + file);
        }

        var issues = new ArrayList<String>();
        try {
            if (Files.size(file) == 0) {
                issues.add("Export file is empty: " + file);
            }
        } catch (IOException e) {
            issues.add("Export file is unreadable: " + e.getMessage());
        }
        Object rows = map.get("row_count") != null ? map.get("row_count") : map.get("items_exported");
        if (rows instanceof Number n && n.longValue() == 0) {
            issues.add("No data exported (0 rows)");
        }
        return issues;
    }
}
