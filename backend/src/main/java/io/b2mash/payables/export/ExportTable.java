package io.b2mash.payables.export;

import java.util.List;
import java.util.Map;

/**
 * Flat, labeled rows handed to a file writer. Every row is keyed by {@link ExportColumn#key()};
 * absent values are null rather than missing keys.
 */
public record ExportTable(
    String title,
    List<ExportColumn> columns,
    List<Map<String, Object>> rows,
    Map<String, Object> summary) {}
