package io.errorinsights.dashboard.service.dto;

import io.errorinsights.dashboard.model.LogField;
import java.util.List;

/**
 * Projected export: one row of display strings per record, cells in {@code columns} order.
 */
public record ExportRows(List<LogField> columns, List<List<String>> rows) {
}
