package de.bsommerfeld.reviewinsights.analytics;

import de.bsommerfeld.reviewinsights.core.result.TabularResult;

/**
 * Outcome of one dispatched report. A failed report still carries a table
 * (empty, with the report's columns) so callers never have to special-case
 * the rendering, plus a diagnostic saying what went wrong.
 *
 * @param reportId   the report that ran
 * @param parameter  the ASIN it ran for, {@code null} for reports without one
 * @param status     whether the table holds real data
 * @param table      the rows, empty on failure
 * @param diagnostic failure description, {@code null} on success
 */
public record ReportResult(ReportId reportId, String parameter, Status status, TabularResult table, String diagnostic) {

    public enum Status {
        SUCCESS,
        QUERY_FAILURE
    }

    static ReportResult success(ReportId reportId, String parameter, TabularResult table) {
        return new ReportResult(reportId, parameter, Status.SUCCESS, table, null);
    }

    static ReportResult queryFailure(ReportId reportId, String parameter, String diagnostic) {
        return new ReportResult(reportId, parameter, Status.QUERY_FAILURE,
                ResultProjector.empty(reportId.columns()), diagnostic);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
