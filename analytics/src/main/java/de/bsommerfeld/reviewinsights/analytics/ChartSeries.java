package de.bsommerfeld.reviewinsights.analytics;

import de.bsommerfeld.reviewinsights.core.domain.RatingTrendPoint;
import de.bsommerfeld.reviewinsights.core.domain.SalesRankEntry;
import de.bsommerfeld.reviewinsights.core.result.TabularResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads chart series out of report tables by column label. Only the two
 * chartable reports ({@link ReportId#isChartable()}) have the labels these
 * methods need. Rows whose plotted values are SQL NULL stay in the table
 * but are left out of the series; their count is logged at DEBUG.
 */
public final class ChartSeries {

    private static final Logger LOG = LoggerFactory.getLogger(ChartSeries.class);

    private ChartSeries() {
    }

    /**
     * {@code Date}/{@code Average Rating} pairs of a
     * {@link ReportId#DAILY_RATING_TREND} table, in table order.
     *
     * @throws IllegalArgumentException if a label is missing
     */
    public static List<RatingTrendPoint> ratingTrend(TabularResult table) {
        int dateIdx = table.indexOf(ReportColumns.DATE);
        int avgIdx = table.indexOf(ReportColumns.AVERAGE_RATING);

        List<RatingTrendPoint> points = new ArrayList<>(table.size());
        for (List<Object> row : table.rows()) {
            if (row.get(dateIdx) instanceof LocalDate date && row.get(avgIdx) instanceof Number avg) {
                points.add(new RatingTrendPoint(date, avg.doubleValue()));
            }
        }
        logSkipped("rating trend", table.size() - points.size(), table.size());
        return points;
    }

    /**
     * {@code Group}/{@code ASIN}/{@code Salesrank} triples of a
     * {@link ReportId#TOP_SALES_RANK_PER_GROUP} table, in table order.
     *
     * @throws IllegalArgumentException if a label is missing
     */
    public static List<SalesRankEntry> salesRankByGroup(TabularResult table) {
        int groupIdx = table.indexOf(ReportColumns.GROUP);
        int asinIdx = table.indexOf(ReportColumns.ASIN);
        int rankIdx = table.indexOf(ReportColumns.SALESRANK);

        List<SalesRankEntry> entries = new ArrayList<>(table.size());
        for (List<Object> row : table.rows()) {
            if (row.get(rankIdx) instanceof Number rank) {
                entries.add(new SalesRankEntry(String.valueOf(row.get(groupIdx)), String.valueOf(row.get(asinIdx)),
                        rank.intValue()));
            }
        }
        logSkipped("sales rank", table.size() - entries.size(), table.size());
        return entries;
    }

    private static void logSkipped(String series, int skipped, int total) {
        if (skipped > 0) {
            LOG.debug("Skipped {} of {} {} rows with NULL chart values", skipped, total, series);
        }
    }
}
