package de.bsommerfeld.reviewinsights.terminal.render;

import com.google.inject.Singleton;
import de.bsommerfeld.reviewinsights.core.domain.RatingTrendPoint;
import de.bsommerfeld.reviewinsights.core.domain.SalesRankEntry;
import de.bsommerfeld.reviewinsights.core.i18n.I18nService;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Locale;

/**
 * {@link ChartRenderer} for a text terminal. Both charts are bar rows of
 * {@code #} characters:
 *
 * <pre>
 * 2005-01-03 |########################                | 3.00
 * </pre>
 *
 * The rating trend is scaled to the fixed 0 to 5 star range. Sales-rank bars
 * are scaled to the largest salesrank shown, so a short bar means a better
 * rank; entries are printed in the order given, with a header line whenever
 * the group changes.
 */
@Singleton
public class TextChartRenderer implements ChartRenderer {

    static final int BAR_WIDTH = 40;
    static final double MAX_RATING = 5.0;

    private final I18nService i18n;

    @Inject
    public TextChartRenderer(I18nService i18n) {
        this.i18n = i18n;
    }

    @Override
    public String renderRatingTrend(String asin, List<RatingTrendPoint> points) {
        if (points.isEmpty()) {
            return i18n.get("chart.empty") + System.lineSeparator();
        }
        StringBuilder sb = new StringBuilder();
        sb.append(i18n.get("chart.trend.title", asin)).append(System.lineSeparator());
        for (RatingTrendPoint point : points) {
            appendBar(sb, point.date().toString(), point.averageRating() / MAX_RATING,
                    String.format(Locale.ROOT, "%.2f", point.averageRating()));
        }
        return sb.toString();
    }

    @Override
    public String renderSalesRankByGroup(List<SalesRankEntry> entries) {
        if (entries.isEmpty()) {
            return i18n.get("chart.empty") + System.lineSeparator();
        }
        int maxRank = 1;
        int labelWidth = 0;
        for (SalesRankEntry entry : entries) {
            maxRank = Math.max(maxRank, entry.salesrank());
            labelWidth = Math.max(labelWidth, entry.asin().length());
        }

        StringBuilder sb = new StringBuilder();
        sb.append(i18n.get("chart.salesrank.title")).append(System.lineSeparator());
        String currentGroup = null;
        for (SalesRankEntry entry : entries) {
            if (!entry.group().equals(currentGroup)) {
                currentGroup = entry.group();
                sb.append('[').append(currentGroup).append(']').append(System.lineSeparator());
            }
            String label = entry.asin() + " ".repeat(labelWidth - entry.asin().length());
            appendBar(sb, label, (double) entry.salesrank() / maxRank, String.valueOf(entry.salesrank()));
        }
        return sb.toString();
    }

    private static void appendBar(StringBuilder sb, String label, double fraction, String value) {
        double clamped = Math.max(0.0, Math.min(1.0, fraction));
        int filled = (int) Math.round(clamped * BAR_WIDTH);
        if (filled == 0 && fraction > 0) {
            filled = 1;
        }
        sb.append(label).append(" |")
                .append("#".repeat(filled))
                .append(" ".repeat(BAR_WIDTH - filled))
                .append("| ").append(value)
                .append(System.lineSeparator());
    }
}
