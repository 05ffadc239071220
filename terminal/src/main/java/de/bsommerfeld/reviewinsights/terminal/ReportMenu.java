package de.bsommerfeld.reviewinsights.terminal;

import com.google.inject.Singleton;
import de.bsommerfeld.reviewinsights.analytics.ChartSeries;
import de.bsommerfeld.reviewinsights.analytics.ReportDispatcher;
import de.bsommerfeld.reviewinsights.analytics.ReportId;
import de.bsommerfeld.reviewinsights.analytics.ReportResult;
import de.bsommerfeld.reviewinsights.core.i18n.I18nService;
import de.bsommerfeld.reviewinsights.db.ConnectionUnavailableException;
import de.bsommerfeld.reviewinsights.terminal.render.ChartRenderer;
import de.bsommerfeld.reviewinsights.terminal.render.TableRenderer;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * The interactive select-run-display loop. Holds no state between reports;
 * every menu choice is one or two independent
 * {@link ReportDispatcher#dispatch} calls.
 *
 * <p>
 * A failed report prints its diagnostic and the loop continues. A lost
 * connection ends the session with {@link #EXIT_CONNECTION_LOST}.
 */
@Singleton
public class ReportMenu {

    private static final Logger LOG = LoggerFactory.getLogger(ReportMenu.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONNECTION_LOST = 1;

    private final ReportDispatcher dispatcher;
    private final I18nService i18n;
    private final TableRenderer tableRenderer;
    private final ChartRenderer chartRenderer;

    @Inject
    public ReportMenu(ReportDispatcher dispatcher, I18nService i18n, TableRenderer tableRenderer,
            ChartRenderer chartRenderer) {
        this.dispatcher = dispatcher;
        this.i18n = i18n;
        this.tableRenderer = tableRenderer;
        this.chartRenderer = chartRenderer;
    }

    /**
     * Runs the menu until the user exits, the input ends, or the store
     * becomes unreachable.
     *
     * @return {@link #EXIT_OK} or {@link #EXIT_CONNECTION_LOST}
     */
    public int run(BufferedReader in, PrintStream out) {
        try {
            while (true) {
                printMenu(out);
                String choice = readLine(in);
                if (choice == null) {
                    return EXIT_OK;
                }
                switch (choice.trim()) {
                    case "1" -> helpfulReviews(in, out);
                    case "2" -> printResult(out, dispatcher.dispatch(ReportId.SIMILAR_CHEAPER_PRODUCTS, askAsin(in, out)));
                    case "3" -> ratingTrend(in, out);
                    case "4" -> topSalesRank(in, out);
                    case "5" -> printResult(out, dispatcher.dispatch(ReportId.BEST_HELPFULNESS_PRODUCTS));
                    case "6" -> printResult(out, dispatcher.dispatch(ReportId.BEST_HELPFULNESS_CATEGORIES));
                    case "7" -> printResult(out, dispatcher.dispatch(ReportId.MOST_ACTIVE_CUSTOMERS_PER_GROUP));
                    case "8" -> {
                        out.println(i18n.get("menu.exit"));
                        return EXIT_OK;
                    }
                    default -> out.println(i18n.get("menu.invalid"));
                }
            }
        } catch (ConnectionUnavailableException e) {
            LOG.error("Session ended, store unavailable", e);
            out.println(i18n.get("connection.unavailable", e.getMessage()));
            return EXIT_CONNECTION_LOST;
        }
    }

    private void printMenu(PrintStream out) {
        out.println();
        out.println(i18n.get("menu.title"));
        for (int option = 1; option <= 8; option++) {
            out.println(i18n.get("menu.option." + option));
        }
        out.print(i18n.get("menu.prompt"));
        out.flush();
    }

    private void helpfulReviews(BufferedReader in, PrintStream out) throws ConnectionUnavailableException {
        String asin = askAsin(in, out);
        ReportResult highest = dispatcher.dispatch(ReportId.HELPFUL_REVIEWS_HIGHEST_RATED, asin);
        ReportResult lowest = dispatcher.dispatch(ReportId.HELPFUL_REVIEWS_LOWEST_RATED, asin);
        out.println(i18n.get("report.highest"));
        printResult(out, highest);
        out.println(i18n.get("report.lowest"));
        printResult(out, lowest);
    }

    private void ratingTrend(BufferedReader in, PrintStream out) throws ConnectionUnavailableException {
        String asin = askAsin(in, out);
        ReportResult result = dispatcher.dispatch(ReportId.DAILY_RATING_TREND, asin);
        printResult(out, result);
        if (result.isSuccess() && !result.table().isEmpty() && askChart(in, out)) {
            out.print(chartRenderer.renderRatingTrend(result.parameter(), ChartSeries.ratingTrend(result.table())));
        }
    }

    private void topSalesRank(BufferedReader in, PrintStream out) throws ConnectionUnavailableException {
        ReportResult result = dispatcher.dispatch(ReportId.TOP_SALES_RANK_PER_GROUP);
        printResult(out, result);
        if (result.isSuccess() && !result.table().isEmpty() && askChart(in, out)) {
            out.print(chartRenderer.renderSalesRankByGroup(ChartSeries.salesRankByGroup(result.table())));
        }
    }

    private void printResult(PrintStream out, ReportResult result) {
        if (!result.isSuccess()) {
            out.println(i18n.get("report.failed", result.diagnostic()));
        } else if (result.table().isEmpty()) {
            out.println(i18n.get("report.empty"));
        } else {
            out.print(tableRenderer.render(result.table()));
        }
    }

    private String askAsin(BufferedReader in, PrintStream out) {
        out.print(i18n.get("menu.prompt.asin"));
        out.flush();
        String asin = readLine(in);
        return asin == null ? "" : asin.trim();
    }

    private boolean askChart(BufferedReader in, PrintStream out) {
        out.println();
        out.print(i18n.get("menu.prompt.chart"));
        out.flush();
        String answer = readLine(in);
        return answer != null && answer.trim().equalsIgnoreCase(i18n.get("menu.chart.yes"));
    }

    private static String readLine(BufferedReader in) {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from the terminal", e);
        }
    }
}
