package com.climateforecast.service;

import com.climateforecast.dto.ObservationRow;
import com.climateforecast.exception.InvalidSeriesException;
import com.climateforecast.model.ClimateDataset;
import com.climateforecast.model.ClimateSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Month;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Builds per-variable monthly series from dated rows. Rows may arrive in any order; after sorting
 * they must cover every month between the first and last exactly once.
 */
@Slf4j
@Component
public class ClimateDatasetAssembler {

    public ClimateDataset assemble(List<ObservationRow> rows, List<String> variables) {
        if (rows == null || rows.isEmpty()) {
            throw new InvalidSeriesException("Dataset has no observation rows");
        }
        List<String> order = (variables == null || variables.isEmpty())
            ? List.copyOf(rows.get(0).getValues().keySet())
            : variables;
        if (order.isEmpty()) {
            throw new InvalidSeriesException("First observation row names no variables");
        }

        List<DatedRow> dated = rows.stream()
            .map(row -> new DatedRow(YearMonth.of(row.getYear(), parseMonth(row.getMonth())), row))
            .sorted(Comparator.comparing(DatedRow::month))
            .toList();

        List<ClimateSeries> series = new ArrayList<>(order.size());
        for (String variable : order) {
            if (dated.stream().noneMatch(d -> d.row().getValues().containsKey(variable))) {
                throw new InvalidSeriesException("Variable '" + variable + "' does not appear in any observation row");
            }
            List<ClimateSeries.MonthlyValue> observations = dated.stream()
                .map(d -> new ClimateSeries.MonthlyValue(d.month(), d.row().getValues().get(variable)))
                .toList();
            series.add(ClimateSeries.fromObservations(variable, observations));
        }

        log.debug("Dataset assembled | variables={} | months={} | start={}",
            order, dated.size(), dated.get(0).month());
        return ClimateDataset.of(series);
    }

    /** Accepts 1-12, a full English month name or its three-letter abbreviation, in any case. */
    static int parseMonth(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidSeriesException("Month is required");
        }
        String text = raw.trim();
        if (text.chars().allMatch(Character::isDigit)) {
            int number;
            try {
                number = Integer.parseInt(text);
            } catch (NumberFormatException ex) {
                throw new InvalidSeriesException("Month number must be between 1 and 12, got " + text);
            }
            if (number < 1 || number > 12) {
                throw new InvalidSeriesException("Month number must be between 1 and 12, got " + text);
            }
            return number;
        }
        String upper = text.toUpperCase(Locale.ROOT);
        for (Month month : Month.values()) {
            if (month.name().equals(upper) || month.name().substring(0, 3).equals(upper)) {
                return month.getValue();
            }
        }
        throw new InvalidSeriesException("Unrecognised month '" + raw + "'");
    }

    private record DatedRow(YearMonth month, ObservationRow row) {}
}
