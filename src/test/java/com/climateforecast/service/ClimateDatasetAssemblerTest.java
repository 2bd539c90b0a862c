package com.climateforecast.service;

import com.climateforecast.dto.ObservationRow;
import com.climateforecast.exception.InvalidSeriesException;
import com.climateforecast.model.ClimateDataset;
import com.climateforecast.model.ClimateSeries;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ClimateDatasetAssemblerTest {

    private final ClimateDatasetAssembler assembler = new ClimateDatasetAssembler();

    private static ObservationRow row(int year, String month, double temperature, Double precipitation) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("Temperature", temperature);
        values.put("Precipitation", precipitation);
        return ObservationRow.builder().year(year).month(month).values(values).build();
    }

    @Test
    void assemble_unsortedRowsWithMixedMonthFormats_buildsConsecutiveSeries() {
        List<ObservationRow> rows = List.of(
            row(2001, "jan", 3.0, 40.0),
            row(2000, "November", 6.0, 55.0),
            row(2000, "12", 4.0, null));

        ClimateDataset dataset = assembler.assemble(rows, null);

        assertThat(dataset.variables()).containsExactly("Temperature", "Precipitation");
        ClimateSeries temperature = dataset.get("Temperature");
        assertThat(temperature.getStart()).isEqualTo(YearMonth.of(2000, 11));
        assertThat(temperature.values()).containsExactly(6.0, 4.0, 3.0);
        ClimateSeries precipitation = dataset.get("Precipitation");
        assertThat(precipitation.isMissing(1)).isTrue();
        assertThat(precipitation.valueAt(2)).isEqualTo(40.0);
    }

    @Test
    void assemble_requestedVariables_controlOrderAndSelection() {
        List<ObservationRow> rows = List.of(row(2000, "1", 1.0, 2.0), row(2000, "2", 1.5, 2.5));

        ClimateDataset dataset = assembler.assemble(rows, List.of("Precipitation"));

        assertThat(dataset.variables()).containsExactly("Precipitation");
    }

    @Test
    void assemble_duplicateMonth_isRejected() {
        List<ObservationRow> rows = List.of(row(2000, "3", 1.0, 2.0), row(2000, "Mar", 1.5, 2.5));

        assertThatThrownBy(() -> assembler.assemble(rows, null))
            .isInstanceOf(InvalidSeriesException.class)
            .hasMessageContaining("duplicate month 2000-03");
    }

    @Test
    void assemble_skippedMonth_isRejected() {
        List<ObservationRow> rows = List.of(row(2000, "1", 1.0, 2.0), row(2000, "3", 1.5, 2.5));

        assertThatThrownBy(() -> assembler.assemble(rows, null))
            .isInstanceOf(InvalidSeriesException.class)
            .hasMessageContaining("gap before 2000-03");
    }

    @Test
    void assemble_variableAbsentFromAllRows_isRejected() {
        List<ObservationRow> rows = List.of(row(2000, "1", 1.0, 2.0));

        assertThatThrownBy(() -> assembler.assemble(rows, List.of("WindSpeed")))
            .isInstanceOf(InvalidSeriesException.class)
            .hasMessageContaining("WindSpeed");
    }

    @Test
    void assemble_variableAbsentFromSomeRows_marksThoseMonthsMissing() {
        Map<String, Double> partial = new HashMap<>();
        partial.put("Temperature", 2.0);
        List<ObservationRow> rows = List.of(
            row(2000, "1", 1.0, 2.0),
            ObservationRow.builder().year(2000).month("2").values(partial).build());

        ClimateSeries precipitation = assembler.assemble(rows, null).get("Precipitation");

        assertThat(precipitation.isMissing(1)).isTrue();
    }

    @Test
    void parseMonth_acceptsNumbersNamesAndAbbreviations() {
        assertThat(ClimateDatasetAssembler.parseMonth("7")).isEqualTo(7);
        assertThat(ClimateDatasetAssembler.parseMonth(" 07 ")).isEqualTo(7);
        assertThat(ClimateDatasetAssembler.parseMonth("July")).isEqualTo(7);
        assertThat(ClimateDatasetAssembler.parseMonth("SEP")).isEqualTo(9);
        assertThatThrownBy(() -> ClimateDatasetAssembler.parseMonth("13"))
            .isInstanceOf(InvalidSeriesException.class);
        assertThatThrownBy(() -> ClimateDatasetAssembler.parseMonth("Sept"))
            .isInstanceOf(InvalidSeriesException.class);
    }

    @Test
    void parseMonth_numberBeyondIntRange_isInvalidSeries() {
        assertThatThrownBy(() -> ClimateDatasetAssembler.parseMonth("99999999999"))
            .isInstanceOf(InvalidSeriesException.class)
            .hasMessageContaining("between 1 and 12");
    }
}
