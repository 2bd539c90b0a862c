package com.climateforecast.forecasting;

import com.climateforecast.exception.UnknownModelException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ForecastModelRegistryTest {

    private final SeasonalArimaModel sarima = new SeasonalArimaModel();
    private final ExponentialSmoothingModel hw = new ExponentialSmoothingModel();
    private final ForecastModelRegistry registry = new ForecastModelRegistry(List.of(sarima, hw));

    @Test
    void resolve_emptySelection_returnsAllInRegistrationOrder() {
        assertThat(registry.resolve(List.of())).containsExactly(sarima, hw);
        assertThat(registry.resolve(null)).containsExactly(sarima, hw);
    }

    @Test
    void resolve_keepsRequestedOrderAndDropsRepeats() {
        assertThat(registry.resolve(List.of("hw", "sarima", "hw"))).containsExactly(hw, sarima);
    }

    @Test
    void get_unknownId_listsKnownModels() {
        assertThatThrownBy(() -> registry.get("prophet"))
            .isInstanceOf(UnknownModelException.class)
            .hasMessageContaining("prophet")
            .hasMessageContaining("sarima");
    }

    @Test
    void duplicateIds_areRejectedAtStartup() {
        assertThatThrownBy(() -> new ForecastModelRegistry(List.of(hw, new ExponentialSmoothingModel())))
            .isInstanceOf(IllegalStateException.class);
    }
}
