package com.climateforecast.forecasting;

import com.climateforecast.exception.UnknownModelException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class ForecastModelRegistry {

    private final Map<String, ForecastModel> models = new LinkedHashMap<>();

    public ForecastModelRegistry(List<ForecastModel> available) {
        for (ForecastModel model : available) {
            if (models.putIfAbsent(model.id(), model) != null) {
                throw new IllegalStateException("Duplicate forecast model id: " + model.id());
            }
        }
        log.info("Forecast models registered | ids={}", models.keySet());
    }

    public ForecastModel get(String id) {
        ForecastModel model = models.get(id);
        if (model == null) {
            throw new UnknownModelException(id, models.keySet());
        }
        return model;
    }

    /** Resolves ids in the given order; an empty or null list means every registered model. */
    public List<ForecastModel> resolve(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return all();
        }
        return ids.stream().distinct().map(this::get).toList();
    }

    public List<ForecastModel> all() {
        return List.copyOf(models.values());
    }
}
