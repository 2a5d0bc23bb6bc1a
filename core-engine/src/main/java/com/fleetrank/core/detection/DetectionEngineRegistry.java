package com.fleetrank.core.detection;

import com.fleetrank.core.config.DetectionSettings;
import com.fleetrank.core.error.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Maps engine names to constructors.
 *
 * <p>
 * A registry is an ordinary object: build one, register engines, and hand
 * it to whatever creates the engine. There is no process-wide instance, so
 * tests can register fakes without touching shared state.
 * </p>
 *
 * <p>
 * Registration is meant to happen during setup. Lookups may run
 * concurrently once registration is complete.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionEngineRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionEngineRegistry.class);

    private final Map<String, Function<DetectionSettings, DetectionEngine>> factories = new LinkedHashMap<>();

    /**
     * @return a registry holding the {@code zscore} and {@code threshold}
     *         engines
     */
    public static DetectionEngineRegistry withBuiltIns() {
        return new DetectionEngineRegistry()
                .register(ZScoreDetectionEngine.NAME, ZScoreDetectionEngine::new)
                .register(ThresholdDetectionEngine.NAME, ThresholdDetectionEngine::new);
    }

    /**
     * Register an engine constructor.
     *
     * @param name    engine name, case-insensitive
     * @param factory creates the engine from settings
     * @return this registry
     * @throws IllegalArgumentException if the name is blank or already taken
     */
    public DetectionEngineRegistry register(String name, Function<DetectionSettings, DetectionEngine> factory) {
        Objects.requireNonNull(factory, "Engine factory must not be null");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Engine name must not be null or blank");
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        if (factories.putIfAbsent(key, factory) != null) {
            throw new IllegalArgumentException("Engine '" + key + "' is already registered");
        }
        return this;
    }

    /**
     * Create the engine named in {@code settings}.
     *
     * @param settings detection settings; must not be {@code null}
     * @return a new engine
     * @throws ConfigException if the engine is unknown or rejects the settings
     */
    public DetectionEngine create(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        return create(settings.getEngine(), settings);
    }

    /**
     * Create a named engine.
     *
     * @param name     registered engine name
     * @param settings settings passed to the engine constructor
     * @return a new engine
     * @throws ConfigException if no engine is registered under {@code name}
     */
    public DetectionEngine create(String name, DetectionSettings settings) {
        String key = name != null ? name.trim().toLowerCase(Locale.ROOT) : null;
        Function<DetectionSettings, DetectionEngine> factory = key != null ? factories.get(key) : null;
        if (factory == null) {
            throw new ConfigException("Unknown detection engine: '" + name
                    + "'. Available: " + String.join(", ", factories.keySet()));
        }
        DetectionEngine engine = factory.apply(settings);
        LOG.info("Created detection engine '{}' ({})", key, engine.getClass().getSimpleName());
        return engine;
    }

    public boolean contains(String name) {
        return name != null && factories.containsKey(name.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * @return unmodifiable list of registered names in registration order
     */
    public List<String> getAvailable() {
        return Collections.unmodifiableList(new ArrayList<>(factories.keySet()));
    }
}
