package org.squadplanner.engine.cache;

import org.squadplanner.engine.api.ParameterSource;
import org.squadplanner.engine.api.dto.ParameterSetDto;
import org.squadplanner.engine.domain.model.CurveKind;
import org.squadplanner.engine.domain.model.CurveSpec;
import org.squadplanner.engine.domain.model.PlannerConfig;
import org.squadplanner.simulation.model.PlanningException;
import org.squadplanner.simulation.model.ValidationException;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe implementation of ParameterCache.
 * Uses read-write lock for concurrent access with exclusive writes.
 */
public final class ParameterCacheImpl implements ParameterCache {

    private static final Logger LOG = Logger.getLogger(ParameterCacheImpl.class.getName());

    private final ParameterSource source;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile boolean initialized = false;
    private PlannerConfig config = PlannerConfig.defaults();

    public ParameterCacheImpl(ParameterSource source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public void refresh() {
        LOG.info(() -> "Refreshing planner parameters from " + source.describe());

        ParameterSetDto data = source.fetchParameters();
        if (data == null) {
            LOG.warning("Parameter source returned nothing, keeping existing parameters");
            return;
        }

        PlannerConfig loaded;
        try {
            loaded = toConfig(data);
        } catch (PlanningException e) {
            LOG.log(Level.WARNING, "Rejected invalid parameter set, keeping existing parameters", e);
            return;
        }

        lock.writeLock().lock();
        try {
            this.config = loaded;
            this.initialized = true;
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Planner parameter refresh complete");
    }

    @Override
    public PlannerConfig getConfig() {
        lock.readLock().lock();
        try {
            return config;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Converts a parameter set DTO; items outside their declared bounds are skipped.
     */
    static PlannerConfig toConfig(ParameterSetDto data) {
        Map<String, Double> values = new HashMap<>();
        if (data.getConfig() != null) {
            for (ParameterSetDto.ConfigItemDto item : data.getConfig()) {
                if (item.getKey() == null) {
                    continue;
                }
                if (!item.isWithinBounds()) {
                    LOG.warning(() -> String.format("Config value %s=%s outside [%s, %s], using default",
                            item.getKey(), item.getValue(), item.getMinValue(), item.getMaxValue()));
                    continue;
                }
                values.put(item.getKey(), item.getValue());
            }
            LOG.info(() -> "Loaded " + values.size() + " config values");
        }

        Map<String, CurveSpec> curves = new HashMap<>();
        if (data.getCurves() != null) {
            for (ParameterSetDto.CurveDto curve : data.getCurves()) {
                if (curve.getName() == null || curve.getKind() == null || curve.getParameters() == null) {
                    LOG.warning(() -> "Skipping incomplete curve definition " + curve.getName());
                    continue;
                }
                curves.put(curve.getName(), new CurveSpec(parseKind(curve.getKind()), curve.getParameters()));
            }
            LOG.info(() -> "Loaded " + curves.size() + " curves");
        }

        return PlannerConfig.fromMap(values, curves);
    }

    private static CurveKind parseKind(String kind) {
        try {
            return CurveKind.valueOf(kind.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown curve kind " + kind, kind);
        }
    }
}
