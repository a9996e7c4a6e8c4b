package org.squadplanner.engine.domain.service;

import org.squadplanner.engine.domain.model.EventSchedule;
import org.squadplanner.engine.domain.model.PlannerConfig;
import org.squadplanner.engine.domain.model.ShadowPrice;
import org.squadplanner.simulation.model.Worker;

import java.util.List;
import java.util.Map;

/**
 * Estimates what starting a worker now costs the events that follow.
 */
public interface ShadowPricingService {

    /**
     * Prices every worker of the roster at event {@code eventIndex}.
     *
     * @return worker id to shadow price, in roster order
     */
    Map<String, ShadowPrice> price(List<Worker> roster, EventSchedule schedule, int eventIndex, PlannerConfig config);

    /**
     * Workers with the highest opportunity cost at the event, highest first.
     *
     * @param limit maximum number of entries returned
     */
    List<ShadowPrice> rankByShadowPrice(List<Worker> roster, EventSchedule schedule, int eventIndex,
                                        PlannerConfig config, int limit);
}
