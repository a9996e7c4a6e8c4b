package org.squadplanner.engine.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.squadplanner.engine.api.dto.PlanningRequestDto;
import org.squadplanner.engine.api.dto.WorkerDto;
import org.squadplanner.simulation.engine.StatePropagationEngineImpl;
import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.Importance;
import org.squadplanner.simulation.model.LoadCategory;
import org.squadplanner.simulation.model.TaskSlot;
import org.squadplanner.simulation.model.TrainingIntensity;
import org.squadplanner.simulation.model.ValidationException;
import org.squadplanner.simulation.model.Worker;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RequestMapperTest {

    private final ObjectMapper json = PlanningJson.mapper();
    private final RequestMapper mapper = new RequestMapper(new StatePropagationEngineImpl());

    private PlanningRequest request;

    @BeforeEach
    void loadFixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/request.json")) {
            request = mapper.toDomain(json.readValue(in, PlanningRequestDto.class));
        }
    }

    private Worker worker(String id) {
        return request.getRoster().stream()
                .filter(w -> w.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no worker " + id));
    }

    @Test
    void mapsRosterWithDefaultsForMissingState() {
        assertEquals(22, request.getRoster().size());

        Worker keeper = worker("gk-0");
        assertTrue(keeper.isGoalkeeper());
        assertEquals("Okafor A", keeper.getName());
        assertEquals(150.0, keeper.getRating("GK"), 0.0);
        assertEquals(1.0, keeper.getInPossessionFamiliarity("GK"), 0.0);
        assertEquals(1.0, keeper.getReadiness(), 0.0);
        assertEquals(LoadCategory.FRESH, keeper.getLoad());
    }

    @Test
    void mapsExplicitStateAndHistory() {
        Worker veteran = worker("dl-0");
        assertEquals(31, veteran.getAge());
        assertEquals(TrainingIntensity.HIGH, veteran.getTrainingIntensity());
        assertEquals(0.91, veteran.getReadiness(), 1e-12);
        assertEquals(0.84, veteran.getSharpness(), 1e-12);
        assertEquals(180, veteran.getWindowMinutes());
        assertEquals(2, veteran.getConsecutiveAppearances());
        assertNotNull(veteran.getLoad());

        assertEquals(LoadCategory.TIRED, worker("ml-0").getLoad());
        assertTrue(worker("mcl-1").isInjured());
    }

    @Test
    void ratedTaskWithoutFamiliarityCountsAsNatural() {
        Worker utility = worker("dl-1");

        assertEquals(1.0, utility.getInPossessionFamiliarity("D(L)"), 0.0);
        assertEquals(0.6, utility.getInPossessionFamiliarity("D(R)"), 1e-12);
        assertEquals(0.9, utility.getOutOfPossessionFamiliarity("D(R)"), 1e-12);
    }

    @Test
    void mapsEventsFormationsAndConstraints() {
        assertEquals(3, request.getEvents().size());
        Event first = request.getEvents().get(0);
        assertEquals("league-7", first.getId());
        assertEquals(LocalDate.of(2025, 9, 13), first.getDate());
        assertEquals(Importance.MEDIUM, first.getImportance());
        assertEquals("4-4-2", first.getFormation().getName());

        TaskSlot wide = first.getFormation().findSlot("ML").get();
        assertEquals("M(L)", wide.getInPossessionTask());
        assertEquals("D(L)", wide.getOutOfPossessionTask());
        assertTrue(first.getFormation().findSlot("GK").get().isGoalkeeper());

        assertTrue(first.getConstraints().isForcedRest("stl-1"));
        assertEquals("GK", first.getConstraints().findLock("gk-0").get().getSlotId());
        assertTrue(first.getConstraints().isRejected("dr-1", "DR"));
        assertFalse(first.getConstraints().isOverrideReadinessFloor());

        assertEquals(Importance.SHARPNESS, request.getEvents().get(1).getImportance());
        assertTrue(request.getEvents().get(1).getConstraints().getLocks().isEmpty());
        assertTrue(request.getEvents().get(2).getConstraints().isOverrideReadinessFloor());
    }

    @Test
    void mapsPreviousLineup() {
        assertEquals("DCL", request.getHistory().previousSlot("dcl-0").get());
        assertFalse(request.getHistory().previousSlot("dcl-1").isPresent());
        assertFalse(request.hasCandidateFormations());
    }

    @Test
    void parsesImportanceSpellings() {
        assertEquals(Importance.HIGH, RequestMapper.parseImportance("High", "e"));
        assertEquals(Importance.LOW, RequestMapper.parseImportance(" low ", "e"));
        assertEquals(Importance.SHARPNESS, RequestMapper.parseImportance("sharpness building", "e"));
        ValidationException e = assertThrows(ValidationException.class,
                () -> RequestMapper.parseImportance("friendly", "e9"));
        assertEquals(Collections.singletonList("e9"), e.getOffendingIds());
    }

    @Test
    void requestWithoutWorkersIsRejected() {
        PlanningRequestDto empty = new PlanningRequestDto();
        empty.setWorkers(Collections.<WorkerDto>emptyList());

        assertThrows(ValidationException.class, () -> mapper.toDomain(empty));
    }

    @Test
    void unknownLoadCategoryIsRejected() {
        WorkerDto dto = new WorkerDto();
        dto.setId("w1");
        Map<String, Double> ratings = new HashMap<>();
        ratings.put("ST", 120.0);
        dto.setRatings(ratings);
        dto.setLoad("exhausted");

        ValidationException e = assertThrows(ValidationException.class, () -> mapper.toWorker(dto));
        assertTrue(e.getOffendingIds().contains("w1"));
    }
}
