package com.medflow.backend.modules.station.presentation;

import java.util.List;

import com.medflow.backend.global.web.RequestIdFilter;
import com.medflow.backend.modules.station.application.StationRegistryService;
import com.medflow.backend.modules.station.application.StationRegistryService.StationDefinition;
import com.medflow.backend.modules.station.presentation.dto.CreateStationRequest;
import com.medflow.backend.modules.station.presentation.dto.StationResponse;
import com.medflow.backend.modules.station.presentation.dto.UpdateStationRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/stations")
@Tag(name = "Stations")
public class StationController {

    private final StationRegistryService stationRegistryService;

    public StationController(StationRegistryService stationRegistryService) {
        this.stationRegistryService = stationRegistryService;
    }

    @GetMapping
    @Operation(summary = "List examination stations")
    public ResponseEntity<List<StationResponse>> listStations(
            @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive
    ) {
        return ResponseEntity.ok(stationRegistryService.listStations(includeInactive).stream()
                .map(StationResponse::from)
                .toList());
    }

    @GetMapping("/{code}")
    public ResponseEntity<StationResponse> getStation(@PathVariable("code") String code) {
        return ResponseEntity.ok(StationResponse.from(stationRegistryService.getStation(code)));
    }

    @PostMapping
    @Operation(summary = "Register a station")
    public ResponseEntity<StationResponse> createStation(
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody CreateStationRequest request
    ) {
        StationDefinition definition = new StationDefinition(
                request.code(),
                request.name(),
                request.location(),
                request.durationMinutes(),
                request.capacity(),
                true,
                request.fastingPreferred(),
                request.predecessorCodes()
        );
        return ResponseEntity.status(201).body(StationResponse.from(stationRegistryService.createStation(definition, actorId)));
    }

    @PatchMapping("/{code}")
    @Operation(summary = "Update capacity, activity, fasting preference or dependencies of a station")
    public ResponseEntity<StationResponse> updateStation(
            @PathVariable("code") String code,
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @Valid @RequestBody UpdateStationRequest request
    ) {
        StationDefinition definition = new StationDefinition(
                code,
                request.name(),
                request.location(),
                request.durationMinutes(),
                request.capacity(),
                request.active(),
                request.fastingPreferred(),
                request.predecessorCodes()
        );
        return ResponseEntity.ok(StationResponse.from(stationRegistryService.updateStation(code, definition, actorId)));
    }
}
