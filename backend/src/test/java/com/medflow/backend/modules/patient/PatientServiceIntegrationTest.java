package com.medflow.backend.modules.patient;

import static com.medflow.backend.support.TestFixtures.EXAM_DATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.UUID;

import com.medflow.backend.global.error.NotFoundException;
import com.medflow.backend.global.error.ProblemException;
import com.medflow.backend.modules.patient.application.PatientService;
import com.medflow.backend.modules.patient.application.PatientService.PatientRegistration;
import com.medflow.backend.modules.patient.domain.Patient;
import com.medflow.backend.modules.station.application.StationRegistryService;
import com.medflow.backend.modules.station.application.StationRegistryService.StationDefinition;
import com.medflow.backend.modules.station.domain.Station;
import com.medflow.backend.modules.tracking.application.TrackingService;
import com.medflow.backend.modules.tracking.domain.InvalidTransitionException;
import com.medflow.backend.support.AbstractIntegrationTest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class PatientServiceIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private PatientService patientService;

    @Autowired
    private StationRegistryService stationRegistryService;

    @Autowired
    private TrackingService trackingService;

    @Test
    @DisplayName("registration normalizes package codes and rejects duplicates per day")
    void registerPatient() {
        Patient patient = patientService.registerPatient(
                new PatientRegistration(" P-100 ", "Lin Mei", EXAM_DATE, null, null, List.of("blood", "Xray")),
                "front-desk"
        );

        assertThat(patient.getChartNo()).isEqualTo("P-100");
        assertThat(patientService.requiredExamCodes(patient.getId())).containsExactly("BLOOD", "XRAY");
        assertThat(patientService.listPatients(EXAM_DATE)).extracting(Patient::getChartNo).contains("P-100");
        assertThatThrownBy(() -> patientService.registerPatient(
                new PatientRegistration("P-100", "Lin Mei", EXAM_DATE, 0, null, List.of()), "front-desk"))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("PATIENT_ALREADY_REGISTERED"));
    }

    @Test
    void unknownStationInPackageIsRejected() {
        assertThatThrownBy(() -> patientService.registerPatient(
                new PatientRegistration("P-101", "Chen", EXAM_DATE, 0, null, List.of("PET")), "front-desk"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("inactive patients and stations reject tracking mutations")
    void inactiveEntitiesRejectMutations() {
        UUID id = fixtures.patient("P-102", "PHY").getId();
        stationRegistryService.updateStation("PHY", new StationDefinition(null, null, null, null, null, false, null, null), "admin");

        assertThatThrownBy(() -> trackingService.reportArrival(id, EXAM_DATE, "PHY", "nurse-1"))
                .isInstanceOf(InvalidTransitionException.class);

        patientService.setActive(id, false, "admin");
        assertThatThrownBy(() -> trackingService.reportArrival(id, EXAM_DATE, "BLOOD", "nurse-1"))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(stationRegistryService.listStations(false)).extracting(Station::getCode).doesNotContain("PHY");
        assertThat(stationRegistryService.listStations(true)).extracting(Station::getCode).contains("PHY");
    }

    @Test
    void stationCapacityMustBePositive() {
        assertThatThrownBy(() -> stationRegistryService.createStation(
                new StationDefinition("DEXA", "Bone density", null, 10, 0, null, null, null), "admin"))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("INVALID_CAPACITY"));

        Station created = stationRegistryService.createStation(
                new StationDefinition("dexa", "Bone density", "2F", 10, 1, null, null, List.of("REG")), "admin");
        assertThat(created.getCode()).isEqualTo("DEXA");
        assertThat(created.getPredecessorCodes()).containsExactly("REG");
    }
}
