package com.medflow.backend.support;

import java.time.LocalDate;
import java.util.List;

import com.medflow.backend.modules.equipment.domain.Equipment;
import com.medflow.backend.modules.equipment.domain.EquipmentStatus;
import com.medflow.backend.modules.equipment.infrastructure.persistence.EquipmentRepository;
import com.medflow.backend.modules.patient.domain.Patient;
import com.medflow.backend.modules.patient.infrastructure.persistence.PatientRepository;
import com.medflow.backend.modules.station.domain.Station;
import com.medflow.backend.modules.station.infrastructure.persistence.StationRepository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Seeds the default station catalog and test patients. The H2 test profile builds the schema from the
 * entities, so the catalog that Flyway loads in production is recreated here.
 */
@Component
@Transactional
public class TestFixtures {

    public static final LocalDate EXAM_DATE = LocalDate.of(2025, 3, 10);

    private static final List<String> CLEANUP_ORDER = List.of(
            "notification",
            "audit_log",
            "escort_assignment",
            "escort_staff_slot",
            "tracking_history",
            "tracking_state",
            "equipment_log",
            "equipment",
            "patient_required_exam",
            "patient",
            "station_dependency",
            "station"
    );

    private final JdbcTemplate jdbcTemplate;
    private final StationRepository stationRepository;
    private final EquipmentRepository equipmentRepository;
    private final PatientRepository patientRepository;

    public TestFixtures(
            JdbcTemplate jdbcTemplate,
            StationRepository stationRepository,
            EquipmentRepository equipmentRepository,
            PatientRepository patientRepository
    ) {
        this.jdbcTemplate = jdbcTemplate;
        this.stationRepository = stationRepository;
        this.equipmentRepository = equipmentRepository;
        this.patientRepository = patientRepository;
    }

    public void reset() {
        CLEANUP_ORDER.forEach(table -> jdbcTemplate.update("DELETE FROM " + table));
        seedCatalog();
    }

    private void seedCatalog() {
        station("REG", "Registration", 5, 3, false);
        station("PHY", "Physical Exam", 15, 5, false);
        station("BLOOD", "Blood Draw", 10, 4, false);
        station("XRAY", "Chest X-Ray", 10, 2, false);
        station("US", "Ultrasound", 20, 3, true);
        station("CT", "CT Scan", 30, 1, false, "BLOOD", "US");
        station("MRI", "MRI", 45, 1, false, "BLOOD", "US");
        station("ENDO", "Endoscopy", 30, 2, true, "BLOOD");
        station("CARDIO", "Cardiology (ECG)", 15, 3, false);
        station("CONSULT", "Doctor Consultation", 15, 4, false,
                "PHY", "BLOOD", "XRAY", "US", "CT", "MRI", "ENDO", "CARDIO");
    }

    public Station station(String code, String name, int durationMinutes, int capacity, boolean fasting, String... predecessors) {
        Station station = new Station();
        station.setCode(code);
        station.setName(name);
        station.setDurationMinutes(durationMinutes);
        station.setCapacity(capacity);
        station.setFastingPreferred(fasting);
        station.replacePredecessorCodes(List.of(predecessors));
        Station saved = stationRepository.save(station);

        Equipment equipment = new Equipment();
        equipment.setName(name + " unit");
        equipment.setStationCode(code);
        equipment.setEquipmentType("GENERAL");
        equipmentRepository.save(equipment);
        return saved;
    }

    public Patient patient(String chartNo, String... requiredExams) {
        Patient patient = new Patient();
        patient.setChartNo(chartNo);
        patient.setFullName("Patient " + chartNo);
        patient.setCheckupDate(EXAM_DATE);
        patient.replaceRequiredExamCodes(List.of(requiredExams));
        return patientRepository.save(patient);
    }

    public void setEquipmentStatus(String stationCode, EquipmentStatus status) {
        equipmentRepository.findByStationCodeAndActiveTrueOrderByNameAsc(stationCode)
                .forEach(equipment -> equipment.setStatus(status));
    }
}
