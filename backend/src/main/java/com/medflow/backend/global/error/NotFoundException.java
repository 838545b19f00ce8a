package com.medflow.backend.global.error;

import org.springframework.http.HttpStatus;

public class NotFoundException extends ProblemException {

    public NotFoundException(String code, String detail) {
        super(HttpStatus.NOT_FOUND, code, detail);
    }

    public static NotFoundException patient(Object patientId) {
        return new NotFoundException("PATIENT_NOT_FOUND", "Unknown patient " + patientId);
    }

    public static NotFoundException station(String stationCode) {
        return new NotFoundException("STATION_NOT_FOUND", "Unknown station " + stationCode);
    }

    public static NotFoundException patientOnDate(Object patientId, Object examDate) {
        return new NotFoundException("PATIENT_DATE_NOT_FOUND",
                "Patient " + patientId + " is not booked for " + examDate);
    }

    public static NotFoundException tracking(Object patientId, Object examDate) {
        return new NotFoundException("TRACKING_NOT_FOUND",
                "No tracking state for patient " + patientId + " on " + examDate);
    }
}
