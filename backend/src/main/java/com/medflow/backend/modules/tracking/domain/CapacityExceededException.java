package com.medflow.backend.modules.tracking.domain;

import com.medflow.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class CapacityExceededException extends ProblemException {

    public static final String CODE = "CAPACITY_EXCEEDED";

    public CapacityExceededException(String stationCode, long inExam, int capacity) {
        super(HttpStatus.CONFLICT, CODE,
                "Station " + stationCode + " is full (" + inExam + "/" + capacity + " in exam)");
    }
}
