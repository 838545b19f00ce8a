package com.medflow.backend.modules.station.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.medflow.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "station")
public class Station extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "code", nullable = false, unique = true, length = 20)
    private String code;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "location", length = 100)
    private String location;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes = 15;

    @Column(name = "capacity", nullable = false)
    private int capacity = 1;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "fasting_preferred", nullable = false)
    private boolean fastingPreferred;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "station_dependency", joinColumns = @JoinColumn(name = "station_id"))
    @OrderColumn(name = "sort_order")
    @Column(name = "predecessor_code", nullable = false, length = 20)
    private List<String> predecessorCodes = new ArrayList<>();

    public UUID getId() {
        return id;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public int getDurationMinutes() {
        return durationMinutes;
    }

    public void setDurationMinutes(int durationMinutes) {
        this.durationMinutes = durationMinutes;
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isFastingPreferred() {
        return fastingPreferred;
    }

    public void setFastingPreferred(boolean fastingPreferred) {
        this.fastingPreferred = fastingPreferred;
    }

    public List<String> getPredecessorCodes() {
        return predecessorCodes;
    }

    public void replacePredecessorCodes(List<String> codes) {
        predecessorCodes.clear();
        if (codes != null) {
            codes.stream()
                    .filter(candidate -> candidate != null && !candidate.isBlank())
                    .map(candidate -> candidate.trim().toUpperCase())
                    .filter(candidate -> !candidate.equals(code))
                    .distinct()
                    .forEach(predecessorCodes::add);
        }
    }
}
