package com.medflow.backend.modules.patient.domain;

import java.time.LocalDate;
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
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(
        name = "patient",
        uniqueConstraints = @UniqueConstraint(name = "uq_patient_chart_date", columnNames = {"chart_no", "checkup_date"})
)
public class Patient extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "chart_no", nullable = false, length = 50)
    private String chartNo;

    @Column(name = "full_name", nullable = false, length = 100)
    private String fullName;

    @Column(name = "checkup_date", nullable = false)
    private LocalDate checkupDate;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "vip_level", nullable = false)
    private int vipLevel;

    @Column(name = "notes")
    private String notes;

    /**
     * The package: station codes the patient must complete, in the order they were booked.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "patient_required_exam", joinColumns = @JoinColumn(name = "patient_id"))
    @OrderColumn(name = "sort_order")
    @Column(name = "station_code", nullable = false, length = 20)
    private List<String> requiredExamCodes = new ArrayList<>();

    public UUID getId() {
        return id;
    }

    public String getChartNo() {
        return chartNo;
    }

    public void setChartNo(String chartNo) {
        this.chartNo = chartNo;
    }

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public LocalDate getCheckupDate() {
        return checkupDate;
    }

    public boolean isBookedOn(LocalDate date) {
        return checkupDate != null && checkupDate.equals(date);
    }

    public void setCheckupDate(LocalDate checkupDate) {
        this.checkupDate = checkupDate;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public int getVipLevel() {
        return vipLevel;
    }

    public void setVipLevel(int vipLevel) {
        this.vipLevel = vipLevel;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public List<String> getRequiredExamCodes() {
        return requiredExamCodes;
    }

    public void replaceRequiredExamCodes(List<String> codes) {
        requiredExamCodes.clear();
        if (codes != null) {
            codes.stream()
                    .filter(code -> code != null && !code.isBlank())
                    .map(code -> code.trim().toUpperCase())
                    .distinct()
                    .forEach(requiredExamCodes::add);
        }
    }
}
