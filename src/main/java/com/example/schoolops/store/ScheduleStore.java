package com.example.schoolops.store;

import com.example.schoolops.engine.model.ScheduleSlot;

import java.util.List;

/**
 * Durable weekly schedule. Writes replace the whole collection.
 */
public interface ScheduleStore {

    /**
     * @param academicYear null for every slot; otherwise the year's slots plus slots without a year
     */
    List<ScheduleSlot> listSchedule(String academicYear);

    void replaceSchedule(List<ScheduleSlot> schedule);
}
