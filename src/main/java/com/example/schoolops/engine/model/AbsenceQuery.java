package com.example.schoolops.engine.model;

import com.example.schoolops.enums.AbsenceFilter;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder(toBuilder = true)
public class AbsenceQuery {

    LocalDate from;
    LocalDate to;
    AbsenceFilter filter;
    String classGrade;
    String search;
}
