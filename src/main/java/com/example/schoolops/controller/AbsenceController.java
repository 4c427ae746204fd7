package com.example.schoolops.controller;

import com.example.schoolops.engine.model.AbsenceQuery;
import com.example.schoolops.enums.AbsenceFilter;
import com.example.schoolops.service.AbsenceReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Absence report for counselors. Filters: today, three-days, week, repeated, excused, unexcused, custom.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/absences")
public class AbsenceController {

    private final AbsenceReportService absenceReportService;

    @GetMapping
    public ResponseEntity<?> report(@RequestParam(defaultValue = "today") String filter,
                                    @RequestParam(required = false) String classGrade,
                                    @RequestParam(name = "q", required = false) String search,
                                    @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                    @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        Optional<AbsenceFilter> parsed = AbsenceFilter.fromCode(filter);
        if (parsed.isEmpty()) return ApiResponses.badRequest("invalid_filter");
        if (from != null && to != null && from.isAfter(to)) return ApiResponses.badRequest("invalid_range");

        AbsenceQuery query = AbsenceQuery.builder()
                .filter(parsed.get())
                .classGrade(classGrade)
                .search(search)
                .from(from)
                .to(to)
                .build();
        return ResponseEntity.ok(absenceReportService.report(query, LocalDate.now()).stream()
                .map(ApiResponses::absence).toList());
    }
}
