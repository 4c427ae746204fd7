package com.example.schoolops.controller;

import com.example.schoolops.engine.model.Outcome;
import com.example.schoolops.service.BulkReport;
import com.example.schoolops.service.SessionCompletionService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionCompletionService sessionCompletionService;

    @GetMapping("/completed")
    public ResponseEntity<?> completed(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                       @RequestParam(required = false) String academicYear) {
        return ResponseEntity.ok(Map.of("date", date.toString(),
                "completedSlotIds", sessionCompletionService.completedSessions(date, academicYear)));
    }

    @GetMapping("/{slotId}/bulk-report")
    public ResponseEntity<?> bulkReport(@PathVariable String slotId,
                                        @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        Outcome<BulkReport> outcome = sessionCompletionService.bulkReport(slotId, date);
        if (!outcome.isSuccess()) return ApiResponses.error(outcome.getError());
        BulkReport report = outcome.getValue();

        Map<String, Object> m = new HashMap<>();
        m.put("slot", ApiResponses.slot(report.getSlot()));
        m.put("date", report.getDate().toString());
        m.put("enabled", report.isEnabled());
        m.put("students", report.getStudents().stream().map(ApiResponses::student).toList());
        m.put("records", report.getRecords().stream().map(ApiResponses::record).toList());
        m.put("missingStudentIds", report.getMissingStudentIds());
        return ResponseEntity.ok(m);
    }
}
