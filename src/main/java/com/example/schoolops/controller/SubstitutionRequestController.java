package com.example.schoolops.controller;

import com.example.schoolops.config.SchoolOpsProperties;
import com.example.schoolops.engine.model.Outcome;
import com.example.schoolops.entities.SubstitutionRequest;
import com.example.schoolops.service.SubstitutionRequestService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/substitution-requests")
public class SubstitutionRequestController {

    private final SubstitutionRequestService substitutionRequestService;
    private final SchoolOpsProperties properties;

    @GetMapping
    public ResponseEntity<?> list() {
        return ResponseEntity.ok(substitutionRequestService.findAll().stream().map(ApiResponses::request).toList());
    }

    /**
     * Teachers always get their own requests; administrators pick the teacher with {@code ?teacher=}.
     */
    @GetMapping("/pending")
    public ResponseEntity<?> pending(@RequestParam(required = false) String teacher, Authentication authentication) {
        String acting = actingTeacher(authentication);
        String name = acting != null ? acting : teacher;
        return ResponseEntity.ok(substitutionRequestService.pendingFor(name).stream().map(ApiResponses::request).toList());
    }

    /**
     * Body: {"date":"YYYY-MM-DD", "scheduleItemId":"...", "teacher":"C"}
     */
    @PostMapping
    public ResponseEntity<?> create(@RequestBody Map<String, Object> payload, Principal principal) {
        LocalDate date;
        try {
            Object raw = payload.get("date");
            date = raw == null ? null : LocalDate.parse(raw.toString());
        } catch (DateTimeParseException ex) {
            return ApiResponses.badRequest("invalid_date");
        }
        Object slotId = payload.get("scheduleItemId");
        Object teacher = payload.get("teacher");
        if (slotId == null) return ApiResponses.badRequest("missing_scheduleItemId");
        if (teacher == null) return ApiResponses.badRequest("missing_teacher");

        String requestedBy = principal == null ? null : principal.getName();
        Outcome<SubstitutionRequest> outcome = substitutionRequestService.create(date, slotId.toString(), teacher.toString(), requestedBy);
        return respond(outcome);
    }

    @PostMapping("/{id}/accept")
    public ResponseEntity<?> accept(@PathVariable String id, Authentication authentication) {
        return respond(substitutionRequestService.accept(id, actingTeacher(authentication)));
    }

    /**
     * Body: {"reason": "..."}
     */
    @PostMapping("/{id}/reject")
    public ResponseEntity<?> reject(@PathVariable String id, @RequestBody(required = false) Map<String, Object> payload,
                                    Authentication authentication) {
        Object reason = payload == null ? null : payload.get("reason");
        return respond(substitutionRequestService.reject(id, reason == null ? null : reason.toString(),
                actingTeacher(authentication)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> cancel(@PathVariable String id) {
        return respond(substitutionRequestService.cancel(id));
    }

    // null for administrators, who may act on any request
    private String actingTeacher(Authentication authentication) {
        if (authentication == null) return null;
        boolean admin = authentication.getAuthorities().stream()
                .anyMatch(a -> "ROLE_ADMIN".equals(a.getAuthority()));
        if (admin) return null;
        String name = properties.teacherNameFor(authentication.getName());
        return name != null ? name : authentication.getName();
    }

    private ResponseEntity<?> respond(Outcome<SubstitutionRequest> outcome) {
        if (!outcome.isSuccess()) return ApiResponses.error(outcome.getError());
        return ResponseEntity.ok(Map.of("success", true, "request", ApiResponses.request(outcome.getValue())));
    }
}
