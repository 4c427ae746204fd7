package com.example.schoolops.service;

import com.example.schoolops.engine.ScheduleEditor;
import com.example.schoolops.engine.SubstitutionManager;
import com.example.schoolops.engine.model.EngineError;
import com.example.schoolops.engine.model.ErrorType;
import com.example.schoolops.engine.model.Outcome;
import com.example.schoolops.engine.model.ScheduleSlot;
import com.example.schoolops.entities.SubstitutionRequest;
import com.example.schoolops.enums.SubstitutionRequestStatus;
import com.example.schoolops.repository.SubstitutionRequestRepository;
import com.example.schoolops.store.ScheduleStore;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Substitution requests: an administrator asks a teacher to cover a slot, the teacher accepts or rejects.
 * Accepting performs the substitution; cancelling an accepted request undoes it.
 */
@Service
@RequiredArgsConstructor
public class SubstitutionRequestService {

    private final Logger log = LoggerFactory.getLogger(SubstitutionRequestService.class);

    private final SubstitutionRequestRepository repository;
    private final ScheduleStore scheduleStore;
    private final SubstitutionManager substitutionManager;
    private final ScheduleService scheduleService;

    @Transactional(readOnly = true)
    public List<SubstitutionRequest> findAll() {
        return repository.findAllByOrderByRequestedAtDesc();
    }

    @Transactional(readOnly = true)
    public List<SubstitutionRequest> pendingFor(String teacher) {
        String name = ScheduleEditor.normalizeTeacher(teacher);
        if (name == null || name.isEmpty()) return List.of();
        return repository.findBySubstituteTeacherAndStatusOrderByRequestedAtDesc(name, SubstitutionRequestStatus.PENDING);
    }

    /**
     * Rejected up front when the assignment itself would be rejected right now
     * (unknown slot, self-reassignment, teacher busy at that time).
     */
    @Transactional
    public Outcome<SubstitutionRequest> create(LocalDate date, String slotId, String teacher, String requestedBy) {
        if (date == null) {
            return Outcome.failure(EngineError.invalidArgument("date is required"));
        }
        List<ScheduleSlot> schedule = scheduleStore.listSchedule(null);
        Outcome<List<ScheduleSlot>> dryRun = substitutionManager.assignSubstitute(schedule, slotId, teacher);
        if (!dryRun.isSuccess()) {
            log.warn("Substitution request for slot id={} teacher={} rejected: {}", slotId, teacher, dryRun.getError().getMessage());
            return Outcome.failure(dryRun.getError());
        }

        SubstitutionRequest request = SubstitutionRequest.builder()
                .id(UUID.randomUUID().toString())
                .requestDate(date)
                .scheduleItemId(slotId)
                .substituteTeacher(ScheduleEditor.normalizeTeacher(teacher))
                .status(SubstitutionRequestStatus.PENDING)
                .requestedAt(Instant.now())
                .requestedBy(requestedBy)
                .build();
        SubstitutionRequest saved = repository.save(request);
        log.info("Created substitution request id={} slot={} teacher={}", saved.getId(), slotId, saved.getSubstituteTeacher());
        return Outcome.success(saved);
    }

    /**
     * @param actingTeacher schedule name of the answering teacher; null when an administrator answers
     */
    @Transactional
    public Outcome<SubstitutionRequest> accept(String requestId, String actingTeacher) {
        Outcome<SubstitutionRequest> pending = findPending(requestId, actingTeacher);
        if (!pending.isSuccess()) return pending;
        SubstitutionRequest request = pending.getValue();

        Outcome<ScheduleSlot> assigned = scheduleService.assignSubstitute(request.getScheduleItemId(), request.getSubstituteTeacher());
        if (!assigned.isSuccess()) {
            log.warn("Accepting request id={} failed: {}", requestId, assigned.getError().getMessage());
            return Outcome.failure(assigned.getError());
        }

        request.setStatus(SubstitutionRequestStatus.ACCEPTED);
        request.setRespondedAt(Instant.now());
        log.info("Substitution request id={} accepted by {}", requestId, request.getSubstituteTeacher());
        return Outcome.success(repository.save(request));
    }

    @Transactional
    public Outcome<SubstitutionRequest> reject(String requestId, String reason, String actingTeacher) {
        if (reason == null || reason.isBlank()) {
            return Outcome.failure(EngineError.invalidArgument("rejection reason is required"));
        }
        Outcome<SubstitutionRequest> pending = findPending(requestId, actingTeacher);
        if (!pending.isSuccess()) return pending;
        SubstitutionRequest request = pending.getValue();

        request.setStatus(SubstitutionRequestStatus.REJECTED);
        request.setRejectionReason(reason.trim());
        request.setRespondedAt(Instant.now());
        log.info("Substitution request id={} rejected by {}", requestId, request.getSubstituteTeacher());
        return Outcome.success(repository.save(request));
    }

    /**
     * Deletes a request. An accepted one first gives the slot back to its regular teacher.
     */
    @Transactional
    public Outcome<SubstitutionRequest> cancel(String requestId) {
        Optional<SubstitutionRequest> found = requestId == null ? Optional.empty() : repository.findById(requestId);
        if (found.isEmpty()) {
            return Outcome.failure(EngineError.notFound("Substitution request not found: " + requestId));
        }
        SubstitutionRequest request = found.get();

        if (request.getStatus() == SubstitutionRequestStatus.ACCEPTED) {
            Outcome<ScheduleSlot> removed = scheduleService.removeSubstitute(request.getScheduleItemId());
            if (!removed.isSuccess()) {
                ErrorType type = removed.getError().getType();
                if (type != ErrorType.NOT_FOUND && type != ErrorType.INVALID_STATE) {
                    return Outcome.failure(removed.getError());
                }
                // slot deleted or substitution already removed by hand
                log.warn("Cancelling request id={}: substitution already gone ({})", requestId, removed.getError().getMessage());
            }
        }

        repository.delete(request);
        log.info("Cancelled substitution request id={} (was {})", requestId, request.getStatus());
        return Outcome.success(request);
    }

    // requests addressed to another teacher are reported as missing
    private Outcome<SubstitutionRequest> findPending(String requestId, String actingTeacher) {
        Optional<SubstitutionRequest> found = requestId == null ? Optional.empty() : repository.findById(requestId);
        if (found.isPresent() && actingTeacher != null
                && !found.get().getSubstituteTeacher().equals(ScheduleEditor.normalizeTeacher(actingTeacher))) {
            log.warn("Teacher {} tried to answer request id={} addressed to {}",
                    actingTeacher, requestId, found.get().getSubstituteTeacher());
            found = Optional.empty();
        }
        if (found.isEmpty()) {
            return Outcome.failure(EngineError.notFound("Substitution request not found: " + requestId));
        }
        if (found.get().getStatus() != SubstitutionRequestStatus.PENDING) {
            return Outcome.failure(EngineError.invalidState(
                    "Substitution request " + requestId + " is already " + found.get().getStatus()));
        }
        return Outcome.success(found.get());
    }
}
