package com.example.schoolops.store;

import com.example.schoolops.engine.model.ScheduleSlot;
import com.example.schoolops.entities.ScheduleItem;
import com.example.schoolops.repository.ScheduleItemRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class JpaScheduleStore implements ScheduleStore {

    private final Logger log = LoggerFactory.getLogger(JpaScheduleStore.class);

    private static final Comparator<ScheduleSlot> WEEK_ORDER = Comparator
            .comparing(ScheduleSlot::getDay)
            .thenComparingInt(ScheduleSlot::getPeriod)
            .thenComparing(ScheduleSlot::getId);

    private final ScheduleItemRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<ScheduleSlot> listSchedule(String academicYear) {
        List<ScheduleItem> items = (academicYear == null || academicYear.isBlank())
                ? repository.findAll()
                : repository.findByAcademicYearOrAcademicYearIsNull(academicYear.trim());
        return items.stream()
                .map(JpaScheduleStore::toSlot)
                .sorted(WEEK_ORDER)
                .toList();
    }

    /**
     * Rows missing from {@code schedule} are deleted, the rest are inserted or overwritten.
     */
    @Override
    @Transactional
    public void replaceSchedule(List<ScheduleSlot> schedule) {
        List<ScheduleSlot> slots = schedule == null ? List.of() : schedule;
        Set<String> keep = slots.stream().map(ScheduleSlot::getId).collect(Collectors.toSet());

        List<String> obsolete = repository.findAll().stream()
                .map(ScheduleItem::getId)
                .filter(id -> !keep.contains(id))
                .toList();
        if (!obsolete.isEmpty()) {
            repository.deleteAllById(obsolete);
        }

        Instant now = Instant.now();
        repository.saveAll(slots.stream().map(s -> toEntity(s, now)).toList());
        log.info("Replaced schedule: {} slots stored, {} removed", slots.size(), obsolete.size());
    }

    static ScheduleSlot toSlot(ScheduleItem item) {
        return ScheduleSlot.builder()
                .id(item.getId())
                .day(item.getDay())
                .period(item.getPeriod() == null ? 0 : item.getPeriod())
                .subject(item.getSubject())
                .classRoom(item.getClassRoom())
                .teacher(item.getTeacher())
                .originalTeacher(item.getOriginalTeacher())
                .academicYear(item.getAcademicYear())
                .createdAt(item.getCreatedAt())
                .build();
    }

    static ScheduleItem toEntity(ScheduleSlot slot, Instant now) {
        return ScheduleItem.builder()
                .id(slot.getId())
                .day(slot.getDay())
                .period(slot.getPeriod())
                .subject(slot.getSubject())
                .classRoom(slot.getClassRoom())
                .teacher(slot.getTeacher())
                .originalTeacher(slot.getOriginalTeacher())
                .academicYear(slot.getAcademicYear())
                .createdAt(slot.getCreatedAt() == null ? now : slot.getCreatedAt())
                .build();
    }
}
