package com.example.schoolops.service;

import com.example.schoolops.engine.AttendanceRecordEngine;
import com.example.schoolops.engine.model.AttendanceRecord;
import com.example.schoolops.engine.model.ErrorType;
import com.example.schoolops.engine.model.Outcome;
import com.example.schoolops.engine.model.RosterStudent;
import com.example.schoolops.enums.AttendanceStatus;
import com.example.schoolops.enums.EvaluationLevel;
import com.example.schoolops.enums.RecordField;
import com.example.schoolops.store.AttendanceStore;
import com.example.schoolops.store.StudentDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AttendanceServiceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 10, 6);

    @Mock
    private AttendanceStore attendanceStore;

    @Mock
    private StudentDirectory studentDirectory;

    private final AttendanceRecordEngine recordEngine = new AttendanceRecordEngine();
    private AttendanceService attendanceService;

    @BeforeEach
    void setUp() {
        attendanceService = new AttendanceService(attendanceStore, studentDirectory, recordEngine);
    }

    private static RosterStudent student(String id) {
        return RosterStudent.builder().id(id).name("Student " + id).classGrade("Grade4").build();
    }

    @Test
    void editFieldStartsFromDefaultAndStoresResult() {
        when(studentDirectory.findStudent("s1")).thenReturn(Optional.of(student("s1")));
        when(attendanceStore.findRecord("s1", DAY)).thenReturn(Optional.empty());

        Outcome<AttendanceRecord> outcome = attendanceService.editField("s1", DAY, RecordField.ATTENDANCE, "absent");

        assertEquals(AttendanceStatus.ABSENT, outcome.getValue().getAttendance());
        assertEquals(EvaluationLevel.NONE, outcome.getValue().getHomework());
        verify(attendanceStore).upsertAttendanceRecords(List.of(outcome.getValue()));
    }

    @Test
    void editFieldForUnknownStudentIsNotFound() {
        when(studentDirectory.findStudent("zz")).thenReturn(Optional.empty());

        Outcome<AttendanceRecord> outcome = attendanceService.editField("zz", DAY, RecordField.NOTES, "x");

        assertEquals(ErrorType.NOT_FOUND, outcome.getError().getType());
        verify(attendanceStore, never()).upsertAttendanceRecords(anyList());
    }

    @Test
    void applyEditsChainsEditsPerStudent() {
        when(studentDirectory.findStudent("s1")).thenReturn(Optional.of(student("s1")));
        when(studentDirectory.findStudent("s2")).thenReturn(Optional.of(student("s2")));
        when(attendanceStore.findRecord("s1", DAY)).thenReturn(Optional.empty());
        when(attendanceStore.findRecord("s2", DAY)).thenReturn(Optional.of(recordEngine.defaultRecord("s2", DAY)));

        Outcome<List<AttendanceRecord>> outcome = attendanceService.applyEdits(DAY, List.of(
                new RecordEdit("s1", RecordField.PARTICIPATION, "good"),
                new RecordEdit("s2", RecordField.ATTENDANCE, "excused"),
                new RecordEdit("s1", RecordField.ATTENDANCE, "absent"),
                new RecordEdit("s1", RecordField.ATTENDANCE, "present")));

        List<AttendanceRecord> saved = outcome.getValue();
        assertEquals(2, saved.size());
        assertEquals("s1", saved.get(0).getStudentId());
        assertEquals(EvaluationLevel.EXCELLENT, saved.get(0).getParticipation());
        assertEquals(AttendanceStatus.EXCUSED, saved.get(1).getAttendance());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<AttendanceRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(attendanceStore).upsertAttendanceRecords(captor.capture());
        assertEquals(saved, captor.getValue());
    }

    @Test
    void applyEditsStoresNothingWhenOneEditFails() {
        when(studentDirectory.findStudent("s1")).thenReturn(Optional.of(student("s1")));
        when(attendanceStore.findRecord("s1", DAY)).thenReturn(Optional.empty());

        Outcome<List<AttendanceRecord>> outcome = attendanceService.applyEdits(DAY, List.of(
                new RecordEdit("s1", RecordField.NOTES, "ok"),
                new RecordEdit("s1", RecordField.BEHAVIOR, "terrible")));

        assertEquals(ErrorType.INVALID_ARGUMENT, outcome.getError().getType());
        verify(attendanceStore, never()).upsertAttendanceRecords(anyList());
    }
}
