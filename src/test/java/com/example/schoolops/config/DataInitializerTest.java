package com.example.schoolops.config;

import com.example.schoolops.entities.ScheduleItem;
import com.example.schoolops.entities.Student;
import com.example.schoolops.repository.ScheduleItemRepository;
import com.example.schoolops.repository.StudentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DataInitializerTest {

    @Mock
    private StudentRepository studentRepo;

    @Mock
    private ScheduleItemRepository scheduleRepo;

    private SchoolOpsProperties properties;
    private DataInitializer initializer;

    @BeforeEach
    void setUp() {
        properties = new SchoolOpsProperties();
        properties.setAcademicYear("1446-1447");
        initializer = new DataInitializer(properties, studentRepo, scheduleRepo);
    }

    @Test
    void doesNothingWhenDemoDisabled() {
        initializer.init();

        verifyNoInteractions(studentRepo, scheduleRepo);
    }

    @Test
    void seedsMissingRowsWithConfiguredYear() {
        properties.getDemo().setEnabled(true);
        when(studentRepo.existsById(anyString())).thenReturn(false);
        when(scheduleRepo.existsById(anyString())).thenReturn(false);

        initializer.init();

        verify(studentRepo, times(4)).save(any(Student.class));
        ArgumentCaptor<ScheduleItem> captor = ArgumentCaptor.forClass(ScheduleItem.class);
        verify(scheduleRepo, times(4)).save(captor.capture());
        assertEquals("1446-1447", captor.getAllValues().get(0).getAcademicYear());
    }

    @Test
    void neverOverwritesExistingRows() {
        properties.getDemo().setEnabled(true);
        when(studentRepo.existsById(anyString())).thenReturn(true);
        when(scheduleRepo.existsById(anyString())).thenReturn(true);

        initializer.init();

        verify(studentRepo, never()).save(any(Student.class));
        verify(scheduleRepo, never()).save(any(ScheduleItem.class));
    }
}
