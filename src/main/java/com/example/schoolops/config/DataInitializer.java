package com.example.schoolops.config;

import com.example.schoolops.entities.ScheduleItem;
import com.example.schoolops.entities.Student;
import com.example.schoolops.enums.SchoolDay;
import com.example.schoolops.enums.StudentStatus;
import com.example.schoolops.repository.ScheduleItemRepository;
import com.example.schoolops.repository.StudentRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Seeds a small demo school when {@code schoolops.demo.enabled=true}. Existing rows are never overwritten.
 */
@Component
public class DataInitializer {

    private final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final SchoolOpsProperties properties;
    private final StudentRepository studentRepo;
    private final ScheduleItemRepository scheduleRepo;

    public DataInitializer(SchoolOpsProperties properties, StudentRepository studentRepo, ScheduleItemRepository scheduleRepo) {
        this.properties = properties;
        this.studentRepo = studentRepo;
        this.scheduleRepo = scheduleRepo;
    }

    @PostConstruct
    public void init() {
        if (!properties.getDemo().isEnabled()) {
            return;
        }
        String year = properties.getAcademicYear();

        int created = 0;
        created += createStudentIfMissing("demo-s1", "Ahmed Saleh", "Grade4/A", "1001") ? 1 : 0;
        created += createStudentIfMissing("demo-s2", "Omar Khalid", "Grade4/A", "1002") ? 1 : 0;
        created += createStudentIfMissing("demo-s3", "Yousef Ali", "Grade4/B", "1003") ? 1 : 0;
        created += createStudentIfMissing("demo-s4", "Fahad Nasser", "Grade5", "1004") ? 1 : 0;

        created += createSlotIfMissing("demo-slot-1", SchoolDay.SUNDAY, 1, "Mathematics", "Grade4/A", "Teacher A", year) ? 1 : 0;
        created += createSlotIfMissing("demo-slot-2", SchoolDay.SUNDAY, 2, "Science", "Grade4/B", "Teacher A", year) ? 1 : 0;
        created += createSlotIfMissing("demo-slot-3", SchoolDay.SUNDAY, 1, "English", "Grade5", "Teacher B", year) ? 1 : 0;
        created += createSlotIfMissing("demo-slot-4", SchoolDay.MONDAY, 3, "Arabic", "Grade4", "Teacher C", year) ? 1 : 0;

        log.info("Demo data initialized, {} rows created", created);
    }

    private boolean createStudentIfMissing(String id, String name, String classGrade, String number) {
        if (studentRepo.existsById(id)) return false;
        studentRepo.save(Student.builder()
                .id(id)
                .name(name)
                .classGrade(classGrade)
                .studentNumber(number)
                .status(StudentStatus.REGULAR)
                .build());
        return true;
    }

    private boolean createSlotIfMissing(String id, SchoolDay day, int period, String subject, String classRoom,
                                        String teacher, String year) {
        if (scheduleRepo.existsById(id)) return false;
        scheduleRepo.save(ScheduleItem.builder()
                .id(id)
                .day(day)
                .period(period)
                .subject(subject)
                .classRoom(classRoom)
                .teacher(teacher)
                .academicYear(year)
                .createdAt(Instant.now())
                .build());
        return true;
    }
}
