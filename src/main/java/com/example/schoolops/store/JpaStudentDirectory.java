package com.example.schoolops.store;

import com.example.schoolops.engine.model.RosterStudent;
import com.example.schoolops.entities.Student;
import com.example.schoolops.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaStudentDirectory implements StudentDirectory {

    private final StudentRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<RosterStudent> listStudents() {
        return repository.findAllByOrderByClassGradeAscNameAsc().stream()
                .map(JpaStudentDirectory::toRosterStudent)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RosterStudent> findStudent(String studentId) {
        if (studentId == null) return Optional.empty();
        return repository.findById(studentId).map(JpaStudentDirectory::toRosterStudent);
    }

    static RosterStudent toRosterStudent(Student s) {
        return RosterStudent.builder()
                .id(s.getId())
                .name(s.getName())
                .classGrade(s.getClassGrade())
                .studentNumber(s.getStudentNumber())
                .build();
    }
}
