package com.example.schoolops.store;

import com.example.schoolops.engine.model.RosterStudent;

import java.util.List;
import java.util.Optional;

public interface StudentDirectory {

    List<RosterStudent> listStudents();

    Optional<RosterStudent> findStudent(String studentId);
}
