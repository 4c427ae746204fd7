package com.example.schoolops.repository;

import com.example.schoolops.entities.Student;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StudentRepository extends JpaRepository<Student, String> {

    List<Student> findAllByOrderByClassGradeAscNameAsc();
}
