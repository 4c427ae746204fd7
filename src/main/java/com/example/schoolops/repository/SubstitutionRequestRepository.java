package com.example.schoolops.repository;

import com.example.schoolops.entities.SubstitutionRequest;
import com.example.schoolops.enums.SubstitutionRequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SubstitutionRequestRepository extends JpaRepository<SubstitutionRequest, String> {

    List<SubstitutionRequest> findAllByOrderByRequestedAtDesc();

    List<SubstitutionRequest> findBySubstituteTeacherAndStatusOrderByRequestedAtDesc(String substituteTeacher,
                                                                                     SubstitutionRequestStatus status);
}
