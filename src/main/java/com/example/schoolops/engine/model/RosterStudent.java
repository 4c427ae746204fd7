package com.example.schoolops.engine.model;

import lombok.Builder;
import lombok.Value;

/**
 * The part of a student the engine needs: identity and class label.
 */
@Value
@Builder
public class RosterStudent {

    String id;
    String name;
    String classGrade;
    String studentNumber;
}
