package com.example.schoolops.service;

import com.example.schoolops.enums.RecordField;
import lombok.Value;

/**
 * One field change on a student's record, as sent in a batch save.
 */
@Value
public class RecordEdit {

    String studentId;
    RecordField field;
    String value;
}
