package com.example.schoolops.engine;

/**
 * Matches a student's class label against a slot's classroom.
 *
 * Labels match when equal, or when one is the other followed by a "/" or "_" section suffix,
 * in either direction: "Grade4" matches "Grade4/A" and "Grade4/A" matches "Grade4".
 */
public class RosterMatcher {

    public boolean matches(String classGrade, String classRoom) {
        if (classGrade == null || classRoom == null) return false;
        String a = classGrade.trim();
        String b = classRoom.trim();
        if (a.isEmpty() || b.isEmpty()) return false;
        return a.equals(b) || isSectionOf(a, b) || isSectionOf(b, a);
    }

    private boolean isSectionOf(String label, String parent) {
        return label.startsWith(parent + "/") || label.startsWith(parent + "_");
    }
}
