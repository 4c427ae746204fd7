package com.example.schoolops.config;

import com.example.schoolops.engine.AbsenceAnalyzer;
import com.example.schoolops.engine.AttendanceRecordEngine;
import com.example.schoolops.engine.ConflictChecker;
import com.example.schoolops.engine.RosterMatcher;
import com.example.schoolops.engine.ScheduleEditor;
import com.example.schoolops.engine.SessionCompletionTracker;
import com.example.schoolops.engine.SubstitutionManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the framework-free engine components as beans.
 */
@Configuration
public class EngineConfig {

    @Bean
    public ConflictChecker conflictChecker() {
        return new ConflictChecker();
    }

    @Bean
    public ScheduleEditor scheduleEditor(ConflictChecker conflictChecker) {
        return new ScheduleEditor(conflictChecker);
    }

    @Bean
    public SubstitutionManager substitutionManager(ConflictChecker conflictChecker) {
        return new SubstitutionManager(conflictChecker);
    }

    @Bean
    public AttendanceRecordEngine attendanceRecordEngine() {
        return new AttendanceRecordEngine();
    }

    @Bean
    public RosterMatcher rosterMatcher() {
        return new RosterMatcher();
    }

    @Bean
    public SessionCompletionTracker sessionCompletionTracker(RosterMatcher rosterMatcher) {
        return new SessionCompletionTracker(rosterMatcher);
    }

    @Bean
    public AbsenceAnalyzer absenceAnalyzer(RosterMatcher rosterMatcher) {
        return new AbsenceAnalyzer(rosterMatcher);
    }
}
