package com.example.schoolops.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "schoolops")
public class SchoolOpsProperties {

    // e.g. "1445-1446"; new slots are tagged with it when the request carries none
    private String academicYear;
    private List<String> classGrades = new ArrayList<>();
    // teachers offered as substitutes in addition to those already on the schedule
    private List<String> teachers = new ArrayList<>();
    private List<ApiUser> users = new ArrayList<>();
    private Demo demo = new Demo();

    public String getAcademicYear() {
        return academicYear;
    }

    public void setAcademicYear(String academicYear) {
        this.academicYear = academicYear;
    }

    public List<String> getClassGrades() {
        return classGrades;
    }

    public void setClassGrades(List<String> classGrades) {
        this.classGrades = classGrades == null ? new ArrayList<>() : classGrades;
    }

    public List<String> getTeachers() {
        return teachers;
    }

    public void setTeachers(List<String> teachers) {
        this.teachers = teachers == null ? new ArrayList<>() : teachers;
    }

    public List<ApiUser> getUsers() {
        return users;
    }

    public void setUsers(List<ApiUser> users) {
        this.users = users == null ? new ArrayList<>() : users;
    }

    public Demo getDemo() {
        return demo;
    }

    public void setDemo(Demo demo) {
        this.demo = demo == null ? new Demo() : demo;
    }

    /**
     * Schedule name of the account {@code username}; the username itself when none is configured.
     */
    public String teacherNameFor(String username) {
        for (ApiUser u : users) {
            if (u.getUsername() != null && u.getUsername().equals(username)
                    && u.getTeacher() != null && !u.getTeacher().isBlank()) {
                return u.getTeacher().trim();
            }
        }
        return username;
    }

    public static class ApiUser {
        private String username;
        private String password;
        private List<String> roles = new ArrayList<>();
        // name used on the schedule, for accounts that belong to a teacher
        private String teacher;

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public List<String> getRoles() {
            return roles;
        }

        public void setRoles(List<String> roles) {
            this.roles = roles == null ? new ArrayList<>() : roles;
        }

        public String getTeacher() {
            return teacher;
        }

        public void setTeacher(String teacher) {
            this.teacher = teacher;
        }
    }

    public static class Demo {
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
