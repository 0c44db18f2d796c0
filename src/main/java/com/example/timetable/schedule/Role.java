package com.example.timetable.schedule;

public enum Role {
    HOMEROOM("H"),
    KOREAN("K"),
    FOREIGN("F"),
    EXAM("EXAM");

    private final String code;

    Role(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isTeaching() {
        return this != EXAM;
    }
}
