package com.example.payrollarea.profile;

/**
 * ML = Mainland, HI = Hawaii, PR = Puerto Rico, IO = International Office.
 */
public enum TimeZoneCode {
    ML,
    HI,
    PR,
    IO
}
