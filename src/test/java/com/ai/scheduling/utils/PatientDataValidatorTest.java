package com.ai.scheduling.utils;

import com.ai.scheduling.entity.InsuranceType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PatientDataValidatorTest {

    @Test
    void nationalId_requiresElevenDigits() {
        assertTrue(PatientDataValidator.isValidNationalId("12345678900"));
        assertTrue(PatientDataValidator.isValidNationalId(" 123.456.789-00 "));
        assertFalse(PatientDataValidator.isValidNationalId("123"));
        assertFalse(PatientDataValidator.isValidNationalId("123456789001"));
        assertFalse(PatientDataValidator.isValidNationalId("1234567890a"));
        assertFalse(PatientDataValidator.isValidNationalId(""));
        assertFalse(PatientDataValidator.isValidNationalId(null));
    }

    @Test
    void nationalId_rejectsNonAsciiDigits() {
        // Arabic-Indic and fullwidth digits are Character.isDigit but not a CPF
        assertFalse(PatientDataValidator.isValidNationalId("\u0661\u0662\u0663\u0664\u0665\u0666\u0667\u0668\u0669\u0660\u0660"));
        assertFalse(PatientDataValidator.isValidNationalId("\uFF11\uFF12\uFF13\uFF14\uFF15\uFF16\uFF17\uFF18\uFF19\uFF10\uFF10"));
    }

    @Test
    void normalizeNationalId_stripsPunctuation() {
        assertEquals("12345678900", PatientDataValidator.normalizeNationalId("123.456.789-00"));
        assertNull(PatientDataValidator.normalizeNationalId(null));
    }

    @Test
    void dateOfBirth_acceptsBrazilianAndIsoFormats() {
        assertEquals(Optional.of(LocalDate.of(1990, 3, 15)), PatientDataValidator.parseDateOfBirth("15/03/1990"));
        assertEquals(Optional.of(LocalDate.of(1990, 3, 15)), PatientDataValidator.parseDateOfBirth("1990-03-15"));
        assertEquals(Optional.of(LocalDate.of(2000, 2, 29)), PatientDataValidator.parseDateOfBirth("29/02/2000"));
    }

    @Test
    void dateOfBirth_rejectsGarbageAndImpossibleDates() {
        assertTrue(PatientDataValidator.parseDateOfBirth("30/02/1990").isEmpty());
        assertTrue(PatientDataValidator.parseDateOfBirth("1990-13-01").isEmpty());
        assertTrue(PatientDataValidator.parseDateOfBirth("03-15-1990").isEmpty());
        assertTrue(PatientDataValidator.parseDateOfBirth("yesterday").isEmpty());
        assertTrue(PatientDataValidator.parseDateOfBirth(" ").isEmpty());
        assertTrue(PatientDataValidator.parseDateOfBirth(null).isEmpty());
    }

    @Test
    void name_needsThreeCharacters() {
        assertTrue(PatientDataValidator.isValidName("Ana"));
        assertFalse(PatientDataValidator.isValidName("  Al  "));
        assertFalse(PatientDataValidator.isValidName(null));
    }

    @Test
    void insuranceType_defaultsToPrivatePay() {
        assertEquals(InsuranceType.HEALTH_PLAN, InsuranceType.fromValue(" health_plan "));
        assertEquals(InsuranceType.PRIVATE_PAY, InsuranceType.fromValue("PRIVATE_PAY"));
        assertEquals(InsuranceType.PRIVATE_PAY, InsuranceType.fromValue("PARTICULAR"));
        assertEquals(InsuranceType.PRIVATE_PAY, InsuranceType.fromValue(null));
    }
}
