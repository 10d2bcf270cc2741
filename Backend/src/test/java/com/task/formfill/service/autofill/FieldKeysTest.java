package com.task.formfill.service.autofill;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FieldKeysTest {

    @Test
    public void normalizesPunctuationAndCase() {
        assertEquals("patient_s_name", FieldKeys.normalize("  Patient's  Name: "));
        assertEquals("date_of_birth", FieldKeys.normalize("Date--of--Birth"));
        assertEquals("", FieldKeys.normalize("***"));
        assertEquals("", FieldKeys.normalize(null));
    }
}
