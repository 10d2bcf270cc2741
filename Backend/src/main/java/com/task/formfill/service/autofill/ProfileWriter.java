package com.task.formfill.service.autofill;

/**
 * Write-back target for values the user chose to keep on their profile.
 */
public interface ProfileWriter {

    /** Updates one of the top-level profile attributes ({@code full_name}, {@code email}, ...). */
    void saveAttribute(String userId, String attribute, Object value);

    void saveCustomField(String userId, String key, Object value);
}
