package com.task.formfill.service.autofill;

import com.task.formfill.model.UserContext;

public interface UserContextProvider {

    /**
     * Read-only snapshot of the user's profile, household and saved dates. When
     * {@code householdMemberId} is non-null only that member is included.
     */
    UserContext fetch(String userId, String householdMemberId);
}
