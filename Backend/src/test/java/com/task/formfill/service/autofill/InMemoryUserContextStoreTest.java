package com.task.formfill.service.autofill;

import com.task.formfill.model.UserContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryUserContextStoreTest {

    private final InMemoryUserContextStore store = new InMemoryUserContextStore();

    @Test
    public void unknownUserHasEmptyContext() {
        UserContext ctx = store.fetch("nobody", null);

        assertNull(ctx.profile());
        assertTrue(ctx.householdMembers().isEmpty());
        assertTrue(ctx.savedDates().isEmpty());
    }

    @Test
    public void householdMemberIdNarrowsContext() {
        store.put("u1", new UserContext(null, List.of(
                new UserContext.HouseholdMember("m1", "John", null, "spouse", null),
                new UserContext.HouseholdMember("m2", "Lily", null, "child", null)), List.of()));

        assertEquals(2, store.fetch("u1", null).householdMembers().size());
        List<UserContext.HouseholdMember> narrowed = store.fetch("u1", "m2").householdMembers();
        assertEquals(1, narrowed.size());
        assertEquals("Lily", narrowed.get(0).name());
    }

    @Test
    public void writeBackUpdatesProfile() {
        store.saveAttribute("u1", "full_name", "Jane Doe");
        store.saveAttribute("u1", "email", "jane@example.com");
        store.saveCustomField("u1", "allergies", "Peanuts");

        UserContext.Profile profile = store.fetch("u1", null).profile();
        assertEquals("Jane Doe", profile.fullName());
        assertEquals("jane@example.com", profile.email());
        assertEquals(Map.of("allergies", "Peanuts"), profile.customFields());
    }

    @Test
    public void unknownAttributeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.saveAttribute("u1", "shoe_size", "9"));
    }
}
