package com.task.formfill.service.autofill;

import com.task.formfill.model.UserContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local user context store. Used when no persistent store is wired in, and by tests.
 */
@Component
public class InMemoryUserContextStore implements UserContextProvider, ProfileWriter {

    private static final Logger log = LoggerFactory.getLogger(InMemoryUserContextStore.class);

    private final Map<String, UserContext> contexts = new ConcurrentHashMap<>();

    public void put(String userId, UserContext context) {
        contexts.put(userId, context);
    }

    @Override
    public UserContext fetch(String userId, String householdMemberId) {
        UserContext context = contexts.getOrDefault(userId, UserContext.empty());
        if (householdMemberId == null || householdMemberId.isBlank()) {
            return context;
        }
        List<UserContext.HouseholdMember> members = context.householdMembers().stream()
                .filter(m -> householdMemberId.equals(m.id()))
                .toList();
        if (members.isEmpty()) {
            log.warn("Household member {} not found for user {}", householdMemberId, userId);
        }
        return new UserContext(context.profile(), members, context.savedDates());
    }

    @Override
    public void saveAttribute(String userId, String attribute, Object value) {
        contexts.compute(userId, (id, current) -> {
            UserContext ctx = current == null ? UserContext.empty() : current;
            UserContext.Profile p = profileOf(id, ctx);
            String text = value == null ? null : value.toString();
            UserContext.Profile updated = switch (attribute) {
                case "full_name" -> new UserContext.Profile(p.id(), text, p.email(), p.phone(), p.dateOfBirth(), p.address(), p.customFields());
                case "email" -> new UserContext.Profile(p.id(), p.fullName(), text, p.phone(), p.dateOfBirth(), p.address(), p.customFields());
                case "phone" -> new UserContext.Profile(p.id(), p.fullName(), p.email(), text, p.dateOfBirth(), p.address(), p.customFields());
                case "date_of_birth" -> new UserContext.Profile(p.id(), p.fullName(), p.email(), p.phone(), text, p.address(), p.customFields());
                default -> throw new IllegalArgumentException("Unknown profile attribute: " + attribute);
            };
            return new UserContext(updated, ctx.householdMembers(), ctx.savedDates());
        });
    }

    @Override
    public void saveCustomField(String userId, String key, Object value) {
        contexts.compute(userId, (id, current) -> {
            UserContext ctx = current == null ? UserContext.empty() : current;
            UserContext.Profile p = profileOf(id, ctx);
            Map<String, Object> custom = new LinkedHashMap<>(p.customFields());
            custom.put(key, value);
            UserContext.Profile updated = new UserContext.Profile(p.id(), p.fullName(), p.email(), p.phone(),
                    p.dateOfBirth(), p.address(), custom);
            return new UserContext(updated, ctx.householdMembers(), ctx.savedDates());
        });
    }

    private static UserContext.Profile profileOf(String userId, UserContext ctx) {
        return ctx.profile() != null ? ctx.profile()
                : new UserContext.Profile(userId, null, null, null, null, null, null);
    }
}
