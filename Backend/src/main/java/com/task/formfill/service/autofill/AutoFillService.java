package com.task.formfill.service.autofill;

import com.task.formfill.model.AutoFillResult;
import com.task.formfill.model.ClassifiedField;
import com.task.formfill.model.FieldMapping;
import com.task.formfill.model.FieldType;
import com.task.formfill.model.MappingSource;
import com.task.formfill.model.UserContext;
import com.task.formfill.service.ProcessingException;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a value for every classified field from the user's stored context. Strategies run
 * in a fixed order (profile, saved date, household member) and the first hit wins; fields with
 * no hit get an empty manual mapping.
 */
@Service
public class AutoFillService {

    private static final Logger log = LoggerFactory.getLogger(AutoFillService.class);

    private static final Map<String, String> PROFILE_ATTRIBUTES = Map.of(
            "name", "full_name",
            "full_name", "full_name",
            "email", "email",
            "phone", "phone",
            "date_of_birth", "date_of_birth",
            "dob", "date_of_birth"
    );

    private final UserContextProvider contextProvider;
    private final ProfileWriter profileWriter;
    private final MatchingTables tables;
    private final Clock clock;
    private final Tracer tracer;

    public AutoFillService(
            UserContextProvider contextProvider,
            ProfileWriter profileWriter,
            MatchingTables tables,
            Clock clock,
            Tracer tracer
    ) {
        this.contextProvider = contextProvider;
        this.profileWriter = profileWriter;
        this.tables = tables;
        this.clock = clock;
        this.tracer = tracer;
    }

    public AutoFillResult autoFill(List<ClassifiedField> fields, String userId, String householdMemberId) {
        if (userId == null || userId.isBlank()) {
            throw ProcessingException.validation("user_id is required");
        }

        Span span = tracer.spanBuilder("autofill.resolve")
                .setAttribute("fields.count", fields == null ? 0 : fields.size())
                .startSpan();
        try (Scope ignored = span.makeCurrent()) {
            UserContext context = contextProvider.fetch(userId, householdMemberId);
            AutoFillResult result = resolve(fields, context == null ? UserContext.empty() : context);
            span.setAttribute("fields.filled", result.autoFilledCount());
            log.info("Auto-filled {} of {} fields for user {}", result.autoFilledCount(), result.totalFields(), userId);
            return result;
        } finally {
            span.end();
        }
    }

    /** Exactly one mapping per field, in field order. */
    public AutoFillResult resolve(List<ClassifiedField> fields, UserContext context) {
        List<FieldMapping> mappings = new ArrayList<>();
        if (fields != null) {
            for (ClassifiedField field : fields) {
                mappings.add(mapField(field, context));
            }
        }
        return AutoFillResult.of(mappings);
    }

    /**
     * Replaces whatever was computed for {@code field} with the user's own value, optionally
     * storing it on the profile.
     */
    public FieldMapping applyManualEdit(String userId, ClassifiedField field, Object value, boolean saveToProfile) {
        if (field == null || field.id() == null) {
            throw ProcessingException.validation("field is required");
        }
        if (saveToProfile) {
            if (userId == null || userId.isBlank()) {
                throw ProcessingException.validation("user_id is required to save to profile");
            }
            writeBack(userId, field.key(), value);
        }
        return FieldMapping.manual(field.id(), value);
    }

    void writeBack(String userId, String fieldKey, Object value) {
        String key = FieldKeys.normalize(fieldKey);
        String attribute = PROFILE_ATTRIBUTES.get(key);
        if (attribute != null) {
            profileWriter.saveAttribute(userId, attribute, value);
        } else {
            profileWriter.saveCustomField(userId, key, value);
        }
        log.debug("Saved {} to profile of user {}", key, userId);
    }

    FieldMapping mapField(ClassifiedField field, UserContext context) {
        String key = FieldKeys.normalize(field.key());

        return matchProfile(key, field, context)
                .or(() -> matchSavedDate(key, field, context))
                .or(() -> matchHousehold(key, field, context))
                .orElseGet(() -> FieldMapping.unresolved(field.id()));
    }

    private Optional<FieldMapping> matchProfile(String key, ClassifiedField field, UserContext context) {
        UserContext.Profile profile = context.profile();
        if (profile == null || key.isEmpty()) return Optional.empty();

        Map<String, Object> values = flatten(profile);
        MatchingTables.Confidences conf = tables.confidences();

        if (values.containsKey(key)) {
            return Optional.of(profileMapping(field, key, values.get(key), profile, conf.exact()));
        }

        for (Map.Entry<String, List<String>> entry : tables.synonyms().entrySet()) {
            if (entry.getValue().contains(key) && values.containsKey(entry.getKey())) {
                return Optional.of(profileMapping(field, entry.getKey(), values.get(entry.getKey()), profile, conf.synonym()));
            }
        }

        String bestKey = null;
        double bestScore = 0;
        for (String candidate : values.keySet()) {
            double score = StringSimilarity.similarity(key, candidate);
            if (score > conf.fuzzyThreshold() && score > bestScore) {
                bestScore = score;
                bestKey = candidate;
            }
        }
        if (bestKey != null) {
            return Optional.of(profileMapping(field, bestKey, values.get(bestKey), profile, bestScore));
        }
        return Optional.empty();
    }

    private FieldMapping profileMapping(ClassifiedField field, String sourceKey, Object value,
                                        UserContext.Profile profile, double confidence) {
        return new FieldMapping(field.id(), displayValue(field, sourceKey, value), MappingSource.PROFILE,
                profile.id(), cap(confidence));
    }

    /**
     * Profile scalars, address parts (plus the joined address) and custom fields keyed by their
     * normalized name. Blank values are left out.
     */
    static Map<String, Object> flatten(UserContext.Profile profile) {
        Map<String, Object> values = new LinkedHashMap<>();
        put(values, "name", profile.fullName());
        put(values, "full_name", profile.fullName());
        put(values, "email", profile.email());
        put(values, "phone", profile.phone());
        put(values, "date_of_birth", profile.dateOfBirth());

        Map<String, String> address = profile.address();
        if (!address.isEmpty()) {
            String joined = String.join(" ",
                    nonNull(address.get("street")), nonNull(address.get("city")),
                    nonNull(address.get("state")), nonNull(address.get("zip"))).trim().replaceAll("\\s+", " ");
            put(values, "address", joined);
            put(values, "street", address.get("street"));
            put(values, "city", address.get("city"));
            put(values, "state", address.get("state"));
            put(values, "zip", address.get("zip"));
            put(values, "zipcode", address.get("zip"));
            put(values, "postal_code", address.get("zip"));
        }

        profile.customFields().forEach((k, v) -> put(values, FieldKeys.normalize(k), v));
        return values;
    }

    private Optional<FieldMapping> matchSavedDate(String key, ClassifiedField field, UserContext context) {
        if (field.type() != FieldType.DATE) return Optional.empty();
        double resolverConfidence = tables.confidences().savedDate();

        for (Map.Entry<String, String> resolver : tables.dateKeywords().entrySet()) {
            if (!mentions(key, resolver.getKey())) continue;

            if (MatchingTables.TODAY.equals(resolver.getKey())) {
                String today = DateValues.DISPLAY.format(LocalDate.now(clock));
                return Optional.of(new FieldMapping(field.id(), today, MappingSource.SAVED_DATE, null, resolverConfidence));
            }
            String keyword = resolver.getValue();
            for (UserContext.SavedDate saved : context.savedDates()) {
                if (saved.label() != null && saved.value() != null
                        && saved.label().toLowerCase(Locale.ROOT).contains(keyword)) {
                    return Optional.of(new FieldMapping(field.id(), DateValues.format(saved.value()),
                            MappingSource.SAVED_DATE, saved.id(), resolverConfidence));
                }
            }
        }

        UserContext.SavedDate best = null;
        double bestScore = 0;
        for (UserContext.SavedDate saved : context.savedDates()) {
            if (saved.value() == null) continue;
            double score = StringSimilarity.similarity(key, FieldKeys.normalize(saved.label()));
            if (score > tables.confidences().fuzzyThreshold() && score > bestScore) {
                bestScore = score;
                best = saved;
            }
        }
        if (best != null) {
            return Optional.of(new FieldMapping(field.id(), DateValues.format(best.value()),
                    MappingSource.SAVED_DATE, best.id(), cap(bestScore)));
        }
        return Optional.empty();
    }

    /** The key contains the resolver name or one of its synonyms. */
    private boolean mentions(String key, String resolver) {
        if (key.contains(resolver)) return true;
        List<String> synonyms = tables.synonyms().getOrDefault(resolver, List.of());
        for (String s : synonyms) {
            if (key.contains(s)) return true;
        }
        return false;
    }

    private Optional<FieldMapping> matchHousehold(String key, ClassifiedField field, UserContext context) {
        if (context.householdMembers().isEmpty()) return Optional.empty();

        String label = field.label().toLowerCase(Locale.ROOT);
        boolean indicated = tables.relationshipIndicators().stream()
                .anyMatch(indicator -> key.contains(indicator) || label.contains(indicator));
        if (!indicated) return Optional.empty();

        UserContext.HouseholdMember best = null;
        double bestScore = 0;
        for (UserContext.HouseholdMember member : context.householdMembers()) {
            double score = scoreMember(key, member);
            if (score > bestScore) {
                bestScore = score;
                best = member;
            }
        }
        if (best == null || bestScore <= tables.householdWeights().minimum()) return Optional.empty();

        Object value = memberValue(key, best);
        if (value == null || (value instanceof String s && s.isBlank())) return Optional.empty();
        return Optional.of(new FieldMapping(field.id(), value, MappingSource.HOUSEHOLD_MEMBER, best.id(), bestScore));
    }

    double scoreMember(String key, UserContext.HouseholdMember member) {
        MatchingTables.HouseholdWeights w = tables.householdWeights();
        String relationship = member.relationship() == null ? "" : member.relationship().toLowerCase(Locale.ROOT).trim();
        double score = 0;

        if (!relationship.isEmpty() && key.contains(relationship)) {
            score += w.relationship();
        }
        if (key.contains("child") || key.contains("minor")) {
            Integer age = ageOf(member.dateOfBirth());
            if (age != null && age < 18) score += w.minor();
        }
        if (key.contains("spouse") && relationship.equals("spouse")) {
            score += w.spouse();
        }
        return cap(score);
    }

    private static Object memberValue(String key, UserContext.HouseholdMember member) {
        if (key.contains("name")) return member.name();
        if (key.contains("birth") || key.contains("dob")) {
            return member.dateOfBirth() == null ? null : DateValues.format(member.dateOfBirth());
        }
        if (key.contains("relationship")) return member.relationship();
        for (Map.Entry<String, Object> e : member.customFields().entrySet()) {
            if (FieldKeys.normalize(e.getKey()).equals(key)) return e.getValue();
        }
        return null;
    }

    Integer ageOf(String dateOfBirth) {
        return DateValues.parse(dateOfBirth)
                .map(dob -> Period.between(dob, LocalDate.now(clock)).getYears())
                .orElse(null);
    }

    private static Object displayValue(ClassifiedField field, String sourceKey, Object value) {
        if (value instanceof String s && (field.type() == FieldType.DATE || sourceKey.contains("birth"))) {
            return DateValues.format(s);
        }
        return value;
    }

    private static void put(Map<String, Object> values, String key, Object value) {
        if (key == null || key.isEmpty() || value == null) return;
        if (value instanceof String s && s.isBlank()) return;
        values.putIfAbsent(key, value);
    }

    private static String nonNull(String s) {
        return s == null ? "" : s;
    }

    private static double cap(double confidence) {
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
