package com.task.formfill.service.autofill;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup tables and scoring constants used while resolving field values. Built once at
 * start-up and shared read-only between requests.
 */
public final class MatchingTables {

    /** Date resolver that always yields the current date instead of scanning saved dates. */
    public static final String TODAY = "today";

    private final Map<String, List<String>> synonyms;
    private final Map<String, String> dateKeywords;
    private final List<String> profileVocabulary;
    private final List<String> relationshipIndicators;
    private final Confidences confidences;
    private final HouseholdWeights householdWeights;

    public MatchingTables(
            Map<String, List<String>> synonyms,
            Map<String, String> dateKeywords,
            List<String> profileVocabulary,
            List<String> relationshipIndicators,
            Confidences confidences,
            HouseholdWeights householdWeights
    ) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        synonyms.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        this.synonyms = Collections.unmodifiableMap(copy);
        this.dateKeywords = Collections.unmodifiableMap(new LinkedHashMap<>(dateKeywords));
        this.profileVocabulary = List.copyOf(profileVocabulary);
        this.relationshipIndicators = List.copyOf(relationshipIndicators);
        this.confidences = confidences;
        this.householdWeights = householdWeights;
    }

    public static MatchingTables defaults() {
        return withScores(Confidences.defaults(), HouseholdWeights.defaults());
    }

    public static MatchingTables withScores(Confidences confidences, HouseholdWeights weights) {
        return new MatchingTables(defaultSynonyms(), defaultDateKeywords(), defaultProfileVocabulary(),
                List.of("child", "spouse", "dependent", "family", "guardian", "parent"),
                confidences, weights);
    }

    /** Canonical profile key to the alternate spellings seen on real forms. */
    public Map<String, List<String>> synonyms() {
        return synonyms;
    }

    /**
     * Semantic date resolvers in evaluation order: resolver key to the keyword searched for in
     * saved-date labels. {@link #TODAY} maps to an empty keyword.
     */
    public Map<String, String> dateKeywords() {
        return dateKeywords;
    }

    public List<String> profileVocabulary() {
        return profileVocabulary;
    }

    public List<String> relationshipIndicators() {
        return relationshipIndicators;
    }

    public Confidences confidences() {
        return confidences;
    }

    public HouseholdWeights householdWeights() {
        return householdWeights;
    }

    public record Confidences(double exact, double synonym, double fuzzyThreshold, double savedDate) {
        public static Confidences defaults() {
            return new Confidences(0.95, 0.8, 0.7, 0.9);
        }
    }

    public record HouseholdWeights(double relationship, double minor, double spouse, double minimum) {
        public static HouseholdWeights defaults() {
            return new HouseholdWeights(0.8, 0.6, 0.9, 0.5);
        }
    }

    private static Map<String, List<String>> defaultSynonyms() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("name", List.of("full_name", "patient_name", "client_name", "student_name", "applicant_name", "member_name"));
        m.put("first_name", List.of("fname", "given_name", "first", "firstname"));
        m.put("last_name", List.of("lname", "surname", "family_name", "last", "lastname"));

        m.put("email", List.of("email_address", "e_mail", "electronic_mail", "contact_email"));
        m.put("phone", List.of("phone_number", "telephone", "mobile", "cell", "contact_number", "primary_phone"));

        m.put("address", List.of("street_address", "home_address", "mailing_address", "residence"));
        m.put("street", List.of("street_address", "address_line_1", "addr1"));
        m.put("city", List.of("city_name", "town"));
        m.put("state", List.of("state_province", "province", "region"));
        m.put("zip", List.of("zip_code", "postal_code", "zipcode"));

        m.put("date_of_birth", List.of("dob", "birth_date", "birthdate", "born"));
        m.put(TODAY, List.of("current_date", "todays_date", "date_signed", "signature_date"));

        m.put("patient", List.of("client", "member", "individual"));
        m.put("guardian", List.of("parent", "legal_guardian", "responsible_party"));
        m.put("emergency_contact", List.of("emergency", "contact_person", "in_case_of_emergency"));

        m.put("ssn", List.of("social_security_number", "social_security", "tax_id"));
        m.put("insurance", List.of("insurance_number", "policy_number", "member_id"));
        return m;
    }

    private static Map<String, String> defaultDateKeywords() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put(TODAY, "");
        m.put("date_of_birth", "birth");
        m.put("immunization_date", "immunization");
        m.put("appointment_date", "appointment");
        return m;
    }

    private static List<String> defaultProfileVocabulary() {
        return List.of("name", "first_name", "last_name", "full_name", "email", "phone", "address",
                "date_of_birth", "ssn", "social_security", "emergency_contact");
    }
}
