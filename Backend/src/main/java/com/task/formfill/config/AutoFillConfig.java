package com.task.formfill.config;

import com.task.formfill.service.autofill.MatchingTables;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AutoFillConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public MatchingTables matchingTables(
            @Value("${formfill.autofill.exact-confidence:0.95}") double exact,
            @Value("${formfill.autofill.synonym-confidence:0.8}") double synonym,
            @Value("${formfill.autofill.fuzzy-threshold:0.7}") double fuzzyThreshold,
            @Value("${formfill.autofill.saved-date-confidence:0.9}") double savedDate,
            @Value("${formfill.autofill.household.relationship-weight:0.8}") double relationship,
            @Value("${formfill.autofill.household.minor-weight:0.6}") double minor,
            @Value("${formfill.autofill.household.spouse-weight:0.9}") double spouse,
            @Value("${formfill.autofill.household.minimum-score:0.5}") double minimum
    ) {
        return MatchingTables.withScores(
                new MatchingTables.Confidences(exact, synonym, fuzzyThreshold, savedDate),
                new MatchingTables.HouseholdWeights(relationship, minor, spouse, minimum));
    }
}
