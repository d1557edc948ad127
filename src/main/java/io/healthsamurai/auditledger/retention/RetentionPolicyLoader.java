package io.healthsamurai.auditledger.retention;

import io.healthsamurai.auditledger.model.EventType;
import io.healthsamurai.auditledger.model.Sensitivity;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads retention tiers from YAML configuration file.
 */
public class RetentionPolicyLoader {

    private static final Logger log = LoggerFactory.getLogger(RetentionPolicyLoader.class);
    private static final String POLICY_FILE = "/retention-policy.yaml";
    private static final String INDEFINITE_VALUE = "indefinite";

    private RetentionPolicyLoader() {
        // Utility class
    }

    /**
     * Loads the retention policy from the bundled YAML file, or the compiled defaults if the file
     * is missing or malformed.
     */
    public static RetentionPolicy loadRetentionPolicy() {
        try (InputStream inputStream = RetentionPolicyLoader.class.getResourceAsStream(POLICY_FILE)) {
            if (inputStream == null) {
                log.warn("Retention policy file {} not found, using default tiers", POLICY_FILE);
                return RetentionPolicy.defaults();
            }
            return parse(inputStream);
        } catch (Exception e) {
            log.error("Failed to load retention policy from YAML file: {}", e.getMessage(), e);
            return RetentionPolicy.defaults();
        }
    }

    /**
     * Parses a retention policy document.
     *
     * @param inputStream YAML with a {@code rules} list and a {@code defaultDays} value
     * @return The parsed policy
     * @throws IllegalArgumentException if a rule is incomplete or names an unknown enum constant
     */
    public static RetentionPolicy parse(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> data = yaml.load(inputStream);
        if (data == null) {
            throw new IllegalArgumentException("Retention policy document is empty");
        }

        List<RetentionRule> rules = new ArrayList<>();

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> ruleList = (List<Map<String, Object>>) data.get("rules");
        if (ruleList != null) {
            for (Map<String, Object> ruleData : ruleList) {
                String name = (String) ruleData.get("name");
                Set<Sensitivity> sensitivities = toEnumSet(ruleData.get("sensitivities"), Sensitivity.class);
                Set<EventType> eventTypes = toEnumSet(ruleData.get("eventTypes"), EventType.class);
                int days = toDays(ruleData.get("days"), name);
                rules.add(new RetentionRule(name, sensitivities, eventTypes, days));
            }
        }

        int defaultDays = toDays(data.get("defaultDays"), "default");
        log.info("Loaded {} retention rules from YAML, default {} days", rules.size(), defaultDays);
        return new RetentionPolicy(rules, defaultDays);
    }

    private static int toDays(Object value, String ruleName) {
        if (value == null) {
            throw new IllegalArgumentException("Retention rule '" + ruleName + "' has no days");
        }
        if (INDEFINITE_VALUE.equalsIgnoreCase(value.toString())) {
            return RetentionPolicyResolver.INDEFINITE;
        }
        if (value instanceof Number number && number.intValue() > 0) {
            return number.intValue();
        }
        throw new IllegalArgumentException("Retention rule '" + ruleName + "' has invalid days: " + value);
    }

    private static <E extends Enum<E>> Set<E> toEnumSet(Object value, Class<E> type) {
        Set<E> result = EnumSet.noneOf(type);
        if (value instanceof List<?> list) {
            for (Object item : list) {
                result.add(Enum.valueOf(type, item.toString().trim().toUpperCase()));
            }
        }
        return result;
    }
}
