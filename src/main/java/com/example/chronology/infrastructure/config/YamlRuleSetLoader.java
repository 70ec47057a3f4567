package com.example.chronology.infrastructure.config;

import com.example.chronology.domain.model.DateOrder;
import com.example.chronology.domain.model.EventType;
import com.example.chronology.domain.model.RuleSet;
import com.example.chronology.infrastructure.exception.RuleConfigurationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads the rule YAML and compiles it into an immutable {@link RuleSet}.
 * Every problem is reported as a {@link RuleConfigurationException}; there are no silent defaults for
 * the required keys.
 */
public class YamlRuleSetLoader {

    private static final Logger log = LoggerFactory.getLogger(YamlRuleSetLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final String DATE_ORDER_KEY = "DATE_ORDER";

    /**
     * Loads and compiles the rule file.
     *
     * @param resource rule file location
     * @return compiled rule set
     * @throws RuleConfigurationException when the file is missing, unreadable or invalid
     */
    public RuleSet load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new RuleConfigurationException("Rule file not found: " + describe(resource));
        }
        RuleFileDocument document;
        try (InputStream in = resource.getInputStream()) {
            document = YAML_MAPPER.readValue(in, RuleFileDocument.class);
        } catch (IOException e) {
            throw new RuleConfigurationException("Unable to read rule file " + describe(resource), e);
        }
        if (document == null) {
            throw new RuleConfigurationException("Rule file is empty: " + describe(resource));
        }
        RuleSet ruleSet = compile(document);
        log.info("Loaded rules from {}: {} section patterns, {} date patterns, {} event labels",
                describe(resource),
                ruleSet.sectionPatterns().size(),
                ruleSet.datePatterns().size(),
                ruleSet.eventPatterns().size());
        return ruleSet;
    }

    RuleSet compile(RuleFileDocument document) {
        List<Pattern> sectionPatterns = compileAll("section_patterns", require("section_patterns", document.sectionPatterns()));
        List<Pattern> datePatterns = compileAll("date_patterns", require("date_patterns", document.datePatterns()));

        Map<String, List<String>> rawEvents = document.events();
        if (rawEvents == null || rawEvents.isEmpty()) {
            throw new RuleConfigurationException("Missing required key 'events'");
        }
        Map<EventType, List<Pattern>> eventPatterns = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : rawEvents.entrySet()) {
            EventType type = EventType.fromLabelOrNull(entry.getKey());
            if (type == null) {
                throw new RuleConfigurationException("Unknown event label in 'events': " + entry.getKey());
            }
            if (eventPatterns.containsKey(type)) {
                throw new RuleConfigurationException("Duplicate event label in 'events': " + entry.getKey());
            }
            List<String> patterns = entry.getValue() == null ? List.of() : entry.getValue();
            eventPatterns.put(type, compileAll("events." + entry.getKey(), patterns));
        }

        List<Locale> languages = new ArrayList<>();
        DateOrder dateOrder = DateOrder.DMY;
        RuleFileDocument.DateParserSection dateParser = document.dateParser();
        if (dateParser != null) {
            if (dateParser.languages() != null) {
                dateParser.languages().stream()
                        .filter(language -> language != null && !language.isBlank())
                        .map(language -> Locale.forLanguageTag(language.trim()))
                        .forEach(languages::add);
            }
            if (dateParser.settings() != null && dateParser.settings().get(DATE_ORDER_KEY) != null) {
                dateOrder = parseDateOrder(dateParser.settings().get(DATE_ORDER_KEY));
            }
        }

        boolean lineBreakIsBoundary = document.lineBreakIsBoundary() == null || document.lineBreakIsBoundary();
        List<String> delimiters = document.sentenceDelimiters() == null
                ? List.of(".")
                : document.sentenceDelimiters().stream().filter(d -> d != null && !d.isEmpty()).toList();

        return new RuleSet(sectionPatterns, datePatterns, eventPatterns, languages, dateOrder,
                lineBreakIsBoundary, delimiters);
    }

    private List<String> require(String key, List<String> values) {
        if (values == null || values.isEmpty()) {
            throw new RuleConfigurationException("Missing required key '" + key + "'");
        }
        return values;
    }

    private List<Pattern> compileAll(String key, List<String> expressions) {
        List<Pattern> compiled = new ArrayList<>(expressions.size());
        for (String expression : expressions) {
            if (expression == null || expression.isEmpty()) {
                throw new RuleConfigurationException("Empty pattern under '" + key + "'");
            }
            try {
                compiled.add(Pattern.compile(expression, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
            } catch (PatternSyntaxException e) {
                throw new RuleConfigurationException("Invalid pattern under '" + key + "': " + expression, e);
            }
        }
        return compiled;
    }

    private DateOrder parseDateOrder(String value) {
        try {
            return DateOrder.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RuleConfigurationException("Unsupported DATE_ORDER: " + value, e);
        }
    }

    private String describe(Resource resource) {
        return resource == null ? "<none>" : resource.getDescription();
    }
}
