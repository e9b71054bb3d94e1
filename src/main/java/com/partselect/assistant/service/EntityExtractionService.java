package com.partselect.assistant.service;

import com.partselect.assistant.model.Entities;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a part number and an appliance model number out of free text.
 */
@Service
public class EntityExtractionService {

    // PartSelect and OEM prefixes followed by a bounded digit run, e.g. PS11752778, WP2188656
    static final Pattern PART_PATTERN =
            Pattern.compile("\\b(PS|AP|WP|WR|WD|DA|W10|W11|242|530)\\d{6,10}\\b", Pattern.CASE_INSENSITIVE);
    static final Pattern MODEL_PATTERN = Pattern.compile("\\b(\\w{3,}\\d{3,}\\w*)\\b");

    public Entities extract(String text) {
        if (!StringUtils.hasText(text)) {
            return Entities.empty();
        }
        Matcher partMatcher = PART_PATTERN.matcher(text);
        String part = partMatcher.find() ? partMatcher.group().toUpperCase(Locale.ROOT) : null;

        String model = null;
        Matcher modelMatcher = MODEL_PATTERN.matcher(text);
        while (modelMatcher.find()) {
            String candidate = modelMatcher.group(1);
            if (part != null && candidate.equalsIgnoreCase(part)) {
                continue;
            }
            // strictly longer only, so the earliest of equal-length candidates stays
            if (model == null || candidate.length() > model.length()) {
                model = candidate;
            }
        }
        return new Entities(part, model == null ? null : model.toUpperCase(Locale.ROOT));
    }
}
