package com.workhub.core.extraction;

import com.workhub.core.model.EntityCategory;
import com.workhub.core.model.EntitySet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans message text for time, location, equipment and urgency hints.
 * <p>
 * Matching is case-insensitive and runs on the lower-cased text, so returned
 * values are lower case. Every alternative of a category is applied; all
 * matches are kept, duplicates included, in the order they occur in the text.
 * A pattern with several groups yields its groups joined by a single space,
 * e.g. {@code "building a"}.
 */
@Component
public class EntityExtractor {

    private static final Map<EntityCategory, List<Pattern>> PATTERNS = Map.of(
            EntityCategory.TIME_MENTIONS, List.of(
                    Pattern.compile("(\\d{1,2}:\\d{2})"),
                    Pattern.compile("(morning|afternoon|evening|night)"),
                    Pattern.compile("(today|tomorrow|yesterday)"),
                    Pattern.compile("(monday|tuesday|wednesday|thursday|friday|saturday|sunday)")),
            EntityCategory.LOCATIONS, List.of(
                    Pattern.compile("(building|floor|room|site|area|zone)\\s*([a-z0-9]+)"),
                    Pattern.compile("(basement|roof|office|warehouse|factory)")),
            EntityCategory.EQUIPMENT, List.of(
                    Pattern.compile("(generator|pump|valve|motor|machine|equipment|tool)"),
                    Pattern.compile("(electrical|plumbing|hvac|mechanical)")),
            EntityCategory.URGENCY, List.of(
                    Pattern.compile("(urgent|emergency|asap|immediately|critical)"),
                    Pattern.compile("(low priority|when possible|no rush)"))
    );

    public EntitySet extract(String text) {
        if (text == null || text.isBlank()) {
            return EntitySet.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);

        var found = new EnumMap<EntityCategory, List<String>>(EntityCategory.class);
        for (EntityCategory category : EntityCategory.values()) {
            List<String> values = scan(lower, PATTERNS.get(category));
            if (!values.isEmpty()) {
                found.put(category, values);
            }
        }
        return EntitySet.of(found);
    }

    private static List<String> scan(String lower, List<Pattern> alternatives) {
        var hits = new ArrayList<Hit>();
        for (Pattern pattern : alternatives) {
            Matcher matcher = pattern.matcher(lower);
            while (matcher.find()) {
                hits.add(new Hit(matcher.start(), render(matcher)));
            }
        }
        hits.sort(Comparator.comparingInt(Hit::position));
        return hits.stream().map(Hit::value).toList();
    }

    private static String render(Matcher matcher) {
        if (matcher.groupCount() <= 1) {
            return matcher.group(matcher.groupCount());
        }
        var parts = new ArrayList<String>();
        for (int i = 1; i <= matcher.groupCount(); i++) {
            parts.add(matcher.group(i));
        }
        return String.join(" ", parts);
    }

    private record Hit(int position, String value) {}
}
