package com.workhub.core.classify;

import com.workhub.core.model.ClassificationResult;
import com.workhub.core.model.Intent;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Deterministic keyword classifier, always available.
 * <p>
 * Each intent owns a list of pattern groups. The confidence of an intent is the
 * share of its groups found in the message, plus a one-time bonus of 0.3 when
 * any of its high-specificity patterns also matches, capped at 0.95. The intent
 * with the highest confidence wins; ties go to the intent declared first in
 * {@link Intent}. A message that matches nothing is {@code (general, 0.5)}.
 */
@Component
public class RuleBasedIntentClassifier {

    static final double SPECIFICITY_BONUS = 0.3;
    static final double MAX_CONFIDENCE = 0.95;

    private static final Map<Intent, List<Pattern>> GROUPS = Map.of(
            Intent.TASK_UPDATE, compile(
                    "(completed|finished|done|complete|completing)",
                    "(started|starting|beginning|begin|working on)",
                    "(progress|update|status|advancement)",
                    "(task|work|job|assignment|project)",
                    "(material|tool|equipment|resource).*(need|require|want)",
                    "(delayed|behind|late|slow|stuck)",
                    "(on schedule|on time|ahead|early)",
                    "(almost done|nearly finished|halfway)",
                    "(repair|fix|install|build|construct)"),
            Intent.INCIDENT_REPORT, compile(
                    "(incident|accident|emergency|problem|issue|trouble)",
                    "(safety|danger|hazard|risk|unsafe)",
                    "(broken|damaged|malfunction|fault|failure|not working)",
                    "(injury|hurt|injured|medical|first aid)",
                    "(leak|spill|fire|gas|smoke|explosion)",
                    "(urgent|emergency|critical|serious|help)",
                    "(pipe.*broken|pipe.*leak|water.*damage)",
                    "(electrical.*problem|power.*out|short circuit)",
                    "(security.*breach|unauthorized.*access)"),
            Intent.PERMISSION_REQUEST, compile(
                    "(permission|access|authorize|authorization|approval)",
                    "(overtime|extra hours|weekend work|holiday work)",
                    "(restricted|locked|secure|private|blocked)",
                    "(can i|may i|allowed to|permit|let me)",
                    "(approve|clearance|sign off)",
                    "(budget|purchase|expense|cost)",
                    "(leave|time off|vacation|sick day)"),
            Intent.ATTENDANCE, compile(
                    "(check in|checked in|arrived|here|present|on site)",
                    "(check out|checking out|leaving|finished|going home)",
                    "(break|lunch|rest|meal)",
                    "(sick|ill|absent|leave|not coming)",
                    "(at location|reached|on site|at work)",
                    "(clocking in|clocking out|time card)",
                    "(shift.*start|shift.*end)"),
            Intent.QUESTION, compile(
                    "(how|what|when|where|why|help|assist)",
                    "(instruction|procedure|guideline|manual)",
                    "(don't know|not sure|confused|unclear|unsure)",
                    "(explain|clarify|understand|learn|show me)",
                    "(\\?|help me|need help|assistance)",
                    "(new.*equipment|operate|use.*machine)")
    );

    private static final Map<Intent, List<Pattern>> SPECIFIC = Map.of(
            Intent.TASK_UPDATE, compile("finished", "completed", "started", "progress", "need.*material"),
            Intent.INCIDENT_REPORT, compile("gas leak", "pipe.*broken", "emergency", "urgent", "safety", "injury", "broken"),
            Intent.PERMISSION_REQUEST, compile("permission", "approval", "overtime", "access", "authorize"),
            Intent.ATTENDANCE, compile("check in", "check out", "arrived", "leaving", "on site"),
            Intent.QUESTION, compile("how.*", "what.*", "help", "procedure", "unclear")
    );

    public ClassificationResult classify(String message) {
        if (message == null || message.isBlank()) {
            return ClassificationResult.unmatched();
        }
        String lower = message.toLowerCase(Locale.ROOT);

        Intent best = null;
        double bestScore = 0.0;
        for (Intent intent : Intent.values()) {
            List<Pattern> groups = GROUPS.get(intent);
            if (groups == null) {
                continue;
            }
            double score = score(lower, groups, SPECIFIC.getOrDefault(intent, List.of()));
            if (score > bestScore) {
                best = intent;
                bestScore = score;
            }
        }
        if (best == null) {
            return ClassificationResult.unmatched();
        }
        return new ClassificationResult(best, bestScore);
    }

    private double score(String lower, List<Pattern> groups, List<Pattern> specific) {
        long matches = groups.stream().filter(p -> p.matcher(lower).find()).count();
        if (matches == 0) {
            return 0.0;
        }
        double confidence = (double) matches / groups.size();
        if (specific.stream().anyMatch(p -> p.matcher(lower).find())) {
            confidence += SPECIFICITY_BONUS;
        }
        return Math.min(MAX_CONFIDENCE, confidence);
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes).map(Pattern::compile).toList();
    }
}
