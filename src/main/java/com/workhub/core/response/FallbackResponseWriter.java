package com.workhub.core.response;

import com.workhub.core.model.EntityCategory;
import com.workhub.core.model.EntitySet;
import com.workhub.core.model.Intent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Deterministic replies, chosen by intent and then by keywords in the message.
 * Never returns blank text.
 */
@Component
public class FallbackResponseWriter {

    private static final List<String> URGENT_WORDS = List.of("urgent", "emergency", "critical", "asap", "immediately", "help");

    public String write(String message, Intent intent, EntitySet entities) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        return switch (intent) {
            case INCIDENT_REPORT -> incident(lower);
            case TASK_UPDATE -> taskUpdate(lower);
            case PERMISSION_REQUEST -> permission(lower);
            case ATTENDANCE -> attendance(lower, entities);
            case QUESTION -> question(lower, entities);
            case GENERAL -> general(lower);
        };
    }

    private String incident(String lower) {
        if (lower.contains("leak")) {
            return "🚨 Gas/water leak reported! Manager and safety team notified immediately. "
                    + "Please evacuate the area and ensure your safety first!";
        }
        if (lower.contains("fire")) {
            return "🔥 Fire emergency logged! Emergency services and management alerted. "
                    + "Please follow evacuation procedures!";
        }
        if (containsAny(lower, "injury", "hurt")) {
            return "🏥 Injury incident recorded! First aid team and manager notified. "
                    + "Please seek immediate medical attention if needed.";
        }
        if (containsAny(lower, "broken", "damaged")) {
            return "⚠️ Equipment damage reported! Maintenance team alerted. "
                    + "Area marked for safety - please avoid using damaged equipment.";
        }
        return "🚨 Incident documented and manager immediately notified! "
                + "Please prioritize your safety and follow proper protocols.";
    }

    private String taskUpdate(String lower) {
        if (containsAny(lower, "finished", "completed", "done")) {
            return "✅ Excellent work completing your task! Progress logged and team updated. Great job!";
        }
        if (containsAny(lower, "started", "beginning")) {
            return "🚀 Task start logged! Good luck with the work. Let me know if you need any assistance.";
        }
        if (lower.contains("need") && containsAny(lower, "material", "tool")) {
            return "📦 Material request noted! Forwarded to procurement team. "
                    + "You should receive an update on availability soon.";
        }
        if (containsAny(lower, "delayed", "behind")) {
            return "⏰ Delay reported and logged. Manager notified to help resolve any issues. Keep up the good work!";
        }
        return "📝 Task update received and logged! Your progress is noted and team informed.";
    }

    private String permission(String lower) {
        if (lower.contains("overtime")) {
            return "📋 Overtime request submitted to your manager! "
                    + "You should receive approval status within a few hours.";
        }
        if (containsAny(lower, "access", "restricted")) {
            return "🔐 Access request forwarded to security and your manager for approval. "
                    + "Please wait for clearance before proceeding.";
        }
        if (containsAny(lower, "budget", "purchase")) {
            return "💼 Budget approval request sent to management. Finance team will review and respond soon.";
        }
        return "📋 Permission request submitted and forwarded to appropriate approvers! "
                + "You'll receive an update shortly.";
    }

    private String attendance(String lower, EntitySet entities) {
        if (containsAny(lower, "check in", "arrived")) {
            List<String> locations = entities.get(EntityCategory.LOCATIONS);
            String at = locations.isEmpty() ? "" : " at " + locations.get(0);
            return "✅ Successfully checked in" + at + "! Welcome to work. Have a productive and safe day!";
        }
        if (containsAny(lower, "check out", "leaving")) {
            return "👋 Check-out recorded! Thank you for your hard work today. Travel safely!";
        }
        if (containsAny(lower, "break", "lunch")) {
            return "☕ Break time logged! Enjoy your rest and remember to stay hydrated.";
        }
        return "⏰ Attendance update recorded! Your time tracking is up to date.";
    }

    private String question(String lower, EntitySet entities) {
        if (lower.contains("how") && containsAny(lower, "operate", "use")) {
            List<String> equipment = entities.get(EntityCategory.EQUIPMENT);
            String forWhat = equipment.isEmpty() ? "" : " for " + equipment.get(0);
            return "💡 Equipment operation question noted" + forWhat
                    + "! Connecting you with a technical expert or finding the manual.";
        }
        if (containsAny(lower, "procedure", "protocol")) {
            return "📋 Procedure question logged! Sending you the relevant guidelines or connecting you with a supervisor.";
        }
        if (lower.contains("safety")) {
            return "⛑️ Safety question is important! Forwarding to safety officer for immediate guidance. Safety first!";
        }
        return "❓ Question received! Getting you the right information or connecting you with someone who can help.";
    }

    private String general(String lower) {
        if (URGENT_WORDS.stream().anyMatch(lower::contains)) {
            return "⚠️ Message marked as urgent and immediately forwarded to your manager! "
                    + "You should receive a response soon.";
        }
        return "📝 Message received and logged! Appropriate team members have been notified.";
    }

    private static boolean containsAny(String lower, String... words) {
        for (String word : words) {
            if (lower.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
