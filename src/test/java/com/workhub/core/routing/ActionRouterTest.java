package com.workhub.core.routing;

import com.workhub.core.config.AgentProperties;
import com.workhub.core.model.ClassificationResult;
import com.workhub.core.model.DatabaseAction;
import com.workhub.core.model.EntityCategory;
import com.workhub.core.model.EntitySet;
import com.workhub.core.model.Intent;
import com.workhub.core.model.RoutingDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionRouterTest {

    private final ActionRouter router = new ActionRouter(AgentProperties.defaults());

    @ParameterizedTest
    @CsvSource({
            "TASK_UPDATE, UPDATE_TASK_PROGRESS",
            "INCIDENT_REPORT, CREATE_INCIDENT_RECORD",
            "PERMISSION_REQUEST, CREATE_PERMISSION_REQUEST",
            "ATTENDANCE, UPDATE_ATTENDANCE_RECORD",
            "QUESTION, ROUTE_TO_SUPPORT",
            "GENERAL, LOG_GENERAL_MESSAGE"
    })
    @DisplayName("each intent maps to exactly one action")
    void mapping(Intent intent, DatabaseAction expected) {
        assertEquals(expected, ActionRouter.actionFor(intent));
    }

    @Test
    @DisplayName("incidents and permission requests always need a manager")
    void alwaysEscalated() {
        assertTrue(route(Intent.INCIDENT_REPORT, 0.95).requiresManagerAttention());
        assertTrue(route(Intent.PERMISSION_REQUEST, 0.95).requiresManagerAttention());
    }

    @Test
    @DisplayName("confident routine messages do not need a manager")
    void routine() {
        RoutingDecision decision = route(Intent.TASK_UPDATE, 0.8);
        assertFalse(decision.requiresManagerAttention());
        assertTrue(decision.autoProcess());
    }

    @Test
    @DisplayName("confidence below 0.5 escalates any intent")
    void lowConfidence() {
        assertTrue(route(Intent.ATTENDANCE, 0.49).requiresManagerAttention());
        assertFalse(route(Intent.ATTENDANCE, 0.5).requiresManagerAttention());
    }

    @Test
    @DisplayName("general 0.5 fallback is not escalated")
    void generalFallback() {
        RoutingDecision decision = router.route(ClassificationResult.unmatched(), EntitySet.empty());
        assertEquals(DatabaseAction.LOG_GENERAL_MESSAGE, decision.action());
        assertFalse(decision.requiresManagerAttention());
        assertFalse(decision.autoProcess());
    }

    @Test
    @DisplayName("an urgency entity mentioning urgent escalates")
    void urgentEntity() {
        EntitySet urgent = EntitySet.of(Map.of(EntityCategory.URGENCY, List.of("urgent")));
        EntitySet asap = EntitySet.of(Map.of(EntityCategory.URGENCY, List.of("asap")));

        assertTrue(router.route(new ClassificationResult(Intent.TASK_UPDATE, 0.9), urgent).requiresManagerAttention());
        assertFalse(router.route(new ClassificationResult(Intent.TASK_UPDATE, 0.9), asap).requiresManagerAttention());
    }

    @Test
    @DisplayName("auto-process needs confidence above 0.6")
    void autoProcess() {
        assertFalse(route(Intent.QUESTION, 0.6).autoProcess());
        assertTrue(route(Intent.QUESTION, 0.61).autoProcess());
    }

    private RoutingDecision route(Intent intent, double confidence) {
        return router.route(new ClassificationResult(intent, confidence), EntitySet.empty());
    }
}
