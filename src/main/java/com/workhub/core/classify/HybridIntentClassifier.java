package com.workhub.core.classify;

import com.workhub.core.config.AgentProperties;
import com.workhub.core.model.ClassificationResult;
import com.workhub.core.model.ClassificationSource;
import com.workhub.core.metrics.AgentMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Chooses between the model-assisted and the rule-based classifier.
 * <p>
 * The model is asked at most once. Its result is accepted outright when its
 * confidence exceeds the acceptance threshold; otherwise it is discarded and the
 * rule-based result is returned instead. Without a configured model the rules
 * are used directly.
 */
@Component
public class HybridIntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(HybridIntentClassifier.class);

    private final ModelIntentClassifier modelClassifier;
    private final RuleBasedIntentClassifier ruleClassifier;
    private final AgentMetrics metrics;
    private final double acceptanceThreshold;

    public HybridIntentClassifier(ModelIntentClassifier modelClassifier,
                                  RuleBasedIntentClassifier ruleClassifier,
                                  AgentMetrics metrics,
                                  AgentProperties properties) {
        this.modelClassifier = modelClassifier;
        this.ruleClassifier = ruleClassifier;
        this.metrics = metrics;
        this.acceptanceThreshold = properties.acceptanceThreshold();
    }

    public HybridClassification classify(String message) {
        if (!modelClassifier.isAvailable()) {
            log.debug("No model configured, using rule-based classification");
            return rules(message, ModelError.NOT_CONFIGURED);
        }

        ModelResult<ClassificationResult> attempt = modelClassifier.classify(message);
        if (attempt instanceof ModelResult.Ok<ClassificationResult> ok) {
            ClassificationResult result = ok.value();
            if (result.confidence() > acceptanceThreshold) {
                log.info("Model classification accepted: {} ({})", result.intent().label(),
                        String.format("%.2f", result.confidence()));
                return new HybridClassification(result, ClassificationSource.MODEL, null);
            }
            log.info("Model confidence too low ({}), using rules", String.format("%.2f", result.confidence()));
            metrics.recordModelFallback("low_confidence");
            return rules(message, null);
        }
        var err = (ModelResult.Err<ClassificationResult>) attempt;
        metrics.recordModelFallback(err.error().tag());
        return rules(message, err.error());
    }

    private HybridClassification rules(String message, ModelError modelError) {
        ClassificationResult result = ruleClassifier.classify(message);
        log.info("Rule-based result: {} ({})", result.intent().label(), String.format("%.2f", result.confidence()));
        return new HybridClassification(result, ClassificationSource.RULES, modelError);
    }
}
