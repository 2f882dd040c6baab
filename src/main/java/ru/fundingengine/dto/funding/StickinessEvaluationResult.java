package ru.fundingengine.dto.funding;

import lombok.Value;

@Value
public class StickinessEvaluationResult {
    StickinessAction action;
    String reason;

    public boolean shouldKeep() {
        return action == StickinessAction.KEEP;
    }

    public static StickinessEvaluationResult keep(String reason) {
        return new StickinessEvaluationResult(StickinessAction.KEEP, reason);
    }

    public static StickinessEvaluationResult close(String reason) {
        return new StickinessEvaluationResult(StickinessAction.CLOSE, reason);
    }

    public static StickinessEvaluationResult replace(String reason) {
        return new StickinessEvaluationResult(StickinessAction.REPLACE, reason);
    }
}
