package com.llmrouter.routing;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ParseOutcome {
    AnalysisVerdict verdict;
    String failureReason;

    public static ParseOutcome success(AnalysisVerdict verdict) {
        return new ParseOutcome(verdict, null);
    }

    public static ParseOutcome failure(String reason) {
        return new ParseOutcome(null, reason);
    }

    public boolean isSuccess() {
        return verdict != null;
    }
}
