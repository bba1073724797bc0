package org.deduction.hints;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一个规则提供者的回答：成功时带有建议列表，失败时带有原因。
 */
@Getter
public final class ProviderResult {

    private final String provider;
    private final boolean success;
    private final List<RuleSuggestion> suggestions;
    private final String failureReason;

    private ProviderResult(String provider, boolean success, List<RuleSuggestion> suggestions, String failureReason) {
        this.provider = Objects.requireNonNull(provider, "Provider name cannot be null.");
        this.success = success;
        this.suggestions = Collections.unmodifiableList(new ArrayList<>(suggestions));
        this.failureReason = failureReason;
    }

    public static ProviderResult success(String provider, List<RuleSuggestion> suggestions) {
        return new ProviderResult(provider, true, suggestions, null);
    }

    public static ProviderResult failure(String provider, String reason) {
        return new ProviderResult(provider, false, List.of(), Objects.requireNonNull(reason, "Reason cannot be null."));
    }

    @Override
    public String toString() {
        return success ? provider + " -> " + suggestions : provider + " failed: " + failureReason;
    }
}
