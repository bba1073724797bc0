package org.deduction.errors;

/**
 * 错误分类。每个被拒绝的请求恰好归入其中一类。
 */
public enum ErrorKind {
    SYNTAX_ERROR("SyntaxError"),
    SCOPE_ERROR("ScopeError"),
    RULE_VIOLATION("RuleViolation"),
    FRESHNESS_ERROR("FreshnessError"),
    CONCLUSION_MISMATCH("ConclusionMismatch"),
    // 求解或 SAT 搜索触及界限，并不说明有效或无效
    SEARCH_EXHAUSTED("SearchExhausted");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
