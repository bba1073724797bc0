package org.deduction.core;

import java.util.Optional;

/**
 * {@link Formula#matchInstance} 的结果：
 * 匹配失败；匹配成功但变元在主体中不自由出现 (空洞量化)；或匹配成功并确定了实例项。
 */
public final class InstanceMatch {

    private static final InstanceMatch FAILED = new InstanceMatch(false, null);
    private static final InstanceMatch VACUOUS = new InstanceMatch(true, null);

    private final boolean matched;
    private final Term term;

    private InstanceMatch(boolean matched, Term term) {
        this.matched = matched;
        this.term = term;
    }

    public static InstanceMatch failed() {
        return FAILED;
    }

    public static InstanceMatch vacuous() {
        return VACUOUS;
    }

    public static InstanceMatch of(Term term) {
        return new InstanceMatch(true, term);
    }

    public boolean isMatched() {
        return matched;
    }

    public Optional<Term> getTerm() {
        return Optional.ofNullable(term);
    }

    @Override
    public String toString() {
        if (!matched) {
            return "InstanceMatch(failed)";
        }
        return term == null ? "InstanceMatch(vacuous)" : "InstanceMatch(" + term + ")";
    }
}
