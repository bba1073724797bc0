package org.deduction.rules;

/**
 * 单条推理规则的校验器。
 */
@FunctionalInterface
public interface RuleValidator {

    /**
     * @param context 当前行、其引用的公式与子证明以及仍然有效的假设。
     * @return 通过或带原因的拒绝，不抛出异常。
     */
    RuleCheck check(RuleContext context);
}
