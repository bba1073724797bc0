package org.deduction.hints;

/**
 * 可用规则的一个来源。提供者之间按顺序尝试，第一个成功的结果被采用。
 * 实现不抛出异常，无法回答时返回 {@link ProviderResult#failure(String, String)}。
 */
public interface RuleSuggestionProvider {

    String getName();

    ProviderResult suggest(HintContext context);
}
