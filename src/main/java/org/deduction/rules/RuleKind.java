package org.deduction.rules;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 推理规则的封闭集合。每条规则有一个规范标签、一个展示名称，以及各种脚本方言中的别名。
 * 别名查找不区分大小写。
 */
public enum RuleKind {

    PREMISE("PR", "Premise", Category.STRUCTURAL, "PREMISE"),
    ASSUMPTION("AS", "Assumption", Category.STRUCTURAL, "ASSUME", "ASSUMPTION", "HYP"),
    SHOW("SHOW", "Show", Category.STRUCTURAL),
    REITERATION("R", "Reiteration", Category.STRUCTURAL, "REIT", "RE"),

    MODUS_PONENS("MP", "Modus Ponens", Category.ELIMINATION, "→E", "->E", "⊃E", "IFE"),
    MODUS_TOLLENS("MT", "Modus Tollens", Category.ELIMINATION),
    CONJ_INTRO("∧I", "Conjunction Introduction", Category.INTRODUCTION, "&I", "/\\I", "^I", "ADJ"),
    CONJ_ELIM("∧E", "Conjunction Elimination", Category.ELIMINATION, "&E", "/\\E", "^E", "S", "SIMP"),
    DISJ_INTRO("∨I", "Disjunction Introduction", Category.INTRODUCTION, "|I", "\\/I", "VI", "ADD"),
    DISJ_ELIM("∨E", "Disjunction Elimination", Category.ELIMINATION, "|E", "\\/E", "VE"),
    DISJ_SYLLOGISM("DS", "Disjunctive Syllogism", Category.ELIMINATION, "MTP"),
    COND_INTRO("→I", "Conditional Introduction", Category.INTRODUCTION, "->I", "⊃I", "CP", "CD"),
    BICOND_INTRO("↔I", "Biconditional Introduction", Category.INTRODUCTION, "<->I", "CB"),
    BICOND_ELIM("↔E", "Biconditional Elimination", Category.ELIMINATION, "<->E", "BC"),
    NEG_INTRO("¬I", "Negation Introduction", Category.INTRODUCTION, "~I", "-I"),
    NEG_ELIM("¬E", "Negation Elimination", Category.ELIMINATION, "~E", "-E", "⊥I", "_|_I"),
    BOTTOM_ELIM("⊥E", "Ex Falso Quodlibet", Category.ELIMINATION, "_|_E", "X", "EFQ"),
    DOUBLE_NEG_ELIM("DNE", "Double Negation Elimination", Category.ELIMINATION, "¬¬E", "~~E", "DN"),
    DOUBLE_NEG_INTRO("DNI", "Double Negation Introduction", Category.INTRODUCTION, "¬¬I", "~~I"),
    INDIRECT_PROOF("PBC", "Proof by Contradiction", Category.INTRODUCTION, "IP", "RAA"),
    UNIV_INTRO("∀I", "Universal Introduction", Category.INTRODUCTION, "AI", "UI", "UG"),
    UNIV_ELIM("∀E", "Universal Elimination", Category.ELIMINATION, "AE", "UE"),
    EXIST_INTRO("∃I", "Existential Introduction", Category.INTRODUCTION, "EI", "EG"),
    EXIST_ELIM("∃E", "Existential Elimination", Category.ELIMINATION, "EE"),
    DIRECT_DERIVATION("DD", "Direct Derivation", Category.STRUCTURAL),
    INDIRECT_DERIVATION("ID", "Indirect Derivation", Category.INTRODUCTION);

    /**
     * 规则的粗分类，供可用规则查询使用。
     */
    public enum Category {
        STRUCTURAL,
        INTRODUCTION,
        ELIMINATION
    }

    private static final Map<String, RuleKind> BY_TAG = new HashMap<>();

    static {
        for (RuleKind kind : values()) {
            register(kind.tag, kind);
            for (String alias : kind.aliases) {
                register(alias, kind);
            }
        }
    }

    private static void register(String spelling, RuleKind kind) {
        RuleKind previous = BY_TAG.put(key(spelling), kind);
        if (previous != null && previous != kind) {
            throw new IllegalStateException("Rule spelling " + spelling + " is ambiguous: " + previous + " / " + kind);
        }
    }

    private final String tag;
    private final String displayName;
    private final Category category;
    private final List<String> aliases;

    RuleKind(String tag, String displayName, Category category, String... aliases) {
        this.tag = tag;
        this.displayName = displayName;
        this.category = category;
        this.aliases = Collections.unmodifiableList(Arrays.asList(aliases));
    }

    public String getTag() {
        return tag;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Category getCategory() {
        return category;
    }

    public List<String> getAliases() {
        return aliases;
    }

    /**
     * 按标签或别名查找规则。
     * @param spelling 脚本中写出的规则文本，如 "MP"、"->E"、"Reit"。
     * @return 找不到时为空。
     */
    public static Optional<RuleKind> fromTag(String spelling) {
        if (spelling == null || spelling.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TAG.get(key(spelling)));
    }

    /**
     * 能够关闭 Show 块的标记：:CD、:DD、:ID，以及与之等价的 →I、¬I、PBC。
     */
    public boolean isShowClosing() {
        return switch (this) {
            case COND_INTRO, DIRECT_DERIVATION, INDIRECT_DERIVATION, NEG_INTRO, INDIRECT_PROOF -> true;
            default -> false;
        };
    }

    private static String key(String spelling) {
        return spelling.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return tag;
    }
}
