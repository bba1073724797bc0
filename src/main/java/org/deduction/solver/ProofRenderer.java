package org.deduction.solver;

import org.deduction.rules.RuleKind;

import java.util.List;

/**
 * 以方括号方言输出证明：每行 "公式 [规则 引用]"，子证明用单独成行的 "{" 与 "}" 包围，每层缩进两个空格。
 * 前提显式写成 PR 行。输出可以被 ProofScriptParser 原样读回。
 */
public final class ProofRenderer {

    private static final String INDENT = "  ";

    private ProofRenderer() {
    }

    public static String renderBracket(List<BuiltLine> lines) {
        StringBuilder sb = new StringBuilder();
        int open = 0;
        for (BuiltLine line : lines) {
            int target = line.getRule() == RuleKind.ASSUMPTION ? line.getDepth() - 1 : line.getDepth();
            while (open > target) {
                open--;
                sb.append(INDENT.repeat(open)).append("}\n");
            }
            if (line.getRule() == RuleKind.ASSUMPTION) {
                sb.append(INDENT.repeat(open)).append("{\n");
                open++;
            }
            sb.append(INDENT.repeat(open)).append(line.getFormula()).append(" [").append(line.getRule().getTag());
            String citations = line.citations();
            if (!citations.isEmpty()) {
                sb.append(' ').append(citations);
            }
            sb.append("]\n");
        }
        while (open > 0) {
            open--;
            sb.append(INDENT.repeat(open)).append("}\n");
        }
        return sb.toString();
    }
}
