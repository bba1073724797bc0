package org.deduction.syntax;

import org.apache.commons.lang3.StringUtils;
import org.deduction.core.Formula;
import org.deduction.errors.ErrorKind;
import org.deduction.errors.FormulaSyntaxException;
import org.deduction.errors.ProofEngineException;
import org.deduction.errors.ProofScriptException;
import org.deduction.rules.RuleKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把证明脚本解析为 {@link ParsedProof}。
 * <p>
 * 方言由第一个非空行判定。解析器负责行号分配、显式行号前缀校验、前提行处理，
 * 以及作用域编号：括号方言依据 { 与 } 行，冒号方言依据 Show 头部、关闭标记和缩进。
 * 规则是否适用、引用是否可见由校验器负责，这里只检查脚本结构。
 * <p>
 * 若脚本以 PR 行开头，它们必须按顺序列出声明的前提；否则声明的前提隐式占据第 1..n 行。
 * { 与 } 行只表示结构，不占行号。
 */
public final class ProofScriptParser {

    private static final Logger logger = LoggerFactory.getLogger(ProofScriptParser.class);

    private static final Pattern NUMBER_PREFIX = Pattern.compile("^(\\d+)\\s*[.)]\\s*(.*)$");
    private static final Pattern SEPARATOR = Pattern.compile("^-{2,}$");
    private static final Pattern SHOW_LINE = Pattern.compile("^(?i:show)\\b\\s*:?\\s*(.*)$");
    private static final Pattern QED_LINE = Pattern.compile("^(?i:qed)\\s*:(.*)$");
    private static final Pattern BRACKET_LINE = Pattern.compile("^(.*?)\\[([^\\[\\]]*)]\\s*$");
    private static final Pattern LINE_REF = Pattern.compile("\\d+");
    private static final Pattern RANGE_REF = Pattern.compile("(\\d+)[-–](\\d+)");
    private static final Pattern CITATION_SPLIT = Pattern.compile("[\\s,]+");

    private final Dialect dialect;
    private final List<Formula> premises;

    private final List<ProofLine> lines = new ArrayList<>();
    private final List<ScopeDecl> scopes = new ArrayList<>();
    private final Deque<Frame> frames = new ArrayDeque<>();

    private int nextNumber = 1;
    private boolean premisesSettled;
    private int explicitPremises;

    /**
     * 解析过程中的作用域帧。indent 为 -1 表示尚未由首行确定缩进。
     */
    private static final class Frame {
        private final int id;
        private final ScopeKind kind;
        private int indent;
        private int lineCount;

        private Frame(int id, ScopeKind kind, int indent) {
            this.id = id;
            this.kind = kind;
            this.indent = indent;
        }
    }

    private ProofScriptParser(Dialect dialect, List<Formula> premises) {
        this.dialect = dialect;
        this.premises = premises;
        scopes.add(new ScopeDecl(0, ScopeDecl.NO_PARENT, ScopeKind.ROOT, 0));
        frames.push(new Frame(0, ScopeKind.ROOT, -1));
    }

    /**
     * 自动判定方言并解析。
     * @throws ProofScriptException 脚本结构不合法时。
     */
    public static ParsedProof parse(String text, List<Formula> premises) {
        return parse(text, premises, detectDialect(text));
    }

    public static ParsedProof parse(String text, List<Formula> premises, Dialect dialect) {
        Objects.requireNonNull(premises, "Premises cannot be null.");
        Objects.requireNonNull(dialect, "Dialect cannot be null.");
        ProofScriptParser parser = new ProofScriptParser(dialect, premises);
        try {
            parser.run(text == null ? "" : text);
        } catch (ProofEngineException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("ProofScriptParser.parse: 解析证明脚本时发生内部错误", e);
            ProofScriptException converted = new ProofScriptException(ErrorKind.SYNTAX_ERROR,
                    "Malformed proof script", parser.nextNumber);
            converted.initCause(e);
            throw converted;
        }
        ParsedProof proof = new ParsedProof(dialect, parser.lines, parser.scopes, premises.size());
        logger.debug("ProofScriptParser.parse: {} 方言，{} 行，{} 个作用域", dialect.getLabel(),
                proof.getLines().size(), proof.getScopes().size());
        return proof;
    }

    /**
     * 依据第一个非空行判定方言；无法判定时默认为括号方言。
     */
    public static Dialect detectDialect(String text) {
        for (String raw : splitLines(text == null ? "" : text)) {
            String content = raw.strip();
            if (content.isEmpty() || SEPARATOR.matcher(content).matches()) {
                continue;
            }
            Matcher numbered = NUMBER_PREFIX.matcher(content);
            if (numbered.matches()) {
                content = numbered.group(2);
            }
            if (SHOW_LINE.matcher(content).matches() || content.startsWith(":") || QED_LINE.matcher(content).matches()) {
                return Dialect.COLON;
            }
            if (content.equals("{") || content.equals("}") || BRACKET_LINE.matcher(content).matches()) {
                return Dialect.BRACKET;
            }
            return content.contains(":") ? Dialect.COLON : Dialect.BRACKET;
        }
        return Dialect.BRACKET;
    }

    private static List<String> splitLines(String text) {
        String trimmed = text.strip();
        if (!trimmed.contains("\n") && trimmed.contains(" / ")) {
            return Arrays.asList(trimmed.split("\\s+/\\s+"));
        }
        return Arrays.asList(text.split("\\r?\\n"));
    }

    private void run(String text) {
        for (String raw : splitLines(text)) {
            String expanded = raw.replace("\t", "    ");
            String content = expanded.strip();
            if (content.isEmpty() || SEPARATOR.matcher(content).matches()) {
                continue;
            }
            int indent = expanded.length() - expanded.stripLeading().length();
            Integer claimed = null;
            Matcher numbered = NUMBER_PREFIX.matcher(content);
            if (numbered.matches()) {
                claimed = Integer.parseInt(numbered.group(1));
                content = numbered.group(2).strip();
            }
            if (dialect == Dialect.BRACKET) {
                bracketLine(content, claimed);
            } else {
                colonLine(content, indent, claimed);
            }
        }
        settlePremises();
    }

    // --- 括号方言 ---

    private void bracketLine(String content, Integer claimed) {
        if (content.equals("{")) {
            settlePremises();
            openFrame(ScopeKind.SUBPROOF, -1, 0);
            return;
        }
        if (content.equals("}")) {
            settlePremises();
            if (frames.peek().kind != ScopeKind.SUBPROOF) {
                throw new ProofScriptException(ErrorKind.SCOPE_ERROR, "Unmatched '}' after line " + (nextNumber - 1),
                        Math.max(1, nextNumber - 1));
            }
            frames.pop();
            return;
        }
        Matcher m = BRACKET_LINE.matcher(content);
        if (!m.matches()) {
            int number = peekNumber();
            throw new ProofScriptException(ErrorKind.SYNTAX_ERROR,
                    "Line " + number + ": expected 'formula [rule refs]' but got \"" + content + "\"", number);
        }
        formulaLine(m.group(1).strip(), m.group(2), frames.peek(), claimed, content);
    }

    // --- 冒号方言 ---

    private void colonLine(String content, int indent, Integer claimed) {
        Matcher show = SHOW_LINE.matcher(content);
        if (show.matches()) {
            settlePremises();
            int number = takeNumber(claimed);
            Frame frame = placeColon(indent, false);
            Formula goal = parseFormulaAt(show.group(1), number);
            addLine(new ProofLine(number, LineKind.SHOW, goal, Justification.bare(RuleKind.SHOW),
                    frame.id, frames.size() - 1, ProofLine.NO_SCOPE, content), frame);
            openFrame(ScopeKind.SHOW, -1, number);
            return;
        }
        Matcher qed = QED_LINE.matcher(content);
        if (content.startsWith(":") || qed.matches()) {
            String body = qed.matches() ? qed.group(1) : content.substring(1);
            closingLine(body, indent, claimed, content);
            return;
        }
        int colon = content.lastIndexOf(':');
        if (colon < 0) {
            int number = peekNumber();
            throw new ProofScriptException(ErrorKind.SYNTAX_ERROR,
                    "Line " + number + ": missing ':' justification in \"" + content + "\"", number);
        }
        String formulaText = content.substring(0, colon).strip();
        String justificationText = content.substring(colon + 1);
        if (formulaText.isEmpty()) {
            closingLine(justificationText, indent, claimed, content);
            return;
        }
        RuleKind rule = resolveRule(justificationText, peekNumber());
        boolean assumption = rule == RuleKind.ASSUMPTION;
        boolean premise = rule == RuleKind.PREMISE && !premisesSettled;
        Frame frame = premise ? frames.peek() : null;
        if (!premise) {
            settlePremises();
            frame = placeColon(indent, assumption);
        } else if (frame.indent < 0) {
            frame.indent = indent;
        }
        formulaLine(formulaText, justificationText, frame, claimed, content);
    }

    private void closingLine(String justificationText, int indent, Integer claimed, String content) {
        settlePremises();
        int number = takeNumber(claimed);
        Frame show = innermostShow();
        if (show == null) {
            throw new ProofScriptException(ErrorKind.SCOPE_ERROR,
                    "Line " + number + ": closing marker ':" + justificationText.strip() + "' without an open Show", number);
        }
        while (frames.peek() != show) {
            frames.pop();
        }
        frames.pop();
        Frame parent = frames.peek();
        if (parent.indent < 0) {
            parent.indent = indent;
        }
        Justification justification = parseJustification(justificationText, number);
        addLine(new ProofLine(number, LineKind.CLOSING, null, justification,
                parent.id, frames.size() - 1, show.id, content), parent);
    }

    private Frame placeColon(int indent, boolean assumption) {
        Frame top = frames.peek();
        while (top.kind != ScopeKind.ROOT && top.indent >= 0 && indent < top.indent) {
            frames.pop();
            top = frames.peek();
        }
        if (top.indent < 0) {
            top.indent = indent;
        } else if (indent > top.indent) {
            top = openFrame(ScopeKind.SUBPROOF, indent, 0);
        } else if (assumption && top.kind == ScopeKind.SUBPROOF && top.lineCount > 0) {
            // 同一缩进上的新假设开启一个并列的子证明
            frames.pop();
            top = openFrame(ScopeKind.SUBPROOF, indent, 0);
        }
        return top;
    }

    private Frame innermostShow() {
        for (Frame frame : frames) {
            if (frame.kind == ScopeKind.SHOW) {
                return frame;
            }
        }
        return null;
    }

    // --- 公共部分 ---

    private void formulaLine(String formulaText, String justificationText, Frame frame, Integer claimed, String content) {
        RuleKind rule = resolveRule(justificationText, peekNumber());
        boolean premise = rule == RuleKind.PREMISE && !premisesSettled && frame.kind == ScopeKind.ROOT;
        if (!premise) {
            settlePremises();
        }
        int number = takeNumber(claimed);
        Formula formula = parseFormulaAt(formulaText, number);
        Justification justification = parseJustification(justificationText, number);
        if (premise) {
            checkExplicitPremise(formula, number);
            addLine(new ProofLine(number, LineKind.PREMISE, formula, justification,
                    frame.id, frames.size() - 1, ProofLine.NO_SCOPE, content), frame);
            return;
        }
        addLine(new ProofLine(number, LineKind.FORMULA, formula, justification,
                frame.id, frames.size() - 1, ProofLine.NO_SCOPE, content), frame);
    }

    private void checkExplicitPremise(Formula formula, int number) {
        if (explicitPremises >= premises.size()) {
            throw new ProofScriptException(ErrorKind.RULE_VIOLATION,
                    "Line " + number + ": " + formula + " is not a declared premise", number);
        }
        Formula declared = premises.get(explicitPremises);
        if (!declared.equals(formula)) {
            throw new ProofScriptException(ErrorKind.RULE_VIOLATION,
                    "Line " + number + ": premise " + (explicitPremises + 1) + " is declared as " + declared
                            + " but the script lists " + formula, number);
        }
        explicitPremises++;
    }

    private void settlePremises() {
        if (premisesSettled) {
            return;
        }
        premisesSettled = true;
        if (explicitPremises == 0) {
            Frame root = frames.peek();
            for (Formula premise : premises) {
                int number = nextNumber++;
                addLine(new ProofLine(number, LineKind.PREMISE, premise, Justification.bare(RuleKind.PREMISE),
                        root.id, 0, ProofLine.NO_SCOPE, premise.toString()), root);
            }
            return;
        }
        if (explicitPremises != premises.size()) {
            throw new ProofScriptException(ErrorKind.RULE_VIOLATION,
                    "The script lists " + explicitPremises + " premise lines but " + premises.size()
                            + " premises were declared", explicitPremises);
        }
    }

    private Frame openFrame(ScopeKind kind, int indent, int showLine) {
        int id = scopes.size();
        scopes.add(new ScopeDecl(id, frames.peek().id, kind, showLine));
        Frame frame = new Frame(id, kind, indent);
        frames.push(frame);
        return frame;
    }

    private void addLine(ProofLine line, Frame frame) {
        lines.add(line);
        frame.lineCount++;
    }

    /**
     * 下一条非前提行将得到的行号 (隐式前提尚未补齐时计入它们)。
     */
    private int peekNumber() {
        if (!premisesSettled && explicitPremises == 0) {
            return nextNumber + premises.size();
        }
        return nextNumber;
    }

    private int takeNumber(Integer claimed) {
        int number = nextNumber++;
        if (claimed != null && claimed != number) {
            throw new ProofScriptException(ErrorKind.SYNTAX_ERROR,
                    "Line number " + claimed + " does not match the expected number " + number, number);
        }
        return number;
    }

    private static Formula parseFormulaAt(String text, int number) {
        try {
            return FormulaParser.parse(text);
        } catch (FormulaSyntaxException e) {
            throw ProofScriptException.atLine(e, number);
        }
    }

    private static RuleKind resolveRule(String justificationText, int number) {
        String ruleText = ruleText(justificationText);
        if (ruleText.isEmpty()) {
            throw new ProofScriptException(ErrorKind.SYNTAX_ERROR, "Line " + number + ": missing rule", number);
        }
        return RuleKind.fromTag(ruleText).orElseThrow(() -> new ProofScriptException(ErrorKind.SYNTAX_ERROR,
                "Line " + number + ": unknown rule '" + ruleText + "'", number));
    }

    private static String ruleText(String justificationText) {
        List<String> parts = new ArrayList<>();
        for (String token : CITATION_SPLIT.split(justificationText.strip())) {
            if (!token.isEmpty() && !LINE_REF.matcher(token).matches() && !RANGE_REF.matcher(token).matches()) {
                parts.add(token);
            }
        }
        return StringUtils.join(parts, " ");
    }

    /**
     * 解析 "MP 1,2"、"2-6 →I"、"∨E 1, 2-3, 4-5" 之类的依据：数字与区间为引用，其余记号组成规则名。
     */
    static Justification parseJustification(String text, int number) {
        RuleKind rule = resolveRule(text, number);
        List<Integer> cited = new ArrayList<>();
        List<LineRange> ranges = new ArrayList<>();
        for (String token : CITATION_SPLIT.split(text.strip())) {
            Matcher range = RANGE_REF.matcher(token);
            if (range.matches()) {
                int start = Integer.parseInt(range.group(1));
                int end = Integer.parseInt(range.group(2));
                if (start <= 0 || end < start) {
                    throw new ProofScriptException(ErrorKind.SYNTAX_ERROR,
                            "Line " + number + ": malformed range " + token, number);
                }
                ranges.add(LineRange.of(start, end));
            } else if (LINE_REF.matcher(token).matches()) {
                int ref = Integer.parseInt(token);
                if (ref <= 0) {
                    throw new ProofScriptException(ErrorKind.SYNTAX_ERROR,
                            "Line " + number + ": line references start at 1", number);
                }
                cited.add(ref);
            }
        }
        return Justification.of(rule, ruleText(text), cited, ranges);
    }
}
