package org.deduction;

import org.deduction.core.Formula;
import org.deduction.core.Sequent;
import org.deduction.errors.ErrorKind;
import org.deduction.errors.ProofEngineException;
import org.deduction.hints.ApplicableRules;
import org.deduction.hints.RuleAdvisor;
import org.deduction.solver.MachineSolver;
import org.deduction.solver.OptimalLengthReport;
import org.deduction.solver.SolverResult;
import org.deduction.solver.SolverStatus;
import org.deduction.symbolic.CountermodelEngine;
import org.deduction.symbolic.CountermodelResult;
import org.deduction.syntax.Dialect;
import org.deduction.syntax.FormulaNormalizer;
import org.deduction.syntax.FormulaParser;
import org.deduction.syntax.ParsedProof;
import org.deduction.syntax.ProofScriptParser;
import org.deduction.utils.CancellationToken;
import org.deduction.verifier.ProofVerifier;
import org.deduction.verifier.VerificationError;
import org.deduction.verifier.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 证明引擎的入口。
 * <p>
 * 每个请求在新建的内存结构上独立完成，引擎本身只持有不可变的设置，可以被多个线程共享。
 * 任何入口都不会抛出异常：解析错误、校验失败、搜索耗尽都以带类型的结果返回。
 * 证明缺失或被拒绝时，校验结果附带相继式的语义分类，无效时附带反模型。
 */
public class ProofEngine {

    private static final Logger logger = LoggerFactory.getLogger(ProofEngine.class);

    private final EngineSettings settings;
    private final ProofVerifier verifier = new ProofVerifier();
    private final RuleAdvisor advisor = new RuleAdvisor();

    public ProofEngine() {
        this(EngineSettings.load());
    }

    public ProofEngine(EngineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null.");
        logger.debug("ProofEngine 初始化完成: {}", settings);
    }

    public EngineSettings getSettings() {
        return settings;
    }

    // --- 校验 ---

    public VerificationResult verify(List<String> premises, String conclusion, String proofText) {
        Dialect dialect = Dialect.BRACKET;
        Sequent sequent = null;
        try {
            sequent = sequent(premises, conclusion);
            String text = proofText == null ? "" : proofText;
            dialect = ProofScriptParser.detectDialect(text);
            ParsedProof parsed = ProofScriptParser.parse(text, sequent.getPremises(), dialect);
            VerificationResult result = verifier.verify(parsed, sequent);
            return result.isValid() ? result : withSemantics(result, sequent);
        } catch (ProofEngineException e) {
            logger.warn("ProofEngine.verify: 输入无法解析: {}", e.getMessage());
            VerificationResult rejected = VerificationResult.rejected(VerificationError.from(e), 0, 0, List.of(), dialect);
            return sequent == null ? rejected : withSemantics(rejected, sequent);
        } catch (RuntimeException e) {
            logger.error("ProofEngine.verify: 内部错误", e);
            return VerificationResult.rejected(internal(e), 0, 0, List.of(), dialect);
        }
    }

    private VerificationResult withSemantics(VerificationResult result, Sequent sequent) {
        CountermodelResult semantics = checkSequent(sequent, newToken());
        return result.withSemantics(semantics.getStatus(), semantics.getModel());
    }

    // --- 语义 ---

    public CountermodelResult checkSequent(List<String> premises, String conclusion) {
        try {
            return checkSequent(sequent(premises, conclusion), newToken());
        } catch (ProofEngineException e) {
            logger.warn("ProofEngine.checkSequent: 输入无法解析: {}", e.getMessage());
            return CountermodelResult.notApplicable("Invalid input: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("ProofEngine.checkSequent: 内部错误", e);
            return CountermodelResult.notApplicable("Internal error: " + e.getMessage());
        }
    }

    private CountermodelResult checkSequent(Sequent sequent, CancellationToken token) {
        try {
            CountermodelEngine engine = new CountermodelEngine(settings.getMaxVariables(), settings.getMaxClauses(),
                    settings.getSatBackend(), settings.getTimeoutMillis());
            return engine.check(sequent, token);
        } catch (RuntimeException e) {
            logger.error("ProofEngine.checkSequent: 语义判定失败", e);
            return CountermodelResult.boundExceeded(0, 0, settings.getSatBackend().getLabel(),
                    "Internal error: " + e.getMessage());
        }
    }

    // --- 搜索 ---

    public SolverResult findProof(List<String> premises, String conclusion, int maxDepth) {
        return findProof(premises, conclusion, maxDepth, newToken());
    }

    public SolverResult findProof(List<String> premises, String conclusion, int maxDepth, CancellationToken token) {
        try {
            Sequent sequent = sequent(premises, conclusion);
            return new MachineSolver(settings.getMaxNodes()).findProof(sequent, maxDepth, token);
        } catch (ProofEngineException e) {
            logger.warn("ProofEngine.findProof: 输入无法解析: {}", e.getMessage());
            return SolverResult.notFound(SolverStatus.INVALID_INPUT, 0, 0, "Invalid input: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("ProofEngine.findProof: 内部错误", e);
            return SolverResult.notFound(SolverStatus.INVALID_INPUT, 0, 0, "Internal error: " + e.getMessage());
        }
    }

    public OptimalLengthReport verifyOptimalLength(List<String> premises, String conclusion, int claimedLength) {
        try {
            Sequent sequent = sequent(premises, conclusion);
            return new MachineSolver(settings.getMaxNodes())
                    .verifyOptimalLength(sequent, claimedLength, settings.getMaxDepth(), newToken());
        } catch (ProofEngineException e) {
            logger.warn("ProofEngine.verifyOptimalLength: 输入无法解析: {}", e.getMessage());
            return OptimalLengthReport.failed(claimedLength, "Invalid input: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("ProofEngine.verifyOptimalLength: 内部错误", e);
            return OptimalLengthReport.failed(claimedLength, "Internal error: " + e.getMessage());
        }
    }

    // --- 提示 ---

    public ApplicableRules applicableRules(List<String> premises, String conclusion, String partialProof) {
        try {
            return advisor.applicableRules(sequent(premises, conclusion), partialProof);
        } catch (ProofEngineException e) {
            logger.warn("ProofEngine.applicableRules: 输入无法解析: {}", e.getMessage());
            return new ApplicableRules(List.of(), "none", 1, 0, VerificationError.from(e));
        } catch (RuntimeException e) {
            logger.error("ProofEngine.applicableRules: 内部错误", e);
            return new ApplicableRules(List.of(), "none", 1, 0, internal(e));
        }
    }

    // --- 规范化 ---

    /**
     * 公式的规范文本；无法解析时为空。
     */
    public Optional<String> normalize(String formulaText) {
        try {
            return Optional.of(FormulaNormalizer.normalize(formulaText));
        } catch (ProofEngineException e) {
            logger.warn("ProofEngine.normalize: {}", e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.error("ProofEngine.normalize: 内部错误", e);
            return Optional.empty();
        }
    }

    private static Sequent sequent(List<String> premises, String conclusion) {
        List<Formula> parsed = FormulaParser.parseAll(premises == null ? List.of() : premises);
        return Sequent.of(parsed, FormulaParser.parse(conclusion));
    }

    private CancellationToken newToken() {
        return CancellationToken.withTimeoutMillis(settings.getTimeoutMillis());
    }

    private static VerificationError internal(RuntimeException e) {
        return VerificationError.of(ErrorKind.SYNTAX_ERROR, 0, null, "Internal error: " + e.getMessage());
    }
}
