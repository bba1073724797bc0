package org.deduction.hints;

import org.deduction.core.Sequent;
import org.deduction.errors.ProofEngineException;
import org.deduction.syntax.ParsedProof;
import org.deduction.syntax.ProofScriptParser;
import org.deduction.verifier.ProofState;
import org.deduction.verifier.ProofVerifier;
import org.deduction.verifier.VerificationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 回答"按已写下的行，现在可以用哪些规则"。
 * <p>
 * 部分证明经校验器重放 (不检查结论)，随后按顺序询问各个提供者，采用第一个成功的回答。
 */
public class RuleAdvisor {

    private static final Logger logger = LoggerFactory.getLogger(RuleAdvisor.class);

    private final List<RuleSuggestionProvider> providers;
    private final ProofVerifier verifier = new ProofVerifier();

    public RuleAdvisor() {
        this(List.of(new StateRuleProvider(), new GoalShapeRuleProvider()));
    }

    public RuleAdvisor(List<RuleSuggestionProvider> providers) {
        Objects.requireNonNull(providers, "Providers cannot be null.");
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("At least one rule provider is required.");
        }
        this.providers = List.copyOf(providers);
    }

    public ApplicableRules applicableRules(Sequent sequent, String partialProof) {
        Objects.requireNonNull(sequent, "Sequent cannot be null.");
        ProofState state = null;
        VerificationError error = null;
        int nextLine = sequent.getPremises().size() + 1;
        try {
            ParsedProof parsed = ProofScriptParser.parse(partialProof == null ? "" : partialProof, sequent.getPremises());
            state = verifier.replay(parsed, sequent);
            error = state.getError();
            nextLine = state.getNextLine();
        } catch (ProofEngineException e) {
            logger.warn("RuleAdvisor: 部分证明无法解析: {}", e.getMessage());
            error = VerificationError.from(e);
        }
        HintContext context = new HintContext(sequent, state, error);
        for (RuleSuggestionProvider provider : providers) {
            ProviderResult result = provider.suggest(context);
            if (result.isSuccess()) {
                logger.debug("RuleAdvisor: {} 给出 {}", provider.getName(), result.getSuggestions());
                return new ApplicableRules(result.getSuggestions(), provider.getName(), nextLine,
                        state == null ? 0 : state.getDepth(), error);
            }
            logger.debug("RuleAdvisor: {} 未能回答: {}", provider.getName(), result.getFailureReason());
        }
        return new ApplicableRules(List.of(), "none", nextLine, 0, error);
    }
}
