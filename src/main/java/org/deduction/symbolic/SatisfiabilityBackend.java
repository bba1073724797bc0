package org.deduction.symbolic;

import org.deduction.utils.CancellationToken;

/**
 * 可满足性判定后端。实现必须是完备的：只有在被取消或超时时才返回 UNKNOWN。
 */
public interface SatisfiabilityBackend {

    SatResult solve(ClauseSet clauses, CancellationToken token);

    String getName();
}
