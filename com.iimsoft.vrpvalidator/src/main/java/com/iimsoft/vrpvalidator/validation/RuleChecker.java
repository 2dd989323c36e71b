package com.iimsoft.vrpvalidator.validation;

import com.iimsoft.vrpvalidator.domain.Problem;

import java.util.List;

/**
 * One independent check over a parsed problem definition.
 *
 * Implementations are stateless and side-effect free, so the orchestrator may run them
 * in any order or concurrently.
 */
public interface RuleChecker {

    /**
     * @return the code every error produced by this checker carries
     */
    ErrorCode code();

    /**
     * Inspects the problem and returns all violations of this rule, in a deterministic
     * order (input order of the offending entities).
     *
     * @param problem parsed problem, never null
     * @return findings, empty when the rule holds
     */
    List<ValidationError> check(Problem problem);
}
