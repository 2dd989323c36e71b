package com.iimsoft.vrpvalidator.validation;

import com.iimsoft.vrpvalidator.config.ValidatorConfig;
import com.iimsoft.vrpvalidator.domain.Problem;
import com.iimsoft.vrpvalidator.validation.interval.IntervalChecker;
import com.iimsoft.vrpvalidator.validation.rule.DuplicateJobIdsChecker;
import com.iimsoft.vrpvalidator.validation.rule.DuplicateVehicleIdsChecker;
import com.iimsoft.vrpvalidator.validation.rule.DuplicateVehicleTypeIdsChecker;
import com.iimsoft.vrpvalidator.validation.rule.JobDemandBalanceChecker;
import com.iimsoft.vrpvalidator.validation.rule.JobTimeWindowsChecker;
import com.iimsoft.vrpvalidator.validation.rule.VehicleShiftTimeChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * 统一入口：对一个已解析的问题定义执行所有规则，汇总全部错误。
 *
 * - 不会在第一个错误处停止，每条启用的规则都会执行；
 * - 规则按固定顺序（E1000 → E1005）执行/合并，同样的输入总是得到同样顺序的结果；
 * - 并行模式下每条规则写自己的结果列表，最后按规则顺序合并。
 */
public class ProblemValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProblemValidator.class);

    private final List<RuleChecker> checkers;
    private final ValidatorConfig config;

    public ProblemValidator() {
        this(defaultRules(), ValidatorConfig.defaults());
    }

    public ProblemValidator(ValidatorConfig config) {
        this(defaultRules(), config);
    }

    public ProblemValidator(List<RuleChecker> checkers, ValidatorConfig config) {
        if (checkers == null || checkers.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("checkers must not be null or contain null");
        }
        this.checkers = Collections.unmodifiableList(new ArrayList<>(checkers));
        this.config = config == null ? ValidatorConfig.defaults() : config;
    }

    /** Validator configured from the {@value ValidatorConfig#CONFIG_JSON_PROPERTY} system property. */
    public static ProblemValidator withDefaults() {
        return new ProblemValidator(ValidatorConfig.load());
    }

    /**
     * The full rule set in its fixed execution order. Both time window rules share one
     * {@link IntervalChecker}.
     */
    public static List<RuleChecker> defaultRules() {
        IntervalChecker intervalChecker = new IntervalChecker();
        List<RuleChecker> rules = new ArrayList<>();
        rules.add(new DuplicateJobIdsChecker());
        rules.add(new JobDemandBalanceChecker());
        rules.add(new JobTimeWindowsChecker(intervalChecker));
        rules.add(new DuplicateVehicleTypeIdsChecker());
        rules.add(new DuplicateVehicleIdsChecker());
        rules.add(new VehicleShiftTimeChecker(intervalChecker));
        return rules;
    }

    public List<RuleChecker> getCheckers() {
        return checkers;
    }

    public ValidatorConfig getConfig() {
        return config;
    }

    public ValidationResult validate(Problem problem) {
        Objects.requireNonNull(problem, "problem");

        List<RuleChecker> enabled = checkers.stream()
                .filter(c -> config.isEnabled(c.code()))
                .collect(Collectors.toList());

        List<List<ValidationError>> partials = config.isParallel() && enabled.size() > 1
                ? runParallel(enabled, problem)
                : runSequential(enabled, problem);

        List<ValidationError> errors = new ArrayList<>();
        for (int i = 0; i < enabled.size(); i++) {
            List<ValidationError> found = partials.get(i);
            LOGGER.debug("Rule {} reported {} error(s)", enabled.get(i).code(), found.size());
            errors.addAll(found);
        }

        LOGGER.info("Validated problem with {} job(s) and {} vehicle type(s): {} rule(s) run, {} error(s)",
                problem.getPlan().getJobs().size(), problem.getFleet().getVehicles().size(),
                enabled.size(), errors.size());
        return errors.isEmpty() ? ValidationResult.valid() : new ValidationResult(errors);
    }

    private static List<List<ValidationError>> runSequential(List<RuleChecker> rules, Problem problem) {
        List<List<ValidationError>> partials = new ArrayList<>(rules.size());
        for (RuleChecker rule : rules) {
            partials.add(nonNull(rule.check(problem)));
        }
        return partials;
    }

    /**
     * 每条规则作为一个 {@link CompletableFuture} 提交到 common pool，不为每次校验新建线程池。
     */
    private static List<List<ValidationError>> runParallel(List<RuleChecker> rules, Problem problem) {
        List<CompletableFuture<List<ValidationError>>> futures = new ArrayList<>(rules.size());
        for (RuleChecker rule : rules) {
            futures.add(CompletableFuture.supplyAsync(() -> nonNull(rule.check(problem))));
        }
        try {
            // 按提交顺序取结果，保证合并顺序与串行一致
            List<List<ValidationError>> partials = new ArrayList<>(rules.size());
            for (CompletableFuture<List<ValidationError>> future : futures) {
                partials.add(future.get());
            }
            return partials;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while validating problem", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Rule checker failed", cause);
        }
    }

    private static List<ValidationError> nonNull(List<ValidationError> errors) {
        return errors == null ? Collections.emptyList() : errors;
    }
}
