package com.iimsoft.vrpvalidator.validation;

import com.iimsoft.vrpvalidator.config.ValidatorConfig;
import com.iimsoft.vrpvalidator.domain.Problem;
import com.iimsoft.vrpvalidator.domain.TimeWindow;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

import static com.iimsoft.vrpvalidator.TestProblems.at;
import static com.iimsoft.vrpvalidator.TestProblems.delivery;
import static com.iimsoft.vrpvalidator.TestProblems.demand;
import static com.iimsoft.vrpvalidator.TestProblems.pickupDelivery;
import static com.iimsoft.vrpvalidator.TestProblems.problem;
import static com.iimsoft.vrpvalidator.TestProblems.task;
import static com.iimsoft.vrpvalidator.TestProblems.vehicleType;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProblemValidatorTest {

    /** One instance of every rule violation. */
    private static Problem sixProblems() {
        return problem(
                List.of(
                        delivery("job1", at("09:00", "10:00")),
                        delivery("job1", at("11:00", "12:00")),
                        pickupDelivery("job2", task(demand(1)), task(demand(2))),
                        delivery("job3", TimeWindow.of("2020-07-04T12:00:00Z", "2020-07-04T11:00:00Z"))),
                List.of(
                        vehicleType("car", List.of("v1"), at("08:00", "18:00")),
                        vehicleType("car", List.of("v2"), at("08:00", "18:00")),
                        vehicleType("truck", List.of("v1"), at("10:00", "14:00"), at("13:00", "17:00"))));
    }

    private static Problem validProblem() {
        return problem(
                List.of(
                        delivery("job1", at("09:00", "10:00"), at("10:00", "11:00")),
                        pickupDelivery("job2", task(demand(1, 2), at("08:00", "09:00")), task(demand(1, 2)))),
                List.of(
                        vehicleType("car", List.of("car_1", "car_2"), at("08:00", "18:00")),
                        vehicleType("truck", List.of("truck_1"), at("06:00", "12:00"), at("13:00", "20:00"))));
    }

    @Test
    void validProblemHasNoErrors() {
        ValidationResult result = new ProblemValidator().validate(validProblem());

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    void reportsEveryProblemInRuleOrder() {
        ValidationResult result = new ProblemValidator().validate(sixProblems());

        assertThat(result.isValid()).isFalse();
        assertThat(result.getCodes()).containsExactly(
                ErrorCode.E1000, ErrorCode.E1001, ErrorCode.E1002,
                ErrorCode.E1003, ErrorCode.E1004, ErrorCode.E1005);
        assertThat(result.getErrors(ErrorCode.E1004).get(0).getReferences()).containsExactly("v1", "car", "truck");
    }

    @Test
    void identicalInputGivesIdenticalOutput() {
        ProblemValidator validator = new ProblemValidator();

        assertThat(validator.validate(sixProblems())).isEqualTo(validator.validate(sixProblems()));
    }

    @Test
    void parallelRunMatchesSequentialRun() {
        ValidationResult sequential = new ProblemValidator().validate(sixProblems());
        ValidationResult parallel = new ProblemValidator(new ValidatorConfig(true, null)).validate(sixProblems());

        assertThat(parallel.getErrors()).containsExactlyElementsOf(sequential.getErrors());
    }

    @Test
    void disabledRulesAreSkipped() {
        ValidatorConfig config = new ValidatorConfig(false, EnumSet.of(ErrorCode.E1001, ErrorCode.E1004));

        ValidationResult result = new ProblemValidator(config).validate(sixProblems());

        assertThat(result.getCodes()).containsExactly(ErrorCode.E1000, ErrorCode.E1002, ErrorCode.E1003, ErrorCode.E1005);
    }

    @Test
    void laterCheckersRunAfterOneReportsErrors() {
        RuleChecker first = fixed(ErrorCode.E1000, 2);
        RuleChecker second = fixed(ErrorCode.E1003, 1);

        ValidationResult result = new ProblemValidator(List.of(first, second), null).validate(validProblem());

        assertThat(result.getCodes()).containsExactly(ErrorCode.E1000, ErrorCode.E1000, ErrorCode.E1003);
    }

    @Test
    void acceptsImmutableRuleList() {
        ProblemValidator validator = new ProblemValidator(List.of(fixed(ErrorCode.E1002, 1)), ValidatorConfig.defaults());

        assertThat(validator.validate(validProblem()).getCodes()).containsExactly(ErrorCode.E1002);
    }

    @Test
    void checkerFailurePropagatesInBothModes() {
        RuleChecker broken = new RuleChecker() {
            @Override
            public ErrorCode code() {
                return ErrorCode.E1001;
            }

            @Override
            public List<ValidationError> check(Problem problem) {
                throw new IllegalStateException("boom");
            }
        };
        List<RuleChecker> rules = List.of(fixed(ErrorCode.E1000, 1), broken);

        assertThatThrownBy(() -> new ProblemValidator(rules, ValidatorConfig.defaults()).validate(validProblem()))
                .isInstanceOf(IllegalStateException.class).hasMessage("boom");
        assertThatThrownBy(() -> new ProblemValidator(rules, new ValidatorConfig(true, null)).validate(validProblem()))
                .isInstanceOf(IllegalStateException.class).hasMessage("boom");
    }

    @Test
    void rejectsMissingArguments() {
        assertThatThrownBy(() -> new ProblemValidator(null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ProblemValidator(Arrays.asList(fixed(ErrorCode.E1000, 1), null), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ProblemValidator().validate(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void defaultRulesCoverEveryCodeInOrder() {
        assertThat(ProblemValidator.defaultRules()).extracting(RuleChecker::code)
                .containsExactly(ErrorCode.values());
    }

    private static RuleChecker fixed(ErrorCode code, int count) {
        return new RuleChecker() {
            @Override
            public ErrorCode code() {
                return code;
            }

            @Override
            public List<ValidationError> check(Problem problem) {
                return Collections.nCopies(count, ValidationError.of(code, "fixed", null));
            }
        };
    }
}
