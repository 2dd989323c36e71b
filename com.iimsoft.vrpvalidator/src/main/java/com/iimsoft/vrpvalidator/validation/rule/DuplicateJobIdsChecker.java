package com.iimsoft.vrpvalidator.validation.rule;

import com.iimsoft.vrpvalidator.domain.Problem;
import com.iimsoft.vrpvalidator.validation.ErrorCode;
import com.iimsoft.vrpvalidator.validation.RuleChecker;
import com.iimsoft.vrpvalidator.validation.ValidationError;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * E1000: every job id must be unique within the plan. One error per duplicated id.
 */
public class DuplicateJobIdsChecker implements RuleChecker {

    @Override
    public ErrorCode code() {
        return ErrorCode.E1000;
    }

    @Override
    public List<ValidationError> check(Problem problem) {
        List<String> ids = problem.getPlan().getJobs().stream()
                .map(job -> job == null ? null : job.getId())
                .collect(Collectors.toList());

        List<ValidationError> errors = new ArrayList<>();
        for (Map.Entry<String, List<Integer>> e : IdOccurrences.duplicates(ids).entrySet()) {
            List<Integer> positions = e.getValue();
            String path = positions.stream().map(i -> "plan.jobs[" + i + "].id").collect(Collectors.joining(", "));
            errors.add(ValidationError.of(code(),
                    "job id '" + e.getKey() + "' is used by " + positions.size() + " jobs",
                    path, e.getKey()));
        }
        return errors;
    }
}
