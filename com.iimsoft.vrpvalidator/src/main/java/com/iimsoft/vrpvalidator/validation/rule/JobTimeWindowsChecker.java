package com.iimsoft.vrpvalidator.validation.rule;

import com.iimsoft.vrpvalidator.domain.Job;
import com.iimsoft.vrpvalidator.domain.JobTask;
import com.iimsoft.vrpvalidator.domain.Problem;
import com.iimsoft.vrpvalidator.domain.TaskRole;
import com.iimsoft.vrpvalidator.validation.ErrorCode;
import com.iimsoft.vrpvalidator.validation.RuleChecker;
import com.iimsoft.vrpvalidator.validation.ValidationError;
import com.iimsoft.vrpvalidator.validation.interval.IntervalChecker;
import com.iimsoft.vrpvalidator.validation.interval.IntervalViolation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * E1002: time windows of every pickup and delivery task, checked by {@link IntervalChecker}.
 * One error per interval violation, tagged with job id, task role and task index.
 */
public class JobTimeWindowsChecker implements RuleChecker {

    private final IntervalChecker intervalChecker;

    public JobTimeWindowsChecker() {
        this(new IntervalChecker());
    }

    public JobTimeWindowsChecker(IntervalChecker intervalChecker) {
        this.intervalChecker = Objects.requireNonNull(intervalChecker, "intervalChecker");
    }

    @Override
    public ErrorCode code() {
        return ErrorCode.E1002;
    }

    @Override
    public List<ValidationError> check(Problem problem) {
        List<ValidationError> errors = new ArrayList<>();
        List<Job> jobs = problem.getPlan().getJobs();
        for (int i = 0; i < jobs.size(); i++) {
            Job job = jobs.get(i);
            if (job == null) {
                continue;
            }
            for (TaskRole role : TaskRole.values()) {
                List<JobTask> tasks = job.getTasks(role);
                for (int t = 0; t < tasks.size(); t++) {
                    JobTask task = tasks.get(t);
                    if (task == null) {
                        continue;
                    }
                    String timesPath = "plan.jobs[" + i + "]." + role.getFieldName() + "[" + t + "].times";
                    for (IntervalViolation v : intervalChecker.check(task.getTimes())) {
                        errors.add(ValidationError.of(code(),
                                "job '" + job.getId() + "' " + role.getDisplayName() + " #" + t + ": " + v.describe(),
                                TimePaths.of(timesPath, v), String.valueOf(job.getId())));
                    }
                }
            }
        }
        return errors;
    }
}
