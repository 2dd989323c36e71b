package com.iimsoft.vrpvalidator.validation.rule;

import com.iimsoft.vrpvalidator.domain.Job;
import com.iimsoft.vrpvalidator.domain.JobTask;
import com.iimsoft.vrpvalidator.domain.Problem;
import com.iimsoft.vrpvalidator.validation.ErrorCode;
import com.iimsoft.vrpvalidator.validation.RuleChecker;
import com.iimsoft.vrpvalidator.validation.ValidationError;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * E1001: for a job with both pickups and deliveries, the dimension-wise sum of pickup demand
 * must equal the dimension-wise sum of delivery demand.
 *
 * 说明：
 * - 只有一侧（只有 pickup 或只有 delivery）的作业不检查；
 * - 空 demand 视为“没有需求”，不参与维度比较，求和时按 0 计；
 * - 维度不一致单独报错，不做补 0；
 * - 每个作业最多报一条错误。
 */
public class JobDemandBalanceChecker implements RuleChecker {

    @Override
    public ErrorCode code() {
        return ErrorCode.E1001;
    }

    @Override
    public List<ValidationError> check(Problem problem) {
        List<ValidationError> errors = new ArrayList<>();
        List<Job> jobs = problem.getPlan().getJobs();
        for (int i = 0; i < jobs.size(); i++) {
            Job job = jobs.get(i);
            if (job == null || job.getPickups().isEmpty() || job.getDeliveries().isEmpty()) {
                continue;
            }
            ValidationError error = checkJob(job, "plan.jobs[" + i + "]");
            if (error != null) {
                errors.add(error);
            }
        }
        return errors;
    }

    private ValidationError checkJob(Job job, String path) {
        Set<Integer> pickupDimensions = dimensions(job.getPickups());
        Set<Integer> deliveryDimensions = dimensions(job.getDeliveries());
        Set<Integer> all = new TreeSet<>(pickupDimensions);
        all.addAll(deliveryDimensions);
        if (all.size() > 1) {
            return ValidationError.of(code(),
                    "job '" + job.getId() + "' has demand of different dimensions: pickup " + pickupDimensions
                            + ", delivery " + deliveryDimensions,
                    path, String.valueOf(job.getId()));
        }

        int size = all.isEmpty() ? 0 : all.iterator().next();
        long[] pickupTotal = sum(job.getPickups(), size);
        long[] deliveryTotal = sum(job.getDeliveries(), size);
        if (Arrays.equals(pickupTotal, deliveryTotal)) {
            return null;
        }
        return ValidationError.of(code(),
                "job '" + job.getId() + "' sum of pickup demand " + Arrays.toString(pickupTotal)
                        + " is not equal to sum of delivery demand " + Arrays.toString(deliveryTotal),
                path, String.valueOf(job.getId()));
    }

    private static Set<Integer> dimensions(List<JobTask> tasks) {
        Set<Integer> sizes = new TreeSet<>();
        for (JobTask task : tasks) {
            if (task != null && !task.getDemand().isEmpty()) {
                sizes.add(task.getDemand().size());
            }
        }
        return sizes;
    }

    private static long[] sum(List<JobTask> tasks, int size) {
        long[] total = new long[size];
        for (JobTask task : tasks) {
            if (task == null) {
                continue;
            }
            List<Integer> demand = task.getDemand();
            for (int d = 0; d < demand.size(); d++) {
                Integer value = demand.get(d);
                total[d] += value == null ? 0 : value;
            }
        }
        return total;
    }
}
