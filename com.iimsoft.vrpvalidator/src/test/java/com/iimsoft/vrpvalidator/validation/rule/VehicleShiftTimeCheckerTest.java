package com.iimsoft.vrpvalidator.validation.rule;

import com.iimsoft.vrpvalidator.domain.TimeWindow;
import com.iimsoft.vrpvalidator.validation.ErrorCode;
import com.iimsoft.vrpvalidator.validation.ValidationError;
import com.iimsoft.vrpvalidator.validation.interval.IntervalChecker;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.iimsoft.vrpvalidator.TestProblems.at;
import static com.iimsoft.vrpvalidator.TestProblems.delivery;
import static com.iimsoft.vrpvalidator.TestProblems.fleet;
import static com.iimsoft.vrpvalidator.TestProblems.jobs;
import static com.iimsoft.vrpvalidator.TestProblems.vehicleType;
import static org.assertj.core.api.Assertions.assertThat;

class VehicleShiftTimeCheckerTest {

    private final VehicleShiftTimeChecker checker = new VehicleShiftTimeChecker();

    @Test
    void validShiftsPass() {
        assertThat(checker.check(fleet(
                vehicleType("car", List.of("v1"), at("06:00", "12:00"), at("12:00", "18:00"))))).isEmpty();
    }

    @Test
    void overlappingShiftWindowsAreReported() {
        List<ValidationError> errors = checker.check(fleet(
                vehicleType("car", List.of("v1"), at("08:00", "18:00")),
                vehicleType("truck", List.of("v2"), at("10:00", "14:00"), at("13:00", "17:00"))));

        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getCode()).isEqualTo(ErrorCode.E1005);
        assertThat(errors.get(0).getReferences()).containsExactly("truck");
        assertThat(errors.get(0).getPath())
                .isEqualTo("fleet.vehicles[1].shift.times[0], fleet.vehicles[1].shift.times[1]");
    }

    @Test
    void findsTheSameProblemsAsJobTimeWindows() {
        TimeWindow[] windows = {
                at("10:00", "14:00"), at("13:00", "17:00"),
                TimeWindow.of("2020-07-04T12:00:00Z", "2020-07-04T11:00:00Z"),
                TimeWindow.of("noon", "2020-07-04T18:00:00Z")
        };
        IntervalChecker intervals = new IntervalChecker();

        List<ValidationError> shiftErrors = new VehicleShiftTimeChecker(intervals)
                .check(fleet(vehicleType("car", List.of("v1"), windows)));
        List<ValidationError> jobErrors = new JobTimeWindowsChecker(intervals)
                .check(jobs(delivery("job1", windows)));

        assertThat(shiftErrors).hasSameSizeAs(jobErrors).hasSize(3);
        for (int i = 0; i < shiftErrors.size(); i++) {
            String shiftDetail = shiftErrors.get(i).getMessage().replace("vehicle type 'car' shift: ", "");
            String jobDetail = jobErrors.get(i).getMessage().replace("job 'job1' delivery #0: ", "");
            assertThat(shiftDetail).isEqualTo(jobDetail);
        }
    }
}
