package com.iimsoft.vrpvalidator.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.vrpvalidator.api.dto.ProblemRequest;
import com.iimsoft.vrpvalidator.api.dto.ValidationResponse;
import com.iimsoft.vrpvalidator.domain.Fleet;
import com.iimsoft.vrpvalidator.domain.Job;
import com.iimsoft.vrpvalidator.domain.JobPlace;
import com.iimsoft.vrpvalidator.domain.JobTask;
import com.iimsoft.vrpvalidator.domain.Location;
import com.iimsoft.vrpvalidator.domain.Plan;
import com.iimsoft.vrpvalidator.domain.Problem;
import com.iimsoft.vrpvalidator.domain.TimeWindow;
import com.iimsoft.vrpvalidator.domain.VehicleShift;
import com.iimsoft.vrpvalidator.domain.VehicleType;
import com.iimsoft.vrpvalidator.validation.ProblemValidator;
import com.iimsoft.vrpvalidator.validation.ValidationError;
import com.iimsoft.vrpvalidator.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 把 JSON 请求转换成领域模型并执行校验的服务。
 * - 支持直接传入 ProblemRequest
 * - 也支持从文件或输入流读取 JSON
 */
public class ProblemValidationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProblemValidationService.class);

    // demand 是整数向量，1.5 这样的值必须报错而不是被截断成 1
    private final ObjectMapper mapper = new ObjectMapper()
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
    private final ProblemValidator validator;

    public ProblemValidationService() {
        this(ProblemValidator.withDefaults());
    }

    public ProblemValidationService(ProblemValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public ValidationResponse validate(ProblemRequest request) {
        Objects.requireNonNull(request, "request");
        ValidationResult result = validator.validate(toProblem(request));
        return toResponse(result);
    }

    public ProblemRequest readRequest(Path path) {
        LOGGER.debug("Reading problem from {}", path.toAbsolutePath());
        try (InputStream in = Files.newInputStream(path)) {
            return readRequest(in);
        } catch (IOException e) {
            throw new ProblemReadException("Cannot read problem file " + path.toAbsolutePath(), e);
        }
    }

    public ProblemRequest readRequest(InputStream in) {
        try {
            ProblemRequest request = mapper.readValue(in, ProblemRequest.class);
            if (request == null) {
                throw new ProblemReadException("Problem document is empty", null);
            }
            return request;
        } catch (IOException e) {
            throw new ProblemReadException("Cannot parse problem document: " + e.getMessage(), e);
        }
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    Problem toProblem(ProblemRequest dto) {
        List<Job> jobs = new ArrayList<>();
        if (dto.plan != null && dto.plan.jobs != null) {
            for (ProblemRequest.JobDto j : dto.plan.jobs) {
                jobs.add(j == null ? null : new Job(j.id, toTasks(j.pickups), toTasks(j.deliveries)));
            }
        }

        List<VehicleType> vehicles = new ArrayList<>();
        if (dto.fleet != null && dto.fleet.vehicles != null) {
            for (ProblemRequest.VehicleTypeDto v : dto.fleet.vehicles) {
                if (v == null) {
                    vehicles.add(null);
                    continue;
                }
                VehicleShift shift = new VehicleShift(v.shift == null ? null : toTimeWindows(v.shift.times));
                vehicles.add(new VehicleType(v.typeId, v.profile, v.vehicleIds, v.capacity, shift));
            }
        }
        return new Problem(new Plan(jobs), new Fleet(vehicles));
    }

    private static List<JobTask> toTasks(List<ProblemRequest.JobTaskDto> dtos) {
        List<JobTask> tasks = new ArrayList<>();
        if (dtos == null) {
            return tasks;
        }
        for (ProblemRequest.JobTaskDto t : dtos) {
            if (t == null) {
                tasks.add(null);
                continue;
            }
            List<JobPlace> places = new ArrayList<>();
            if (t.places != null) {
                for (ProblemRequest.JobPlaceDto p : t.places) {
                    if (p == null) continue;
                    Location location = p.location == null ? null : new Location(p.location.lat, p.location.lng);
                    places.add(new JobPlace(location, p.duration, p.tag));
                }
            }
            tasks.add(new JobTask(places, t.demand, toTimeWindows(t.times), t.tag));
        }
        return tasks;
    }

    /**
     * 每个时间窗必须正好两个元素；否则保留第一个值、end 置空，让校验规则报告为格式错误。
     */
    private static List<TimeWindow> toTimeWindows(List<List<String>> times) {
        List<TimeWindow> windows = new ArrayList<>();
        if (times == null) {
            return windows;
        }
        for (List<String> pair : times) {
            if (pair != null && pair.size() == 2) {
                windows.add(new TimeWindow(pair.get(0), pair.get(1)));
            } else {
                String start = pair == null || pair.isEmpty() ? null : pair.get(0);
                windows.add(new TimeWindow(start, null));
            }
        }
        return windows;
    }

    static ValidationResponse toResponse(ValidationResult result) {
        ValidationResponse resp = new ValidationResponse();
        resp.valid = result.isValid();
        List<ValidationResponse.ErrorDto> errors = new ArrayList<>();
        for (ValidationError e : result.getErrors()) {
            ValidationResponse.ErrorDto out = new ValidationResponse.ErrorDto();
            out.code = e.getCode().name();
            out.cause = e.getMessage();
            out.action = e.getAction();
            out.path = e.getPath();
            out.references = e.getReferences();
            errors.add(out);
        }
        resp.errors = errors;
        return resp;
    }
}
