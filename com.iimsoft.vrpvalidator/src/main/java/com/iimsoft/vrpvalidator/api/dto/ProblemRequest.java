package com.iimsoft.vrpvalidator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * 问题定义的 JSON 结构（pragmatic 格式的子集）。
 *
 * 时间窗写成两个 RFC3339 字符串组成的数组：["2020-07-04T09:00:00Z", "2020-07-04T18:00:00Z"]
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProblemRequest {

    public PlanDto plan;
    public FleetDto fleet;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PlanDto {
        public List<JobDto> jobs;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobDto {
        public String id;
        public List<JobTaskDto> pickups;
        public List<JobTaskDto> deliveries;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobTaskDto {
        public List<JobPlaceDto> places;
        /** 每个维度一个数量 */
        public List<Integer> demand;
        public List<List<String>> times;
        public String tag;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobPlaceDto {
        public LocationDto location;
        /** 服务时长（秒） */
        public double duration;
        public String tag;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LocationDto {
        public double lat;
        public double lng;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FleetDto {
        public List<VehicleTypeDto> vehicles;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VehicleTypeDto {
        public String typeId;
        public String profile;
        public List<String> vehicleIds;
        public List<Integer> capacity;
        public ShiftDto shift;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ShiftDto {
        public List<List<String>> times;
    }
}
