package com.iimsoft.vrpvalidator.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.vrpvalidator.validation.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * 校验器配置。
 *
 * 配置来源（优先级从高到低）：
 * 1) JVM 参数：-Dvrp.validator.config=JSON，例如 {"parallel":true,"disabledRules":["E1001"]}
 * 2) 默认：串行执行，所有规则启用
 *
 * JSON 写错时记录告警并回退默认，避免整个校验不可用。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidatorConfig {

    /** JVM 参数 key */
    public static final String CONFIG_JSON_PROPERTY = "vrp.validator.config";

    private static final Logger LOGGER = LoggerFactory.getLogger(ValidatorConfig.class);

    /** 是否并行执行各规则；结果顺序与串行一致 */
    @JsonProperty("parallel")
    private boolean parallel;

    /** 跳过的规则 */
    @JsonProperty("disabledRules")
    private Set<ErrorCode> disabledRules = EnumSet.noneOf(ErrorCode.class);

    public ValidatorConfig() {
    }

    public ValidatorConfig(boolean parallel, Set<ErrorCode> disabledRules) {
        this.parallel = parallel;
        setDisabledRules(disabledRules);
    }

    public static ValidatorConfig defaults() {
        return new ValidatorConfig();
    }

    public static ValidatorConfig load() {
        return fromJson(System.getProperty(CONFIG_JSON_PROPERTY));
    }

    public static ValidatorConfig fromJson(String json) {
        if (json == null || json.isBlank()) {
            return defaults();
        }
        try {
            ValidatorConfig config = new ObjectMapper().readValue(json, ValidatorConfig.class);
            return config == null ? defaults() : config;
        } catch (JsonProcessingException e) {
            LOGGER.warn("Invalid {} value, falling back to defaults: {}", CONFIG_JSON_PROPERTY, e.getOriginalMessage());
            return defaults();
        }
    }

    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    public Set<ErrorCode> getDisabledRules() {
        return disabledRules;
    }

    public void setDisabledRules(Set<ErrorCode> disabledRules) {
        this.disabledRules = disabledRules == null || disabledRules.isEmpty()
                ? EnumSet.noneOf(ErrorCode.class)
                : EnumSet.copyOf(disabledRules);
    }

    public boolean isEnabled(ErrorCode code) {
        return !disabledRules.contains(code);
    }

    @Override
    public String toString() {
        return "ValidatorConfig{parallel=" + parallel + ", disabledRules=" + disabledRules + "}";
    }
}
