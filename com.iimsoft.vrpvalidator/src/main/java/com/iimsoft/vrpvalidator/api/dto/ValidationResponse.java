package com.iimsoft.vrpvalidator.api.dto;

import java.util.List;

public class ValidationResponse {

    public boolean valid;

    /** 按规则顺序（E1000 → E1005）排列 */
    public List<ErrorDto> errors;

    public static class ErrorDto {
        public String code;
        public String cause;
        public String action;
        public String path;
        public List<String> references;
    }
}
