package com.resilia.neurogrid.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 运维清除故障请求
 */
@Data
public class FaultClearRequest {

    @NotBlank(message = "operator must not be blank")
    private String operator;

    @NotBlank(message = "reason must not be blank")
    private String reason;
}
