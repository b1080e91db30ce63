package com.resilia.neurogrid.api.controller;

import com.resilia.neurogrid.api.dto.FaultClearRequest;
import com.resilia.neurogrid.api.dto.NodeStateView;
import com.resilia.neurogrid.common.web.result.ApiResult;
import com.resilia.neurogrid.common.web.result.ResultCode;
import com.resilia.neurogrid.core.controller.LocalController;
import com.resilia.neurogrid.core.controller.NodeSnapshot;
import com.resilia.neurogrid.core.dispatch.DispatchPlan;
import com.resilia.neurogrid.core.estimator.ForecastWindow;
import com.resilia.neurogrid.core.islanding.IslandingStateMachine;
import com.resilia.neurogrid.core.islanding.StateTransition;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 节点状态、预测、调度与故障清除接口
 */
@Slf4j
@RestController
@RequestMapping("/api/grid")
@RequiredArgsConstructor
public class GridController {

    private final LocalController localController;
    private final IslandingStateMachine stateMachine;

    @GetMapping("/state")
    public ApiResult<NodeStateView> state() {
        return ApiResult.success(NodeStateView.from(localController.latestSnapshot()));
    }

    @GetMapping("/forecast")
    public ApiResult<ForecastWindow> forecast() {
        NodeSnapshot snapshot = localController.latestSnapshot();
        if (snapshot.getForecast() == null) {
            return ApiResult.error(ResultCode.DATA_NOT_FOUND.getCode(), "当前没有可用的预测");
        }
        return ApiResult.success(snapshot.getForecast());
    }

    @GetMapping("/plan")
    public ApiResult<DispatchPlan> plan() {
        NodeSnapshot snapshot = localController.latestSnapshot();
        if (snapshot.getPlan() == null) {
            return ApiResult.error(ResultCode.DATA_NOT_FOUND.getCode(), "当前周期没有调度计划");
        }
        return ApiResult.success(snapshot.getPlan());
    }

    @GetMapping("/transitions")
    public ApiResult<List<StateTransition>> transitions() {
        return ApiResult.success(stateMachine.history());
    }

    /**
     * 运维清除 FAULT
     */
    @PostMapping("/fault/clear")
    public ApiResult<StateTransition> clearFault(@Valid @RequestBody FaultClearRequest request) {
        StateTransition transition = stateMachine.clearFault(request.getOperator(), request.getReason(),
                System.currentTimeMillis());
        return ApiResult.success("故障已清除", transition);
    }
}
