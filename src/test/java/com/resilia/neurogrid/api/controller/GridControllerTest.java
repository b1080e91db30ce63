package com.resilia.neurogrid.api.controller;

import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import com.resilia.neurogrid.common.exception.GlobalExceptionHandler;
import com.resilia.neurogrid.core.controller.ControllerFixture;
import com.resilia.neurogrid.core.islanding.GridSignal;
import com.resilia.neurogrid.core.islanding.IslandingInputs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GridControllerTest {

    private static final String CLEAR_BODY = "{\"operator\":\"ops\",\"reason\":\"inverter replaced\"}";

    private ControllerFixture fixture;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        fixture = new ControllerFixture(ControllerFixture.defaultProperties());
        mockMvc = MockMvcBuilders
                .standaloneSetup(new GridController(fixture.controller, fixture.stateMachine))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void clearingOutsideFaultIsConflict() throws Exception {
        mockMvc.perform(post("/api/grid/fault/clear").contentType(MediaType.APPLICATION_JSON).content(CLEAR_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.extra.kind").value("INVALID_OPERATION"))
                .andExpect(jsonPath("$.extra.subject").value("node-a"));

        assertEquals(ConnectionState.GRID_CONNECTED, fixture.stateMachine.getState());
    }

    @Test
    void clearingFaultMovesToIslandDetected() throws Exception {
        long now = System.currentTimeMillis();
        fixture.stateMachine.evaluate(IslandingInputs.builder()
                .gridSignal(GridSignal.builder().lastHeartbeatAt(now).frequencyHz(50.0).voltagePu(1.0).phaseDeg(0.0).build())
                .localFailure(true)
                .build(), now);
        assertEquals(ConnectionState.FAULT, fixture.stateMachine.getState());

        mockMvc.perform(post("/api/grid/fault/clear").contentType(MediaType.APPLICATION_JSON).content(CLEAR_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.from").value("FAULT"))
                .andExpect(jsonPath("$.data.to").value("ISLAND_DETECTED"));

        assertEquals(ConnectionState.ISLAND_DETECTED, fixture.stateMachine.getState());
        assertEquals(ConnectionState.ISLAND_DETECTED, fixture.node.getConnectionState());
    }

    @Test
    void blankOperatorIsRejected() throws Exception {
        mockMvc.perform(post("/api/grid/fault/clear").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operator\":\"\",\"reason\":\"x\"}"))
                .andExpect(status().isBadRequest());

        assertEquals(ConnectionState.GRID_CONNECTED, fixture.stateMachine.getState());
    }
}
