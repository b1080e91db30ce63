package com.resilia.neurogrid.core.command;

import com.resilia.neurogrid.common.domain.enums.CommandKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandEmitterTest {

    private List<GridCommand> delivered;
    private CommandEmitter emitter;

    @BeforeEach
    void setUp() {
        delivered = new ArrayList<>();
        emitter = new CommandEmitter(delivered::add);
    }

    @Test
    void repeatedSetpointIsSentOnlyOnce() {
        GridCommand first = setpoint("battery", 20.0, 1_000);
        GridCommand sameValue = setpoint("battery", 20.0004, 2_000);

        assertEquals(1, emitter.emit(List.of(first)).size());
        assertTrue(emitter.emit(List.of(sameValue)).isEmpty());

        assertEquals(1, delivered.size());
        assertEquals(1L, emitter.getEmittedCount());
        assertEquals(1L, emitter.getSuppressedCount());
    }

    @Test
    void changedValueOrTargetIsSent() {
        emitter.emit(List.of(setpoint("battery", 20.0, 1_000)));
        List<GridCommand> sent = emitter.emit(List.of(
                setpoint("battery", 15.0, 2_000),
                setpoint("flywheel", 15.0, 2_000)));

        assertEquals(2, sent.size());
        assertEquals(3, delivered.size());
    }

    @Test
    void breakerOpenAndCloseAlternate() {
        assertEquals(1, emitter.emit(List.of(GridCommand.breakerOpen(1_000, "island"))).size());
        assertTrue(emitter.emit(List.of(GridCommand.breakerOpen(2_000, "island"))).isEmpty());

        assertEquals(1, emitter.emit(List.of(GridCommand.breakerClose(3_000, "resync"))).size());
        // 合闸后再次开闸必须重新下发
        List<GridCommand> reopened = emitter.emit(List.of(GridCommand.breakerOpen(4_000, "island")));
        assertEquals(1, reopened.size());
        assertEquals(CommandKind.BREAKER_OPEN, reopened.get(0).getKind());
    }

    @Test
    void resetForgetsIssuedCommands() {
        emitter.emit(List.of(setpoint("battery", 20.0, 1_000)));
        emitter.reset();

        assertEquals(1, emitter.emit(List.of(setpoint("battery", 20.0, 2_000))).size());
    }

    private static GridCommand setpoint(String tierId, double kw, long timestamp) {
        return GridCommand.builder()
                .kind(CommandKind.STORAGE_SETPOINT)
                .target(tierId)
                .value(kw)
                .cycleTimestamp(timestamp)
                .build();
    }
}
