package com.resilia.neurogrid.core.command;

import com.resilia.neurogrid.common.domain.enums.CommandKind;
import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandGateTest {

    private final CommandGate gate = new CommandGate();

    private final List<GridCommand> all = List.of(
            command(CommandKind.STORAGE_SETPOINT, "battery"),
            command(CommandKind.LOAD_SHED, "ev-charging"),
            GridCommand.breakerOpen(1_000, "island"),
            GridCommand.breakerClose(1_000, "resync"));

    @Test
    void faultOnlyLetsSafetyCommandsThrough() {
        CommandGate.GateResult result = gate.filter(all, ConnectionState.FAULT);

        assertEquals(List.of(CommandKind.LOAD_SHED, CommandKind.BREAKER_OPEN), kinds(result.allowed()));
        assertEquals(List.of(CommandKind.STORAGE_SETPOINT, CommandKind.BREAKER_CLOSE), kinds(result.withheld()));
    }

    @Test
    void islandedStatesWithholdGridTie() {
        for (ConnectionState state : List.of(ConnectionState.ISLAND_DETECTED,
                ConnectionState.ISLAND_STABLE, ConnectionState.RESYNCHRONIZING)) {
            CommandGate.GateResult result = gate.filter(all, state);
            assertEquals(List.of(CommandKind.BREAKER_CLOSE), kinds(result.withheld()), state.name());
            assertEquals(3, result.allowed().size());
        }
    }

    @Test
    void gridConnectedAllowsEverything() {
        CommandGate.GateResult result = gate.filter(all, ConnectionState.GRID_CONNECTED);

        assertEquals(4, result.allowed().size());
        assertTrue(result.withheld().isEmpty());
    }

    private static GridCommand command(CommandKind kind, String target) {
        return GridCommand.builder().kind(kind).target(target).value(1.0).cycleTimestamp(1_000).build();
    }

    private static List<CommandKind> kinds(List<GridCommand> commands) {
        return commands.stream().map(GridCommand::getKind).toList();
    }
}
