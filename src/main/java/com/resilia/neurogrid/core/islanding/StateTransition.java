package com.resilia.neurogrid.core.islanding;

import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StateTransition {

    ConnectionState from;

    ConnectionState to;

    long timestamp;

    String reason;
}
