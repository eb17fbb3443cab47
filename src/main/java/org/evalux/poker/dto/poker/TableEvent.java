package org.evalux.poker.dto.poker;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TableEvent {
    private String type;
    private Long tableId;
    private Object payload;
}
