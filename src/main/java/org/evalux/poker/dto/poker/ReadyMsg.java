package org.evalux.poker.dto.poker;

import lombok.Data;

@Data
public class ReadyMsg {
    private Long tableId;
    private Long userId;
}
