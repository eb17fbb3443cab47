package org.evalux.poker.dto.poker;

import lombok.Data;

@Data
public class ActionMsg {
    private Long tableId;
    private Long userId;
    private String action;   // fold, check, call, bet, raise, all_in, ready
    private Long amount;
}
