package com.mathhighlow.round.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything decided when a round is scored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoundResult {
    private int target;
    private int bet;

    private String playerExpression;
    private Double playerValue; // null when the expression failed
    private double playerDistance;
    private String playerError;

    private String aiExpression;
    private Double aiValue;
    private double aiDistance;
    private String aiError;

    private Winner winner;
    private int playerScoreChange;
    private int aiScoreChange;
}
