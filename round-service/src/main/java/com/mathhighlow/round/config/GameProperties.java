package com.mathhighlow.round.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule values for dealing, betting and targets, bound from {@code game.*}.
 */
@Data
@ConfigurationProperties(prefix = "game")
public class GameProperties {

    /** Copies of each number 0..10 in the slot deck. */
    private int numberCopiesPerValue = 4;

    private int forcedMultiplyCards = 2;

    private int unaryRootCards = 2;

    /** Slot cards drawn before topping up with numbers. */
    private int initialCardCount = 3;

    private int requiredNumberCards = 3;

    private int startingCredits = 20;

    private int minBet = 1;

    private int maxBet = 5;

    private List<Integer> targetValues = new ArrayList<>(List.of(1, 20));

    /** Fixed seed for reproducible shuffles; random when unset. */
    private Long seed;

    private Console console = new Console();

    @Data
    public static class Console {
        private boolean enabled = false;
        private boolean json = false;
    }
}
