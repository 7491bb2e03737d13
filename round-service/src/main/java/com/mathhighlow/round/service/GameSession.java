package com.mathhighlow.round.service;

import com.mathhighlow.engine.model.Expression;
import com.mathhighlow.engine.model.Hand;
import com.mathhighlow.engine.player.ComputerPlayer;
import com.mathhighlow.round.config.GameProperties;
import com.mathhighlow.round.model.DealtRound;
import com.mathhighlow.round.model.RoundResult;
import com.mathhighlow.round.model.Winner;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * One player's game against the computer: both sides' credits, the current bet and the
 * round in play. The game ends when either side runs out of credits.
 * Not thread-safe; create one per player with {@link GameSessionFactory}.
 */
@Slf4j
public class GameSession {

    private final GameProperties properties;
    private final Dealer dealer;
    private final ComputerPlayer computerPlayer;
    private final RoundScorer scorer;
    private final Random random;

    private final List<RoundResult> history = new ArrayList<>();
    private int credits;
    private int aiCredits;
    private int bet;
    private int roundNumber;
    private DealtRound currentRound;

    public GameSession(GameProperties properties, Dealer dealer, ComputerPlayer computerPlayer,
                       RoundScorer scorer, Random random) {
        if (properties.getTargetValues() == null || properties.getTargetValues().isEmpty()) {
            throw new IllegalArgumentException("At least one target value must be configured");
        }
        if (properties.getMinBet() > properties.getMaxBet()) {
            throw new IllegalArgumentException("min-bet " + properties.getMinBet()
                    + " is greater than max-bet " + properties.getMaxBet());
        }
        this.properties = properties;
        this.dealer = dealer;
        this.computerPlayer = computerPlayer;
        this.scorer = scorer;
        this.random = random;
        this.credits = properties.getStartingCredits();
        this.aiCredits = properties.getStartingCredits();
        this.bet = clampBet(properties.getMinBet());
    }

    /**
     * Set the bet for the next round, clamped to the configured range and to the credits left.
     *
     * @return the bet actually placed
     */
    public int placeBet(int requested) {
        if (currentRound != null) {
            throw new IllegalStateException("Bet cannot change while round " + roundNumber + " is in play");
        }
        bet = clampBet(requested);
        return bet;
    }

    private int clampBet(int requested) {
        int clamped = Math.max(properties.getMinBet(), Math.min(requested, properties.getMaxBet()));
        return Math.max(0, Math.min(clamped, credits));
    }

    /**
     * Deal both hands, pick a target and let the computer choose its expression.
     */
    public DealtRound startRound() {
        if (isGameOver()) {
            throw new IllegalStateException("Game is over: " + getGameWinner().orElseThrow() + " has won");
        }
        if (currentRound != null) {
            throw new IllegalStateException("Round " + roundNumber + " has not been submitted yet");
        }

        Hand playerHand = new Hand();
        Hand aiHand = new Hand();
        dealer.dealHand(playerHand);
        dealer.dealHand(aiHand);

        List<Integer> targets = properties.getTargetValues();
        int target = targets.get(random.nextInt(targets.size()));
        bet = clampBet(bet);

        roundNumber++;
        currentRound = DealtRound.builder()
                .roundNumber(roundNumber)
                .target(target)
                .bet(bet)
                .playerHand(playerHand)
                .aiHand(aiHand)
                .aiExpression(computerPlayer.playTurn(aiHand, target))
                .build();

        log.debug("Round {} started: target {}, bet {}", roundNumber, target, bet);
        return currentRound;
    }

    /**
     * Score the player's expression against the computer's and settle the bet.
     */
    public RoundResult submit(Expression playerExpression) {
        if (currentRound == null) {
            throw new IllegalStateException("No round in play");
        }

        RoundResult result = scorer.score(currentRound.getTarget(), currentRound.getBet(),
                currentRound.getPlayerHand(), playerExpression,
                currentRound.getAiHand(), currentRound.getAiExpression());

        credits += result.getPlayerScoreChange();
        aiCredits += result.getAiScoreChange();
        history.add(result);
        currentRound = null;

        if (isGameOver()) {
            log.info("Game over after {} rounds, {} wins ({} to {})",
                    roundNumber, getGameWinner().orElseThrow(), credits, aiCredits);
        }
        return result;
    }

    public boolean isGameOver() {
        return credits <= 0 || aiCredits <= 0;
    }

    /**
     * The side left with credits once the game is over, empty while it is still running.
     */
    public Optional<Winner> getGameWinner() {
        if (credits <= 0) {
            return Optional.of(Winner.AI);
        }
        if (aiCredits <= 0) {
            return Optional.of(Winner.PLAYER);
        }
        return Optional.empty();
    }

    public int getCredits() {
        return credits;
    }

    public int getAiCredits() {
        return aiCredits;
    }

    public int getBet() {
        return bet;
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    public DealtRound getCurrentRound() {
        return currentRound;
    }

    public List<RoundResult> getHistory() {
        return Collections.unmodifiableList(history);
    }
}
