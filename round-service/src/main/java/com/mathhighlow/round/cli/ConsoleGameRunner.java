package com.mathhighlow.round.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mathhighlow.engine.model.Card;
import com.mathhighlow.engine.model.Expression;
import com.mathhighlow.engine.model.Hand;
import com.mathhighlow.engine.parse.ExpressionParser;
import com.mathhighlow.round.config.GameProperties;
import com.mathhighlow.round.model.DealtRound;
import com.mathhighlow.round.model.RoundResult;
import com.mathhighlow.round.service.GameSession;
import com.mathhighlow.round.service.GameSessionFactory;
import com.mathhighlow.round.service.PlayOutcome;
import com.mathhighlow.round.service.PlayerExpressionBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Scanner;
import java.util.stream.Collectors;

/**
 * Plays rounds against the computer on standard input and output.
 * Enabled with {@code game.console.enabled=true}; pass {@code --json} to print each result as JSON.
 *
 * <p>An expression is entered either card by card ({@code play 1 4 2}, then {@code submit}) or
 * typed out in full ({@code √4 × 3 + 2}).
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "game.console", name = "enabled", havingValue = "true")
public class ConsoleGameRunner implements CommandLineRunner {

    private final GameSessionFactory sessionFactory;
    private final ExpressionParser parser;
    private final GameProperties properties;
    private final ObjectMapper objectMapper;

    public ConsoleGameRunner(GameSessionFactory sessionFactory, ExpressionParser parser, GameProperties properties) {
        this.sessionFactory = sessionFactory;
        this.parser = parser;
        this.properties = properties;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void run(String... args) {
        boolean json = properties.getConsole().isJson() || Arrays.asList(args).contains("--json");
        play(new Scanner(System.in), System.out, json);
    }

    /**
     * Run a game until the credits run out, input ends, or the player quits.
     */
    public void play(Scanner in, PrintStream out, boolean json) {
        GameSession session = sessionFactory.create();
        out.println("=== MATH HIGH-LOW ===");
        out.println("Build an expression from your cards that lands closest to the target.");
        out.println("Play cards by position with 'play 1 4 2', then 'submit'; 'reset' starts over.");
        out.println("Or type the whole expression, e.g. 4 × 3 + 2. Type 'q' to quit.");
        out.println();

        while (!session.isGameOver()) {
            out.printf("Credits: you %d, computer %d. Bet %d-%d [%d]: ", session.getCredits(),
                    session.getAiCredits(), properties.getMinBet(), properties.getMaxBet(), session.getBet());
            if (!in.hasNextLine()) {
                break;
            }
            String betInput = in.nextLine().trim();
            if (isQuit(betInput)) {
                break;
            }
            if (!betInput.isEmpty()) {
                try {
                    session.placeBet(Integer.parseInt(betInput));
                } catch (NumberFormatException e) {
                    out.println("Not a number, keeping bet " + session.getBet());
                }
            }

            DealtRound round = session.startRound();
            out.println();
            out.printf("Round %d - target %d, bet %d%n", round.getRoundNumber(), round.getTarget(), round.getBet());
            out.println("Your hand: " + numbered(round.getPlayerHand()));

            Expression expression = readExpression(in, out, new PlayerExpressionBuilder(round.getPlayerHand()));
            if (expression == null) {
                break;
            }

            RoundResult result = session.submit(expression);
            out.println("Computer hand: " + describe(round.getAiHand()));
            printResult(out, result, json);
            out.println();
        }

        session.getGameWinner().ifPresent(winner -> out.println("Game over: " + winner + " wins"));
        out.printf("Final credits: you %d, computer %d after %d round(s)%n",
                session.getCredits(), session.getAiCredits(), session.getHistory().size());
    }

    private Expression readExpression(Scanner in, PrintStream out, PlayerExpressionBuilder builder) {
        while (true) {
            out.print("> ");
            if (!in.hasNextLine()) {
                return null;
            }
            String line = in.nextLine().trim();
            if (isQuit(line)) {
                return null;
            }

            String command = line.toLowerCase(Locale.ROOT);
            if (command.equals("submit")) {
                if (!builder.hasUsedRequiredSpecialCards()) {
                    out.println("Warning: not every special card has been played");
                }
                return builder.getExpression();
            }
            if (command.equals("reset")) {
                builder.reset();
                out.println("Cleared");
                continue;
            }
            if (command.startsWith("play")) {
                playCards(line.substring(4).trim(), builder, out);
                continue;
            }

            try {
                return parser.parse(line);
            } catch (IllegalArgumentException e) {
                out.println(e.getMessage());
            }
        }
    }

    /**
     * Play cards by their 1-based position in the hand listing, stopping at the first refusal.
     */
    private void playCards(String positions, PlayerExpressionBuilder builder, PrintStream out) {
        List<Card> cards = cardsOf(builder.getHand());
        for (String token : positions.split("[\\s,]+")) {
            if (token.isEmpty()) {
                continue;
            }
            int index;
            try {
                index = Integer.parseInt(token) - 1;
            } catch (NumberFormatException e) {
                out.println("Not a card position: " + token);
                break;
            }
            if (index < 0 || index >= cards.size()) {
                out.println("No card at position " + token);
                break;
            }

            PlayOutcome outcome = builder.play(cards.get(index));
            if (!outcome.isAccepted()) {
                out.println(cards.get(index).getDisplayText() + ": " + outcome.getMessage());
                break;
            }
        }
        String shown = builder.getExpression().toDisplayString();
        out.println("Expression: " + (shown.isEmpty() ? "-" : shown) + (builder.isRootPending() ? " √" : ""));
    }

    private void printResult(PrintStream out, RoundResult result, boolean json) {
        if (json) {
            try {
                out.println(objectMapper.writeValueAsString(result));
                return;
            } catch (JsonProcessingException e) {
                log.error("Could not serialize round result", e);
            }
        }

        out.println("You:      " + sideLine(result.getPlayerExpression(), result.getPlayerValue(), result.getPlayerError()));
        out.println("Computer: " + sideLine(result.getAiExpression(), result.getAiValue(), result.getAiError()));
        out.printf("Winner: %s (%+d credits)%n", result.getWinner(), result.getPlayerScoreChange());
    }

    private static String sideLine(String expression, Double value, String error) {
        if (value == null) {
            return (expression.isEmpty() ? "-" : expression) + "  ->  " + error;
        }
        return expression + " = " + String.format("%.2f", value);
    }

    private static List<Card> cardsOf(Hand hand) {
        List<Card> cards = new ArrayList<>(hand.getNumberCards());
        cards.addAll(hand.getOperatorCards());
        cards.addAll(hand.getSpecialCards());
        return cards;
    }

    static String describe(Hand hand) {
        return cardsOf(hand).stream().map(Card::getDisplayText).collect(Collectors.joining(" "));
    }

    static String numbered(Hand hand) {
        List<Card> cards = cardsOf(hand);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cards.size(); i++) {
            sb.append(i == 0 ? "" : "  ").append('[').append(i + 1).append("] ").append(cards.get(i).getDisplayText());
        }
        return sb.toString();
    }

    private static boolean isQuit(String input) {
        return input.equalsIgnoreCase("q") || input.equalsIgnoreCase("quit");
    }
}
