package com.mathhighlow.round.service;

import com.mathhighlow.engine.player.ComputerPlayer;
import com.mathhighlow.round.config.GameProperties;
import org.springframework.stereotype.Service;

import java.util.Random;

@Service
public class GameSessionFactory {

    private final GameProperties properties;
    private final Dealer dealer;
    private final ComputerPlayer computerPlayer;
    private final RoundScorer scorer;
    private final Random random;

    public GameSessionFactory(GameProperties properties, Dealer dealer, ComputerPlayer computerPlayer,
                              RoundScorer scorer, Random random) {
        this.properties = properties;
        this.dealer = dealer;
        this.computerPlayer = computerPlayer;
        this.scorer = scorer;
        this.random = random;
    }

    public GameSession create() {
        return new GameSession(properties, dealer, computerPlayer, scorer, random);
    }
}
