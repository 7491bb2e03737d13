package com.mathhighlow.round.config;

import com.mathhighlow.engine.evaluation.ExpressionEvaluator;
import com.mathhighlow.engine.parse.ExpressionParser;
import com.mathhighlow.engine.player.ComputerPlayer;
import com.mathhighlow.engine.search.ExpressionOptimizer;
import com.mathhighlow.engine.search.FallbackExpressionBuilder;
import com.mathhighlow.engine.validation.ExpressionValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Exposes the framework-free engine components as beans.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public ExpressionValidator expressionValidator() {
        return new ExpressionValidator();
    }

    @Bean
    public ExpressionEvaluator expressionEvaluator() {
        return new ExpressionEvaluator();
    }

    @Bean
    public ExpressionOptimizer expressionOptimizer(ExpressionValidator validator, ExpressionEvaluator evaluator) {
        return new ExpressionOptimizer(validator, evaluator);
    }

    @Bean
    public FallbackExpressionBuilder fallbackExpressionBuilder() {
        return new FallbackExpressionBuilder();
    }

    @Bean
    public ComputerPlayer computerPlayer(ExpressionOptimizer optimizer, ExpressionValidator validator,
                                         FallbackExpressionBuilder fallbackBuilder) {
        return new ComputerPlayer(optimizer, validator, fallbackBuilder);
    }

    @Bean
    public ExpressionParser expressionParser() {
        return new ExpressionParser();
    }

    @Bean
    public Random gameRandom(GameProperties properties) {
        if (properties.getSeed() != null) {
            log.info("Using fixed game seed {}", properties.getSeed());
            return new Random(properties.getSeed());
        }
        return new Random();
    }
}
