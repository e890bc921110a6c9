package com.brixo.outbreak.game.config;

import com.brixo.outbreak.game.model.GameSettings;
import com.brixo.outbreak.game.service.GameState;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Beans del estado de partida.
 *
 * El lock, el reloj y la fuente aleatoria se exponen como beans para que los
 * tests puedan sustituirlos.
 */
@Configuration
public class GameConfig {

    /** Valores de arranque; el operador los sustituye al pasar a "prepare". */
    @Bean
    public GameState gameState(
            @Value("${outbreak.game.defaults.human-percentage:50}") int humanPercentage,
            @Value("${outbreak.game.defaults.timeout-seconds:30}") int timeoutSeconds,
            @Value("${outbreak.game.defaults.duration-minutes:15}") int durationMinutes) {
        return new GameState(new GameSettings(humanPercentage, timeoutSeconds, durationMinutes));
    }

    /** Lock único que protege registro, fase y grupos. */
    @Bean
    public Lock gameStateLock() {
        return new ReentrantLock();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random random() {
        return new Random();
    }
}
