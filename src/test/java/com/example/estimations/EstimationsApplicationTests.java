package com.example.estimations;

import com.example.estimations.controller.GameController;
import com.example.estimations.handler.GameWebSocketHandler;
import com.example.estimations.service.GameService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class EstimationsApplicationTests {

    @Autowired
    private GameService gameService;

    @Autowired
    private GameController gameController;

    @Autowired
    private GameWebSocketHandler gameWebSocketHandler;

    @Test
    void contextLoads_andEngineIsWired() {
        assertNotNull(gameController);
        assertNotNull(gameWebSocketHandler);

        String id = gameService.createGame("Smoke", null);
        assertTrue(gameService.gameExists(id));
        assertTrue(gameService.stopGame(id));
    }
}
