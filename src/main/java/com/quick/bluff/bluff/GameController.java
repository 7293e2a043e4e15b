package com.quick.bluff.bluff;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
@CrossOrigin("*")
public class GameController {

    private final SessionRegistry sessionRegistry;

    @GetMapping
    public ResponseEntity<List<GameView>> listGames() {
        return ResponseEntity.ok(sessionRegistry.views());
    }

    @GetMapping("/{gameId}")
    public ResponseEntity<GameView> getGame(@PathVariable String gameId) {
        return sessionRegistry.view(gameId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
