package com.example.goserver.controller;

import com.example.goserver.model.dto.CreateGameRequest;
import com.example.goserver.model.dto.GameStateDTO;
import com.example.goserver.model.dto.SeatResponse;
import com.example.goserver.service.GameService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/games")
public class GameController {

    static final MediaType SGF = MediaType.parseMediaType("application/x-go-sgf");

    private final GameService gameService;

    public GameController(GameService gameService) {
        this.gameService = gameService;
    }

    @PostMapping
    public ResponseEntity<SeatResponse> createGame(@RequestBody CreateGameRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(gameService.createGame(request));
    }

    @GetMapping("/{gameId}")
    public GameStateDTO getGame(@PathVariable String gameId) {
        return gameService.getGame(gameId);
    }

    @GetMapping("/code/{code}")
    public GameStateDTO findByCode(@PathVariable String code) {
        return gameService.findByCode(code);
    }

    @GetMapping("/{gameId}/sgf")
    public ResponseEntity<String> exportSgf(@PathVariable String gameId) {
        return ResponseEntity.ok()
                .contentType(SGF)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + gameId + ".sgf\"")
                .body(gameService.exportSgf(gameId));
    }

    /** The AI engine's own view of the result; advisory, 204 for games without an AI. */
    @GetMapping("/{gameId}/ai-score")
    public ResponseEntity<String> aiScoreEstimate(@PathVariable String gameId) {
        String estimate = gameService.aiScoreEstimate(gameId);
        return estimate == null ? ResponseEntity.noContent().build() : ResponseEntity.ok(estimate);
    }
}
