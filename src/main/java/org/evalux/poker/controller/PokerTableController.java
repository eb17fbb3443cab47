package org.evalux.poker.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.evalux.poker.dto.poker.ActionRequest;
import org.evalux.poker.dto.poker.PlayerRequest;
import org.evalux.poker.service.HandHistoryService;
import org.evalux.poker.service.poker.PokerGameService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/poker/tables")
@RequiredArgsConstructor
public class PokerTableController {
    private final PokerGameService game;
    private final HandHistoryService history;

    // POST /api/poker/tables/{id}/start : première main (ou reprise après fermeture d'une main)
    @PostMapping("/{id}/start")
    public ResponseEntity<Map<String, Object>> start(@PathVariable Long id) {
        return ResponseEntity.ok(game.start(id));
    }

    @PostMapping("/{id}/actions")
    public ResponseEntity<Map<String, Object>> action(@PathVariable Long id, @Valid @RequestBody ActionRequest req) {
        return ResponseEntity.ok(game.act(id, req.getUserId(), req.getAction(), req.getAmount()));
    }

    @PostMapping("/{id}/ready")
    public ResponseEntity<Map<String, Object>> ready(@PathVariable Long id, @Valid @RequestBody PlayerRequest req) {
        return ResponseEntity.ok(game.ready(id, req.getUserId()));
    }

    @PostMapping("/{id}/inter-hand/complete")
    public ResponseEntity<Map<String, Object>> completeInterHand(@PathVariable Long id) {
        return ResponseEntity.ok(game.completeInterHand(id));
    }

    @PostMapping("/{id}/abort")
    public ResponseEntity<Map<String, Object>> abort(@PathVariable Long id, @RequestBody(required = false) Map<String, String> body) {
        return ResponseEntity.ok(game.abort(id, body == null ? null : body.get("reason")));
    }

    // état filtré : les cartes des adversaires sont masquées pour le spectateur
    @GetMapping("/{id}/state")
    public ResponseEntity<Map<String, Object>> state(@PathVariable Long id, @RequestParam(required = false) Long viewer) {
        return ResponseEntity.ok(game.state(id, viewer));
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<List<Map<String, Object>>> history(@PathVariable Long id) {
        return ResponseEntity.ok(history.recentForTable(id));
    }
}
