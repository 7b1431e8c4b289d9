package com.basepulse.indexer.controller;

import com.basepulse.indexer.entity.LeaderboardEntry;
import com.basepulse.indexer.service.LeaderboardMetric;
import com.basepulse.indexer.service.ProjectionQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only leaderboard and distribution ledger endpoints.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class LeaderboardController {

    private final ProjectionQueryService queryService;

    @GetMapping("/leaderboard")
    public ResponseEntity<Map<String, Object>> comprehensive(@RequestParam(defaultValue = "10") int limit) {
        Map<String, Object> response = new HashMap<>();
        response.put("leaderboard", queryService.comprehensive(limit));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/leaderboard/{metric}")
    public ResponseEntity<Map<String, Object>> top(@PathVariable String metric,
                                                   @RequestParam(defaultValue = "0") int page,
                                                   @RequestParam(defaultValue = "10") int limit) {
        LeaderboardMetric parsed = parseMetric(metric);
        List<LeaderboardEntry> users = queryService.top(parsed, page, limit);

        Map<String, Object> response = new HashMap<>();
        response.put("metric", parsed);
        response.put("users", users);
        response.put("page", page);
        response.put("limit", limit);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/leaderboard/stats")
    public ResponseEntity<Map<String, Object>> totals() {
        return ResponseEntity.ok(queryService.totals());
    }

    @GetMapping("/leaderboard/user/{address}")
    public ResponseEntity<Map<String, Object>> user(@PathVariable String address) {
        Map<String, Object> response = new HashMap<>();
        response.put("stats", queryService.userStats(address));
        response.put("rankByRewards", queryService.rankByRewards(address).orElse(null));
        response.put("rankByVotes", queryService.rankByVotes(address).orElse(null));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/polls/{chainId}/{pollId}/distributions")
    public ResponseEntity<Map<String, Object>> distributions(@PathVariable Long chainId, @PathVariable Long pollId) {
        return queryService.findPoll(chainId, pollId)
                .map(poll -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("poll", poll);
                    response.put("distributions", queryService.distributionsForPoll(chainId, pollId));
                    return ResponseEntity.ok(response);
                })
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", e.getMessage());
        return ResponseEntity.badRequest().body(response);
    }

    private static LeaderboardMetric parseMetric(String metric) {
        return switch (metric.toLowerCase()) {
            case "rewards" -> LeaderboardMetric.REWARDS;
            case "votes" -> LeaderboardMetric.VOTES;
            case "creators" -> LeaderboardMetric.POLLS_CREATED;
            case "participation" -> LeaderboardMetric.PARTICIPATION;
            default -> throw new IllegalArgumentException("Unknown leaderboard metric " + metric);
        };
    }
}
