package com.gurukul.karmaLedger.karma.controller;

import com.gurukul.karmaLedger.karma.dto.BalanceRequest;
import com.gurukul.karmaLedger.karma.dto.EvaluateRequest;
import com.gurukul.karmaLedger.karma.dto.GuidanceResponse;
import com.gurukul.karmaLedger.karma.dto.RewardRequest;
import com.gurukul.karmaLedger.karma.model.ActionEvaluation;
import com.gurukul.karmaLedger.karma.model.AdaptedReward;
import com.gurukul.karmaLedger.karma.model.NetKarmaResult;
import com.gurukul.karmaLedger.karma.service.KarmaApiService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Karma REST controller - thin HTTP layer over the scoring engine.
 *
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Extract the request id header
 * - Delegate to KarmaApiService
 */
@RestController
@RequestMapping("/api/v1/karma")
@RequiredArgsConstructor
public class KarmaController {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    private final KarmaApiService karmaApiService;

    @PostMapping("/evaluate")
    public ResponseEntity<ActionEvaluation> evaluate(
            @Valid @RequestBody EvaluateRequest request,
            @RequestHeader(value = REQUEST_ID_HEADER, required = false) String requestId) {
        return ResponseEntity.ok(karmaApiService.evaluate(request, requestId));
    }

    @PostMapping("/net")
    public ResponseEntity<NetKarmaResult> net(@RequestBody BalanceRequest request) {
        return ResponseEntity.ok(karmaApiService.netKarma(request.getBalances()));
    }

    @PostMapping("/guidance")
    public ResponseEntity<GuidanceResponse> guidance(@RequestBody BalanceRequest request) {
        return ResponseEntity.ok(karmaApiService.guidance(request.getBalances()));
    }

    @PostMapping("/reward")
    public ResponseEntity<AdaptedReward> reward(@Valid @RequestBody RewardRequest request) {
        return ResponseEntity.ok(karmaApiService.reward(request));
    }

    /**
     * Net karma of a stored user.
     *
     * @param userId user document id
     * @return aggregate result, 404 when the user is unknown
     */
    @GetMapping("/users/{userId}/net")
    public ResponseEntity<NetKarmaResult> userNet(@PathVariable String userId) {
        return ResponseEntity.ok(karmaApiService.netKarmaForUser(userId));
    }
}
