package com.gurukul.karmaLedger.karma.service;

import com.gurukul.karmaLedger.karma.dto.EvaluateRequest;
import com.gurukul.karmaLedger.karma.dto.GuidanceResponse;
import com.gurukul.karmaLedger.karma.dto.RewardRequest;
import com.gurukul.karmaLedger.karma.exception.UserNotFoundException;
import com.gurukul.karmaLedger.karma.model.ActionEvaluation;
import com.gurukul.karmaLedger.karma.model.AdaptedReward;
import com.gurukul.karmaLedger.karma.model.BalanceSheet;
import com.gurukul.karmaLedger.karma.model.NetKarmaResult;
import com.gurukul.karmaLedger.ledger.service.KarmaChainLogger;
import com.gurukul.karmaLedger.repository.UserDocumentRepository;
import com.gurukul.karmaLedger.util.UserIdMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Entry point for the karma HTTP endpoints.
 *
 * Responsibilities:
 * - Normalize raw balances into a {@link BalanceSheet}
 * - Delegate scoring to the evaluator, aggregator, recommender and reward adapter
 * - Record evaluated actions in the ledger
 *
 * Scoring stays pure: this service never writes balances back. Applying deltas is the
 * caller's job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KarmaApiService {

    private final KarmaEvaluator karmaEvaluator;
    private final NetKarmaAggregator netKarmaAggregator;
    private final CorrectiveGuidanceRecommender recommender;
    private final KarmicSignals karmicSignals;
    private final RewardAdapter rewardAdapter;
    private final RoleLadder roleLadder;
    private final UserDocumentRepository userDocumentRepository;
    private final KarmaChainLogger karmaChainLogger;
    private final CorrelationIdService correlationIdService;

    /**
     * Evaluates an action and records a karma_action entry for it.
     *
     * Workflow:
     * NORMALIZE -> EVALUATE -> RECORD KARMA ACTION -> RECORD TIMING
     */
    public ActionEvaluation evaluate(EvaluateRequest request, String requestIdHeader) {
        String requestId = correlationIdService.resolve(requestIdHeader);
        long startNanos = System.nanoTime();

        BalanceSheet sheet = BalanceSheet.from(request.getBalances());
        double intensity = request.getIntensity() != null ? request.getIntensity() : KarmaEvaluator.DEFAULT_INTENSITY;
        ActionEvaluation evaluation = karmaEvaluator.evaluate(sheet, request.getAction(), intensity);

        log.info("Action evaluated - requestId: {}, userId: {}, action: {}, classification: {}, netKarma: {}",
                requestId, UserIdMasker.mask(request.getUserId()), evaluation.getAction(),
                evaluation.getClassification(), evaluation.getNetKarma());

        String role = roleLadder.roleFor(rewardAdapter.merit(sheet));
        karmaChainLogger.logKarmaAction(requestId, request.getUserId(), evaluation.getAction(),
                evaluation.getNetKarma(), role, "evaluate", Map.of(
                        "classification", evaluation.getClassification().name(),
                        "intensity", intensity,
                        "positive_impact", evaluation.getPositiveImpact(),
                        "negative_impact", evaluation.getNegativeImpact(),
                        "rnanubandhan_delta", evaluation.getRnanubandhanDelta()));

        double elapsedMs = (System.nanoTime() - startNanos) / 1_000_000.0;
        karmaChainLogger.logPerformanceMetric(requestId, "karma_evaluation", elapsedMs, "ms", request.getUserId());
        return evaluation;
    }

    public NetKarmaResult netKarma(Map<String, Object> balances) {
        return netKarmaAggregator.aggregate(BalanceSheet.from(balances));
    }

    public GuidanceResponse guidance(Map<String, Object> balances) {
        BalanceSheet sheet = BalanceSheet.from(balances);
        return GuidanceResponse.builder()
                .netKarma(netKarmaAggregator.aggregate(sheet).getNetKarma())
                .dridhaRatio(karmicSignals.dridhaRatio(sheet))
                .totalDebt(karmicSignals.totalDebt(sheet))
                .purusharthaScores(netKarmaAggregator.purusharthaScores(sheet))
                .recommendations(recommender.recommendForSheet(sheet))
                .build();
    }

    public AdaptedReward reward(RewardRequest request) {
        return rewardAdapter.adapt(BalanceSheet.from(request.getBalances()), request.getAction(),
                request.getBaseReward());
    }

    /**
     * Net karma for a stored user.
     *
     * @throws UserNotFoundException when no document exists for {@code userId}
     */
    public NetKarmaResult netKarmaForUser(String userId) {
        Document user = userDocumentRepository.findById(userId);
        if (user == null) {
            throw new UserNotFoundException("User not found: " + userId);
        }
        log.debug("Aggregating stored balances - userId: {}", UserIdMasker.mask(userId));
        return netKarmaAggregator.aggregate(BalanceSheet.fromUserDocument(user));
    }
}
