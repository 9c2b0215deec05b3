package com.gurukul.karmaLedger.karma.controller;

import com.gurukul.karmaLedger.config.KarmaConfig;
import com.gurukul.karmaLedger.config.KarmaConfigLoader;
import com.gurukul.karmaLedger.karma.service.BalanceSheetSignals;
import com.gurukul.karmaLedger.karma.service.CorrectiveGuidanceRecommender;
import com.gurukul.karmaLedger.karma.service.CorrelationIdService;
import com.gurukul.karmaLedger.karma.service.KarmaApiService;
import com.gurukul.karmaLedger.karma.service.KarmaEvaluator;
import com.gurukul.karmaLedger.karma.service.NetKarmaAggregator;
import com.gurukul.karmaLedger.karma.service.RewardAdapter;
import com.gurukul.karmaLedger.karma.service.RoleLadder;
import com.gurukul.karmaLedger.karma.service.TokenWeightedScorer;
import com.gurukul.karmaLedger.ledger.service.KarmaChainLogger;
import com.gurukul.karmaLedger.repository.UserDocumentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.closeTo;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class KarmaControllerTest {

    private KarmaChainLogger chainLogger;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        KarmaConfig config = KarmaConfigLoader.load(KarmaConfigLoader.DEFAULT_RESOURCE);
        NetKarmaAggregator aggregator = new NetKarmaAggregator(config, new TokenWeightedScorer(config));
        BalanceSheetSignals signals = new BalanceSheetSignals();
        CorrectiveGuidanceRecommender recommender = new CorrectiveGuidanceRecommender(config, signals, aggregator);
        KarmaEvaluator evaluator = new KarmaEvaluator(config, recommender);
        RoleLadder roleLadder = new RoleLadder(config);
        RewardAdapter rewardAdapter = new RewardAdapter(config, evaluator, roleLadder);

        chainLogger = mock(KarmaChainLogger.class);
        KarmaApiService service = new KarmaApiService(evaluator, aggregator, recommender, signals, rewardAdapter,
                roleLadder, new UserDocumentRepository("data/users.json"), chainLogger, new CorrelationIdService());

        mockMvc = MockMvcBuilders.standaloneSetup(new KarmaController(service))
                .setControllerAdvice(new GlobalExceptionHandler(chainLogger))
                .build();
    }

    @Test
    void evaluateReturnsEvaluationAndRecordsKarmaAction() throws Exception {
        mockMvc.perform(post("/api/v1/karma/evaluate")
                        .header(KarmaController.REQUEST_ID_HEADER, "req-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"cheat\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.classification").value("DEMERIT"))
                .andExpect(jsonPath("$.negativeImpact").value(12.0))
                .andExpect(jsonPath("$.netKarma").value(-12.0))
                .andExpect(jsonPath("$.correctiveRecommendations[0].practice").value("Tap"))
                .andExpect(jsonPath("$.correctiveRecommendations[0].urgency").value("high"));

        verify(chainLogger).logKarmaAction(eq("req-42"), isNull(), eq("cheat"), eq(-12.0), eq("learner"),
                eq("evaluate"), anyMap());
    }

    @Test
    void evaluateRejectsBlankAction() throws Exception {
        mockMvc.perform(post("/api/v1/karma/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verify(chainLogger).logValidationError(isNull(), eq("invalid_field"), eq("action"), anyString(), isNull());
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/karma/net")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"balances\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void netAggregatesLegacyScalarDebt() throws Exception {
        mockMvc.perform(post("/api/v1/karma/net")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"balances\":{\"Rnanubandhan\":12.5}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.breakdown.rnanubandhan").value(37.5))
                .andExpect(jsonPath("$.netKarma").value(-37.5));

        verifyNoInteractions(chainLogger);
    }

    @Test
    void guidanceForMissingBalances() throws Exception {
        mockMvc.perform(post("/api/v1/karma/guidance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dridhaRatio").value(0.5))
                .andExpect(jsonPath("$.recommendations[0].practice").value("Seva"))
                .andExpect(jsonPath("$.recommendations[1].practice").value("Meditation"));
    }

    @Test
    void rewardIsAdjustedByKarma() throws Exception {
        mockMvc.perform(post("/api/v1/karma/reward")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"completing_lessons\",\"baseReward\":10}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.adjustedReward", closeTo(11.0, 1e-9)))
                .andExpect(jsonPath("$.nextRole").value("learner"));
    }

    @Test
    void rewardRequiresBaseReward() throws Exception {
        mockMvc.perform(post("/api/v1/karma/reward")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"completing_lessons\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void storedUserNetKarma() throws Exception {
        mockMvc.perform(get("/api/v1/karma/users/test_user_001/net"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.netKarma", closeTo(296.0, 1e-9)));
    }

    @Test
    void unknownUserIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/karma/users/nobody/net"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("USER_NOT_FOUND"));
    }
}
