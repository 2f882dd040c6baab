package ru.fundingengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import ru.fundingengine.config.FundingConfig;
import ru.fundingengine.dto.exchanges.ExchangeBalance;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.funding.ArbitrageOpportunity;
import ru.fundingengine.dto.funding.CycleResult;
import ru.fundingengine.dto.funding.CycleStatus;
import ru.fundingengine.dto.funding.EvaluatedOpportunity;
import ru.fundingengine.dto.funding.ExecutionPlan;
import ru.fundingengine.dto.funding.LadderAllocationResult;
import ru.fundingengine.dto.funding.OpenPositionPair;
import ru.fundingengine.dto.funding.PositionFilterResult;
import ru.fundingengine.dto.funding.SelectedOpportunity;
import ru.fundingengine.dto.funding.StickinessEvaluationResult;
import ru.fundingengine.event.AllocationPlanEvent;
import ru.fundingengine.event.PositionCloseDecisionEvent;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the decision engine. Exposes each stage separately and runs them in order once per cycle:
 * discover, evaluate, decide which open pairs to close, allocate capital, publish the plan.
 * Execution of the plan belongs to whoever listens for {@link AllocationPlanEvent}.
 */
@Slf4j
@Service
public class DecisionCycleService {

    private final FundingRateAggregator aggregator;
    private final OpportunityEvaluator evaluator;
    private final PositionStickinessManager stickinessManager;
    private final LadderAllocator ladderAllocator;
    private final BalanceSnapshotService balanceSnapshotService;
    private final PositionSnapshotService positionSnapshotService;
    private final PositionTrackingService positionTrackingService;
    private final ApplicationEventPublisher eventPublisher;
    private final FundingConfig fundingConfig;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Autowired
    public DecisionCycleService(FundingRateAggregator aggregator,
                                OpportunityEvaluator evaluator,
                                PositionStickinessManager stickinessManager,
                                LadderAllocator ladderAllocator,
                                BalanceSnapshotService balanceSnapshotService,
                                PositionSnapshotService positionSnapshotService,
                                PositionTrackingService positionTrackingService,
                                ApplicationEventPublisher eventPublisher,
                                FundingConfig fundingConfig) {
        this(aggregator, evaluator, stickinessManager, ladderAllocator, balanceSnapshotService,
                positionSnapshotService, positionTrackingService, eventPublisher, fundingConfig, Clock.systemUTC());
    }

    DecisionCycleService(FundingRateAggregator aggregator,
                         OpportunityEvaluator evaluator,
                         PositionStickinessManager stickinessManager,
                         LadderAllocator ladderAllocator,
                         BalanceSnapshotService balanceSnapshotService,
                         PositionSnapshotService positionSnapshotService,
                         PositionTrackingService positionTrackingService,
                         ApplicationEventPublisher eventPublisher,
                         FundingConfig fundingConfig,
                         Clock clock) {
        this.aggregator = aggregator;
        this.evaluator = evaluator;
        this.stickinessManager = stickinessManager;
        this.ladderAllocator = ladderAllocator;
        this.balanceSnapshotService = balanceSnapshotService;
        this.positionSnapshotService = positionSnapshotService;
        this.positionTrackingService = positionTrackingService;
        this.eventPublisher = eventPublisher;
        this.fundingConfig = fundingConfig;
        this.clock = clock;
    }

    /**
     * With no symbols the common assets are discovered first.
     */
    public List<ArbitrageOpportunity> discoverOpportunities(List<String> symbols, double minSpread) {
        List<String> targets = symbols;
        if (targets == null || targets.isEmpty()) {
            targets = aggregator.discoverCommonAssets();
        } else if (!aggregator.hasSymbolMappings()) {
            aggregator.discoverCommonAssets();
        }
        return aggregator.findArbitrageOpportunities(targets, minSpread);
    }

    public EvaluatedOpportunity evaluate(ArbitrageOpportunity opportunity, ExecutionPlan plan) {
        return evaluator.evaluate(opportunity, plan);
    }

    public Optional<SelectedOpportunity> rankAndSelect(List<EvaluatedOpportunity> evaluated) {
        return evaluator.rankAndSelect(evaluated);
    }

    public StickinessEvaluationResult shouldKeepPosition(String symbol, ExchangeType longExchange,
                                                        ExchangeType shortExchange, Double bestAlternativeSpread) {
        return stickinessManager.shouldKeepPosition(symbol, longExchange, shortExchange, bestAlternativeSpread);
    }

    public LadderAllocationResult allocate(List<EvaluatedOpportunity> ranked,
                                           List<OpenPositionPair> existingPositions,
                                           double totalCapital) {
        return ladderAllocator.allocate(ranked, existingPositions, totalCapital);
    }

    @Scheduled(fixedDelayString = "${funding.cycle.fixed-delay-ms:300000}")
    public void scheduledCycle() {
        if (!fundingConfig.getCycle().isEnabled()) {
            return;
        }
        try {
            Optional<List<OpenPositionPair>> positions = positionSnapshotService.snapshot();
            if (positions.isEmpty()) {
                log.warn("[Cycle] Open positions unknown, skipping cycle");
                return;
            }
            runCycle(positions.get());
        } catch (Exception e) {
            log.error("[Cycle] Error in decision cycle", e);
        }
    }

    /**
     * One full decision pass over the given open pairs.
     *
     * @throws IllegalStateException when another cycle is still running
     * @throws ru.fundingengine.exceptions.ArbitrageInvariantException when the open pairs hold two pairs for one symbol
     */
    public CycleResult runCycle(List<OpenPositionPair> existingPositions) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Decision cycle already running");
        }
        try {
            return doRunCycle(existingPositions);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private CycleResult doRunCycle(List<OpenPositionPair> existingPositions) {
        Instant startedAt = clock.instant();
        Map<String, OpenPositionPair> pairsBySymbol = LadderAllocator.indexBySymbol(existingPositions);

        log.info("[Cycle] Starting decision cycle with {} open pair(s)", existingPositions.size());

        List<String> symbols = aggregator.discoverCommonAssets();
        positionTrackingService.syncOpenPositions(existingPositions);

        if (aggregator.getListedExchangeCount() < 2 || symbols.isEmpty()) {
            log.warn("[Cycle] No usable market data: {} exchange(s) listed, {} common asset(s)",
                    aggregator.getListedExchangeCount(), symbols.size());
            return CycleResult.builder()
                    .status(CycleStatus.NO_DATA)
                    .discovered(List.of())
                    .evaluated(List.of())
                    .startedAt(startedAt)
                    .finishedAt(clock.instant())
                    .build();
        }

        List<ArbitrageOpportunity> discovered = aggregator.findArbitrageOpportunities(symbols,
                fundingConfig.getDiscovery().getMinSpread());

        List<EvaluatedOpportunity> evaluated = new ArrayList<>();
        for (ArbitrageOpportunity opportunity : discovered) {
            evaluated.add(evaluator.evaluate(opportunity, null));
        }

        List<EvaluatedOpportunity> qualified = evaluator.filterByPredictionQuality(evaluated,
                fundingConfig.getPrediction().getMinConfidenceThreshold(),
                fundingConfig.getPrediction().getMaxWorstCaseBreakEvenDays() * 24);

        Double bestSpread = qualified.isEmpty() ? null : qualified.get(0).getOpportunity().getSpread();
        PositionFilterResult positionDecisions = stickinessManager.filterPositionsToCloseWithStickiness(
                existingPositions, pairsBySymbol, bestSpread);
        for (OpenPositionPair position : positionDecisions.getToClose()) {
            positionTrackingService.recordClosed(position);
            eventPublisher.publishEvent(new PositionCloseDecisionEvent(position,
                    positionDecisions.getReasons().get(position.getSymbol())));
        }

        Map<ExchangeType, ExchangeBalance> balances = balanceSnapshotService.snapshot();
        int leverage = fundingConfig.getLadder().getLeverage();
        List<EvaluatedOpportunity> ranked = ladderAllocator.filterOpportunitiesForLadder(qualified,
                BalanceSnapshotService.toBalanceMap(balances), leverage);

        double capital = BalanceSnapshotService.totalCapital(balances);
        LadderAllocationResult allocation = ranked.isEmpty()
                ? LadderAllocationResult.empty(capital)
                : ladderAllocator.allocate(ranked, positionDecisions.getToKeep(), capital, leverage);

        CycleStatus status = allocation.getSelectedOpportunities().isEmpty()
                ? CycleStatus.NO_OPPORTUNITIES
                : CycleStatus.ALLOCATED;

        if (status == CycleStatus.ALLOCATED) {
            eventPublisher.publishEvent(new AllocationPlanEvent(allocation, clock.instant()));
        }

        log.info("[Cycle] {} | discovered {}, evaluated {}, ranked {}, selected {}, closing {}",
                status, discovered.size(), evaluated.size(), ranked.size(),
                allocation.getSelectedOpportunities().size(), positionDecisions.getToClose().size());

        return CycleResult.builder()
                .status(status)
                .discovered(discovered)
                .evaluated(evaluated)
                .positionDecisions(positionDecisions)
                .allocation(allocation)
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .build();
    }
}
