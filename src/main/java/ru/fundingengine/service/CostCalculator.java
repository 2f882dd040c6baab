package ru.fundingengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.fundingengine.config.FundingConfig;
import ru.fundingengine.dto.exchanges.BidAsk;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.dto.exchanges.OrderType;
import ru.fundingengine.dto.funding.TradeCosts;

import java.util.OptionalDouble;

/**
 * Trading cost model: fees, square-root market impact and the funding shift caused by
 * our own size. All methods are pure.
 */
@Slf4j
@Service
public class CostCalculator {

    //Used when the book has no usable mid price
    private static final double DEFAULT_SPREAD_FRACTION = 0.001;
    private static final double MAKER_BASE_SLIPPAGE = 0.0001;
    private static final double MAX_IMPACT_SLIPPAGE = 0.02;
    private static final double TAKER_FLAT_SLIPPAGE = 0.0005;
    private static final double MAKER_FLAT_SLIPPAGE = 0.0001;
    //Funding shift for a position equal to 100% of open interest
    private static final double FUNDING_IMPACT_PER_OI = 0.001;
    private static final double MAX_FUNDING_IMPACT = 0.0005;

    private final FundingConfig fundingConfig;

    public CostCalculator(FundingConfig fundingConfig) {
        this.fundingConfig = fundingConfig;
    }

    public double slippage(double notional, double bestBid, double bestAsk,
                           double openInterest, OrderType orderType) {
        double mid = (bestBid + bestAsk) / 2;
        double spreadFraction = mid > 0 ? (bestAsk - bestBid) / mid : DEFAULT_SPREAD_FRACTION;

        double base = orderType.isTaker() ? spreadFraction / 2 : MAKER_BASE_SLIPPAGE;

        if (openInterest > 0) {
            double liquidityRatio = notional / openInterest;
            double impact = Math.min(Math.sqrt(Math.min(liquidityRatio, 1)) * spreadFraction * 2, MAX_IMPACT_SLIPPAGE);
            return notional * (base + impact);
        }

        return notional * (orderType.isTaker() ? TAKER_FLAT_SLIPPAGE : MAKER_FLAT_SLIPPAGE);
    }

    public double slippage(double notional, BidAsk book, double openInterest, OrderType orderType) {
        if (book == null) {
            return slippage(notional, 0, 0, openInterest, orderType);
        }
        return slippage(notional, book.getBid(), book.getAsk(), openInterest, orderType);
    }

    /**
     * Expected shift of the hourly funding rate caused by adding {@code notional} to the book.
     */
    public double fundingImpact(double notional, double openInterest, double currentRate) {
        if (openInterest <= 0 || Double.isNaN(currentRate)) {
            return 0.0;
        }
        double impact = Math.min(notional / openInterest * FUNDING_IMPACT_PER_OI, MAX_FUNDING_IMPACT);
        return Double.isNaN(impact) ? 0.0 : impact;
    }

    public double fees(double notional, ExchangeType exchange, boolean maker) {
        double rate = maker ? fundingConfig.getMakerFeeRate(exchange) : fundingConfig.getTakerFeeRate(exchange);
        return notional * rate;
    }

    /**
     * Empty when the position never breaks even
     */
    public OptionalDouble breakEvenHours(double totalCosts, double hourlyReturn) {
        if (hourlyReturn <= 0) {
            return OptionalDouble.empty();
        }
        if (totalCosts <= 0) {
            return OptionalDouble.of(0.0);
        }
        return OptionalDouble.of(totalCosts / hourlyReturn);
    }

    /**
     * Costs of trading both legs at {@code notional}. On entry the exit fees are included,
     * so {@link TradeCosts#getTotal()} is the round trip.
     */
    public TradeCosts tradeCosts(double notional,
                                 ExchangeType longExchange, ExchangeType shortExchange,
                                 BidAsk longBook, BidAsk shortBook,
                                 double longOpenInterest, double shortOpenInterest,
                                 double basisDivergence, OrderType orderType, boolean isEntry) {
        boolean maker = !orderType.isTaker();

        double oneWayFees = fees(notional, longExchange, maker) + fees(notional, shortExchange, maker);
        double totalFees = isEntry ? oneWayFees * 2 : oneWayFees;

        double slippage = slippage(notional, longBook, longOpenInterest, orderType)
                + slippage(notional, shortBook, shortOpenInterest, orderType);

        double basisRisk = notional * Math.abs(basisDivergence);

        TradeCosts costs = TradeCosts.of(totalFees, slippage, basisRisk);
        log.debug("[Costs] ${} {}/{}: fees={} slippage={} basis={}",
                String.format("%.0f", notional), longExchange, shortExchange,
                String.format("%.4f", costs.getFees()),
                String.format("%.4f", costs.getSlippage()),
                String.format("%.4f", costs.getBasisRiskCost()));
        return costs;
    }
}
