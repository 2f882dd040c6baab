package ru.fundingengine.exchanges.factory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import ru.fundingengine.dto.exchanges.ExchangeType;
import ru.fundingengine.exchanges.BalanceProvider;
import ru.fundingengine.exchanges.FundingDataProvider;
import ru.fundingengine.exchanges.PositionProvider;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Component
public class FundingProviderFactory {

    private final Map<ExchangeType, FundingDataProvider> fundingProviders = new EnumMap<>(ExchangeType.class);
    private final Map<ExchangeType, BalanceProvider> balanceProviders = new EnumMap<>(ExchangeType.class);
    private final Map<ExchangeType, PositionProvider> positionProviders = new EnumMap<>(ExchangeType.class);

    @Autowired
    public FundingProviderFactory(ObjectProvider<FundingDataProvider> fundingProviderList,
                                  ObjectProvider<BalanceProvider> balanceProviderList,
                                  ObjectProvider<PositionProvider> positionProviderList) {
        this(fundingProviderList.orderedStream().toList(), balanceProviderList.orderedStream().toList(),
                positionProviderList.orderedStream().toList());
    }

    public FundingProviderFactory(List<FundingDataProvider> fundingProviderList,
                                  List<BalanceProvider> balanceProviderList) {
        this(fundingProviderList, balanceProviderList, List.of());
    }

    public FundingProviderFactory(List<FundingDataProvider> fundingProviderList,
                                  List<BalanceProvider> balanceProviderList,
                                  List<PositionProvider> positionProviderList) {
        for (FundingDataProvider provider : fundingProviderList) {
            if (fundingProviders.put(provider.getType(), provider) != null) {
                throw new IllegalArgumentException("Duplicate funding provider for " + provider.getType());
            }
        }
        for (BalanceProvider provider : balanceProviderList) {
            if (balanceProviders.put(provider.getType(), provider) != null) {
                throw new IllegalArgumentException("Duplicate balance provider for " + provider.getType());
            }
        }
        for (PositionProvider provider : positionProviderList) {
            if (positionProviders.put(provider.getType(), provider) != null) {
                throw new IllegalArgumentException("Duplicate position provider for " + provider.getType());
            }
        }

        log.info("[ProviderFactory] Initialized with {} funding providers: {}, {} balance providers: {}, "
                        + "{} position providers: {}",
                fundingProviders.size(),
                fundingProviders.keySet(),
                balanceProviders.size(),
                balanceProviders.keySet(),
                positionProviders.size(),
                positionProviders.keySet());
    }

    public FundingDataProvider getFundingProvider(ExchangeType type) {
        FundingDataProvider provider = fundingProviders.get(type);

        if (provider == null) {
            throw new IllegalArgumentException("Funding provider not found: " + type);
        }

        return provider;
    }

    public boolean hasFundingProvider(ExchangeType type) {
        return fundingProviders.containsKey(type);
    }

    public List<FundingDataProvider> getAllFundingProviders() {
        return List.copyOf(fundingProviders.values());
    }

    public List<BalanceProvider> getAllBalanceProviders() {
        return List.copyOf(balanceProviders.values());
    }

    public List<PositionProvider> getAllPositionProviders() {
        return List.copyOf(positionProviders.values());
    }

    public Set<ExchangeType> getExchangeTypes() {
        return Collections.unmodifiableSet(fundingProviders.keySet());
    }
}
