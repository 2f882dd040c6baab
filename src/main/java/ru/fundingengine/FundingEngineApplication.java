package ru.fundingengine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;
import ru.fundingengine.exchanges.factory.FundingProviderFactory;

@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties
public class FundingEngineApplication {

    public static void main(String[] args) {
        ApplicationContext context = SpringApplication.run(FundingEngineApplication.class, args);
        FundingProviderFactory providers = context.getBean(FundingProviderFactory.class);

        log.info("[FundingEngine] Decision engine started with exchanges: {}", providers.getExchangeTypes());
    }
}
