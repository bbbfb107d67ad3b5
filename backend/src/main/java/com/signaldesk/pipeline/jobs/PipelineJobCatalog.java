package com.signaldesk.pipeline.jobs;

import com.signaldesk.pipeline.config.PipelineProperties;
import com.signaldesk.pipeline.scheduler.AsyncJobHandler;
import com.signaldesk.pipeline.scheduler.BlockingJobHandler;
import com.signaldesk.pipeline.scheduler.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

@Configuration
public class PipelineJobCatalog {
    private static final Logger log = LoggerFactory.getLogger(PipelineJobCatalog.class);

    public static List<JobDefinition> definitions(
        MarketQuotesJob marketQuotes,
        EconomicIndicatorsJob economicIndicators,
        InsiderTradesJob insiderTrades,
        FinancialNewsJob financialNews
    ) {
        return List.of(
            new JobDefinition(MarketQuotesJob.NAME, Duration.ofMinutes(15), new BlockingJobHandler(marketQuotes::run)),
            new JobDefinition(EconomicIndicatorsJob.NAME, Duration.ofHours(24), new BlockingJobHandler(economicIndicators::run)),
            new JobDefinition(InsiderTradesJob.NAME, Duration.ofHours(24), new BlockingJobHandler(insiderTrades::run)),
            new JobDefinition(FinancialNewsJob.NAME, Duration.ofHours(3), new AsyncJobHandler(financialNews::run))
        );
    }

    @Bean
    public JobRegistry jobRegistry(
        PipelineProperties properties,
        MarketQuotesJob marketQuotes,
        EconomicIndicatorsJob economicIndicators,
        InsiderTradesJob insiderTrades,
        FinancialNewsJob financialNews
    ) {
        return buildRegistry(properties, definitions(marketQuotes, economicIndicators, insiderTrades, financialNews));
    }

    static JobRegistry buildRegistry(PipelineProperties properties, List<JobDefinition> definitions) {
        JobRegistry registry = new JobRegistry();
        for (JobDefinition definition : definitions) {
            PipelineProperties.JobSettings settings = properties.job(definition.name());
            if (!settings.isEnabled()) {
                log.info("Job {} disabled by configuration", definition.name());
                continue;
            }
            Duration cadence = settings.getCadence() == null ? definition.defaultCadence() : settings.getCadence();
            registry.register(definition.name(), cadence, definition.handler());
            log.info("Registered job {} cadence={}", definition.name(), cadence);
        }
        registry.seal();
        return registry;
    }
}
