package com.eventfeed.feed.service;

import com.eventfeed.config.FeedProperties;
import com.eventfeed.feed.model.EnrichmentStats;
import com.eventfeed.feed.model.FeedRunRequest;
import com.eventfeed.feed.model.FeedRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class FeedCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(FeedCliRunner.class);

    private final FeedProperties properties;
    private final EventFeedService eventFeedService;
    private final ConfigurableApplicationContext applicationContext;

    public FeedCliRunner(
        FeedProperties properties,
        EventFeedService eventFeedService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.eventFeedService = eventFeedService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        FeedProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        FeedRunRequest request = new FeedRunRequest(
            cli.getIcsUrl(),
            cli.getOutput(),
            cli.getConfig(),
            cli.isPrintOnly(),
            cli.getLimit(),
            EventFeedService.enrichmentOptions(properties.getEnrichment())
        );

        FeedRunSummary summary = eventFeedService.generate(request);
        log.info(
            "Feed run completed: entries={}, written={}, output={}, titlesFilled={}",
            summary.calendarEntries(),
            summary.recordsWritten(),
            summary.outputPath() == null ? "stdout" : summary.outputPath(),
            summary.titlesFilled()
        );
        for (EnrichmentStats stats : summary.enrichmentStats()) {
            log.info("Summary {}: {}", stats.kind().field(), stats);
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
