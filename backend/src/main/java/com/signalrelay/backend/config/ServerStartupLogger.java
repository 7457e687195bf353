package com.signalrelay.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final TradingProperties tradingProperties;
    private final OandaProperties oandaProperties;
    private final RelayProperties relayProperties;
    private final NotificationProperties notificationProperties;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        log.info("Signal gateway listening on port {} (trading {}, dry run {}, forward oanda={} duplikium={}, discord {})",
                event.getWebServer().getPort(),
                tradingProperties.isEnabled() ? "enabled" : "DISABLED",
                tradingProperties.isDryRun(),
                oandaProperties.isForward(),
                relayProperties.isForward(),
                notificationProperties.isActive() ? "on" : "off");
        if (!oandaProperties.hasCredentials()) {
            log.warn("OANDA credentials missing; balance reads will use the fallback balance");
        }
    }
}
