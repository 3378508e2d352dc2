package com.ciro.gatemux.spring;

import com.ciro.gatemux.Gatemux;
import com.ciro.gatemux.bridge.BridgeSettings;
import com.ciro.gatemux.connection.GatewayEndpoint;
import com.ciro.gatemux.spi.AccessPolicy;
import com.ciro.gatemux.web.RateLimiter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Duration;

@AutoConfiguration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableConfigurationProperties(GatemuxProperties.class)
@Import({GatemuxWebSocketConfig.class, GatemuxWebMvcConfig.class})
public class GatemuxAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Gatemux gatemux(GatemuxProperties props) {
        GatemuxProperties.Gateway gw = props.getGateway();
        GatemuxProperties.Bridge br = props.getBridge();

        BridgeSettings bridge = BridgeSettings.defaults()
                .withKeepAlive(br.getKeepAlive())
                .withMaxPending(br.getMaxPending())
                .withTerminalPolicy(br.getTerminalPolicy())
                .withDefaultCommand(props.getTerminalShell());

        return Gatemux.builder()
                .endpoint(GatewayEndpoint.of(gw.getUrl(), gw.getToken(), gw.getPassword()))
                .bridgeSettings(bridge)
                .idleTimeout(props.getSessionIdleTimeout())
                .maxSessions(props.getMaxSessions())
                .build();
    }

    @Bean
    public GatemuxLifecycle gatemuxLifecycle(Gatemux gatemux, GatemuxProperties props) {
        return new GatemuxLifecycle(gatemux, props.isAutoStart());
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessPolicy gatemuxAccessPolicy(GatemuxProperties props) {
        return AccessPolicy.sharedToken(props.getAccessToken());
    }

    @Bean
    public GatemuxBridgeController gatemuxBridgeController(Gatemux gatemux, GatemuxProperties props) {
        return new GatemuxBridgeController(gatemux,
                new RateLimiter(props.getInputRateLimit(), Duration.ofMinutes(1)));
    }

    @Bean
    public TerminalSocketHandler terminalSocketHandler(Gatemux gatemux) {
        return new TerminalSocketHandler(gatemux.bridge(), gatemux.mapper());
    }
}
