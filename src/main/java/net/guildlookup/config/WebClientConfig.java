package net.guildlookup.config;

import io.netty.channel.ChannelOption;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient shared by the Battle.net token and guild profile clients.
 * Guild and token bodies are a few KB, so the default codec buffer is kept.
 */
@Configuration
public class WebClientConfig {

    private static final String USER_AGENT = "guild-lookup/0.1 (+https://github.com/guild-lookup)";
    private static final int CONNECT_TIMEOUT_MILLIS = 2000;

    /**
     * The Netty response timeout matches {@code battlenet.api.request-timeout}; the clients
     * apply the same bound per call, so this only catches connections the clients stop
     * waiting on.
     */
    @Bean
    public WebClient.Builder webClientBuilder(BattleNetApiProperties properties) {
        Duration responseTimeout = properties.getRequestTimeout();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
            .responseTimeout(responseTimeout);

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
