package com.example.estimations.config;

import com.example.estimations.handler.GameWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Mounts the game socket. Allowed origins come from a comma-separated property. */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private static final List<String> LOOPBACK_HOSTS = List.of("localhost", "127.0.0.1");

  private final GameWebSocketHandler handler;
  private final String socketPath;
  private final String[] originPatterns;

  public WebSocketConfig(
      GameWebSocketHandler handler,
      @Value("${app.websocket.path:/gameSocket}") String socketPath,
      @Value("${app.websocket.allowed-origins:http://localhost:8080}") String allowedOrigins
  ) {
    this.handler = handler;
    this.socketPath = socketPath;
    this.originPatterns = originPatterns(allowedOrigins);
  }

  /**
   * Turns the configured origins into Spring origin patterns. A loopback origin admits every
   * loopback host and port of the same scheme; an empty list admits everything.
   */
  static String[] originPatterns(String csv) {
    Set<String> patterns = new LinkedHashSet<>();
    for (String raw : (csv == null ? "" : csv).split(",")) {
      String origin = raw.trim();
      if (origin.isEmpty()) continue;
      if ("*".equals(origin)) return new String[] {"*"};
      patterns.add(origin);

      int sep = origin.indexOf("://");
      if (sep < 0) continue;
      String scheme = origin.substring(0, sep).toLowerCase(Locale.ROOT);
      String host = origin.substring(sep + 3).replaceFirst(":.*$", "").toLowerCase(Locale.ROOT);
      if (LOOPBACK_HOSTS.contains(host)) {
        for (String h : LOOPBACK_HOSTS) patterns.add(scheme + "://" + h + ":*");
      }
    }
    return patterns.isEmpty() ? new String[] {"*"} : patterns.toArray(String[]::new);
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    registry.addHandler(handler, socketPath)
            .setAllowedOriginPatterns(originPatterns);
  }
}
