package com.ciro.gatemux.spring;

import com.ciro.gatemux.bridge.TerminalPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "gatemux")
public class GatemuxProperties {

    private final Gateway gateway = new Gateway();
    private final Bridge bridge = new Bridge();

    /** Token compartido para /api y /ws; vacío = sin control de acceso */
    private String accessToken = "";
    /** Comando por defecto de las terminales */
    private List<String> terminalShell = new ArrayList<>(List.of("/bin/zsh"));
    /** Sesiones sin actividad se cierran después de esto */
    private Duration sessionIdleTimeout = Duration.ofMinutes(30);
    private int maxSessions = 256;
    /** Requests de terminal-input por IP y minuto */
    private int inputRateLimit = 60;
    /** Conectar al gateway al arrancar el contexto */
    private boolean autoStart = true;

    public Gateway getGateway() { return gateway; }
    public Bridge getBridge() { return bridge; }

    public String getAccessToken() { return accessToken; }
    public void setAccessToken(String accessToken) { this.accessToken = accessToken; }

    public List<String> getTerminalShell() { return terminalShell; }
    public void setTerminalShell(List<String> terminalShell) { this.terminalShell = terminalShell; }

    public Duration getSessionIdleTimeout() { return sessionIdleTimeout; }
    public void setSessionIdleTimeout(Duration sessionIdleTimeout) { this.sessionIdleTimeout = sessionIdleTimeout; }

    public int getMaxSessions() { return maxSessions; }
    public void setMaxSessions(int maxSessions) { this.maxSessions = maxSessions; }

    public int getInputRateLimit() { return inputRateLimit; }
    public void setInputRateLimit(int inputRateLimit) { this.inputRateLimit = inputRateLimit; }

    public boolean isAutoStart() { return autoStart; }
    public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }

    public static class Gateway {
        private String url = "ws://127.0.0.1:18789";
        private String token = "";
        private String password = "";

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }

    public static class Bridge {
        private Duration keepAlive = Duration.ofSeconds(15);
        private int maxPending = 256;
        private TerminalPolicy terminalPolicy = TerminalPolicy.KEEP;

        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }

        public int getMaxPending() { return maxPending; }
        public void setMaxPending(int maxPending) { this.maxPending = maxPending; }

        public TerminalPolicy getTerminalPolicy() { return terminalPolicy; }
        public void setTerminalPolicy(TerminalPolicy terminalPolicy) { this.terminalPolicy = terminalPolicy; }
    }
}
