package net.slotwatch.bootstrap.props;

import net.slotwatch.adapter.http.UpstreamHttpSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("slotwatch")
public class SlotwatchProperties {
    private String zone = "UTC";
    private Supervisor supervisor = new Supervisor();
    private Worker worker = new Worker();
    private Booking booking = new Booking();
    private RateLimiter rateLimiter = new RateLimiter();
    private Startup startup = new Startup();
    private Upstream upstream = new Upstream();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Supervisor getSupervisor() {
        return supervisor;
    }

    public void setSupervisor(Supervisor supervisor) {
        this.supervisor = supervisor;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Booking getBooking() {
        return booking;
    }

    public void setBooking(Booking booking) {
        this.booking = booking;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public void setRateLimiter(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    public Startup getStartup() {
        return startup;
    }

    public void setStartup(Startup startup) {
        this.startup = startup;
    }

    public Upstream getUpstream() {
        return upstream;
    }

    public void setUpstream(Upstream upstream) {
        this.upstream = upstream;
    }

    public static class Supervisor {
        private boolean enabled = true;
        private long reconcileDelayMs = 30000; // @Scheduled 가 직접 읽는다
        private Duration failureBackoff = Duration.ofSeconds(60);
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getReconcileDelayMs() {
            return reconcileDelayMs;
        }

        public void setReconcileDelayMs(long reconcileDelayMs) {
            this.reconcileDelayMs = reconcileDelayMs;
        }

        public Duration getFailureBackoff() {
            return failureBackoff;
        }

        public void setFailureBackoff(Duration failureBackoff) {
            this.failureBackoff = failureBackoff;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static class Worker {
        private Duration pollInterval = Duration.ofSeconds(12);
        private Duration rateLimitPause = Duration.ofSeconds(120);
        private Duration errorPause = Duration.ofSeconds(5);

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getRateLimitPause() {
            return rateLimitPause;
        }

        public void setRateLimitPause(Duration rateLimitPause) {
            this.rateLimitPause = rateLimitPause;
        }

        public Duration getErrorPause() {
            return errorPause;
        }

        public void setErrorPause(Duration errorPause) {
            this.errorPause = errorPause;
        }
    }

    public static class Booking {
        private int maxAttempts = 3;
        private Duration retryDelay = Duration.ofSeconds(3);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }
    }

    public static class RateLimiter {
        private Duration minInterval = Duration.ofSeconds(10);

        public Duration getMinInterval() {
            return minInterval;
        }

        public void setMinInterval(Duration minInterval) {
            this.minInterval = minInterval;
        }
    }

    public static class Startup {
        private boolean sweepEnabled = true;

        public boolean isSweepEnabled() {
            return sweepEnabled;
        }

        public void setSweepEnabled(boolean sweepEnabled) {
            this.sweepEnabled = sweepEnabled;
        }
    }

    public static class Upstream {
        private boolean enabled = true;
        private String suppliesUrl = UpstreamHttpSettings.DEFAULT_SUPPLIES_URL;
        private String marketplaceUrl = UpstreamHttpSettings.DEFAULT_MARKETPLACE_URL;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSuppliesUrl() {
            return suppliesUrl;
        }

        public void setSuppliesUrl(String suppliesUrl) {
            this.suppliesUrl = suppliesUrl;
        }

        public String getMarketplaceUrl() {
            return marketplaceUrl;
        }

        public void setMarketplaceUrl(String marketplaceUrl) {
            this.marketplaceUrl = marketplaceUrl;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public UpstreamHttpSettings toSettings() {
            return new UpstreamHttpSettings(suppliesUrl, marketplaceUrl, connectTimeout, requestTimeout);
        }
    }
}
