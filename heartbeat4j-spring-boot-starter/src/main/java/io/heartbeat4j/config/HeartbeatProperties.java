package io.heartbeat4j.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the heartbeat scheduler, worker pool and notification dispatcher.
 */
@ConfigurationProperties(prefix = "heartbeat4j")
public class HeartbeatProperties {
    private boolean enabled = true;
    private String timezone; // null = system default
    private int cronThreads = 2;
    private boolean ensureIndexesOnStartup = false;

    private final Worker worker = new Worker();
    private final Heartbeat heartbeat = new Heartbeat();
    private final Briefing briefing = new Briefing();
    private final Notify notify = new Notify();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public int getCronThreads() {
        return cronThreads;
    }

    public void setCronThreads(int cronThreads) {
        this.cronThreads = cronThreads;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Worker getWorker() {
        return worker;
    }

    public Heartbeat getHeartbeat() {
        return heartbeat;
    }

    public Briefing getBriefing() {
        return briefing;
    }

    public Notify getNotify() {
        return notify;
    }

    public static class Worker {
        private int workers = 4;
        private int queueCapacity = 100;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    public static class Heartbeat {
        private boolean enabled = true;
        private String cron = "*/5 * * * *";
        private Duration cycleTimeout = Duration.ofMinutes(2);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public Duration getCycleTimeout() {
            return cycleTimeout;
        }

        public void setCycleTimeout(Duration cycleTimeout) {
            this.cycleTimeout = cycleTimeout;
        }
    }

    public static class Briefing {
        private boolean enabled = true;
        private String cron = "30 6 * * *";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }
    }

    public static class Notify {
        private Duration cooldown = Duration.ofMinutes(30);
        private Duration sendTimeout = Duration.ofSeconds(15);
        private String quietStart = "23:00"; // HH:mm, local to timezone
        private String quietEnd = "07:00";

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }

        public String getQuietStart() {
            return quietStart;
        }

        public void setQuietStart(String quietStart) {
            this.quietStart = quietStart;
        }

        public String getQuietEnd() {
            return quietEnd;
        }

        public void setQuietEnd(String quietEnd) {
            this.quietEnd = quietEnd;
        }
    }
}
