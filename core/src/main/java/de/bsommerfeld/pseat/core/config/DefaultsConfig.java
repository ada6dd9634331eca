package de.bsommerfeld.pseat.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Policy used for channels that have never been configured. These values are
 * only handed out, never written to the store.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DefaultsConfig {

    @JsonProperty("event-expectancy")
    private double eventExpectancy = 0.0;

    @JsonProperty("event-duration")
    private long eventDuration = 24;

    @JsonProperty("event-cooldown")
    private double eventCooldown = 5.0;

    @JsonProperty("max-offenses")
    private long maxOffenses = 3;

    @JsonProperty("timeout-duration")
    private long timeoutDuration = 300;

    @JsonProperty("prefixes")
    private String prefixes = "";

    public double getEventExpectancy() {
        return eventExpectancy;
    }

    public void setEventExpectancy(double eventExpectancy) {
        this.eventExpectancy = eventExpectancy;
    }

    public long getEventDuration() {
        return eventDuration;
    }

    public void setEventDuration(long eventDuration) {
        this.eventDuration = eventDuration;
    }

    public double getEventCooldown() {
        return eventCooldown;
    }

    public void setEventCooldown(double eventCooldown) {
        this.eventCooldown = eventCooldown;
    }

    public long getMaxOffenses() {
        return maxOffenses;
    }

    public void setMaxOffenses(long maxOffenses) {
        this.maxOffenses = maxOffenses;
    }

    public long getTimeoutDuration() {
        return timeoutDuration;
    }

    public void setTimeoutDuration(long timeoutDuration) {
        this.timeoutDuration = timeoutDuration;
    }

    public String getPrefixes() {
        return prefixes;
    }

    public void setPrefixes(String prefixes) {
        this.prefixes = prefixes;
    }
}
