package com.maestro.ensemblespec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Performer record as declared: guid, schedule/backoff (ms), optional autoScale and controlAware, source. */
public final class PerformerDefinition {

    private final String guid;
    private final Integer schedule;
    private final Integer backoff;
    private final Integer autoScale;
    private final Boolean controlAware;
    private final SourceDefinition source;

    @JsonCreator
    public PerformerDefinition(
            @JsonProperty("guid") String guid,
            @JsonProperty("schedule") Integer schedule,
            @JsonProperty("backoff") Integer backoff,
            @JsonProperty("autoScale") Integer autoScale,
            @JsonProperty("controlAware") Boolean controlAware,
            @JsonProperty("source") SourceDefinition source) {
        this.guid = guid;
        this.schedule = schedule;
        this.backoff = backoff;
        this.autoScale = autoScale;
        this.controlAware = controlAware;
        this.source = source;
    }

    public String getGuid() {
        return guid;
    }

    /** Tick period in milliseconds; 0 = no tick. */
    public Integer getSchedule() {
        return schedule;
    }

    /** Performer-internal backoff in milliseconds. */
    public Integer getBackoff() {
        return backoff;
    }

    /** Pool upper bound; null when absent (no pooling). */
    public Integer getAutoScale() {
        return autoScale;
    }

    /** Control-priority flag; null when absent. */
    public Boolean getControlAware() {
        return controlAware;
    }

    public SourceDefinition getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PerformerDefinition that = (PerformerDefinition) o;
        return Objects.equals(guid, that.guid) && Objects.equals(schedule, that.schedule)
                && Objects.equals(backoff, that.backoff) && Objects.equals(autoScale, that.autoScale)
                && Objects.equals(controlAware, that.controlAware) && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(guid, schedule, backoff, autoScale, controlAware, source);
    }
}
