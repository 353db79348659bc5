package com.yaml2sbml.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Converter settings.
 *
 * <p>Loaded from {@code yaml2sbml.yaml}. Every section is optional; missing values
 * fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * compartment:
 *   id: Compartment
 *   size: 1
 *
 * units:
 *   default: dimensionless
 *
 * observables:
 *   prefix: observable_
 *
 * eventsPolicy: WARN
 * }</pre>
 *
 * @param compartment default compartment settings
 * @param units unit settings
 * @param observables observable settings
 * @param eventsPolicy what to do with an events block
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConverterConfig(
    @JsonProperty("compartment") CompartmentSettings compartment,
    @JsonProperty("units") UnitSettings units,
    @JsonProperty("observables") ObservableSettings observables,
    @JsonProperty("eventsPolicy") UnsupportedBlockPolicy eventsPolicy
) {
    /**
     * Compact constructor filling in defaults for absent sections.
     */
    public ConverterConfig {
        if (compartment == null) {
            compartment = CompartmentSettings.defaults();
        }
        if (units == null) {
            units = UnitSettings.defaults();
        }
        if (observables == null) {
            observables = ObservableSettings.defaults();
        }
        if (eventsPolicy == null) {
            eventsPolicy = UnsupportedBlockPolicy.WARN;
        }
    }

    /**
     * Creates the default configuration: compartment {@code Compartment} of size 1,
     * unit {@code dimensionless}, observable prefix {@code observable_}, events warn.
     *
     * @return default configuration
     */
    public static ConverterConfig defaults() {
        return new ConverterConfig(null, null, null, null);
    }

    /**
     * What to do with a block whose semantics the converter does not support.
     */
    public enum UnsupportedBlockPolicy {
        /** Report a warning diagnostic and contribute nothing */
        WARN,
        /** Abort the conversion with a schema error */
        FAIL
    }

    /**
     * Default compartment.
     *
     * @param id compartment identifier
     * @param size compartment size
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CompartmentSettings(
        @JsonProperty("id") String id,
        @JsonProperty("size") Double size
    ) {
        public CompartmentSettings {
            if (id == null || id.isBlank()) {
                id = "Compartment";
            }
            if (size == null) {
                size = 1.0;
            }
        }

        public static CompartmentSettings defaults() {
            return new CompartmentSettings(null, null);
        }
    }

    /**
     * Units. Only a single default unit is supported.
     *
     * @param defaultUnit unit attached to parameters and species
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UnitSettings(
        @JsonProperty("default") String defaultUnit
    ) {
        public UnitSettings {
            if (defaultUnit == null || defaultUnit.isBlank()) {
                defaultUnit = "dimensionless";
            }
        }

        public static UnitSettings defaults() {
            return new UnitSettings(null);
        }
    }

    /**
     * Observables.
     *
     * @param prefix prepended to an observable id to form its parameter id
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ObservableSettings(
        @JsonProperty("prefix") String prefix
    ) {
        public ObservableSettings {
            if (prefix == null) {
                prefix = "observable_";
            }
        }

        public static ObservableSettings defaults() {
            return new ObservableSettings(null);
        }
    }
}
