package org.iceforge.terra.gateway.model;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class DatasetSemantics {

    private static final Pattern YEAR_RANGE = Pattern.compile("^\\s*(\\d{4})\\s*-\\s*(\\d{4})\\s*$");

    private List<String> units = List.of("tonnes CO2");
    private String source;
    private String spatialResolution;
    private String temporalResolution;

    /**
     * Inclusive year range, e.g. "2000-2023".
     */
    private String temporalCoverage;

    public List<String> getUnits() {
        return units;
    }

    public void setUnits(List<String> units) {
        this.units = units;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getSpatialResolution() {
        return spatialResolution;
    }

    public void setSpatialResolution(String spatialResolution) {
        this.spatialResolution = spatialResolution;
    }

    public String getTemporalResolution() {
        return temporalResolution;
    }

    public void setTemporalResolution(String temporalResolution) {
        this.temporalResolution = temporalResolution;
    }

    public String getTemporalCoverage() {
        return temporalCoverage;
    }

    public void setTemporalCoverage(String temporalCoverage) {
        this.temporalCoverage = temporalCoverage;
    }

    /**
     * @return {@code [start, end]} when the coverage string is a well-formed year range
     */
    public Optional<int[]> coverageYears() {
        if (temporalCoverage == null) {
            return Optional.empty();
        }
        Matcher m = YEAR_RANGE.matcher(temporalCoverage);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new int[]{Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))});
    }
}
