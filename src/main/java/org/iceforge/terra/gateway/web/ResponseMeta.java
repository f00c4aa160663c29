package org.iceforge.terra.gateway.web;

import org.iceforge.terra.gateway.model.DatasetDescriptor;
import org.iceforge.terra.gateway.model.DatasetSemantics;

import java.util.List;

/**
 * Provenance attached to every result so the caller can cite units and source.
 *
 * @param warnings non-fatal findings, e.g. years outside the dataset's coverage; null when none
 */
public record ResponseMeta(List<String> units, String source, String spatialResolution,
                           String temporalResolution, String tableId, List<String> warnings) {

    public static ResponseMeta of(DatasetDescriptor d, List<String> warnings) {
        DatasetSemantics s = d.getSemantics();
        return new ResponseMeta(s.getUnits(), s.getSource(), s.getSpatialResolution(), s.getTemporalResolution(),
                d.getFileId(), warnings == null || warnings.isEmpty() ? null : List.copyOf(warnings));
    }
}
