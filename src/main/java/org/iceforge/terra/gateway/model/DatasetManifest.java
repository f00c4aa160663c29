package org.iceforge.terra.gateway.model;

import java.util.List;

public class DatasetManifest {
    private List<DatasetDescriptor> files = List.of();

    public List<DatasetDescriptor> getFiles() {
        return files;
    }

    public void setFiles(List<DatasetDescriptor> files) {
        this.files = files == null ? List.of() : files;
    }
}
