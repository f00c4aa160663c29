package org.iceforge.terra.gateway.model;

public class ColumnDef {
    private String name;
    private String type; // engine type name, e.g. VARCHAR, DOUBLE
    private String description;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
