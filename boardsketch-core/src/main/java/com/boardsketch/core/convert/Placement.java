package com.boardsketch.core.convert;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One renderable primitive of a {@link PlacementPlan}: a shape or a connector.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ShapePlacement.class, name = "shape"),
    @JsonSubTypes.Type(value = ConnectorPlacement.class, name = "connector")
})
public interface Placement {
}
