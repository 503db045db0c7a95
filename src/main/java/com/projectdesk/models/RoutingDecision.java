package com.projectdesk.models;

import java.util.List;

/**
 * Route chosen for one request, with the mentions that justified it.
 */
public record RoutingDecision(Route route,
                              List<ResolvedMention> inputs,
                              List<ResolvedMention> guidelines,
                              List<ResolvedMention> outputs) {

    public RoutingDecision {
        inputs = List.copyOf(inputs);
        guidelines = List.copyOf(guidelines);
        outputs = List.copyOf(outputs);
    }

    public boolean isStructured() {
        return route == Route.STRUCTURED;
    }
}
