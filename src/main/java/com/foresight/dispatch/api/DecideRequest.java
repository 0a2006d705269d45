package com.foresight.dispatch.api;

import java.util.List;

/**
 * Request body for POST /api/v1/actions/decide.
 */
public record DecideRequest(List<Item> decisions) {

    public record Item(String actionId, String decision) {}
}
