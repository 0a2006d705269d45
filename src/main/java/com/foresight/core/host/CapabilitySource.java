package com.foresight.core.host;

import java.util.List;

/**
 * Supplies capabilities discovered at runtime rather than registered as beans.
 */
public interface CapabilitySource {

    String name();

    List<Capability> capabilities();
}
