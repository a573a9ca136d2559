package io.stagerelay.capability;

public interface Capability {
    String kind();

    CapabilityResult invoke(CapabilityRequest request) throws Exception;
}
