package com.ethnicthv.entitystore.core;

public class UnknownNetworkIdException extends EntityStoreException {
    private final int networkId;

    public UnknownNetworkIdException(int networkId) {
        super("No component type is registered with network id " + networkId);
        this.networkId = networkId;
    }

    public int getNetworkId() {
        return networkId;
    }
}
