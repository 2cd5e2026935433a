package org.courtside.rotation.scheduler;

/**
 * How often two participants have shared a team or faced each other.
 */
public record PairingHistory(int teammates, int opponents) {

    public static final PairingHistory NONE = new PairingHistory(0, 0);
}
