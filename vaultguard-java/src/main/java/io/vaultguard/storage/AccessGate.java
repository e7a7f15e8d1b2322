package io.vaultguard.storage;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Switch that disables storage access while the vault is locked down.
 * Locked state persists until {@link #unlock()} is called explicitly.
 */
public class AccessGate {

    private static final Logger logger = Logger.getLogger(AccessGate.class.getName());

    private final AtomicReference<Lockdown> lockdown = new AtomicReference<>();

    /**
     * Lock the gate. Locking an already locked gate keeps the original reason.
     * @return true if this call locked the gate
     */
    public boolean lock(String reason) {
        boolean locked = lockdown.compareAndSet(null, new Lockdown(reason, Instant.now()));
        if (locked) {
            logger.warning("Storage access locked: " + reason);
        }
        return locked;
    }

    /**
     * @return true if the gate was locked
     */
    public boolean unlock() {
        Lockdown previous = lockdown.getAndSet(null);
        if (previous != null) {
            logger.info("Storage access restored after lockdown since " + previous.since());
        }
        return previous != null;
    }

    public boolean isLocked() {
        return lockdown.get() != null;
    }

    public Optional<Lockdown> current() {
        return Optional.ofNullable(lockdown.get());
    }

    public record Lockdown(String reason, Instant since) {}
}
