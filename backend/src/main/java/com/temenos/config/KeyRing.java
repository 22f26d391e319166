package com.temenos.config;

import com.temenos.crypto.KeyGate;
import com.temenos.crypto.VaultKey;
import com.temenos.error.ConfigException;

/**
 * Holds the two process-wide secrets. Each one is validated on first use and the outcome,
 * a usable key or the reason it is unusable, is kept for every later request.
 * A missing key therefore fails requests, not startup.
 */
public class KeyRing {

    public static final String AT_REST = "at-rest";
    public static final String TRANSPORT = "transport";

    private final ResolvedKey atRest;
    private final ResolvedKey transport;

    public KeyRing(String atRestKey, String transportKey) {
        this.atRest = new ResolvedKey(AT_REST, atRestKey);
        this.transport = new ResolvedKey(TRANSPORT, transportKey);
    }

    public VaultKey atRestKey() {
        return atRest.get();
    }

    public VaultKey transportKey() {
        return transport.get();
    }

    private static final class ResolvedKey {

        private final String label;
        private String raw;
        private VaultKey key;
        private String failure;

        ResolvedKey(String label, String raw) {
            this.label = label;
            this.raw = raw;
        }

        synchronized VaultKey get() {
            if (key == null && failure == null) {
                try {
                    key = KeyGate.require(label, raw);
                } catch (ConfigException e) {
                    failure = e.getMessage();
                }
                raw = null;
            }
            if (failure != null) {
                throw new ConfigException(failure);
            }
            return key;
        }
    }
}
