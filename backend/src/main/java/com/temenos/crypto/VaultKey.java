package com.temenos.crypto;

import java.util.Arrays;

import javax.crypto.spec.SecretKeySpec;

/**
 * A 256-bit key that has already passed {@link KeyGate}.
 * Instances only come from {@link KeyGate#require(String, String)}.
 */
public final class VaultKey {

    private final String label;
    private final byte[] material;

    VaultKey(String label, byte[] material) {
        this.label = label;
        this.material = material.clone();
    }

    public String label() {
        return label;
    }

    SecretKeySpec aesKey() {
        return new SecretKeySpec(material, "AES");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VaultKey other)) return false;
        return Arrays.equals(material, other.material);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(material);
    }

    @Override
    public String toString() {
        return "VaultKey[" + label + ", redacted]";
    }
}
