package com.temenos.crypto;

public enum EncryptionVersion {

    LEGACY(1),
    CURRENT(2);

    private final int number;

    EncryptionVersion(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    /** Index flags written before versioning existed are absent; those records are legacy. */
    public static EncryptionVersion fromFlag(Integer flag) {
        return flag != null && flag == CURRENT.number ? CURRENT : LEGACY;
    }
}
