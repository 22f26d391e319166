package com.temenos.store;

import java.util.Arrays;

import com.temenos.error.InvalidRequestException;

/** The record kinds sharing the store contract, with their directory names and id prefixes. */
public enum EntityClass {

    CONVERSATIONS("conversations", "conv"),
    NARRATIVES("narratives", "narrative"),
    SYSTEM_PROMPTS("system-prompts", "prompt"),
    CONTEXTS("contexts", "context"),
    IMAGES("images", "img");

    private final String pathName;
    private final String idPrefix;

    EntityClass(String pathName, String idPrefix) {
        this.pathName = pathName;
        this.idPrefix = idPrefix;
    }

    public String pathName() {
        return pathName;
    }

    public String idPrefix() {
        return idPrefix;
    }

    public static EntityClass fromPathName(String pathName) {
        return Arrays.stream(values())
                .filter(c -> c.pathName.equals(pathName))
                .findFirst()
                .orElseThrow(() -> new InvalidRequestException("Unknown entity class: " + pathName));
    }
}
