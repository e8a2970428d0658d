package com.hyperdesk.vmrequest.domain;

import java.util.Locale;

/** Fixed size categories a user can request. */
public enum VmSize {
    S(2, 4, 50),
    M(4, 8, 100),
    L(8, 16, 200),
    XL(16, 32, 500);

    private final int cpuCores;
    private final int memoryGb;
    private final int diskGb;

    VmSize(int cpuCores, int memoryGb, int diskGb) {
        this.cpuCores = cpuCores;
        this.memoryGb = memoryGb;
        this.diskGb = diskGb;
    }

    public int cpuCores() {
        return cpuCores;
    }

    public int memoryGb() {
        return memoryGb;
    }

    public int diskGb() {
        return diskGb;
    }

    /**
     * Parses a size code, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException for an unknown code
     */
    public static VmSize fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Size code must not be null");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (VmSize size : values()) {
            if (size.name().equals(normalized)) {
                return size;
            }
        }
        throw new IllegalArgumentException("Unknown VM size: '" + code + "'");
    }
}
