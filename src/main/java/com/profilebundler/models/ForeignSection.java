package com.profilebundler.models;

import java.util.ArrayList;
import java.util.List;

/**
 * A stanza the engine does not interpret (for example {@code [vendor]} or
 * {@code [printer_model:...]}). Kept verbatim so rewrites do not lose it.
 */
public class ForeignSection {

    public static final String VENDOR = "vendor";

    private final String header;
    private final List<String> lines;

    public ForeignSection(String header, List<String> lines) {
        this.header = header;
        this.lines = lines != null ? new ArrayList<>(lines) : new ArrayList<>();
    }

    /**
     * Section name without brackets, e.g. {@code vendor}.
     */
    public String getHeader() {
        return header;
    }

    /**
     * Original lines including the header line.
     */
    public List<String> getLines() {
        return lines;
    }

    public boolean isVendor() {
        return VENDOR.equalsIgnoreCase(header.trim());
    }
}
