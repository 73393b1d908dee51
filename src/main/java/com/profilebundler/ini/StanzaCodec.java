package com.profilebundler.ini;

import com.profilebundler.models.ForeignSection;
import com.profilebundler.models.Profile;
import com.profilebundler.models.ProfileDocument;
import com.profilebundler.models.ProfileType;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Parses and renders the slicer's stanza dialect.
 *
 * Parsing keeps every original line of a stanza so comments survive a rewrite;
 * rendering always alphabetizes properties and separates stanzas with a single
 * blank line. Headers of privatized (asterisk-wrapped) profiles are written
 * without a space after the colon, e.g. {@code [print:*Base*]}.
 */
public class StanzaCodec {

    public static final String INI_EXTENSION = ".ini";

    private final ProfileType defaultType;

    public StanzaCodec(ProfileType defaultType) {
        if (defaultType == null) {
            throw new IllegalArgumentException("Default profile type is required");
        }
        this.defaultType = defaultType;
    }

    public ProfileType getDefaultType() {
        return defaultType;
    }

    /**
     * File base name without the {@code .ini} extension; names the implicit default profile.
     */
    public static String defaultName(Path file) {
        String fileName = file.getFileName().toString();
        if (fileName.toLowerCase().endsWith(INI_EXTENSION)) {
            return fileName.substring(0, fileName.length() - INI_EXTENSION.length());
        }
        return fileName;
    }

    // -------------------------------------------------------------------------
    // Parsing
    // -------------------------------------------------------------------------

    public ProfileDocument parse(String text, Path sourceFile) {
        return parse(text, sourceFile, defaultName(sourceFile));
    }

    /**
     * Parses file content into a document.
     *
     * @param text        full file content
     * @param sourceFile  file the content came from (recorded on every profile)
     * @param defaultName name given to content that appears before any stanza header
     */
    public ProfileDocument parse(String text, Path sourceFile, String defaultName) {
        ProfileDocument document = new ProfileDocument(sourceFile);

        Profile preamble = new Profile(sourceFile, defaultType, defaultType.qualify(defaultName));
        preamble.setImplicit(true);

        Profile current = null;
        String foreignHeader = null;
        List<String> foreignLines = null;
        boolean preambleFlushed = false;

        for (String line : splitLines(text)) {
            String clean = IniLines.stripComment(line).trim();

            Matcher profileHeader = IniLines.PROFILE_HEADER.matcher(clean);
            Matcher anyHeader = IniLines.ANY_HEADER.matcher(clean);
            if (profileHeader.matches() || anyHeader.matches()) {
                // Content before the first header is not a profile of its own; its comments stay with that header
                List<String> carried = new ArrayList<>();
                if (!preambleFlushed) {
                    carried.addAll(commentLines(preamble));
                    preambleFlushed = true;
                }
                flushProfile(document, current);
                flushForeign(document, foreignHeader, foreignLines);
                current = null;
                foreignHeader = null;
                foreignLines = null;

                if (profileHeader.matches()) {
                    ProfileType type = ProfileType.fromKeyword(profileHeader.group(1));
                    current = new Profile(sourceFile, type, type.qualify(profileHeader.group(2).trim()));
                    current.getRawLines().add(line);
                    current.getRawLines().addAll(carried);
                } else {
                    foreignHeader = anyHeader.group(1).trim();
                    foreignLines = new ArrayList<>(carried);
                    foreignLines.add(line);
                }
                continue;
            }

            if (foreignLines != null) {
                foreignLines.add(line);
                continue;
            }

            Profile target = current != null ? current : preamble;
            Matcher property = IniLines.PROPERTY.matcher(clean);
            if (property.matches()) {
                target.putProperty(property.group(1).trim(), property.group(2).trim());
            }
            target.getRawLines().add(line);
        }

        if (!preambleFlushed && hasContent(preamble)) {
            document.addProfile(preamble);
        }
        flushProfile(document, current);
        flushForeign(document, foreignHeader, foreignLines);

        if (document.getProfiles().isEmpty() && document.getForeignSections().isEmpty()) {
            Profile empty = new Profile(sourceFile, defaultType, defaultType.qualify(defaultName));
            empty.setImplicit(true);
            document.addProfile(empty);
        }
        return document;
    }

    private void flushProfile(ProfileDocument document, Profile profile) {
        if (profile != null) {
            document.addProfile(profile);
        }
    }

    private void flushForeign(ProfileDocument document, String header, List<String> lines) {
        if (header != null) {
            document.addForeignSection(new ForeignSection(header, lines));
        }
    }

    private boolean hasContent(Profile profile) {
        return !profile.getProperties().isEmpty() || !commentLines(profile).isEmpty();
    }

    private static List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\\R", -1)));
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    /**
     * Comment lines a rewrite keeps for this profile: original lines that carry a
     * {@code #} and are neither properties, headers nor blank.
     */
    public static List<String> commentLines(Profile profile) {
        List<String> comments = new ArrayList<>();
        for (String line : profile.getRawLines()) {
            if (line.indexOf('#') < 0) {
                continue;
            }
            String clean = IniLines.stripComment(line).trim();
            if (clean.isEmpty()) {
                if (!line.trim().isEmpty()) {
                    comments.add(line);
                }
            } else if (!IniLines.isPropertyLine(clean) && !IniLines.isHeaderLine(clean)) {
                comments.add(line);
            }
        }
        return comments;
    }

    // -------------------------------------------------------------------------
    // Rendering
    // -------------------------------------------------------------------------

    /**
     * Renders a document: {@code [vendor]} first, then profiles in order, then
     * any other foreign sections.
     */
    public String render(ProfileDocument document) {
        List<List<String>> blocks = new ArrayList<>();

        for (ForeignSection section : document.getForeignSections()) {
            if (section.isVendor()) {
                blocks.add(trimTrailingBlanks(section.getLines()));
            }
        }

        boolean headerless = document.getProfiles().size() == 1
            && document.getProfiles().get(0).isImplicit()
            && document.getForeignSections().isEmpty();

        for (Profile profile : document.getProfiles()) {
            blocks.add(renderProfile(profile, !headerless));
        }

        for (ForeignSection section : document.getForeignSections()) {
            if (!section.isVendor()) {
                blocks.add(trimTrailingBlanks(section.getLines()));
            }
        }

        StringBuilder out = new StringBuilder();
        for (List<String> block : blocks) {
            if (block.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append('\n');
            }
            for (String line : block) {
                out.append(line).append('\n');
            }
        }
        return out.toString();
    }

    public List<String> renderProfile(Profile profile, boolean withHeader) {
        List<String> lines = new ArrayList<>();
        if (withHeader) {
            lines.add(header(profile.getName()));
        }
        lines.addAll(commentLines(profile));
        profile.getProperties().forEach((key, value) -> lines.add(key + " = " + value));
        return lines;
    }

    /**
     * Stanza header for a qualified name; privatized names lose the space after the colon.
     */
    public static String header(String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        if (colon < 0) {
            return "[" + qualifiedName + "]";
        }
        String type = qualifiedName.substring(0, colon).trim();
        String display = qualifiedName.substring(colon + 1).trim();
        if (display.contains("*")) {
            return "[" + type + ":" + display + "]";
        }
        return "[" + type + ": " + display + "]";
    }

    /**
     * The fixed {@code [vendor]} stanza that opens a newly created bundle file.
     */
    public static ForeignSection vendorStanza(String bundleName, String repoId, String configVersion) {
        List<String> lines = new ArrayList<>();
        lines.add("[vendor]");
        lines.add("repo_id = " + repoId);
        lines.add("# Vendor name will be shown by the Config Wizard.");
        lines.add("name = " + bundleName);
        lines.add("# Configuration version of this file. Config file will only be installed, if the config_version differs.");
        lines.add("# This means, the server may force the PrusaSlicer configuration to be downgraded.");
        lines.add("config_version = " + configVersion);
        return new ForeignSection(ForeignSection.VENDOR, lines);
    }

    private static List<String> trimTrailingBlanks(List<String> lines) {
        List<String> trimmed = new ArrayList<>(lines);
        while (!trimmed.isEmpty() && IniLines.isBlank(trimmed.get(trimmed.size() - 1))) {
            trimmed.remove(trimmed.size() - 1);
        }
        return trimmed;
    }
}
