package com.tomopipe.normalize;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-preserving model of an IMOD/SerialEM {@code .mdoc} sidecar.
 *
 * <p>Every physical line is kept with its original terminator. Entries ({@code Key = Value}) and
 * section headers ({@code [ZValue = 3]}) are recognised so single values can be replaced; every
 * other byte is written back untouched. Content is decoded as ISO-8859-1 so that arbitrary bytes
 * survive a parse/serialize cycle unchanged.</p>
 */
public final class MdocDocument {
    public static final String TILT_AXIS_KEY = "TiltAxisAngle";

    private static final Pattern LINE_PATTERN = Pattern.compile("[^\\r\\n]*(?:\\r\\n|\\n|\\r)?");
    private static final Pattern ENTRY_PATTERN = Pattern.compile("^(\\s*)([A-Za-z_][A-Za-z0-9_]*)(\\s*=\\s*)(.*)$");
    private static final Pattern SECTION_PATTERN = Pattern.compile("^\\s*\\[\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*(.*?)\\s*]\\s*$");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    private final Path source;
    private final List<Line> lines;

    private MdocDocument(Path source, List<Line> lines) {
        this.source = source;
        this.lines = lines;
    }

    public static MdocDocument read(Path path) throws IOException, MetadataParseException {
        return parse(path, new String(Files.readAllBytes(path), StandardCharsets.ISO_8859_1));
    }

    public static MdocDocument parse(Path source, String content) throws MetadataParseException {
        List<Line> lines = new ArrayList<>();
        Matcher matcher = LINE_PATTERN.matcher(content);
        int lineNumber = 0;
        while (matcher.find()) {
            String raw = matcher.group();
            if (raw.isEmpty()) {
                break;
            }
            lineNumber++;
            lines.add(parseLine(source, lineNumber, raw));
        }
        return new MdocDocument(source, lines);
    }

    private static Line parseLine(Path source, int lineNumber, String raw) throws MetadataParseException {
        int bodyEnd = raw.length();
        while (bodyEnd > 0 && (raw.charAt(bodyEnd - 1) == '\n' || raw.charAt(bodyEnd - 1) == '\r')) {
            bodyEnd--;
        }
        String body = raw.substring(0, bodyEnd);
        String terminator = raw.substring(bodyEnd);

        String trimmed = body.strip();
        if (trimmed.startsWith("[")) {
            Matcher section = SECTION_PATTERN.matcher(body);
            if (!section.matches()) {
                throw new MetadataParseException(source, "Malformed section header at line " + lineNumber + ": " + trimmed);
            }
            return new Line(body, terminator, section.group(1), section.group(2), null, true);
        }

        Matcher entry = ENTRY_PATTERN.matcher(body);
        if (entry.matches()) {
            return new Line(body, terminator, entry.group(2), entry.group(4), entry.group(1) + entry.group(2) + entry.group(3), false);
        }
        return new Line(body, terminator, null, null, null, false);
    }

    public Path source() {
        return source;
    }

    public Optional<String> firstValue(String key) {
        return lines.stream()
                .filter(line -> !line.section && key.equals(line.key))
                .map(Line::value)
                .findFirst();
    }

    public List<String> values(String key) {
        List<String> values = new ArrayList<>();
        for (Line line : lines) {
            if (!line.section && key.equals(line.key)) {
                values.add(line.value());
            }
        }
        return values;
    }

    /**
     * Replaces the first number in the value of every {@code key} entry.
     *
     * @return number of entries changed
     */
    public int replaceNumericValue(String key, String replacement) throws MetadataParseException {
        int changed = 0;
        for (int i = 0; i < lines.size(); i++) {
            Line line = lines.get(i);
            if (line.section || !key.equals(line.key)) {
                continue;
            }
            Matcher number = NUMBER_PATTERN.matcher(line.value);
            if (!number.find()) {
                throw new MetadataParseException(source, "No numeric value for " + key + ": '" + line.value + "'");
            }
            String value = line.value.substring(0, number.start()) + replacement + line.value.substring(number.end());
            if (!value.equals(line.value)) {
                lines.set(i, new Line(line.prefix + value, line.terminator, line.key, value, line.prefix, false));
                changed++;
            }
        }
        return changed;
    }

    public List<Map<String, String>> sections() {
        List<Map<String, String>> sections = new ArrayList<>();
        Map<String, String> current = null;
        for (Line line : lines) {
            if (line.section) {
                current = new LinkedHashMap<>();
                current.put(line.key, line.value);
                sections.add(current);
            } else if (current != null && line.key != null) {
                current.putIfAbsent(line.key, line.value);
            }
        }
        return sections;
    }

    /**
     * Frames referenced by {@code ZValue} sections, ordered by tilt angle rather than acquisition order.
     */
    public List<FrameReference> framesByTiltAngle() throws MetadataParseException {
        List<FrameReference> frames = new ArrayList<>();
        for (Map<String, String> section : sections()) {
            if (!section.containsKey("ZValue")) {
                continue;
            }
            String framePath = section.get("SubFramePath");
            String angle = section.get("TiltAngle");
            if (framePath == null || framePath.isBlank()) {
                continue;
            }
            frames.add(new FrameReference(
                    parseInt(section.get("ZValue")),
                    angle == null ? 0.0 : parseDouble("TiltAngle", angle),
                    fileName(framePath)));
        }
        frames.sort(Comparator.comparingDouble(FrameReference::tiltAngle).thenComparingInt(FrameReference::zValue));
        return frames;
    }

    public String serialize() {
        StringBuilder builder = new StringBuilder();
        for (Line line : lines) {
            builder.append(line.body).append(line.terminator);
        }
        return builder.toString();
    }

    public void write(Path target) throws IOException {
        Path temp = target.resolveSibling("." + target.getFileName() + ".tmp");
        Files.write(temp, serialize().getBytes(StandardCharsets.ISO_8859_1));
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    double parseDouble(String key, String value) throws MetadataParseException {
        Matcher number = NUMBER_PATTERN.matcher(value);
        if (!number.find()) {
            throw new MetadataParseException(source, "No numeric value for " + key + ": '" + value + "'");
        }
        return Double.parseDouble(number.group());
    }

    private int parseInt(String value) throws MetadataParseException {
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new MetadataParseException(source, "Invalid ZValue '" + value + "'", e);
        }
    }

    // SerialEM on Windows records backslash paths
    static String fileName(String recordedPath) {
        String normalized = recordedPath.strip().replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    private record Line(String body, String terminator, String key, String value, String prefix, boolean section) {
    }
}
